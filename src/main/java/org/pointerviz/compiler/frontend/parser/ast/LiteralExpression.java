package org.pointerviz.compiler.frontend.parser.ast;

import org.pointerviz.compiler.frontend.lexer.Token;
import org.pointerviz.compiler.frontend.lexer.TokenType;

/**
 * An integer, floating point or string literal.
 *
 * @param literal The literal token; its {@link Token#value()} holds the parsed value.
 */
public record LiteralExpression(Token literal) implements ExpressionNode {

    public Object value() {
        return literal.value();
    }

    /**
     * @return true for the integer literal {@code 0}, which doubles as a null pointer constant.
     */
    public boolean isZero() {
        return literal.type() == TokenType.NUMBER && "0".equals(literal.text());
    }

    @Override
    public Token firstToken() {
        return literal;
    }

    @Override
    public String text() {
        return literal.text();
    }
}
