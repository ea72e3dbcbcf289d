package org.pointerviz.compiler.frontend.parser.ast;

import org.pointerviz.compiler.frontend.lexer.Token;

/**
 * {@code nullptr} or {@code NULL}. The literal {@code 0} stays a {@link LiteralExpression}
 * and is only treated as null in pointer context.
 *
 * @param keyword The keyword token.
 */
public record NullPointerExpression(Token keyword) implements ExpressionNode {

    @Override
    public Token firstToken() {
        return keyword;
    }

    @Override
    public String text() {
        return keyword.text();
    }
}
