package org.pointerviz.compiler.frontend.parser.ast;

import org.pointerviz.compiler.frontend.lexer.Token;

/**
 * {@code &name}: takes the address of a previously declared object.
 *
 * @param ampersand  The {@code &} token.
 * @param identifier The operand.
 */
public record AddressOfExpression(Token ampersand, Token identifier) implements ExpressionNode {

    public String name() {
        return identifier.text();
    }

    @Override
    public Token firstToken() {
        return ampersand;
    }

    @Override
    public String text() {
        return "&" + identifier.text();
    }
}
