package org.pointerviz.compiler.frontend.parser.ast;

import org.pointerviz.compiler.frontend.lexer.Token;

/**
 * A bare identifier, e.g. the {@code a} in {@code int &r = a;}.
 *
 * @param identifier The identifier token.
 */
public record IdentifierExpression(Token identifier) implements ExpressionNode {

    public String name() {
        return identifier.text();
    }

    @Override
    public Token firstToken() {
        return identifier;
    }

    @Override
    public String text() {
        return identifier.text();
    }
}
