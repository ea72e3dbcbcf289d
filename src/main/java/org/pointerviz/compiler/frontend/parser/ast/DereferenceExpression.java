package org.pointerviz.compiler.frontend.parser.ast;

import org.pointerviz.compiler.frontend.lexer.Token;

/**
 * {@code *name}: follows one level of indirection of a previously declared object.
 *
 * @param star       The {@code *} token.
 * @param identifier The operand.
 */
public record DereferenceExpression(Token star, Token identifier) implements ExpressionNode {

    public String name() {
        return identifier.text();
    }

    @Override
    public Token firstToken() {
        return star;
    }

    @Override
    public String text() {
        return "*" + identifier.text();
    }
}
