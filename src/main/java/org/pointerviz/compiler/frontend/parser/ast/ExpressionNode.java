package org.pointerviz.compiler.frontend.parser.ast;

import org.pointerviz.compiler.frontend.lexer.Token;

/**
 * The right-hand side of a declaration.
 */
public sealed interface ExpressionNode
        permits IdentifierExpression, LiteralExpression, AddressOfExpression, DereferenceExpression,
        NullPointerExpression {

    /**
     * @return the first token of the expression, for source positions.
     */
    Token firstToken();

    /**
     * @return the expression as written, e.g. {@code &a} or {@code "text"}.
     */
    String text();
}
