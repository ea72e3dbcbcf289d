package org.pointerviz.compiler.frontend.parser.ast;

import org.pointerviz.compiler.frontend.lexer.Token;

/**
 * One parsed declaration statement.
 */
public sealed interface DeclarationNode
        permits VariableDeclarationNode, PointerDeclarationNode, ReferenceDeclarationNode {

    /** The declared identifier. */
    Token name();

    /** The base type name. */
    Token type();

    /** The initializer. */
    ExpressionNode initializer();

    /** Whether {@code const} precedes the base type. */
    boolean leadingConst();

    default int line() {
        return type().line();
    }
}
