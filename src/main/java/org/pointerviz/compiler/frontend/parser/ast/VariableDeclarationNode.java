package org.pointerviz.compiler.frontend.parser.ast;

import org.pointerviz.compiler.frontend.lexer.Token;

/**
 * {@code [const] type name = expr}.
 *
 * @param leadingConst Whether the variable is const.
 * @param type         The type token.
 * @param name         The name token.
 * @param initializer  The initializer.
 */
public record VariableDeclarationNode(
        boolean leadingConst,
        Token type,
        Token name,
        ExpressionNode initializer
) implements DeclarationNode {
}
