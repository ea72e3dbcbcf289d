package org.pointerviz.compiler.frontend.parser.ast;

import org.pointerviz.compiler.frontend.lexer.Token;

/**
 * {@code [const] type *... & [const] name = expr}.
 *
 * @param leadingConst A {@code const} before the base type: the referent is accessed as const.
 * @param type         The base type token.
 * @param starCount    Number of {@code *} before the {@code &}, e.g. 1 for a reference to a pointer.
 * @param name         The name token.
 * @param initializer  The initializer.
 */
public record ReferenceDeclarationNode(
        boolean leadingConst,
        Token type,
        int starCount,
        Token name,
        ExpressionNode initializer
) implements DeclarationNode {
}
