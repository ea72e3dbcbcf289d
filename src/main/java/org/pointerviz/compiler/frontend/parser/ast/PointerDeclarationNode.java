package org.pointerviz.compiler.frontend.parser.ast;

import org.pointerviz.compiler.frontend.lexer.Token;

/**
 * {@code [const] type *[const]... name = expr}.
 *
 * @param leadingConst  A {@code const} before the base type: the pointee is const.
 * @param type          The base type token.
 * @param starCount     Number of {@code *}, at least 1.
 * @param constAfterStar A {@code const} after any {@code *}: the pointer itself is const.
 * @param name          The name token.
 * @param initializer   The initializer.
 */
public record PointerDeclarationNode(
        boolean leadingConst,
        Token type,
        int starCount,
        boolean constAfterStar,
        Token name,
        ExpressionNode initializer
) implements DeclarationNode {
}
