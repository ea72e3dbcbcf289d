package org.pointerviz.compiler.frontend.lexer;

/**
 * A lexical token.
 *
 * @param type   The token kind.
 * @param text   The exact source text of the token.
 * @param value  The literal value for {@link TokenType#NUMBER} ({@link Integer} or {@link Long}),
 *               {@link TokenType#FLOAT} ({@link Double}) and {@link TokenType#STRING} (de-quoted);
 *               {@code null} otherwise.
 * @param line   1-based line of the first character.
 * @param column 1-based column of the first character.
 */
public record Token(TokenType type, String text, Object value, int line, int column) {

    public boolean is(TokenType other) {
        return type == other;
    }

    @Override
    public String toString() {
        return type + "('" + text + "')@" + line + ":" + column;
    }
}
