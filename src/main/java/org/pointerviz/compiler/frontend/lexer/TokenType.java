package org.pointerviz.compiler.frontend.lexer;

/**
 * Token kinds of the declaration language.
 */
public enum TokenType {
    // Literals and names
    IDENTIFIER,
    NUMBER,
    FLOAT,
    STRING,

    // Keywords
    CONST,
    NULLPTR,

    // Punctuation
    STAR,
    AMPERSAND,
    EQUALS,
    SEMICOLON,

    NEWLINE,
    // Text the lexer rejected and already reported
    INVALID,
    END_OF_FILE
}
