package org.pointerviz.compiler.frontend.lexer;

import org.pointerviz.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns declaration source text into a token stream.
 * <p>
 * Line comments ({@code //}) and block comments are dropped. Line breaks are kept as
 * {@link TokenType#NEWLINE} tokens because a line break may end a statement. Unknown characters,
 * unterminated string literals and out-of-range integers are reported to the {@link DiagnosticsEngine}
 * and kept as {@link TokenType#INVALID} tokens so the parser does not report them again.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "const", TokenType.CONST,
            "nullptr", TokenType.NULLPTR,
            "NULL", TokenType.NULLPTR
    );

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;

    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this.source = source;
        this.diagnostics = diagnostics;
    }

    /**
     * Scans the whole source.
     *
     * @return the tokens, always terminated by a single {@link TokenType#END_OF_FILE} token.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, current - lineStart + 1));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ', '\t', '\f' -> { }
            case '\r' -> {
                match('\n');
                newLine();
            }
            case '\n' -> newLine();
            case '*' -> addToken(TokenType.STAR);
            case '&' -> addToken(TokenType.AMPERSAND);
            case '=' -> addToken(TokenType.EQUALS);
            case ';' -> addToken(TokenType.SEMICOLON);
            case '"', '\'' -> string(c);
            case '/' -> {
                if (match('/')) {
                    while (peek() != '\n' && peek() != '\r' && !isAtEnd()) advance();
                } else if (match('*')) {
                    blockComment();
                } else {
                    unexpected(c);
                }
            }
            case '-', '+' -> {
                if (isDigit(peek())) {
                    number();
                } else {
                    unexpected(c);
                }
            }
            default -> {
                if (isDigit(c)) {
                    number();
                } else if (c == '.' && isDigit(peek())) {
                    number();
                } else if (isIdentifierStart(c)) {
                    identifier();
                } else {
                    unexpected(c);
                }
            }
        }
    }

    private void newLine() {
        tokens.add(new Token(TokenType.NEWLINE, "\n", null, line, start - lineStart + 1));
        line++;
        lineStart = current;
    }

    private void blockComment() {
        int startLine = line;
        int startColumn = start - lineStart + 1;
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            char c = advance();
            if (c == '\n' || (c == '\r' && peek() != '\n')) {
                line++;
                lineStart = current;
            }
        }
        diagnostics.reportError("Unterminated block comment.", startLine, startColumn);
    }

    private void string(char quote) {
        int startColumn = start - lineStart + 1;
        StringBuilder value = new StringBuilder();
        while (peek() != quote && !isAtEnd() && peek() != '\n' && peek() != '\r') {
            char c = advance();
            if (c == '\\' && !isAtEnd() && peek() != '\n' && peek() != '\r') {
                value.append(unescape(advance()));
            } else {
                value.append(c);
            }
        }
        if (peek() != quote) {
            diagnostics.reportError("Unterminated string literal.", line, startColumn);
            addToken(TokenType.INVALID);
            return;
        }
        advance(); // closing quote
        addToken(TokenType.STRING, value.toString());
    }

    private static char unescape(char c) {
        return switch (c) {
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            case '0' -> '\0';
            default -> c;
        };
    }

    private void number() {
        while (isDigit(peek())) advance();
        boolean isFloat = source.charAt(start) == '.';
        if (peek() == '.' && isDigit(peekNext())) {
            isFloat = true;
            advance();
            while (isDigit(peek())) advance();
        }
        if ((peek() == 'e' || peek() == 'E')
                && (isDigit(peekNext()) || ((peekNext() == '+' || peekNext() == '-') && isDigit(peekAt(2))))) {
            isFloat = true;
            advance();
            if (peek() == '+' || peek() == '-') advance();
            while (isDigit(peek())) advance();
        }
        String text = source.substring(start, current);
        if (isFloat) {
            // C++ float suffix, e.g. 2.5f
            if (peek() == 'f' || peek() == 'F') advance();
            addToken(TokenType.FLOAT, Double.parseDouble(text));
            return;
        }
        String digits = text.startsWith("+") ? text.substring(1) : text;
        try {
            addToken(TokenType.NUMBER, Integer.parseInt(digits));
        } catch (NumberFormatException e) {
            try {
                addToken(TokenType.NUMBER, Long.parseLong(digits));
            } catch (NumberFormatException tooLarge) {
                diagnostics.reportError("Integer literal out of range: " + text, line, start - lineStart + 1);
                addToken(TokenType.INVALID);
            }
        }
    }

    private void identifier() {
        while (isIdentifierPart(peek())) advance();
        String text = source.substring(start, current);
        addToken(KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER));
    }

    private void unexpected(char c) {
        diagnostics.reportError("Unexpected character '" + c + "'.", line, start - lineStart + 1);
        addToken(TokenType.INVALID);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object value) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, value, line, start - lineStart + 1));
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char advance() {
        return source.charAt(current++);
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        int index = current + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
