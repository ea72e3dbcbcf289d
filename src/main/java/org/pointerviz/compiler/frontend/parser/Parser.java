package org.pointerviz.compiler.frontend.parser;

import org.pointerviz.compiler.diagnostics.DiagnosticsEngine;
import org.pointerviz.compiler.frontend.lexer.Token;
import org.pointerviz.compiler.frontend.lexer.TokenType;
import org.pointerviz.compiler.frontend.parser.ast.AddressOfExpression;
import org.pointerviz.compiler.frontend.parser.ast.DeclarationNode;
import org.pointerviz.compiler.frontend.parser.ast.DereferenceExpression;
import org.pointerviz.compiler.frontend.parser.ast.ExpressionNode;
import org.pointerviz.compiler.frontend.parser.ast.IdentifierExpression;
import org.pointerviz.compiler.frontend.parser.ast.LiteralExpression;
import org.pointerviz.compiler.frontend.parser.ast.NullPointerExpression;
import org.pointerviz.compiler.frontend.parser.ast.PointerDeclarationNode;
import org.pointerviz.compiler.frontend.parser.ast.ReferenceDeclarationNode;
import org.pointerviz.compiler.frontend.parser.ast.VariableDeclarationNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the declaration language:
 * <pre>
 * declaration   := variableDecl | pointerDecl | referenceDecl
 * variableDecl  := "const"? type IDENT "=" expr
 * pointerDecl   := "const"? type pointerSpec+ IDENT "=" expr
 * pointerSpec   := "*" "const"?
 * referenceDecl := "const"? type pointerSpec* "&amp;" "const"? IDENT "=" expr
 * expr          := IDENT | number | float | string | "&amp;" IDENT | "*" IDENT | "nullptr" | "NULL" | "0"
 * </pre>
 * A statement ends at {@code ;}, or at a line break once its initializer is complete. Inside an unfinished
 * statement a line break is crossed when the token after it is one the statement expects, so
 * {@code int *p =} followed by {@code &a;} on the next line is one declaration. A statement that matches none of the shapes is reported once and skipped
 * up to the next terminator, so one run reports every malformed statement. Tokens the lexer already reported
 * as {@link TokenType#INVALID} never produce a second error.
 */
public class Parser {

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private int current = 0;
    private boolean insideStatement = false;

    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses all statements.
     *
     * @return the well-formed declarations in source order.
     */
    public List<DeclarationNode> parse() {
        List<DeclarationNode> declarations = new ArrayList<>();
        while (!isAtEnd()) {
            // blank statements
            if (match(TokenType.NEWLINE, TokenType.SEMICOLON)) {
                continue;
            }
            DeclarationNode declaration = statement();
            if (declaration != null) {
                declarations.add(declaration);
            } else {
                synchronize();
            }
        }
        return declarations;
    }

    private DeclarationNode statement() {
        insideStatement = true;
        try {
            return declaration();
        } finally {
            insideStatement = false;
        }
    }

    private DeclarationNode declaration() {
        boolean leadingConst = match(TokenType.CONST);
        Token type = consume(TokenType.IDENTIFIER,
                leadingConst ? "Expected a type name after 'const'." : "Expected a declaration starting with a type name.");
        if (type == null) return null;

        int stars = 0;
        boolean constAfterStar = false;
        while (match(TokenType.STAR)) {
            stars++;
            if (match(TokenType.CONST)) {
                constAfterStar = true;
            }
        }

        if (match(TokenType.AMPERSAND)) {
            // a qualifier after '&' cannot change a reference's binding
            match(TokenType.CONST);
            Token name = consume(TokenType.IDENTIFIER, "Expected a reference name after '&'.");
            ExpressionNode initializer = name == null ? null : initializer(name);
            if (initializer == null || !terminator()) return null;
            return new ReferenceDeclarationNode(leadingConst, type, stars, name, initializer);
        }

        Token name = consume(TokenType.IDENTIFIER,
                stars > 0 ? "Expected a pointer name after '*'." : "Expected a variable name after type '" + type.text() + "'.");
        ExpressionNode initializer = name == null ? null : initializer(name);
        if (initializer == null || !terminator()) return null;

        if (stars > 0) {
            return new PointerDeclarationNode(leadingConst, type, stars, constAfterStar, name, initializer);
        }
        return new VariableDeclarationNode(leadingConst, type, name, initializer);
    }

    private ExpressionNode initializer(Token name) {
        if (consume(TokenType.EQUALS, "Expected '=' after '" + name.text() + "'.") == null) {
            return null;
        }
        return expression();
    }

    private ExpressionNode expression() {
        if (match(TokenType.AMPERSAND)) {
            Token ampersand = previous();
            Token identifier = consume(TokenType.IDENTIFIER, "Expected an identifier after '&'.");
            return identifier == null ? null : new AddressOfExpression(ampersand, identifier);
        }
        if (match(TokenType.STAR)) {
            Token star = previous();
            Token identifier = consume(TokenType.IDENTIFIER, "Expected an identifier after '*'.");
            return identifier == null ? null : new DereferenceExpression(star, identifier);
        }
        if (match(TokenType.NULLPTR)) {
            return new NullPointerExpression(previous());
        }
        if (match(TokenType.IDENTIFIER)) {
            return new IdentifierExpression(previous());
        }
        if (match(TokenType.NUMBER, TokenType.FLOAT, TokenType.STRING)) {
            return new LiteralExpression(previous());
        }
        error(peek(), "Expected an initializer expression.");
        return null;
    }

    private boolean terminator() {
        // a line break may end the statement from here on
        insideStatement = false;
        if (match(TokenType.SEMICOLON) || check(TokenType.NEWLINE) || isAtEnd()) {
            return true;
        }
        error(peek(), "Expected ';' or end of line after declaration.");
        return false;
    }

    /**
     * Skips the rest of a malformed statement.
     */
    private void synchronize() {
        while (!isAtEnd()) {
            Token token = advance();
            if (token.is(TokenType.SEMICOLON) || token.is(TokenType.NEWLINE)) {
                return;
            }
        }
    }

    private void error(Token token, String message) {
        if (token.is(TokenType.INVALID)) {
            return;
        }
        String found = switch (token.type()) {
            case END_OF_FILE -> "end of input";
            case NEWLINE -> "end of line";
            default -> "'" + token.text() + "'";
        };
        diagnostics.reportError(message + " Found " + found + ".", token.line(), token.column());
    }

    // --- token cursor ---

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    /**
     * Inside a statement, looks past line breaks and moves onto the token found there only if it matches.
     */
    private boolean check(TokenType type) {
        int next = current;
        if (insideStatement) {
            while (tokens.get(next).is(TokenType.NEWLINE)) next++;
        }
        Token token = tokens.get(next);
        if (token.is(TokenType.END_OF_FILE)) return type == TokenType.END_OF_FILE;
        if (token.type() != type) return false;
        current = next;
        return true;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(Math.max(0, current - 1));
    }

    private Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        error(peek(), errorMessage);
        return null;
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }
}
