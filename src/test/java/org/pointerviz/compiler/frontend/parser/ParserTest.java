package org.pointerviz.compiler.frontend.parser;

import org.pointerviz.compiler.diagnostics.Diagnostic;
import org.pointerviz.compiler.diagnostics.DiagnosticsEngine;
import org.pointerviz.compiler.frontend.lexer.Lexer;
import org.pointerviz.compiler.frontend.parser.ast.AddressOfExpression;
import org.pointerviz.compiler.frontend.parser.ast.DeclarationNode;
import org.pointerviz.compiler.frontend.parser.ast.DereferenceExpression;
import org.pointerviz.compiler.frontend.parser.ast.IdentifierExpression;
import org.pointerviz.compiler.frontend.parser.ast.LiteralExpression;
import org.pointerviz.compiler.frontend.parser.ast.NullPointerExpression;
import org.pointerviz.compiler.frontend.parser.ast.PointerDeclarationNode;
import org.pointerviz.compiler.frontend.parser.ast.ReferenceDeclarationNode;
import org.pointerviz.compiler.frontend.parser.ast.VariableDeclarationNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the declaration parser, including statement termination and error recovery.
 */
public class ParserTest {

    private DiagnosticsEngine diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
    }

    private List<DeclarationNode> parse(String source) {
        diagnostics.setSource("test", source);
        return new Parser(new Lexer(source, diagnostics).scanTokens(), diagnostics).parse();
    }

    @Test
    @Tag("unit")
    void parsesVariableDeclaration() {
        List<DeclarationNode> nodes = parse("const double pi = 3.14;");

        assertThat(nodes).hasSize(1);
        VariableDeclarationNode variable = (VariableDeclarationNode) nodes.get(0);
        assertThat(variable.leadingConst()).isTrue();
        assertThat(variable.type().text()).isEqualTo("double");
        assertThat(variable.name().text()).isEqualTo("pi");
        assertThat(variable.initializer()).isInstanceOf(LiteralExpression.class);
    }

    @Test
    @Tag("unit")
    void parsesMultiLevelPointerWithConstAfterStar() {
        List<DeclarationNode> nodes = parse("int** const pp = &p;");

        PointerDeclarationNode pointer = (PointerDeclarationNode) nodes.get(0);
        assertThat(pointer.starCount()).isEqualTo(2);
        assertThat(pointer.constAfterStar()).isTrue();
        assertThat(pointer.leadingConst()).isFalse();
        assertThat(pointer.initializer()).isInstanceOf(AddressOfExpression.class);
        assertThat(((AddressOfExpression) pointer.initializer()).name()).isEqualTo("p");
    }

    @Test
    @Tag("unit")
    void parsesReferenceForms() {
        List<DeclarationNode> nodes = parse("""
                int &r = a
                const int &cr = a
                int* &rp = p
                int &d = *p
                """);

        assertThat(nodes).hasSize(4).allMatch(node -> node instanceof ReferenceDeclarationNode);
        ReferenceDeclarationNode constRef = (ReferenceDeclarationNode) nodes.get(1);
        assertThat(constRef.leadingConst()).isTrue();
        assertThat(((ReferenceDeclarationNode) nodes.get(2)).starCount()).isEqualTo(1);
        assertThat(nodes.get(0).initializer()).isInstanceOf(IdentifierExpression.class);
        assertThat(nodes.get(3).initializer()).isInstanceOf(DereferenceExpression.class);
    }

    @Test
    @Tag("unit")
    void acceptsNullKeywordsAsInitializer() {
        List<DeclarationNode> nodes = parse("int *a = nullptr; int *b = NULL;");

        assertThat(nodes).extracting(DeclarationNode::initializer)
                .allMatch(init -> init instanceof NullPointerExpression);
    }

    @Test
    @Tag("unit")
    void statementsEndAtSemicolonOrLineBreak() {
        List<DeclarationNode> nodes = parse("int a = 1; int b = 2\nint c = 3\n\n;;\nint d = 4;");

        assertThat(nodes).extracting(node -> node.name().text()).containsExactly("a", "b", "c", "d");
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    @Tag("unit")
    void reportsMalformedStatementAndContinues() {
        List<DeclarationNode> nodes = parse("int a = 1;\nint b 2;\nint *p = &a;");

        assertThat(nodes).extracting(node -> node.name().text()).containsExactly("a", "p");
        assertThat(diagnostics.getErrors()).hasSize(1);
        Diagnostic error = diagnostics.getErrors().get(0);
        assertThat(error.line()).isEqualTo(2);
        assertThat(error.snippet()).isEqualTo("int b 2;");
        assertThat(error.message()).startsWith("Expected '=' after 'b'.").endsWith("Found '2'.");
    }

    @Test
    @Tag("unit")
    void reportsEveryMalformedStatement() {
        parse("= 5;\nint x =;\nint *q = &;");

        assertThat(diagnostics.getErrors()).extracting(Diagnostic::line).containsExactly(1, 2, 3);
    }

    @Test
    @Tag("unit")
    void reportsMissingTerminator() {
        List<DeclarationNode> nodes = parse("int a = 1 int b = 2;");

        assertThat(nodes).isEmpty();
        assertThat(diagnostics.getErrors()).hasSize(1);
        assertThat(diagnostics.getErrors().get(0).message()).contains("Expected ';' or end of line");
    }

    @Test
    @Tag("unit")
    void continuesStatementAcrossLineBreaks() {
        List<DeclarationNode> nodes = parse("int *p =\n    &a;\nconst int\n    *cp = &a;");

        assertThat(nodes).hasSize(2);
        PointerDeclarationNode p = (PointerDeclarationNode) nodes.get(0);
        assertThat(p.name().text()).isEqualTo("p");
        assertThat(p.initializer()).isInstanceOf(AddressOfExpression.class);
        PointerDeclarationNode cp = (PointerDeclarationNode) nodes.get(1);
        assertThat(cp.leadingConst()).isTrue();
        assertThat(cp.name().text()).isEqualTo("cp");
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    @Tag("unit")
    void unfinishedLineDoesNotSwallowNextStatement() {
        List<DeclarationNode> nodes = parse("int x\nint y = 2;");

        assertThat(nodes).hasSize(1);
        assertThat(((VariableDeclarationNode) nodes.get(0)).name().text()).isEqualTo("y");
        assertThat(diagnostics.getErrors()).hasSize(1);
        Diagnostic error = diagnostics.getErrors().get(0);
        assertThat(error.line()).isEqualTo(1);
        assertThat(error.message()).endsWith("Found end of line.");
    }

    @Test
    @Tag("unit")
    void lexerErrorsAreReportedOnce() {
        List<DeclarationNode> nodes = parse("int big = 99999999999999999999;\nchar *s = \"open\nint b = 2;");

        assertThat(diagnostics.getErrors()).extracting(Diagnostic::message)
                .containsExactly("Integer literal out of range: 99999999999999999999", "Unterminated string literal.");
        assertThat(nodes).hasSize(1);
        assertThat(((VariableDeclarationNode) nodes.get(0)).name().text()).isEqualTo("b");
    }

    @Test
    @Tag("unit")
    void emptyInputYieldsNoDeclarations() {
        assertThat(parse("  // nothing here\n")).isEmpty();
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }
}
