package org.pointerviz.compiler.resolver;

import org.pointerviz.compiler.diagnostics.Diagnostic;
import org.pointerviz.model.MemoryGraph;
import org.pointerviz.model.MemoryObject;
import org.pointerviz.model.ObjectKind;
import org.pointerviz.model.Pointer;
import org.pointerviz.model.Reference;
import org.pointerviz.model.Variable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the resolution of declaration programs into memory graphs.
 */
public class DeclarationResolverTest {

    private DeclarationResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new DeclarationResolver();
    }

    private MemoryGraph resolveClean(String source) {
        ResolutionResult result = resolver.resolve(source);
        assertThat(result.diagnostics()).as("diagnostics of %s", source).isEmpty();
        return result.graph();
    }

    private MemoryObject object(MemoryGraph graph, String name) {
        return graph.findByName(name).orElseThrow();
    }

    @Test
    @Tag("unit")
    @DisplayName("Variable, pointer and reference to the same variable")
    void resolvesBasicProgram() {
        MemoryGraph graph = resolveClean("int a = 42; int *p = &a; int &ref = a;");

        assertThat(graph.size()).isEqualTo(3);
        MemoryObject a = object(graph, "a");
        assertThat(a).isInstanceOf(Variable.class);
        assertThat(a.value()).contains(42);
        assertThat(object(graph, "p").pointsTo()).contains(a.address());
        MemoryObject ref = object(graph, "ref");
        assertThat(ref.kind()).isEqualTo(ObjectKind.REFERENCE);
        assertThat(ref.pointsTo()).contains(a.address());
        assertThat(ref.value()).contains(42);
    }

    @Test
    @Tag("unit")
    @DisplayName("Chain of pointers tracks indirection levels and targets")
    void resolvesPointerChain() {
        MemoryGraph graph = resolveClean("int value = 100; int *p1 = &value; int **p2 = &p1; int ***p3 = &p2;");

        Pointer p1 = (Pointer) object(graph, "p1");
        Pointer p2 = (Pointer) object(graph, "p2");
        Pointer p3 = (Pointer) object(graph, "p3");
        assertThat(p1.indirectionLevel()).isEqualTo(1);
        assertThat(p2.indirectionLevel()).isEqualTo(2);
        assertThat(p3.indirectionLevel()).isEqualTo(3);
        assertThat(p3.pointsTo()).contains(p2.address());
        assertThat(p2.pointsTo()).contains(p1.address());
        assertThat(p1.pointsTo()).contains(object(graph, "value").address());
        assertThat(graph.isDeclarationOrdered()).isTrue();
    }

    @Test
    @Tag("unit")
    @DisplayName("nullptr, NULL and 0 all produce the null sentinel")
    void resolvesNullPointers() {
        MemoryGraph graph = resolveClean("int *a = nullptr; int *b = NULL; int *c = 0;");

        assertThat(graph.objects()).allSatisfy(object -> {
            assertThat(object.pointsTo()).contains(MemoryGraph.NULL_SENTINEL);
            assertThat(((Pointer) object).isNull()).isTrue();
        });
        assertThat(graph.edges()).isEmpty();
    }

    @Test
    @Tag("unit")
    void zeroInitializedVariableIsAnInteger() {
        MemoryGraph graph = resolveClean("int n = 0;");

        assertThat(object(graph, "n").value()).contains(0);
    }

    @Test
    @Tag("unit")
    @DisplayName("Leading const qualifies the value, const after '*' the pointer")
    void resolvesConstQualifiers() {
        MemoryGraph graph = resolveClean("""
                int val = 1;
                const int *cp = &val;
                int* const pc = &val;
                const int* const cpc = &val;
                """);

        Pointer cp = (Pointer) object(graph, "cp");
        assertThat(cp.isValueConst()).isTrue();
        assertThat(cp.isPointerConst()).isFalse();
        Pointer pc = (Pointer) object(graph, "pc");
        assertThat(pc.isValueConst()).isFalse();
        assertThat(pc.isPointerConst()).isTrue();
        Pointer cpc = (Pointer) object(graph, "cpc");
        assertThat(cpc.isValueConst()).isTrue();
        assertThat(cpc.isPointerConst()).isTrue();
        assertThat(cpc.typeDescription()).isEqualTo("const int* const");
    }

    @Test
    @Tag("unit")
    @DisplayName("Undeclared target leaves the pointer dangling with a warning")
    void undeclaredTargetIsAWarning() {
        ResolutionResult result = resolver.resolve("int *p = &ghost;");

        assertThat(result.isSuccess()).isTrue();
        MemoryObject p = result.graph().findByName("p").orElseThrow();
        assertThat(p.pointsTo()).isEmpty();
        assertThat(p.valueOrTarget()).isEqualTo("-> ?");
        assertThat(result.warnings()).hasSize(1);
        Diagnostic warning = result.warnings().get(0);
        assertThat(warning.message()).contains("'ghost'");
        assertThat(warning.column()).isEqualTo(11);
    }

    @Test
    @Tag("unit")
    @DisplayName("Lookups only see earlier declarations")
    void forwardReferencesDoNotResolve() {
        ResolutionResult result = resolver.resolve("int *p = &a; int a = 1;");

        assertThat(result.graph().findByName("p").orElseThrow().pointsTo()).isEmpty();
        assertThat(result.warnings()).hasSize(1);
    }

    @Test
    @Tag("unit")
    @DisplayName("Duplicate names bind to the earlier declaration and lookups return the first match")
    void duplicateNamesResolveToFirstMatch() {
        MemoryGraph graph = resolveClean("int a = 1; int a = 2; int *p = &a;");

        List<MemoryObject> objects = graph.objects();
        assertThat(objects.get(2).pointsTo()).contains(objects.get(0).address());
        assertThat(object(graph, "a").value()).contains(1);
        assertThat(objects.get(0).address()).isNotEqualTo(objects.get(1).address());
    }

    @Test
    @Tag("unit")
    void assignsSequentialHexAddresses() {
        MemoryGraph graph = resolveClean("int a = 1; int b = 2; int *p = &a;");

        assertThat(graph.objects()).extracting(MemoryObject::address)
                .containsExactly("0x1000", "0x1004", "0x1008");
    }

    @Test
    @Tag("unit")
    @DisplayName("Two resolvers produce identical graphs for identical text")
    void resolutionIsIdempotent() {
        String source = "int a = 42; int *p = &a; int **pp = &p; int &r = a;";

        MemoryGraph first = new DeclarationResolver().resolve(source).graph();
        MemoryGraph second = new DeclarationResolver().resolve(source).graph();

        assertThat(second).isEqualTo(first);
    }

    @Test
    @Tag("unit")
    void referenceToPointerBindsToThePointerItself() {
        MemoryGraph graph = resolveClean("int num = 7; int *ptr = &num; int* &refPtr = ptr;");

        Reference refPtr = (Reference) object(graph, "refPtr");
        assertThat(refPtr.pointsTo()).contains(object(graph, "ptr").address());
        assertThat(refPtr.targetIndirectionLevel()).isEqualTo(1);
        assertThat(refPtr.typeDescription()).isEqualTo("int* &");
        assertThat(refPtr.value()).contains(object(graph, "num").address());
    }

    @Test
    @Tag("unit")
    void dereferenceBindsToThePointee() {
        MemoryGraph graph = resolveClean("int num = 7; int *ptr = &num; int &r = *ptr;");

        MemoryObject r = object(graph, "r");
        assertThat(r.pointsTo()).contains(object(graph, "num").address());
        assertThat(r.value()).contains(7);
    }

    @Test
    @Tag("unit")
    void dereferencingNullPointerLeavesReferenceUnbound() {
        ResolutionResult result = resolver.resolve("int *p = nullptr; int &r = *p;");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.graph().findByName("r").orElseThrow().pointsTo()).isEmpty();
        assertThat(result.warnings()).singleElement()
                .extracting(Diagnostic::message).asString().contains("'p' does not point to a declared object");
    }

    @Test
    @Tag("unit")
    void referenceToLiteralKeepsValueWithoutTarget() {
        ResolutionResult result = resolver.resolve("const int &c = 5;");

        Reference c = (Reference) result.graph().findByName("c").orElseThrow();
        assertThat(c.pointsTo()).isEmpty();
        assertThat(c.value()).contains(5);
        assertThat(c.isValueConst()).isTrue();
        assertThat(result.warnings()).hasSize(1);
    }

    @Test
    @Tag("unit")
    void variableInitializedFromIdentifierKeepsItsText() {
        MemoryGraph graph = resolveClean("int a = 1; int b = a;");

        assertThat(object(graph, "b").value()).contains("a");
        assertThat(object(graph, "b").pointsTo()).isEmpty();
    }

    @Test
    @Tag("unit")
    void ignoresCommentsAndBlankLines() {
        MemoryGraph graph = resolveClean("""
                // a program
                int a = 1   // no semicolon needed

                /* int ignored = 2; */
                int *p = &a
                """);

        assertThat(graph.objects()).extracting(MemoryObject::name).containsExactly("a", "p");
    }

    @Test
    @Tag("unit")
    @DisplayName("A statement may span several lines before its ';'")
    void resolvesStatementsSplitAcrossLines() {
        MemoryGraph graph = resolveClean("int a = 42;\nint *p =\n    &a;\nconst int\n    *cp = &a;");

        assertThat(graph.size()).isEqualTo(3);
        String a = object(graph, "a").address();
        assertThat(object(graph, "p").pointsTo()).contains(a);
        assertThat(object(graph, "cp").pointsTo()).contains(a);
        assertThat(object(graph, "cp").isValueConst()).isTrue();
    }

    @Test
    @Tag("unit")
    @DisplayName("An out-of-range integer is reported once")
    void lexerErrorsAreNotRepeatedByTheParser() {
        ResolutionResult result = resolver.resolve("int big = 99999999999999999999;\nint b = 2;");

        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0).message()).startsWith("Integer literal out of range");
        assertThat(result.graph().objects()).extracting(MemoryObject::name).containsExactly("b");
    }

    @Test
    @Tag("unit")
    @DisplayName("Malformed statements fail the resolution but keep well-formed objects")
    void malformedStatementsAreErrors() {
        ResolutionResult result = resolver.resolve("int a = 1;\nint *p &a;\nint b = 2;", "demo.ptr");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.graph().objects()).extracting(MemoryObject::name).containsExactly("a", "b");
        Diagnostic error = result.errors().get(0);
        assertThat(error.fileName()).isEqualTo("demo.ptr");
        assertThat(error.line()).isEqualTo(2);
        assertThat(error.snippet()).isEqualTo("int *p &a;");
        assertThatThrownBy(result::requireSuccess)
                .isInstanceOf(ResolutionException.class)
                .hasMessageContaining("demo.ptr:2");
    }

    @Test
    @Tag("unit")
    void emptyInputYieldsEmptyGraph() {
        ResolutionResult result = resolver.resolve("");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.requireSuccess().isEmpty()).isTrue();
    }
}
