package org.pointerviz.compiler.resolver;

import org.pointerviz.compiler.diagnostics.Diagnostic;
import org.pointerviz.model.MemoryGraph;

import java.util.List;

/**
 * Outcome of resolving one program.
 *
 * @param graph       The objects of all well-formed statements, in declaration order.
 * @param diagnostics Errors and warnings, in the order they were reported.
 */
public record ResolutionResult(MemoryGraph graph, List<Diagnostic> diagnostics) {

    public ResolutionResult {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return true if no error was reported. Warnings do not count.
     */
    public boolean isSuccess() {
        return diagnostics.stream().noneMatch(Diagnostic::isError);
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> !d.isError()).toList();
    }

    /**
     * Returns the graph of a successful resolution.
     *
     * @throws ResolutionException if any error was reported.
     */
    public MemoryGraph requireSuccess() {
        if (!isSuccess()) {
            throw new ResolutionException(errors());
        }
        return graph;
    }
}
