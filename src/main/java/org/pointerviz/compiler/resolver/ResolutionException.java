package org.pointerviz.compiler.resolver;

import org.pointerviz.compiler.diagnostics.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown by {@link ResolutionResult#requireSuccess()} when a program contains malformed statements.
 */
public class ResolutionException extends RuntimeException {

    private final transient List<Diagnostic> errors;

    public ResolutionException(List<Diagnostic> errors) {
        super(errors.size() + " error(s) while resolving declarations:\n"
                + errors.stream().map(Diagnostic::format).collect(Collectors.joining("\n")));
        this.errors = List.copyOf(errors);
    }

    public List<Diagnostic> getErrors() {
        return errors;
    }
}
