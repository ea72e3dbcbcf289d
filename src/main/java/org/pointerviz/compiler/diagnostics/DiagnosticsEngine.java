package org.pointerviz.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects errors and warnings reported by the lexer, parser and resolver of one run.
 * <p>
 * Snippets are taken from the source text registered via {@link #setSource(String, String)}, so
 * reporters only need to pass a line number.
 * <p>
 * Thread Safety: Not thread-safe. One engine belongs to one resolution.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private String fileName = "<input>";
    private String[] sourceLines = new String[0];

    /**
     * Registers the source being processed, used for snippets.
     *
     * @param fileName The logical source name.
     * @param source   The full source text.
     */
    public void setSource(String fileName, String source) {
        this.fileName = fileName;
        this.sourceLines = source.split("\\r?\\n|\\r", -1);
    }

    /**
     * Reports an error at the given line of the registered source.
     */
    public void reportError(String message, int line, int column) {
        report(Diagnostic.Severity.ERROR, message, line, column);
    }

    /**
     * Reports a warning at the given line of the registered source.
     */
    public void reportWarning(String message, int line, int column) {
        report(Diagnostic.Severity.WARNING, message, line, column);
    }

    private void report(Diagnostic.Severity severity, String message, int line, int column) {
        diagnostics.add(new Diagnostic(severity, message, fileName, line, column, snippetAt(line)));
    }

    /**
     * Returns the trimmed source line, or an empty string if the line is out of range.
     */
    public String snippetAt(int line) {
        if (line < 1 || line > sourceLines.length) {
            return "";
        }
        return sourceLines[line - 1].trim();
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public List<Diagnostic> getErrors() {
        return diagnostics.stream().filter(Diagnostic::isError).collect(Collectors.toList());
    }

    /**
     * @return all diagnostics formatted one per line.
     */
    public String summary() {
        return diagnostics.stream().map(Diagnostic::format).collect(Collectors.joining("\n"));
    }
}
