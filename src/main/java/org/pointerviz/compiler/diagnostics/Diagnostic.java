package org.pointerviz.compiler.diagnostics;

/**
 * A single message produced while resolving a program.
 *
 * @param severity The severity. Only {@link Severity#ERROR} fails a resolution.
 * @param message  Human-readable description.
 * @param fileName The logical source name, e.g. a file path or {@code <input>}.
 * @param line     1-based line number, or 0 if unknown.
 * @param column   1-based column number, or 0 if unknown.
 * @param snippet  The offending source line, trimmed; empty if unavailable.
 */
public record Diagnostic(
        Severity severity,
        String message,
        String fileName,
        int line,
        int column,
        String snippet
) {

    public enum Severity {
        ERROR,
        WARNING
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Formats the diagnostic as {@code [ERROR] file:line:column: message | snippet}.
     */
    public String format() {
        StringBuilder sb = new StringBuilder()
                .append('[').append(severity).append("] ")
                .append(fileName).append(':').append(line);
        if (column > 0) {
            sb.append(':').append(column);
        }
        sb.append(": ").append(message);
        if (snippet != null && !snippet.isEmpty()) {
            sb.append(" | ").append(snippet);
        }
        return sb.toString();
    }
}
