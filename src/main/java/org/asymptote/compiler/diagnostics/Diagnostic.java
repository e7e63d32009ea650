package org.asymptote.compiler.diagnostics;

/**
 * A localized finding attached to an otherwise complete analysis result.
 *
 * @param severity The severity. {@link Severity#ERROR} marks a semantic error.
 * @param code     A stable identifier for the kind of finding, e.g. {@code undefined-variable}.
 * @param message  The human-readable message.
 * @param line     The 1-based source line of the offending node.
 * @param column   The 1-based source column of the offending node.
 */
public record Diagnostic(Severity severity, String code, String message, int line, int column) {

    /**
     * Severity of a diagnostic.
     */
    public enum Severity {
        ERROR,
        WARNING,
        INFO
    }

    @Override
    public String toString() {
        return severity + " [" + code + "] " + line + ":" + column + ": " + message;
    }
}
