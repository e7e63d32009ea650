package org.asymptote.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects semantic diagnostics during one analysis pass.
 * <p>
 * Lexical and syntax failures never go through here: they abort the request with an
 * exception. This engine only carries findings that are localized to a node, such as an
 * undefined variable or a malformed loop bound. Identical findings at the same position
 * are recorded once.
 * <p>
 * Not thread-safe; one instance belongs to one analysis run.
 */
public class DiagnosticsEngine {

    private final Set<Diagnostic> diagnostics = new LinkedHashSet<>();

    /**
     * Reports a semantic error.
     */
    public void reportError(String code, String message, int line, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.ERROR, code, message, line, column));
    }

    /**
     * Reports a warning, e.g. a subtree that could not be classified.
     */
    public void reportWarning(String code, String message, int line, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.WARNING, code, message, line, column));
    }

    /**
     * Reports an informational note.
     */
    public void reportInfo(String code, String message, int line, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.INFO, code, message, line, column));
    }

    /**
     * @return true if at least one error was reported.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Diagnostic.Severity.ERROR);
    }

    /**
     * @return an unmodifiable snapshot of all diagnostics in report order.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }
}
