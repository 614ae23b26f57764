package org.loxlang.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the errors reported by the lexer, parser and resolver for one run.
 * <p>
 * None of the static stages stop at their first error: each one reports into this engine
 * and keeps going, so a single run can surface every independent problem at once. The caller
 * decides whether to continue with the next stage by checking {@link #hasErrors()}.
 */
public class DiagnosticsEngine {

    private final String sourceName;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Creates an engine for an anonymous source.
     */
    public DiagnosticsEngine() {
        this("<script>");
    }

    /**
     * Creates an engine whose diagnostics are attributed to the given source.
     * @param sourceName The file name or other label of the source being processed.
     */
    public DiagnosticsEngine(String sourceName) {
        this.sourceName = sourceName;
    }

    /**
     * Reports an error.
     * @param phase The stage reporting the error.
     * @param message The error message.
     * @param line The source line.
     * @param column The source column, or 0 if unknown.
     */
    public void reportError(Diagnostic.Phase phase, String message, int line, int column) {
        diagnostics.add(new Diagnostic(phase, message, sourceName, line, column));
    }

    /**
     * Checks whether any error has been reported.
     * @return true if at least one error was reported.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * Checks whether an error of the given phase has been reported.
     * @param phase The phase to look for.
     * @return true if at least one error of that phase was reported.
     */
    public boolean hasErrors(Diagnostic.Phase phase) {
        return diagnostics.stream().anyMatch(d -> d.phase() == phase);
    }

    public int errorCount() {
        return diagnostics.size();
    }

    /**
     * Gets all reported diagnostics in reporting order.
     * @return An unmodifiable view of the diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public String getSourceName() {
        return sourceName;
    }

    /**
     * Renders all diagnostics, one per line.
     * @return The rendered summary, or an empty string if nothing was reported.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining(System.lineSeparator()));
    }
}
