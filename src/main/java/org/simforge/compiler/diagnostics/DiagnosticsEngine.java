package org.simforge.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting diagnostic messages (errors, warnings) that occur
 * during a single pipeline run.
 * <p>
 * This decouples error reporting from the stage logic (parser, validator, mapping).
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Records a diagnostic.
     *
     * @param diagnostic The diagnostic to record.
     */
    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    /**
     * Records all given diagnostics, preserving their order.
     *
     * @param batch The diagnostics to record.
     */
    public void reportAll(List<Diagnostic> batch) {
        diagnostics.addAll(batch);
    }

    /**
     * Reports an error without entity context.
     *
     * @param category The category of the error.
     * @param message  The error message.
     */
    public void reportError(Diagnostic.Category category, String message) {
        report(Diagnostic.of(Diagnostic.Severity.ERROR, category, message));
    }

    /**
     * Reports a warning without entity context.
     *
     * @param category The category of the warning.
     * @param message  The warning message.
     */
    public void reportWarning(Diagnostic.Category category, String message) {
        report(Diagnostic.of(Diagnostic.Severity.WARNING, category, message));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    /**
     * Returns the number of diagnostics with the given severity.
     */
    public long count(Diagnostic.Severity severity) {
        return diagnostics.stream().filter(d -> d.severity() == severity).count();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
