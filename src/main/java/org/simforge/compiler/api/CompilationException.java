package org.simforge.compiler.api;

import org.simforge.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * Thrown when a layout document cannot be compiled: it cannot be parsed, it fails validation,
 * or creation was aborted by the error policy.
 * <p>
 * Carries every diagnostic collected up to the failure.
 */
public class CompilationException extends Exception {

    private final List<Diagnostic> diagnostics;

    /**
     * @param message     The detail message.
     * @param diagnostics The diagnostics collected so far.
     */
    public CompilationException(String message, List<Diagnostic> diagnostics) {
        this(message, diagnostics, null);
    }

    /**
     * @param message     The detail message.
     * @param diagnostics The diagnostics collected so far.
     * @param cause       The cause.
     */
    public CompilationException(String message, List<Diagnostic> diagnostics, Throwable cause) {
        super(message, cause);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
