package org.simforge.compiler.backend.creation;

/**
 * Thrown when a backend failure occurs in a category configured as {@link ErrorMode#ERROR_AND_STOP}.
 */
public class CreationAbortedException extends Exception {

    private final ErrorCategory category;

    public CreationAbortedException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
