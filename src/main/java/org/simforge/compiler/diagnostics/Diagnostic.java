package org.simforge.compiler.diagnostics;

/**
 * Represents a single diagnostic message (error, warning, info) raised by any
 * stage of the layout compilation pipeline.
 * <p>
 * Besides the human readable message, a diagnostic carries structured context so
 * callers can assert on the offending entity without parsing the message text.
 *
 * @param severity     The severity of the diagnostic.
 * @param category     The pipeline concern that raised it.
 * @param message      The diagnostic message.
 * @param entityKind   The kind of IR entity concerned (e.g. "Resource"), or {@code null}.
 * @param entityId     The identifier of the entity concerned, or {@code null}.
 * @param referencedId The identifier the entity refers to, or {@code null}.
 */
public record Diagnostic(
        Severity severity,
        Category category,
        String message,
        String entityKind,
        String entityId,
        String referencedId
) {
    /**
     * The severity of a diagnostic message.
     */
    public enum Severity {
        /** A problem that makes the result unusable. */
        ERROR,
        /** A problem that does not prevent further processing. */
        WARNING,
        /** An informational message. */
        INFO
    }

    /**
     * The pipeline concern a diagnostic belongs to.
     */
    public enum Category {
        PARSE,
        VALIDATION,
        MAPPING,
        CREATION,
        PROPERTY,
        CONNECTION
    }

    /**
     * Creates a diagnostic without structured entity context.
     */
    public static Diagnostic of(Severity severity, Category category, String message) {
        return new Diagnostic(severity, category, message, null, null, null);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        if (entityId == null) {
            return String.format("[%s/%s] %s", severity, category, message);
        }
        return String.format("[%s/%s] %s '%s': %s", severity, category, entityKind, entityId, message);
    }
}
