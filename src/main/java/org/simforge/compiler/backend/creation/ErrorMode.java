package org.simforge.compiler.backend.creation;

import java.util.Locale;

/**
 * What the orchestrator does when a backend operation fails.
 */
public enum ErrorMode {
    /** Abort the run with a {@link CreationAbortedException}. */
    ERROR_AND_STOP,
    /** Log the failure at ERROR, count it and continue. */
    WARN_AND_CONTINUE,
    /** Count the failure and continue silently. */
    IGNORE;

    /**
     * @param name {@code error_and_stop}, {@code warn_and_continue} or {@code ignore}; dashes are accepted for underscores.
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static ErrorMode fromConfigName(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ErrorMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown error handling mode: " + name);
    }
}
