package org.simforge.compiler.backend;

import java.util.Locale;

/**
 * The available backend implementations.
 */
public enum BackendType {
    RECORDING,
    REMOTE,
    IN_PROCESS;

    /**
     * @param name The configured name: {@code recording}, {@code remote} or {@code in-process}.
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static BackendType fromConfigName(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (BackendType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown simforge.backend.type: " + name);
    }
}
