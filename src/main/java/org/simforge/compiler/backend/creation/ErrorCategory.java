package org.simforge.compiler.backend.creation;

import org.simforge.compiler.diagnostics.Diagnostic;

/**
 * The kinds of backend failure the error policy distinguishes.
 */
public enum ErrorCategory {
    CREATION("on-creation-error", Diagnostic.Category.CREATION),
    PROPERTY("on-property-error", Diagnostic.Category.PROPERTY),
    CONNECTION("on-connection-error", Diagnostic.Category.CONNECTION);

    private final String configKey;
    private final Diagnostic.Category diagnosticCategory;

    ErrorCategory(String configKey, Diagnostic.Category diagnosticCategory) {
        this.configKey = configKey;
        this.diagnosticCategory = diagnosticCategory;
    }

    /**
     * @return The key below {@code simforge.error-handling} that configures this category.
     */
    public String configKey() {
        return configKey;
    }

    public Diagnostic.Category diagnosticCategory() {
        return diagnosticCategory;
    }
}
