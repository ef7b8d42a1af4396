package org.simforge.compiler.backend;

/**
 * Turns template names into absolute template paths: a configured path wins, otherwise
 * the template is looked up in the user objects folder.
 */
public final class TemplateResolver {

    private final BackendSettings settings;

    public TemplateResolver(BackendSettings settings) {
        this.settings = settings;
    }

    public String resolve(String templateName) {
        String configured = settings.templates().get(templateName);
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        return settings.userObjects() + "." + templateName;
    }
}
