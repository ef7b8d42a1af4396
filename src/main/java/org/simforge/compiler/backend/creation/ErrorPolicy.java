package org.simforge.compiler.backend.creation;

import com.typesafe.config.Config;

import java.util.EnumMap;
import java.util.Map;

/**
 * The {@link ErrorMode} per {@link ErrorCategory}. Unconfigured categories use {@link ErrorMode#WARN_AND_CONTINUE}.
 */
public final class ErrorPolicy {

    public static final ErrorMode DEFAULT_MODE = ErrorMode.WARN_AND_CONTINUE;

    private final Map<ErrorCategory, ErrorMode> modes;

    private ErrorPolicy(Map<ErrorCategory, ErrorMode> modes) {
        this.modes = new EnumMap<>(modes);
    }

    public static ErrorPolicy defaults() {
        return new ErrorPolicy(new EnumMap<>(ErrorCategory.class));
    }

    /**
     * @param errorHandling The {@code simforge.error-handling} section.
     * @throws IllegalArgumentException if a configured mode is unknown; the message names the key.
     */
    public static ErrorPolicy fromConfig(Config errorHandling) {
        Map<ErrorCategory, ErrorMode> modes = new EnumMap<>(ErrorCategory.class);
        for (ErrorCategory category : ErrorCategory.values()) {
            if (errorHandling.hasPath(category.configKey())) {
                String value = errorHandling.getString(category.configKey());
                try {
                    modes.put(category, ErrorMode.fromConfigName(value));
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Invalid value for error-handling." + category.configKey() + ": " + value, e);
                }
            }
        }
        return new ErrorPolicy(modes);
    }

    /**
     * @return A copy of this policy with {@code category} set to {@code mode}.
     */
    public ErrorPolicy with(ErrorCategory category, ErrorMode mode) {
        Map<ErrorCategory, ErrorMode> copy = new EnumMap<>(ErrorCategory.class);
        copy.putAll(modes);
        copy.put(category, mode);
        return new ErrorPolicy(copy);
    }

    public ErrorMode mode(ErrorCategory category) {
        return modes.getOrDefault(category, DEFAULT_MODE);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ErrorPolicy{");
        for (ErrorCategory c : ErrorCategory.values()) {
            sb.append(c.configKey()).append('=').append(mode(c)).append(c.ordinal() < ErrorCategory.values().length - 1 ? ", " : "}");
        }
        return sb.toString();
    }
}
