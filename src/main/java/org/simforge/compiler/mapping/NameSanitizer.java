package org.simforge.compiler.mapping;

import org.simforge.compiler.mapping.rules.NamingRules;

import java.util.Locale;

/**
 * Turns free-text names into valid object names according to {@link NamingRules}.
 * <p>
 * Sanitizing an already sanitized name returns it unchanged.
 */
public final class NameSanitizer {

    public static final String UNNAMED = "unnamed";

    private final NamingRules rules;
    private final String prefix;

    public NameSanitizer(NamingRules rules) {
        this.rules = rules;
        this.prefix = replaceInvalid(applyCase(rules.digitPrefix()));
    }

    /**
     * @param raw The name as written in the document, may be {@code null}.
     * @return A non-empty name of at most {@code maxLength} characters.
     */
    public String sanitize(String raw) {
        String name = replaceInvalid(applyCase(raw == null || raw.isEmpty() ? UNNAMED : raw));
        name = truncate(name);
        if (Character.isDigit(name.charAt(0))) {
            name = truncate(prefix + name);
        }
        return name;
    }

    /**
     * Appends {@code _<n>} to a sanitized name, shortening the base so the result stays within the maximum length.
     */
    public String withSuffix(String sanitized, int n) {
        String suffix = rules.replacementChar() + n;
        int room = Math.max(1, rules.maxLength() - suffix.length());
        String base = sanitized.length() > room ? sanitized.substring(0, room) : sanitized;
        return base + suffix;
    }

    public NamingRules rules() {
        return rules;
    }

    private String applyCase(String name) {
        return switch (rules.caseHandling()) {
            case UPPER -> name.toUpperCase(Locale.ROOT);
            case LOWER -> name.toLowerCase(Locale.ROOT);
            case PRESERVE -> name;
        };
    }

    private String replaceInvalid(String name) {
        String result = name;
        for (String invalid : rules.invalidChars()) {
            if (!invalid.isEmpty()) {
                result = result.replace(invalid, rules.replacementChar());
            }
        }
        return result;
    }

    private String truncate(String name) {
        return name.length() > rules.maxLength() ? name.substring(0, rules.maxLength()) : name;
    }
}
