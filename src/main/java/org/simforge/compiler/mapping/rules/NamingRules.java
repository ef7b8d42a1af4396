package org.simforge.compiler.mapping.rules;

import java.util.List;
import java.util.Locale;

/**
 * Rules for turning free-text resource names into valid object names.
 *
 * @param caseHandling    Case folding applied first.
 * @param invalidChars    Character sequences replaced by {@code replacementChar}.
 * @param replacementChar The replacement for invalid characters.
 * @param maxLength       Maximum name length.
 * @param digitPrefix     Prefix for names that start with a digit.
 */
public record NamingRules(
        CaseHandling caseHandling,
        List<String> invalidChars,
        String replacementChar,
        int maxLength,
        String digitPrefix
) {

    public static final NamingRules DEFAULTS = new NamingRules(
            CaseHandling.PRESERVE,
            List.of(" ", "-", ".", "/", "\\", "(", ")", "[", "]", "{", "}", ":", ";", ",", "'", "\""),
            "_",
            32,
            "obj_");

    public NamingRules {
        invalidChars = List.copyOf(invalidChars);
        if (!digitPrefix.isEmpty() && Character.isDigit(digitPrefix.charAt(0))) {
            throw new IllegalArgumentException("digit-prefix must not start with a digit: '" + digitPrefix + "'");
        }
        if (maxLength <= digitPrefix.length()) {
            throw new IllegalArgumentException("max-length must exceed the length of digit-prefix '" + digitPrefix + "'");
        }
        for (String invalid : invalidChars) {
            if (!invalid.isEmpty() && replacementChar.contains(invalid)) {
                throw new IllegalArgumentException("replacement-char '" + replacementChar + "' contains invalid character '" + invalid + "'");
            }
        }
    }

    public enum CaseHandling {
        PRESERVE,
        UPPER,
        LOWER;

        public static CaseHandling fromConfigName(String name) {
            try {
                return valueOf(name.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown case-handling: " + name, e);
            }
        }
    }
}
