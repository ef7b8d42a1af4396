package org.simforge.compiler.ir;

import java.util.Optional;

/**
 * A named, textual property of a resource with an optional unit.
 * <p>
 * Values are frequently descriptive text, so the numeric accessors never throw:
 * an unparsable value yields an empty optional.
 *
 * @param name  The property name as written in the document.
 * @param value The raw textual value.
 * @param unit  The unit of the value, or {@code null} if none was given.
 */
public record Property(String name, String value, String unit) {

    /**
     * @return The value as a double, or empty if it is not numeric.
     */
    public Optional<Double> numericValue() {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Double.parseDouble(value.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * @return The value as an integer, or empty if it is not an integral number.
     */
    public Optional<Integer> intValue() {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * @return The unit if present and non-blank.
     */
    public Optional<String> unitValue() {
        return unit == null || unit.isBlank() ? Optional.empty() : Optional.of(unit);
    }
}
