package org.simforge.compiler.mapping;

import org.simforge.compiler.mapping.rules.DataType;
import org.simforge.compiler.mapping.rules.RuleTable;
import org.simforge.compiler.mapping.rules.ValueRange;

import java.util.Optional;

/**
 * Checks converted property values against their data type and configured ranges.
 */
public final class PropertyValidator {

    private final RuleTable rules;

    public PropertyValidator(RuleTable rules) {
        this.rules = rules;
    }

    /**
     * @param sourceName The source property name; ranges are keyed by it.
     * @param text       The value text after unit conversion.
     * @param value      The coerced value.
     * @param dataType   The target data type.
     * @return The violation message, or empty if the value is acceptable.
     */
    public Optional<String> validate(String sourceName, String text, Object value, DataType dataType) {
        if (dataType.isPositive()) {
            Optional<Double> parsed = ValueCoercion.parseDouble(text);
            boolean integral = dataType == DataType.POSITIVE_INT
                    ? parsed.map(d -> d == Math.rint(d)).orElse(false)
                    : parsed.isPresent();
            if (!integral || parsed.get() < 0) {
                return Optional.of("Invalid data type for " + sourceName + ". Expected "
                        + dataType.configName() + ", got '" + text + "'");
            }
        }
        if (dataType == DataType.INT || dataType == DataType.POSITIVE_INT) {
            Optional<Double> parsed = ValueCoercion.parseDouble(text);
            if (parsed.isPresent() && (parsed.get() > Integer.MAX_VALUE || parsed.get() < Integer.MIN_VALUE)) {
                return Optional.of(sourceName + " value '" + text + "' exceeds the integer range");
            }
        }
        if (dataType.isNumeric() && value instanceof Number n) {
            Optional<ValueRange> range = rules.range(sourceName);
            if (range.isPresent() && !range.get().contains(n.doubleValue())) {
                return Optional.of(sourceName + " value " + n.doubleValue() + " outside valid range " + range.get());
            }
        }
        return Optional.empty();
    }
}
