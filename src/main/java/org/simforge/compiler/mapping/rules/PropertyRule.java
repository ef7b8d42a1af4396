package org.simforge.compiler.mapping.rules;

import java.util.Optional;

/**
 * How a single source property of a resource is mapped onto the target object.
 *
 * @param sourceName     The property name in the layout document (matched case-insensitively).
 * @param target         The attribute name on the target object.
 * @param dataType       The type the value is coerced to.
 * @param unitConversion The unit conversion category, or {@code null}.
 * @param specialHandler The name of a special handler that replaces the generic path, or {@code null}.
 */
public record PropertyRule(
        String sourceName,
        String target,
        DataType dataType,
        String unitConversion,
        String specialHandler
) {

    public Optional<String> unitConversionValue() {
        return Optional.ofNullable(unitConversion);
    }

    public Optional<String> specialHandlerValue() {
        return Optional.ofNullable(specialHandler);
    }
}
