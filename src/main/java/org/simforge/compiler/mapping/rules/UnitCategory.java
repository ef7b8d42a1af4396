package org.simforge.compiler.mapping.rules;

import java.util.Map;
import java.util.Optional;

/**
 * A family of convertible units, e.g. lengths. Every unit maps to a multiplicative
 * factor that converts a value into the base unit.
 *
 * @param name     The category name referenced by property rules.
 * @param baseUnit The unit values are converted into.
 * @param factors  Unit name to factor.
 */
public record UnitCategory(String name, String baseUnit, Map<String, Double> factors) {

    public UnitCategory {
        factors = Map.copyOf(factors);
    }

    /**
     * @return The factor for {@code unit}, {@code 1.0} for the base unit, or empty if the unit is unknown.
     */
    public Optional<Double> factor(String unit) {
        if (unit.equals(baseUnit)) {
            return Optional.of(1.0);
        }
        return Optional.ofNullable(factors.get(unit));
    }
}
