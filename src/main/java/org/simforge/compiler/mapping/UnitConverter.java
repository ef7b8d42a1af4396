package org.simforge.compiler.mapping;

import org.simforge.compiler.mapping.rules.RuleTable;
import org.simforge.compiler.mapping.rules.UnitCategory;

import java.util.Optional;

/**
 * Multiplicative unit conversion into the base unit of a conversion category.
 */
public final class UnitConverter {

    private final RuleTable rules;

    public UnitConverter(RuleTable rules) {
        this.rules = rules;
    }

    /**
     * The converted value and, if the conversion could not be performed, a warning.
     * An unperformed conversion leaves the value unchanged.
     */
    public record Result(double value, Optional<String> warning) {

        static Result converted(double value) {
            return new Result(value, Optional.empty());
        }

        static Result unchanged(double value, String warning) {
            return new Result(value, Optional.of(warning));
        }
    }

    /**
     * Converts {@code value} given in {@code unit} into the base unit of {@code category}.
     */
    public Result toBase(double value, String unit, String category) {
        Optional<UnitCategory> c = rules.unitCategory(category);
        if (c.isEmpty()) {
            return Result.unchanged(value, "Unknown unit conversion category '" + category + "'");
        }
        Optional<Double> factor = c.get().factor(unit);
        if (factor.isEmpty()) {
            return Result.unchanged(value, "Unknown unit '" + unit + "' for conversion category '" + category + "'");
        }
        return Result.converted(value * factor.get());
    }

    /**
     * Converts {@code value} from the base unit of {@code category} back into {@code unit}.
     */
    public Result fromBase(double value, String unit, String category) {
        Optional<UnitCategory> c = rules.unitCategory(category);
        if (c.isEmpty()) {
            return Result.unchanged(value, "Unknown unit conversion category '" + category + "'");
        }
        Optional<Double> factor = c.get().factor(unit);
        if (factor.isEmpty() || factor.get() == 0.0) {
            return Result.unchanged(value, "Unknown unit '" + unit + "' for conversion category '" + category + "'");
        }
        return Result.converted(value / factor.get());
    }
}
