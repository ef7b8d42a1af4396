package org.simforge.compiler.mapping.rules;

/**
 * Inclusive range a numeric property must fall into.
 */
public record ValueRange(double min, double max) {

    public boolean contains(double value) {
        return value >= min && value <= max;
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + "]";
    }
}
