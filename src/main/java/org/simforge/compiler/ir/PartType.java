package org.simforge.compiler.ir;

import java.util.Optional;

/**
 * A part or product type flowing through the layout.
 */
public record PartType(String identifier, String name, String description, Double weight, Boundary dimensions) {

    public Optional<Double> weightValue() {
        return Optional.ofNullable(weight);
    }

    public Optional<Boundary> dimensionsValue() {
        return Optional.ofNullable(dimensions);
    }
}
