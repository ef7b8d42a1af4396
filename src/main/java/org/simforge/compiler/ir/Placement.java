package org.simforge.compiler.ir;

import java.util.Optional;

/**
 * The pose of a layout object inside the layout.
 */
public record Placement(String layoutElementId, Position position, Rotation rotation) {

    public Optional<Rotation> rotationValue() {
        return Optional.ofNullable(rotation);
    }
}
