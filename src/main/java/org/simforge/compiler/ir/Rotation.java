package org.simforge.compiler.ir;

/**
 * A rotation by {@code angle} around the given axis. The axis defaults to Z.
 */
public record Rotation(double angle, double axisX, double axisY, double axisZ) {

    public Rotation(double angle) {
        this(angle, 0.0, 0.0, 1.0);
    }
}
