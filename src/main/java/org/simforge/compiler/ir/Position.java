package org.simforge.compiler.ir;

/**
 * A point in the layout coordinate system.
 */
public record Position(double x, double y, double z) {

    public Position(double x, double y) {
        this(x, y, 0.0);
    }
}
