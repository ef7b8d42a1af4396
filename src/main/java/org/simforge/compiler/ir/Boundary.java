package org.simforge.compiler.ir;

/**
 * Physical dimensions of an object or of the whole layout.
 */
public record Boundary(double width, double depth, double height, String unit) {

    public static final double DEFAULT_HEIGHT = 1.0;
    public static final String DEFAULT_UNIT = "meter";

    public Boundary(double width, double depth) {
        this(width, depth, DEFAULT_HEIGHT, DEFAULT_UNIT);
    }
}
