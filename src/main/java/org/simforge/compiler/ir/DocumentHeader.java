package org.simforge.compiler.ir;

/**
 * Header metadata of a layout document, including the unit defaults that apply
 * to values without an explicit unit.
 */
public record DocumentHeader(
        String identifier,
        String description,
        String version,
        String creationTime,
        String timeUnit,
        String lengthUnit,
        String weightUnit
) {
    public static final String DEFAULT_TIME_UNIT = "second";
    public static final String DEFAULT_LENGTH_UNIT = "meter";
    public static final String DEFAULT_WEIGHT_UNIT = "kilogram";

    public DocumentHeader {
        identifier = identifier == null ? "" : identifier;
        description = description == null ? "" : description;
        version = version == null ? "" : version;
        creationTime = creationTime == null ? "" : creationTime;
        timeUnit = timeUnit == null || timeUnit.isEmpty() ? DEFAULT_TIME_UNIT : timeUnit;
        lengthUnit = lengthUnit == null || lengthUnit.isEmpty() ? DEFAULT_LENGTH_UNIT : lengthUnit;
        weightUnit = weightUnit == null || weightUnit.isEmpty() ? DEFAULT_WEIGHT_UNIT : weightUnit;
    }
}
