package org.simforge.compiler.mapping.rules;

import java.util.Locale;

/**
 * Target data type of a mapped property.
 */
public enum DataType {
    STRING("string"),
    INT("int"),
    FLOAT("float"),
    POSITIVE_INT("positive_int"),
    POSITIVE_FLOAT("positive_float"),
    BOOL("bool");

    private final String configName;

    DataType(String configName) {
        this.configName = configName;
    }

    /**
     * @return The name used for this type in the rule table.
     */
    public String configName() {
        return configName;
    }

    public boolean isNumeric() {
        return this == INT || this == FLOAT || this == POSITIVE_INT || this == POSITIVE_FLOAT;
    }

    public boolean isPositive() {
        return this == POSITIVE_INT || this == POSITIVE_FLOAT;
    }

    /**
     * Resolves a data type from its rule table name.
     *
     * @param name The configured name, e.g. {@code positive_float}.
     * @return The matching data type.
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static DataType fromConfigName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (DataType type : values()) {
            if (type.configName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown data type: " + name);
    }
}
