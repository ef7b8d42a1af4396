package org.simforge.compiler.mapping;

import org.simforge.compiler.mapping.rules.DataType;

import java.util.Locale;
import java.util.Optional;

/**
 * Best-effort conversion of property text into the target data type. Unparsable numbers become zero.
 */
final class ValueCoercion {

    private ValueCoercion() {
        // Private constructor to prevent instantiation
    }

    static Object coerce(Object raw, DataType dataType) {
        String text = raw == null ? "" : String.valueOf(raw).trim();
        return switch (dataType) {
            case STRING -> raw == null ? "" : String.valueOf(raw);
            case INT, POSITIVE_INT -> parseDouble(text).map(d -> (int) d.doubleValue()).orElse(0);
            case FLOAT, POSITIVE_FLOAT -> parseDouble(text).orElse(0.0);
            case BOOL -> raw instanceof Boolean b ? b : parseBoolean(text);
        };
    }

    static Optional<Double> parseDouble(String text) {
        if (text == null) {
            return Optional.empty();
        }
        try {
            double d = Double.parseDouble(text.trim());
            return Double.isFinite(d) ? Optional.of(d) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static boolean parseBoolean(String text) {
        String t = text.toLowerCase(Locale.ROOT);
        return t.equals("true") || t.equals("yes") || t.equals("1");
    }
}
