package org.simforge.compiler.backend.remote;

import org.simforge.compiler.backend.Handle;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Formats backend operations as SimTalk statements.
 */
public final class SimTalkCommands {

    private SimTalkCommands() {
        // Private constructor to prevent instantiation
    }

    public static String derive(Handle template, Handle parent, String name) {
        return template.path() + ".derive(" + parent.path() + ", " + quote(name) + ")";
    }

    public static String assign(Handle object, String attributePath, Object value) {
        return object.path() + "." + attributePath + " := " + literal(value);
    }

    public static String connect(Handle connector, Handle from, Handle to) {
        return connector.path() + ".connect(" + from.path() + ", " + to.path() + ")";
    }

    public static String existsObject(String path) {
        return "existsObject(" + quote(path) + ")";
    }

    /**
     * Renders a value as a SimTalk literal. Handles are written as object paths, lists as
     * bracketed arrays, everything else non-numeric as a quoted string.
     */
    public static String literal(Object value) {
        if (value == null) {
            return "void";
        }
        if (value instanceof Handle h) {
            return h.path();
        }
        if (value instanceof Boolean b) {
            return b ? "true" : "false";
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return d == Math.rint(d) && !Double.isInfinite(d) ? String.format(Locale.ROOT, "%.1f", d) : Double.toString(d);
        }
        if (value instanceof Number n) {
            return n.toString();
        }
        if (value instanceof List<?> list) {
            return list.stream().map(SimTalkCommands::literal).collect(Collectors.joining(", ", "[", "]"));
        }
        return quote(String.valueOf(value));
    }

    static String quote(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
