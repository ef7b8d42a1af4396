package org.simforge.compiler.mapping;

/**
 * A target attribute with its converted value.
 *
 * @param name  The attribute name on the target object.
 * @param value The converted value (String, Integer, Double, Boolean, List of Double, or metadata).
 * @param kind  How the value is applied.
 */
public record MappedProperty(String name, Object value, PropertyKind kind) {
}
