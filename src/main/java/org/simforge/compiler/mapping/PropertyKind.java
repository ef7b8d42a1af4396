package org.simforge.compiler.mapping;

/**
 * How a mapped property is applied to the target object.
 */
public enum PropertyKind {
    /** A scalar value set directly. */
    VALUE,
    /** An ordered list of numbers, e.g. coordinates. */
    LIST,
    /** The label of a material unit; resolved to the material unit object at creation time. */
    MATERIAL_UNIT,
    /** Metadata for downstream consumers; never sent to the backend. */
    SPECIAL
}
