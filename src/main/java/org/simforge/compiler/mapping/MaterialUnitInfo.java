package org.simforge.compiler.mapping;

/**
 * Links a product type to the material unit label assigned to it.
 */
public record MaterialUnitInfo(String productType, String label) {
}
