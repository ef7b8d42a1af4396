package org.simforge.compiler.mapping.special;

import org.simforge.compiler.mapping.ObjectMapping;

/**
 * State handed to special handlers: the mapping under construction and the run-scoped
 * material unit labels.
 */
public record SpecialHandlerContext(ObjectMapping mapping, MaterialUnitRegistry materialUnits) {
}
