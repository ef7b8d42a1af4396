package org.simforge.compiler.mapping.special;

import org.simforge.compiler.ir.Property;
import org.simforge.compiler.mapping.rules.PropertyRule;

/**
 * Maps a source property that needs custom logic instead of the generic
 * convert-coerce-validate path.
 */
public interface ISpecialHandler {

    /**
     * Maps the property into the context's current object mapping.
     *
     * @param source  The source property.
     * @param rule    The rule that named this handler.
     * @param context The mapping run state.
     */
    void handle(Property source, PropertyRule rule, SpecialHandlerContext context);
}
