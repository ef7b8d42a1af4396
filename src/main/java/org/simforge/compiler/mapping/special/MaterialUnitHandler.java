package org.simforge.compiler.mapping.special;

import org.simforge.compiler.ir.Property;
import org.simforge.compiler.mapping.MaterialUnitInfo;
import org.simforge.compiler.mapping.PropertyKind;
import org.simforge.compiler.mapping.rules.PropertyRule;

/**
 * Assigns a material unit to a source object: the source property names the product type,
 * which is translated into a run-stable material unit label.
 */
public final class MaterialUnitHandler implements ISpecialHandler {

    public static final String NAME = "assign_material_unit";
    public static final String PATH_PROPERTY = "Path";
    public static final String INFO_PROPERTY = "_material_unit_info";

    @Override
    public void handle(Property source, PropertyRule rule, SpecialHandlerContext context) {
        String productType = source.value();
        String label = context.materialUnits().labelFor(productType);
        context.mapping().addProperty(PATH_PROPERTY, label, PropertyKind.MATERIAL_UNIT);
        context.mapping().addProperty(INFO_PROPERTY, new MaterialUnitInfo(productType, label), PropertyKind.SPECIAL);
    }
}
