package org.simforge.compiler.frontend.schema;

import java.util.Optional;

/**
 * Declarative description of where each semantic field lives in a layout document.
 * <p>
 * Only the header is mandatory. A section that is not configured is simply not parsed.
 * Field and child role names are the constants declared below.
 */
public record SchemaConfig(
        EntitySchema header,
        EntitySchema resources,
        EntitySchema layoutObjects,
        EntitySchema layout,
        EntitySchema partTypes
) {
    // header fields
    public static final String DOCUMENT_IDENTIFIER = "document-identifier";
    public static final String DESCRIPTION = "description";
    public static final String VERSION = "version";
    public static final String CREATION_TIME = "creation-time";
    public static final String TIME_UNIT = "time-unit";
    public static final String LENGTH_UNIT = "length-unit";
    public static final String WEIGHT_UNIT = "weight-unit";

    // entity fields
    public static final String IDENTIFIER = "identifier";
    public static final String NAME = "name";
    public static final String RESOURCE_TYPE = "resource-type";
    public static final String CURRENT_STATUS = "current-status";
    public static final String RESOURCE_CLASS_IDENTIFIER = "resource-class-identifier";
    public static final String VALUE = "value";
    public static final String UNIT = "unit";
    public static final String TO_RESOURCE_ID = "to-resource-id";
    public static final String ASSOCIATED_RESOURCE_ID = "associated-resource-id";
    public static final String LAYOUT_ELEMENT_ID = "layout-element-id";
    public static final String POSITION_X = "position-x";
    public static final String POSITION_Y = "position-y";
    public static final String POSITION_Z = "position-z";
    public static final String ROTATION_ANGLE = "rotation-angle";
    public static final String ROTATION_AXIS_X = "rotation-axis-x";
    public static final String ROTATION_AXIS_Y = "rotation-axis-y";
    public static final String ROTATION_AXIS_Z = "rotation-axis-z";
    public static final String WIDTH = "width";
    public static final String DEPTH = "depth";
    public static final String HEIGHT = "height";
    public static final String WEIGHT = "weight";

    // child roles
    public static final String PROPERTIES = "properties";
    public static final String CONNECTIONS = "connections";
    public static final String BOUNDARY = "boundary";
    public static final String PLACEMENTS = "placements";

    public SchemaConfig {
        if (header == null) {
            throw new IllegalArgumentException("schema configuration requires a header section");
        }
    }

    public Optional<EntitySchema> resourcesSchema() {
        return Optional.ofNullable(resources);
    }

    public Optional<EntitySchema> layoutObjectsSchema() {
        return Optional.ofNullable(layoutObjects);
    }

    public Optional<EntitySchema> layoutSchema() {
        return Optional.ofNullable(layout);
    }

    public Optional<EntitySchema> partTypesSchema() {
        return Optional.ofNullable(partTypes);
    }
}
