package org.simforge.compiler.frontend.schema;

import java.util.Map;
import java.util.Optional;

/**
 * Describes how to locate one kind of entity inside the source tree.
 *
 * @param path     Path of the entity elements, relative to the parent context. An empty
 *                 path designates the context element itself.
 * @param fields   Semantic field name to path of the field, relative to the entity element.
 * @param children Nested entity descriptions (e.g. a resource's properties), keyed by role.
 */
public record EntitySchema(String path, Map<String, String> fields, Map<String, EntitySchema> children) {

    public EntitySchema {
        path = path == null ? "" : path;
        fields = Map.copyOf(fields);
        children = Map.copyOf(children);
    }

    public static EntitySchema of(String path, Map<String, String> fields) {
        return new EntitySchema(path, fields, Map.of());
    }

    /**
     * @return The configured path for the field, or an empty string if the field is not mapped.
     */
    public String field(String name) {
        return fields.getOrDefault(name, "");
    }

    public Optional<EntitySchema> child(String role) {
        return Optional.ofNullable(children.get(role));
    }
}
