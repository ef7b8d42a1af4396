package org.simforge.compiler.frontend.schema;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads a {@link SchemaConfig} from a HOCON subtree.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * schema {
 *   header { path = "{*}HeaderSection", fields { document-identifier = "{*}DocumentIdentifier" } }
 *   resources {
 *     path = ".//{*}Resource"
 *     fields { identifier = "{*}Identifier", name = "{*}Name" }
 *     properties { path = "{*}Property", fields { name = "{*}Name", value = "{*}Value" } }
 *   }
 * }
 * </pre>
 * Every key of an entity section other than {@code path} and {@code fields} that holds an
 * object is read as a nested child schema.
 */
public final class SchemaConfigReader {

    private static final String PATH_KEY = "path";
    private static final String FIELDS_KEY = "fields";

    private SchemaConfigReader() {
        // Private constructor to prevent instantiation
    }

    /**
     * @param schemaConfig The {@code schema} subtree.
     * @return The parsed schema configuration.
     * @throws com.typesafe.config.ConfigException.Missing if the header section is absent.
     */
    public static SchemaConfig read(final Config schemaConfig) {
        return new SchemaConfig(
                readEntity(schemaConfig.getConfig("header")),
                readOptional(schemaConfig, "resources"),
                readOptional(schemaConfig, "layout-objects"),
                readOptional(schemaConfig, "layout"),
                readOptional(schemaConfig, "part-types"));
    }

    private static EntitySchema readOptional(final Config parent, final String key) {
        return parent.hasPath(key) ? readEntity(parent.getConfig(key)) : null;
    }

    static EntitySchema readEntity(final Config section) {
        final String path = section.hasPath(PATH_KEY) ? section.getString(PATH_KEY) : "";

        final Map<String, String> fields = new LinkedHashMap<>();
        if (section.hasPath(FIELDS_KEY)) {
            final Config fieldsConfig = section.getConfig(FIELDS_KEY);
            for (final Map.Entry<String, ConfigValue> entry : fieldsConfig.root().entrySet()) {
                fields.put(entry.getKey(), entry.getValue().unwrapped().toString());
            }
        }

        final Map<String, EntitySchema> children = new LinkedHashMap<>();
        for (final Map.Entry<String, ConfigValue> entry : section.root().entrySet()) {
            final String key = entry.getKey();
            if (PATH_KEY.equals(key) || FIELDS_KEY.equals(key)) {
                continue;
            }
            if (entry.getValue().valueType() == ConfigValueType.OBJECT) {
                children.put(key, readEntity(section.getConfig(key)));
            }
        }
        return new EntitySchema(path, fields, children);
    }
}
