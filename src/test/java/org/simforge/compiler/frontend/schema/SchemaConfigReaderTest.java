package org.simforge.compiler.frontend.schema;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SchemaConfigReaderTest {

    @Test
    void readsNestedChildSchemasAndOmitsUnconfiguredSections() {
        Config config = ConfigFactory.parseString("""
                header { path = "Head", fields { document-identifier = "Id" } }
                resources {
                  path = ".//Res"
                  fields { identifier = "Id" }
                  properties { path = "Prop", fields { name = "N", value = "V" } }
                  comment = "ignored"
                }
                """);

        SchemaConfig schema = SchemaConfigReader.read(config);

        assertThat(schema.header().field(SchemaConfig.DOCUMENT_IDENTIFIER)).isEqualTo("Id");
        assertThat(schema.header().field(SchemaConfig.VERSION)).isEmpty();
        EntitySchema resources = schema.resourcesSchema().orElseThrow();
        assertThat(resources.path()).isEqualTo(".//Res");
        assertThat(resources.child(SchemaConfig.PROPERTIES)).hasValueSatisfying(p -> {
            assertThat(p.path()).isEqualTo("Prop");
            assertThat(p.field(SchemaConfig.VALUE)).isEqualTo("V");
        });
        assertThat(resources.children()).containsOnlyKeys(SchemaConfig.PROPERTIES);
        assertThat(schema.layoutSchema()).isEmpty();
        assertThat(schema.partTypesSchema()).isEmpty();
    }

    @Test
    void headerSectionIsMandatory() {
        assertThatThrownBy(() -> SchemaConfigReader.read(ConfigFactory.parseString("resources { path = \"R\" }")))
                .isInstanceOf(ConfigException.Missing.class);
    }
}
