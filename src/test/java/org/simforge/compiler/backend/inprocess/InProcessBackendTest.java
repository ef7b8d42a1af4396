package org.simforge.compiler.backend.inprocess;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.simforge.compiler.backend.BackendException;
import org.simforge.compiler.backend.BackendSettings;
import org.simforge.compiler.backend.BackendType;
import org.simforge.compiler.backend.Handle;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InProcessBackend} on top of {@link InMemoryObjectModel}.
 */
@Tag("unit")
class InProcessBackendTest {

    private final BackendSettings settings = BackendSettings.defaults(BackendType.IN_PROCESS);
    private InMemoryObjectModel model;
    private InProcessBackend backend;

    @BeforeEach
    void setUp() {
        model = InProcessBackend.frameworkModel(settings).register(".UserObjects.Station");
        backend = new InProcessBackend(settings, model);
    }

    @Test
    void createsObjectsWithAttributesAndConnections() throws Exception {
        // Arrange
        Handle frame = backend.scope(settings.modelFrame());
        Handle template = backend.resolveTemplate("Station");

        // Act
        Handle a = backend.derive(template, frame, "A");
        Handle b = backend.derive(template, frame, "B");
        backend.setProperty(a, "MU", new Handle(".UserObjects.PartA"));
        backend.setProperty(a, "Refs", List.of(new Handle(".Models.Model.B"), 2.0));
        backend.connect(backend.scope(settings.connector()), a, b);

        // Assert
        assertThat(model.children(".Models.Model")).extracting(InMemoryObjectModel.ModelObject::path)
                .containsExactly(".Models.Model.A", ".Models.Model.B");
        InMemoryObjectModel.ModelObject created = model.object(".Models.Model.A").orElseThrow();
        assertThat(created.templatePath()).contains(".UserObjects.Station");
        assertThat(created.attribute("MU")).contains(".UserObjects.PartA");
        assertThat(created.attribute("Refs")).contains(List.of(".Models.Model.B", 2.0));
        assertThat(model.connections()).containsExactly(new InMemoryObjectModel.ModelConnection(
                ".MaterialFlow.Connector", ".Models.Model.A", ".Models.Model.B"));
    }

    @Test
    void unknownTemplateIsBackendException() {
        assertThatThrownBy(() -> backend.resolveTemplate("Gantry"))
                .isInstanceOf(BackendException.class)
                .hasMessage("Template 'Gantry' not found at .UserObjects.Gantry");
    }

    @Test
    void duplicateObjectIsWrappedNativeFailure() throws Exception {
        Handle template = backend.resolveTemplate("Station");
        backend.derive(template, backend.scope(".Models.Model"), "A");

        assertThatThrownBy(() -> backend.derive(template, backend.scope(".Models.Model"), "A"))
                .isInstanceOf(BackendException.class)
                .hasCauseInstanceOf(NativeModelException.class)
                .hasMessageContaining("Object .Models.Model.A already exists");
    }

    @Test
    void settingAttributeOnMissingObjectFails() {
        assertThatThrownBy(() -> backend.setProperty(new Handle(".Models.Model.Ghost"), "Speed", 1.0))
                .isInstanceOf(BackendException.class)
                .hasMessageContaining("Object .Models.Model.Ghost does not exist");
    }

    @Test
    void connectingToMissingObjectFails() throws Exception {
        Handle a = backend.derive(backend.resolveTemplate("Station"), backend.scope(".Models.Model"), "A");

        assertThatThrownBy(() -> backend.connect(backend.scope(settings.connector()), a, new Handle(".Models.Model.Z")))
                .isInstanceOf(BackendException.class)
                .hasMessageContaining("Target object .Models.Model.Z does not exist");
        assertThat(model.connections()).isEmpty();
    }
}
