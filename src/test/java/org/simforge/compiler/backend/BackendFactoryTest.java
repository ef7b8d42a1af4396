package org.simforge.compiler.backend;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.simforge.compiler.backend.inprocess.InMemoryObjectModel;
import org.simforge.compiler.backend.inprocess.InProcessBackend;
import org.simforge.compiler.backend.recording.RecordingBackend;
import org.simforge.compiler.backend.remote.RemoteBackend;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link BackendFactory}, {@link BackendSettings} and {@link TemplateResolver}.
 */
@Tag("unit")
class BackendFactoryTest {

    private static Config backendConfig(String overrides) {
        return ConfigFactory.parseString(overrides)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .getConfig("simforge.backend");
    }

    @Test
    void defaultConfigurationCreatesRecordingBackend() {
        IBackend backend = BackendFactory.create(backendConfig(""));

        assertThat(backend).isInstanceOf(RecordingBackend.class);
        assertThat(backend.settings().templates()).containsEntry("Line", ".MaterialFlow.Line");
        assertThat(backend.settings().remote().requestTimeout()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void remoteTypeCreatesRemoteBackend() {
        IBackend backend = BackendFactory.create(backendConfig(
                "simforge.backend { type = remote, remote.endpoint = \"http://sim:9000/cmd\" }"));

        assertThat(backend).isInstanceOf(RemoteBackend.class);
        assertThat(backend.settings().remote().endpoint().getHost()).isEqualTo("sim");
    }

    @Test
    void inProcessBackendGetsDefaultModelWithTemplates() throws Exception {
        IBackend backend = BackendFactory.create(backendConfig("simforge.backend.type = in-process"));

        assertThat(backend).isInstanceOf(InProcessBackend.class);
        InMemoryObjectModel model = (InMemoryObjectModel) ((InProcessBackend) backend).model();
        assertThat(model.exists(".Models.Model")).isTrue();
        assertThat(model.exists(".UserObjects.PartA")).isTrue();
        assertThat(backend.resolveTemplate("Station").path()).isEqualTo(".MaterialFlow.Station");
    }

    @Test
    void explicitNativeModelIsUsed() {
        InMemoryObjectModel model = new InMemoryObjectModel();

        IBackend backend = BackendFactory.create(BackendSettings.defaults(BackendType.IN_PROCESS), model);

        assertThat(((InProcessBackend) backend).model()).isSameAs(model);
    }

    @Test
    void unknownTypeIsRejected() {
        assertThatThrownBy(() -> BackendFactory.create(backendConfig("simforge.backend.type = plant-sim-com")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown simforge.backend.type: plant-sim-com");
    }

    @Test
    void templateResolverPrefersConfiguredPath() {
        TemplateResolver resolver = new TemplateResolver(BackendSettings.fromConfig(backendConfig("")));

        assertThat(resolver.resolve("Source")).isEqualTo(".MaterialFlow.Source");
        assertThat(resolver.resolve("Gantry")).isEqualTo(".UserObjects.Gantry");
    }

    @Test
    void handlesExposeNameAndRejectBlankPaths() {
        Handle handle = new Handle(".Models.Model").child("Drill_1");

        assertThat(handle.name()).isEqualTo("Drill_1");
        assertThat(handle).hasToString(".Models.Model.Drill_1");
        assertThatThrownBy(() -> new Handle(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
