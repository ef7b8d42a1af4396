package org.simforge.compiler.backend.remote;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.simforge.compiler.backend.BackendException;
import org.simforge.compiler.backend.BackendSettings;
import org.simforge.compiler.backend.BackendType;
import org.simforge.compiler.backend.Handle;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link RemoteBackend} with a mocked command channel.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
class RemoteBackendTest {

    @Mock
    private ICommandChannel channel;

    private static BackendSettings settings(boolean verifyTemplates) {
        BackendSettings d = BackendSettings.defaults(BackendType.REMOTE);
        return new BackendSettings(d.type(), d.modelFrame(), d.connector(), d.userObjects(),
                Map.of("Station", ".MaterialFlow.Station"), d.materialUnitTemplatePath(),
                new RemoteSettings(RemoteSettings.DEFAULTS.endpoint(), Duration.ofSeconds(1), Duration.ofSeconds(1), verifyTemplates));
    }

    @Test
    void resolvesTemplatesWithoutRoundTripByDefault() throws Exception {
        RemoteBackend backend = new RemoteBackend(settings(false), channel);

        assertThat(backend.resolveTemplate("Station")).isEqualTo(new Handle(".MaterialFlow.Station"));
        assertThat(backend.resolveTemplate("Gantry")).isEqualTo(new Handle(".UserObjects.Gantry"));
        verify(channel, never()).execute(anyString());
    }

    @Test
    void verifiesTemplateExistenceWhenEnabled() throws Exception {
        when(channel.execute("existsObject(\".MaterialFlow.Station\")")).thenReturn("true\n");
        when(channel.execute("existsObject(\".UserObjects.Gantry\")")).thenReturn("false");
        RemoteBackend backend = new RemoteBackend(settings(true), channel);

        assertThat(backend.resolveTemplate("Station").path()).isEqualTo(".MaterialFlow.Station");
        assertThatThrownBy(() -> backend.resolveTemplate("Gantry"))
                .isInstanceOf(BackendException.class)
                .hasMessage("Template 'Gantry' not found at .UserObjects.Gantry");
    }

    @Test
    void sendsOneCommandPerOperation() throws Exception {
        // Arrange
        RemoteBackend backend = new RemoteBackend(settings(false), channel);
        Handle frame = backend.scope(".Models.Model");

        // Act
        Handle created = backend.derive(new Handle(".MaterialFlow.Station"), frame, "Drill_1");
        backend.setProperty(created, "ProcTime", 30.0);
        backend.connect(backend.scope(".MaterialFlow.Connector"), created, frame.child("Exit"));

        // Assert
        assertThat(created).isEqualTo(new Handle(".Models.Model.Drill_1"));
        InOrder order = inOrder(channel);
        order.verify(channel).execute(".MaterialFlow.Station.derive(.Models.Model, \"Drill_1\")");
        order.verify(channel).execute(".Models.Model.Drill_1.ProcTime := 30.0");
        order.verify(channel).execute(".MaterialFlow.Connector.connect(.Models.Model.Drill_1, .Models.Model.Exit)");
    }

    @Test
    void propagatesChannelFailures() throws Exception {
        when(channel.execute(anyString())).thenThrow(new BackendException("bridge down"));
        RemoteBackend backend = new RemoteBackend(settings(false), channel);

        assertThatThrownBy(() -> backend.setProperty(new Handle(".Models.Model.A"), "Speed", 1.0))
                .isInstanceOf(BackendException.class)
                .hasMessage("bridge down");
    }
}
