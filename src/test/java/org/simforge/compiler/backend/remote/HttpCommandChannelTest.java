package org.simforge.compiler.backend.remote;

import io.javalin.Javalin;
import io.javalin.testtools.JavalinTest;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.simforge.compiler.backend.BackendException;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Exercises {@link HttpCommandChannel} against a local fake command bridge.
 */
@Tag("integration")
class HttpCommandChannelTest {

    private static RemoteSettings settingsFor(int port) {
        return new RemoteSettings(URI.create("http://localhost:" + port + "/simtalk"),
                Duration.ofSeconds(2), Duration.ofSeconds(5), false);
    }

    @Test
    void postsCommandAndReturnsResponseBody() {
        List<String> received = new CopyOnWriteArrayList<>();
        Javalin app = Javalin.create();
        app.post("/simtalk", ctx -> {
            received.add(ctx.body());
            ctx.result("true");
        });

        JavalinTest.test(app, (server, client) -> {
            HttpCommandChannel channel = new HttpCommandChannel(settingsFor(server.port()));

            String result = channel.execute("existsObject(\".UserObjects.Grüße\")");

            assertThat(result).isEqualTo("true");
            assertThat(received).containsExactly("existsObject(\".UserObjects.Grüße\")");
        });
    }

    @Test
    void nonSuccessStatusIsRejectedCommand() {
        Javalin app = Javalin.create();
        app.post("/simtalk", ctx -> ctx.status(500).result("Unknown object .Models.Nope"));

        JavalinTest.test(app, (server, client) -> {
            HttpCommandChannel channel = new HttpCommandChannel(settingsFor(server.port()));

            assertThatThrownBy(() -> channel.execute(".Models.Nope.X := 1"))
                    .isInstanceOf(BackendException.class)
                    .hasMessageContaining("status 500")
                    .hasMessageContaining("Unknown object .Models.Nope");
        });
    }

    @Test
    void unreachableBridgeIsBackendException() {
        HttpCommandChannel channel = new HttpCommandChannel(new RemoteSettings(
                URI.create("http://127.0.0.1:9/simtalk"), Duration.ofSeconds(1), Duration.ofSeconds(1), false));

        assertThatThrownBy(() -> channel.execute("x"))
                .isInstanceOf(BackendException.class)
                .hasMessageStartingWith("Failed to reach command bridge at http://127.0.0.1:9/simtalk");
    }
}
