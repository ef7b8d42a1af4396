package org.simforge.compiler.backend.remote;

import com.typesafe.config.Config;

import java.net.URI;
import java.time.Duration;

/**
 * Settings of the command bridge the remote backend talks to.
 *
 * @param endpoint        The URI commands are posted to.
 * @param connectTimeout  Timeout for establishing the connection.
 * @param requestTimeout  Timeout for a single command round trip.
 * @param verifyTemplates Whether template existence is checked before deriving.
 */
public record RemoteSettings(URI endpoint, Duration connectTimeout, Duration requestTimeout, boolean verifyTemplates) {

    public static final RemoteSettings DEFAULTS = new RemoteSettings(
            URI.create("http://localhost:8765/simtalk"), Duration.ofSeconds(5), Duration.ofSeconds(30), false);

    /**
     * @param remote The {@code simforge.backend.remote} section.
     */
    public static RemoteSettings fromConfig(Config remote) {
        return new RemoteSettings(
                remote.hasPath("endpoint") ? URI.create(remote.getString("endpoint")) : DEFAULTS.endpoint(),
                remote.hasPath("connect-timeout") ? remote.getDuration("connect-timeout") : DEFAULTS.connectTimeout(),
                remote.hasPath("request-timeout") ? remote.getDuration("request-timeout") : DEFAULTS.requestTimeout(),
                remote.hasPath("verify-templates") ? remote.getBoolean("verify-templates") : DEFAULTS.verifyTemplates());
    }
}
