package org.simforge.compiler.backend.remote;

import org.simforge.compiler.backend.BackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;

/**
 * Posts SimTalk commands as plain text to an HTTP command bridge. The response body is the
 * command result; any non-2xx status is a rejected command.
 */
public class HttpCommandChannel implements ICommandChannel {

    private static final Logger LOG = LoggerFactory.getLogger(HttpCommandChannel.class);

    private final RemoteSettings settings;
    private final HttpClient client;

    public HttpCommandChannel(RemoteSettings settings) {
        this(settings, HttpClient.newBuilder().connectTimeout(settings.connectTimeout()).build());
    }

    HttpCommandChannel(RemoteSettings settings, HttpClient client) {
        this.settings = settings;
        this.client = client;
    }

    @Override
    public String execute(String command) throws BackendException {
        final HttpRequest request = HttpRequest.newBuilder()
                .uri(settings.endpoint())
                .timeout(settings.requestTimeout())
                .header("Content-Type", "text/plain; charset=utf-8")
                .POST(HttpRequest.BodyPublishers.ofString(command, StandardCharsets.UTF_8))
                .build();

        LOG.debug("-> {}", command);
        try {
            final HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() / 100 != 2) {
                throw new BackendException("Command bridge responded with status " + response.statusCode()
                        + " to '" + command + "': " + response.body());
            }
            LOG.debug("<- {}", response.body());
            return response.body() == null ? "" : response.body();
        } catch (IOException e) {
            throw new BackendException("Failed to reach command bridge at " + settings.endpoint() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException("Interrupted while executing '" + command + "'", e);
        }
    }
}
