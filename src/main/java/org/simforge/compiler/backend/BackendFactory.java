package org.simforge.compiler.backend;

import com.typesafe.config.Config;
import org.simforge.compiler.backend.inprocess.INativeObjectModel;
import org.simforge.compiler.backend.inprocess.InMemoryObjectModel;
import org.simforge.compiler.backend.inprocess.InProcessBackend;
import org.simforge.compiler.backend.recording.RecordingBackend;
import org.simforge.compiler.backend.remote.HttpCommandChannel;
import org.simforge.compiler.backend.remote.RemoteBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Creates the backend selected by {@code simforge.backend.type}.
 */
public final class BackendFactory {

    private static final Logger LOG = LoggerFactory.getLogger(BackendFactory.class);

    private BackendFactory() {
        // Private constructor to prevent instantiation
    }

    /**
     * @param backend The {@code simforge.backend} section.
     */
    public static IBackend create(Config backend) {
        return create(BackendSettings.fromConfig(backend), null);
    }

    /**
     * Creates a backend. An in-process backend without a native model gets an in-memory model
     * holding the framework objects and every configured template.
     *
     * @param settings    The backend settings.
     * @param nativeModel The native model for the in-process backend, or {@code null}.
     */
    public static IBackend create(BackendSettings settings, INativeObjectModel nativeModel) {
        LOG.info("Using {} backend", settings.type().name().toLowerCase(Locale.ROOT));
        return switch (settings.type()) {
            case RECORDING -> new RecordingBackend(settings);
            case REMOTE -> new RemoteBackend(settings, new HttpCommandChannel(settings.remote()));
            case IN_PROCESS -> new InProcessBackend(settings, nativeModel != null ? nativeModel : defaultModel(settings));
        };
    }

    private static InMemoryObjectModel defaultModel(BackendSettings settings) {
        InMemoryObjectModel model = InProcessBackend.frameworkModel(settings);
        settings.templates().values().forEach(model::register);
        return model;
    }
}
