package org.simforge.compiler.backend.remote;

import org.simforge.compiler.backend.BackendException;
import org.simforge.compiler.backend.BackendSettings;
import org.simforge.compiler.backend.Handle;
import org.simforge.compiler.backend.IBackend;
import org.simforge.compiler.backend.TemplateResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a live simulation engine by sending SimTalk commands through an {@link ICommandChannel}.
 */
public class RemoteBackend implements IBackend {

    private static final Logger LOG = LoggerFactory.getLogger(RemoteBackend.class);

    private final BackendSettings settings;
    private final ICommandChannel channel;
    private final TemplateResolver templateResolver;

    public RemoteBackend(BackendSettings settings, ICommandChannel channel) {
        this.settings = settings;
        this.channel = channel;
        this.templateResolver = new TemplateResolver(settings);
    }

    @Override
    public Handle resolveTemplate(String name) throws BackendException {
        String path = templateResolver.resolve(name);
        if (settings.remote().verifyTemplates()) {
            String result = channel.execute(SimTalkCommands.existsObject(path)).trim();
            if (!result.equalsIgnoreCase("true")) {
                throw new BackendException("Template '" + name + "' not found at " + path);
            }
        }
        return new Handle(path);
    }

    @Override
    public Handle derive(Handle template, Handle parent, String name) throws BackendException {
        channel.execute(SimTalkCommands.derive(template, parent, name));
        Handle created = parent.child(name);
        LOG.debug("Derived {} from {}", created, template);
        return created;
    }

    @Override
    public void setProperty(Handle object, String path, Object value) throws BackendException {
        channel.execute(SimTalkCommands.assign(object, path, value));
    }

    @Override
    public void connect(Handle connector, Handle from, Handle to) throws BackendException {
        channel.execute(SimTalkCommands.connect(connector, from, to));
    }

    @Override
    public Handle scope(String path) {
        return new Handle(path);
    }

    @Override
    public BackendSettings settings() {
        return settings;
    }
}
