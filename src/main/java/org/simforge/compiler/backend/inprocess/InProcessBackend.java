package org.simforge.compiler.backend.inprocess;

import org.simforge.compiler.backend.BackendException;
import org.simforge.compiler.backend.BackendSettings;
import org.simforge.compiler.backend.Handle;
import org.simforge.compiler.backend.IBackend;
import org.simforge.compiler.backend.TemplateResolver;

import java.util.List;

/**
 * Creates objects through an {@link INativeObjectModel} in the same process.
 */
public class InProcessBackend implements IBackend {

    private final BackendSettings settings;
    private final INativeObjectModel model;
    private final TemplateResolver templateResolver;

    public InProcessBackend(BackendSettings settings, INativeObjectModel model) {
        this.settings = settings;
        this.model = model;
        this.templateResolver = new TemplateResolver(settings);
    }

    /**
     * Creates an in-memory model containing the configured framework objects. Templates still
     * have to be registered on the returned model.
     */
    public static InMemoryObjectModel frameworkModel(BackendSettings settings) {
        return new InMemoryObjectModel()
                .register(settings.modelFrame())
                .register(settings.connector())
                .register(settings.userObjects())
                .register(settings.materialUnitTemplatePath());
    }

    @Override
    public Handle resolveTemplate(String name) throws BackendException {
        String path = templateResolver.resolve(name);
        if (!model.exists(path)) {
            throw new BackendException("Template '" + name + "' not found at " + path);
        }
        return new Handle(path);
    }

    @Override
    public Handle derive(Handle template, Handle parent, String name) throws BackendException {
        try {
            return new Handle(model.derive(template.path(), parent.path(), name));
        } catch (NativeModelException e) {
            throw new BackendException("Failed to derive " + name + " from " + template + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void setProperty(Handle object, String path, Object value) throws BackendException {
        try {
            model.setAttribute(object.path(), path, toNative(value));
        } catch (NativeModelException e) {
            throw new BackendException("Failed to set " + object + "." + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void connect(Handle connector, Handle from, Handle to) throws BackendException {
        try {
            model.connect(connector.path(), from.path(), to.path());
        } catch (NativeModelException e) {
            throw new BackendException("Failed to connect " + from + " -> " + to + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Handle scope(String path) {
        return new Handle(path);
    }

    @Override
    public BackendSettings settings() {
        return settings;
    }

    public INativeObjectModel model() {
        return model;
    }

    private static Object toNative(Object value) {
        if (value instanceof Handle h) {
            return h.path();
        }
        if (value instanceof List<?> list) {
            return list.stream().map(InProcessBackend::toNative).toList();
        }
        return value;
    }
}
