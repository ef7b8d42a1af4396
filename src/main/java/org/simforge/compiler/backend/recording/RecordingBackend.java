package org.simforge.compiler.backend.recording;

import org.simforge.compiler.backend.BackendException;
import org.simforge.compiler.backend.BackendSettings;
import org.simforge.compiler.backend.Handle;
import org.simforge.compiler.backend.IBackend;
import org.simforge.compiler.backend.TemplateResolver;
import org.simforge.compiler.backend.remote.SimTalkCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * A backend that performs nothing and records every call in order. Runs against it are
 * deterministic, which makes the call log suitable for comparing runs.
 * <p>
 * Without a set of resolvable templates every template resolves; with one, templates outside
 * the set fail to resolve.
 */
public class RecordingBackend implements IBackend {

    private static final Logger LOG = LoggerFactory.getLogger(RecordingBackend.class);

    private final BackendSettings settings;
    private final TemplateResolver templateResolver;
    private final Set<String> resolvableTemplates;
    private final List<RecordedCall> calls = new ArrayList<>();

    public RecordingBackend(BackendSettings settings) {
        this(settings, null);
    }

    /**
     * @param resolvableTemplates Template names that resolve, or {@code null} to resolve all.
     */
    public RecordingBackend(BackendSettings settings, Set<String> resolvableTemplates) {
        this.settings = settings;
        this.templateResolver = new TemplateResolver(settings);
        this.resolvableTemplates = resolvableTemplates == null ? null : Set.copyOf(resolvableTemplates);
    }

    @Override
    public Handle resolveTemplate(String name) throws BackendException {
        String path = templateResolver.resolve(name);
        record(RecordedCall.of(RecordedCall.Operation.RESOLVE_TEMPLATE, name, path));
        if (resolvableTemplates != null && !resolvableTemplates.contains(name)) {
            throw new BackendException("Template '" + name + "' not found at " + path);
        }
        return new Handle(path);
    }

    @Override
    public Handle derive(Handle template, Handle parent, String name) {
        record(RecordedCall.of(RecordedCall.Operation.DERIVE, template.path(), parent.path(), name));
        return parent.child(name);
    }

    @Override
    public void setProperty(Handle object, String path, Object value) {
        record(RecordedCall.of(RecordedCall.Operation.SET_PROPERTY, object.path(), path, SimTalkCommands.literal(value)));
    }

    @Override
    public void connect(Handle connector, Handle from, Handle to) {
        record(RecordedCall.of(RecordedCall.Operation.CONNECT, connector.path(), from.path(), to.path()));
    }

    @Override
    public Handle scope(String path) {
        return new Handle(path);
    }

    @Override
    public BackendSettings settings() {
        return settings;
    }

    /**
     * @return All calls so far, in order.
     */
    public List<RecordedCall> calls() {
        return Collections.unmodifiableList(calls);
    }

    public List<RecordedCall> calls(RecordedCall.Operation operation) {
        return calls.stream().filter(c -> c.operation() == operation).toList();
    }

    private void record(RecordedCall call) {
        LOG.debug("{}", call);
        calls.add(call);
    }
}
