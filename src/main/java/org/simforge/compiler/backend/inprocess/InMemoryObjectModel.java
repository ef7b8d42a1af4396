package org.simforge.compiler.backend.inprocess;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A self-contained object model: a tree of named objects with attribute maps and a list of
 * connections. Objects must be registered (framework objects, templates) or derived before use.
 */
public class InMemoryObjectModel implements INativeObjectModel {

    /**
     * An object in the model.
     */
    public static final class ModelObject {
        private final String path;
        private final String templatePath;
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        ModelObject(String path, String templatePath) {
            this.path = path;
            this.templatePath = templatePath;
        }

        public String path() {
            return path;
        }

        /**
         * @return The template this object was derived from, or empty for registered objects.
         */
        public Optional<String> templatePath() {
            return Optional.ofNullable(templatePath);
        }

        public Map<String, Object> attributes() {
            return Collections.unmodifiableMap(attributes);
        }

        public Optional<Object> attribute(String attributePath) {
            return Optional.ofNullable(attributes.get(attributePath));
        }
    }

    /**
     * A connection created through a connector.
     */
    public record ModelConnection(String connectorPath, String fromPath, String toPath) {
    }

    private final Map<String, ModelObject> objects = new LinkedHashMap<>();
    private final List<ModelConnection> connections = new ArrayList<>();

    /**
     * Registers an existing object, such as a frame, a folder, a connector or a template.
     */
    public InMemoryObjectModel register(String path) {
        objects.putIfAbsent(path, new ModelObject(path, null));
        return this;
    }

    @Override
    public boolean exists(String path) {
        return objects.containsKey(path);
    }

    @Override
    public String derive(String templatePath, String parentPath, String name) throws NativeModelException {
        require(templatePath, "Template");
        require(parentPath, "Parent");
        String path = parentPath + "." + name;
        if (objects.containsKey(path)) {
            throw new NativeModelException("Object " + path + " already exists");
        }
        objects.put(path, new ModelObject(path, templatePath));
        return path;
    }

    @Override
    public void setAttribute(String objectPath, String attributePath, Object value) throws NativeModelException {
        require(objectPath, "Object").attributes.put(attributePath, value);
    }

    @Override
    public void connect(String connectorPath, String fromPath, String toPath) throws NativeModelException {
        require(connectorPath, "Connector");
        require(fromPath, "Source object");
        require(toPath, "Target object");
        connections.add(new ModelConnection(connectorPath, fromPath, toPath));
    }

    public Optional<ModelObject> object(String path) {
        return Optional.ofNullable(objects.get(path));
    }

    /**
     * @return Objects derived below {@code parentPath}, in creation order.
     */
    public List<ModelObject> children(String parentPath) {
        String prefix = parentPath + ".";
        return objects.values().stream()
                .filter(o -> o.path.startsWith(prefix) && o.path.indexOf('.', prefix.length()) < 0)
                .toList();
    }

    public List<ModelConnection> connections() {
        return Collections.unmodifiableList(connections);
    }

    private ModelObject require(String path, String role) throws NativeModelException {
        ModelObject object = objects.get(path);
        if (object == null) {
            throw new NativeModelException(role + " " + path + " does not exist");
        }
        return object;
    }
}
