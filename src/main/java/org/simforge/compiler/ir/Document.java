package org.simforge.compiler.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Root aggregate of the intermediate representation.
 * <p>
 * The document exclusively owns all entity collections. Entities never point back
 * to the document; cross references are plain identifiers resolved through the
 * accessor methods here. Instances are immutable and built via {@link Builder}.
 */
public final class Document {

    private final DocumentHeader header;
    private final Map<String, Resource> resources;
    private final List<Connection> connections;
    private final Map<String, LayoutObject> layoutObjects;
    private final Layout layout;
    private final Map<String, PartType> partTypes;

    private Document(Builder builder, Map<String, Resource> resources) {
        this.header = builder.header;
        this.resources = Collections.unmodifiableMap(resources);
        this.connections = List.copyOf(builder.connections);
        this.layoutObjects = Collections.unmodifiableMap(new LinkedHashMap<>(builder.layoutObjects));
        this.layout = builder.layout;
        this.partTypes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.partTypes));
    }

    public DocumentHeader header() {
        return header;
    }

    public String identifier() {
        return header.identifier();
    }

    public Map<String, Resource> resources() {
        return resources;
    }

    public List<Connection> connections() {
        return connections;
    }

    public Map<String, LayoutObject> layoutObjects() {
        return layoutObjects;
    }

    public Optional<Layout> layout() {
        return Optional.ofNullable(layout);
    }

    public Map<String, PartType> partTypes() {
        return partTypes;
    }

    public Optional<Resource> resource(String resourceId) {
        return Optional.ofNullable(resources.get(resourceId));
    }

    public Optional<LayoutObject> layoutObject(String layoutObjectId) {
        return Optional.ofNullable(layoutObjects.get(layoutObjectId));
    }

    public Optional<Placement> placement(String layoutElementId) {
        if (layout == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(layout.placements().get(layoutElementId));
    }

    public Optional<PartType> partType(String partTypeId) {
        return Optional.ofNullable(partTypes.get(partTypeId));
    }

    /**
     * @return The outgoing connection targets of a resource, or an empty list for unknown ids.
     */
    public List<String> resourceConnections(String resourceId) {
        Resource resource = resources.get(resourceId);
        return resource == null ? List.of() : resource.connections();
    }

    public static Builder builder(DocumentHeader header) {
        return new Builder(header);
    }

    /**
     * Collects parsed entities. {@link #build()} derives each resource's outgoing
     * connections once all connections are known.
     */
    public static final class Builder {
        private final DocumentHeader header;
        private final Map<String, Resource> resources = new LinkedHashMap<>();
        private final List<Connection> connections = new ArrayList<>();
        private final Map<String, LayoutObject> layoutObjects = new LinkedHashMap<>();
        private final Map<String, PartType> partTypes = new LinkedHashMap<>();
        private Layout layout;

        private Builder(DocumentHeader header) {
            this.header = header;
        }

        public Builder resource(Resource resource) {
            resources.put(resource.identifier(), resource);
            return this;
        }

        public Builder connection(Connection connection) {
            connections.add(connection);
            return this;
        }

        public Builder layoutObject(LayoutObject layoutObject) {
            layoutObjects.put(layoutObject.identifier(), layoutObject);
            return this;
        }

        public Builder partType(PartType partType) {
            partTypes.put(partType.identifier(), partType);
            return this;
        }

        public Builder layout(Layout layout) {
            this.layout = layout;
            return this;
        }

        public Document build() {
            Map<String, List<String>> outgoing = new LinkedHashMap<>();
            for (Connection c : connections) {
                if (resources.containsKey(c.fromResourceId())) {
                    outgoing.computeIfAbsent(c.fromResourceId(), k -> new ArrayList<>()).add(c.toResourceId());
                }
            }
            Map<String, Resource> linked = new LinkedHashMap<>();
            resources.forEach((id, r) -> linked.put(id, r.withConnections(outgoing.getOrDefault(id, List.of()))));
            return new Document(this, linked);
        }
    }
}
