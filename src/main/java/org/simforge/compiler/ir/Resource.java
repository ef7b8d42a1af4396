package org.simforge.compiler.ir;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * A logical entity of the layout, e.g. a machine, conveyor, source or sink.
 * <p>
 * Property lookup is case-insensitive through a lower-cased index built once at
 * construction. The outgoing {@link #connections()} are derived from the document's
 * connection list after parsing and attached with {@link #withConnections(List)}.
 */
public final class Resource {

    public static final String DEFAULT_STATUS = "idle";

    private final String identifier;
    private final String resourceType;
    private final String name;
    private final String description;
    private final String currentStatus;
    private final String resourceClassIdentifier;
    private final Map<String, Property> properties;
    private final Map<String, Property> propertiesByLowerName;
    private final List<String> connections;

    public Resource(String identifier,
                    String resourceType,
                    String name,
                    String description,
                    String currentStatus,
                    String resourceClassIdentifier,
                    Map<String, Property> properties) {
        this(identifier, resourceType, name, description, currentStatus, resourceClassIdentifier, properties, List.of());
    }

    private Resource(String identifier,
                     String resourceType,
                     String name,
                     String description,
                     String currentStatus,
                     String resourceClassIdentifier,
                     Map<String, Property> properties,
                     List<String> connections) {
        this.identifier = identifier;
        this.resourceType = resourceType == null ? "" : resourceType;
        this.name = name == null ? "" : name;
        this.description = description == null ? "" : description;
        this.currentStatus = currentStatus == null || currentStatus.isEmpty() ? DEFAULT_STATUS : currentStatus;
        this.resourceClassIdentifier = resourceClassIdentifier == null || resourceClassIdentifier.isEmpty()
                ? null : resourceClassIdentifier;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        Map<String, Property> index = new HashMap<>();
        for (Property p : this.properties.values()) {
            // first spelling wins if a document repeats a name in different case
            index.putIfAbsent(p.name().toLowerCase(Locale.ROOT), p);
        }
        this.propertiesByLowerName = Collections.unmodifiableMap(index);
        this.connections = List.copyOf(connections);
    }

    /**
     * Returns a copy of this resource with the given outgoing connection targets.
     */
    public Resource withConnections(List<String> targetResourceIds) {
        return new Resource(identifier, resourceType, name, description, currentStatus,
                resourceClassIdentifier, properties, targetResourceIds);
    }

    public String identifier() {
        return identifier;
    }

    public String resourceType() {
        return resourceType;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public String currentStatus() {
        return currentStatus;
    }

    public Optional<String> resourceClassIdentifier() {
        return Optional.ofNullable(resourceClassIdentifier);
    }

    /**
     * @return All properties keyed by the name as written in the document.
     */
    public Map<String, Property> properties() {
        return properties;
    }

    /**
     * Looks up a property ignoring case.
     *
     * @param propertyName The name to look up.
     * @return The property, or empty if the resource has none with that name.
     */
    public Optional<Property> property(String propertyName) {
        if (propertyName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(propertiesByLowerName.get(propertyName.toLowerCase(Locale.ROOT)));
    }

    /**
     * Looks up a property value ignoring case.
     */
    public Optional<String> propertyValue(String propertyName) {
        return property(propertyName).map(Property::value);
    }

    public boolean hasProperty(String propertyName) {
        return property(propertyName).isPresent();
    }

    /**
     * @return Identifiers of the resources this one feeds, in document order.
     */
    public List<String> connections() {
        return connections;
    }

    @Override
    public String toString() {
        return "Resource[" + identifier + ", type=" + resourceType + ", name=" + name + "]";
    }
}
