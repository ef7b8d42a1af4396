package org.simforge.compiler.mapping;

import org.simforge.compiler.diagnostics.Diagnostic;
import org.simforge.compiler.ir.LayoutObject;
import org.simforge.compiler.ir.Placement;
import org.simforge.compiler.ir.Resource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything needed to create one target object for a resource: the template, the mapped
 * properties in application order, and the problems found while mapping.
 */
public final class ObjectMapping {

    public static final String NAME_PROPERTY = "name";
    private static final String ENTITY_KIND = "Resource";

    private final Resource resource;
    private final LayoutObject layoutObject;
    private final Placement placement;
    private final String template;
    private final Map<String, MappedProperty> properties = new LinkedHashMap<>();
    private final List<Diagnostic> errors = new ArrayList<>();
    private final List<Diagnostic> warnings = new ArrayList<>();

    public ObjectMapping(Resource resource, LayoutObject layoutObject, Placement placement, String template) {
        this.resource = resource;
        this.layoutObject = layoutObject;
        this.placement = placement;
        this.template = template;
    }

    /**
     * Adds a property. A later property with the same name replaces the earlier value but keeps its position.
     */
    public void addProperty(String name, Object value, PropertyKind kind) {
        properties.put(name, new MappedProperty(name, value, kind));
    }

    public void addError(String message) {
        errors.add(new Diagnostic(Diagnostic.Severity.ERROR, Diagnostic.Category.MAPPING,
                message, ENTITY_KIND, resource.identifier(), null));
    }

    public void addWarning(String message) {
        warnings.add(new Diagnostic(Diagnostic.Severity.WARNING, Diagnostic.Category.MAPPING,
                message, ENTITY_KIND, resource.identifier(), null));
    }

    public Resource resource() {
        return resource;
    }

    public String resourceId() {
        return resource.identifier();
    }

    public LayoutObject layoutObject() {
        return layoutObject;
    }

    public Optional<Placement> placement() {
        return Optional.ofNullable(placement);
    }

    /**
     * @return The template name, or empty if the rule for this resource type names none.
     */
    public Optional<String> template() {
        return Optional.ofNullable(template).filter(t -> !t.isBlank());
    }

    /**
     * @return Mapped properties in application order.
     */
    public List<MappedProperty> properties() {
        return List.copyOf(properties.values());
    }

    public Optional<MappedProperty> property(String name) {
        return Optional.ofNullable(properties.get(name));
    }

    /**
     * @return The mapped object name. Without one, the raw resource name or, if that is empty, the resource identifier.
     */
    public String objectName() {
        MappedProperty name = properties.get(NAME_PROPERTY);
        if (name != null) {
            return String.valueOf(name.value());
        }
        return resource.name() == null || resource.name().isEmpty() ? resource.identifier() : resource.name();
    }

    public List<Diagnostic> errors() {
        return Collections.unmodifiableList(errors);
    }

    public List<Diagnostic> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    @Override
    public String toString() {
        return "ObjectMapping{" + resource.identifier() + " -> " + template + ", " + properties.size() + " properties}";
    }
}
