package org.simforge.compiler.mapping.rules;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Mapping rule for one resource type.
 * <p>
 * Property rules keep their configured order; mapped properties are emitted in that order.
 */
public final class ResourceRule {

    private final String resourceType;
    private final String template;
    private final String alias;
    private final Map<String, PropertyRule> properties;
    private final List<String> requiredProperties;
    private final Map<String, Object> defaultProperties;

    public ResourceRule(String resourceType,
                        String template,
                        String alias,
                        List<PropertyRule> properties,
                        List<String> requiredProperties,
                        Map<String, Object> defaultProperties) {
        this.resourceType = resourceType;
        this.template = template;
        this.alias = alias;
        Map<String, PropertyRule> byName = new LinkedHashMap<>();
        for (PropertyRule rule : properties) {
            byName.put(rule.sourceName().toLowerCase(Locale.ROOT), rule);
        }
        this.properties = Collections.unmodifiableMap(byName);
        this.requiredProperties = List.copyOf(requiredProperties);
        this.defaultProperties = Collections.unmodifiableMap(new LinkedHashMap<>(defaultProperties));
    }

    public String resourceType() {
        return resourceType;
    }

    /**
     * @return The template name objects of this type are derived from, or empty if none is configured.
     */
    public Optional<String> template() {
        return Optional.ofNullable(template).filter(t -> !t.isBlank());
    }

    public Optional<String> alias() {
        return Optional.ofNullable(alias).filter(a -> !a.isBlank());
    }

    /**
     * @return Property rules keyed by lower-cased source name, in configured order.
     */
    public Map<String, PropertyRule> properties() {
        return properties;
    }

    public Optional<PropertyRule> property(String sourceName) {
        return Optional.ofNullable(properties.get(sourceName.toLowerCase(Locale.ROOT)));
    }

    public List<String> requiredProperties() {
        return requiredProperties;
    }

    public Map<String, Object> defaultProperties() {
        return defaultProperties;
    }

    public Optional<Object> defaultValue(String propertyName) {
        Object value = defaultProperties.get(propertyName);
        if (value == null) {
            for (Map.Entry<String, Object> e : defaultProperties.entrySet()) {
                if (e.getKey().equalsIgnoreCase(propertyName)) {
                    return Optional.of(e.getValue());
                }
            }
        }
        return Optional.ofNullable(value);
    }

    @Override
    public String toString() {
        return "ResourceRule{" + resourceType + " -> " + template + "}";
    }
}
