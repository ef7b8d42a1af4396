package org.simforge.compiler.mapping.rules;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The declarative mapping configuration: one {@link ResourceRule} per resource type plus the
 * global unit conversion, range validation and naming sections.
 */
public final class RuleTable {

    private final Map<String, ResourceRule> resourceRules;
    private final Map<String, UnitCategory> unitCategories;
    private final Map<String, ValueRange> ranges;
    private final NamingRules namingRules;

    public RuleTable(List<ResourceRule> resourceRules,
                     List<UnitCategory> unitCategories,
                     Map<String, ValueRange> ranges,
                     NamingRules namingRules) {
        Map<String, ResourceRule> rules = new LinkedHashMap<>();
        for (ResourceRule rule : resourceRules) {
            rules.put(rule.resourceType().toLowerCase(Locale.ROOT), rule);
        }
        this.resourceRules = Collections.unmodifiableMap(rules);

        Map<String, UnitCategory> categories = new LinkedHashMap<>();
        for (UnitCategory category : unitCategories) {
            categories.put(category.name(), category);
        }
        this.unitCategories = Collections.unmodifiableMap(categories);

        Map<String, ValueRange> lowered = new LinkedHashMap<>();
        ranges.forEach((k, v) -> lowered.put(k.toLowerCase(Locale.ROOT), v));
        this.ranges = Collections.unmodifiableMap(lowered);
        this.namingRules = namingRules;
    }

    /**
     * Finds the rule for a resource type. The type is matched case-insensitively against rule
     * names first, then against rule aliases.
     *
     * @param resourceType The resource type from the document.
     * @return The matching rule, or empty if the type is not mapped.
     */
    public Optional<ResourceRule> lookup(String resourceType) {
        if (resourceType == null) {
            return Optional.empty();
        }
        String key = resourceType.toLowerCase(Locale.ROOT);
        ResourceRule direct = resourceRules.get(key);
        if (direct != null) {
            return Optional.of(direct);
        }
        return resourceRules.values().stream()
                .filter(r -> r.alias().map(a -> a.equalsIgnoreCase(resourceType)).orElse(false))
                .findFirst();
    }

    public Map<String, ResourceRule> resourceRules() {
        return resourceRules;
    }

    public Optional<UnitCategory> unitCategory(String name) {
        return Optional.ofNullable(unitCategories.get(name));
    }

    public Map<String, UnitCategory> unitCategories() {
        return unitCategories;
    }

    /**
     * @return The range for the given source property name, matched case-insensitively.
     */
    public Optional<ValueRange> range(String propertyName) {
        return Optional.ofNullable(ranges.get(propertyName.toLowerCase(Locale.ROOT)));
    }

    public NamingRules namingRules() {
        return namingRules;
    }
}
