package org.simforge.compiler.mapping.rules;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a {@link RuleTable} from the {@code simforge.mapping} configuration section.
 * <p>
 * Keys below {@code resource-mappings}, {@code properties}, {@code unit-conversions} and
 * {@code ranges} are read as object keys, so they may contain characters HOCON treats as path
 * separators when quoted. Keys are visited in the order they appear in the configuration source.
 */
public final class RuleTableReader {

    private RuleTableReader() {
        // Private constructor to prevent instantiation
    }

    /**
     * @param mapping The {@code simforge.mapping} section.
     * @return The typed rule table.
     * @throws ConfigException if a required key is missing or has the wrong type.
     * @throws IllegalArgumentException if an enumerated value (data type, case handling) is unknown.
     */
    public static RuleTable read(Config mapping) {
        List<ResourceRule> rules = new ArrayList<>();
        if (mapping.hasPath("resource-mappings")) {
            ConfigObject resourceMappings = mapping.getObject("resource-mappings");
            for (String type : orderedKeys(resourceMappings)) {
                Config ruleConfig = object(resourceMappings.get(type), "resource-mappings." + type);
                rules.add(readResourceRule(type, ruleConfig));
            }
        }

        List<UnitCategory> categories = new ArrayList<>();
        if (mapping.hasPath("unit-conversions")) {
            ConfigObject conversions = mapping.getObject("unit-conversions");
            for (String name : orderedKeys(conversions)) {
                Config categoryConfig = object(conversions.get(name), "unit-conversions." + name);
                Map<String, Double> factors = new LinkedHashMap<>();
                if (categoryConfig.hasPath("conversions")) {
                    ConfigObject factorObject = categoryConfig.getObject("conversions");
                    for (String unit : orderedKeys(factorObject)) {
                        factors.put(unit, number(factorObject.get(unit), "unit-conversions." + name + ".conversions." + unit));
                    }
                }
                categories.add(new UnitCategory(name, categoryConfig.getString("base-unit"), factors));
            }
        }

        Map<String, ValueRange> ranges = new LinkedHashMap<>();
        if (mapping.hasPath("property-validation.ranges")) {
            ConfigObject rangeObject = mapping.getObject("property-validation.ranges");
            for (String property : orderedKeys(rangeObject)) {
                ConfigValue value = rangeObject.get(property);
                if (value.valueType() != ConfigValueType.LIST) {
                    throw new ConfigException.WrongType(value.origin(), "property-validation.ranges." + property, "LIST", value.valueType().name());
                }
                List<?> bounds = (List<?>) value.unwrapped();
                if (bounds.size() != 2 || !(bounds.get(0) instanceof Number) || !(bounds.get(1) instanceof Number)) {
                    throw new ConfigException.BadValue(value.origin(), "property-validation.ranges." + property, "expected [min, max]");
                }
                ranges.put(property, new ValueRange(((Number) bounds.get(0)).doubleValue(), ((Number) bounds.get(1)).doubleValue()));
            }
        }

        NamingRules naming = mapping.hasPath("naming") ? readNaming(mapping.getConfig("naming")) : NamingRules.DEFAULTS;
        return new RuleTable(rules, categories, ranges, naming);
    }

    private static ResourceRule readResourceRule(String type, Config config) {
        List<PropertyRule> properties = new ArrayList<>();
        if (config.hasPath("properties")) {
            ConfigObject propertyObject = config.getObject("properties");
            for (String source : orderedKeys(propertyObject)) {
                Config p = object(propertyObject.get(source), "resource-mappings." + type + ".properties." + source);
                properties.add(new PropertyRule(
                        source,
                        p.hasPath("target") ? p.getString("target") : source,
                        p.hasPath("data-type") ? DataType.fromConfigName(p.getString("data-type")) : DataType.STRING,
                        p.hasPath("unit-conversion") ? p.getString("unit-conversion") : null,
                        p.hasPath("special-handler") ? p.getString("special-handler") : null));
            }
        }

        Map<String, Object> defaults = new LinkedHashMap<>();
        if (config.hasPath("default-properties")) {
            ConfigObject defaultObject = config.getObject("default-properties");
            for (String key : orderedKeys(defaultObject)) {
                defaults.put(key, defaultObject.get(key).unwrapped());
            }
        }

        return new ResourceRule(
                type,
                config.hasPath("template") ? config.getString("template") : null,
                config.hasPath("alias") ? config.getString("alias") : null,
                properties,
                config.hasPath("required-properties") ? config.getStringList("required-properties") : List.of(),
                defaults);
    }

    private static NamingRules readNaming(Config naming) {
        NamingRules d = NamingRules.DEFAULTS;
        return new NamingRules(
                naming.hasPath("case-handling") ? NamingRules.CaseHandling.fromConfigName(naming.getString("case-handling")) : d.caseHandling(),
                naming.hasPath("invalid-chars") ? naming.getStringList("invalid-chars") : d.invalidChars(),
                naming.hasPath("replacement-char") ? naming.getString("replacement-char") : d.replacementChar(),
                naming.hasPath("max-length") ? naming.getInt("max-length") : d.maxLength(),
                naming.hasPath("digit-prefix") ? naming.getString("digit-prefix") : d.digitPrefix());
    }

    private static List<String> orderedKeys(ConfigObject object) {
        return object.keySet().stream()
                .sorted(Comparator.comparingInt((String key) -> object.get(key).origin().lineNumber())
                        .thenComparing(Comparator.naturalOrder()))
                .toList();
    }

    private static Config object(ConfigValue value, String path) {
        if (value instanceof ConfigObject o) {
            return o.toConfig();
        }
        throw new ConfigException.WrongType(value.origin(), path, "OBJECT", value.valueType().name());
    }

    private static double number(ConfigValue value, String path) {
        if (value.unwrapped() instanceof Number n) {
            return n.doubleValue();
        }
        throw new ConfigException.WrongType(value.origin(), path, "NUMBER", value.valueType().name());
    }
}
