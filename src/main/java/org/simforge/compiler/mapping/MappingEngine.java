package org.simforge.compiler.mapping;

import org.simforge.compiler.ir.Document;
import org.simforge.compiler.ir.LayoutObject;
import org.simforge.compiler.ir.Placement;
import org.simforge.compiler.ir.Position;
import org.simforge.compiler.ir.Property;
import org.simforge.compiler.ir.Resource;
import org.simforge.compiler.ir.Rotation;
import org.simforge.compiler.mapping.rules.DataType;
import org.simforge.compiler.mapping.rules.PropertyRule;
import org.simforge.compiler.mapping.rules.ResourceRule;
import org.simforge.compiler.mapping.rules.RuleTable;
import org.simforge.compiler.mapping.special.ISpecialHandler;
import org.simforge.compiler.mapping.special.MaterialUnitRegistry;
import org.simforge.compiler.mapping.special.SpecialHandlerContext;
import org.simforge.compiler.mapping.special.SpecialHandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Translates the resources of a document into {@link ObjectMapping}s using a {@link RuleTable}.
 * <p>
 * Problems with individual objects are attached to their mapping and never abort the run.
 * An engine holds the material unit labels of one run; use a new engine per document.
 */
public class MappingEngine {

    private static final Logger LOG = LoggerFactory.getLogger(MappingEngine.class);

    public static final String COORDINATE_PROPERTY = "Coordinate3D";
    public static final String ROTATION_PROPERTY = "_3D.Rotation";

    private final RuleTable rules;
    private final SpecialHandlerRegistry specialHandlers;
    private final NameSanitizer nameSanitizer;
    private final UnitConverter unitConverter;
    private final PropertyValidator validator;
    private final MaterialUnitRegistry materialUnits = new MaterialUnitRegistry();

    public MappingEngine(RuleTable rules) {
        this(rules, SpecialHandlerRegistry.initializeWithDefaults());
    }

    public MappingEngine(RuleTable rules, SpecialHandlerRegistry specialHandlers) {
        this.rules = rules;
        this.specialHandlers = specialHandlers;
        this.nameSanitizer = new NameSanitizer(rules.namingRules());
        this.unitConverter = new UnitConverter(rules);
        this.validator = new PropertyValidator(rules);
    }

    /**
     * Maps every layout object whose resource has a rule.
     *
     * @param document The validated document.
     * @return Mappings keyed by resource identifier, in layout object document order.
     */
    public Map<String, ObjectMapping> map(Document document) {
        Map<String, ObjectMapping> mappings = new LinkedHashMap<>();
        for (LayoutObject layoutObject : document.layoutObjects().values()) {
            Optional<Resource> resource = document.resource(layoutObject.associatedResourceId());
            if (resource.isEmpty()) {
                continue;
            }
            String resourceId = resource.get().identifier();
            if (mappings.containsKey(resourceId)) {
                LOG.warn("Resource '{}' is referenced by more than one layout object; ignoring '{}'",
                        resourceId, layoutObject.identifier());
                continue;
            }
            Placement placement = document.placement(layoutObject.identifier()).orElse(null);
            mapObject(resource.get(), layoutObject, placement).ifPresent(m -> mappings.put(resourceId, m));
        }

        long withErrors = mappings.values().stream().filter(ObjectMapping::hasErrors).count();
        LOG.info("Mapped {} objects ({} with errors), {} material units",
                mappings.size(), withErrors, materialUnits.labels().size());
        return mappings;
    }

    /**
     * @return Product type to material unit label, in first-seen order.
     */
    public Map<String, String> materialUnits() {
        return materialUnits.labels();
    }

    public NameSanitizer nameSanitizer() {
        return nameSanitizer;
    }

    private Optional<ObjectMapping> mapObject(Resource resource, LayoutObject layoutObject, Placement placement) {
        Optional<ResourceRule> rule = rules.lookup(resource.resourceType());
        if (rule.isEmpty()) {
            LOG.info("No mapping rule for resource type '{}', skipping resource '{}'",
                    resource.resourceType(), resource.identifier());
            return Optional.empty();
        }

        ObjectMapping mapping = new ObjectMapping(resource, layoutObject, placement, rule.get().template().orElse(null));
        mapBasicProperties(mapping, placement);
        mapConfiguredProperties(mapping, rule.get());
        mapRequiredProperties(mapping, rule.get());
        LOG.debug("Mapped {}", mapping);
        return Optional.of(mapping);
    }

    private void mapBasicProperties(ObjectMapping mapping, Placement placement) {
        if (placement == null) {
            mapping.addWarning("No placement information found");
            return;
        }
        Position p = placement.position();
        mapping.addProperty(COORDINATE_PROPERTY, List.of(p.x(), p.y(), p.z()), PropertyKind.LIST);
        placement.rotationValue().ifPresent(r -> mapping.addProperty(ROTATION_PROPERTY, rotationList(r), PropertyKind.LIST));
        mapping.addProperty(ObjectMapping.NAME_PROPERTY, nameSanitizer.sanitize(mapping.resource().name()), PropertyKind.VALUE);
    }

    private static List<Double> rotationList(Rotation r) {
        return List.of(r.angle(), r.axisX(), r.axisY(), r.axisZ());
    }

    private void mapConfiguredProperties(ObjectMapping mapping, ResourceRule rule) {
        for (PropertyRule propertyRule : rule.properties().values()) {
            Optional<Property> source = mapping.resource().property(propertyRule.sourceName());
            if (source.isEmpty()) {
                continue;
            }
            if (propertyRule.specialHandler() != null) {
                applySpecialHandler(mapping, source.get(), propertyRule);
            } else {
                mapSingleProperty(mapping, source.get(), propertyRule);
            }
        }
    }

    private void applySpecialHandler(ObjectMapping mapping, Property source, PropertyRule rule) {
        Optional<ISpecialHandler> handler = specialHandlers.get(rule.specialHandler());
        if (handler.isEmpty()) {
            mapping.addWarning("Unknown special handler: " + rule.specialHandler());
            return;
        }
        handler.get().handle(source, rule, new SpecialHandlerContext(mapping, materialUnits));
    }

    private void mapSingleProperty(ObjectMapping mapping, Property source, PropertyRule rule) {
        String text = source.value();
        if (rule.unitConversion() != null) {
            Optional<Double> numeric = source.numericValue();
            if (source.unitValue().isEmpty()) {
                mapping.addWarning(rule.sourceName() + ": no unit given for conversion category '"
                        + rule.unitConversion() + "'");
            } else if (numeric.isEmpty()) {
                mapping.addWarning(rule.sourceName() + ": non-numeric value '" + text
                        + "' cannot be converted from unit '" + source.unit() + "'");
            } else {
                UnitConverter.Result result = unitConverter.toBase(numeric.get(), source.unit(), rule.unitConversion());
                result.warning().ifPresent(w -> mapping.addWarning(rule.sourceName() + ": " + w));
                if (result.warning().isEmpty()) {
                    text = String.valueOf(result.value());
                }
            }
        }

        Object value = ValueCoercion.coerce(text, rule.dataType());
        Optional<String> violation = validator.validate(rule.sourceName(), text, value, rule.dataType());
        if (violation.isPresent()) {
            mapping.addError(violation.get());
            return;
        }
        mapping.addProperty(rule.target(), value, PropertyKind.VALUE);
    }

    private void mapRequiredProperties(ObjectMapping mapping, ResourceRule rule) {
        for (String required : rule.requiredProperties()) {
            if (mapping.resource().hasProperty(required)) {
                continue;
            }
            Optional<Object> defaultValue = rule.defaultValue(required);
            if (defaultValue.isEmpty()) {
                mapping.addError("Required property '" + required + "' not found and no default available");
                continue;
            }
            Optional<PropertyRule> propertyRule = rule.property(required);
            String target = propertyRule.map(PropertyRule::target).orElse(required);
            DataType type = propertyRule.map(PropertyRule::dataType)
                    .orElse(defaultValue.get() instanceof Number ? DataType.FLOAT : DataType.STRING);
            mapping.addProperty(target, ValueCoercion.coerce(defaultValue.get(), type), PropertyKind.VALUE);
            mapping.addWarning("Using default value for required property '" + required + "': " + defaultValue.get());
        }
    }
}
