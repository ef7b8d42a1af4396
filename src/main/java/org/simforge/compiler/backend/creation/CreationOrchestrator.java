package org.simforge.compiler.backend.creation;

import org.simforge.compiler.backend.BackendException;
import org.simforge.compiler.backend.BackendSettings;
import org.simforge.compiler.backend.Handle;
import org.simforge.compiler.backend.IBackend;
import org.simforge.compiler.diagnostics.Diagnostic;
import org.simforge.compiler.ir.Connection;
import org.simforge.compiler.ir.Document;
import org.simforge.compiler.mapping.MappedProperty;
import org.simforge.compiler.mapping.NameSanitizer;
import org.simforge.compiler.mapping.ObjectMapping;
import org.simforge.compiler.mapping.PropertyKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Creates the objects and connections of a mapped document through an {@link IBackend}.
 * <p>
 * Backend failures are handled per {@link ErrorCategory} according to the {@link ErrorPolicy}.
 * An orchestrator tracks the objects of one run; use a new instance per run.
 */
public class CreationOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(CreationOrchestrator.class);
    private static final String ENTITY_KIND = "Resource";

    private final IBackend backend;
    private final ErrorPolicy policy;
    private final NameSanitizer nameSanitizer;
    private final Handle modelFrame;
    private final Handle connector;
    private final Handle userObjects;
    private final Handle materialUnitTemplate;

    private final Map<String, Handle> createdObjects = new LinkedHashMap<>();
    private final List<CreatedConnection> createdConnections = new ArrayList<>();
    private final Map<String, Handle> materialUnitObjects = new LinkedHashMap<>();
    private final Set<String> usedNames = new HashSet<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final CreationStatistics statistics = new CreationStatistics();

    public CreationOrchestrator(IBackend backend, ErrorPolicy policy, NameSanitizer nameSanitizer) {
        this.backend = backend;
        this.policy = policy;
        this.nameSanitizer = nameSanitizer;
        BackendSettings settings = backend.settings();
        this.modelFrame = backend.scope(settings.modelFrame());
        this.connector = backend.scope(settings.connector());
        this.userObjects = backend.scope(settings.userObjects());
        this.materialUnitTemplate = backend.scope(settings.materialUnitTemplatePath());
    }

    /**
     * Creates one object per mapping, in map order, and applies its properties.
     *
     * @param mappings Mappings keyed by resource identifier.
     * @return Handles of the created objects keyed by resource identifier.
     * @throws CreationAbortedException if a failure occurs in a category set to {@link ErrorMode#ERROR_AND_STOP}.
     */
    public Map<String, Handle> createObjects(Map<String, ObjectMapping> mappings) throws CreationAbortedException {
        LOG.info("Creating {} objects", mappings.size());
        Map<String, Handle> created = new LinkedHashMap<>();
        for (ObjectMapping mapping : mappings.values()) {
            Handle handle = createObject(mapping);
            if (handle != null) {
                created.put(mapping.resourceId(), handle);
            }
        }
        return created;
    }

    /**
     * Connects the created objects along the document's connections, in document order.
     * Connections with an endpoint that was not created are skipped with a warning.
     *
     * @return The created connections in creation order.
     * @throws CreationAbortedException if a failure occurs in a category set to {@link ErrorMode#ERROR_AND_STOP}.
     */
    public List<CreatedConnection> createConnections(Document document) throws CreationAbortedException {
        LOG.info("Creating {} connections", document.connections().size());
        List<CreatedConnection> created = new ArrayList<>();
        for (Connection connection : document.connections()) {
            Handle from = createdObjects.get(connection.fromResourceId());
            Handle to = createdObjects.get(connection.toResourceId());
            if (from == null || to == null) {
                String missing = from == null ? connection.fromResourceId() : connection.toResourceId();
                LOG.warn("Skipping connection '{}': object for resource '{}' was not created",
                        connection.identifier(), missing);
                statistics.warning();
                continue;
            }
            try {
                backend.connect(connector, from, to);
                CreatedConnection c = new CreatedConnection(connection.fromResourceId(), connection.toResourceId());
                created.add(c);
                createdConnections.add(c);
                statistics.connectionCreated();
                LOG.debug("Connected {} -> {}", from, to);
            } catch (BackendException e) {
                handleError(ErrorCategory.CONNECTION, "Connection", connection.identifier(),
                        "Failed to create connection " + connection.fromResourceId() + " -> "
                                + connection.toResourceId() + ": " + e.getMessage(), e);
            }
        }
        return created;
    }

    /**
     * Checks the created objects. Every object without an incoming or outgoing connection yields a warning.
     */
    public PostCreationIssues validateCreatedObjects() {
        Set<String> connected = new HashSet<>();
        for (CreatedConnection c : createdConnections) {
            connected.add(c.fromResourceId());
            connected.add(c.toResourceId());
        }
        List<Diagnostic> warnings = new ArrayList<>();
        for (String resourceId : createdObjects.keySet()) {
            if (!connected.contains(resourceId)) {
                warnings.add(new Diagnostic(Diagnostic.Severity.WARNING, Diagnostic.Category.CONNECTION,
                        "Object '" + resourceId + "' has no connections", ENTITY_KIND, resourceId, null));
            }
        }
        return new PostCreationIssues(List.of(), warnings);
    }

    public Map<String, Handle> createdObjects() {
        return Collections.unmodifiableMap(createdObjects);
    }

    public List<CreatedConnection> createdConnections() {
        return Collections.unmodifiableList(createdConnections);
    }

    /**
     * @return Material unit objects keyed by label.
     */
    public Map<String, Handle> materialUnitObjects() {
        return Collections.unmodifiableMap(materialUnitObjects);
    }

    public CreationStatistics statistics() {
        return statistics;
    }

    /**
     * @return The failures recorded so far, in order.
     */
    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    private Handle createObject(ObjectMapping mapping) throws CreationAbortedException {
        String resourceId = mapping.resourceId();
        if (mapping.template().isEmpty()) {
            handleError(ErrorCategory.CREATION, ENTITY_KIND, resourceId,
                    "Failed to create object " + mapping.objectName() + ": No template specified", null);
            return null;
        }

        Handle object;
        try {
            Handle template = backend.resolveTemplate(mapping.template().get());
            object = backend.derive(template, modelFrame, uniqueName(mapping.objectName()));
        } catch (BackendException e) {
            handleError(ErrorCategory.CREATION, ENTITY_KIND, resourceId,
                    "Failed to create object " + mapping.objectName() + ": " + e.getMessage(), e);
            return null;
        }
        createdObjects.put(resourceId, object);
        statistics.objectCreated();
        LOG.debug("Created {} for resource '{}'", object, resourceId);

        for (MappedProperty property : mapping.properties()) {
            if (property.name().equalsIgnoreCase(ObjectMapping.NAME_PROPERTY) || property.kind() == PropertyKind.SPECIAL) {
                continue;
            }
            try {
                Object value = property.kind() == PropertyKind.MATERIAL_UNIT
                        ? materialUnit(String.valueOf(property.value()))
                        : property.value();
                backend.setProperty(object, property.name(), value);
            } catch (BackendException e) {
                handleError(ErrorCategory.PROPERTY, ENTITY_KIND, resourceId,
                        "Failed to set property " + property.name() + " on " + object + ": " + e.getMessage(), e);
            }
        }
        return object;
    }

    private Handle materialUnit(String label) throws BackendException {
        Handle existing = materialUnitObjects.get(label);
        if (existing != null) {
            return existing;
        }
        Handle target = userObjects.child(label);
        Handle unit = target.equals(materialUnitTemplate)
                ? materialUnitTemplate
                : backend.derive(materialUnitTemplate, userObjects, label);
        materialUnitObjects.put(label, unit);
        statistics.materialUnitCreated();
        LOG.info("Material unit {} -> {}", label, unit);
        return unit;
    }

    private String uniqueName(String rawName) {
        String base = nameSanitizer.sanitize(rawName);
        String name = base;
        for (int n = 2; usedNames.contains(name); n++) {
            name = nameSanitizer.withSuffix(base, n);
        }
        usedNames.add(name);
        return name;
    }

    private void handleError(ErrorCategory category, String entityKind, String entityId, String message, Throwable cause)
            throws CreationAbortedException {
        statistics.error();
        diagnostics.add(new Diagnostic(Diagnostic.Severity.ERROR, category.diagnosticCategory(),
                message, entityKind, entityId, null));
        switch (policy.mode(category)) {
            case ERROR_AND_STOP -> throw new CreationAbortedException(category, message, cause);
            case WARN_AND_CONTINUE -> LOG.error(message);
            case IGNORE -> LOG.debug("Ignored: {}", message);
        }
    }
}
