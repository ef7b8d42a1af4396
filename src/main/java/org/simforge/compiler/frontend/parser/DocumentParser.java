package org.simforge.compiler.frontend.parser;

import org.simforge.compiler.frontend.schema.EntitySchema;
import org.simforge.compiler.frontend.schema.SchemaConfig;
import org.simforge.compiler.ir.Boundary;
import org.simforge.compiler.ir.Connection;
import org.simforge.compiler.ir.Document;
import org.simforge.compiler.ir.DocumentHeader;
import org.simforge.compiler.ir.Layout;
import org.simforge.compiler.ir.LayoutObject;
import org.simforge.compiler.ir.PartType;
import org.simforge.compiler.ir.Placement;
import org.simforge.compiler.ir.Position;
import org.simforge.compiler.ir.Property;
import org.simforge.compiler.ir.Resource;
import org.simforge.compiler.ir.Rotation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parses a layout document into the intermediate representation, locating every
 * field through the configured {@link SchemaConfig}.
 * <p>
 * Only a malformed document or a missing header fails the parse. Entities lacking a
 * required identifier are skipped with a warning; optional fields fall back to empty
 * values. This class is not thread-safe.
 */
public class DocumentParser {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentParser.class);

    private final SchemaConfig schema;
    private final Map<String, ElementPath> pathCache = new HashMap<>();

    public DocumentParser(SchemaConfig schema) {
        this.schema = schema;
    }

    /**
     * Parses the document stored at the given path.
     *
     * @param file The document file.
     * @return The parsed document.
     * @throws ParseException if the file cannot be read or parsed.
     */
    public Document parse(Path file) throws ParseException {
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in);
        } catch (IOException e) {
            throw new ParseException("Failed to read layout document " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses a document from a stream. The stream is not closed.
     */
    public Document parse(InputStream in) throws ParseException {
        return parse(readDom(new InputSource(in)));
    }

    /**
     * Parses a document from its textual form.
     */
    public Document parse(String xml) throws ParseException {
        return parse(readDom(new InputSource(new StringReader(xml))));
    }

    private Document parse(org.w3c.dom.Document dom) throws ParseException {
        Element root = dom.getDocumentElement();

        Document.Builder builder = Document.builder(parseHeader(root));

        schema.resourcesSchema().ifPresent(rs -> parseResources(root, rs, builder));
        schema.layoutObjectsSchema().ifPresent(ls -> parseLayoutObjects(root, ls, builder));
        schema.layoutSchema().ifPresent(ls -> parseLayout(root, ls).ifPresent(builder::layout));
        schema.partTypesSchema().ifPresent(ps -> parsePartTypes(root, ps, builder));

        Document document = builder.build();
        LOG.info("Parsed document '{}': {} resources, {} connections, {} layout objects, {} placements, {} part types",
                document.identifier(),
                document.resources().size(),
                document.connections().size(),
                document.layoutObjects().size(),
                document.layout().map(l -> l.placements().size()).orElse(0),
                document.partTypes().size());
        return document;
    }

    private DocumentHeader parseHeader(Element root) throws ParseException {
        EntitySchema headerSchema = schema.header();
        Element header = path(headerSchema.path()).findFirst(root)
                .orElseThrow(() -> new ParseException(
                        "Header section '" + headerSchema.path() + "' not found in layout document"));

        return new DocumentHeader(
                text(header, headerSchema, SchemaConfig.DOCUMENT_IDENTIFIER),
                text(header, headerSchema, SchemaConfig.DESCRIPTION),
                text(header, headerSchema, SchemaConfig.VERSION),
                text(header, headerSchema, SchemaConfig.CREATION_TIME),
                text(header, headerSchema, SchemaConfig.TIME_UNIT),
                text(header, headerSchema, SchemaConfig.LENGTH_UNIT),
                text(header, headerSchema, SchemaConfig.WEIGHT_UNIT));
    }

    private void parseResources(Element root, EntitySchema resourceSchema, Document.Builder builder) {
        Optional<EntitySchema> propertySchema = resourceSchema.child(SchemaConfig.PROPERTIES);
        Optional<EntitySchema> connectionSchema = resourceSchema.child(SchemaConfig.CONNECTIONS);

        for (Element element : path(resourceSchema.path()).findAll(root)) {
            String identifier = text(element, resourceSchema, SchemaConfig.IDENTIFIER);
            if (identifier.isEmpty()) {
                LOG.warn("Skipping resource with no identifier");
                continue;
            }

            Map<String, Property> properties = propertySchema
                    .map(ps -> parseProperties(element, ps))
                    .orElse(Map.of());

            builder.resource(new Resource(
                    identifier,
                    text(element, resourceSchema, SchemaConfig.RESOURCE_TYPE),
                    text(element, resourceSchema, SchemaConfig.NAME),
                    text(element, resourceSchema, SchemaConfig.DESCRIPTION),
                    text(element, resourceSchema, SchemaConfig.CURRENT_STATUS),
                    text(element, resourceSchema, SchemaConfig.RESOURCE_CLASS_IDENTIFIER),
                    properties));

            // connection references are nested inside the source resource
            connectionSchema.ifPresent(cs -> parseConnections(element, identifier, cs, builder));
        }
    }

    private Map<String, Property> parseProperties(Element resource, EntitySchema propertySchema) {
        Map<String, Property> properties = new LinkedHashMap<>();
        for (Element element : path(propertySchema.path()).findAll(resource)) {
            String name = text(element, propertySchema, SchemaConfig.NAME);
            String value = text(element, propertySchema, SchemaConfig.VALUE);
            String unit = text(element, propertySchema, SchemaConfig.UNIT);
            if (!name.isEmpty() && !value.isEmpty()) {
                properties.put(name, new Property(name, value, unit.isEmpty() ? null : unit));
            }
        }
        return properties;
    }

    private void parseConnections(Element resource, String fromResourceId, EntitySchema connectionSchema,
                                  Document.Builder builder) {
        for (Element element : path(connectionSchema.path()).findAll(resource)) {
            String toResourceId = text(element, connectionSchema, SchemaConfig.TO_RESOURCE_ID);
            if (toResourceId.isEmpty()) {
                LOG.warn("Skipping connection of resource '{}' with no target resource", fromResourceId);
                continue;
            }
            String identifier = text(element, connectionSchema, SchemaConfig.IDENTIFIER);
            builder.connection(new Connection(
                    identifier.isEmpty() ? Connection.syntheticIdentifier(fromResourceId, toResourceId) : identifier,
                    fromResourceId,
                    toResourceId,
                    text(element, connectionSchema, SchemaConfig.DESCRIPTION)));
        }
    }

    private void parseLayoutObjects(Element root, EntitySchema layoutObjectSchema, Document.Builder builder) {
        Optional<EntitySchema> boundarySchema = layoutObjectSchema.child(SchemaConfig.BOUNDARY);
        for (Element element : path(layoutObjectSchema.path()).findAll(root)) {
            String identifier = text(element, layoutObjectSchema, SchemaConfig.IDENTIFIER);
            String resourceId = text(element, layoutObjectSchema, SchemaConfig.ASSOCIATED_RESOURCE_ID);
            if (identifier.isEmpty() || resourceId.isEmpty()) {
                LOG.warn("Skipping layout object with missing identifier or resource reference (identifier='{}')",
                        identifier);
                continue;
            }
            Boundary boundary = boundarySchema.flatMap(bs -> parseBoundary(element, bs)).orElse(null);
            builder.layoutObject(new LayoutObject(identifier, resourceId, boundary));
        }
    }

    private Optional<Layout> parseLayout(Element root, EntitySchema layoutSchema) {
        Optional<Element> found = path(layoutSchema.path()).findFirst(root);
        if (found.isEmpty()) {
            LOG.debug("No layout section found at '{}'", layoutSchema.path());
            return Optional.empty();
        }
        Element element = found.get();

        Boundary boundary = layoutSchema.child(SchemaConfig.BOUNDARY)
                .flatMap(bs -> parseBoundary(element, bs))
                .orElse(null);
        Map<String, Placement> placements = layoutSchema.child(SchemaConfig.PLACEMENTS)
                .map(ps -> parsePlacements(element, ps))
                .orElse(Map.of());

        return Optional.of(new Layout(
                text(element, layoutSchema, SchemaConfig.IDENTIFIER),
                text(element, layoutSchema, SchemaConfig.DESCRIPTION),
                boundary,
                placements));
    }

    private Map<String, Placement> parsePlacements(Element layout, EntitySchema placementSchema) {
        Map<String, Placement> placements = new LinkedHashMap<>();
        for (Element element : path(placementSchema.path()).findAll(layout)) {
            String layoutElementId = text(element, placementSchema, SchemaConfig.LAYOUT_ELEMENT_ID);
            if (layoutElementId.isEmpty()) {
                LOG.debug("Skipping placement without layout element reference");
                continue;
            }

            Optional<Double> x = number(element, placementSchema, SchemaConfig.POSITION_X);
            Optional<Double> y = number(element, placementSchema, SchemaConfig.POSITION_Y);
            if (x.isEmpty() || y.isEmpty()) {
                LOG.warn("Skipping placement {} with invalid position", layoutElementId);
                continue;
            }
            Position position = new Position(x.get(), y.get(),
                    number(element, placementSchema, SchemaConfig.POSITION_Z).orElse(0.0));

            Rotation rotation = number(element, placementSchema, SchemaConfig.ROTATION_ANGLE)
                    .map(angle -> new Rotation(
                            angle,
                            number(element, placementSchema, SchemaConfig.ROTATION_AXIS_X).orElse(0.0),
                            number(element, placementSchema, SchemaConfig.ROTATION_AXIS_Y).orElse(0.0),
                            number(element, placementSchema, SchemaConfig.ROTATION_AXIS_Z).orElse(1.0)))
                    .orElse(null);

            placements.put(layoutElementId, new Placement(layoutElementId, position, rotation));
        }
        return placements;
    }

    private Optional<Boundary> parseBoundary(Element parent, EntitySchema boundarySchema) {
        List<Element> scopes = path(boundarySchema.path()).findAll(parent);
        if (scopes.isEmpty()) {
            return Optional.empty();
        }
        Element element = scopes.get(0);
        Optional<Double> width = number(element, boundarySchema, SchemaConfig.WIDTH);
        Optional<Double> depth = number(element, boundarySchema, SchemaConfig.DEPTH);
        if (width.isEmpty() || depth.isEmpty()) {
            return Optional.empty();
        }
        String unit = text(element, boundarySchema, SchemaConfig.UNIT);
        return Optional.of(new Boundary(
                width.get(),
                depth.get(),
                number(element, boundarySchema, SchemaConfig.HEIGHT).orElse(Boundary.DEFAULT_HEIGHT),
                unit.isEmpty() ? Boundary.DEFAULT_UNIT : unit));
    }

    private void parsePartTypes(Element root, EntitySchema partTypeSchema, Document.Builder builder) {
        for (Element element : path(partTypeSchema.path()).findAll(root)) {
            String identifier = text(element, partTypeSchema, SchemaConfig.IDENTIFIER);
            if (identifier.isEmpty()) {
                LOG.warn("Skipping part type with no identifier");
                continue;
            }
            String name = text(element, partTypeSchema, SchemaConfig.NAME);

            Optional<Double> width = number(element, partTypeSchema, SchemaConfig.WIDTH);
            Optional<Double> depth = number(element, partTypeSchema, SchemaConfig.DEPTH);
            Boundary dimensions = null;
            if (width.isPresent() && depth.isPresent()) {
                dimensions = new Boundary(width.get(), depth.get(),
                        number(element, partTypeSchema, SchemaConfig.HEIGHT).orElse(Boundary.DEFAULT_HEIGHT),
                        Boundary.DEFAULT_UNIT);
            }

            builder.partType(new PartType(
                    identifier,
                    name.isEmpty() ? identifier : name,
                    text(element, partTypeSchema, SchemaConfig.DESCRIPTION),
                    number(element, partTypeSchema, SchemaConfig.WEIGHT).orElse(null),
                    dimensions));
        }
    }

    private String text(Element context, EntitySchema entity, String field) {
        String fieldPath = entity.field(field);
        if (fieldPath.isEmpty()) {
            return "";
        }
        return path(fieldPath).text(context);
    }

    private Optional<Double> number(Element context, EntitySchema entity, String field) {
        String text = text(context, entity, field);
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            LOG.debug("Field '{}' value '{}' is not numeric", field, text);
            return Optional.empty();
        }
    }

    private ElementPath path(String expression) {
        return pathCache.computeIfAbsent(expression, ElementPath::compile);
    }

    private static org.w3c.dom.Document readDom(InputSource source) throws ParseException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            DocumentBuilder documentBuilder = factory.newDocumentBuilder();
            // the default handler prints fatal errors to stderr; the exception already carries them
            documentBuilder.setErrorHandler(new DefaultHandler());
            return documentBuilder.parse(source);
        } catch (SAXException e) {
            throw new ParseException("Layout document is not well-formed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ParseException("Failed to read layout document: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new ParseException("XML parser could not be configured: " + e.getMessage(), e);
        }
    }
}
