package org.simforge.compiler.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The layout section: an optional overall boundary and the placements keyed by layout element id.
 */
public final class Layout {

    public static final String DEFAULT_IDENTIFIER = "main_layout";

    private final String identifier;
    private final String description;
    private final Boundary boundary;
    private final Map<String, Placement> placements;

    public Layout(String identifier, String description, Boundary boundary, Map<String, Placement> placements) {
        this.identifier = identifier == null || identifier.isEmpty() ? DEFAULT_IDENTIFIER : identifier;
        this.description = description == null ? "" : description;
        this.boundary = boundary;
        this.placements = Collections.unmodifiableMap(new LinkedHashMap<>(placements));
    }

    public String identifier() {
        return identifier;
    }

    public String description() {
        return description;
    }

    public Optional<Boundary> boundary() {
        return Optional.ofNullable(boundary);
    }

    public Map<String, Placement> placements() {
        return placements;
    }
}
