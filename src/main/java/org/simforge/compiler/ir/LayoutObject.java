package org.simforge.compiler.ir;

import java.util.Optional;

/**
 * The visual counterpart of a resource. The referenced resource is not checked
 * on construction; see {@link org.simforge.compiler.frontend.semantics.DocumentValidator}.
 */
public record LayoutObject(String identifier, String associatedResourceId, Boundary boundary) {

    public Optional<Boundary> boundaryValue() {
        return Optional.ofNullable(boundary);
    }
}
