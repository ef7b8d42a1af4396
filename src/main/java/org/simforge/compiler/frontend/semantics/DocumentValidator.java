package org.simforge.compiler.frontend.semantics;

import org.simforge.compiler.ir.Connection;
import org.simforge.compiler.ir.Document;
import org.simforge.compiler.ir.LayoutObject;
import org.simforge.compiler.ir.Placement;

import java.util.HashSet;
import java.util.Set;

/**
 * Checks the referential integrity of a parsed document.
 * <p>
 * Validation is exhaustive: every violation is recorded rather than stopping at the
 * first one. The document is never modified.
 */
public final class DocumentValidator {

    public static final String KIND_DOCUMENT = "Document";
    public static final String KIND_RESOURCE = "Resource";
    public static final String KIND_LAYOUT_OBJECT = "LayoutObject";
    public static final String KIND_PLACEMENT = "Placement";
    public static final String KIND_CONNECTION = "Connection";

    private DocumentValidator() {
        // Private constructor to prevent instantiation
    }

    /**
     * Validates the document.
     *
     * @param document The document to check.
     * @return The collected errors and warnings.
     */
    public static ValidationResult validate(Document document) {
        ValidationResult result = new ValidationResult();

        if (document.identifier().isEmpty()) {
            result.addError("Missing document identifier", KIND_DOCUMENT, null, null);
        }
        if (document.resources().isEmpty()) {
            result.addError("No resources defined", KIND_DOCUMENT, document.identifier(), null);
        }

        for (LayoutObject lo : document.layoutObjects().values()) {
            if (!document.resources().containsKey(lo.associatedResourceId())) {
                result.addError(
                        "LayoutObject '" + lo.identifier() + "' references unknown resource '"
                                + lo.associatedResourceId() + "'",
                        KIND_LAYOUT_OBJECT, lo.identifier(), lo.associatedResourceId());
            }
        }

        document.layout().ifPresent(layout -> {
            for (Placement p : layout.placements().values()) {
                if (!document.layoutObjects().containsKey(p.layoutElementId())) {
                    result.addError(
                            "Placement references unknown layout object '" + p.layoutElementId() + "'",
                            KIND_PLACEMENT, p.layoutElementId(), p.layoutElementId());
                }
            }
        });

        for (Connection c : document.connections()) {
            if (!document.resources().containsKey(c.fromResourceId())) {
                result.addError(
                        "Connection '" + c.identifier() + "' references unknown source resource '"
                                + c.fromResourceId() + "'",
                        KIND_CONNECTION, c.identifier(), c.fromResourceId());
            }
            if (!document.resources().containsKey(c.toResourceId())) {
                result.addError(
                        "Connection '" + c.identifier() + "' references unknown target resource '"
                                + c.toResourceId() + "'",
                        KIND_CONNECTION, c.identifier(), c.toResourceId());
            }
        }

        Set<String> withLayout = new HashSet<>();
        for (LayoutObject lo : document.layoutObjects().values()) {
            withLayout.add(lo.associatedResourceId());
        }
        for (String resourceId : document.resources().keySet()) {
            if (!withLayout.contains(resourceId)) {
                result.addWarning("Resource '" + resourceId + "' has no associated layout object",
                        KIND_RESOURCE, resourceId);
            }
        }

        return result;
    }
}
