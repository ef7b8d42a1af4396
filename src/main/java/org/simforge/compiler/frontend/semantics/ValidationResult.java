package org.simforge.compiler.frontend.semantics;

import org.simforge.compiler.diagnostics.Diagnostic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of validating a document. The result is valid iff no error was recorded;
 * warnings never affect validity.
 */
public final class ValidationResult {

    private final List<Diagnostic> errors = new ArrayList<>();
    private final List<Diagnostic> warnings = new ArrayList<>();

    void addError(String message, String entityKind, String entityId, String referencedId) {
        errors.add(new Diagnostic(Diagnostic.Severity.ERROR, Diagnostic.Category.VALIDATION,
                message, entityKind, entityId, referencedId));
    }

    void addWarning(String message, String entityKind, String entityId) {
        warnings.add(new Diagnostic(Diagnostic.Severity.WARNING, Diagnostic.Category.VALIDATION,
                message, entityKind, entityId, null));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<Diagnostic> errors() {
        return Collections.unmodifiableList(errors);
    }

    public List<Diagnostic> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    /**
     * @return Errors followed by warnings.
     */
    public List<Diagnostic> all() {
        List<Diagnostic> all = new ArrayList<>(errors);
        all.addAll(warnings);
        return all;
    }
}
