package org.simforge.compiler.backend.creation;

import org.simforge.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * Findings of the check that runs after all objects and connections were created.
 */
public record PostCreationIssues(List<Diagnostic> errors, List<Diagnostic> warnings) {

    public PostCreationIssues {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }
}
