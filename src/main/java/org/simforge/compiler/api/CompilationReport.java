package org.simforge.compiler.api;

import org.simforge.compiler.backend.Handle;
import org.simforge.compiler.backend.creation.CreatedConnection;
import org.simforge.compiler.backend.creation.CreationStatistics;
import org.simforge.compiler.backend.creation.PostCreationIssues;
import org.simforge.compiler.diagnostics.Diagnostic;
import org.simforge.compiler.frontend.semantics.ValidationResult;
import org.simforge.compiler.mapping.ObjectMapping;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The outcome of a successful compilation run.
 *
 * @param documentId         The identifier of the compiled document.
 * @param validation         The validation result; valid, possibly with warnings.
 * @param mappings           The object mappings keyed by resource identifier.
 * @param statistics         The creation counters.
 * @param createdObjects     Handles of created objects keyed by resource identifier.
 * @param createdConnections The created connections in creation order.
 * @param postCreationIssues Findings of the post-creation check.
 * @param materialUnits      Product type to material unit label.
 * @param timings            Durations of the pipeline stages.
 * @param diagnostics        All diagnostics of the run.
 */
public record CompilationReport(
        String documentId,
        ValidationResult validation,
        Map<String, ObjectMapping> mappings,
        CreationStatistics statistics,
        Map<String, Handle> createdObjects,
        List<CreatedConnection> createdConnections,
        PostCreationIssues postCreationIssues,
        Map<String, String> materialUnits,
        StageTimings timings,
        List<Diagnostic> diagnostics
) {

    /**
     * Durations of the pipeline stages. Validation is counted towards parsing.
     */
    public record StageTimings(Duration parse, Duration map, Duration create, Duration total) {
    }

    public CompilationReport {
        mappings = Collections.unmodifiableMap(new LinkedHashMap<>(mappings));
        createdObjects = Collections.unmodifiableMap(new LinkedHashMap<>(createdObjects));
        createdConnections = List.copyOf(createdConnections);
        materialUnits = Collections.unmodifiableMap(new LinkedHashMap<>(materialUnits));
        diagnostics = List.copyOf(diagnostics);
    }

    public int mappingCount() {
        return mappings.size();
    }

    public long count(Diagnostic.Severity severity) {
        return diagnostics.stream().filter(d -> d.severity() == severity).count();
    }
}
