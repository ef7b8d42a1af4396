package org.simforge.compiler;

import com.typesafe.config.Config;
import org.simforge.compiler.api.CompilationException;
import org.simforge.compiler.api.CompilationReport;
import org.simforge.compiler.api.ILayoutCompiler;
import org.simforge.compiler.backend.BackendFactory;
import org.simforge.compiler.backend.IBackend;
import org.simforge.compiler.backend.creation.CreatedConnection;
import org.simforge.compiler.backend.creation.CreationAbortedException;
import org.simforge.compiler.backend.creation.CreationOrchestrator;
import org.simforge.compiler.backend.creation.ErrorPolicy;
import org.simforge.compiler.backend.creation.PostCreationIssues;
import org.simforge.compiler.backend.Handle;
import org.simforge.compiler.diagnostics.Diagnostic;
import org.simforge.compiler.diagnostics.DiagnosticsEngine;
import org.simforge.compiler.frontend.parser.DocumentParser;
import org.simforge.compiler.frontend.parser.ParseException;
import org.simforge.compiler.frontend.schema.SchemaConfig;
import org.simforge.compiler.frontend.schema.SchemaConfigReader;
import org.simforge.compiler.frontend.semantics.DocumentValidator;
import org.simforge.compiler.frontend.semantics.ValidationResult;
import org.simforge.compiler.ir.Document;
import org.simforge.compiler.mapping.MappingEngine;
import org.simforge.compiler.mapping.ObjectMapping;
import org.simforge.compiler.mapping.rules.RuleTable;
import org.simforge.compiler.mapping.rules.RuleTableReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * The layout compiler. Runs parsing, validation, mapping and creation in strict sequence
 * and stops at the first stage that fails. It is not thread-safe.
 * <p>
 * Each run takes its backend from a supplier. A compiler built around a single {@link IBackend}
 * hands that same backend to every run, so its state accumulates across runs.
 */
public class LayoutCompiler implements ILayoutCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(LayoutCompiler.class);

    private final SchemaConfig schema;
    private final RuleTable rules;
    private final Supplier<IBackend> backends;
    private final ErrorPolicy errorPolicy;
    private IBackend backend;

    public LayoutCompiler(SchemaConfig schema, RuleTable rules, Supplier<IBackend> backends, ErrorPolicy errorPolicy) {
        this.schema = schema;
        this.rules = rules;
        this.backends = backends;
        this.errorPolicy = errorPolicy;
    }

    public LayoutCompiler(SchemaConfig schema, RuleTable rules, IBackend backend, ErrorPolicy errorPolicy) {
        this(schema, rules, () -> backend, errorPolicy);
    }

    /**
     * Creates a compiler from the {@code simforge} configuration root. Every run gets a new backend
     * built from {@code simforge.backend}.
     *
     * @param config The root configuration containing the {@code simforge} section.
     */
    public static LayoutCompiler fromConfig(Config config) {
        Config backendConfig = config.getConfig("simforge.backend");
        return fromConfig(config, () -> BackendFactory.create(backendConfig));
    }

    /**
     * Creates a compiler from the {@code simforge} configuration root that runs every compilation
     * against the given backend.
     */
    public static LayoutCompiler fromConfig(Config config, IBackend backend) {
        return fromConfig(config, () -> backend);
    }

    /**
     * Creates a compiler from the {@code simforge} configuration root that asks {@code backends}
     * for the backend of each run.
     */
    public static LayoutCompiler fromConfig(Config config, Supplier<IBackend> backends) {
        Config simforge = config.getConfig("simforge");
        return new LayoutCompiler(
                SchemaConfigReader.read(simforge.getConfig("schema")),
                RuleTableReader.read(simforge.getConfig("mapping")),
                backends,
                simforge.hasPath("error-handling") ? ErrorPolicy.fromConfig(simforge.getConfig("error-handling")) : ErrorPolicy.defaults());
    }

    /**
     * @return The backend the most recent run created objects through.
     * @throws IllegalStateException if no run has reached the creation stage yet.
     */
    public IBackend backend() {
        if (backend == null) {
            throw new IllegalStateException("No compilation has reached the creation stage yet");
        }
        return backend;
    }

    @Override
    public CompilationReport compile(String xml) throws CompilationException {
        long start = System.nanoTime();
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Document document;
        try {
            document = new DocumentParser(schema).parse(xml);
        } catch (ParseException e) {
            throw parseFailure(diagnostics, e);
        }
        return run(document, diagnostics, start);
    }

    @Override
    public CompilationReport compile(Path file) throws CompilationException {
        long start = System.nanoTime();
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Document document;
        try {
            document = new DocumentParser(schema).parse(file);
        } catch (ParseException e) {
            throw parseFailure(diagnostics, e);
        }
        return run(document, diagnostics, start);
    }

    /**
     * Runs validation, mapping and creation on an already parsed document.
     */
    public CompilationReport compile(Document document) throws CompilationException {
        return run(document, new DiagnosticsEngine(), System.nanoTime());
    }

    private CompilationReport run(Document document, DiagnosticsEngine diagnostics, long start) throws CompilationException {
        // Phase 1: Validation
        ValidationResult validation = DocumentValidator.validate(document);
        diagnostics.reportAll(validation.all());
        validation.warnings().forEach(w -> LOG.warn("{}", w.message()));
        if (!validation.isValid()) {
            LOG.error("Document '{}' is invalid:\n{}", document.identifier(), diagnostics.summary());
            throw new CompilationException("Validation of document '" + document.identifier() + "' failed with "
                    + validation.errors().size() + " error(s):\n" + diagnostics.summary(), diagnostics.getDiagnostics());
        }
        long parsed = System.nanoTime();

        // Phase 2: Mapping
        MappingEngine mappingEngine = new MappingEngine(rules);
        Map<String, ObjectMapping> mappings = mappingEngine.map(document);
        for (ObjectMapping mapping : mappings.values()) {
            diagnostics.reportAll(mapping.errors());
            diagnostics.reportAll(mapping.warnings());
        }
        long mapped = System.nanoTime();

        // Phase 3: Creation
        backend = backends.get();
        CreationOrchestrator orchestrator = new CreationOrchestrator(backend, errorPolicy, mappingEngine.nameSanitizer());
        Map<String, Handle> created;
        List<CreatedConnection> connections;
        try {
            created = orchestrator.createObjects(mappings);
            connections = orchestrator.createConnections(document);
        } catch (CreationAbortedException e) {
            diagnostics.reportAll(orchestrator.diagnostics());
            throw new CompilationException("Creation aborted after " + e.getCategory().name().toLowerCase(Locale.ROOT)
                    + " error: " + e.getMessage(), diagnostics.getDiagnostics(), e);
        }
        diagnostics.reportAll(orchestrator.diagnostics());
        PostCreationIssues issues = orchestrator.validateCreatedObjects();
        diagnostics.reportAll(issues.errors());
        diagnostics.reportAll(issues.warnings());
        issues.warnings().forEach(w -> LOG.warn("{}", w.message()));
        long end = System.nanoTime();

        CompilationReport.StageTimings timings = new CompilationReport.StageTimings(
                Duration.ofNanos(parsed - start), Duration.ofNanos(mapped - parsed),
                Duration.ofNanos(end - mapped), Duration.ofNanos(end - start));
        LOG.info("Compiled document '{}': {} mappings, {} ({} ms)",
                document.identifier(), mappings.size(), orchestrator.statistics(), timings.total().toMillis());

        return new CompilationReport(
                document.identifier(), validation, mappings, orchestrator.statistics(), created, connections,
                issues, mappingEngine.materialUnits(), timings, diagnostics.getDiagnostics());
    }

    private static CompilationException parseFailure(DiagnosticsEngine diagnostics, ParseException e) {
        diagnostics.reportError(Diagnostic.Category.PARSE, e.getMessage());
        LOG.error("Failed to parse layout document: {}", e.getMessage());
        return new CompilationException("Failed to parse layout document: " + e.getMessage(), diagnostics.getDiagnostics(), e);
    }
}
