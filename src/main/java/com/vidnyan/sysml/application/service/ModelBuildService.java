package com.vidnyan.sysml.application.service;

import com.vidnyan.sysml.ModelProperties;
import com.vidnyan.sysml.application.port.in.BuildModelUseCase;
import com.vidnyan.sysml.application.port.out.LibraryRepository;
import com.vidnyan.sysml.application.port.out.SyntaxTreeReader;
import com.vidnyan.sysml.domain.build.ModelBuilder;
import com.vidnyan.sysml.domain.build.ModelElementFactory;
import com.vidnyan.sysml.domain.expression.ExpressionEvaluator;
import com.vidnyan.sysml.domain.model.*;
import com.vidnyan.sysml.domain.syntax.SyntaxDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Main application service that orchestrates the model build workflow.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelBuildService implements BuildModelUseCase {

    private final SyntaxTreeReader syntaxTreeReader;
    private final LibraryRepository libraryRepository;
    private final ModelWorkspace workspace;
    private final ModelElementFactory elementFactory;
    private final ModelBuilder modelBuilder;
    private final ExpressionEvaluator evaluator;
    private final ModelProperties properties;

    @Override
    public synchronized BuildResult build(BuildRequest request) {
        Instant startTime = Instant.now();
        log.info("Starting model build of: {}", request.sourcePath());
        List<SyntaxTreeReader.ReadFailure> failures = new ArrayList<>();

        // Step 1: Load the standard library
        log.info("Step 1: Loading standard library...");
        loadLibrary(failures);
        log.info("Library: {} documents", workspace.libraryDocuments().size());

        // Step 2: Read syntax documents
        log.info("Step 2: Reading syntax documents...");
        SyntaxTreeReader.ReadResult readResult = syntaxTreeReader.read(request.sourcePath());
        failures.addAll(readResult.failures());

        // Step 3: Create semantic elements
        log.info("Step 3: Creating elements...");
        List<ModelDocument> documents = new ArrayList<>();
        List<ModelDocument> dependents = new ArrayList<>();
        for (SyntaxDocument syntax : readResult.documents()) {
            try {
                if (workspace.get(syntax.uri()).isPresent()) {
                    List<ModelDocument> reset = workspace.invalidate(syntax.uri());
                    reset.stream().filter(d -> !dependents.contains(d)).forEach(dependents::add);
                    log.info("  Replacing {} ({} dependents reset)", syntax.uri(), reset.size());
                }
                ModelDocument document = elementFactory.create(syntax, false);
                List<ModelDocument> reset = workspace.add(document);
                reset.stream().filter(d -> !dependents.contains(d)).forEach(dependents::add);
                if (!reset.isEmpty()) log.info("  {} documents reset for re-resolution", reset.size());
                documents.add(document);
            } catch (IllegalArgumentException | IllegalStateException e) {
                log.error("Error creating elements of {}: {}", syntax.uri(), e.getMessage());
                failures.add(new SyntaxTreeReader.ReadFailure(syntax.uri(), e.getMessage()));
            }
        }
        int elementsCreated = documents.stream().mapToInt(ModelDocument::size).sum();
        log.info("Created: {} elements in {} documents", elementsCreated, documents.size());

        // Step 4: Link and complete
        log.info("Step 4: Building documents...");
        for (ModelDocument document : documents) {
            modelBuilder.buildDocument(document);
        }
        for (ModelDocument document : dependents) {
            if (document.state() != ModelDocument.State.DISCARDED) modelBuilder.buildDocument(document);
        }

        // Step 5: Collect diagnostics
        log.info("Step 5: Collecting diagnostics...");
        List<UnresolvedReference> unresolved = new ArrayList<>();
        List<MetamodelIssue> issues = new ArrayList<>();
        int explicitEdges = 0;
        int implicitEdges = 0;
        for (ModelDocument document : documents) {
            for (ElementMeta element : document.elements()) {
                issues.addAll(element.issues());
                // relationships are reported under the element that declares them
                ElementMeta referencing = element instanceof RelationshipMeta && element.owner() != null
                        ? element.owner()
                        : element;
                for (ElementReference reference : element.references()) {
                    if (reference.isAttempted() && !reference.isResolved()) {
                        unresolved.add(new UnresolvedReference(
                                document.uri(), referencing.qualifiedName(), reference.text(), reference.found().size()));
                    }
                }
                if (element instanceof TypeMeta type) {
                    for (SpecializationEdge edge : type.specializations()) {
                        if (edge.isImplicit()) implicitEdges++;
                        else explicitEdges++;
                    }
                }
            }
        }
        unresolved.forEach(u -> log.warn("  Unresolved reference '{}' in {}", u.reference(), u.element()));
        log.info("Found {} unresolved references, {} issues", unresolved.size(), issues.size());

        // Step 6: Evaluate expressions
        List<EvaluatedExpression> evaluations = new ArrayList<>();
        if (request.evaluateExpressions()) {
            log.info("Step 6: Evaluating expressions...");
            for (ModelDocument document : documents) {
                evaluations.addAll(evaluateExpressions(document));
            }
            log.info("Evaluated {} expressions", evaluations.size());
        }

        Duration totalDuration = Duration.between(startTime, Instant.now());
        BuildStats stats = new BuildStats(
                workspace.libraryDocuments().size(),
                documents.size(),
                elementsCreated,
                explicitEdges,
                implicitEdges,
                totalDuration.toMillis()
        );

        log.info("Build complete: {} documents in {}ms", documents.size(), stats.totalDurationMs());
        return new BuildResult(documents, unresolved, issues, evaluations, failures, stats);
    }

    @Override
    public synchronized List<ModelDocument> rebuild(String uri) {
        log.info("Rebuilding {}", uri);
        List<ModelDocument> rebuilt = modelBuilder.rebuild(uri);
        log.info("Rebuilt {} documents", rebuilt.size());
        return rebuilt;
    }

    @Override
    public synchronized List<ModelDocument> invalidate(String uri) {
        log.info("Invalidating {}", uri);
        List<ModelDocument> rebuilt = modelBuilder.invalidate(uri);
        log.info("Rebuilt {} dependent documents", rebuilt.size());
        return rebuilt;
    }

    private void loadLibrary(List<SyntaxTreeReader.ReadFailure> failures) {
        if (!properties.isStandardLibrary()) {
            log.info("  Standard library disabled");
            return;
        }
        if (workspace.hasLibrary()) return;

        failures.addAll(libraryRepository.failures());
        List<ModelDocument> library = new ArrayList<>();
        List<ModelDocument> reset = new ArrayList<>();
        for (SyntaxDocument syntax : libraryRepository.findAll()) {
            try {
                ModelDocument document = elementFactory.create(syntax, true);
                workspace.add(document).stream().filter(d -> !reset.contains(d)).forEach(reset::add);
                library.add(document);
            } catch (IllegalArgumentException e) {
                log.error("Error creating library document {}: {}", syntax.uri(), e.getMessage());
                failures.add(new SyntaxTreeReader.ReadFailure(syntax.uri(), e.getMessage()));
            }
        }
        library.forEach(modelBuilder::buildDocument);
        reset.forEach(modelBuilder::buildDocument);
    }

    /**
     * Top-level expressions, evaluated against their owning element.
     */
    private List<EvaluatedExpression> evaluateExpressions(ModelDocument document) {
        List<EvaluatedExpression> evaluations = new ArrayList<>();
        for (ElementMeta element : document.elements()) {
            if (!(element instanceof ExpressionMeta expression)) continue;
            ElementMeta owner = expression.owner();
            if (owner instanceof ExpressionMeta) continue;
            Optional<List<Object>> values = evaluator.evaluate(expression, owner);
            values.ifPresent(v -> evaluations.add(new EvaluatedExpression(
                    expression.qualifiedName(),
                    owner != null ? owner.qualifiedName() : null,
                    v.stream().map(ModelBuildService::render).toList())));
        }
        return evaluations;
    }

    private static String render(Object value) {
        if (value instanceof ElementMeta element) return element.qualifiedName();
        return String.valueOf(value);
    }
}
