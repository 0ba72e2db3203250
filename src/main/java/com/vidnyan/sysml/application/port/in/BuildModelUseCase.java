package com.vidnyan.sysml.application.port.in;

import com.vidnyan.sysml.application.port.out.SyntaxTreeReader;
import com.vidnyan.sysml.domain.model.MetamodelIssue;
import com.vidnyan.sysml.domain.model.ModelDocument;

import java.nio.file.Path;
import java.util.List;

/**
 * Primary use case: build the semantic model of a set of syntax documents.
 */
public interface BuildModelUseCase {

    /**
     * Read, create and link the documents at the request path against the standard library.
     */
    BuildResult build(BuildRequest request);

    /**
     * Reset a built document together with its dependents and build them again.
     * @return the rebuilt documents
     */
    List<ModelDocument> rebuild(String uri);

    /**
     * Discard a document and rebuild the documents that linked into it.
     * @return the rebuilt dependents
     */
    List<ModelDocument> invalidate(String uri);

    record BuildRequest(
        Path sourcePath,
        boolean evaluateExpressions
    ) {
        public static BuildRequest forPath(Path path) {
            return new BuildRequest(path, true);
        }
    }

    record BuildResult(
        List<ModelDocument> documents,
        List<UnresolvedReference> unresolvedReferences,
        List<MetamodelIssue> issues,
        List<EvaluatedExpression> evaluations,
        List<SyntaxTreeReader.ReadFailure> failures,
        BuildStats stats
    ) {
        public boolean isClean() {
            return unresolvedReferences.isEmpty() && issues.isEmpty() && failures.isEmpty();
        }
    }

    /**
     * A reference that did not resolve; {@code resolvedSegments} counts the leading segments that did.
     */
    record UnresolvedReference(
        String documentUri,
        String element,
        String reference,
        int resolvedSegments
    ) {}

    /**
     * A top-level expression that evaluated at model level, with its values rendered as text.
     */
    record EvaluatedExpression(
        String element,
        String owner,
        List<String> values
    ) {}

    record BuildStats(
        int libraryDocuments,
        int documentsBuilt,
        int elementsCreated,
        int explicitSpecializations,
        int implicitSpecializations,
        long totalDurationMs
    ) {}
}
