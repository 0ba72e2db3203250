package com.vidnyan.sysml.application.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.sysml.ModelProperties;
import com.vidnyan.sysml.TestModels;
import com.vidnyan.sysml.adapter.out.library.FileSystemLibraryRepository;
import com.vidnyan.sysml.adapter.out.syntax.JsonSyntaxTreeReader;
import com.vidnyan.sysml.adapter.out.syntax.SyntaxDocumentMapper;
import com.vidnyan.sysml.application.port.in.BuildModelUseCase.BuildRequest;
import com.vidnyan.sysml.application.port.in.BuildModelUseCase.BuildResult;
import com.vidnyan.sysml.application.port.in.BuildModelUseCase.EvaluatedExpression;
import com.vidnyan.sysml.application.port.in.BuildModelUseCase.UnresolvedReference;
import com.vidnyan.sysml.domain.model.ModelDocument;
import com.vidnyan.sysml.domain.model.TypeMeta;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelBuildServiceTest {

    private static final String VEHICLES = """
            { "uri": "model:vehicles", "root": { "kind": "Namespace", "children": [
              { "kind": "OwningMembership", "children": [
                { "kind": "Package", "name": "Vehicles", "children": [
                  { "kind": "OwningMembership", "children": [ { "kind": "PartDefinition", "name": "Engine" } ] },
                  { "kind": "OwningMembership", "children": [
                    { "kind": "PartUsage", "name": "engine", "children": [
                      { "kind": "FeatureTyping", "reference": "Engine" } ] } ] },
                  { "kind": "OwningMembership", "children": [
                    { "kind": "AttributeUsage", "name": "mass", "children": [
                      { "kind": "FeatureValue", "children": [
                        { "kind": "OperatorExpression", "operator": "+", "children": [
                          { "kind": "LiteralNumber", "value": 1000 },
                          { "kind": "LiteralNumber", "value": 500 } ] } ] } ] } ] },
                  { "kind": "OwningMembership", "children": [
                    { "kind": "Classifier", "name": "Broken", "children": [
                      { "kind": "Subclassification", "reference": "Missing" } ] } ] }
                ] } ] } ] } }
            """;

    @TempDir
    Path tempDir;

    private TestModels models;
    private ModelProperties properties;
    private ModelBuildService service;

    @BeforeEach
    void setUp() {
        models = TestModels.empty();
        properties = new ModelProperties();
        SyntaxDocumentMapper mapper = new SyntaxDocumentMapper(new ObjectMapper());
        service = new ModelBuildService(
                new JsonSyntaxTreeReader(mapper),
                new FileSystemLibraryRepository(mapper, properties),
                models.workspace(),
                models.factory(),
                models.builder(),
                models.evaluator(),
                properties);
    }

    private static String packageDocument(String uri, String packageName, String classifier, String general) {
        String heritage = general == null ? ""
                : ", \"children\": [ { \"kind\": \"Subclassification\", \"reference\": \"" + general + "\" } ]";
        return "{ \"uri\": \"" + uri + "\", \"root\": { \"kind\": \"Namespace\", \"children\": ["
                + " { \"kind\": \"OwningMembership\", \"children\": ["
                + " { \"kind\": \"Package\", \"name\": \"" + packageName + "\", \"children\": ["
                + " { \"kind\": \"OwningMembership\", \"children\": ["
                + " { \"kind\": \"Classifier\", \"name\": \"" + classifier + "\"" + heritage + " } ] } ] } ] } ] } }";
    }

    @Test
    void build_ShouldLinkAgainstLibraryAndCollectDiagnostics() throws IOException {
        // Arrange
        Path file = Files.writeString(tempDir.resolve("vehicles.json"), VEHICLES);

        // Act
        BuildResult result = service.build(BuildRequest.forPath(file));

        // Assert
        assertEquals(15, result.stats().libraryDocuments());
        assertEquals(1, result.stats().documentsBuilt());
        assertEquals(1, result.stats().explicitSpecializations());
        assertTrue(result.stats().implicitSpecializations() > 0);
        assertTrue(result.failures().isEmpty());
        assertTrue(result.issues().isEmpty());
        assertFalse(result.isClean());

        assertEquals(List.of(new UnresolvedReference("model:vehicles", "Vehicles::Broken", "Missing", 0)),
                result.unresolvedReferences());
        assertTrue(result.evaluations().stream()
                .map(EvaluatedExpression::values)
                .anyMatch(List.of("1500")::equals));
        assertTrue(result.evaluations().stream().anyMatch(e -> "Vehicles::mass".equals(e.owner())));
        TypeMeta engine = (TypeMeta) models.workspace().get("model:vehicles").orElseThrow()
                .root().findMember("Vehicles").orElseThrow()
                .findMember("engine").orElseThrow();
        assertTrue(engine.conforms("Parts::parts"));
    }

    @Test
    void build_ShouldSkipEvaluationWhenDisabled() throws IOException {
        // Arrange
        Path file = Files.writeString(tempDir.resolve("vehicles.json"), VEHICLES);

        // Act
        BuildResult result = service.build(new BuildRequest(file, false));

        // Assert
        assertTrue(result.evaluations().isEmpty());
    }

    @Test
    void build_ShouldReportMissingImplicitsWithoutStandardLibrary() throws IOException {
        // Arrange
        properties.setStandardLibrary(false);
        Path file = Files.writeString(tempDir.resolve("a.json"), packageDocument("model:a", "P", "A", null));

        // Act
        BuildResult result = service.build(BuildRequest.forPath(file));

        // Assert
        assertEquals(0, result.stats().libraryDocuments());
        assertEquals(1, result.issues().size());
        assertEquals("P::A", result.issues().get(0).qualifiedName());
    }

    @Test
    void build_ShouldReportUnreadableDocuments() throws IOException {
        // Arrange
        Files.writeString(tempDir.resolve("a.json"), packageDocument("model:a", "P", "A", null));
        Files.writeString(tempDir.resolve("broken.json"), "{");

        // Act
        BuildResult result = service.build(BuildRequest.forPath(tempDir));

        // Assert
        assertEquals(1, result.documents().size());
        assertEquals(1, result.failures().size());
        assertFalse(result.isClean());
    }

    @Test
    void build_ShouldReplaceDocumentAndRebuildDependents() throws IOException {
        // Arrange
        Path a = Files.writeString(tempDir.resolve("a.json"), packageDocument("model:a", "P", "A", null));
        Files.writeString(tempDir.resolve("b.json"), packageDocument("model:b", "Q", "B", "P::A"));
        service.build(BuildRequest.forPath(tempDir));
        ModelDocument b = models.workspace().get("model:b").orElseThrow();
        TypeMeta typeB = (TypeMeta) b.root().findMember("Q").orElseThrow().findMember("B").orElseThrow();
        assertTrue(typeB.conforms("P::A"));

        // Act
        Files.writeString(a, packageDocument("model:a", "P", "Renamed", null));
        BuildResult result = service.build(BuildRequest.forPath(a));

        // Assert
        assertEquals(1, result.documents().size());
        assertEquals(2, models.workspace().userDocuments().size());
        assertEquals(15, models.workspace().libraryDocuments().size());
        assertEquals(ModelDocument.State.BUILT, b.state());
        assertFalse(typeB.conforms("P::A"));
        assertTrue(typeB.conforms("Base::Anything"));
    }

    @Test
    void build_ShouldResolveForwardReferencesOnceTargetDocumentArrives() throws IOException {
        // Arrange
        Path b = Files.writeString(tempDir.resolve("b.json"), packageDocument("model:b", "Q", "B", "P::A"));
        BuildResult first = service.build(BuildRequest.forPath(b));
        ModelDocument documentB = models.workspace().get("model:b").orElseThrow();
        TypeMeta typeB = (TypeMeta) documentB.root().findMember("Q").orElseThrow().findMember("B").orElseThrow();
        assertEquals(1, first.unresolvedReferences().size());
        assertFalse(typeB.conforms("P::A"));

        // Act
        Path a = Files.writeString(tempDir.resolve("a.json"), packageDocument("model:a", "P", "A", null));
        service.build(BuildRequest.forPath(a));

        // Assert
        assertEquals(ModelDocument.State.BUILT, documentB.state());
        assertFalse(documentB.hasUnresolvedReferences());
        assertTrue(typeB.conforms("P::A"));
    }

    @Test
    void rebuildAndInvalidate_ShouldDelegateToBuilder() throws IOException {
        // Arrange
        Files.writeString(tempDir.resolve("a.json"), packageDocument("model:a", "P", "A", null));
        Files.writeString(tempDir.resolve("b.json"), packageDocument("model:b", "Q", "B", "P::A"));
        service.build(BuildRequest.forPath(tempDir));

        // Act
        List<ModelDocument> rebuilt = service.rebuild("model:a");
        List<ModelDocument> dependents = service.invalidate("model:a");

        // Assert
        assertEquals(List.of("model:a", "model:b"), rebuilt.stream().map(ModelDocument::uri).toList());
        assertEquals(List.of("model:b"), dependents.stream().map(ModelDocument::uri).toList());
        assertTrue(models.workspace().get("model:a").isEmpty());
    }
}
