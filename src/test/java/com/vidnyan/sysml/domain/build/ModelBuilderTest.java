package com.vidnyan.sysml.domain.build;

import com.vidnyan.sysml.TestModels;
import com.vidnyan.sysml.domain.model.*;
import com.vidnyan.sysml.domain.syntax.SyntaxNode;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.sysml.TestModels.*;
import static org.junit.jupiter.api.Assertions.*;

class ModelBuilderTest {

    private static TestModels library;

    @BeforeAll
    static void loadLibrary() {
        library = TestModels.withStandardLibrary();
    }

    private static List<String> names(List<TypeMeta> types) {
        return types.stream().map(TypeMeta::qualifiedName).toList();
    }

    @Test
    void build_ShouldAddAnythingToClassifiers() {
        // Arrange
        TestModels models = TestModels.withStandardLibrary();

        // Act
        models.load("test:classifiers", pkg("P",
                classifier("A"),
                classifier("B", subclassification("A"))));

        // Assert
        TypeMeta b = models.element("P::B", TypeMeta.class);
        assertEquals(List.of("P::A", "Base::Anything"), names(b.allTypes()));
        SpecializationEdge first = b.specializations().get(0);
        assertEquals(EdgeSource.EXPLICIT, first.source());
        assertTrue(b.specializations().stream()
                .anyMatch(e -> e.isImplicit() && "Base::Anything".equals(e.target().qualifiedName())));
    }

    @Test
    void build_ShouldAddThingsToUntypedFeature() {
        // Arrange
        TestModels models = TestModels.withStandardLibrary();

        // Act
        models.load("test:feature", pkg("P", feature("f")));

        // Assert
        FeatureMeta f = models.element("P::f", FeatureMeta.class);
        assertEquals(List.of("Base::things"), names(f.types()));
        assertEquals(SpecializationKind.SUBSETTING, f.specializations().get(0).kind());
        assertTrue(f.conforms("Base::Anything"));
    }

    @Test
    void build_ShouldAddDataValuesToFeatureTypedByDataType() {
        // Arrange
        TestModels models = TestModels.withStandardLibrary();

        // Act
        models.load("test:data", pkg("P", feature("count", typing("ScalarValues::Integer"))));

        // Assert
        FeatureMeta count = models.element("P::count", FeatureMeta.class);
        assertTrue(count.hasDataType());
        assertEquals(List.of("ScalarValues::Integer", "Base::dataValues"), names(count.types()));
    }

    @Test
    void build_ShouldAddSubobjectsToCompositeFeatureOfStructure() {
        // Arrange
        TestModels models = TestModels.withStandardLibrary();

        // Act
        models.load("test:structure", pkg("P",
                type("Structure", "Wheel"),
                type("Structure", "Car",
                        featureMember(feature("wheel", typing("Wheel")).flag(SyntaxNode.COMPOSITE)),
                        featureMember(feature("spare", typing("Wheel"))))));

        // Assert
        assertTrue(models.element("P::Car::wheel", FeatureMeta.class).conforms("Objects::Object::subobjects"));
        FeatureMeta spare = models.element("P::Car::spare", FeatureMeta.class);
        assertTrue(spare.conforms("Objects::objects"));
        assertFalse(spare.conforms("Objects::Object::subobjects"));
    }

    @Test
    void build_ShouldUseSysmlUsageLibraryFeatures() {
        // Arrange
        TestModels models = TestModels.withStandardLibrary();

        // Act
        models.load("test:parts", pkg("Vehicles",
                type("PartDefinition", "Engine"),
                type("PartUsage", "engine", typing("Engine")),
                type("ActionUsage", "drive")));

        // Assert
        TypeMeta engine = models.element("Vehicles::Engine", TypeMeta.class);
        FeatureMeta usage = models.element("Vehicles::engine", FeatureMeta.class);
        assertTrue(engine.conforms("Parts::Part"));
        assertTrue(engine.conforms("Base::Anything"));
        assertEquals(List.of("Vehicles::Engine", "Parts::parts"), names(usage.types()));
        assertTrue(models.element("Vehicles::drive", FeatureMeta.class).conforms("Actions::actions"));
    }

    @Test
    void build_ShouldSpecializeBinaryLinkForTwoEndedAssociation() {
        // Arrange
        TestModels models = TestModels.withStandardLibrary();

        // Act
        models.load("test:association", pkg("P",
                type("Association", "Connects",
                        SyntaxNode.builder("EndFeatureMembership").child(feature("from")),
                        SyntaxNode.builder("EndFeatureMembership").child(feature("to"))),
                type("Association", "Loose")));

        // Assert
        ClassifierMeta connects = models.element("P::Connects", ClassifierMeta.class);
        assertTrue(connects.isBinary());
        assertTrue(connects.conforms("Links::BinaryLink"));
        assertTrue(models.element("P::Connects::from", FeatureMeta.class).conforms("Links::Link::participant"));
        ClassifierMeta loose = models.element("P::Loose", ClassifierMeta.class);
        assertFalse(loose.isBinary());
        assertTrue(loose.conforms("Links::Link"));
        assertFalse(loose.conforms("Links::BinaryLink"));
    }

    @Test
    void build_ShouldNotAddImplicitsNextToExplicitSubsetting() {
        // Arrange
        TestModels models = TestModels.withStandardLibrary();

        // Act
        models.load("test:subsetting", pkg("P",
                feature("whole"),
                feature("part", subsetting("whole"))));

        // Assert
        assertEquals(List.of("P::whole"), names(models.element("P::part", FeatureMeta.class).types()));
    }

    @Test
    void build_ShouldReportMissingLibraryElement() {
        // Arrange
        TestModels models = TestModels.empty();

        // Act
        models.load("test:no-library", pkg("P", classifier("A")));

        // Assert
        TypeMeta a = models.element("P::A", TypeMeta.class);
        assertTrue(a.types().isEmpty());
        assertEquals(1, a.issues().size());
        assertTrue(a.issues().get(0).message().contains("Base::Anything"));
    }

    @Test
    void build_ShouldPropagateOrderedThroughSubsetting() {
        // Arrange
        TestModels models = TestModels.empty();

        // Act
        models.load("test:ordered", pkg("P",
                feature("sequence").flag(SyntaxNode.ORDERED),
                feature("tail", subsetting("sequence"))));

        // Assert
        assertTrue(models.element("P::tail", FeatureMeta.class).isOrdered());
    }

    @Test
    void build_ShouldRejectElementWithoutDocument() {
        // Arrange
        TestModels models = TestModels.empty();
        TypeMeta orphan = new TypeMeta(1, "Type", TestModels.description().typeIndex());

        // Act & Assert
        assertThrows(IllegalStateException.class, () -> models.builder().build(orphan));
    }

    @Test
    void buildDocument_ShouldMarkDocumentBuiltAndElementsCompleted() {
        // Arrange
        TestModels models = TestModels.empty();
        ModelDocument document = models.create("test:state", pkg("P", classifier("A")));

        // Act
        models.builder().buildDocument(document);

        // Assert
        assertEquals(ModelDocument.State.BUILT, document.state());
        assertTrue(document.elements().stream().allMatch(e -> e.buildState() == ResolutionState.COMPLETED));
    }

    @Test
    void rebuild_ShouldReproduceSameEdges() {
        // Arrange
        TestModels models = TestModels.withStandardLibrary();
        models.load("test:rebuild", pkg("P",
                classifier("A"),
                classifier("B", subclassification("A"))));
        TypeMeta b = models.element("P::B", TypeMeta.class);
        List<String> before = names(b.allTypes());
        int edges = b.specializations().size();

        // Act
        List<ModelDocument> rebuilt = models.builder().rebuild("test:rebuild");

        // Assert
        assertEquals(1, rebuilt.size());
        assertEquals(before, names(b.allTypes()));
        assertEquals(edges, b.specializations().size());
    }

    @Test
    void invalidate_ShouldRebuildDependentsAgainstReplacement() {
        // Arrange
        TestModels models = TestModels.empty();
        models.load("test:first", pkg("P", classifier("A")));
        ModelDocument second = models.load("test:second", pkg("Q", classifier("B", subclassification("P::A"))));
        models.load("test:unrelated", pkg("R", classifier("C")));
        TypeMeta b = models.element("Q::B", TypeMeta.class);

        // Act
        List<ModelDocument> dependents = models.builder().invalidate("test:first");

        // Assert
        assertEquals(List.of(second), dependents);
        assertTrue(models.workspace().get("test:first").isEmpty());
        assertTrue(b.types().isEmpty());

        // Act
        models.load("test:first", pkg("P", classifier("A")));
        models.builder().rebuild("test:second");

        // Assert
        assertSame(models.element("P::A", TypeMeta.class), b.types().get(0));
    }

    @Test
    void load_ShouldRelinkEarlierDocumentWithForwardReference() {
        // Arrange
        TestModels models = TestModels.empty();
        ModelDocument first = models.load("test:A", pkg("A", classifier("Y", subclassification("B::X"))));
        models.load("test:unrelated", pkg("R", classifier("C")));
        TypeMeta y = models.element("A::Y", TypeMeta.class);
        assertTrue(y.types().isEmpty());
        assertTrue(first.hasUnresolvedReferences());

        // Act
        models.load("test:B", pkg("B", classifier("X")));

        // Assert
        assertEquals(ModelDocument.State.BUILT, first.state());
        assertSame(models.element("B::X", TypeMeta.class), y.types().get(0));
        assertTrue(y.conforms("B::X"));
        assertFalse(first.hasUnresolvedReferences());
    }

    @Test
    void workspaceAdd_ShouldOnlyResetDocumentsWithUnresolvedReferences() {
        // Arrange
        TestModels models = TestModels.empty();
        ModelDocument broken = models.load("test:broken", pkg("A", classifier("Y", subclassification("Missing::X"))));
        ModelDocument complete = models.load("test:complete", pkg("R", classifier("C")));
        ModelDocument added = models.factory().create(document("test:added", pkg("S")), false);

        // Act
        List<ModelDocument> reset = models.workspace().add(added);

        // Assert
        assertEquals(List.of(broken), reset);
        assertEquals(ModelDocument.State.CREATED, broken.state());
        assertEquals(ModelDocument.State.BUILT, complete.state());
    }

    @Test
    void invalidate_ShouldRejectLibraryDocuments() {
        // Arrange
        TestModels models = TestModels.empty();
        models.library("library:Test", pkg("Lib", classifier("Thing")));

        // Act & Assert
        assertThrows(IllegalStateException.class, () -> models.builder().invalidate("library:Test"));
        assertTrue(models.workspace().findLibraryElement("Lib::Thing").isPresent());
    }

    @Test
    void withStandardLibrary_ShouldResolveEveryLibraryReference() {
        // Arrange
        ModelWorkspace workspace = library.workspace();

        // Act
        List<ElementReference> unresolved = workspace.libraryDocuments().stream()
                .flatMap(d -> d.elements().stream())
                .flatMap(e -> e.references().stream())
                .filter(r -> !r.isResolved())
                .toList();

        // Assert
        assertTrue(unresolved.isEmpty(), () -> "Unresolved: " + unresolved);
        assertTrue(workspace.findLibraryElement("ScalarValues::Positive").orElseThrow() instanceof TypeMeta positive
                && positive.conforms("ScalarValues::Integer"));
    }
}
