package com.vidnyan.sysml.domain.scope;

import com.vidnyan.sysml.TestModels;
import com.vidnyan.sysml.domain.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.sysml.TestModels.*;
import static org.junit.jupiter.api.Assertions.*;

class LinkerTest {

    private static ElementReference heritageReference(TypeMeta type) {
        return type.children().stream()
                .filter(SpecializationMeta.class::isInstance)
                .map(SpecializationMeta.class::cast)
                .findFirst()
                .flatMap(SpecializationMeta::reference)
                .orElseThrow();
    }

    @Test
    void link_ShouldResolveQualifiedNameAcrossPackages() {
        // Arrange
        TestModels models = TestModels.empty();

        // Act
        models.load("test:qualified",
                pkg("P", classifier("A")),
                pkg("Q", classifier("B", subclassification("P::A"))));

        // Assert
        TypeMeta a = models.element("P::A", TypeMeta.class);
        TypeMeta b = models.element("Q::B", TypeMeta.class);
        assertEquals(List.of(a), b.types());
        ElementReference reference = heritageReference(b);
        assertEquals(2, reference.found().size());
        assertSame(a, reference.target().orElseThrow());
    }

    @Test
    void link_ShouldResolveThroughEnclosingNamespaces() {
        // Arrange
        TestModels models = TestModels.empty();

        // Act
        models.load("test:enclosing",
                pkg("P", classifier("A"), pkg("Inner", classifier("B", subclassification("A")))));

        // Assert
        assertTrue(models.element("P::Inner::B", TypeMeta.class)
                .conforms(models.element("P::A", TypeMeta.class)));
    }

    @Test
    void link_ShouldResolveAcrossDocuments() {
        // Arrange
        TestModels models = TestModels.empty();
        models.load("test:first", pkg("P", classifier("A")));

        // Act
        models.load("test:second", pkg("Q", classifier("B", subclassification("P::A"))));

        // Assert
        assertTrue(models.element("Q::B", TypeMeta.class).conforms(models.element("P::A", TypeMeta.class)));
    }

    @Test
    void link_ShouldUseWildcardSpecificAndRecursiveImports() {
        // Arrange
        TestModels models = TestModels.empty();

        // Act
        models.load("test:imports",
                pkg("P", classifier("A"), classifier("C"), pkg("Inner", classifier("Deep"))),
                pkg("Wild", importing("P::*"), classifier("B", subclassification("A"))),
                pkg("Specific", importing("P::C"), classifier("B", subclassification("C"))),
                pkg("Recursive", importing("P::**"), classifier("B", subclassification("Deep"))));

        // Assert
        assertTrue(models.element("Wild::B", TypeMeta.class).conforms(models.element("P::A", TypeMeta.class)));
        assertTrue(models.element("Specific::B", TypeMeta.class).conforms(models.element("P::C", TypeMeta.class)));
        assertTrue(models.element("Recursive::B", TypeMeta.class)
                .conforms(models.element("P::Inner::Deep", TypeMeta.class)));
    }

    @Test
    void link_ShouldNotImportPrivateMembers() {
        // Arrange
        TestModels models = TestModels.empty();

        // Act
        models.load("test:private",
                pkg("P", classifier("A").visibility("private")),
                pkg("Q", importing("P::*"), classifier("B", subclassification("A"))));

        // Assert
        TypeMeta b = models.element("Q::B", TypeMeta.class);
        ElementReference reference = heritageReference(b);
        assertTrue(reference.isAttempted());
        assertFalse(reference.isResolved());
        assertTrue(reference.found().isEmpty());
        assertTrue(b.types().isEmpty());
    }

    @Test
    void link_ShouldTerminateOnImportCycles() {
        // Arrange
        TestModels models = TestModels.empty();

        // Act
        models.load("test:cycle",
                pkg("P", importing("Q::*").visibility("public"), classifier("A")),
                pkg("Q", importing("P::*").visibility("public"),
                        classifier("C", subclassification("A")),
                        classifier("B", subclassification("Missing"))));

        // Assert
        assertTrue(models.element("Q::C", TypeMeta.class).conforms(models.element("P::A", TypeMeta.class)));
        assertFalse(heritageReference(models.element("Q::B", TypeMeta.class)).isResolved());
    }

    @Test
    void link_ShouldFindInheritedMembersButNotPrivateOnes() {
        // Arrange
        TestModels models = TestModels.empty();

        // Act
        models.load("test:inherited", pkg("P",
                classifier("A",
                        featureMember(feature("x")),
                        featureMember(feature("hidden").visibility("private"))),
                classifier("B",
                        subclassification("A"),
                        featureMember(feature("y", subsetting("x"))),
                        featureMember(feature("z", subsetting("hidden"))))));

        // Assert
        FeatureMeta x = models.element("P::A::x", FeatureMeta.class);
        assertEquals(List.of(x), models.element("P::B::y", FeatureMeta.class).types());
        assertTrue(models.element("P::B::z", FeatureMeta.class).types().isEmpty());
    }

    @Test
    void link_ShouldSkipRedefiningFeatureWhenResolvingItsOwnName() {
        // Arrange
        TestModels models = TestModels.empty();

        // Act
        models.load("test:redefinition", pkg("P",
                classifier("A", featureMember(feature("x"))),
                classifier("B", subclassification("A"), featureMember(feature("x", redefinition("x"))))));

        // Assert
        FeatureMeta original = models.element("P::A::x", FeatureMeta.class);
        FeatureMeta redefining = models.element("P::B::x", FeatureMeta.class);
        assertEquals(List.of(original), redefining.types(SpecializationKind.REDEFINITION));
        assertEquals(List.of(redefining), models.element("P::B", TypeMeta.class).allFeatures());
    }

    @Test
    void build_ShouldNameAnonymousFeatureAfterRedefinedFeature() {
        // Arrange
        TestModels models = TestModels.empty();

        // Act
        models.load("test:naming", pkg("P",
                classifier("A", featureMember(feature("x"))),
                classifier("B", subclassification("A"), featureMember(feature(null, redefinition("x"))))));

        // Assert
        TypeMeta b = models.element("P::B", TypeMeta.class);
        FeatureMeta anonymous = (FeatureMeta) b.findMember("x").orElseThrow();
        assertNull(anonymous.name());
        assertEquals("x", anonymous.effectiveName());
        assertEquals("P::B::x", anonymous.qualifiedName());
    }

    @Test
    void link_ShouldFollowAliases() {
        // Arrange
        TestModels models = TestModels.empty();

        // Act
        models.load("test:alias",
                node("Package", "P").child(member(classifier("A"))).child(alias("Alt", "A")),
                pkg("Q", classifier("B", subclassification("P::Alt"))));

        // Assert
        assertEquals(List.of(models.element("P::A", TypeMeta.class)), models.element("Q::B", TypeMeta.class).types());
    }

    @Test
    void link_ShouldTerminateOnInheritanceCycles() {
        // Arrange
        TestModels models = TestModels.empty();

        // Act
        models.load("test:inheritance-cycle", pkg("P",
                classifier("A", subclassification("B"), featureMember(feature("f", typing("Missing")))),
                classifier("B", subclassification("A"))));

        // Assert
        TypeMeta a = models.element("P::A", TypeMeta.class);
        TypeMeta b = models.element("P::B", TypeMeta.class);
        assertTrue(a.conforms(b));
        assertTrue(b.conforms(a));
        assertTrue(models.element("P::A::f", FeatureMeta.class).types().isEmpty());
    }

    @Test
    void link_ShouldResolveFeatureChains() {
        // Arrange
        TestModels models = TestModels.empty();

        // Act
        models.load("test:chain", pkg("P",
                classifier("C", featureMember(feature("c"))),
                classifier("T", featureMember(feature("b", typing("C")))),
                feature("a", typing("T")),
                feature("d", subsetting("a.b.c"))));

        // Assert
        FeatureMeta d = models.element("P::d", FeatureMeta.class);
        FeatureMeta c = models.element("P::C::c", FeatureMeta.class);
        assertEquals(List.of(c), d.types(SpecializationKind.SUBSETTING));
        assertEquals(List.of(
                models.element("P::a", FeatureMeta.class),
                models.element("P::T::b", FeatureMeta.class),
                c), d.chainingFeatures());
    }

    @Test
    void scopeChain_ShouldListVisibleMembers() {
        // Arrange
        TestModels models = TestModels.empty();
        models.load("test:members",
                pkg("P", classifier("A"), classifier("Secret").visibility("private")),
                pkg("Q", importing("P::*"), classifier("B")));
        NamespaceMeta q = models.element("Q", NamespaceMeta.class);

        // Act
        var members = new ScopeChain(q, ScopeOptions.create(models.builder(), null)).allMembers();

        // Assert
        assertTrue(members.containsKey("A"));
        assertTrue(members.containsKey("B"));
        assertTrue(members.containsKey("P"));
        assertFalse(members.containsKey("Secret"));
    }
}
