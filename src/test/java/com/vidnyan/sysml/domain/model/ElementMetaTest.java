package com.vidnyan.sysml.domain.model;

import com.vidnyan.sysml.TestModels;
import org.junit.jupiter.api.Test;

import static com.vidnyan.sysml.TestModels.*;
import static org.junit.jupiter.api.Assertions.*;

class ElementMetaTest {

    @Test
    void qualifiedName_ShouldSkipMembershipsAndRoot() {
        // Arrange
        TestModels models = TestModels.empty();
        models.create("test:names", pkg("P", classifier("A", featureMember(feature("x")))));

        // Act
        FeatureMeta x = models.element("P::A::x", FeatureMeta.class);

        // Assert
        assertEquals("P::A::x", x.qualifiedName());
        assertEquals("A", x.owner().effectiveName());
        assertTrue(x.owningMembership().isPresent());
    }

    @Test
    void names_ShouldBeSanitizedAndIncludeShortName() {
        // Arrange
        TestModels models = TestModels.empty();
        models.create("test:names", pkg("P", node("Classifier", "'my type'").shortName("mt")));
        NamespaceMeta p = models.element("P", NamespaceMeta.class);

        // Act
        ElementMeta byName = p.findMember("my type").orElseThrow();
        ElementMeta byShortName = p.findMember("mt").orElseThrow();

        // Assert
        assertSame(byName, byShortName);
        assertEquals("'my type'", byName.name().raw());
        assertEquals("P::my type", byName.qualifiedName());
    }

    @Test
    void updateName_ShouldRekeyOwnerAndRecomputeQualifiedNames() {
        // Arrange
        TestModels models = TestModels.empty();
        models.create("test:names", pkg("P", classifier("A", featureMember(feature("x")))));
        NamespaceMeta p = models.element("P", NamespaceMeta.class);
        TypeMeta a = models.element("P::A", TypeMeta.class);
        FeatureMeta x = models.element("P::A::x", FeatureMeta.class);

        // Act
        a.updateName("B", null);

        // Assert
        assertTrue(p.findMember("A").isEmpty());
        assertSame(a, p.findMember("B").orElseThrow());
        assertEquals("P::B::x", x.qualifiedName());
    }

    @Test
    void updateName_ShouldHandOverFreedNameToSibling() {
        // Arrange
        TestModels models = TestModels.empty();
        models.create("test:siblings", pkg("P", classifier("x"), feature("x")));
        NamespaceMeta p = models.element("P", NamespaceMeta.class);
        ElementMeta first = p.findMember("x").orElseThrow();
        ElementMeta second = p.ownedElements().stream()
                .filter(e -> e instanceof FeatureMeta)
                .findFirst()
                .orElseThrow();

        // Act
        first.updateName("y", null);

        // Assert
        assertTrue(first instanceof ClassifierMeta);
        assertSame(second, p.findMember("x").orElseThrow());
        assertSame(first, p.findMember("y").orElseThrow());
        assertEquals("P::x", second.qualifiedName());
    }

    @Test
    void visibility_ShouldComeFromDeclarationOrMembership() {
        // Arrange
        TestModels models = TestModels.empty();
        models.create("test:visibility", node("Package", "P")
                .child(member(classifier("Hidden")).visibility("private"))
                .child(member(classifier("Guarded").visibility("protected")))
                .child(member(classifier("Open"))));

        // Act & Assert
        assertEquals(Visibility.PRIVATE, models.element("P::Hidden", TypeMeta.class).visibility());
        assertEquals(Visibility.PROTECTED, models.element("P::Guarded", TypeMeta.class).visibility());
        assertEquals(Visibility.PUBLIC, models.element("P::Open", TypeMeta.class).visibility());
    }

    @Test
    void displayName_ShouldFallBackToId() {
        // Arrange
        TestModels models = TestModels.empty();
        ModelDocument document = models.create("test:anonymous", pkg("P", classifier(null)));

        // Act
        ElementMeta anonymous = document.elements().stream()
                .filter(e -> e instanceof TypeMeta)
                .findFirst()
                .orElseThrow();

        // Assert
        assertNull(anonymous.effectiveName());
        assertEquals(String.valueOf(anonymous.id()), anonymous.displayName());
        assertTrue(anonymous.memberNames().isEmpty());
    }
}
