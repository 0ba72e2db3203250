package com.vidnyan.sysml.domain.model;

import com.vidnyan.sysml.TestModels;
import com.vidnyan.sysml.domain.metamodel.Kinds;
import com.vidnyan.sysml.domain.metamodel.TypeIndex;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TypeMetaTest {

    private final TypeIndex index = TestModels.description().typeIndex();
    private int ids = 1;

    private TypeMeta type() {
        return new ClassifierMeta(ids++, Kinds.CLASSIFIER, index);
    }

    private FeatureMeta feature() {
        return new FeatureMeta(ids++, Kinds.FEATURE, index);
    }

    @Test
    void addSpecialization_ShouldIgnoreSelf() {
        // Arrange
        TypeMeta a = type();

        // Act
        boolean added = a.addSpecialization(a, SpecializationKind.SUBCLASSIFICATION, EdgeSource.EXPLICIT);

        // Assert
        assertFalse(added);
        assertTrue(a.types().isEmpty());
    }

    @Test
    void addSpecialization_ShouldKeepFirstEdgePerTarget() {
        // Arrange
        TypeMeta a = type();
        TypeMeta b = type();

        // Act
        boolean first = b.addSpecialization(a, SpecializationKind.SUBCLASSIFICATION, EdgeSource.EXPLICIT);
        boolean second = b.addSpecialization(a, SpecializationKind.SUBCLASSIFICATION, EdgeSource.IMPLICIT);

        // Assert
        assertTrue(first);
        assertFalse(second);
        assertEquals(1, b.specializations().size());
        assertFalse(b.specializations().get(0).isImplicit());
    }

    @Test
    void allTypes_ShouldTerminateOnCycles() {
        // Arrange
        TypeMeta a = type();
        TypeMeta b = type();
        TypeMeta c = type();
        a.addSpecialization(b, SpecializationKind.SUBCLASSIFICATION, EdgeSource.EXPLICIT);
        b.addSpecialization(c, SpecializationKind.SUBCLASSIFICATION, EdgeSource.EXPLICIT);
        c.addSpecialization(a, SpecializationKind.SUBCLASSIFICATION, EdgeSource.EXPLICIT);

        // Act
        List<TypeMeta> all = a.allTypes();

        // Assert
        assertEquals(List.of(b, c), all);
        assertTrue(c.conforms(b));
        assertTrue(a.conforms(c));
    }

    @Test
    void allTypes_ShouldVisitDiamondOnceInPreOrder() {
        // Arrange
        TypeMeta top = type();
        TypeMeta left = type();
        TypeMeta right = type();
        TypeMeta bottom = type();
        bottom.addSpecialization(left, SpecializationKind.SUBCLASSIFICATION, EdgeSource.EXPLICIT);
        bottom.addSpecialization(right, SpecializationKind.SUBCLASSIFICATION, EdgeSource.EXPLICIT);
        left.addSpecialization(top, SpecializationKind.SUBCLASSIFICATION, EdgeSource.EXPLICIT);
        right.addSpecialization(top, SpecializationKind.SUBCLASSIFICATION, EdgeSource.EXPLICIT);

        // Act
        List<TypeMeta> all = bottom.allTypes(SpecializationKind.NONE, true);

        // Assert
        assertEquals(List.of(bottom, left, top, right), all);
    }

    @Test
    void types_ShouldFilterByKind() {
        // Arrange
        TypeMeta typ = type();
        FeatureMeta general = feature();
        FeatureMeta redefined = feature();
        FeatureMeta f = feature();
        f.addSpecialization(typ, SpecializationKind.TYPING, EdgeSource.EXPLICIT);
        f.addSpecialization(general, SpecializationKind.SUBSETTING, EdgeSource.EXPLICIT);
        f.addSpecialization(redefined, SpecializationKind.REDEFINITION, EdgeSource.EXPLICIT);

        // Act & Assert
        assertEquals(List.of(typ), f.types(SpecializationKind.TYPING));
        assertEquals(List.of(general, redefined), f.types(SpecializationKind.SUBSETTING));
        assertEquals(List.of(redefined), f.types(SpecializationKind.REDEFINITION));
        assertEquals(List.of(typ, general, redefined), f.types());
    }

    @Test
    void conforms_ShouldRespectKindFilter() {
        // Arrange
        TypeMeta a = type();
        TypeMeta b = type();
        b.addSpecialization(a, SpecializationKind.SUBCLASSIFICATION, EdgeSource.EXPLICIT);

        // Act & Assert
        assertTrue(b.conforms(a));
        assertTrue(b.conforms(a, SpecializationKind.SUBCLASSIFICATION));
        assertFalse(b.conforms(a, SpecializationKind.REDEFINITION));
        assertFalse(a.conforms(b));
        assertTrue(a.conforms(a, SpecializationKind.REDEFINITION));
    }

    @Test
    void allFeatures_ShouldLeaveOutRedefinedFeatures() {
        // Arrange
        TypeMeta a = type();
        TypeMeta b = type();
        FeatureMeta x = feature();
        FeatureMeta y = feature();
        FeatureMeta z = feature();
        a.addChild(x);
        a.addChild(z);
        b.addChild(y);
        b.addSpecialization(a, SpecializationKind.SUBCLASSIFICATION, EdgeSource.EXPLICIT);
        y.addSpecialization(x, SpecializationKind.REDEFINITION, EdgeSource.EXPLICIT);

        // Act
        List<FeatureMeta> features = b.allFeatures();

        // Assert
        assertEquals(List.of(y, z), features);
    }

    @Test
    void propagateOrdered_ShouldInheritFromSubsettedFeature() {
        // Arrange
        FeatureMeta ordered = feature();
        ordered.setOrdered(true);
        FeatureMeta f = feature();
        f.addSpecialization(ordered, SpecializationKind.SUBSETTING, EdgeSource.EXPLICIT);

        // Act
        f.propagateOrdered();

        // Assert
        assertTrue(f.isOrdered());
        f.resetLinks();
        assertFalse(f.isOrdered());
        assertTrue(f.types().isEmpty());
    }
}
