package com.vidnyan.sysml.domain.metamodel;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TypeIndexTest {

    private static Map<String, List<String>> hierarchy() {
        Map<String, List<String>> supertypes = new LinkedHashMap<>();
        supertypes.put("Element", List.of());
        supertypes.put("Namespace", List.of("Element"));
        supertypes.put("Relationship", List.of("Element"));
        supertypes.put("Type", List.of("Namespace"));
        supertypes.put("Feature", List.of("Type"));
        supertypes.put("Connector", List.of("Feature", "Relationship"));
        return supertypes;
    }

    @Test
    void isSubtype_ShouldFollowTransitiveSupertypes() {
        // Arrange
        TypeIndex index = TypeIndex.build(hierarchy());

        // Act & Assert
        assertTrue(index.isSubtype("Connector", "Element"));
        assertTrue(index.isSubtype("Connector", "Relationship"));
        assertTrue(index.isSubtype("Feature", "Feature"));
        assertFalse(index.isSubtype("Feature", "Relationship"));
        assertFalse(index.isSubtype("Element", "Type"));
        assertFalse(index.isSubtype("Unknown", "Element"));
    }

    @Test
    void getInheritanceChain_ShouldPutFirstDeclaredSupertypeClosest() {
        // Arrange
        TypeIndex index = TypeIndex.build(hierarchy());

        // Act
        List<String> chain = List.copyOf(index.getInheritanceChain("Connector"));

        // Assert
        assertEquals("Connector", chain.get(0));
        assertEquals("Feature", chain.get(1));
        assertTrue(chain.indexOf("Feature") < chain.indexOf("Relationship"));
        assertEquals(6, chain.size());
        assertEquals(List.of("Element"), List.copyOf(index.getInheritanceChain("Element")));
    }

    @Test
    void build_ShouldRejectCyclesAndUnknownSupertypes() {
        // Arrange
        Map<String, List<String>> cyclic = new LinkedHashMap<>();
        cyclic.put("A", List.of("B"));
        cyclic.put("B", List.of("A"));
        Map<String, List<String>> dangling = new LinkedHashMap<>();
        dangling.put("A", List.of("Missing"));

        // Act & Assert
        assertThrows(MetamodelException.class, () -> TypeIndex.build(cyclic));
        assertThrows(MetamodelException.class, () -> TypeIndex.build(dangling));
        assertThrows(MetamodelException.class, () -> TypeIndex.build(hierarchy()).getInheritanceChain("Missing"));
    }

    @Test
    void expandToDerivedTypes_ShouldUseNearestRegisteredAncestor() {
        // Arrange
        TypeIndex index = TypeIndex.build(hierarchy());
        Map<String, String> registry = Map.of("Element", "element", "Feature", "feature");

        // Act
        Map<String, String> expanded = index.expandToDerivedTypes(registry, null);

        // Assert
        assertEquals("element", expanded.get("Namespace"));
        assertEquals("element", expanded.get("Type"));
        assertEquals("feature", expanded.get("Feature"));
        assertEquals("feature", expanded.get("Connector"));
    }

    @Test
    void expandAndMerge_ShouldConcatenateAlongChain() {
        // Arrange
        TypeIndex index = TypeIndex.build(hierarchy());
        Map<String, List<String>> registry = Map.of(
                "Element", List.of("e"),
                "Type", List.of("t1", "t2"),
                "Connector", List.of("c"));

        // Act
        Map<String, List<String>> specificFirst = index.expandAndMerge(registry, false);
        Map<String, List<String>> generalFirst = index.expandAndMerge(registry, true);

        // Assert
        assertEquals(List.of("c", "t1", "t2", "e"), specificFirst.get("Connector"));
        assertEquals(List.of("e", "t1", "t2", "c"), generalFirst.get("Connector"));
        assertEquals(List.of("e"), generalFirst.get("Relationship"));
    }
}
