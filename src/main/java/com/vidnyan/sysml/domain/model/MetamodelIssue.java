package com.vidnyan.sysml.domain.model;

/**
 * A recoverable problem found while building an element, e.g. a missing library type.
 */
public record MetamodelIssue(
    int elementId,
    String qualifiedName,
    String message
) {

    public static MetamodelIssue of(ElementMeta element, String message) {
        return new MetamodelIssue(element.id(), element.qualifiedName(), message);
    }
}
