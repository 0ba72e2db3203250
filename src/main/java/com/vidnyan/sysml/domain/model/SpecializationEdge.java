package com.vidnyan.sysml.domain.model;

/**
 * Outgoing specialization edge of a type.
 * {@code relationship} is null for implicit and synthetic edges.
 */
public record SpecializationEdge(
    TypeMeta target,
    SpecializationKind kind,
    EdgeSource source,
    RelationshipMeta relationship
) {

    public boolean isImplicit() {
        return source == EdgeSource.IMPLICIT;
    }
}
