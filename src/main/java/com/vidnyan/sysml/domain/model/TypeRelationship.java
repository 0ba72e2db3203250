package com.vidnyan.sysml.domain.model;

/**
 * Non-heritage type relationship (disjoining, unioning, intersecting,
 * differencing, inverting, featuring) kept beside the specialization graph.
 */
public record TypeRelationship(
    String kind,
    TypeMeta target,
    RelationshipMeta relationship
) {}
