package com.vidnyan.sysml.domain.metamodel;

import com.vidnyan.sysml.domain.model.ElementMeta;

/**
 * Creates the semantic element for a syntax node of a given kind.
 */
@FunctionalInterface
public interface MetaFactory {

    ElementMeta create(int id, String kind, TypeIndex typeIndex);
}
