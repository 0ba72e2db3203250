package com.vidnyan.sysml.domain.model;

import com.vidnyan.sysml.domain.metamodel.TypeIndex;

import java.util.Optional;

/**
 * {@code element.metadata}: the metadata of the referenced element.
 */
public class MetadataAccessExpressionMeta extends ExpressionMeta {

    public MetadataAccessExpressionMeta(int id, String kind, TypeIndex typeIndex) {
        super(id, kind, typeIndex);
    }

    @Override
    public Optional<String> returnType() {
        return Optional.of("Metaobjects::Metaobject");
    }
}
