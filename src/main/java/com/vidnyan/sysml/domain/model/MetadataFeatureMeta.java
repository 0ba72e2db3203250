package com.vidnyan.sysml.domain.model;

import com.vidnyan.sysml.domain.metamodel.TypeIndex;

/**
 * Metadata applied to its owning element.
 */
public class MetadataFeatureMeta extends FeatureMeta {

    public MetadataFeatureMeta(int id, String kind, TypeIndex typeIndex) {
        super(id, kind, typeIndex);
    }

    public ElementMeta annotatedElement() {
        return owner();
    }

    /**
     * The metaclass typing this metadata.
     */
    public TypeMeta metaclass() {
        return types(SpecializationKind.TYPING).stream().findFirst().orElse(null);
    }

    @Override
    public String defaultSupertype() {
        return "base";
    }
}
