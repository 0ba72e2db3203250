package com.vidnyan.sysml.domain.model;

import com.vidnyan.sysml.domain.metamodel.Kinds;
import com.vidnyan.sysml.domain.metamodel.TypeIndex;

/**
 * Multiplicity of its owning type.
 */
public class MultiplicityMeta extends FeatureMeta {

    public MultiplicityMeta(int id, String kind, TypeIndex typeIndex) {
        super(id, kind, typeIndex);
    }

    @Override
    public String defaultSupertype() {
        ElementMeta owner = owner();
        if (owner != null && owner.is(Kinds.CLASSIFIER)) return "classifier";
        if (owner != null && owner.is(Kinds.FEATURE)) return "feature";
        return "base";
    }
}
