package com.vidnyan.sysml.domain.model;

import com.vidnyan.sysml.domain.metamodel.TypeIndex;

/**
 * SysML usage. Its library feature depends only on the usage kind.
 */
public class UsageMeta extends FeatureMeta {

    public UsageMeta(int id, String kind, TypeIndex typeIndex) {
        super(id, kind, typeIndex);
    }

    @Override
    public String defaultSupertype() {
        return "base";
    }
}
