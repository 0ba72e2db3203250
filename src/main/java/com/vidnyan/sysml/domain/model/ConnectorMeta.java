package com.vidnyan.sysml.domain.model;

import com.vidnyan.sysml.domain.metamodel.TypeIndex;

/**
 * Connector between related features, binary when it has two ends.
 */
public class ConnectorMeta extends FeatureMeta {

    public ConnectorMeta(int id, String kind, TypeIndex typeIndex) {
        super(id, kind, typeIndex);
    }

    public boolean isBinary() {
        return ownedEnds().size() == 2;
    }

    @Override
    public String defaultSupertype() {
        int ends = ownedEnds().size();
        if (hasStructureType()) {
            if (ends > 2) return "object";
            return isBinary() ? "binaryObject" : "object";
        }
        if (ends > 2) return "base";
        return isBinary() ? "binary" : "base";
    }
}
