package com.vidnyan.sysml.domain.model;

import com.vidnyan.sysml.domain.metamodel.TypeIndex;

import java.util.List;

/**
 * Item flow: a connector that is also a step.
 */
public class ItemFlowMeta extends ConnectorMeta {

    public ItemFlowMeta(int id, String kind, TypeIndex typeIndex) {
        super(id, kind, typeIndex);
    }

    @Override
    public String defaultSupertype() {
        return "base";
    }

    @Override
    public List<String> defaultGeneralTypes() {
        List<String> keys = super.defaultGeneralTypes();
        if (isStructureOwnedComposite()) keys.add("ownedPerformance");
        if (isBehaviorOwnedComposite()) keys.add("subperformance");
        if (isBehaviorOwned()) keys.add("enclosedPerformance");
        return keys;
    }
}
