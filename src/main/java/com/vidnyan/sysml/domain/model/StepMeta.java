package com.vidnyan.sysml.domain.model;

import com.vidnyan.sysml.domain.metamodel.Kinds;
import com.vidnyan.sysml.domain.metamodel.TypeIndex;

/**
 * Step: a feature typed by behaviors. Placement decides which performance it subsets.
 */
public class StepMeta extends FeatureMeta {

    public StepMeta(int id, String kind, TypeIndex typeIndex) {
        super(id, kind, typeIndex);
    }

    @Override
    public String defaultSupertype() {
        if (isStructureOwnedComposite()) return "ownedPerformance";
        if (isBehaviorOwnedComposite()) return "subperformance";
        if (isBehaviorOwned()) return "enclosedPerformance";
        if (isIncomingTransfer()) return "incomingTransfer";
        return "base";
    }

    protected boolean isIncomingTransfer() {
        ElementMeta owner = owner();
        return owner != null && owner.is(Kinds.ITEM_FLOW) && !isEnd();
    }
}
