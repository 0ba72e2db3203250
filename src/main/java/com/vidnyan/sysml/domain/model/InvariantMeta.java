package com.vidnyan.sysml.domain.model;

import com.vidnyan.sysml.domain.metamodel.TypeIndex;

/**
 * Boolean expression that must hold, or must not hold if negated.
 */
public class InvariantMeta extends ExpressionMeta {

    private boolean negated;

    public InvariantMeta(int id, String kind, TypeIndex typeIndex) {
        super(id, kind, typeIndex);
    }

    public boolean isNegated() {
        return negated;
    }

    public void setNegated(boolean negated) {
        this.negated = negated;
    }

    @Override
    public String defaultSupertype() {
        return negated ? "negated" : "base";
    }
}
