package com.vidnyan.sysml.domain.model;

import com.vidnyan.sysml.domain.metamodel.TypeIndex;

import java.util.Optional;

/**
 * The empty sequence.
 */
public class NullExpressionMeta extends ExpressionMeta {

    public NullExpressionMeta(int id, String kind, TypeIndex typeIndex) {
        super(id, kind, typeIndex);
    }

    @Override
    public Optional<String> returnType() {
        return Optional.of("Base::Anything");
    }
}
