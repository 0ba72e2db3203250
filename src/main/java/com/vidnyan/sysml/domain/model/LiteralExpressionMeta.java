package com.vidnyan.sysml.domain.model;

import com.vidnyan.sysml.domain.metamodel.Kinds;
import com.vidnyan.sysml.domain.metamodel.TypeIndex;

import java.util.Optional;

/**
 * Boolean, number, string or infinity literal.
 * Numbers are held as {@link Long} when integral and {@link Double} otherwise.
 */
public class LiteralExpressionMeta extends ExpressionMeta {

    private Object literal;

    public LiteralExpressionMeta(int id, String kind, TypeIndex typeIndex) {
        super(id, kind, typeIndex);
    }

    public Object literal() {
        return literal;
    }

    public void setLiteral(Object literal) {
        this.literal = literal;
    }

    public boolean isInfinity() {
        return is(Kinds.LITERAL_INFINITY);
    }

    @Override
    public Optional<String> returnType() {
        if (isInfinity()) return Optional.of("ScalarValues::Positive");
        if (literal instanceof Boolean) return Optional.of("ScalarValues::Boolean");
        if (literal instanceof String) return Optional.of("ScalarValues::String");
        if (literal instanceof Long) return Optional.of("ScalarValues::Integer");
        if (literal instanceof Double) return Optional.of("ScalarValues::Real");
        return Optional.empty();
    }
}
