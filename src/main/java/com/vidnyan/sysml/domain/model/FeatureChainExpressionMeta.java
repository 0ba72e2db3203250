package com.vidnyan.sysml.domain.model;

import com.vidnyan.sysml.domain.metamodel.TypeIndex;

import java.util.Optional;

/**
 * {@code source.feature}: navigates from the values of the source expression
 * to the referenced feature.
 */
public class FeatureChainExpressionMeta extends OperatorExpressionMeta {

    public FeatureChainExpressionMeta(int id, String kind, TypeIndex typeIndex) {
        super(id, kind, typeIndex);
    }

    public Optional<ExpressionMeta> source() {
        return argument(0);
    }

    /**
     * The feature navigated to, once linked.
     */
    public Optional<FeatureMeta> targetFeature() {
        return referencedElement()
                .filter(FeatureMeta.class::isInstance)
                .map(FeatureMeta.class::cast);
    }

    @Override
    public Optional<String> returnType() {
        return targetFeature()
                .flatMap(f -> f.types(SpecializationKind.TYPING).stream().findFirst())
                .map(ElementMeta::qualifiedName);
    }
}
