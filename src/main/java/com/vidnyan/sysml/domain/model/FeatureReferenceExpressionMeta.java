package com.vidnyan.sysml.domain.model;

import com.vidnyan.sysml.domain.metamodel.TypeIndex;

import java.util.Optional;

/**
 * Reference to a feature, evaluated in the context of the target element.
 */
public class FeatureReferenceExpressionMeta extends ExpressionMeta {

    public FeatureReferenceExpressionMeta(int id, String kind, TypeIndex typeIndex) {
        super(id, kind, typeIndex);
    }

    @Override
    public Optional<String> returnType() {
        Optional<ElementMeta> referenced = referencedElement();
        if (referenced.isEmpty()) return Optional.empty();
        if (referenced.get() instanceof ExpressionMeta expression) return expression.returnType();
        if (referenced.get() instanceof FeatureMeta feature) {
            return feature.types(SpecializationKind.TYPING).stream()
                    .findFirst()
                    .map(ElementMeta::qualifiedName);
        }
        return Optional.of(referenced.get().qualifiedName());
    }
}
