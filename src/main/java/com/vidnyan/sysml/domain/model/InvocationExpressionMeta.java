package com.vidnyan.sysml.domain.model;

import com.vidnyan.sysml.domain.metamodel.TypeIndex;

import java.util.Optional;

/**
 * Invocation of a function given by reference, with positional arguments.
 */
public class InvocationExpressionMeta extends ExpressionMeta {

    public InvocationExpressionMeta(int id, String kind, TypeIndex typeIndex) {
        super(id, kind, typeIndex);
    }

    /**
     * The invoked function or type, once linked.
     */
    public Optional<TypeMeta> invokedType() {
        return referencedElement()
                .filter(TypeMeta.class::isInstance)
                .map(TypeMeta.class::cast);
    }

    @Override
    public Optional<String> getFunction() {
        Optional<TypeMeta> invoked = invokedType();
        if (invoked.isPresent()) return Optional.of(invoked.get().qualifiedName());
        return reference().map(ElementReference::text).map(Names::sanitize);
    }

    @Override
    public Optional<String> returnType() {
        Optional<TypeMeta> invoked = invokedType();
        if (invoked.isEmpty()) return super.returnType();
        Optional<FeatureMeta> result = invoked.get().resultParameter()
                .or(() -> invoked.get().returnParameter());
        if (result.isPresent()) {
            if (result.get() instanceof ExpressionMeta expression) return expression.returnType();
            return result.get().types(SpecializationKind.TYPING).stream()
                    .findFirst()
                    .map(ElementMeta::qualifiedName);
        }
        // invoking a non-function type constructs an instance of it
        if (!(invoked.get() instanceof FeatureMeta)) return Optional.of(invoked.get().qualifiedName());
        return Optional.empty();
    }
}
