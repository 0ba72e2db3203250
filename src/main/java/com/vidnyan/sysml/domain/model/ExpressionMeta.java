package com.vidnyan.sysml.domain.model;

import com.vidnyan.sysml.domain.metamodel.TypeIndex;

import java.util.List;
import java.util.Optional;

/**
 * Expression: a step whose evaluation yields values.
 */
public class ExpressionMeta extends StepMeta {

    private ElementReference reference;

    public ExpressionMeta(int id, String kind, TypeIndex typeIndex) {
        super(id, kind, typeIndex);
    }

    public Optional<ElementReference> reference() {
        return Optional.ofNullable(reference);
    }

    public void setReference(ElementReference reference) {
        this.reference = reference;
    }

    /**
     * Target of this expression's reference, if it has one and it resolved.
     */
    public Optional<ElementMeta> referencedElement() {
        return reference == null ? Optional.empty() : reference.target();
    }

    /**
     * Owned argument expressions in declared order.
     */
    public List<ExpressionMeta> arguments() {
        return ownedElements().stream()
                .filter(ExpressionMeta.class::isInstance)
                .map(ExpressionMeta.class::cast)
                .toList();
    }

    public Optional<ExpressionMeta> argument(int index) {
        List<ExpressionMeta> arguments = arguments();
        return index >= 0 && index < arguments.size() ? Optional.of(arguments.get(index)) : Optional.empty();
    }

    /**
     * Qualified name of the function this expression invokes.
     */
    public Optional<String> getFunction() {
        return Optional.empty();
    }

    /**
     * Qualified name of the type of values this expression yields, if it can be inferred.
     */
    public Optional<String> returnType() {
        Optional<FeatureMeta> result = resultParameter();
        if (result.isPresent() && result.get() instanceof ExpressionMeta expression && expression != this) {
            return expression.returnType();
        }
        return types(SpecializationKind.TYPING).stream()
                .findFirst()
                .map(ElementMeta::qualifiedName);
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

    @Override
    public List<ElementReference> references() {
        return reference == null ? List.of() : List.of(reference);
    }

    @Override
    public void resetLinks() {
        super.resetLinks();
        if (reference != null) reference.reset();
    }
}
