package com.vidnyan.sysml.domain.expression;

import com.vidnyan.sysml.domain.model.*;

import java.util.*;
import java.util.function.Function;

/**
 * Tree-walking evaluator for model-level evaluable expressions.
 * An empty result means "not evaluable at model level"; it is the common outcome, not an error.
 */
public class ExpressionEvaluator {

    private static final String SELF = "Base::Anything::self";

    private static final List<String> NATURAL = List.of(
            "ScalarValues::Natural", "ScalarValues::Integer", "ScalarValues::Rational", "ScalarValues::Real",
            "ScalarValues::Complex", "ScalarValues::NumericalValue", "ScalarValues::ScalarValue",
            "Base::DataValue", "Base::Anything");
    private static final List<String> INTEGER = NATURAL.subList(1, NATURAL.size());
    private static final List<String> REAL = NATURAL.subList(3, NATURAL.size());
    private static final List<String> BOOLEAN = List.of(
            "ScalarValues::Boolean", "ScalarValues::ScalarValue", "Base::DataValue", "Base::Anything");
    private static final List<String> STRING = List.of(
            "ScalarValues::String", "ScalarValues::ScalarValue", "Base::DataValue", "Base::Anything");

    private final BuiltinFunctionRegistry registry;
    private final Function<String, Optional<ElementMeta>> library;

    /**
     * @param library lookup of standard library elements by qualified name
     */
    public ExpressionEvaluator(BuiltinFunctionRegistry registry, Function<String, Optional<ElementMeta>> library) {
        this.registry = registry;
        this.library = library;
    }

    public Optional<List<Object>> evaluate(ExpressionMeta expression, ElementMeta target) {
        return new EvaluationContext(this, target).evaluate(expression);
    }

    /**
     * True if the expression evaluates without a context element.
     */
    public boolean isModelLevelEvaluable(ExpressionMeta expression) {
        return evaluate(expression, null).isPresent();
    }

    Optional<List<Object>> dispatch(ExpressionMeta expression, EvaluationContext context) {
        if (expression instanceof NullExpressionMeta) return Values.empty();
        if (expression instanceof LiteralExpressionMeta literal) return evaluateLiteral(literal);
        if (expression instanceof FeatureChainExpressionMeta chain) return evaluateChain(chain, context);
        if (expression instanceof InvocationExpressionMeta invocation) return evaluateInvocation(invocation, context);
        if (expression instanceof FeatureReferenceExpressionMeta reference) return evaluateReference(reference, context);
        if (expression instanceof MetadataAccessExpressionMeta access) return evaluateMetadataAccess(access, context);
        return evaluateResult(expression, context);
    }

    private Optional<List<Object>> evaluateLiteral(LiteralExpressionMeta literal) {
        if (literal.isInfinity()) return Values.of(Double.POSITIVE_INFINITY);
        return Values.of(literal.literal());
    }

    private Optional<List<Object>> evaluateInvocation(InvocationExpressionMeta invocation, EvaluationContext context) {
        return invocation.getFunction()
                .flatMap(registry::find)
                .flatMap(function -> function.call(invocation, context));
    }

    /**
     * Values of the target feature, navigated from each value of the source.
     */
    private Optional<List<Object>> evaluateChain(FeatureChainExpressionMeta chain, EvaluationContext context) {
        Optional<FeatureMeta> feature = chain.targetFeature();
        if (feature.isEmpty()) return Optional.empty();
        Optional<List<Object>> source = context.argument(chain, 0);
        if (source.isEmpty()) return Optional.empty();

        List<Object> result = new ArrayList<>();
        for (Object value : source.get()) {
            if (!(value instanceof ElementMeta element)) return Optional.empty();
            Optional<List<Object>> navigated = evaluateFeature(feature.get(), context.withTarget(element));
            if (navigated.isEmpty()) return Optional.empty();
            result.addAll(navigated.get());
        }
        return Optional.of(result);
    }

    private Optional<List<Object>> evaluateReference(FeatureReferenceExpressionMeta reference, EvaluationContext context) {
        Optional<ElementMeta> referenced = reference.referencedElement();
        if (referenced.isEmpty()) return Optional.empty();
        if (referenced.get() instanceof FeatureMeta feature) return evaluateFeature(feature, context);
        return Values.of(referenced.get());
    }

    /**
     * Self-like features yield the context element, valued features their value
     * as redefined in the context element, any other feature itself.
     */
    private Optional<List<Object>> evaluateFeature(FeatureMeta feature, EvaluationContext context) {
        ElementMeta target = context.target();
        if (feature.conforms(SELF)) return target == null ? Optional.empty() : Values.of(target);

        if (target instanceof TypeMeta type) {
            for (FeatureMeta candidate : type.allFeatures()) {
                if (candidate.conforms(feature) && candidate.value().isPresent()) {
                    return context.evaluate(candidate.value().get());
                }
            }
        }
        Optional<ExpressionMeta> value = feature.value();
        if (value.isPresent()) return context.evaluate(value.get());
        return Values.of(feature);
    }

    /**
     * Metadata of the referenced element, or of the target, followed by its metaclass.
     */
    private Optional<List<Object>> evaluateMetadataAccess(MetadataAccessExpressionMeta access, EvaluationContext context) {
        ElementMeta element = access.referencedElement().orElse(context.target());
        if (element == null) return Optional.empty();

        List<Object> result = new ArrayList<>();
        if (element instanceof TypeMeta type) {
            result.addAll(type.allMetadata());
        } else {
            result.addAll(element.metadata());
        }
        metaclass(element).ifPresent(result::add);
        return Optional.of(result);
    }

    private Optional<List<Object>> evaluateResult(ExpressionMeta expression, EvaluationContext context) {
        Optional<FeatureMeta> result = expression.resultParameter();
        if (result.isPresent() && result.get() instanceof ExpressionMeta body && body != expression) {
            return context.evaluate(body);
        }
        return Optional.empty();
    }

    /**
     * Library metaclass {@code KerML::<Kind>} of an element, if the library has it.
     */
    public Optional<ElementMeta> metaclass(ElementMeta element) {
        return library.apply(Names.concat("KerML", element.kind()));
    }

    /**
     * Classification test of a single value against a type; transitive over the specialization graph.
     */
    public boolean isType(Object value, TypeMeta type) {
        if (value instanceof TypeMeta valueType) {
            return valueType.conforms(type) || isMetaclass(valueType, type, true);
        }
        if (value instanceof ElementMeta element) return isMetaclass(element, type, true);
        return primitiveTypes(value).contains(type.qualifiedName());
    }

    /**
     * Classification test against direct specializations only.
     */
    public boolean hasType(Object value, TypeMeta type) {
        if (value instanceof TypeMeta valueType) {
            return valueType == type || valueType.types().contains(type) || isMetaclass(valueType, type, false);
        }
        if (value instanceof ElementMeta element) return isMetaclass(element, type, false);
        List<String> types = primitiveTypes(value);
        return !types.isEmpty() && types.get(0).equals(type.qualifiedName());
    }

    private static boolean isMetaclass(ElementMeta element, TypeMeta type, boolean transitive) {
        String qualifiedName = type.qualifiedName();
        if (!qualifiedName.startsWith("KerML" + Names.SEPARATOR)) return false;
        String kind = type.effectiveName();
        return transitive ? element.is(kind) : element.kind().equals(kind);
    }

    /**
     * Library types of a primitive value, most specific first.
     */
    static List<String> primitiveTypes(Object value) {
        if (value instanceof Boolean) return BOOLEAN;
        if (value instanceof String) return STRING;
        if (value instanceof Long number) return number >= 0 ? NATURAL : INTEGER;
        if (value instanceof Double) return REAL;
        return List.of();
    }

    public BuiltinFunctionRegistry registry() {
        return registry;
    }
}
