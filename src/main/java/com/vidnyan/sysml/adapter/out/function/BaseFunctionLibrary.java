package com.vidnyan.sysml.adapter.out.function;

import com.vidnyan.sysml.domain.expression.*;
import com.vidnyan.sysml.domain.model.ElementMeta;
import com.vidnyan.sysml.domain.model.InvocationExpressionMeta;
import com.vidnyan.sysml.domain.model.TypeMeta;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Predicate;

/**
 * Equality, classification, casting, indexing and sequence construction.
 */
@Component
@Order(20)
public class BaseFunctionLibrary implements BuiltinFunctionLibrary {

    private final Map<String, BuiltinFunction> functions = new LinkedHashMap<>();

    public BaseFunctionLibrary() {
        functions.put(Operators.EQUALS, equality(false));
        functions.put(Operators.NOT_EQUALS, equality(true));
        functions.put(Operators.SAME, equality(false));
        functions.put(Operators.NOT_SAME, equality(true));
        functions.put(Operators.IS_TYPE, classification(true, (evaluator, value, type) -> evaluator.isType(value, type)));
        functions.put(Operators.HAS_TYPE, classification(false, (evaluator, value, type) -> evaluator.hasType(value, type)));
        functions.put(Operators.AT, classification(false, (evaluator, value, type) -> evaluator.isType(value, type)));
        functions.put(Operators.AT_AT, classification(false, (evaluator, value, type) -> evaluator.isType(value, type)));
        functions.put(Operators.AS, BaseFunctionLibrary::cast);
        functions.put(Operators.META, BaseFunctionLibrary::meta);
        functions.put(Operators.INDEX, BaseFunctionLibrary::index);
        functions.put(Operators.QUANTITY, BaseFunctionLibrary::index);
        functions.put(Operators.COMMA, BaseFunctionLibrary::concat);
    }

    @Override
    public String packageName() {
        return Operators.BASE_FUNCTIONS;
    }

    @Override
    public Map<String, BuiltinFunction> functions() {
        return Collections.unmodifiableMap(functions);
    }

    /**
     * Sequence equality. Elements compare by identity, numbers by value.
     */
    private static BuiltinFunction equality(boolean negated) {
        return (expression, context) -> {
            if (context.argumentCount(expression) != 2) return Optional.empty();
            Optional<List<Object>> left = context.argument(expression, 0);
            if (left.isEmpty()) return Optional.empty();
            Optional<List<Object>> right = context.argument(expression, 1);
            if (right.isEmpty()) return Optional.empty();
            return Values.of(Values.equal(left.get(), right.get()) != negated);
        };
    }

    @FunctionalInterface
    private interface Classifier {
        boolean test(ExpressionEvaluator evaluator, Object value, TypeMeta type);
    }

    /**
     * With {@code every}, true if all values of the first operand pass the test, so an
     * empty sequence passes. Otherwise true if any value passes.
     */
    private static BuiltinFunction classification(boolean every, Classifier classifier) {
        return (expression, context) -> {
            Optional<TypeMeta> type = typeOperand(expression, context);
            if (type.isEmpty()) return Optional.empty();
            Optional<List<Object>> values = context.argument(expression, 0);
            if (values.isEmpty()) return Optional.empty();
            for (Object value : values.get()) {
                if (classifier.test(context.evaluator(), value, type.get()) != every) return Values.of(!every);
            }
            return Values.of(every);
        };
    }

    /**
     * The type operand: the expression's own type reference, else a second argument naming a type.
     */
    private static Optional<TypeMeta> typeOperand(InvocationExpressionMeta expression, EvaluationContext context) {
        Optional<ElementMeta> referenced = expression.referencedElement();
        if (referenced.isPresent()) {
            return referenced.get() instanceof TypeMeta type ? Optional.of(type) : Optional.empty();
        }
        return context.argument(expression, 1)
                .flatMap(Values::single)
                .filter(TypeMeta.class::isInstance)
                .map(TypeMeta.class::cast);
    }

    private static Optional<List<Object>> cast(InvocationExpressionMeta expression, EvaluationContext context) {
        Optional<TypeMeta> type = typeOperand(expression, context);
        if (type.isEmpty()) return Optional.empty();
        Optional<List<Object>> values = context.argument(expression, 0);
        if (values.isEmpty()) return Optional.empty();
        return Optional.of(filter(values.get(), value -> context.evaluator().isType(value, type.get())));
    }

    private static List<Object> filter(List<Object> values, Predicate<Object> predicate) {
        List<Object> result = new ArrayList<>();
        for (Object value : values) {
            if (predicate.test(value)) result.add(value);
        }
        return result;
    }

    private static Optional<List<Object>> meta(InvocationExpressionMeta expression, EvaluationContext context) {
        return context.argument(expression, 0)
                .flatMap(Values::single)
                .filter(ElementMeta.class::isInstance)
                .flatMap(element -> context.evaluator().metaclass((ElementMeta) element))
                .flatMap(Values::of);
    }

    /**
     * 1-based indexing; an index outside the sequence is not evaluable.
     */
    private static Optional<List<Object>> index(InvocationExpressionMeta expression, EvaluationContext context) {
        if (context.argumentCount(expression) != 2) return Optional.empty();
        Optional<List<Object>> values = context.argument(expression, 0);
        if (values.isEmpty()) return Optional.empty();
        Optional<Long> index = context.argument(expression, 1).flatMap(Values::asLong);
        if (index.isEmpty()) return Optional.empty();
        if (index.get() < 1 || index.get() > values.get().size()) return Optional.empty();
        return Values.of(values.get().get((int) (index.get() - 1)));
    }

    private static Optional<List<Object>> concat(InvocationExpressionMeta expression, EvaluationContext context) {
        List<Object> result = new ArrayList<>();
        for (int i = 0; i < context.argumentCount(expression); i++) {
            Optional<List<Object>> values = context.argument(expression, i);
            if (values.isEmpty()) return Optional.empty();
            result.addAll(values.get());
        }
        return Optional.of(result);
    }
}
