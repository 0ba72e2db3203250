package com.vidnyan.sysml.adapter.out.function;

import com.vidnyan.sysml.domain.expression.BuiltinFunction;
import com.vidnyan.sysml.domain.expression.BuiltinFunctionLibrary;
import com.vidnyan.sysml.domain.expression.EvaluationContext;
import com.vidnyan.sysml.domain.expression.Operators;
import com.vidnyan.sysml.domain.expression.Values;
import com.vidnyan.sysml.domain.model.InvocationExpressionMeta;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Short-circuit boolean operators, conditional and null-coalescing.
 * The second operand is evaluated only when the first does not decide the result.
 */
@Component
@Order(30)
public class ControlFunctionLibrary implements BuiltinFunctionLibrary {

    private final Map<String, BuiltinFunction> functions = new LinkedHashMap<>();

    public ControlFunctionLibrary() {
        functions.put(Operators.AND, (expression, context) -> shortCircuit(expression, context, false, false));
        functions.put(Operators.OR, (expression, context) -> shortCircuit(expression, context, true, true));
        functions.put(Operators.IMPLIES, (expression, context) -> shortCircuit(expression, context, false, true));
        functions.put(Operators.IF, ControlFunctionLibrary::conditional);
        functions.put(Operators.NULL_COALESCING, ControlFunctionLibrary::coalesce);
    }

    @Override
    public String packageName() {
        return Operators.CONTROL_FUNCTIONS;
    }

    @Override
    public Map<String, BuiltinFunction> functions() {
        return Collections.unmodifiableMap(functions);
    }

    /**
     * If the first operand equals {@code decidingValue} the result is {@code decidedResult}
     * without looking at the second operand; otherwise the second operand is the result.
     */
    private static Optional<List<Object>> shortCircuit(
            InvocationExpressionMeta expression,
            EvaluationContext context,
            boolean decidingValue,
            boolean decidedResult
    ) {
        if (context.argumentCount(expression) != 2) return Optional.empty();
        Optional<Boolean> first = context.argument(expression, 0).flatMap(Values::asBoolean);
        if (first.isEmpty()) return Optional.empty();
        if (first.get() == decidingValue) return Values.of(decidedResult);
        return context.argument(expression, 1)
                .flatMap(Values::asBoolean)
                .flatMap(Values::of);
    }

    private static Optional<List<Object>> conditional(InvocationExpressionMeta expression, EvaluationContext context) {
        Optional<Boolean> condition = context.argument(expression, 0).flatMap(Values::asBoolean);
        if (condition.isEmpty()) return Optional.empty();
        int branch = condition.get() ? 1 : 2;
        if (context.argumentCount(expression) <= branch) return Values.empty();
        return context.argument(expression, branch);
    }

    private static Optional<List<Object>> coalesce(InvocationExpressionMeta expression, EvaluationContext context) {
        Optional<List<Object>> first = context.argument(expression, 0);
        if (first.isEmpty()) return Optional.empty();
        if (!first.get().isEmpty()) return first;
        return context.argument(expression, 1);
    }
}
