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
 * String length and 1-based substrings.
 */
@Component
@Order(60)
public class StringFunctionLibrary implements BuiltinFunctionLibrary {

    private final Map<String, BuiltinFunction> functions = new LinkedHashMap<>();

    public StringFunctionLibrary() {
        functions.put("Length", FunctionSupport.unary(value -> value instanceof String text
                ? Optional.<Object>of((long) text.length())
                : Optional.empty()));
        functions.put("Substring", StringFunctionLibrary::substring);
    }

    @Override
    public String packageName() {
        return Operators.STRING_FUNCTIONS;
    }

    @Override
    public Map<String, BuiltinFunction> functions() {
        return Collections.unmodifiableMap(functions);
    }

    /**
     * Characters {@code lower} through {@code upper}, both inclusive and counted from 1.
     * {@code upper = lower - 1} gives the empty string.
     */
    private static Optional<List<Object>> substring(InvocationExpressionMeta expression, EvaluationContext context) {
        if (context.argumentCount(expression) != 3) return Optional.empty();
        Optional<String> text = context.argument(expression, 0).flatMap(Values::asString);
        Optional<Long> lower = context.argument(expression, 1).flatMap(Values::asLong);
        Optional<Long> upper = context.argument(expression, 2).flatMap(Values::asLong);
        if (text.isEmpty() || lower.isEmpty() || upper.isEmpty()) return Optional.empty();

        long length = text.get().length();
        if (lower.get() < 1 || upper.get() > length || lower.get() > upper.get() + 1) return Optional.empty();
        return Values.of(text.get().substring(lower.get().intValue() - 1, upper.get().intValue()));
    }
}
