package com.vidnyan.sysml.adapter.out.function;

import com.vidnyan.sysml.domain.expression.BuiltinFunction;
import com.vidnyan.sysml.domain.expression.BuiltinFunctionLibrary;
import com.vidnyan.sysml.domain.expression.Operators;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.BiFunction;

import static com.vidnyan.sysml.adapter.out.function.FunctionSupport.sequence;

/**
 * Aggregates over numeric sequences.
 */
@Component
@Order(40)
public class NumericalFunctionLibrary implements BuiltinFunctionLibrary {

    private final Map<String, BuiltinFunction> functions = new LinkedHashMap<>();

    public NumericalFunctionLibrary() {
        functions.put("sum", sequence(values -> fold(values, 0L, DataFunctionLibrary::add)));
        functions.put("product", sequence(values -> fold(values, 1L, DataFunctionLibrary::multiply)));
    }

    @Override
    public String packageName() {
        return Operators.NUMERICAL_FUNCTIONS;
    }

    @Override
    public Map<String, BuiltinFunction> functions() {
        return Collections.unmodifiableMap(functions);
    }

    private static Optional<Object> fold(List<Object> values, Object identity,
                                         BiFunction<Object, Object, Optional<Object>> operation) {
        Object result = identity;
        for (Object value : values) {
            if (value instanceof String) return Optional.empty();
            Optional<Object> next = operation.apply(result, value);
            if (next.isEmpty()) return Optional.empty();
            result = next.get();
        }
        return Optional.of(result);
    }
}
