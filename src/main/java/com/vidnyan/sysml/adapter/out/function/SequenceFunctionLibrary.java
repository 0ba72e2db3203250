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

import static com.vidnyan.sysml.adapter.out.function.FunctionSupport.sequence;

/**
 * Queries over sequences.
 */
@Component
@Order(50)
public class SequenceFunctionLibrary implements BuiltinFunctionLibrary {

    private final Map<String, BuiltinFunction> functions = new LinkedHashMap<>();

    public SequenceFunctionLibrary() {
        functions.put("size", sequence(values -> Optional.of((long) values.size())));
        functions.put("isEmpty", sequence(values -> Optional.of(values.isEmpty())));
        functions.put("notEmpty", sequence(values -> Optional.of(!values.isEmpty())));
        functions.put("includes", SequenceFunctionLibrary::includes);
    }

    @Override
    public String packageName() {
        return Operators.SEQUENCE_FUNCTIONS;
    }

    @Override
    public Map<String, BuiltinFunction> functions() {
        return Collections.unmodifiableMap(functions);
    }

    /**
     * True if every value of the second argument occurs in the first.
     */
    private static Optional<List<Object>> includes(InvocationExpressionMeta expression, EvaluationContext context) {
        if (context.argumentCount(expression) != 2) return Optional.empty();
        Optional<List<Object>> values = context.argument(expression, 0);
        if (values.isEmpty()) return Optional.empty();
        Optional<List<Object>> searched = context.argument(expression, 1);
        if (searched.isEmpty()) return Optional.empty();

        for (Object wanted : searched.get()) {
            boolean found = values.get().stream().anyMatch(value -> Values.equal(value, wanted));
            if (!found) return Values.of(false);
        }
        return Values.of(true);
    }
}
