package com.vidnyan.sysml.adapter.out.function;

import com.vidnyan.sysml.domain.expression.BuiltinFunction;
import com.vidnyan.sysml.domain.expression.Values;

import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Adapters from plain value operations to built-in functions.
 * Every operand must evaluate to exactly one value.
 */
final class FunctionSupport {

    private FunctionSupport() {
    }

    static BuiltinFunction unary(Function<Object, Optional<Object>> operation) {
        return (expression, context) -> {
            if (context.argumentCount(expression) != 1) return Optional.empty();
            return context.argument(expression, 0)
                    .flatMap(Values::single)
                    .flatMap(operation)
                    .flatMap(Values::of);
        };
    }

    static BuiltinFunction binary(BiFunction<Object, Object, Optional<Object>> operation) {
        return (expression, context) -> {
            if (context.argumentCount(expression) != 2) return Optional.empty();
            Optional<Object> left = context.argument(expression, 0).flatMap(Values::single);
            if (left.isEmpty()) return Optional.empty();
            Optional<Object> right = context.argument(expression, 1).flatMap(Values::single);
            if (right.isEmpty()) return Optional.empty();
            return operation.apply(left.get(), right.get()).flatMap(Values::of);
        };
    }

    /**
     * Dispatch on the argument count, for operators like {@code -} that are both prefix and infix.
     */
    static BuiltinFunction unaryOrBinary(
            Function<Object, Optional<Object>> unaryOperation,
            BiFunction<Object, Object, Optional<Object>> binaryOperation
    ) {
        BuiltinFunction unary = unary(unaryOperation);
        BuiltinFunction binary = binary(binaryOperation);
        return (expression, context) -> context.argumentCount(expression) == 1
                ? unary.call(expression, context)
                : binary.call(expression, context);
    }

    /**
     * Function over the whole sequence of the first argument.
     */
    static BuiltinFunction sequence(Function<List<Object>, Optional<Object>> operation) {
        return (expression, context) -> {
            if (context.argumentCount(expression) < 1) return Optional.empty();
            return context.argument(expression, 0)
                    .flatMap(operation)
                    .flatMap(Values::of);
        };
    }
}
