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
import java.util.function.BiFunction;
import java.util.function.BinaryOperator;
import java.util.function.IntPredicate;

import static com.vidnyan.sysml.adapter.out.function.FunctionSupport.*;

/**
 * Arithmetic, comparison, range and logical operators.
 * Integer arithmetic stays integral unless a division leaves a remainder;
 * overflow and division by zero are not evaluable.
 */
@Component
@Order(10)
public class DataFunctionLibrary implements BuiltinFunctionLibrary {

    static final long MAX_RANGE = 1 << 20;

    private final Map<String, BuiltinFunction> functions = new LinkedHashMap<>();

    public DataFunctionLibrary() {
        functions.put(Operators.PLUS, unaryOrBinary(DataFunctionLibrary::identity, DataFunctionLibrary::add));
        functions.put(Operators.MINUS, unaryOrBinary(DataFunctionLibrary::negate, DataFunctionLibrary::subtract));
        functions.put(Operators.MULTIPLY, binary(DataFunctionLibrary::multiply));
        functions.put(Operators.DIVIDE, binary(DataFunctionLibrary::divide));
        functions.put(Operators.MODULO, binary(DataFunctionLibrary::modulo));
        functions.put(Operators.EXPONENT_1, binary(DataFunctionLibrary::power));
        functions.put(Operators.EXPONENT_2, binary(DataFunctionLibrary::power));
        functions.put(Operators.LESS, binary(comparison(c -> c < 0)));
        functions.put(Operators.LESS_EQUAL, binary(comparison(c -> c <= 0)));
        functions.put(Operators.GREATER, binary(comparison(c -> c > 0)));
        functions.put(Operators.GREATER_EQUAL, binary(comparison(c -> c >= 0)));
        functions.put(Operators.RANGE, DataFunctionLibrary::range);
        functions.put(Operators.BITWISE_AND, binary((a, b) -> logical(a, b, Boolean::logicalAnd)));
        functions.put(Operators.BITWISE_OR, binary((a, b) -> logical(a, b, Boolean::logicalOr)));
        functions.put(Operators.XOR, binary((a, b) -> logical(a, b, Boolean::logicalXor)));
        functions.put(Operators.NOT, unary(a -> a instanceof Boolean value ? Optional.<Object>of(!value) : Optional.empty()));
    }

    @Override
    public String packageName() {
        return Operators.DATA_FUNCTIONS;
    }

    @Override
    public Map<String, BuiltinFunction> functions() {
        return Collections.unmodifiableMap(functions);
    }

    private static Optional<Object> identity(Object value) {
        return Values.isNumber(value) ? Optional.of(value) : Optional.empty();
    }

    private static Optional<Object> negate(Object value) {
        if (value instanceof Long number) {
            return number == Long.MIN_VALUE ? Optional.empty() : Optional.of(-number);
        }
        if (value instanceof Double number) return Optional.of(-number);
        return Optional.empty();
    }

    static Optional<Object> add(Object left, Object right) {
        if (left instanceof String a && right instanceof String b) return Optional.of(a + b);
        if (left instanceof Long a && right instanceof Long b) {
            try {
                return Optional.of(Math.addExact(a, b));
            } catch (ArithmeticException e) {
                return Optional.empty();
            }
        }
        if (Values.isNumber(left) && Values.isNumber(right)) {
            return Optional.of(((Number) left).doubleValue() + ((Number) right).doubleValue());
        }
        return Optional.empty();
    }

    private static Optional<Object> subtract(Object left, Object right) {
        if (left instanceof Long a && right instanceof Long b) {
            try {
                return Optional.of(Math.subtractExact(a, b));
            } catch (ArithmeticException e) {
                return Optional.empty();
            }
        }
        if (Values.isNumber(left) && Values.isNumber(right)) {
            return Optional.of(((Number) left).doubleValue() - ((Number) right).doubleValue());
        }
        return Optional.empty();
    }

    static Optional<Object> multiply(Object left, Object right) {
        if (left instanceof Long a && right instanceof Long b) {
            try {
                return Optional.of(Math.multiplyExact(a, b));
            } catch (ArithmeticException e) {
                return Optional.empty();
            }
        }
        if (Values.isNumber(left) && Values.isNumber(right)) {
            return Optional.of(((Number) left).doubleValue() * ((Number) right).doubleValue());
        }
        return Optional.empty();
    }

    private static Optional<Object> divide(Object left, Object right) {
        if (!Values.isNumber(left) || !Values.isNumber(right)) return Optional.empty();
        if (((Number) right).doubleValue() == 0) return Optional.empty();
        if (left instanceof Long a && right instanceof Long b) {
            if (a == Long.MIN_VALUE && b == -1) return Optional.empty();
            if (a % b == 0) return Optional.of(a / b);
            return Optional.of((double) a / b);
        }
        return Optional.of(((Number) left).doubleValue() / ((Number) right).doubleValue());
    }

    private static Optional<Object> modulo(Object left, Object right) {
        if (!Values.isNumber(left) || !Values.isNumber(right)) return Optional.empty();
        if (((Number) right).doubleValue() == 0) return Optional.empty();
        if (left instanceof Long a && right instanceof Long b) return Optional.of(a % b);
        return Optional.of(((Number) left).doubleValue() % ((Number) right).doubleValue());
    }

    private static Optional<Object> power(Object left, Object right) {
        if (!Values.isNumber(left) || !Values.isNumber(right)) return Optional.empty();
        if (left instanceof Long base && right instanceof Long exponent && exponent >= 0) {
            try {
                return Optional.of(exactPower(base, exponent));
            } catch (ArithmeticException e) {
                return Optional.empty();
            }
        }
        double result = Math.pow(((Number) left).doubleValue(), ((Number) right).doubleValue());
        return Double.isNaN(result) ? Optional.empty() : Optional.of(result);
    }

    /**
     * Exponentiation by squaring.
     * @throws ArithmeticException on long overflow
     */
    private static long exactPower(long base, long exponent) {
        if (base == 0 || base == 1) return exponent == 0 ? 1 : base;
        if (base == -1) return (exponent & 1) == 0 ? 1 : -1;
        long result = 1;
        long factor = base;
        long remaining = exponent;
        while (remaining > 0) {
            if ((remaining & 1) == 1) result = Math.multiplyExact(result, factor);
            remaining >>= 1;
            if (remaining > 0) factor = Math.multiplyExact(factor, factor);
        }
        return result;
    }

    private static BiFunction<Object, Object, Optional<Object>> comparison(IntPredicate test) {
        return (left, right) -> {
            Optional<Integer> order = Values.compare(left, right);
            return order.isPresent() ? Optional.<Object>of(test.test(order.get())) : Optional.empty();
        };
    }

    private static Optional<Object> logical(Object left, Object right, BinaryOperator<Boolean> operation) {
        if (left instanceof Boolean a && right instanceof Boolean b) return Optional.of(operation.apply(a, b));
        return Optional.empty();
    }

    /**
     * Inclusive integer range; empty when the lower bound exceeds the upper one.
     */
    private static Optional<List<Object>> range(InvocationExpressionMeta expression, EvaluationContext context) {
        if (context.argumentCount(expression) != 2) return Optional.empty();
        Optional<Long> lower = context.argument(expression, 0).flatMap(Values::asLong);
        Optional<Long> upper = context.argument(expression, 1).flatMap(Values::asLong);
        if (lower.isEmpty() || upper.isEmpty()) return Optional.empty();
        if (lower.get() > upper.get()) return Values.empty();
        if (upper.get() - lower.get() >= MAX_RANGE) return Optional.empty();

        List<Object> values = new ArrayList<>();
        for (long i = lower.get(); i <= upper.get(); i++) {
            values.add(i);
        }
        return Optional.of(values);
    }
}
