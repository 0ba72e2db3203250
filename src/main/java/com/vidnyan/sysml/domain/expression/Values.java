package com.vidnyan.sysml.domain.expression;

import com.vidnyan.sysml.domain.model.ElementMeta;

import java.text.Collator;
import java.util.List;
import java.util.Optional;

/**
 * Helpers over evaluation results. Values are {@link Boolean}, {@link Long},
 * {@link Double}, {@link String} or {@link ElementMeta}.
 */
public final class Values {

    private static final Collator COLLATOR = Collator.getInstance();

    private Values() {
    }

    public static Optional<List<Object>> of(Object value) {
        return value == null ? Optional.empty() : Optional.of(List.of(value));
    }

    public static Optional<List<Object>> empty() {
        return Optional.of(List.of());
    }

    /**
     * The only value of a one-element result.
     */
    public static Optional<Object> single(List<Object> values) {
        return values != null && values.size() == 1 ? Optional.of(values.get(0)) : Optional.empty();
    }

    public static Optional<Number> asNumber(List<Object> values) {
        return single(values)
                .filter(v -> v instanceof Long || v instanceof Double)
                .map(Number.class::cast);
    }

    public static Optional<Long> asLong(List<Object> values) {
        return single(values)
                .filter(Long.class::isInstance)
                .map(Long.class::cast);
    }

    public static Optional<Boolean> asBoolean(List<Object> values) {
        return single(values)
                .filter(Boolean.class::isInstance)
                .map(Boolean.class::cast);
    }

    public static Optional<String> asString(List<Object> values) {
        return single(values)
                .filter(String.class::isInstance)
                .map(String.class::cast);
    }

    public static boolean isNumber(Object value) {
        return value instanceof Long || value instanceof Double;
    }

    /**
     * Value equality; numbers compare by value across Long and Double.
     */
    public static boolean equal(Object left, Object right) {
        if (isNumber(left) && isNumber(right)) {
            if (left instanceof Long a && right instanceof Long b) return a.longValue() == b.longValue();
            return ((Number) left).doubleValue() == ((Number) right).doubleValue();
        }
        if (left instanceof ElementMeta || right instanceof ElementMeta) return left == right;
        return left != null && left.equals(right);
    }

    /**
     * Element-wise equality of two sequences.
     */
    public static boolean equal(List<Object> left, List<Object> right) {
        if (left.size() != right.size()) return false;
        for (int i = 0; i < left.size(); i++) {
            if (!equal(left.get(i), right.get(i))) return false;
        }
        return true;
    }

    /**
     * Order of two numbers or two strings; strings use locale-aware collation.
     */
    public static Optional<Integer> compare(Object left, Object right) {
        if (left instanceof Long a && right instanceof Long b) return Optional.of(Long.compare(a, b));
        if (isNumber(left) && isNumber(right)) {
            return Optional.of(Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue()));
        }
        if (left instanceof String a && right instanceof String b) return Optional.of(COLLATOR.compare(a, b));
        return Optional.empty();
    }
}
