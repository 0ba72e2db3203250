package com.vidnyan.sysml.domain.expression;

import com.vidnyan.sysml.domain.model.ElementMeta;
import com.vidnyan.sysml.domain.model.ExpressionMeta;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * State of one evaluation: the target element and the expressions being
 * evaluated, so a self-referencing expression is reported as not evaluable.
 */
public final class EvaluationContext {

    private final ExpressionEvaluator evaluator;
    private final ElementMeta target;
    private final Set<ExpressionMeta> active;

    EvaluationContext(ExpressionEvaluator evaluator, ElementMeta target) {
        this(evaluator, target, new HashSet<>());
    }

    private EvaluationContext(ExpressionEvaluator evaluator, ElementMeta target, Set<ExpressionMeta> active) {
        this.evaluator = evaluator;
        this.target = target;
        this.active = active;
    }

    public ElementMeta target() {
        return target;
    }

    public ExpressionEvaluator evaluator() {
        return evaluator;
    }

    /**
     * Same evaluation, with {@code target} as the context element.
     */
    public EvaluationContext withTarget(ElementMeta target) {
        return new EvaluationContext(evaluator, target, active);
    }

    public Optional<List<Object>> evaluate(ExpressionMeta expression) {
        if (expression == null || !active.add(expression)) return Optional.empty();
        try {
            return evaluator.dispatch(expression, this);
        } finally {
            active.remove(expression);
        }
    }

    /**
     * Evaluate the argument at {@code index}; empty if it is missing or not evaluable.
     */
    public Optional<List<Object>> argument(ExpressionMeta expression, int index) {
        return expression.argument(index).flatMap(this::evaluate);
    }

    public int argumentCount(ExpressionMeta expression) {
        return expression.arguments().size();
    }
}
