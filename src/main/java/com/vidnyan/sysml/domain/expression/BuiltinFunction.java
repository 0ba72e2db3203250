package com.vidnyan.sysml.domain.expression;

import com.vidnyan.sysml.domain.model.InvocationExpressionMeta;

import java.util.List;
import java.util.Optional;

/**
 * Model-level implementation of a library function.
 * Returns empty when the invocation cannot be evaluated, never throws for bad operands.
 */
@FunctionalInterface
public interface BuiltinFunction {

    Optional<List<Object>> call(InvocationExpressionMeta expression, EvaluationContext context);
}
