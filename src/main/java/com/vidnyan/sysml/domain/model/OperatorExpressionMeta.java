package com.vidnyan.sysml.domain.model;

import com.vidnyan.sysml.domain.expression.Operators;
import com.vidnyan.sysml.domain.metamodel.TypeIndex;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Invocation written as an operator. The operator names a library function.
 */
public class OperatorExpressionMeta extends InvocationExpressionMeta {

    private static final Set<String> BOOLEAN_OPERATORS = Set.of(
            Operators.EQUALS, Operators.NOT_EQUALS, Operators.SAME, Operators.NOT_SAME,
            Operators.LESS, Operators.LESS_EQUAL, Operators.GREATER, Operators.GREATER_EQUAL,
            Operators.AND, Operators.OR, Operators.IMPLIES, Operators.NOT, Operators.XOR,
            Operators.HAS_TYPE, Operators.IS_TYPE, Operators.AT);

    private static final Set<String> NUMERIC_OPERATORS = Set.of(
            Operators.PLUS, Operators.MINUS, Operators.MULTIPLY, Operators.DIVIDE, Operators.MODULO,
            Operators.EXPONENT_1, Operators.EXPONENT_2);

    private String operator;

    public OperatorExpressionMeta(int id, String kind, TypeIndex typeIndex) {
        super(id, kind, typeIndex);
    }

    public String operator() {
        return operator;
    }

    public void setOperator(String operator) {
        this.operator = operator == null ? null : Names.sanitize(operator);
    }

    @Override
    public Optional<String> getFunction() {
        return Operators.functionFor(operator);
    }

    @Override
    public Optional<String> returnType() {
        if (operator == null) return Optional.empty();
        if (BOOLEAN_OPERATORS.contains(operator)) return Optional.of("ScalarValues::Boolean");
        if (Operators.QUANTITY.equals(operator)) return Optional.of("ScalarValues::Natural");
        if (Operators.AS.equals(operator) || Operators.AT_AT.equals(operator)) {
            return referencedElement().map(ElementMeta::qualifiedName);
        }
        if (Operators.META.equals(operator)) return Optional.of("Metaobjects::Metaobject");

        List<ExpressionMeta> arguments = arguments();
        if (Operators.IF.equals(operator)) {
            return arguments.size() > 1 ? arguments.get(1).returnType() : Optional.empty();
        }
        if (NUMERIC_OPERATORS.contains(operator)) return numericResult(arguments);
        // remaining operators yield values of their first operand's type
        return arguments.isEmpty() ? Optional.empty() : arguments.get(0).returnType();
    }

    private static Optional<String> numericResult(List<ExpressionMeta> arguments) {
        if (arguments.isEmpty()) return Optional.empty();
        Optional<String> result = arguments.get(0).returnType();
        for (ExpressionMeta argument : arguments.subList(1, arguments.size())) {
            Optional<String> type = argument.returnType();
            if (type.isEmpty()) return Optional.empty();
            if (result.isPresent() && !result.get().equals(type.get())) {
                // mixed operands widen to real unless strings are concatenated
                if (result.get().equals("ScalarValues::String") || type.get().equals("ScalarValues::String")) {
                    return Optional.of("ScalarValues::String");
                }
                result = Optional.of("ScalarValues::Real");
            }
        }
        return result;
    }
}
