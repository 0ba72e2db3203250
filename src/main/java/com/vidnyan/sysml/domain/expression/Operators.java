package com.vidnyan.sysml.domain.expression;

import com.vidnyan.sysml.domain.model.Names;

import java.util.*;

/**
 * Operator symbols and the library functions they invoke.
 */
public final class Operators {

    private Operators() {
    }

    public static final String DATA_FUNCTIONS = "DataFunctions";
    public static final String BASE_FUNCTIONS = "BaseFunctions";
    public static final String CONTROL_FUNCTIONS = "ControlFunctions";
    public static final String NUMERICAL_FUNCTIONS = "NumericalFunctions";
    public static final String SEQUENCE_FUNCTIONS = "SequenceFunctions";
    public static final String STRING_FUNCTIONS = "StringFunctions";

    // DataFunctions
    public static final String PLUS = "+";
    public static final String MINUS = "-";
    public static final String MULTIPLY = "*";
    public static final String DIVIDE = "/";
    public static final String MODULO = "%";
    public static final String EXPONENT_1 = "**";
    public static final String EXPONENT_2 = "^";
    public static final String LESS = "<";
    public static final String LESS_EQUAL = "<=";
    public static final String GREATER = ">";
    public static final String GREATER_EQUAL = ">=";
    public static final String RANGE = "..";
    public static final String BITWISE_AND = "&";
    public static final String BITWISE_OR = "|";
    public static final String NOT = "not";
    public static final String XOR = "xor";

    // BaseFunctions
    public static final String EQUALS = "==";
    public static final String NOT_EQUALS = "!=";
    public static final String SAME = "===";
    public static final String NOT_SAME = "!==";
    public static final String AS = "as";
    public static final String META = "meta";
    public static final String AT = "@";
    public static final String AT_AT = "@@";
    public static final String HAS_TYPE = "hastype";
    public static final String IS_TYPE = "istype";
    public static final String INDEX = "[";
    public static final String QUANTITY = "#";
    public static final String COMMA = ",";

    // ControlFunctions
    public static final String AND = "and";
    public static final String OR = "or";
    public static final String IMPLIES = "implies";
    public static final String IF = "if";
    public static final String NULL_COALESCING = "??";
    public static final String DOT = ".";

    private static final Map<String, String> FUNCTIONS = new HashMap<>();

    static {
        register(DATA_FUNCTIONS, PLUS, MINUS, MULTIPLY, DIVIDE, MODULO, EXPONENT_1, EXPONENT_2,
                LESS, LESS_EQUAL, GREATER, GREATER_EQUAL, RANGE, BITWISE_AND, BITWISE_OR, NOT, XOR);
        register(BASE_FUNCTIONS, EQUALS, NOT_EQUALS, SAME, NOT_SAME, AS, META, AT, AT_AT,
                HAS_TYPE, IS_TYPE, INDEX, QUANTITY, COMMA);
        register(CONTROL_FUNCTIONS, AND, OR, IMPLIES, IF, NULL_COALESCING, DOT);
    }

    private static void register(String pack, String... operators) {
        for (String operator : operators) {
            FUNCTIONS.put(operator, Names.concat(pack, operator));
        }
    }

    /**
     * Qualified name of the function an operator invokes. Accepts quoted operators like {@code '+'}.
     */
    public static Optional<String> functionFor(String operator) {
        if (operator == null) return Optional.empty();
        return Optional.ofNullable(FUNCTIONS.get(Names.sanitize(operator)));
    }

    public static Set<String> operators() {
        return Collections.unmodifiableSet(FUNCTIONS.keySet());
    }
}
