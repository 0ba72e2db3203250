package com.vidnyan.sysml.domain.expression;

import java.util.Map;

/**
 * Built-in functions of one library package, keyed by simple function name.
 */
public interface BuiltinFunctionLibrary {

    String packageName();

    Map<String, BuiltinFunction> functions();
}
