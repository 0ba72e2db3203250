package com.vidnyan.sysml.domain.expression;

import com.vidnyan.sysml.domain.model.Names;

import java.util.*;

/**
 * Built-in functions by sanitized qualified name, e.g. {@code DataFunctions::+}.
 */
public class BuiltinFunctionRegistry {

    private final Map<String, BuiltinFunction> functions = new LinkedHashMap<>();

    public BuiltinFunctionRegistry(List<BuiltinFunctionLibrary> libraries) {
        for (BuiltinFunctionLibrary library : libraries) {
            library.functions().forEach((name, function) ->
                    functions.putIfAbsent(Names.concat(library.packageName(), name), function));
        }
    }

    public Optional<BuiltinFunction> find(String qualifiedName) {
        if (qualifiedName == null) return Optional.empty();
        return Optional.ofNullable(functions.get(qualifiedName));
    }

    public boolean contains(String qualifiedName) {
        return functions.containsKey(qualifiedName);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(functions.keySet());
    }

    public int size() {
        return functions.size();
    }
}
