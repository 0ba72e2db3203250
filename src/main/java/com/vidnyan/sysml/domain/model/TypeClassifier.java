package com.vidnyan.sysml.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural classifier categories, combined as a bitmask on each type.
 */
public final class TypeClassifier {

    private TypeClassifier() {
    }

    public static final int NONE = 0;
    public static final int DATA_TYPE = 1;
    public static final int CLASS = 1 << 1;
    public static final int STRUCTURE = 1 << 2;
    public static final int ASSOCIATION = 1 << 3;
    public static final int ASSOCIATION_STRUCT = STRUCTURE | ASSOCIATION;

    public static boolean has(int flags, int classifier) {
        return (flags & classifier) == classifier && classifier != NONE;
    }

    /**
     * Readable form used in diagnostics, e.g. {@code Class|Structure}.
     */
    public static String toString(int flags) {
        List<String> parts = new ArrayList<>();
        if (has(flags, DATA_TYPE)) parts.add("DataType");
        if (has(flags, CLASS)) parts.add("Class");
        if (has(flags, STRUCTURE)) parts.add("Structure");
        if (has(flags, ASSOCIATION)) parts.add("Association");
        return parts.isEmpty() ? "None" : String.join("|", parts);
    }
}
