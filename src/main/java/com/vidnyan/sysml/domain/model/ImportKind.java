package com.vidnyan.sysml.domain.model;

/**
 * What an import statement brings into scope.
 */
public enum ImportKind {
    SPECIFIC("", false, false),                          // P::x
    WILDCARD("::*", true, false),                        // P::*
    RECURSIVE("::**", false, true),                      // P::**
    RECURSIVE_EXCLUSIVE("::*::**", true, true);          // P::*::**

    private final String suffix;
    private final boolean namespace;
    private final boolean recursive;

    ImportKind(String suffix, boolean namespace, boolean recursive) {
        this.suffix = suffix;
        this.namespace = namespace;
        this.recursive = recursive;
    }

    public String suffix() {
        return suffix;
    }

    /**
     * True if members of the target are imported rather than the target itself.
     */
    public boolean importsMembers() {
        return namespace || recursive;
    }

    /**
     * True if the target itself is visible under its own name.
     */
    public boolean importsTarget() {
        return !namespace;
    }

    public boolean isRecursive() {
        return recursive;
    }

    /**
     * Detect the import kind from the suffix of the reference text.
     */
    public static ImportKind fromReference(String text) {
        if (text == null) return SPECIFIC;
        String trimmed = text.trim();
        if (trimmed.endsWith(RECURSIVE_EXCLUSIVE.suffix)) return RECURSIVE_EXCLUSIVE;
        if (trimmed.endsWith(RECURSIVE.suffix)) return RECURSIVE;
        if (trimmed.endsWith(WILDCARD.suffix)) return WILDCARD;
        return SPECIFIC;
    }

    /**
     * Reference text with the import suffix removed.
     */
    public String stripSuffix(String text) {
        if (text == null) return null;
        String trimmed = text.trim();
        return trimmed.endsWith(suffix) ? trimmed.substring(0, trimmed.length() - suffix.length()) : trimmed;
    }
}
