package com.vidnyan.sysml.domain.model;

/**
 * Member visibility, ordered from most to least visible.
 */
public enum Visibility {
    PUBLIC,
    PROTECTED,
    PRIVATE;

    /**
     * True if a member with this visibility passes the {@code limit}.
     */
    public boolean isVisibleWith(Visibility limit) {
        return ordinal() <= limit.ordinal();
    }

    /**
     * Parse the syntax token, null for a missing one.
     */
    public static Visibility parse(String token) {
        if (token == null || token.isBlank()) return null;
        return switch (token.trim().toLowerCase()) {
            case "public" -> PUBLIC;
            case "protected" -> PROTECTED;
            case "private" -> PRIVATE;
            default -> null;
        };
    }
}
