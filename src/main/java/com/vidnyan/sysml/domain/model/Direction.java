package com.vidnyan.sysml.domain.model;

/**
 * Feature direction.
 */
public enum Direction {
    NONE,
    IN,
    OUT,
    INOUT;

    public static Direction parse(String token) {
        if (token == null || token.isBlank()) return NONE;
        return switch (token.trim().toLowerCase()) {
            case "in" -> IN;
            case "out" -> OUT;
            case "inout" -> INOUT;
            default -> NONE;
        };
    }
}
