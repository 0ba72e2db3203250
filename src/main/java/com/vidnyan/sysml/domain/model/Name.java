package com.vidnyan.sysml.domain.model;

/**
 * A declared name: the raw form as written, and the sanitized form used for lookup.
 */
public record Name(String raw, String sanitized) {

    public static Name of(String raw) {
        if (raw == null) return null;
        return new Name(raw, Names.sanitize(raw));
    }

    @Override
    public String toString() {
        return raw;
    }
}
