package com.vidnyan.sysml.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Name sanitization and qualified-name handling.
 */
public final class Names {

    public static final String SEPARATOR = "::";

    private Names() {
    }

    /**
     * Strip surrounding single quotes and unescape the quoted body.
     */
    public static String sanitize(String name) {
        if (name == null) return null;
        if (name.length() >= 2 && name.startsWith("'") && name.endsWith("'")) {
            return name.substring(1, name.length() - 1)
                    .replace("\\'", "'")
                    .replace("\\\\", "\\");
        }
        return name;
    }

    /**
     * Quote a sanitized name if it cannot be written as a plain identifier.
     */
    public static String escape(String name) {
        if (name == null || name.isEmpty()) return name;
        boolean plain = Character.isJavaIdentifierStart(name.charAt(0));
        for (int i = 1; plain && i < name.length(); i++) {
            plain = Character.isJavaIdentifierPart(name.charAt(i)) && name.charAt(i) != '$';
        }
        if (plain) return name;
        return "'" + name.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    /**
     * Join sanitized segments into a qualified name.
     */
    public static String concat(String... segments) {
        return String.join(SEPARATOR, segments);
    }

    /**
     * Split a reference into sanitized segments, honoring quoted names. Both
     * {@code ::} and {@code .} separate segments; {@code .} marks a feature chain.
     */
    public static List<Segment> split(String reference) {
        List<Segment> segments = new ArrayList<>();
        if (reference == null || reference.isBlank()) return segments;

        String text = reference.trim();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        boolean chained = false;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (quoted) {
                current.append(c);
                if (c == '\\' && i + 1 < text.length()) {
                    current.append(text.charAt(++i));
                } else if (c == '\'') {
                    quoted = false;
                }
                i++;
            } else if (c == '\'') {
                quoted = true;
                current.append(c);
                i++;
            } else if (text.startsWith(SEPARATOR, i)) {
                segments.add(new Segment(sanitize(current.toString().trim()), chained));
                current.setLength(0);
                chained = false;
                i += SEPARATOR.length();
            } else if (c == '.') {
                segments.add(new Segment(sanitize(current.toString().trim()), chained));
                current.setLength(0);
                chained = true;
                i++;
            } else {
                current.append(c);
                i++;
            }
        }
        segments.add(new Segment(sanitize(current.toString().trim()), chained));
        return segments;
    }

    /**
     * One segment of a reference; {@code chained} if it followed a {@code .}.
     */
    public record Segment(String name, boolean chained) {}
}
