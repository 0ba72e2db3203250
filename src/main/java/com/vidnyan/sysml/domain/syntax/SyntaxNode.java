package com.vidnyan.sysml.domain.syntax;

import java.util.*;

/**
 * A node of the parsed syntax tree handed over by the parser.
 * Every field except {@code kind} and {@code children} is optional.
 */
public record SyntaxNode(
    String kind,
    String name,
    String shortName,
    String visibility,
    String reference,
    String operator,
    Object value,
    String direction,
    String body,
    Set<String> flags,
    List<SyntaxNode> children
) {

    // Flag names shared with the JSON interchange format
    public static final String ABSTRACT = "isAbstract";
    public static final String COMPOSITE = "isComposite";
    public static final String PORTION = "isPortion";
    public static final String READONLY = "isReadonly";
    public static final String DERIVED = "isDerived";
    public static final String END = "isEnd";
    public static final String ORDERED = "isOrdered";
    public static final String NONUNIQUE = "isNonunique";
    public static final String NEGATED = "isNegated";
    public static final String INTEGER = "isInteger";
    public static final String IMPLIED = "isImplied";

    public SyntaxNode {
        Objects.requireNonNull(kind, "kind");
        flags = flags == null ? Set.of() : Set.copyOf(flags);
        children = children == null ? List.of() : List.copyOf(children);
    }

    public boolean flag(String flag) {
        return flags.contains(flag);
    }

    public static Builder builder(String kind) {
        return new Builder(kind);
    }

    public static class Builder {
        private final String kind;
        private String name;
        private String shortName;
        private String visibility;
        private String reference;
        private String operator;
        private Object value;
        private String direction;
        private String body;
        private final Set<String> flags = new LinkedHashSet<>();
        private final List<SyntaxNode> children = new ArrayList<>();

        private Builder(String kind) { this.kind = kind; }

        public Builder name(String name) { this.name = name; return this; }
        public Builder shortName(String shortName) { this.shortName = shortName; return this; }
        public Builder visibility(String visibility) { this.visibility = visibility; return this; }
        public Builder reference(String reference) { this.reference = reference; return this; }
        public Builder operator(String operator) { this.operator = operator; return this; }
        public Builder value(Object value) { this.value = value; return this; }
        public Builder direction(String direction) { this.direction = direction; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder flag(String flag) { this.flags.add(flag); return this; }
        public Builder child(SyntaxNode child) { this.children.add(child); return this; }
        public Builder child(Builder child) { return child(child.build()); }
        public Builder children(List<SyntaxNode> children) { this.children.addAll(children); return this; }

        public SyntaxNode build() {
            return new SyntaxNode(kind, name, shortName, visibility, reference,
                    operator, value, direction, body, flags, children);
        }
    }
}
