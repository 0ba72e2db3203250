package com.vidnyan.sysml.domain.metamodel;

import java.util.*;

/**
 * One row of the metamodel description.
 * {@code factory} may be null; the nearest ancestor's factory is used then.
 */
public record KindDefinition(
    String kind,
    List<String> supertypes,
    MetaFactory factory,
    Map<String, String> implicits,
    List<MetaInitializer> initializers
) {

    public static Builder builder(String kind) {
        return new Builder(kind);
    }

    public static class Builder {
        private final String kind;
        private final List<String> supertypes = new ArrayList<>();
        private MetaFactory factory;
        private final Map<String, String> implicits = new LinkedHashMap<>();
        private final List<MetaInitializer> initializers = new ArrayList<>();

        private Builder(String kind) { this.kind = kind; }

        public Builder supertypes(String... supertypes) { this.supertypes.addAll(List.of(supertypes)); return this; }
        public Builder factory(MetaFactory factory) { this.factory = factory; return this; }
        public Builder implicit(String key, String qualifiedName) { this.implicits.put(key, qualifiedName); return this; }
        public Builder initializer(MetaInitializer initializer) { this.initializers.add(initializer); return this; }

        public KindDefinition build() {
            return new KindDefinition(kind, List.copyOf(supertypes), factory,
                    Collections.unmodifiableMap(new LinkedHashMap<>(implicits)), List.copyOf(initializers));
        }
    }
}
