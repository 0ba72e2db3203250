package com.vidnyan.sysml.domain.metamodel;

import java.util.*;

/**
 * The complete kind table: hierarchy, factories, implicit generalizations
 * and initializers. Derived tables are computed once at construction and
 * validated eagerly.
 */
public final class MetamodelDescription {

    private final Map<String, KindDefinition> definitions;
    private final TypeIndex typeIndex;
    private final Map<String, MetaFactory> factories;
    private final Map<String, List<MetaInitializer>> initializers;

    private MetamodelDescription(Map<String, KindDefinition> definitions) {
        this.definitions = Collections.unmodifiableMap(definitions);

        Map<String, List<String>> hierarchy = new LinkedHashMap<>();
        Map<String, MetaFactory> declaredFactories = new HashMap<>();
        Map<String, List<MetaInitializer>> declaredInitializers = new HashMap<>();
        for (KindDefinition definition : definitions.values()) {
            hierarchy.put(definition.kind(), definition.supertypes());
            if (definition.factory() != null) declaredFactories.put(definition.kind(), definition.factory());
            if (!definition.initializers().isEmpty()) {
                declaredInitializers.put(definition.kind(), definition.initializers());
            }
        }

        this.typeIndex = TypeIndex.build(hierarchy);
        this.factories = typeIndex.expandToDerivedTypes(declaredFactories, null);
        for (String kind : typeIndex.kinds()) {
            if (!factories.containsKey(kind)) {
                throw new MetamodelException("No factory for kind " + kind);
            }
        }
        this.initializers = typeIndex.expandAndMerge(declaredInitializers, true);
    }

    public TypeIndex typeIndex() {
        return typeIndex;
    }

    public Collection<KindDefinition> definitions() {
        return definitions.values();
    }

    public Optional<KindDefinition> definition(String kind) {
        return Optional.ofNullable(definitions.get(kind));
    }

    /**
     * Nearest declared factory for {@code kind}.
     */
    public MetaFactory factory(String kind) {
        MetaFactory factory = factories.get(kind);
        if (factory == null) {
            throw new MetamodelException("Unknown kind: " + kind);
        }
        return factory;
    }

    /**
     * Initializers of every kind on the chain of {@code kind}, most general first.
     */
    public List<MetaInitializer> initializers(String kind) {
        return initializers.getOrDefault(kind, List.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, KindDefinition> definitions = new LinkedHashMap<>();

        private Builder() {}

        public Builder kind(KindDefinition definition) {
            if (definitions.putIfAbsent(definition.kind(), definition) != null) {
                throw new MetamodelException("Duplicate kind " + definition.kind());
            }
            return this;
        }

        public Builder kind(KindDefinition.Builder definition) {
            return kind(definition.build());
        }

        public MetamodelDescription build() {
            return new MetamodelDescription(new LinkedHashMap<>(definitions));
        }
    }
}
