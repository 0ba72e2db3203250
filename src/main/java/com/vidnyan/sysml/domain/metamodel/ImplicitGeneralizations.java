package com.vidnyan.sysml.domain.metamodel;

import java.util.*;

/**
 * Per-kind table of implicit generalization keys to library qualified names.
 * A key declared on a more specific kind overrides the same key on its ancestors.
 */
public final class ImplicitGeneralizations {

    private final Map<String, Map<String, String>> table;

    public ImplicitGeneralizations(MetamodelDescription description) {
        Map<String, List<Map.Entry<String, String>>> declared = new HashMap<>();
        for (KindDefinition definition : description.definitions()) {
            if (!definition.implicits().isEmpty()) {
                declared.put(definition.kind(), List.copyOf(definition.implicits().entrySet()));
            }
        }

        // merged general to specific, so later puts override earlier ones
        Map<String, List<Map.Entry<String, String>>> merged =
                description.typeIndex().expandAndMerge(declared, true);
        Map<String, Map<String, String>> table = new HashMap<>();
        merged.forEach((kind, entries) -> {
            Map<String, String> keys = new LinkedHashMap<>();
            for (Map.Entry<String, String> entry : entries) {
                keys.put(entry.getKey(), entry.getValue());
            }
            table.put(kind, Collections.unmodifiableMap(keys));
        });
        this.table = Collections.unmodifiableMap(table);
    }

    /**
     * Library qualified name registered for {@code key} on {@code kind} or its nearest ancestor.
     */
    public Optional<String> lookup(String kind, String key) {
        Map<String, String> keys = table.get(kind);
        return keys == null ? Optional.empty() : Optional.ofNullable(keys.get(key));
    }

    public Map<String, String> keys(String kind) {
        return table.getOrDefault(kind, Map.of());
    }

    public int size() {
        return table.values().stream().mapToInt(Map::size).sum();
    }
}
