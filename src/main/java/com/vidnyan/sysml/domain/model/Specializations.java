package com.vidnyan.sysml.domain.model;

import java.util.*;

/**
 * Direct specialization edges of one type, keyed by target.
 * The first edge added for a target wins; views by kind are cached until the next mutation.
 */
public final class Specializations {

    private final Map<TypeMeta, SpecializationEdge> edges = new LinkedHashMap<>();
    private final Map<SpecializationKind, List<SpecializationEdge>> cache = new EnumMap<>(SpecializationKind.class);

    /**
     * Add an edge unless one to the same target is already present.
     * @return true if the edge was inserted
     */
    public boolean add(SpecializationEdge edge) {
        if (edges.containsKey(edge.target())) return false;
        edges.put(edge.target(), edge);
        cache.clear();
        return true;
    }

    /**
     * Edges whose kind includes {@code kind}; {@code null} or {@code NONE} return all.
     */
    public List<SpecializationEdge> get(SpecializationKind kind) {
        SpecializationKind key = kind == null ? SpecializationKind.NONE : kind;
        return cache.computeIfAbsent(key, k -> edges.values().stream()
                .filter(e -> e.kind().matches(k))
                .toList());
    }

    public Optional<SpecializationEdge> find(TypeMeta target) {
        return Optional.ofNullable(edges.get(target));
    }

    public boolean contains(TypeMeta target) {
        return edges.containsKey(target);
    }

    public int size() {
        return edges.size();
    }

    public boolean isEmpty() {
        return edges.isEmpty();
    }

    public void clear() {
        edges.clear();
        cache.clear();
    }
}
