package com.vidnyan.sysml.domain.metamodel;

import java.util.*;

/**
 * Precomputed kind hierarchy of the metamodel.
 * Immutable after construction and safe for concurrent reads.
 */
public final class TypeIndex {

    private final Map<String, Set<String>> chains; // kind → self + ancestors, most specific first

    private TypeIndex(Map<String, Set<String>> chains) {
        this.chains = Collections.unmodifiableMap(chains);
    }

    /**
     * Build the index from a kind → direct supertypes table.
     * Fails fast on unknown supertypes and cyclic declarations.
     */
    public static TypeIndex build(Map<String, List<String>> supertypes) {
        Map<String, Set<String>> chains = new LinkedHashMap<>();
        for (String kind : supertypes.keySet()) {
            List<String> postOrder = new ArrayList<>();
            visit(kind, supertypes, new HashSet<>(), new HashSet<>(), postOrder);
            Collections.reverse(postOrder);
            chains.put(kind, Collections.unmodifiableSet(new LinkedHashSet<>(postOrder)));
        }
        return new TypeIndex(chains);
    }

    private static void visit(
            String kind,
            Map<String, List<String>> supertypes,
            Set<String> visited,
            Set<String> inStack,
            List<String> postOrder
    ) {
        if (inStack.contains(kind)) {
            throw new MetamodelException("Cyclic kind hierarchy through " + kind);
        }
        if (!visited.add(kind)) return;
        List<String> direct = supertypes.get(kind);
        if (direct == null) {
            throw new MetamodelException("Unknown kind in hierarchy: " + kind);
        }

        inStack.add(kind);
        // walk in reverse so the first declared supertype lands closest to the kind
        for (int i = direct.size() - 1; i >= 0; i--) {
            visit(direct.get(i), supertypes, visited, inStack, postOrder);
        }
        inStack.remove(kind);
        postOrder.add(kind);
    }

    /**
     * True if {@code sub} is {@code sup} or one of its descendants.
     */
    public boolean isSubtype(String sub, String sup) {
        if (Objects.equals(sub, sup)) return true;
        Set<String> chain = chains.get(sub);
        return chain != null && chain.contains(sup);
    }

    /**
     * Ordered ancestor kinds, starting with {@code kind} itself.
     */
    public Set<String> getInheritanceChain(String kind) {
        Set<String> chain = chains.get(kind);
        if (chain == null) {
            throw new MetamodelException("Unknown kind: " + kind);
        }
        return chain;
    }

    public boolean contains(String kind) {
        return chains.containsKey(kind);
    }

    public Set<String> kinds() {
        return chains.keySet();
    }

    /**
     * Fill a sparse kind table for every kind with the value of the nearest
     * registered ancestor. Kinds with no match receive {@code fallback},
     * or are left out if it is null.
     */
    public <V> Map<String, V> expandToDerivedTypes(Map<String, V> registry, V fallback) {
        Map<String, V> expanded = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : chains.entrySet()) {
            V value = null;
            for (String ancestor : entry.getValue()) {
                value = registry.get(ancestor);
                if (value != null) break;
            }
            if (value == null) value = fallback;
            if (value != null) expanded.put(entry.getKey(), value);
        }
        return expanded;
    }

    /**
     * Concatenate registered values along each kind's chain.
     * Without {@code reverse} the result runs from the most specific kind to the most
     * general one, with {@code reverse} from the most general to the most specific.
     * Declaration order is kept within each level.
     */
    public <V> Map<String, List<V>> expandAndMerge(Map<String, List<V>> registry, boolean reverse) {
        Map<String, List<V>> expanded = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : chains.entrySet()) {
            List<String> chain = new ArrayList<>(entry.getValue());
            if (reverse) Collections.reverse(chain);

            List<V> merged = new ArrayList<>();
            for (String ancestor : chain) {
                List<V> values = registry.get(ancestor);
                if (values != null) merged.addAll(values);
            }
            expanded.put(entry.getKey(), Collections.unmodifiableList(merged));
        }
        return expanded;
    }

    public Stats stats() {
        return new Stats(
                chains.size(),
                chains.values().stream().mapToInt(Set::size).max().orElse(0)
        );
    }

    public record Stats(int kindCount, int deepestChain) {}
}
