package com.vidnyan.sysml.domain.scope;

import com.vidnyan.sysml.domain.model.ElementMeta;
import com.vidnyan.sysml.domain.model.ImportMeta;
import com.vidnyan.sysml.domain.model.NamespaceMeta;
import com.vidnyan.sysml.domain.model.TypeMeta;

import java.util.HashSet;
import java.util.Set;

/**
 * State of a single lookup. Imports are visited at most once per lookup;
 * supertypes at most once per inheritance branch.
 */
public final class ScopeOptions {

    private final ScopeResolver resolver;
    private final ElementMeta skip;
    private final Set<ImportMeta> visitedImports;
    private final Set<NamespaceMeta> visitedTypes;

    private ScopeOptions(ScopeResolver resolver, ElementMeta skip, Set<ImportMeta> visitedImports, Set<NamespaceMeta> visitedTypes) {
        this.resolver = resolver;
        this.skip = skip;
        this.visitedImports = visitedImports;
        this.visitedTypes = visitedTypes;
    }

    /**
     * @param skip element never returned by the lookup, e.g. the element whose reference is being linked
     */
    public static ScopeOptions create(ScopeResolver resolver, ElementMeta skip) {
        return new ScopeOptions(resolver, skip, new HashSet<>(), new HashSet<>());
    }

    public ScopeResolver resolver() {
        return resolver;
    }

    public ElementMeta skip() {
        return skip;
    }

    /**
     * @return false if the import was already visited in this lookup
     */
    public boolean visitImport(ImportMeta importMeta) {
        return visitedImports.add(importMeta);
    }

    public boolean isVisitedType(TypeMeta type) {
        return visitedTypes.contains(type);
    }

    /**
     * Options for one inheritance branch, with {@code type} marked as visited.
     */
    public ScopeOptions branch(NamespaceMeta type) {
        Set<NamespaceMeta> types = new HashSet<>(visitedTypes);
        types.add(type);
        return new ScopeOptions(resolver, skip, visitedImports, types);
    }
}
