package com.vidnyan.sysml.domain.scope;

import com.vidnyan.sysml.domain.model.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Members of a namespace followed by what its imports bring in.
 * While the namespace's own imports are being resolved only the imports
 * already linked take part, which cuts import cycles.
 */
public class NamespaceScope extends ElementScope {

    protected final NamespaceMeta namespace;

    public NamespaceScope(NamespaceMeta namespace, Visibility limit, ScopeOptions options) {
        super(namespace, limit, options);
        this.namespace = namespace;
    }

    @Override
    protected List<ModelScope> childScopes() {
        return importScopes();
    }

    protected List<ModelScope> importScopes() {
        if (namespace.importResolution() == ResolutionState.NONE) {
            options.resolver().prepareNamespace(namespace);
        }
        List<ModelScope> scopes = new ArrayList<>();
        for (ImportMeta importMeta : namespace.imports()) {
            if (!importMeta.visibility().isVisibleWith(limit)) continue;
            if (importMeta.target().isEmpty()) continue;
            scopes.add(new ImportScope(importMeta, options));
        }
        return scopes;
    }

    /**
     * Scope of {@code element} as seen with {@code limit}: a type scope for types,
     * a namespace scope for namespaces, plain members otherwise.
     */
    public static ModelScope of(ElementMeta element, Visibility limit, ScopeOptions options) {
        if (element instanceof TypeMeta type) return new TypeScope(type, limit, options);
        if (element instanceof NamespaceMeta namespace) return new NamespaceScope(namespace, limit, options);
        return new ElementScope(element, limit, options);
    }

    /**
     * Members visible from outside {@code element}.
     */
    public static ModelScope exported(ElementMeta element, ScopeOptions options) {
        return of(element, Visibility.PUBLIC, options);
    }
}
