package com.vidnyan.sysml.domain.scope;

import com.vidnyan.sysml.domain.model.NamespaceMeta;
import com.vidnyan.sysml.domain.model.Visibility;

import java.util.ArrayList;
import java.util.List;

/**
 * Scopes consulted for the first segment of a reference: the namespace the
 * reference appears in, its enclosing namespaces, then every document root.
 */
public class ScopeChain extends ModelScope {

    private final NamespaceMeta start;

    public ScopeChain(NamespaceMeta start, ScopeOptions options) {
        super(options);
        this.start = start;
    }

    @Override
    protected List<ModelScope> childScopes() {
        List<ModelScope> scopes = new ArrayList<>();
        List<NamespaceMeta> local = new ArrayList<>();
        NamespaceMeta current = start;
        while (current != null) {
            local.add(current);
            scopes.add(NamespaceScope.of(current, Visibility.PRIVATE, options));
            current = current.owningNamespace().orElse(null);
        }
        for (NamespaceMeta root : options.resolver().globalRoots()) {
            if (!local.contains(root)) scopes.add(NamespaceScope.exported(root, options));
        }
        return scopes;
    }
}
