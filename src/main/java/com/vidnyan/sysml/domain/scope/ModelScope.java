package com.vidnyan.sysml.domain.scope;

import com.vidnyan.sysml.domain.model.ElementMeta;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A lookup scope: local members first, then child scopes in order.
 * Child scopes are created only when the local lookup misses.
 */
public abstract class ModelScope {

    protected final ScopeOptions options;

    protected ModelScope(ScopeOptions options) {
        this.options = options;
    }

    protected Optional<ElementMeta> lookupLocal(String name) {
        return Optional.empty();
    }

    protected void collectLocal(Map<String, ElementMeta> members) {
    }

    protected List<ModelScope> childScopes() {
        return List.of();
    }

    public Optional<ElementMeta> lookup(String name) {
        Optional<ElementMeta> local = lookupLocal(name);
        if (local.isPresent()) return local;
        for (ModelScope child : childScopes()) {
            Optional<ElementMeta> found = child.lookup(name);
            if (found.isPresent()) return found;
        }
        return Optional.empty();
    }

    /**
     * Every visible name with the element it resolves to. Shadowed names keep the first match.
     */
    public Map<String, ElementMeta> allMembers() {
        Map<String, ElementMeta> members = new LinkedHashMap<>();
        collect(members);
        return members;
    }

    protected void collect(Map<String, ElementMeta> members) {
        collectLocal(members);
        for (ModelScope child : childScopes()) {
            child.collect(members);
        }
    }
}
