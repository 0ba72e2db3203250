package com.vidnyan.sysml.domain.scope;

import com.vidnyan.sysml.domain.model.TypeMeta;
import com.vidnyan.sysml.domain.model.Visibility;

import java.util.ArrayList;
import java.util.List;

/**
 * Namespace scope of a type, extended with the members it inherits.
 * Private members of supertypes are never inherited.
 */
public class TypeScope extends NamespaceScope {

    private final TypeMeta type;

    public TypeScope(TypeMeta type, Visibility limit, ScopeOptions options) {
        super(type, limit, options);
        this.type = type;
    }

    @Override
    protected List<ModelScope> childScopes() {
        List<ModelScope> scopes = new ArrayList<>();
        options.resolver().prepareType(type);
        Visibility inherited = limit == Visibility.PUBLIC ? Visibility.PUBLIC : Visibility.PROTECTED;
        ScopeOptions branch = options.branch(type);
        for (TypeMeta supertype : type.types()) {
            if (branch.isVisitedType(supertype)) continue;
            scopes.add(of(supertype, inherited, branch));
        }
        scopes.addAll(importScopes());
        return scopes;
    }
}
