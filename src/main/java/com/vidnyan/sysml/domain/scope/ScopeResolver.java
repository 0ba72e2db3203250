package com.vidnyan.sysml.domain.scope;

import com.vidnyan.sysml.domain.model.NamespaceMeta;
import com.vidnyan.sysml.domain.model.TypeMeta;

import java.util.List;

/**
 * Callbacks scopes use to bring elements up to date before reading them.
 * Implemented by the model builder, which builds elements lazily.
 */
public interface ScopeResolver {

    /**
     * Make sure the direct specializations of {@code type} are linked.
     */
    void prepareType(TypeMeta type);

    /**
     * Make sure the imports and aliases of {@code namespace} are linked.
     */
    void prepareNamespace(NamespaceMeta namespace);

    /**
     * Roots of all documents taking part in global lookup.
     */
    List<NamespaceMeta> globalRoots();
}
