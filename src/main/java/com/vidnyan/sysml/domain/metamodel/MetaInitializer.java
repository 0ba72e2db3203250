package com.vidnyan.sysml.domain.metamodel;

import com.vidnyan.sysml.domain.model.ElementMeta;
import com.vidnyan.sysml.domain.syntax.SyntaxNode;

/**
 * Copies kind-specific syntax fields onto a freshly created element.
 * Initializers of all kinds on the chain run, most general first.
 */
@FunctionalInterface
public interface MetaInitializer {

    void initialize(ElementMeta meta, SyntaxNode node);
}
