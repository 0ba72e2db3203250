package com.vidnyan.sysml.domain.scope;

import com.vidnyan.sysml.domain.model.*;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves element references segment by segment. The first segment is looked up
 * through the scope chain of the referencing namespace, every following segment
 * in the members visible from outside the previous element.
 */
@Slf4j
public class Linker {

    private final ScopeResolver resolver;
    private final boolean trace;

    public Linker(ScopeResolver resolver, boolean trace) {
        this.resolver = resolver;
        this.trace = trace;
    }

    /**
     * Link {@code reference} starting from {@code root}. Already attempted references
     * return their cached result; a reference met again while resolving yields nothing.
     *
     * @param skip element excluded from the lookup, usually the referencing element itself
     */
    public Optional<ElementMeta> link(ElementReference reference, NamespaceMeta root, ElementMeta skip) {
        if (reference == null) return Optional.empty();
        if (reference.isAttempted()) return reference.target();
        if (reference.isResolving()) return Optional.empty();

        reference.beginResolution();
        List<Names.Segment> segments = reference.segments();
        ElementMeta current = null;
        for (int i = 0; i < segments.size(); i++) {
            String name = segments.get(i).name();
            Optional<ElementMeta> found = i == 0
                    ? new ScopeChain(root, ScopeOptions.create(resolver, skip)).lookup(name)
                    : NamespaceScope.exported(current, ScopeOptions.create(resolver, skip)).lookup(name);
            current = found.map(this::resolveAlias).orElse(null);
            if (current == null) break;
            reference.addFound(current);
        }
        reference.completeResolution(current);

        if (trace) {
            log.debug("Linked '{}' from {} -> {}", reference.text(),
                    root == null ? "<global>" : root.qualifiedName(),
                    current == null ? "<unresolved>" : current.qualifiedName());
        }
        return Optional.ofNullable(current);
    }

    /**
     * Link a reference in the members visible from outside {@code context}.
     */
    public Optional<ElementMeta> linkMember(ElementReference reference, ElementMeta context, ElementMeta skip) {
        if (reference == null || context == null) return Optional.empty();
        if (reference.isAttempted()) return reference.target();
        if (reference.isResolving()) return Optional.empty();

        reference.beginResolution();
        ElementMeta current = context;
        for (Names.Segment segment : reference.segments()) {
            current = NamespaceScope.exported(current, ScopeOptions.create(resolver, skip))
                    .lookup(segment.name())
                    .map(this::resolveAlias)
                    .orElse(null);
            if (current == null) break;
            reference.addFound(current);
        }
        reference.completeResolution(current);
        return Optional.ofNullable(current);
    }

    /**
     * Link the imports and aliases of {@code namespace}. The namespace is marked active
     * for the duration, so a cyclic import sees only what was linked before it.
     */
    public void resolveImports(NamespaceMeta namespace) {
        if (namespace.importResolution() != ResolutionState.NONE) return;
        namespace.setImportResolution(ResolutionState.ACTIVE);
        try {
            for (ImportMeta importMeta : namespace.imports()) {
                importMeta.reference().ifPresent(reference -> link(reference, namespace, importMeta));
            }
            for (MembershipMeta alias : namespace.aliases()) {
                alias.reference().ifPresent(reference -> link(reference, namespace, alias));
            }
        } finally {
            namespace.setImportResolution(ResolutionState.COMPLETED);
        }
    }

    private ElementMeta resolveAlias(ElementMeta element) {
        Set<ElementMeta> visited = new HashSet<>();
        ElementMeta current = element;
        while (current instanceof MembershipMeta membership && membership.isAlias()) {
            if (!visited.add(current)) return null;
            membership.reference().ifPresent(reference ->
                    link(reference, membership.owningNamespace().orElse(null), membership));
            current = membership.element().orElse(null);
        }
        return current;
    }

    /**
     * Follow alias memberships to the element they name, using links already made.
     */
    public static ElementMeta dealias(ElementMeta element) {
        Set<ElementMeta> visited = new HashSet<>();
        ElementMeta current = element;
        while (current instanceof MembershipMeta membership && membership.isAlias()) {
            if (!visited.add(current)) return null;
            current = membership.element().orElse(null);
        }
        return current;
    }
}
