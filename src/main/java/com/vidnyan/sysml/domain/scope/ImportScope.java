package com.vidnyan.sysml.domain.scope;

import com.vidnyan.sysml.domain.model.*;

import java.util.*;

/**
 * What one resolved import statement makes visible.
 */
public class ImportScope extends ModelScope {

    private final ImportMeta importMeta;
    private final ElementMeta target;
    private final boolean active;

    public ImportScope(ImportMeta importMeta, ScopeOptions options) {
        super(options);
        this.importMeta = importMeta;
        this.target = Linker.dealias(importMeta.target().orElse(null));
        this.active = target != null && options.visitImport(importMeta);
    }

    private List<String> targetNames() {
        List<String> names = new ArrayList<>(target.memberNames());
        importMeta.reference()
                .map(ElementReference::segments)
                .filter(segments -> !segments.isEmpty())
                .map(segments -> segments.get(segments.size() - 1).name())
                .filter(name -> !names.contains(name))
                .ifPresent(names::add);
        return names;
    }

    @Override
    protected Optional<ElementMeta> lookupLocal(String name) {
        if (!active || !importMeta.importKind().importsTarget()) return Optional.empty();
        if (target == options.skip()) return Optional.empty();
        return targetNames().contains(name) ? Optional.of(target) : Optional.empty();
    }

    @Override
    protected void collectLocal(Map<String, ElementMeta> members) {
        if (!active || !importMeta.importKind().importsTarget() || target == options.skip()) return;
        for (String name : targetNames()) {
            members.putIfAbsent(name, target);
        }
    }

    @Override
    protected List<ModelScope> childScopes() {
        if (!active || !importMeta.importKind().importsMembers()) return List.of();
        if (!(target instanceof NamespaceMeta namespace)) return List.of();

        Visibility limit = importMeta.importsAll() ? Visibility.PRIVATE : Visibility.PUBLIC;
        List<ModelScope> scopes = new ArrayList<>();
        scopes.add(NamespaceScope.of(namespace, limit, options));
        if (importMeta.importKind().isRecursive()) {
            Set<ElementMeta> visited = new HashSet<>();
            visited.add(namespace);
            collectNested(namespace, limit, visited, scopes);
        }
        return scopes;
    }

    private void collectNested(ElementMeta namespace, Visibility limit, Set<ElementMeta> visited, List<ModelScope> scopes) {
        for (ElementMeta member : new LinkedHashSet<>(namespace.namedMembers().values())) {
            if (!(member instanceof NamespaceMeta nested) || member instanceof MembershipMeta) continue;
            if (!member.visibility().isVisibleWith(limit) || !visited.add(member)) continue;
            scopes.add(NamespaceScope.of(nested, limit, options));
            collectNested(nested, limit, visited, scopes);
        }
    }
}
