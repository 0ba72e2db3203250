package com.vidnyan.sysml.domain.scope;

import com.vidnyan.sysml.domain.model.ElementMeta;
import com.vidnyan.sysml.domain.model.Visibility;

import java.util.Map;
import java.util.Optional;

/**
 * Named members of one element, filtered by visibility.
 */
public class ElementScope extends ModelScope {

    protected final ElementMeta element;
    protected final Visibility limit;

    public ElementScope(ElementMeta element, Visibility limit, ScopeOptions options) {
        super(options);
        this.element = element;
        this.limit = limit;
    }

    @Override
    protected Optional<ElementMeta> lookupLocal(String name) {
        return element.findMember(name).filter(this::accepts);
    }

    @Override
    protected void collectLocal(Map<String, ElementMeta> members) {
        element.namedMembers().forEach((name, member) -> {
            if (accepts(member)) members.putIfAbsent(name, member);
        });
    }

    private boolean accepts(ElementMeta member) {
        return member != options.skip() && member.visibility().isVisibleWith(limit);
    }
}
