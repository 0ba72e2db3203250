package com.vidnyan.sysml.domain.model;

import com.vidnyan.sysml.domain.metamodel.TypeIndex;

import java.util.List;
import java.util.Optional;

/**
 * Directed relationship whose target is given by a textual reference.
 * The source is the owning element.
 */
public class RelationshipMeta extends ElementMeta {

    private ElementReference reference;

    public RelationshipMeta(int id, String kind, TypeIndex typeIndex) {
        super(id, kind, typeIndex);
    }

    public Optional<ElementReference> reference() {
        return Optional.ofNullable(reference);
    }

    public void setReference(ElementReference reference) {
        this.reference = reference;
    }

    /**
     * Resolved target, empty if unresolved or missing.
     */
    public Optional<ElementMeta> target() {
        return reference == null ? Optional.empty() : reference.target();
    }

    /**
     * The element this relationship goes out from.
     */
    public ElementMeta source() {
        return owner();
    }

    @Override
    public List<ElementReference> references() {
        return reference == null ? List.of() : List.of(reference);
    }

    @Override
    public void resetLinks() {
        super.resetLinks();
        if (reference != null) reference.reset();
    }
}
