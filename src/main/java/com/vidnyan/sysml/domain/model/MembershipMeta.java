package com.vidnyan.sysml.domain.model;

import com.vidnyan.sysml.domain.metamodel.Kinds;
import com.vidnyan.sysml.domain.metamodel.TypeIndex;

import java.util.Optional;

/**
 * Membership of an element in a namespace. Owning memberships wrap their
 * member and are transparent for naming; plain memberships are aliases
 * that refer to an element owned elsewhere.
 */
public class MembershipMeta extends RelationshipMeta {

    public MembershipMeta(int id, String kind, TypeIndex typeIndex) {
        super(id, kind, typeIndex);
    }

    @Override
    public boolean isTransparent() {
        return is(Kinds.OWNING_MEMBERSHIP);
    }

    public boolean isAlias() {
        return !isTransparent();
    }

    /**
     * The member: the wrapped element for owning memberships, the alias target otherwise.
     */
    public Optional<ElementMeta> element() {
        if (isAlias()) return target();
        return children().stream().findFirst();
    }
}
