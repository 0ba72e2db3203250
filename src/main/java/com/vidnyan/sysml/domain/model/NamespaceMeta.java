package com.vidnyan.sysml.domain.model;

import com.vidnyan.sysml.domain.metamodel.TypeIndex;

import java.util.List;

/**
 * Element that owns named members and import statements.
 */
public class NamespaceMeta extends ElementMeta {

    private ResolutionState importResolution = ResolutionState.NONE;

    public NamespaceMeta(int id, String kind, TypeIndex typeIndex) {
        super(id, kind, typeIndex);
    }

    public List<ImportMeta> imports() {
        return children().stream()
                .filter(ImportMeta.class::isInstance)
                .map(ImportMeta.class::cast)
                .toList();
    }

    public List<MembershipMeta> aliases() {
        return children().stream()
                .filter(c -> c instanceof MembershipMeta m && m.isAlias())
                .map(MembershipMeta.class::cast)
                .toList();
    }

    /**
     * Owned members, with memberships unwrapped.
     */
    public List<ElementMeta> ownedMembers() {
        return ownedElements().stream()
                .filter(e -> !(e instanceof RelationshipMeta) || e instanceof MembershipMeta)
                .toList();
    }

    public ResolutionState importResolution() {
        return importResolution;
    }

    public void setImportResolution(ResolutionState importResolution) {
        this.importResolution = importResolution;
    }

    @Override
    public void resetLinks() {
        super.resetLinks();
        importResolution = ResolutionState.NONE;
    }
}
