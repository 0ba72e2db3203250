package com.vidnyan.sysml.domain.model;

import com.vidnyan.sysml.domain.metamodel.TypeIndex;

/**
 * Explicit heritage relationship: subclassification, typing, subsetting,
 * redefinition, conjugation and their kin.
 */
public class SpecializationMeta extends RelationshipMeta {

    private SpecializationKind specializationKind = SpecializationKind.SPECIALIZATION;

    public SpecializationMeta(int id, String kind, TypeIndex typeIndex) {
        super(id, kind, typeIndex);
    }

    public SpecializationKind specializationKind() {
        return specializationKind;
    }

    public void setSpecializationKind(SpecializationKind specializationKind) {
        this.specializationKind = specializationKind;
    }
}
