package com.vidnyan.sysml.domain.model;

import com.vidnyan.sysml.domain.metamodel.TypeIndex;

/**
 * Classifier: data types, classes, structures, behaviors and associations.
 * Implicit generalizations are always added, even next to explicit ones.
 */
public class ClassifierMeta extends TypeMeta {

    public ClassifierMeta(int id, String kind, TypeIndex typeIndex) {
        super(id, kind, typeIndex);
    }

    @Override
    public SpecializationKind specializationKind() {
        return SpecializationKind.SUBCLASSIFICATION;
    }

    public boolean isAssociation() {
        return TypeClassifier.has(classifier(), TypeClassifier.ASSOCIATION);
    }

    /**
     * An association with exactly two owned ends.
     */
    public boolean isBinary() {
        return isAssociation() && ownedEnds().size() == 2;
    }

    @Override
    public String defaultSupertype() {
        if (isAssociation()) return isBinary() ? "binary" : "base";
        return "base";
    }
}
