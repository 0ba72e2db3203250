package com.vidnyan.sysml.domain.model;

import com.vidnyan.sysml.domain.metamodel.Kinds;
import com.vidnyan.sysml.domain.metamodel.TypeIndex;

import java.util.*;

/**
 * Feature: a type that is also a member of its featuring types.
 * Its default supertype depends on its classifier flags and its owner.
 */
public class FeatureMeta extends TypeMeta {

    private Direction direction = Direction.NONE;
    private boolean composite;
    private boolean portion;
    private boolean readonly;
    private boolean derived;
    private boolean end;
    private boolean nonunique;
    private boolean declaredOrdered;
    private boolean ordered;
    private String inheritedName;
    private List<FeatureMeta> chainingFeatures = List.of();

    public FeatureMeta(int id, String kind, TypeIndex typeIndex) {
        super(id, kind, typeIndex);
    }

    @Override
    public SpecializationKind specializationKind() {
        return SpecializationKind.SUBSETTING;
    }

    public Direction direction() {
        return direction;
    }

    public void setDirection(Direction direction) {
        this.direction = direction == null ? Direction.NONE : direction;
    }

    public boolean isComposite() {
        return composite;
    }

    public void setComposite(boolean composite) {
        this.composite = composite;
    }

    public boolean isPortion() {
        return portion;
    }

    public void setPortion(boolean portion) {
        this.portion = portion;
    }

    public boolean isReadonly() {
        return readonly;
    }

    public void setReadonly(boolean readonly) {
        this.readonly = readonly;
    }

    public boolean isDerived() {
        return derived;
    }

    public void setDerived(boolean derived) {
        this.derived = derived;
    }

    /**
     * Declared end, or owned through an end feature membership.
     */
    public boolean isEnd() {
        if (end) return true;
        return owningMembership()
                .map(m -> m.is(Kinds.END_FEATURE_MEMBERSHIP))
                .orElse(false);
    }

    public void setEnd(boolean end) {
        this.end = end;
    }

    public boolean isNonunique() {
        return nonunique;
    }

    public void setNonunique(boolean nonunique) {
        this.nonunique = nonunique;
    }

    public boolean isOrdered() {
        return ordered;
    }

    public void setOrdered(boolean ordered) {
        this.declaredOrdered = ordered;
        this.ordered = ordered;
    }

    /**
     * A feature subsetting an ordered feature is itself ordered.
     */
    public void propagateOrdered() {
        if (ordered) return;
        for (TypeMeta subsetted : types(SpecializationKind.SUBSETTING)) {
            if (subsetted instanceof FeatureMeta feature && feature.isOrdered()) {
                ordered = true;
                return;
            }
        }
    }

    @Override
    public String effectiveName() {
        String own = super.effectiveName();
        return own != null ? own : inheritedName;
    }

    @Override
    public List<String> memberNames() {
        List<String> names = super.memberNames();
        if (names.isEmpty() && inheritedName != null) return List.of(inheritedName);
        return names;
    }

    /**
     * For an unnamed feature, the first feature it redefines.
     */
    public Optional<FeatureMeta> namingFeature() {
        if (name() != null || shortName() != null) return Optional.empty();
        return types(SpecializationKind.REDEFINITION).stream()
                .filter(FeatureMeta.class::isInstance)
                .map(FeatureMeta.class::cast)
                .findFirst();
    }

    public String inheritedName() {
        return inheritedName;
    }

    public void setInheritedName(String inheritedName) {
        this.inheritedName = inheritedName;
    }

    public Optional<TypeMeta> owningType() {
        ElementMeta owner = owner();
        return owner instanceof TypeMeta type ? Optional.of(type) : Optional.empty();
    }

    /**
     * Owning type followed by types added through type featuring.
     */
    public List<TypeMeta> featuringTypes() {
        List<TypeMeta> featuring = new ArrayList<>();
        owningType().ifPresent(featuring::add);
        for (TypeRelationship relationship : typeRelationships(Kinds.TYPE_FEATURING)) {
            if (!featuring.contains(relationship.target())) featuring.add(relationship.target());
        }
        return featuring;
    }

    /**
     * Expression bound through a feature value.
     */
    public Optional<ExpressionMeta> value() {
        for (ElementMeta child : children()) {
            if (child instanceof MembershipMeta membership && membership.is(Kinds.FEATURE_VALUE)) {
                Optional<ElementMeta> element = membership.element();
                if (element.isPresent() && element.get() instanceof ExpressionMeta expression) {
                    return Optional.of(expression);
                }
            }
        }
        return Optional.empty();
    }

    public List<FeatureMeta> chainingFeatures() {
        return chainingFeatures;
    }

    public void setChainingFeatures(List<FeatureMeta> chainingFeatures) {
        this.chainingFeatures = List.copyOf(chainingFeatures);
    }

    /**
     * Union of the classifier bits of all types this feature specializes.
     */
    @Override
    public int classifierFlags() {
        int flags = TypeClassifier.NONE;
        for (TypeMeta type : allTypes()) {
            if (!(type instanceof FeatureMeta)) flags |= type.classifier();
        }
        return flags;
    }

    public boolean hasStructureType() {
        return TypeClassifier.has(classifierFlags(), TypeClassifier.STRUCTURE);
    }

    public boolean hasClassType() {
        return TypeClassifier.has(classifierFlags(), TypeClassifier.CLASS);
    }

    public boolean hasDataType() {
        return TypeClassifier.has(classifierFlags(), TypeClassifier.DATA_TYPE);
    }

    protected boolean isBehaviorOwned() {
        ElementMeta owner = owner();
        return owner != null && owner.isAny(Kinds.BEHAVIOR, Kinds.STEP);
    }

    protected boolean isBehaviorOwnedComposite() {
        return composite && isBehaviorOwned();
    }

    /**
     * Composite and owned by a structure, or by a feature typed by one.
     */
    protected boolean isSubobject() {
        if (!composite) return false;
        ElementMeta owner = owner();
        if (owner == null) return false;
        return owner.is(Kinds.STRUCTURE) || (owner instanceof FeatureMeta feature && feature.hasStructureType());
    }

    protected boolean isStructureOwnedComposite() {
        return isSubobject();
    }

    /**
     * Composite and owned by a class, or by a feature typed by one.
     */
    protected boolean isSuboccurrence() {
        if (!composite) return false;
        ElementMeta owner = owner();
        if (owner == null) return false;
        return owner.is(Kinds.CLASS) || (owner instanceof FeatureMeta feature && feature.hasClassType());
    }

    public boolean isAssociationEnd() {
        if (!isEnd()) return false;
        ElementMeta owner = owner();
        return owner != null && owner.isAny(Kinds.ASSOCIATION, Kinds.CONNECTOR);
    }

    @Override
    public String defaultSupertype() {
        if (hasStructureType()) return isSubobject() ? "subobject" : "object";
        if (hasClassType()) return isSuboccurrence() ? "suboccurrence" : "occurrence";
        if (hasDataType()) return "dataValue";
        return "base";
    }

    @Override
    public List<String> defaultGeneralTypes() {
        List<String> keys = super.defaultGeneralTypes();
        if (isAssociationEnd()) keys.add("participant");
        return keys;
    }

    /**
     * Skipped when an explicit subsetting, redefinition or conjugation exists.
     */
    @Override
    public boolean needsImplicitGeneralization() {
        boolean subsets = specializations(SpecializationKind.SUBSETTING).stream()
                .anyMatch(e -> !e.isImplicit());
        return !subsets && specializations(SpecializationKind.CONJUGATION).isEmpty();
    }

    @Override
    public void resetLinks() {
        super.resetLinks();
        if (inheritedName != null) {
            ElementMeta owner = owner();
            inheritedName = null;
            if (owner != null && super.effectiveName() == null) {
                owner.removeNamedMember(this);
                owner.restoreNamedMembers();
            }
        }
        ordered = declaredOrdered;
        chainingFeatures = List.of();
    }
}
