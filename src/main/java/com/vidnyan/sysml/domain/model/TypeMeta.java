package com.vidnyan.sysml.domain.model;

import com.vidnyan.sysml.domain.metamodel.Kinds;
import com.vidnyan.sysml.domain.metamodel.TypeIndex;

import java.util.*;
import java.util.function.Predicate;

/**
 * Node of the specialization graph.
 * Traversals tolerate cycles in the input: every walk carries a visited set
 * and skips targets it has already seen.
 */
public class TypeMeta extends NamespaceMeta {

    private final Specializations heritage = new Specializations();
    private final List<TypeRelationship> typeRelationships = new ArrayList<>();
    private boolean isAbstract;
    private int classifier = TypeClassifier.NONE;

    public TypeMeta(int id, String kind, TypeIndex typeIndex) {
        super(id, kind, typeIndex);
    }

    public boolean isAbstract() {
        return isAbstract;
    }

    public void setAbstract(boolean isAbstract) {
        this.isAbstract = isAbstract;
    }

    /**
     * Kind used for implicit generalizations of this type.
     */
    public SpecializationKind specializationKind() {
        return SpecializationKind.SPECIALIZATION;
    }

    /**
     * Add a direct specialization. Self-specialization is ignored and the
     * first edge added for a target wins.
     * @return true if a new edge was inserted
     */
    public boolean addSpecialization(TypeMeta target, SpecializationKind kind, EdgeSource source, RelationshipMeta relationship) {
        if (target == null || target == this) return false;
        return heritage.add(new SpecializationEdge(target, kind, source, relationship));
    }

    public boolean addSpecialization(TypeMeta target, SpecializationKind kind, EdgeSource source) {
        return addSpecialization(target, kind, source, null);
    }

    /**
     * Direct edges whose kind includes {@code kind}; null returns all.
     */
    public List<SpecializationEdge> specializations(SpecializationKind kind) {
        return heritage.get(kind);
    }

    public List<SpecializationEdge> specializations() {
        return heritage.get(SpecializationKind.NONE);
    }

    /**
     * Direct specialized types.
     */
    public List<TypeMeta> types(SpecializationKind kind) {
        return specializations(kind).stream()
                .map(SpecializationEdge::target)
                .toList();
    }

    public List<TypeMeta> types() {
        return types(SpecializationKind.NONE);
    }

    /**
     * Transitive edges of {@code kind}, in depth-first pre-order.
     */
    public List<SpecializationEdge> allSpecializations(SpecializationKind kind) {
        List<SpecializationEdge> result = new ArrayList<>();
        Set<TypeMeta> visited = new HashSet<>();
        visited.add(this);
        collectSpecializations(this, kind, visited, result);
        return result;
    }

    public List<SpecializationEdge> allSpecializations() {
        return allSpecializations(SpecializationKind.NONE);
    }

    private static void collectSpecializations(
            TypeMeta type,
            SpecializationKind kind,
            Set<TypeMeta> visited,
            List<SpecializationEdge> result
    ) {
        for (SpecializationEdge edge : type.specializations(kind)) {
            if (!visited.add(edge.target())) continue;
            result.add(edge);
            collectSpecializations(edge.target(), kind, visited, result);
        }
    }

    /**
     * Transitive specialized types, optionally led by this type.
     */
    public List<TypeMeta> allTypes(SpecializationKind kind, boolean includeSelf) {
        List<TypeMeta> result = new ArrayList<>();
        if (includeSelf) result.add(this);
        for (SpecializationEdge edge : allSpecializations(kind)) {
            result.add(edge.target());
        }
        return result;
    }

    public List<TypeMeta> allTypes() {
        return allTypes(SpecializationKind.NONE, false);
    }

    /**
     * True if a type with this qualified name is this type or one of its transitive supertypes.
     */
    public boolean conforms(String qualifiedName, SpecializationKind kind) {
        for (TypeMeta type : allTypes(kind, true)) {
            if (qualifiedName.equals(type.qualifiedName())) return true;
        }
        return false;
    }

    public boolean conforms(String qualifiedName) {
        return conforms(qualifiedName, SpecializationKind.NONE);
    }

    /**
     * Identity-based variant of {@link #conforms(String, SpecializationKind)}.
     */
    public boolean conforms(TypeMeta type, SpecializationKind kind) {
        for (TypeMeta candidate : allTypes(kind, true)) {
            if (candidate == type) return true;
        }
        return false;
    }

    public boolean conforms(TypeMeta type) {
        return conforms(type, SpecializationKind.NONE);
    }

    /**
     * Features owned through feature memberships or as direct children.
     */
    public List<FeatureMeta> ownedFeatures() {
        List<FeatureMeta> features = new ArrayList<>();
        for (ElementMeta element : ownedElements()) {
            if (!(element instanceof FeatureMeta feature)) continue;
            if (feature.is(Kinds.MULTIPLICITY) || feature.is(Kinds.METADATA_FEATURE)) continue;
            boolean value = feature.owningMembership()
                    .map(m -> m.is(Kinds.FEATURE_VALUE))
                    .orElse(false);
            if (!value) features.add(feature);
        }
        return features;
    }

    public List<FeatureMeta> ownedEnds() {
        return ownedFeatures().stream()
                .filter(FeatureMeta::isEnd)
                .toList();
    }

    /**
     * Owned features of this type and all of its supertypes. A feature
     * redefined by an already collected feature is left out.
     */
    public List<FeatureMeta> allFeatures() {
        Set<FeatureMeta> visited = new HashSet<>();
        List<FeatureMeta> result = new ArrayList<>();
        for (TypeMeta type : allTypes(SpecializationKind.NONE, true)) {
            for (FeatureMeta feature : type.ownedFeatures()) {
                if (!visited.add(feature)) continue;
                result.add(feature);
                for (TypeMeta redefined : feature.allTypes(SpecializationKind.REDEFINITION, false)) {
                    if (redefined instanceof FeatureMeta redefinedFeature) visited.add(redefinedFeature);
                }
            }
        }
        return result;
    }

    /**
     * Metadata of this type and all of its supertypes.
     */
    public List<FeatureMeta> allMetadata() {
        List<FeatureMeta> result = new ArrayList<>();
        for (TypeMeta type : allTypes(SpecializationKind.NONE, true)) {
            result.addAll(type.metadata());
        }
        return result;
    }

    /**
     * Positional features matched across the hierarchy. Each supertype
     * contributes only the features past the ones already matched, so
     * redefined positional parameters line up with their originals.
     */
    public List<FeatureMeta> basePositionalFeatures(Predicate<FeatureMeta> predicate, Predicate<TypeMeta> typePredicate) {
        List<FeatureMeta> result = new ArrayList<>();
        int count = 0;
        for (TypeMeta type : allTypes(SpecializationKind.NONE, true)) {
            if (typePredicate != null && !typePredicate.test(type)) continue;
            List<FeatureMeta> matching = type.ownedFeatures().stream()
                    .filter(predicate)
                    .toList();
            if (matching.size() <= count) continue;
            List<FeatureMeta> tail = matching.subList(count, matching.size());
            result.addAll(tail);
            count += tail.size();
        }
        return result;
    }

    /**
     * Own result expression, else the first one found among supertypes.
     */
    public Optional<FeatureMeta> resultParameter() {
        return findInherited(Kinds.RESULT_EXPRESSION_MEMBERSHIP);
    }

    /**
     * Own return parameter, else the first one found among supertypes.
     */
    public Optional<FeatureMeta> returnParameter() {
        return findInherited(Kinds.RETURN_PARAMETER_MEMBERSHIP);
    }

    private Optional<FeatureMeta> findInherited(String membershipKind) {
        Optional<FeatureMeta> own = findOwned(membershipKind);
        if (own.isPresent()) return own;
        for (SpecializationEdge edge : allSpecializations()) {
            Optional<FeatureMeta> inherited = edge.target().findOwned(membershipKind);
            if (inherited.isPresent()) return inherited;
        }
        return Optional.empty();
    }

    private Optional<FeatureMeta> findOwned(String membershipKind) {
        for (ElementMeta child : children()) {
            if (child instanceof MembershipMeta membership && membership.is(membershipKind)) {
                Optional<ElementMeta> element = membership.element();
                if (element.isPresent() && element.get() instanceof FeatureMeta feature) {
                    return Optional.of(feature);
                }
            }
        }
        return Optional.empty();
    }

    public Optional<FeatureMeta> multiplicity() {
        return ownedElements().stream()
                .filter(e -> e.is(Kinds.MULTIPLICITY))
                .map(FeatureMeta.class::cast)
                .findFirst();
    }

    /**
     * Own classifier bits, set from the kind at creation.
     */
    public int classifier() {
        return classifier;
    }

    public void addClassifier(int flags) {
        classifier |= flags;
    }

    /**
     * Classifier bits used for structural checks.
     */
    public int classifierFlags() {
        return classifier;
    }

    public String classifierString() {
        return TypeClassifier.toString(classifierFlags());
    }

    public List<TypeRelationship> typeRelationships(String kind) {
        return typeRelationships.stream()
                .filter(r -> r.kind().equals(kind))
                .toList();
    }

    public void addTypeRelationship(TypeRelationship relationship) {
        typeRelationships.add(relationship);
    }

    /**
     * Key of the library type this type specializes when nothing explicit applies.
     */
    public String defaultSupertype() {
        return "base";
    }

    /**
     * All implicit generalization keys, most important first.
     */
    public List<String> defaultGeneralTypes() {
        List<String> keys = new ArrayList<>();
        keys.add(defaultSupertype());
        return keys;
    }

    /**
     * True if implicit generalizations should be added.
     */
    public boolean needsImplicitGeneralization() {
        return true;
    }

    @Override
    public void resetLinks() {
        super.resetLinks();
        heritage.clear();
        typeRelationships.clear();
    }
}
