package com.vidnyan.sysml.domain.build;

import com.vidnyan.sysml.domain.metamodel.ImplicitGeneralizations;
import com.vidnyan.sysml.domain.metamodel.Kinds;
import com.vidnyan.sysml.domain.model.*;
import com.vidnyan.sysml.domain.scope.Linker;
import com.vidnyan.sysml.domain.scope.ScopeResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Links and completes semantic elements. Each element is built at most once
 * per reset; an element requested again while it is being built is returned
 * as is, which keeps cyclic input from recursing.
 */
@Slf4j
public class ModelBuilder implements ScopeResolver {

    private final ModelWorkspace workspace;
    private final ImplicitGeneralizations implicits;
    private final Linker linker;
    private final Set<String> reportedMissing = ConcurrentHashMap.newKeySet();

    public ModelBuilder(ModelWorkspace workspace, ImplicitGeneralizations implicits, boolean traceLinking) {
        this.workspace = workspace;
        this.implicits = implicits;
        this.linker = new Linker(this, traceLinking);
    }

    public Linker linker() {
        return linker;
    }

    public void buildDocument(ModelDocument document) {
        for (ElementMeta element : new ArrayList<>(document.elements())) {
            build(element);
        }
        document.markBuilt();
    }

    public void build(ElementMeta element) {
        if (element.buildState() != ResolutionState.NONE) return;
        if (element.document() == null) {
            throw new IllegalStateException("Element does not belong to a document: " + element);
        }

        element.setBuildState(ResolutionState.ACTIVE);
        try {
            if (element instanceof NamespaceMeta namespace) linker.resolveImports(namespace);
            if (element instanceof TypeMeta type) resolveHeritage(type);
            if (element instanceof FeatureMeta feature) completeFeature(feature);
            if (element instanceof TypeMeta type) addImplicitGeneralizations(type);
            if (element instanceof ExpressionMeta expression) linkExpression(expression);
            if (element instanceof RelationshipMeta relationship) linkRelationship(relationship);
        } finally {
            element.setBuildState(ResolutionState.COMPLETED);
        }
    }

    @Override
    public void prepareType(TypeMeta type) {
        build(type);
    }

    @Override
    public void prepareNamespace(NamespaceMeta namespace) {
        linker.resolveImports(namespace);
    }

    @Override
    public List<NamespaceMeta> globalRoots() {
        return workspace.roots();
    }

    private void resolveHeritage(TypeMeta type) {
        NamespaceMeta root = type.owningNamespace().orElse(null);
        for (ElementMeta child : type.children()) {
            if (child instanceof SpecializationMeta specialization) {
                Optional<ElementReference> reference = specialization.reference();
                if (reference.isEmpty()) continue;
                Optional<ElementMeta> target = linker.link(reference.get(), root, type);
                if (target.isPresent() && target.get() instanceof TypeMeta general) {
                    prepareType(general);
                    type.addSpecialization(general, specialization.specializationKind(), EdgeSource.EXPLICIT, specialization);
                }
                if (type instanceof FeatureMeta feature && isChain(reference.get())) {
                    feature.setChainingFeatures(features(reference.get().found()));
                }
            } else if (child instanceof RelationshipMeta relationship && isTypeRelationship(relationship)) {
                relationship.reference()
                        .flatMap(reference -> linker.link(reference, root, type))
                        .filter(TypeMeta.class::isInstance)
                        .ifPresent(target -> type.addTypeRelationship(
                                new TypeRelationship(relationship.kind(), (TypeMeta) target, relationship)));
            }
        }
        if (type instanceof FeatureMeta feature) resolveChainings(feature, root);
    }

    /**
     * Explicit feature chainings: each link is looked up in the previous chaining feature.
     */
    private void resolveChainings(FeatureMeta feature, NamespaceMeta root) {
        List<FeatureMeta> chaining = new ArrayList<>();
        ElementMeta previous = null;
        for (ElementMeta child : feature.children()) {
            if (!(child instanceof RelationshipMeta relationship) || !relationship.is(Kinds.FEATURE_CHAINING)) continue;
            ElementReference reference = relationship.reference().orElse(null);
            Optional<ElementMeta> target = previous == null
                    ? linker.link(reference, root, feature)
                    : linker.linkMember(reference, previous, feature);
            if (target.isEmpty() || !(target.get() instanceof FeatureMeta chained)) break;
            chaining.add(chained);
            previous = chained;
        }
        if (!chaining.isEmpty()) feature.setChainingFeatures(chaining);
    }

    private static boolean isChain(ElementReference reference) {
        return reference.segments().stream().anyMatch(Names.Segment::chained);
    }

    private static List<FeatureMeta> features(List<ElementMeta> elements) {
        return elements.stream()
                .filter(FeatureMeta.class::isInstance)
                .map(FeatureMeta.class::cast)
                .toList();
    }

    private static boolean isTypeRelationship(RelationshipMeta relationship) {
        return relationship.isAny(Kinds.DISJOINING, Kinds.UNIONING, Kinds.INTERSECTING,
                Kinds.DIFFERENCING, Kinds.FEATURE_INVERTING, Kinds.TYPE_FEATURING);
    }

    private void completeFeature(FeatureMeta feature) {
        feature.propagateOrdered();
        feature.namingFeature().ifPresent(naming -> {
            build(naming);
            String name = naming.effectiveName();
            if (name == null) return;
            feature.setInheritedName(name);
            ElementMeta owner = feature.owner();
            if (owner != null) owner.addNamedMember(name, feature);
        });
    }

    private void addImplicitGeneralizations(TypeMeta type) {
        if (type instanceof FeatureMeta) {
            ElementMeta owner = type.owner();
            if (owner != null) build(owner);
        }
        if (!type.needsImplicitGeneralization()) return;

        for (String key : type.defaultGeneralTypes()) {
            Optional<String> qualifiedName = implicits.lookup(type.kind(), key);
            if (qualifiedName.isEmpty()) continue;
            Optional<ElementMeta> general = workspace.findLibraryElement(qualifiedName.get());
            if (general.isPresent() && general.get() instanceof TypeMeta generalType) {
                type.addSpecialization(generalType, type.specializationKind(), EdgeSource.IMPLICIT);
            } else {
                type.addIssue("Implicit generalization target not found: " + qualifiedName.get());
                if (reportedMissing.add(qualifiedName.get())) {
                    log.warn("Library element {} not found, implicit generalizations to it are skipped",
                            qualifiedName.get());
                }
            }
        }
    }

    private void linkExpression(ExpressionMeta expression) {
        ElementReference reference = expression.reference().orElse(null);
        if (reference == null) return;
        if (expression instanceof FeatureChainExpressionMeta chain) {
            Optional<ElementMeta> context = chain.source().flatMap(this::sourceContext);
            if (context.isPresent()) {
                linker.linkMember(reference, context.get(), expression);
                return;
            }
        }
        linker.link(reference, expression.owningNamespace().orElse(null), expression);
    }

    /**
     * Element whose members a feature chain navigates: the referenced element of the
     * source, or the type of its values.
     */
    private Optional<ElementMeta> sourceContext(ExpressionMeta source) {
        build(source);
        Optional<ElementMeta> referenced = source.referencedElement();
        if (referenced.isPresent()) return referenced;
        return source.returnType().flatMap(workspace::findLibraryElement);
    }

    private void linkRelationship(RelationshipMeta relationship) {
        ElementMeta owner = relationship.owner();
        if (owner != null) build(owner);
        ElementReference reference = relationship.reference().orElse(null);
        if (reference == null || reference.isAttempted()) return;
        linker.link(reference, relationship.owningNamespace().orElse(null), relationship);
    }

    /**
     * Reset the document and its dependents in the workspace, then build them again.
     * @return the rebuilt documents
     */
    public List<ModelDocument> rebuild(String uri) {
        List<ModelDocument> affected = workspace.reset(uri);
        affected.forEach(this::buildDocument);
        return affected;
    }

    /**
     * Drop a document and rebuild everything that linked into it.
     */
    public List<ModelDocument> invalidate(String uri) {
        List<ModelDocument> dependents = workspace.invalidate(uri);
        dependents.forEach(this::buildDocument);
        return dependents;
    }
}
