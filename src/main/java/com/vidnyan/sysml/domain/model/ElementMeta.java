package com.vidnyan.sysml.domain.model;

import com.vidnyan.sysml.domain.metamodel.Kinds;
import com.vidnyan.sysml.domain.metamodel.TypeIndex;

import java.util.*;

/**
 * Semantic side-table of one syntax node. Holds all computed state:
 * names, visibility, the child-name table, annotations and build progress.
 */
public class ElementMeta {

    private final int id;
    private final String kind;
    protected final TypeIndex typeIndex;

    private ModelDocument document;
    private ElementMeta parent;
    private final List<ElementMeta> children = new ArrayList<>();

    private Name name;
    private Name shortName;
    private Visibility declaredVisibility;

    private final Map<String, ElementMeta> namedMembers = new LinkedHashMap<>();
    private final List<MetamodelIssue> issues = new ArrayList<>();
    private ResolutionState buildState = ResolutionState.NONE;

    public ElementMeta(int id, String kind, TypeIndex typeIndex) {
        this.id = id;
        this.kind = kind;
        this.typeIndex = typeIndex;
    }

    public int id() {
        return id;
    }

    public String kind() {
        return kind;
    }

    /**
     * True if this element's kind is {@code kind} or derives from it.
     */
    public boolean is(String kind) {
        return typeIndex.isSubtype(this.kind, kind);
    }

    public boolean isAny(String... kinds) {
        for (String k : kinds) {
            if (is(k)) return true;
        }
        return false;
    }

    public ModelDocument document() {
        return document;
    }

    public void attachTo(ModelDocument document) {
        this.document = document;
    }

    public ElementMeta parent() {
        return parent;
    }

    public List<ElementMeta> children() {
        return Collections.unmodifiableList(children);
    }

    public void addChild(ElementMeta child) {
        child.parent = this;
        children.add(child);
    }

    /**
     * True for structural wrappers that are not nameable scopes.
     */
    public boolean isTransparent() {
        return false;
    }

    /**
     * Nearest ancestor that is not a transparent wrapper.
     */
    public ElementMeta owner() {
        ElementMeta current = parent;
        while (current != null && current.isTransparent()) {
            current = current.parent;
        }
        return current;
    }

    /**
     * The wrapping membership, if this element sits inside one.
     */
    public Optional<MembershipMeta> owningMembership() {
        return parent instanceof MembershipMeta membership && membership.isTransparent()
                ? Optional.of(membership)
                : Optional.empty();
    }

    /**
     * Children with transparent wrappers replaced by the elements they wrap.
     */
    public List<ElementMeta> ownedElements() {
        List<ElementMeta> owned = new ArrayList<>();
        for (ElementMeta child : children) {
            if (child.isTransparent()) {
                owned.addAll(child.ownedElements());
            } else {
                owned.add(child);
            }
        }
        return owned;
    }

    public Optional<NamespaceMeta> owningNamespace() {
        ElementMeta current = owner();
        while (current != null && !(current instanceof NamespaceMeta)) {
            current = current.owner();
        }
        return Optional.ofNullable((NamespaceMeta) current);
    }

    public Name name() {
        return name;
    }

    public Name shortName() {
        return shortName;
    }

    public void setNames(String name, String shortName) {
        this.name = Name.of(name);
        this.shortName = Name.of(shortName);
    }

    /**
     * Sanitized declared name, falling back to the short name.
     */
    public String effectiveName() {
        if (name != null) return name.sanitized();
        if (shortName != null) return shortName.sanitized();
        return null;
    }

    /**
     * Effective name, or the element id for anonymous elements.
     */
    public String displayName() {
        String effective = effectiveName();
        return effective != null ? effective : String.valueOf(id);
    }

    /**
     * Names this element is registered under in its owner's member table.
     */
    public List<String> memberNames() {
        List<String> names = new ArrayList<>(2);
        if (name != null) names.add(name.sanitized());
        if (shortName != null && !names.contains(shortName.sanitized())) names.add(shortName.sanitized());
        return names;
    }

    /**
     * Ancestor names joined with {@code ::}, skipping transparent wrappers and the document root.
     * Recomputed from the live owner chain on every call.
     */
    public String qualifiedName() {
        Deque<String> segments = new ArrayDeque<>();
        ElementMeta current = this;
        while (current != null && current.parent != null) {
            if (!current.isTransparent()) segments.addFirst(current.displayName());
            current = current.parent;
        }
        return String.join(Names.SEPARATOR, segments);
    }

    /**
     * Rename this element, re-keying the owner's member table. A sibling that
     * shares one of the old names takes over that name.
     */
    public void updateName(String name, String shortName) {
        ElementMeta owner = owner();
        if (owner != null) owner.removeNamedMember(this);
        setNames(name, shortName);
        if (owner != null) owner.restoreNamedMembers();
    }

    public Map<String, ElementMeta> namedMembers() {
        return Collections.unmodifiableMap(namedMembers);
    }

    public Optional<ElementMeta> findMember(String name) {
        return Optional.ofNullable(namedMembers.get(name));
    }

    /**
     * Register a child under all of its names. The first registration of a name wins.
     */
    public void addNamedMember(ElementMeta member) {
        for (String memberName : member.memberNames()) {
            namedMembers.putIfAbsent(memberName, member);
        }
    }

    public void addNamedMember(String memberName, ElementMeta member) {
        namedMembers.putIfAbsent(memberName, member);
    }

    public void removeNamedMember(ElementMeta member) {
        namedMembers.values().removeIf(m -> m == member);
    }

    /**
     * Register owned elements again under any names left free, in declaration order.
     */
    public void restoreNamedMembers() {
        for (ElementMeta member : ownedElements()) {
            addNamedMember(member);
        }
    }

    public Visibility declaredVisibility() {
        return declaredVisibility;
    }

    public void setDeclaredVisibility(Visibility visibility) {
        this.declaredVisibility = visibility;
    }

    /**
     * Declared visibility, else the wrapping membership's, else public.
     */
    public Visibility visibility() {
        if (declaredVisibility != null) return declaredVisibility;
        return owningMembership()
                .map(ElementMeta::visibility)
                .orElse(Visibility.PUBLIC);
    }

    public List<AnnotationMeta> comments() {
        return annotations(Kinds.COMMENT).stream()
                .filter(a -> !a.is(Kinds.DOCUMENTATION))
                .toList();
    }

    public List<AnnotationMeta> documentation() {
        return annotations(Kinds.DOCUMENTATION);
    }

    public List<AnnotationMeta> representations() {
        return annotations(Kinds.TEXTUAL_REPRESENTATION);
    }

    /**
     * Metadata features applied directly to this element.
     */
    public List<FeatureMeta> metadata() {
        return ownedElements().stream()
                .filter(e -> e.is(Kinds.METADATA_FEATURE))
                .map(FeatureMeta.class::cast)
                .toList();
    }

    private List<AnnotationMeta> annotations(String kind) {
        return ownedElements().stream()
                .filter(e -> e instanceof AnnotationMeta && e.is(kind))
                .map(AnnotationMeta.class::cast)
                .toList();
    }

    public ResolutionState buildState() {
        return buildState;
    }

    public void setBuildState(ResolutionState buildState) {
        this.buildState = buildState;
    }

    public List<MetamodelIssue> issues() {
        return Collections.unmodifiableList(issues);
    }

    public void addIssue(String message) {
        issues.add(MetamodelIssue.of(this, message));
    }

    /**
     * All element references owned directly by this element.
     */
    public List<ElementReference> references() {
        return List.of();
    }

    /**
     * Drop everything computed during linking. Structure and names derived
     * from the syntax tree are kept.
     */
    public void resetLinks() {
        buildState = ResolutionState.NONE;
        issues.clear();
    }

    @Override
    public String toString() {
        return kind + "[" + displayName() + "#" + id + "]";
    }
}
