package com.vidnyan.sysml.domain.model;

import java.util.*;

/**
 * Per-document arena of semantic elements, keyed by element id.
 * Discarding the document drops the whole arena at once.
 */
public final class ModelDocument {

    public enum State {
        CREATED,    // metas created, nothing linked
        BUILT,      // build pipeline completed
        DISCARDED   // invalidated, must not be queried
    }

    private final String uri;
    private final boolean library;
    private final Map<Integer, ElementMeta> elements = new LinkedHashMap<>();
    private NamespaceMeta root;
    private State state = State.CREATED;

    public ModelDocument(String uri, boolean library) {
        this.uri = uri;
        this.library = library;
    }

    public String uri() {
        return uri;
    }

    /**
     * Standard library documents are shared and never reset by user edits.
     */
    public boolean isLibrary() {
        return library;
    }

    public NamespaceMeta root() {
        return root;
    }

    public void setRoot(NamespaceMeta root) {
        this.root = root;
    }

    public void register(ElementMeta element) {
        element.attachTo(this);
        elements.put(element.id(), element);
    }

    public Optional<ElementMeta> find(int id) {
        return Optional.ofNullable(elements.get(id));
    }

    /**
     * Elements in creation order, which is syntax-tree pre-order.
     */
    public Collection<ElementMeta> elements() {
        return Collections.unmodifiableCollection(elements.values());
    }

    public int size() {
        return elements.size();
    }

    public State state() {
        return state;
    }

    public void markBuilt() {
        state = State.BUILT;
    }

    /**
     * Clear linking results of every element so the document can be rebuilt.
     */
    public void reset() {
        if (state == State.DISCARDED) {
            throw new IllegalStateException("Document was discarded: " + uri);
        }
        elements.values().forEach(ElementMeta::resetLinks);
        state = State.CREATED;
    }

    /**
     * True if any reference or specialization edge of this document points into {@code other}.
     */
    public boolean dependsOn(ModelDocument other) {
        for (ElementMeta element : elements.values()) {
            for (ElementReference reference : element.references()) {
                if (reference.target().map(t -> t.document() == other).orElse(false)) return true;
            }
            if (element instanceof TypeMeta type) {
                boolean linked = type.specializations(SpecializationKind.NONE).stream()
                        .anyMatch(e -> e.target().document() == other);
                if (linked) return true;
            }
        }
        return false;
    }

    /**
     * True if a finished resolution attempt in this document found no target.
     */
    public boolean hasUnresolvedReferences() {
        for (ElementMeta element : elements.values()) {
            for (ElementReference reference : element.references()) {
                if (reference.isAttempted() && !reference.isResolved()) return true;
            }
        }
        return false;
    }

    public void discard() {
        elements.clear();
        root = null;
        state = State.DISCARDED;
    }
}
