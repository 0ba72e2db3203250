package com.vidnyan.sysml.domain.model;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * All documents known to the engine: the shared standard library and the user documents.
 * Library documents are built once and never reset by user edits.
 */
public class ModelWorkspace {

    private final Map<String, ModelDocument> documents = new LinkedHashMap<>();
    private final Map<String, ElementMeta> libraryCache = new ConcurrentHashMap<>();

    /**
     * Register a document. Built user documents with unresolved references may
     * resolve against it, so they are reset together with their dependents.
     * @return the documents that were reset and need a rebuild
     */
    public List<ModelDocument> add(ModelDocument document) {
        documents.put(document.uri(), document);
        if (document.isLibrary()) libraryCache.clear();

        List<ModelDocument> stale = new ArrayList<>();
        for (ModelDocument other : userDocuments()) {
            if (other != document && other.state() == ModelDocument.State.BUILT && other.hasUnresolvedReferences()) {
                stale.add(other);
            }
        }
        List<ModelDocument> affected = new ArrayList<>(stale);
        for (ModelDocument other : userDocuments()) {
            if (other == document || affected.contains(other) || other.state() != ModelDocument.State.BUILT) continue;
            if (stale.stream().anyMatch(other::dependsOn)) affected.add(other);
        }
        affected.forEach(ModelDocument::reset);
        return affected;
    }

    public Optional<ModelDocument> get(String uri) {
        return Optional.ofNullable(documents.get(uri));
    }

    public Collection<ModelDocument> documents() {
        return Collections.unmodifiableCollection(documents.values());
    }

    public List<ModelDocument> libraryDocuments() {
        return documents.values().stream()
                .filter(ModelDocument::isLibrary)
                .toList();
    }

    public List<ModelDocument> userDocuments() {
        return documents.values().stream()
                .filter(d -> !d.isLibrary())
                .toList();
    }

    /**
     * Roots of all live documents, library documents first.
     */
    public List<NamespaceMeta> roots() {
        List<NamespaceMeta> roots = new ArrayList<>();
        for (ModelDocument document : libraryDocuments()) {
            if (document.root() != null) roots.add(document.root());
        }
        for (ModelDocument document : userDocuments()) {
            if (document.root() != null) roots.add(document.root());
        }
        return roots;
    }

    public boolean hasLibrary() {
        return documents.values().stream().anyMatch(ModelDocument::isLibrary);
    }

    /**
     * Look up a library element by sanitized qualified name, e.g. {@code Base::Anything}.
     * Only successful lookups are cached.
     */
    public Optional<ElementMeta> findLibraryElement(String qualifiedName) {
        ElementMeta cached = libraryCache.get(qualifiedName);
        if (cached != null) return Optional.of(cached);

        List<Names.Segment> segments = Names.split(qualifiedName);
        for (ModelDocument document : libraryDocuments()) {
            ElementMeta current = document.root();
            for (Names.Segment segment : segments) {
                if (current == null) break;
                current = dealias(current.findMember(segment.name()).orElse(null));
            }
            if (current != null) {
                libraryCache.put(qualifiedName, current);
                return Optional.of(current);
            }
        }
        return Optional.empty();
    }

    private static ElementMeta dealias(ElementMeta element) {
        if (element instanceof MembershipMeta membership && membership.isAlias()) {
            return membership.element().orElse(null);
        }
        return element;
    }

    /**
     * Discard a user document and reset every other user document that linked into it.
     * @return the documents that were reset and need a rebuild
     */
    public List<ModelDocument> invalidate(String uri) {
        ModelDocument removed = documents.get(uri);
        if (removed == null) return List.of();
        if (removed.isLibrary()) {
            throw new IllegalStateException("Library documents cannot be invalidated: " + uri);
        }

        List<ModelDocument> dependents = new ArrayList<>();
        for (ModelDocument document : userDocuments()) {
            if (document != removed && document.dependsOn(removed)) dependents.add(document);
        }
        documents.remove(uri);
        removed.discard();
        dependents.forEach(ModelDocument::reset);
        return dependents;
    }

    /**
     * Reset a document in place so it can be rebuilt, together with its dependents.
     */
    public List<ModelDocument> reset(String uri) {
        ModelDocument document = documents.get(uri);
        if (document == null) return List.of();
        if (document.isLibrary()) {
            throw new IllegalStateException("Library documents cannot be reset: " + uri);
        }

        List<ModelDocument> affected = new ArrayList<>();
        affected.add(document);
        for (ModelDocument other : userDocuments()) {
            if (other != document && other.dependsOn(document)) affected.add(other);
        }
        affected.forEach(ModelDocument::reset);
        return affected;
    }
}
