package com.vidnyan.sysml.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Textual reference to another element, as parsed, plus its resolution state.
 * Resetting keeps the text and drops everything that was resolved.
 */
public final class ElementReference {

    private final String text;
    private final List<Names.Segment> segments;
    private final List<ElementMeta> found;
    private ElementMeta target;
    private boolean resolving;
    private boolean attempted;

    public ElementReference(String text) {
        this.text = text;
        this.segments = Collections.unmodifiableList(Names.split(text));
        this.found = new ArrayList<>();
    }

    public String text() {
        return text;
    }

    public List<Names.Segment> segments() {
        return segments;
    }

    /**
     * Elements found for each leading segment, even when the full chain failed.
     */
    public List<ElementMeta> found() {
        return Collections.unmodifiableList(found);
    }

    public Optional<ElementMeta> target() {
        return Optional.ofNullable(target);
    }

    public boolean isResolved() {
        return target != null;
    }

    /**
     * True once a resolution attempt finished, successful or not.
     */
    public boolean isAttempted() {
        return attempted;
    }

    public boolean isResolving() {
        return resolving;
    }

    public void beginResolution() {
        resolving = true;
        found.clear();
    }

    public void addFound(ElementMeta element) {
        found.add(element);
    }

    public void completeResolution(ElementMeta resolved) {
        target = resolved;
        resolving = false;
        attempted = true;
    }

    public void reset() {
        target = null;
        found.clear();
        resolving = false;
        attempted = false;
    }

    @Override
    public String toString() {
        return text;
    }
}
