package com.vidnyan.sysml.domain.model;

import com.vidnyan.sysml.domain.metamodel.TypeIndex;

/**
 * Comment, documentation or textual representation attached to its owner.
 */
public class AnnotationMeta extends ElementMeta {

    private String body = "";

    public AnnotationMeta(int id, String kind, TypeIndex typeIndex) {
        super(id, kind, typeIndex);
    }

    public String body() {
        return body;
    }

    public void setBody(String body) {
        this.body = body == null ? "" : body;
    }

    /**
     * The annotated element.
     */
    public ElementMeta annotatedElement() {
        return owner();
    }
}
