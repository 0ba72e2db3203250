package com.vidnyan.sysml.domain.model;

/**
 * Origin of a specialization edge.
 */
public enum EdgeSource {
    EXPLICIT,   // declared in the model text
    IMPLICIT    // injected from the standard library
}
