package com.vidnyan.sysml.domain.model;

/**
 * Progress of a lazily resolved computation. {@code ACTIVE} doubles as the cycle guard.
 */
public enum ResolutionState {
    NONE,
    ACTIVE,
    COMPLETED
}
