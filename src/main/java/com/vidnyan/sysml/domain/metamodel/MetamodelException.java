package com.vidnyan.sysml.domain.metamodel;

/**
 * Raised when the static metamodel description is inconsistent.
 * These are configuration errors and are not recovered from.
 */
public class MetamodelException extends RuntimeException {

    public MetamodelException(String message) {
        super(message);
    }
}
