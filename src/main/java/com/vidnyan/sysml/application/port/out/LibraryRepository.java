package com.vidnyan.sysml.application.port.out;

import com.vidnyan.sysml.domain.syntax.SyntaxDocument;

import java.util.List;

/**
 * Port for loading the standard library's syntax documents.
 */
public interface LibraryRepository {

    /**
     * All library documents that could be loaded.
     */
    List<SyntaxDocument> findAll();

    /**
     * Library documents that failed to load.
     */
    List<SyntaxTreeReader.ReadFailure> failures();
}
