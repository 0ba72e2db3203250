package com.vidnyan.sysml.application.port.out;

import com.vidnyan.sysml.domain.syntax.SyntaxDocument;

import java.nio.file.Path;
import java.util.List;

/**
 * Port for reading parsed syntax trees.
 * Implemented by adapters that read the parser's interchange format.
 */
public interface SyntaxTreeReader {

    /**
     * Read one document file, or every document under a directory.
     * Unreadable documents are reported as failures, never thrown.
     */
    ReadResult read(Path path);

    record ReadResult(
        List<SyntaxDocument> documents,
        List<ReadFailure> failures
    ) {}

    /**
     * A document that could not be read.
     */
    record ReadFailure(
        String location,
        String message
    ) {}
}
