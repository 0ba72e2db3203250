package com.vidnyan.sysml.domain.syntax;

/**
 * A parsed document: its URI and the root namespace node.
 */
public record SyntaxDocument(
    String uri,
    SyntaxNode root
) {}
