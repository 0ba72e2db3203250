package com.vidnyan.sysml.adapter.out.syntax;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.sysml.domain.syntax.SyntaxDocument;
import com.vidnyan.sysml.domain.syntax.SyntaxNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * Maps the JSON interchange format of syntax trees to domain syntax nodes.
 */
@Component
@RequiredArgsConstructor
public class SyntaxDocumentMapper {

    private final ObjectMapper objectMapper;

    /**
     * Read one document. {@code fallbackUri} is used when the document declares no URI.
     * @throws IOException if the stream is not a valid document
     */
    public SyntaxDocument read(InputStream input, String fallbackUri) throws IOException {
        DocumentDto dto = objectMapper.readValue(input, DocumentDto.class);
        return toDocument(dto, fallbackUri);
    }

    public SyntaxDocument toDocument(DocumentDto dto, String fallbackUri) {
        if (dto == null || dto.root == null) {
            throw new IllegalArgumentException("Document has no root node: " + fallbackUri);
        }
        String uri = dto.uri != null && !dto.uri.isBlank() ? dto.uri : fallbackUri;
        return new SyntaxDocument(uri, toNode(dto.root));
    }

    private SyntaxNode toNode(NodeDto dto) {
        if (dto.kind == null || dto.kind.isBlank()) {
            throw new IllegalArgumentException("Syntax node without kind" + (dto.name != null ? ": " + dto.name : ""));
        }
        List<SyntaxNode> children = new ArrayList<>();
        if (dto.children != null) {
            for (NodeDto child : dto.children) {
                if (child != null) children.add(toNode(child));
            }
        }
        return new SyntaxNode(
                dto.kind,
                dto.name,
                dto.shortName,
                dto.visibility,
                dto.reference,
                dto.operator,
                dto.value,
                dto.direction,
                dto.body,
                mapFlags(dto),
                children
        );
    }

    private Set<String> mapFlags(NodeDto dto) {
        Set<String> flags = new LinkedHashSet<>();
        if (Boolean.TRUE.equals(dto.isAbstract)) flags.add(SyntaxNode.ABSTRACT);
        if (Boolean.TRUE.equals(dto.isComposite)) flags.add(SyntaxNode.COMPOSITE);
        if (Boolean.TRUE.equals(dto.isPortion)) flags.add(SyntaxNode.PORTION);
        if (Boolean.TRUE.equals(dto.isReadonly)) flags.add(SyntaxNode.READONLY);
        if (Boolean.TRUE.equals(dto.isDerived)) flags.add(SyntaxNode.DERIVED);
        if (Boolean.TRUE.equals(dto.isEnd)) flags.add(SyntaxNode.END);
        if (Boolean.TRUE.equals(dto.isOrdered)) flags.add(SyntaxNode.ORDERED);
        if (Boolean.TRUE.equals(dto.isNonunique)) flags.add(SyntaxNode.NONUNIQUE);
        if (Boolean.TRUE.equals(dto.isNegated)) flags.add(SyntaxNode.NEGATED);
        if (Boolean.TRUE.equals(dto.isInteger)) flags.add(SyntaxNode.INTEGER);
        if (Boolean.TRUE.equals(dto.isImplied)) flags.add(SyntaxNode.IMPLIED);
        return flags;
    }

    // DTO classes for JSON deserialization
    public static class DocumentDto {
        public String uri;
        public NodeDto root;
    }

    public static class NodeDto {
        public String kind;
        public String name;
        public String shortName;
        public String visibility;
        public String reference;
        public String operator;
        public Object value;
        public String direction;
        public String body;
        public Boolean isAbstract;
        public Boolean isComposite;
        public Boolean isPortion;
        public Boolean isReadonly;
        public Boolean isDerived;
        public Boolean isEnd;
        public Boolean isOrdered;
        public Boolean isNonunique;
        public Boolean isNegated;
        public Boolean isInteger;
        public Boolean isImplied;
        public List<NodeDto> children;
    }
}
