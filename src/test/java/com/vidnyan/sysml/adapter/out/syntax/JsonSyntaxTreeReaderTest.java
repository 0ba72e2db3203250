package com.vidnyan.sysml.adapter.out.syntax;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.sysml.application.port.out.SyntaxTreeReader;
import com.vidnyan.sysml.domain.syntax.SyntaxDocument;
import com.vidnyan.sysml.domain.syntax.SyntaxNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class JsonSyntaxTreeReaderTest {

    private static final String VEHICLES = """
            {
              "uri": "model:vehicles",
              "root": {
                "kind": "Namespace",
                "children": [
                  {
                    "kind": "OwningMembership",
                    "children": [
                      {
                        "kind": "Package",
                        "name": "Vehicles",
                        "children": [
                          {
                            "kind": "OwningMembership",
                            "visibility": "private",
                            "children": [
                              { "kind": "PartDefinition", "name": "Engine", "isAbstract": true }
                            ]
                          },
                          {
                            "kind": "OwningMembership",
                            "children": [
                              {
                                "kind": "AttributeUsage",
                                "name": "mass",
                                "children": [
                                  { "kind": "FeatureValue", "children": [ { "kind": "LiteralNumber", "value": 1500 } ] }
                                ]
                              }
                            ]
                          }
                        ]
                      }
                    ]
                  }
                ]
              }
            }
            """;

    @TempDir
    Path tempDir;

    private JsonSyntaxTreeReader reader;

    @BeforeEach
    void setUp() {
        reader = new JsonSyntaxTreeReader(new SyntaxDocumentMapper(new ObjectMapper()));
    }

    @Test
    void read_ShouldMapNodesFlagsAndValues() throws IOException {
        // Arrange
        Path file = Files.writeString(tempDir.resolve("vehicles.json"), VEHICLES);

        // Act
        SyntaxTreeReader.ReadResult result = reader.read(file);

        // Assert
        assertTrue(result.failures().isEmpty());
        assertEquals(1, result.documents().size());
        SyntaxDocument document = result.documents().get(0);
        assertEquals("model:vehicles", document.uri());
        SyntaxNode vehicles = document.root().children().get(0).children().get(0);
        assertEquals("Package", vehicles.kind());
        assertEquals("Vehicles", vehicles.name());
        SyntaxNode engineMembership = vehicles.children().get(0);
        assertEquals("private", engineMembership.visibility());
        SyntaxNode engine = engineMembership.children().get(0);
        assertTrue(engine.flag(SyntaxNode.ABSTRACT));
        assertFalse(engine.flag(SyntaxNode.COMPOSITE));
        SyntaxNode literal = vehicles.children().get(1).children().get(0).children().get(0).children().get(0);
        assertEquals(1500, ((Number) literal.value()).intValue());
    }

    @Test
    void read_ShouldWalkDirectoryAndReportBadDocuments() throws IOException {
        // Arrange
        Path nested = Files.createDirectories(tempDir.resolve("nested"));
        Files.writeString(tempDir.resolve("a.json"), VEHICLES);
        Files.writeString(nested.resolve("b.json"), "{ \"root\": { \"kind\": \"Namespace\" } }");
        Files.writeString(tempDir.resolve("broken.json"), "{ not json");
        Files.writeString(tempDir.resolve("rootless.json"), "{ \"uri\": \"model:empty\" }");
        Files.writeString(tempDir.resolve("notes.txt"), "ignored");

        // Act
        SyntaxTreeReader.ReadResult result = reader.read(tempDir);

        // Assert
        assertEquals(2, result.documents().size());
        assertEquals(2, result.failures().size());
        assertTrue(result.failures().stream().anyMatch(f -> f.location().endsWith("broken.json")));
        assertTrue(result.failures().stream().anyMatch(f -> f.location().endsWith("rootless.json")));
        SyntaxDocument fallback = result.documents().stream()
                .filter(d -> !d.uri().equals("model:vehicles"))
                .findFirst()
                .orElseThrow();
        assertEquals(nested.resolve("b.json").toUri().toString(), fallback.uri());
    }

    @Test
    void read_ShouldReportMissingPath() {
        // Arrange
        Path missing = tempDir.resolve("missing");

        // Act
        SyntaxTreeReader.ReadResult result = reader.read(missing);

        // Assert
        assertTrue(result.documents().isEmpty());
        assertEquals(1, result.failures().size());
        assertEquals(missing.toString(), result.failures().get(0).location());
    }

    @Test
    void read_ShouldRejectNodeWithoutKind() throws IOException {
        // Arrange
        Path file = Files.writeString(tempDir.resolve("kindless.json"),
                "{ \"root\": { \"kind\": \"Namespace\", \"children\": [ { \"name\": \"x\" } ] } }");

        // Act
        SyntaxTreeReader.ReadResult result = reader.read(file);

        // Assert
        assertTrue(result.documents().isEmpty());
        assertTrue(result.failures().get(0).message().contains("without kind"));
    }
}
