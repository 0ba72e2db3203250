package com.vidnyan.sysml.adapter.out.library;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.sysml.ModelProperties;
import com.vidnyan.sysml.adapter.out.syntax.SyntaxDocumentMapper;
import com.vidnyan.sysml.domain.syntax.SyntaxDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemLibraryRepositoryTest {

    @TempDir
    Path tempDir;

    private static FileSystemLibraryRepository repository(String libraryPath) {
        ModelProperties properties = new ModelProperties();
        properties.setLibraryPath(libraryPath);
        return new FileSystemLibraryRepository(new SyntaxDocumentMapper(new ObjectMapper()), properties);
    }

    @Test
    void findAll_ShouldLoadBundledStandardLibrary() {
        // Arrange
        FileSystemLibraryRepository repository = repository(ModelProperties.DEFAULT_LIBRARY_PATH);

        // Act
        List<SyntaxDocument> documents = repository.findAll();

        // Assert
        assertEquals(15, documents.size());
        assertTrue(repository.failures().isEmpty());
        assertTrue(documents.stream().anyMatch(d -> d.uri().equals("library:Base")));
        assertTrue(documents.stream().anyMatch(d -> d.uri().equals("library:KerML")));
    }

    @Test
    void findAll_ShouldLoadOnceAndCollectFailures() throws IOException {
        // Arrange
        Files.writeString(tempDir.resolve("Good.json"),
                "{ \"uri\": \"library:Good\", \"root\": { \"kind\": \"Namespace\" } }");
        Files.writeString(tempDir.resolve("Bad.json"), "[]");
        FileSystemLibraryRepository repository = repository("file:" + tempDir.toAbsolutePath() + "/*.json");

        // Act
        List<SyntaxDocument> first = repository.findAll();
        List<SyntaxDocument> second = repository.findAll();

        // Assert
        assertEquals(1, first.size());
        assertEquals("library:Good", first.get(0).uri());
        assertSame(first.get(0), second.get(0));
        assertEquals(1, repository.failures().size());
        assertTrue(repository.failures().get(0).location().endsWith("Bad.json"));
    }
}
