package com.vidnyan.sysml.adapter.out.syntax;

import com.vidnyan.sysml.application.port.out.SyntaxTreeReader;
import com.vidnyan.sysml.domain.syntax.SyntaxDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reads syntax documents from {@code .json} files on the file system.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonSyntaxTreeReader implements SyntaxTreeReader {

    private final SyntaxDocumentMapper mapper;

    @Override
    public ReadResult read(Path path) {
        List<SyntaxDocument> documents = new ArrayList<>();
        List<ReadFailure> failures = new ArrayList<>();

        List<Path> files;
        try {
            files = findFiles(path);
        } catch (IOException e) {
            log.warn("Failed to list syntax documents under {}: {}", path, e.getMessage());
            failures.add(new ReadFailure(path.toString(), e.getMessage()));
            return new ReadResult(documents, failures);
        }

        for (Path file : files) {
            try (InputStream input = Files.newInputStream(file)) {
                SyntaxDocument document = mapper.read(input, file.toUri().toString());
                documents.add(document);
                log.debug("Read syntax document {}", document.uri());
            } catch (Exception e) {
                log.warn("Failed to read syntax document {}: {}", file, e.getMessage());
                failures.add(new ReadFailure(file.toString(), e.getMessage()));
            }
        }

        log.info("Read {} syntax documents from {} ({} failed)", documents.size(), path, failures.size());
        return new ReadResult(documents, failures);
    }

    private List<Path> findFiles(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("No such file or directory: " + path);
        }
        if (Files.isRegularFile(path)) return List.of(path);
        try (Stream<Path> walk = Files.walk(path)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .toList();
        }
    }
}
