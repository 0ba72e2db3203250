package com.vidnyan.sysml.adapter.out.library;

import com.vidnyan.sysml.ModelProperties;
import com.vidnyan.sysml.adapter.out.syntax.SyntaxDocumentMapper;
import com.vidnyan.sysml.application.port.out.LibraryRepository;
import com.vidnyan.sysml.application.port.out.SyntaxTreeReader.ReadFailure;
import com.vidnyan.sysml.domain.syntax.SyntaxDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Standard library repository.
 * Loads library syntax documents matching the configured resource pattern, once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileSystemLibraryRepository implements LibraryRepository {

    private final SyntaxDocumentMapper mapper;
    private final ModelProperties properties;

    private List<SyntaxDocument> documents;
    private final List<ReadFailure> failures = new ArrayList<>();

    @Override
    public synchronized List<SyntaxDocument> findAll() {
        if (documents == null) {
            documents = load();
        }
        return documents;
    }

    @Override
    public synchronized List<ReadFailure> failures() {
        return List.copyOf(failures);
    }

    private List<SyntaxDocument> load() {
        List<SyntaxDocument> loaded = new ArrayList<>();
        String libraryPath = properties.getLibraryPath();
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources(libraryPath);

            for (Resource resource : resources) {
                String location = describe(resource);
                try (InputStream input = resource.getInputStream()) {
                    SyntaxDocument document = mapper.read(input, location);
                    loaded.add(document);
                    log.info("Loaded library document: {}", document.uri());
                } catch (Exception e) {
                    log.warn("Failed to load library document from {}: {}", resource.getFilename(), e.getMessage());
                    failures.add(new ReadFailure(location, e.getMessage()));
                }
            }

            log.info("Loaded {} library documents from {}", loaded.size(), libraryPath);
        } catch (IOException e) {
            log.error("Failed to load library documents from {}", libraryPath, e);
            failures.add(new ReadFailure(libraryPath, e.getMessage()));
        }
        return List.copyOf(loaded);
    }

    private static String describe(Resource resource) {
        try {
            return resource.getURI().toString();
        } catch (IOException e) {
            return resource.getDescription();
        }
    }
}
