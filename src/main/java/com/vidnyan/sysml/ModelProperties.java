package com.vidnyan.sysml;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the model engine.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "sysml.model")
public class ModelProperties {

    public static final String DEFAULT_LIBRARY_PATH = "classpath*:library/**/*.json";

    /**
     * Resource pattern of the standard library documents.
     */
    private String libraryPath = DEFAULT_LIBRARY_PATH;

    /**
     * Load the standard library. Without it implicit generalizations are not added.
     */
    private boolean standardLibrary = true;

    /**
     * Log every reference resolution at DEBUG.
     */
    private boolean traceLinking = false;

    @PostConstruct
    public void init() {
        if (libraryPath == null || libraryPath.isBlank()) {
            libraryPath = DEFAULT_LIBRARY_PATH;
        }
    }
}
