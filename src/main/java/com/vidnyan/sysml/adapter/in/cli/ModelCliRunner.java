package com.vidnyan.sysml.adapter.in.cli;

import com.vidnyan.sysml.application.port.in.BuildModelUseCase;
import com.vidnyan.sysml.application.port.in.BuildModelUseCase.BuildRequest;
import com.vidnyan.sysml.application.port.in.BuildModelUseCase.BuildResult;
import com.vidnyan.sysml.application.port.in.BuildModelUseCase.EvaluatedExpression;
import com.vidnyan.sysml.application.port.in.BuildModelUseCase.UnresolvedReference;
import com.vidnyan.sysml.application.port.out.SyntaxTreeReader.ReadFailure;
import com.vidnyan.sysml.domain.model.MetamodelIssue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * CLI Runner for standalone model builds.
 * Runs a build when the sysml.build.path property is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelCliRunner implements CommandLineRunner {

    private static final int MAX_DETAILS = 100;

    private final BuildModelUseCase buildModelUseCase;
    private final ConfigurableApplicationContext context;

    @Value("${sysml.build.path:}")
    private String sourcePath;

    @Value("${sysml.build.evaluate:true}")
    private boolean evaluate;

    @Override
    public void run(String... args) throws Exception {
        if (sourcePath == null || sourcePath.isBlank()) {
            log.info("No source path specified. Set sysml.build.path property.");
            return;
        }

        int exitCode = 0;
        try {
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║              SysML - Semantic Model Engine                    ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Building: {}", truncatePath(sourcePath, 50));
            log.info("╚══════════════════════════════════════════════════════════════╝");

            BuildResult result = buildModelUseCase.build(new BuildRequest(Path.of(sourcePath), evaluate));
            printResults(result);
            if (!result.failures().isEmpty()) exitCode = 1;

            log.info("");
            log.info("Build complete!");
        } finally {
            int code = exitCode;
            SpringApplication.exit(context, () -> code);
        }
    }

    private void printResults(BuildResult result) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" BUILD RESULTS");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Library documents:   {}", result.stats().libraryDocuments());
        log.info(" Documents built:     {}", result.stats().documentsBuilt());
        log.info(" Elements created:    {}", result.stats().elementsCreated());
        log.info(" Explicit edges:      {}", result.stats().explicitSpecializations());
        log.info(" Implicit edges:      {}", result.stats().implicitSpecializations());
        log.info(" Duration:            {}ms", result.stats().totalDurationMs());
        log.info("───────────────────────────────────────────────────────────────");
        log.info(" Unresolved references: {}", result.unresolvedReferences().size());
        log.info(" Issues:                {}", result.issues().size());
        log.info(" Read failures:         {}", result.failures().size());
        log.info("═══════════════════════════════════════════════════════════════");

        if (result.isClean()) {
            log.info("");
            log.info("✅ All references resolved.");
        } else {
            printDetails(result);
        }

        if (!result.evaluations().isEmpty()) {
            log.info("");
            log.info(" EVALUATED EXPRESSIONS:");
            log.info("───────────────────────────────────────────────────────────────");
            for (EvaluatedExpression evaluation : limit(result.evaluations())) {
                log.info(" {} = {}", evaluation.owner() != null ? evaluation.owner() : evaluation.element(),
                        evaluation.values());
            }
        }
    }

    private void printDetails(BuildResult result) {
        log.info("");
        log.info(" DETAILS:");
        log.info("───────────────────────────────────────────────────────────────");
        for (ReadFailure failure : limit(result.failures())) {
            log.info(" 🔴 FAILED     {}: {}", failure.location(), failure.message());
        }
        for (UnresolvedReference reference : limit(result.unresolvedReferences())) {
            log.info(" 🟠 UNRESOLVED '{}' in {} ({} segments resolved)",
                    reference.reference(), reference.element(), reference.resolvedSegments());
        }
        for (MetamodelIssue issue : limit(result.issues())) {
            log.info(" 🟡 ISSUE      {}: {}", issue.qualifiedName(), issue.message());
        }
    }

    private static <T> List<T> limit(List<T> items) {
        if (items.size() <= MAX_DETAILS) return items;
        log.info(" ... showing {} of {}", MAX_DETAILS, items.size());
        return items.subList(0, MAX_DETAILS);
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
