package com.example.report.docgen.service;

import com.example.report.docgen.config.DocgenProperties;
import com.example.report.docgen.exception.DocumentWriteException;
import com.example.report.docgen.model.ReportDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writes the configured report to disk at startup.
 *
 * docgen:
 *   export:
 *     enabled: true
 *     definition: course-project
 *     output-path: /tmp/Пояснительная_записка.docx
 */
@Slf4j
@Component
public class ReportExportRunner {

    private final DocgenProperties properties;
    private final ReportDefinitionLoader definitionLoader;
    private final ReportGenerationService generationService;

    public ReportExportRunner(DocgenProperties properties,
                              ReportDefinitionLoader definitionLoader,
                              ReportGenerationService generationService) {
        this.properties = properties;
        this.definitionLoader = definitionLoader;
        this.generationService = generationService;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void exportOnStartup() {
        DocgenProperties.Export export = properties.getExport();
        if (!export.isEnabled()) {
            log.debug("Report export on startup skipped (disabled)");
            return;
        }
        export();
    }

    public Path export() {
        DocgenProperties.Export export = properties.getExport();
        log.info("Exporting report '{}' to {}", export.getDefinition(), export.getOutputPath());
        Path destination = outputPath(export.getOutputPath());
        ReportDefinition definition = definitionLoader.load(export.getDefinition());
        Path written = generationService.generateToFile(definition, destination);
        log.info("Document saved: {}", written.toAbsolutePath());
        return written;
    }

    private Path outputPath(String outputPath) {
        try {
            return Paths.get(outputPath);
        } catch (InvalidPathException e) {
            // e.g. a Cyrillic name on a host whose file name encoding is not UTF-8
            throw new DocumentWriteException("Invalid output path: " + outputPath, e);
        }
    }
}
