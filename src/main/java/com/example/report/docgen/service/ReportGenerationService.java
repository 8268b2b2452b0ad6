package com.example.report.docgen.service;

import com.example.report.docgen.aspect.LogExecutionTime;
import com.example.report.docgen.config.DocgenProperties;
import com.example.report.docgen.exception.DocgenException;
import com.example.report.docgen.exception.ReportDefinitionLoadingException;
import com.example.report.docgen.model.Block;
import com.example.report.docgen.model.ReferencesDefinition;
import com.example.report.docgen.model.ReportDefinition;
import com.example.report.docgen.model.ReportMetadata;
import com.example.report.docgen.model.TitlePageDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Main orchestrator for report generation.
 * Feeds a {@link ReportDefinition} through a fresh {@link DocumentComposer} in
 * GOST order: title page, table of contents, body, bibliography, each part
 * starting on a new page.
 *
 * Notes:
 * - Stateless; a new composer is created per call, so concurrent requests do
 *   not share document state.
 * - Definition parts other than the body are optional and skipped when absent.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportGenerationService {

    private final DocgenProperties properties;
    private final TitlePageAssembler titlePageAssembler;
    private final TableOfContentsAssembler tableOfContentsAssembler;

    /**
     * Generate the report and return the .docx package bytes
     */
    @LogExecutionTime("Report Generation")
    public byte[] generate(ReportDefinition definition) {
        try {
            return compose(definition).toByteArray();
        } catch (DocgenException e) {
            log.error("Report generation failed: {}", e.getCode(), e);
            throw e;
        } catch (RuntimeException e) {
            log.error("Report generation failed", e);
            throw new DocgenException(DocgenException.GENERATION_FAILED, "Failed to generate report", e);
        }
    }

    /**
     * Generate the report and write it to {@code destination}
     */
    @LogExecutionTime("Report Export")
    public Path generateToFile(ReportDefinition definition, Path destination) {
        try {
            compose(definition).serialize(destination);
            return destination;
        } catch (DocgenException e) {
            log.error("Report export to {} failed: {}", destination, e.getCode(), e);
            throw e;
        } catch (RuntimeException e) {
            log.error("Report export to {} failed", destination, e);
            throw new DocgenException(DocgenException.GENERATION_FAILED, "Failed to generate report", e);
        }
    }

    /**
     * Build an unserialized composer for the definition. Exposed so callers can
     * append extra content before writing.
     */
    public DocumentComposer compose(ReportDefinition definition) {
        DocumentComposer composer = newComposer();
        ReportMetadata metadata = definition.getMetadata() != null ? definition.getMetadata() : new ReportMetadata();
        boolean needsBreak = false;

        TitlePageDefinition titlePage = definition.getTitlePage();
        if (titlePage != null) {
            log.info("Composing title page");
            titlePageAssembler.assemble(composer, metadata, titlePage);
            needsBreak = true;
        }

        if (definition.getTableOfContents() != null) {
            needsBreak = breakIfNeeded(composer, needsBreak);
            log.info("Composing table of contents");
            tableOfContentsAssembler.assemble(composer, definition.getTableOfContents());
            needsBreak = true;
        }

        List<Block> body = definition.getBody();
        if (body != null && !body.isEmpty()) {
            needsBreak = breakIfNeeded(composer, needsBreak);
            log.info("Composing body: {} blocks", body.size());
            for (int i = 0; i < body.size(); i++) {
                appendBodyBlock(composer, body.get(i), i);
            }
            needsBreak = true;
        }

        ReferencesDefinition references = definition.getReferences();
        if (references != null) {
            breakIfNeeded(composer, needsBreak);
            log.info("Composing bibliography: {} sources", references.getEntries().size());
            composer.appendHeading(1, references.getTitle());
            int number = 1;
            for (String entry : references.getEntries()) {
                composer.appendReferenceEntry(number++, entry);
            }
        }
        return composer;
    }

    public DocumentComposer newComposer() {
        return new DocumentComposer(properties.getStyle())
                .configureGeometry(properties.getGeometry())
                .configurePageNumbering(properties.getPageNumbering().resolve());
    }

    /**
     * Blocks the composer rejects (null text, unsupported heading level) are
     * reported as an invalid definition rather than a generation failure.
     */
    private void appendBodyBlock(DocumentComposer composer, Block block, int index) {
        try {
            composer.append(block);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ReportDefinitionLoadingException(ReportDefinitionLoadingException.INVALID_DEFINITION,
                    "Invalid body block #" + index + ": " + e.getMessage(), e);
        }
    }

    private boolean breakIfNeeded(DocumentComposer composer, boolean needsBreak) {
        if (needsBreak) {
            composer.appendPageBreak();
        }
        return false;
    }
}
