package com.example.report.docgen.service;

import com.example.report.docgen.exception.DocumentWriteException;
import com.example.report.docgen.exception.MalformedTableShapeException;
import com.example.report.docgen.field.PageNumberFieldInjector;
import com.example.report.docgen.model.Block;
import com.example.report.docgen.model.Heading;
import com.example.report.docgen.model.ListItem;
import com.example.report.docgen.model.PageBreak;
import com.example.report.docgen.model.PageNumbering;
import com.example.report.docgen.model.Paragraph;
import com.example.report.docgen.model.ReferenceEntry;
import com.example.report.docgen.model.ReportDocument;
import com.example.report.docgen.model.SectionGeometry;
import com.example.report.docgen.model.Table;
import com.example.report.docgen.model.TocEntry;
import com.example.report.docgen.renderer.DocxPackageRenderer;
import com.example.report.docgen.style.Alignment;
import com.example.report.docgen.style.StyleConfiguration;
import com.example.report.docgen.style.StyleEngine;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFRun;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Objects;

/**
 * Builds one report document top to bottom and writes it out.
 *
 * Notes:
 * - Blocks are only ever appended; nothing is edited or removed afterwards.
 * - The first {@link #serialize}/{@link #toByteArray} call finalizes the document.
 *   The package bytes are kept, so later calls produce identical output and any
 *   further append fails with {@link IllegalStateException}.
 * - Not thread-safe. Create one composer per document.
 */
@Slf4j
public class DocumentComposer {

    private final StyleEngine styleEngine;
    private final DocxPackageRenderer packageRenderer;
    private final PageNumberFieldInjector fieldInjector;
    private final ReportDocument document = new ReportDocument();
    private final Date created;

    private byte[] packageBytes;

    public DocumentComposer(StyleConfiguration styleConfiguration,
                            DocxPackageRenderer packageRenderer,
                            PageNumberFieldInjector fieldInjector) {
        this.styleEngine = new StyleEngine(styleConfiguration);
        this.packageRenderer = packageRenderer;
        this.fieldInjector = fieldInjector;
        // whole seconds, the package properties do not keep milliseconds
        this.created = new Date(System.currentTimeMillis() / 1000 * 1000);
    }

    public DocumentComposer(StyleConfiguration styleConfiguration) {
        this(styleConfiguration, new PageNumberFieldInjector());
    }

    public DocumentComposer() {
        this(StyleConfiguration.gost());
    }

    private DocumentComposer(StyleConfiguration styleConfiguration, PageNumberFieldInjector fieldInjector) {
        this(styleConfiguration, new DocxPackageRenderer(fieldInjector), fieldInjector);
    }

    /**
     * Set the page geometry of the single section. Last call wins.
     */
    public DocumentComposer configureGeometry(SectionGeometry geometry) {
        document.setGeometry(geometry);
        log.debug("Section geometry set: {}", geometry);
        return this;
    }

    /**
     * Emit a live page number in the footer or header. Null disables page numbers.
     */
    public DocumentComposer configurePageNumbering(PageNumbering numbering) {
        document.setPageNumbering(numbering);
        return this;
    }

    public DocumentComposer appendHeading(int level, String text) {
        return append(Heading.builder().level(level).text(text).build());
    }

    public DocumentComposer appendParagraph(String text, boolean bold, boolean indented) {
        return appendParagraph(text, bold, indented, null);
    }

    public DocumentComposer appendParagraph(String text, boolean bold, boolean indented, Alignment alignment) {
        return append(Paragraph.builder()
                .text(text)
                .bold(bold)
                .indented(indented)
                .alignment(alignment)
                .build());
    }

    /**
     * Empty, unindented paragraph; used for vertical spacing on the title page
     */
    public DocumentComposer appendBlankLine() {
        return appendParagraph("", false, false, Alignment.LEFT);
    }

    public DocumentComposer appendListItem(String text, Integer ordinal) {
        return append(ListItem.builder().text(text).ordinal(ordinal).build());
    }

    public DocumentComposer appendListItem(String text) {
        return appendListItem(text, null);
    }

    public DocumentComposer appendPageBreak() {
        return append(new PageBreak());
    }

    public DocumentComposer appendTocEntry(String title, String page) {
        return append(TocEntry.builder().title(title).page(page).build());
    }

    public DocumentComposer appendReferenceEntry(int number, String text) {
        return append(ReferenceEntry.builder().number(number).text(text).build());
    }

    /**
     * Append a table.
     *
     * @param headerRow column captions, rendered bold
     * @param dataRows rows with exactly {@code headerRow.size()} cells each; null cells render empty
     * @throws MalformedTableShapeException when the header is empty or a row width differs
     */
    public DocumentComposer appendTable(List<String> headerRow, List<List<String>> dataRows) {
        Objects.requireNonNull(headerRow, "headerRow");
        Objects.requireNonNull(dataRows, "dataRows");

        List<List<String>> rows = new ArrayList<>(dataRows.size());
        for (List<String> row : dataRows) {
            rows.add(copyRow(Objects.requireNonNull(row, "data row")));
        }
        return append(Table.builder()
                .headerRow(copyRow(headerRow))
                .dataRows(Collections.unmodifiableList(rows))
                .build());
    }

    /**
     * Validate and append any block. Used directly for blocks coming from a
     * report definition.
     */
    public DocumentComposer append(Block block) {
        Objects.requireNonNull(block, "block");
        validate(block);
        document.append(block);
        log.debug("Appended {} block #{}", block.getKind(), document.size());
        return this;
    }

    /**
     * Attach a live "current page" field to a header or footer run
     */
    public void injectPageNumberField(XWPFRun run) {
        fieldInjector.injectPageNumberField(run);
    }

    /**
     * Render the document and write the package to {@code destination},
     * creating or overwriting the file.
     *
     * @throws DocumentWriteException if the file cannot be written
     */
    public void serialize(Path destination) {
        Objects.requireNonNull(destination, "destination");
        byte[] bytes = toByteArray();
        try {
            Files.write(destination, bytes);
        } catch (IOException e) {
            throw new DocumentWriteException(destination, e);
        }
        log.info("Document written to {} ({} bytes)", destination, bytes.length);
    }

    /**
     * Finalize the document and return the package bytes
     */
    public byte[] toByteArray() {
        if (packageBytes == null) {
            document.markFinalized();
            try {
                packageBytes = packageRenderer.render(document, styleEngine, created);
            } catch (IOException e) {
                throw new DocumentWriteException("Failed to build document package", e);
            }
            log.info("Document finalized: {} blocks, {} bytes", document.size(), packageBytes.length);
        }
        return packageBytes.clone();
    }

    public ReportDocument getDocument() {
        return document;
    }

    public StyleEngine getStyleEngine() {
        return styleEngine;
    }

    // keeps null cells
    private static List<String> copyRow(List<String> row) {
        return Collections.unmodifiableList(new ArrayList<>(row));
    }

    private void validate(Block block) {
        if (block instanceof Heading) {
            Heading heading = (Heading) block;
            Objects.requireNonNull(heading.getText(), "text");
            if (heading.getLevel() != 1 && heading.getLevel() != 2) {
                throw new IllegalArgumentException("Heading level must be 1 or 2: " + heading.getLevel());
            }
        } else if (block instanceof Paragraph) {
            Objects.requireNonNull(((Paragraph) block).getText(), "text");
        } else if (block instanceof ListItem) {
            Objects.requireNonNull(((ListItem) block).getText(), "text");
        } else if (block instanceof ReferenceEntry) {
            Objects.requireNonNull(((ReferenceEntry) block).getText(), "text");
        } else if (block instanceof TocEntry) {
            Objects.requireNonNull(((TocEntry) block).getTitle(), "title");
        } else if (block instanceof Table) {
            validateTableShape((Table) block);
        }
    }

    private void validateTableShape(Table table) {
        if (table.getHeaderRow() == null || table.getHeaderRow().isEmpty()) {
            throw new MalformedTableShapeException("Table header row must have at least one column");
        }
        if (table.getDataRows() == null) {
            throw new MalformedTableShapeException("Table data rows are missing");
        }
        int width = table.getHeaderRow().size();
        for (int i = 0; i < table.getDataRows().size(); i++) {
            List<String> row = table.getDataRows().get(i);
            int actual = row == null ? 0 : row.size();
            if (actual != width) {
                throw new MalformedTableShapeException(width, i, actual);
            }
        }
    }
}
