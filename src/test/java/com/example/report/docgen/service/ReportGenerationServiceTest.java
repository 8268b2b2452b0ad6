package com.example.report.docgen.service;

import com.example.report.docgen.config.DocgenProperties;
import com.example.report.docgen.exception.DocgenException;
import com.example.report.docgen.exception.MalformedTableShapeException;
import com.example.report.docgen.exception.ReportDefinitionLoadingException;
import com.example.report.docgen.model.Block;
import com.example.report.docgen.model.Heading;
import com.example.report.docgen.model.PageBreak;
import com.example.report.docgen.model.Paragraph;
import com.example.report.docgen.model.ReferenceEntry;
import com.example.report.docgen.model.ReferencesDefinition;
import com.example.report.docgen.model.ReportDefinition;
import com.example.report.docgen.model.ReportMetadata;
import com.example.report.docgen.model.Table;
import com.example.report.docgen.model.TableOfContentsDefinition;
import com.example.report.docgen.model.TitlePageDefinition;
import com.example.report.docgen.model.TocItem;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;

/**
 * Unit tests for ReportGenerationService
 */
@DisplayName("Report Generation Service Tests")
public class ReportGenerationServiceTest {

    private DocgenProperties properties;
    private ReportGenerationService service;

    @TempDir
    Path tempDir;

    @BeforeEach
    public void setup() {
        properties = new DocgenProperties();
        service = new ReportGenerationService(properties, new TitlePageAssembler(), new TableOfContentsAssembler());
    }

    @Test
    @DisplayName("Parts are composed in order, each after a page break")
    public void testComposeOrder() {
        DocumentComposer composer = service.compose(fullDefinition());
        List<Block> blocks = composer.getDocument().getBlocks();

        int tocHeading = indexOfHeading(blocks, "СОДЕРЖАНИЕ");
        int bodyHeading = indexOfHeading(blocks, "Введение");
        int referencesHeading = indexOfHeading(blocks, "СПИСОК ИСПОЛЬЗОВАННЫХ ИСТОЧНИКОВ");

        assertTrue(tocHeading > 0);
        assertTrue(bodyHeading > tocHeading);
        assertTrue(referencesHeading > bodyHeading);
        assertInstanceOf(PageBreak.class, blocks.get(tocHeading - 1));
        assertInstanceOf(PageBreak.class, blocks.get(bodyHeading - 1));
        assertInstanceOf(PageBreak.class, blocks.get(referencesHeading - 1));
        assertInstanceOf(Paragraph.class, blocks.get(0));
    }

    @Test
    @DisplayName("References are numbered from one")
    public void testReferenceNumbering() {
        List<Block> blocks = service.compose(fullDefinition()).getDocument().getBlocks();

        ReferenceEntry first = (ReferenceEntry) blocks.get(blocks.size() - 2);
        ReferenceEntry second = (ReferenceEntry) blocks.get(blocks.size() - 1);
        assertEquals(1, first.getNumber());
        assertEquals(2, second.getNumber());
        assertEquals("Второй источник", second.getText());
    }

    @Test
    @DisplayName("Body-only definition has no leading page break")
    public void testBodyOnly() {
        ReportDefinition definition = ReportDefinition.builder()
                .body(List.of(Heading.builder().level(1).text("Введение").build()))
                .build();

        List<Block> blocks = service.compose(definition).getDocument().getBlocks();

        assertEquals(1, blocks.size());
        assertInstanceOf(Heading.class, blocks.get(0));
    }

    @Test
    @DisplayName("Assemblers are called title page first, then table of contents")
    public void testAssemblerOrder() {
        TitlePageAssembler titlePageAssembler = mock(TitlePageAssembler.class);
        TableOfContentsAssembler tocAssembler = mock(TableOfContentsAssembler.class);
        ReportGenerationService mocked = new ReportGenerationService(properties, titlePageAssembler, tocAssembler);

        mocked.compose(fullDefinition());

        InOrder order = inOrder(titlePageAssembler, tocAssembler);
        order.verify(titlePageAssembler).assemble(any(DocumentComposer.class), any(ReportMetadata.class), any(TitlePageDefinition.class));
        order.verify(tocAssembler).assemble(any(DocumentComposer.class), any(TableOfContentsDefinition.class));
    }

    @Test
    @DisplayName("Generated package carries the page number footer and GOST geometry")
    public void testGenerateProducesDocx() throws Exception {
        byte[] bytes = service.generate(fullDefinition());

        try (InputStream in = new ByteArrayInputStream(bytes); XWPFDocument doc = new XWPFDocument(in)) {
            assertNotNull(doc.getHeaderFooterPolicy().getDefaultFooter());
            assertTrue(doc.getDocument().getBody().getSectPr().isSetTitlePg());
            assertEquals("11906", String.valueOf(doc.getDocument().getBody().getSectPr().getPgSz().getW()));
        }
    }

    @Test
    @DisplayName("Disabled page numbering leaves the footer out")
    public void testPageNumberingDisabled() throws Exception {
        properties.getPageNumbering().setEnabled(false);

        byte[] bytes = service.generate(fullDefinition());

        try (XWPFDocument doc = new XWPFDocument(new ByteArrayInputStream(bytes))) {
            assertTrue(doc.getFooterList().isEmpty());
        }
    }

    @Test
    @DisplayName("Malformed table propagates with its own code")
    public void testMalformedTablePropagates() {
        ReportDefinition definition = ReportDefinition.builder()
                .body(List.of(Table.builder()
                        .headerRow(List.of("A", "B"))
                        .dataRows(List.of(List.of("1")))
                        .build()))
                .build();

        DocgenException e = assertThrows(DocgenException.class, () -> service.generate(definition));
        assertEquals(MalformedTableShapeException.MALFORMED_TABLE_SHAPE, e.getCode());
    }

    @Test
    @DisplayName("Rejected body blocks are reported as an invalid definition")
    public void testInvalidBodyBlockIsInvalidDefinition() {
        ReportDefinition unsupportedLevel = ReportDefinition.builder()
                .body(List.of(Heading.builder().level(3).text("1.1.1 Пункт").build()))
                .build();
        ReportDefinition missingText = ReportDefinition.builder()
                .body(List.of(Paragraph.builder().build()))
                .build();

        DocgenException e = assertThrows(DocgenException.class, () -> service.generate(unsupportedLevel));
        assertEquals(ReportDefinitionLoadingException.INVALID_DEFINITION, e.getCode());
        assertInstanceOf(IllegalArgumentException.class, e.getCause());

        e = assertThrows(DocgenException.class, () -> service.generate(missingText));
        assertEquals(ReportDefinitionLoadingException.INVALID_DEFINITION, e.getCode());
    }

    @Test
    @DisplayName("Generate to file writes a readable package")
    public void testGenerateToFile() throws Exception {
        Path destination = tempDir.resolve("report.docx");

        Path written = service.generateToFile(fullDefinition(), destination);

        assertEquals(destination, written);
        assertTrue(Files.size(destination) > 0);
        try (XWPFDocument doc = new XWPFDocument(Files.newInputStream(destination))) {
            assertFalse(doc.getParagraphs().isEmpty());
        }
    }

    private int indexOfHeading(List<Block> blocks, String text) {
        for (int i = 0; i < blocks.size(); i++) {
            if (blocks.get(i) instanceof Heading && text.equals(((Heading) blocks.get(i)).getText())) {
                return i;
            }
        }
        return -1;
    }

    private ReportDefinition fullDefinition() {
        return ReportDefinition.builder()
                .metadata(ReportMetadata.builder()
                        .studentName("Иванов И.И.")
                        .group("ИВТ-21")
                        .teacherName("Петров П.П.")
                        .topicTitle("Тема")
                        .year("2025")
                        .build())
                .titlePage(TitlePageDefinition.builder()
                        .institutionLines(List.of("УНИВЕРСИТЕТ"))
                        .workType("КУРСОВОЙ ПРОЕКТ")
                        .city("Москва")
                        .build())
                .tableOfContents(TableOfContentsDefinition.builder()
                        .entries(List.of(new TocItem("ВВЕДЕНИЕ", "3"), new TocItem("1.1 Раздел", "4")))
                        .build())
                .body(List.of(
                        Heading.builder().level(1).text("Введение").build(),
                        Paragraph.builder().text("Текст введения.").build()))
                .references(ReferencesDefinition.builder()
                        .entries(List.of("Первый источник", "Второй источник"))
                        .build())
                .build();
    }
}
