package com.example.report.docgen.service;

import com.example.report.docgen.exception.DocumentWriteException;
import com.example.report.docgen.exception.MalformedTableShapeException;
import com.example.report.docgen.model.Paragraph;
import com.example.report.docgen.model.SectionGeometry;
import com.example.report.docgen.renderer.DocxUnits;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DocumentComposer
 * Builds small documents, serializes them and reads them back with POI
 */
@DisplayName("Document Composer Tests")
public class DocumentComposerTest {

    private DocumentComposer composer;

    @TempDir
    Path tempDir;

    @BeforeEach
    public void setup() {
        composer = new DocumentComposer();
    }

    @Test
    @DisplayName("Chapter heading is centered, bold, upper-cased; body paragraph is justified and indented")
    public void testHeadingAndParagraphScenario() throws Exception {
        composer.appendHeading(1, "введение");
        composer.appendParagraph("text", false, true);

        try (XWPFDocument doc = reopen(composer.toByteArray())) {
            List<XWPFParagraph> paragraphs = doc.getParagraphs();
            assertEquals(2, paragraphs.size());

            XWPFParagraph heading = paragraphs.get(0);
            assertEquals(ParagraphAlignment.CENTER, heading.getAlignment());
            assertEquals("ВВЕДЕНИЕ", heading.getText());
            assertTrue(heading.getRuns().get(0).isBold());
            assertEquals(14.0, heading.getRuns().get(0).getFontSizeAsDouble(), 0.001);
            assertEquals("Times New Roman", heading.getRuns().get(0).getFontFamily());
            assertEquals(1.5, heading.getSpacingBetween(), 0.001);
            assertEquals(DocxUnits.ptToTwips(12), heading.getSpacingAfter());
            assertEquals(0, heading.getIndentationFirstLine());

            XWPFParagraph body = paragraphs.get(1);
            assertEquals(ParagraphAlignment.BOTH, body.getAlignment());
            assertEquals("text", body.getText());
            assertFalse(body.getRuns().get(0).isBold());
            assertEquals(DocxUnits.cmToTwips(1.25), body.getIndentationFirstLine());
        }
    }

    @Test
    @DisplayName("2x2 table renders 3 rows and 2 columns with a bold header")
    public void testTableScenario() throws Exception {
        composer.appendTable(List.of("A", "B"), List.of(List.of("1", "2"), List.of("3", "4")));

        try (XWPFDocument doc = reopen(composer.toByteArray())) {
            assertEquals(1, doc.getTables().size());
            XWPFTable table = doc.getTables().get(0);
            assertEquals(3, table.getNumberOfRows());
            for (int row = 0; row < 3; row++) {
                assertEquals(2, table.getRow(row).getTableCells().size());
            }

            XWPFTableCell header = table.getRow(0).getCell(0);
            assertEquals("A", header.getText());
            assertTrue(header.getParagraphs().get(0).getRuns().get(0).isBold());

            XWPFTableCell last = table.getRow(2).getCell(1);
            assertEquals("4", last.getText());
            assertFalse(last.getParagraphs().get(0).getRuns().get(0).isBold());
        }
    }

    @Test
    public void testTableWithManyRowsKeepsShape() throws Exception {
        List<String> header = List.of("Реализация", "ns/op", "B/op", "allocs/op");
        List<List<String>> rows = List.of(
                List.of("MapCache", "220", "32", "1"),
                List.of("FilesystemCache", "8000", "512", "5"),
                List.of("SQLiteCache", "78000", "1024", "12"));

        composer.appendTable(header, rows);

        try (XWPFDocument doc = reopen(composer.toByteArray())) {
            XWPFTable table = doc.getTables().get(0);
            assertEquals(1 + rows.size(), table.getNumberOfRows());
            assertEquals(4, table.getRow(3).getTableCells().size());
            assertEquals("SQLiteCache", table.getRow(3).getCell(0).getText());
        }
    }

    @Test
    @DisplayName("Null table cells are kept and render as empty cells")
    public void testNullTableCellsRenderEmpty() throws Exception {
        composer.appendTable(Arrays.asList("A", null), List.of(Arrays.asList(null, "2")));

        try (XWPFDocument doc = reopen(composer.toByteArray())) {
            XWPFTable table = doc.getTables().get(0);
            assertEquals("A", table.getRow(0).getCell(0).getText());
            assertEquals("", table.getRow(0).getCell(1).getText());
            assertEquals("", table.getRow(1).getCell(0).getText());
            assertEquals("2", table.getRow(1).getCell(1).getText());
        }
    }

    @Test
    @DisplayName("Serializing twice to different paths yields byte-identical files")
    public void testRepeatedSerializationIsByteIdentical() throws Exception {
        composer.appendHeading(1, "Заключение");
        composer.appendListItem("пункт", 1);
        composer.appendTable(List.of("A"), List.of(List.of("1")));

        Path first = tempDir.resolve("first.docx");
        Path second = tempDir.resolve("second.docx");
        composer.serialize(first);
        Thread.sleep(1100);
        composer.serialize(second);

        assertArrayEquals(Files.readAllBytes(first), Files.readAllBytes(second));
    }

    @Test
    @DisplayName("Row narrower than the header raises MalformedTableShapeException")
    public void testMalformedTableShapeIsRejected() {
        MalformedTableShapeException e = assertThrows(MalformedTableShapeException.class, () ->
                composer.appendTable(List.of("a", "b", "c", "d"), List.of(List.of("1", "2", "3"))));

        assertEquals(MalformedTableShapeException.MALFORMED_TABLE_SHAPE, e.getCode());
        assertEquals(4, e.getExpectedColumns());
        assertEquals(3, e.getActualColumns());
        assertEquals(0, composer.getDocument().size());
    }

    @Test
    public void testEmptyHeaderIsRejected() {
        assertThrows(MalformedTableShapeException.class, () -> composer.appendTable(List.of(), List.of()));
    }

    @Test
    public void testListItemPrefixesAreRendered() throws Exception {
        composer.appendListItem("третий", 3);
        composer.appendListItem("без номера");

        try (XWPFDocument doc = reopen(composer.toByteArray())) {
            assertEquals("3) третий", doc.getParagraphs().get(0).getText());
            assertEquals("– без номера", doc.getParagraphs().get(1).getText());
            assertEquals(DocxUnits.cmToTwips(1.25), doc.getParagraphs().get(1).getIndentationFirstLine());
        }
    }

    @Test
    public void testEmptyTextProducesEmptyStyledParagraph() throws Exception {
        composer.appendParagraph("", false, true);

        try (XWPFDocument doc = reopen(composer.toByteArray())) {
            XWPFParagraph paragraph = doc.getParagraphs().get(0);
            assertEquals("", paragraph.getText());
            assertEquals(ParagraphAlignment.BOTH, paragraph.getAlignment());
        }
    }

    @Test
    public void testNullTextIsRejected() {
        assertThrows(NullPointerException.class, () -> composer.appendParagraph(null, false, true));
        assertThrows(NullPointerException.class, () -> composer.appendHeading(1, null));
    }

    @Test
    public void testUnsupportedHeadingLevelIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> composer.appendHeading(3, "x"));
    }

    @Test
    public void testAppendsAreNotIdempotent() {
        composer.appendPageBreak();
        composer.appendPageBreak();
        composer.append(Paragraph.builder().text("x").build());
        composer.append(Paragraph.builder().text("x").build());

        assertEquals(4, composer.getDocument().size());
    }

    @Test
    public void testPageBreakIsRendered() throws Exception {
        composer.appendParagraph("до", false, true);
        composer.appendPageBreak();
        composer.appendParagraph("после", false, true);

        try (XWPFDocument doc = reopen(composer.toByteArray())) {
            assertEquals(3, doc.getParagraphs().size());
            assertEquals(1, doc.getParagraphs().get(1).getRuns().get(0).getCTR().sizeOfBrArray());
        }
    }

    @Test
    @DisplayName("Document is read-only once serialized")
    public void testAppendAfterSerializationFails() {
        composer.appendParagraph("x", false, true);
        composer.toByteArray();

        assertTrue(composer.getDocument().isFinalized());
        assertThrows(IllegalStateException.class, () -> composer.appendParagraph("y", false, true));
        assertThrows(IllegalStateException.class, () -> composer.configureGeometry(SectionGeometry.gost()));
    }

    @Test
    public void testGeometryIsLastWriteWins() {
        composer.configureGeometry(SectionGeometry.builder().leftMarginCm(2.5).build());
        composer.configureGeometry(SectionGeometry.builder().leftMarginCm(3.5).build());

        assertEquals(3.5, composer.getDocument().getGeometry().getLeftMarginCm());
    }

    @Test
    @DisplayName("Unwritable destination raises DocumentWriteException")
    public void testUnwritableDestinationFails() {
        composer.appendParagraph("x", false, true);
        Path destination = tempDir.resolve("missing-dir").resolve("report.docx");

        DocumentWriteException e = assertThrows(DocumentWriteException.class, () -> composer.serialize(destination));
        assertEquals(DocumentWriteException.IO_FAILURE, e.getCode());
        assertEquals(destination, e.getDestination());
    }

    private XWPFDocument reopen(byte[] bytes) throws Exception {
        return new XWPFDocument(new ByteArrayInputStream(bytes));
    }
}
