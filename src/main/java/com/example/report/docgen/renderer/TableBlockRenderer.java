package com.example.report.docgen.renderer;

import com.example.report.docgen.model.Block;
import com.example.report.docgen.model.Table;
import com.example.report.docgen.style.BlockKind;
import com.example.report.docgen.style.StyleFlags;
import com.example.report.docgen.style.StyleRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;

import java.util.List;

/**
 * Renders a {@link Table} as a fully bordered grid followed by an empty paragraph.
 * Cells hold one plain run; header cells are bold.
 */
@Slf4j
public class TableBlockRenderer implements BlockRenderer {

    private static final int BORDER_SIZE = 4;
    private static final String BORDER_COLOR = "000000";

    @Override
    public boolean supports(BlockKind kind) {
        return kind == BlockKind.TABLE;
    }

    @Override
    public void render(Block block, RenderContext context) {
        Table table = (Table) block;
        int rows = table.getRowCount();
        int cols = table.getColumnCount();

        XWPFTable xwpfTable = context.getDocument().createTable(rows, cols);
        xwpfTable.setWidth("100%");
        applyGridBorders(xwpfTable);

        StyleRecord headerStyle = context.getStyleEngine().styleFor(BlockKind.TABLE_CELL, StyleFlags.builder().bold(true).build());
        StyleRecord cellStyle = context.getStyleEngine().styleFor(BlockKind.TABLE_CELL, StyleFlags.NONE);

        fillRow(xwpfTable, 0, table.getHeaderRow(), headerStyle);
        for (int i = 0; i < table.getDataRows().size(); i++) {
            fillRow(xwpfTable, i + 1, table.getDataRows().get(i), cellStyle);
        }
        log.debug("Rendered table {}x{}", rows, cols);

        context.getDocument().createParagraph();
    }

    private void fillRow(XWPFTable table, int rowIndex, List<String> values, StyleRecord style) {
        for (int col = 0; col < values.size(); col++) {
            XWPFTableCell cell = table.getRow(rowIndex).getCell(col);
            XWPFParagraph paragraph = cell.getParagraphs().get(0);
            DocxFormatting.applyParagraphStyle(paragraph, style);
            XWPFRun run = paragraph.createRun();
            DocxFormatting.applyRunStyle(run, style);
            run.setText(values.get(col) != null ? values.get(col) : "");
        }
    }

    private void applyGridBorders(XWPFTable table) {
        table.setTopBorder(XWPFTable.XWPFBorderType.SINGLE, BORDER_SIZE, 0, BORDER_COLOR);
        table.setBottomBorder(XWPFTable.XWPFBorderType.SINGLE, BORDER_SIZE, 0, BORDER_COLOR);
        table.setLeftBorder(XWPFTable.XWPFBorderType.SINGLE, BORDER_SIZE, 0, BORDER_COLOR);
        table.setRightBorder(XWPFTable.XWPFBorderType.SINGLE, BORDER_SIZE, 0, BORDER_COLOR);
        table.setInsideHBorder(XWPFTable.XWPFBorderType.SINGLE, BORDER_SIZE, 0, BORDER_COLOR);
        table.setInsideVBorder(XWPFTable.XWPFBorderType.SINGLE, BORDER_SIZE, 0, BORDER_COLOR);
    }
}
