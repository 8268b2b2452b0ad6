package com.example.report.docgen.renderer;

import com.example.report.docgen.model.Block;
import com.example.report.docgen.model.TocEntry;
import com.example.report.docgen.style.BlockKind;
import com.example.report.docgen.style.StyleRecord;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTabStop;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTabs;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STTabJc;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STTabTlc;

import java.math.BigInteger;

/**
 * Table-of-contents row: title run, then a tab and the literal page number.
 * A right-aligned dotted tab stop at the text width lines the numbers up.
 */
public class TocEntryRenderer implements BlockRenderer {

    @Override
    public boolean supports(BlockKind kind) {
        return kind == BlockKind.TOC_ENTRY;
    }

    @Override
    public void render(Block block, RenderContext context) {
        TocEntry entry = (TocEntry) block;
        StyleRecord style = context.getStyleEngine().styleFor(BlockKind.TOC_ENTRY, entry.getStyleFlags());

        XWPFParagraph paragraph = context.getDocument().createParagraph();
        DocxFormatting.applyParagraphStyle(paragraph, style);
        addPageNumberTabStop(paragraph, DocxUnits.cmToTwips(context.getGeometry().textWidthCm()));

        XWPFRun titleRun = paragraph.createRun();
        DocxFormatting.applyRunStyle(titleRun, style);
        DocxFormatting.appendText(titleRun, entry.isNested() ? "\t" + entry.getTitle() : entry.getTitle());

        XWPFRun pageRun = paragraph.createRun();
        DocxFormatting.applyRunStyle(pageRun, style);
        DocxFormatting.appendText(pageRun, "\t" + (entry.getPage() != null ? entry.getPage() : ""));
    }

    private void addPageNumberTabStop(XWPFParagraph paragraph, int positionTwips) {
        CTPPr ppr = paragraph.getCTP().isSetPPr() ? paragraph.getCTP().getPPr() : paragraph.getCTP().addNewPPr();
        CTTabs tabs = ppr.isSetTabs() ? ppr.getTabs() : ppr.addNewTabs();
        CTTabStop stop = tabs.addNewTab();
        stop.setVal(STTabJc.RIGHT);
        stop.setLeader(STTabTlc.DOT);
        stop.setPos(BigInteger.valueOf(positionTwips));
    }
}
