package com.example.report.docgen.renderer;

import com.example.report.docgen.style.Alignment;
import com.example.report.docgen.style.StyleRecord;
import org.apache.poi.xwpf.usermodel.LineSpacingRule;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPPr;

import java.math.BigInteger;

/**
 * Writes a {@link StyleRecord} onto XWPF paragraphs and runs
 */
public final class DocxFormatting {

    private DocxFormatting() {
    }

    public static void applyParagraphStyle(XWPFParagraph paragraph, StyleRecord style) {
        paragraph.setAlignment(toParagraphAlignment(style.getAlignment()));
        paragraph.setSpacingBefore(DocxUnits.ptToTwips(style.getSpaceBeforePt()));
        paragraph.setSpacingAfter(DocxUnits.ptToTwips(style.getSpaceAfterPt()));
        paragraph.setSpacingBetween(style.getLineSpacingMultiple(), LineSpacingRule.AUTO);
        // kinds without an indent still get an explicit zero
        paragraph.setIndentationFirstLine(style.hasFirstLineIndent()
                ? DocxUnits.cmToTwips(style.getFirstLineIndentCm())
                : 0);

        if (style.getOutlineLevel() != null) {
            CTPPr ppr = paragraph.getCTP().isSetPPr() ? paragraph.getCTP().getPPr() : paragraph.getCTP().addNewPPr();
            if (ppr.isSetOutlineLvl()) {
                ppr.getOutlineLvl().setVal(BigInteger.valueOf(style.getOutlineLevel()));
            } else {
                ppr.addNewOutlineLvl().setVal(BigInteger.valueOf(style.getOutlineLevel()));
            }
        }
    }

    public static void applyRunStyle(XWPFRun run, StyleRecord style) {
        run.setFontFamily(style.getFontFamily());
        run.setFontFamily(style.getEastAsiaFontFamily(), XWPFRun.FontCharRange.eastAsia);
        run.setFontSize(style.getFontSizePt());
        run.setBold(style.isBold());
    }

    /**
     * Sets run text, turning tab characters into {@code <w:tab/>} elements
     */
    public static void appendText(XWPFRun run, String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        String[] parts = text.split("\t", -1);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                run.addTab();
            }
            if (!parts[i].isEmpty()) {
                run.setText(parts[i], run.getCTR().sizeOfTArray());
            }
        }
    }

    public static ParagraphAlignment toParagraphAlignment(Alignment alignment) {
        if (alignment == null) {
            return ParagraphAlignment.LEFT;
        }
        switch (alignment) {
            case CENTER:
                return ParagraphAlignment.CENTER;
            case JUSTIFY:
                return ParagraphAlignment.BOTH;
            case LEFT:
            default:
                return ParagraphAlignment.LEFT;
        }
    }
}
