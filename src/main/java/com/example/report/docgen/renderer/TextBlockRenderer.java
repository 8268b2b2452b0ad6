package com.example.report.docgen.renderer;

import com.example.report.docgen.model.Block;
import com.example.report.docgen.model.Heading;
import com.example.report.docgen.model.ListItem;
import com.example.report.docgen.model.Paragraph;
import com.example.report.docgen.model.ReferenceEntry;
import com.example.report.docgen.style.BlockKind;
import com.example.report.docgen.style.StyleRecord;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;

import java.util.EnumSet;
import java.util.Set;

/**
 * Headings, paragraphs, list items and bibliography entries: one paragraph
 * with a single styled run each.
 */
public class TextBlockRenderer implements BlockRenderer {

    private static final Set<BlockKind> KINDS = EnumSet.of(
            BlockKind.HEADING_1, BlockKind.HEADING_2, BlockKind.PARAGRAPH,
            BlockKind.LIST_ITEM, BlockKind.REFERENCE_ENTRY);

    @Override
    public boolean supports(BlockKind kind) {
        return KINDS.contains(kind);
    }

    @Override
    public void render(Block block, RenderContext context) {
        StyleRecord style = context.getStyleEngine().styleFor(block.getKind(), block.getStyleFlags());
        String text = context.getStyleEngine().formatText(block.getKind(), block.getStyleFlags(), textOf(block));

        XWPFParagraph paragraph = context.getDocument().createParagraph();
        DocxFormatting.applyParagraphStyle(paragraph, style);
        XWPFRun run = paragraph.createRun();
        DocxFormatting.applyRunStyle(run, style);
        DocxFormatting.appendText(run, text);
    }

    private String textOf(Block block) {
        if (block instanceof Heading) {
            return ((Heading) block).getText();
        } else if (block instanceof Paragraph) {
            return ((Paragraph) block).getText();
        } else if (block instanceof ListItem) {
            return ((ListItem) block).getText();
        } else if (block instanceof ReferenceEntry) {
            return ((ReferenceEntry) block).getText();
        }
        throw new IllegalArgumentException("Not a text block: " + block);
    }
}
