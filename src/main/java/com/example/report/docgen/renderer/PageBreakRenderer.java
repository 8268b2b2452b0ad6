package com.example.report.docgen.renderer;

import com.example.report.docgen.model.Block;
import com.example.report.docgen.style.BlockKind;
import org.apache.poi.xwpf.usermodel.BreakType;

public class PageBreakRenderer implements BlockRenderer {

    @Override
    public boolean supports(BlockKind kind) {
        return kind == BlockKind.PAGE_BREAK;
    }

    @Override
    public void render(Block block, RenderContext context) {
        context.getDocument().createParagraph().createRun().addBreak(BreakType.PAGE);
    }
}
