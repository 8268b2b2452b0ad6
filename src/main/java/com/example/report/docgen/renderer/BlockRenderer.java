package com.example.report.docgen.renderer;

import com.example.report.docgen.model.Block;
import com.example.report.docgen.style.BlockKind;

/**
 * Renders one kind of block into the XWPF document held by the context
 */
public interface BlockRenderer {

    boolean supports(BlockKind kind);

    void render(Block block, RenderContext context);
}
