package com.example.report.docgen.renderer;

import com.example.report.docgen.model.SectionGeometry;
import com.example.report.docgen.style.StyleEngine;
import lombok.Getter;
import org.apache.poi.xwpf.usermodel.XWPFDocument;

/**
 * State shared by the block renderers while one package is being built
 */
@Getter
public class RenderContext {
    private final XWPFDocument document;
    private final StyleEngine styleEngine;
    private final SectionGeometry geometry;
    private int renderedBlocks;

    public RenderContext(XWPFDocument document, StyleEngine styleEngine, SectionGeometry geometry) {
        this.document = document;
        this.styleEngine = styleEngine;
        this.geometry = geometry;
    }

    void blockRendered() {
        renderedBlocks++;
    }
}
