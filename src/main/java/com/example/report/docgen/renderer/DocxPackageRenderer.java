package com.example.report.docgen.renderer;

import com.example.report.docgen.field.PageNumberFieldInjector;
import com.example.report.docgen.model.Block;
import com.example.report.docgen.model.HeaderFooterRegion;
import com.example.report.docgen.model.PageNumbering;
import com.example.report.docgen.model.ReportDocument;
import com.example.report.docgen.model.SectionGeometry;
import com.example.report.docgen.style.BlockKind;
import com.example.report.docgen.style.StyleEngine;
import com.example.report.docgen.style.StyleFlags;
import com.example.report.docgen.style.StyleRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.wp.usermodel.HeaderFooterType;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFHeaderFooter;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPageMar;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPageSz;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTSectPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STPageOrientation;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigInteger;
import java.util.Date;
import java.util.List;
import java.util.Optional;

/**
 * Turns a finished {@link ReportDocument} into WordprocessingML package bytes.
 *
 * Blocks are rendered in order by the first {@link BlockRenderer} that supports
 * their kind. The section geometry and the optional page-number header/footer
 * are written after the body so they land in the document's final {@code w:sectPr}.
 */
@Slf4j
public class DocxPackageRenderer {

    private final List<BlockRenderer> renderers;
    private final PageNumberFieldInjector fieldInjector;

    public DocxPackageRenderer(List<BlockRenderer> renderers, PageNumberFieldInjector fieldInjector) {
        this.renderers = renderers;
        this.fieldInjector = fieldInjector;
    }

    public DocxPackageRenderer(PageNumberFieldInjector fieldInjector) {
        this(defaultRenderers(), fieldInjector);
    }

    public static List<BlockRenderer> defaultRenderers() {
        return List.of(new TextBlockRenderer(), new TocEntryRenderer(), new TableBlockRenderer(), new PageBreakRenderer());
    }

    public byte[] render(ReportDocument document, StyleEngine styleEngine, Date created) throws IOException {
        try (XWPFDocument xwpf = new XWPFDocument();
             ByteArrayOutputStream baos = new ByteArrayOutputStream()) {

            xwpf.getProperties().getCoreProperties().setCreated(Optional.of(created));

            SectionGeometry geometry = document.getGeometry();
            RenderContext context = new RenderContext(xwpf, styleEngine, geometry);
            for (Block block : document.getBlocks()) {
                findRenderer(block.getKind()).render(block, context);
                context.blockRendered();
            }
            log.debug("Rendered {} blocks", context.getRenderedBlocks());

            applyGeometry(xwpf, geometry);
            if (document.getPageNumbering() != null) {
                addPageNumber(xwpf, document.getPageNumbering(), styleEngine);
            }

            xwpf.write(baos);
            return baos.toByteArray();
        }
    }

    private BlockRenderer findRenderer(BlockKind kind) {
        return renderers.stream()
                .filter(r -> r.supports(kind))
                .findFirst()
                .orElseThrow(() -> new UnsupportedOperationException("No renderer found for block kind: " + kind));
    }

    static CTSectPr sectionProperties(XWPFDocument xwpf) {
        return xwpf.getDocument().getBody().isSetSectPr()
                ? xwpf.getDocument().getBody().getSectPr()
                : xwpf.getDocument().getBody().addNewSectPr();
    }

    private void applyGeometry(XWPFDocument xwpf, SectionGeometry geometry) {
        CTSectPr sectPr = sectionProperties(xwpf);

        CTPageSz pageSize = sectPr.isSetPgSz() ? sectPr.getPgSz() : sectPr.addNewPgSz();
        pageSize.setW(DocxUnits.cmToTwipsBig(geometry.getPageWidthCm()));
        pageSize.setH(DocxUnits.cmToTwipsBig(geometry.getPageHeightCm()));
        pageSize.setOrient(geometry.getPageWidthCm() > geometry.getPageHeightCm()
                ? STPageOrientation.LANDSCAPE
                : STPageOrientation.PORTRAIT);

        CTPageMar margins = sectPr.isSetPgMar() ? sectPr.getPgMar() : sectPr.addNewPgMar();
        margins.setTop(DocxUnits.cmToTwipsBig(geometry.getTopMarginCm()));
        margins.setBottom(DocxUnits.cmToTwipsBig(geometry.getBottomMarginCm()));
        margins.setLeft(DocxUnits.cmToTwipsBig(geometry.getLeftMarginCm()));
        margins.setRight(DocxUnits.cmToTwipsBig(geometry.getRightMarginCm()));
        margins.setHeader(DocxUnits.cmToTwipsBig(geometry.getHeaderDistanceCm()));
        margins.setFooter(DocxUnits.cmToTwipsBig(geometry.getFooterDistanceCm()));
        margins.setGutter(BigInteger.ZERO);
    }

    private void addPageNumber(XWPFDocument xwpf, PageNumbering numbering, StyleEngine styleEngine) {
        boolean footer = numbering.getRegion() == HeaderFooterRegion.FOOTER;

        if (numbering.isSuppressOnFirstPage()) {
            CTSectPr sectPr = sectionProperties(xwpf);
            if (!sectPr.isSetTitlePg()) {
                sectPr.addNewTitlePg();
            }
            // empty first-page part keeps the number off the title page
            if (footer) {
                xwpf.createFooter(HeaderFooterType.FIRST);
            } else {
                xwpf.createHeader(HeaderFooterType.FIRST);
            }
        }

        XWPFHeaderFooter part = footer
                ? xwpf.createFooter(HeaderFooterType.DEFAULT)
                : xwpf.createHeader(HeaderFooterType.DEFAULT);

        StyleRecord style = styleEngine.styleFor(BlockKind.PARAGRAPH, StyleFlags.builder()
                .indented(false)
                .alignment(numbering.getAlignment())
                .build());

        XWPFParagraph paragraph = part.getParagraphs().isEmpty() ? part.createParagraph() : part.getParagraphs().get(0);
        paragraph.setAlignment(DocxFormatting.toParagraphAlignment(numbering.getAlignment()));
        XWPFRun run = paragraph.createRun();
        DocxFormatting.applyRunStyle(run, style);
        fieldInjector.injectPageNumberField(run);
        log.debug("Page number field placed in {} ({})", numbering.getRegion(), numbering.getAlignment());
    }
}
