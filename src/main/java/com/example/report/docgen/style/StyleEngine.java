package com.example.report.docgen.style;

import java.util.Locale;
import java.util.Objects;

/**
 * Maps a block kind plus flags to the concrete formatting of that block.
 *
 * <p>Both {@link #styleFor} and {@link #formatText} are pure: the engine keeps a
 * private snapshot of its configuration, so the same arguments always yield an
 * equal result for the lifetime of the engine.
 */
public class StyleEngine {

    private final StyleConfiguration config;

    public StyleEngine(StyleConfiguration config) {
        Objects.requireNonNull(config, "config");
        this.config = config.toBuilder().build();
    }

    public StyleEngine() {
        this(StyleConfiguration.gost());
    }

    public StyleRecord styleFor(BlockKind kind, StyleFlags flags) {
        StyleFlags f = flags != null ? flags : StyleFlags.NONE;
        StyleRecord.StyleRecordBuilder style = base();

        switch (kind) {
            case HEADING_1:
                return style.alignment(Alignment.CENTER)
                        .bold(true)
                        .spaceAfterPt(config.getHeading1SpaceAfterPt())
                        .outlineLevel(0)
                        .build();
            case HEADING_2:
                return style.alignment(Alignment.JUSTIFY)
                        .bold(true)
                        .spaceBeforePt(config.getHeading2SpaceBeforePt())
                        .spaceAfterPt(config.getHeading2SpaceAfterPt())
                        .firstLineIndentCm(config.getFirstLineIndentCm())
                        .outlineLevel(1)
                        .build();
            case PARAGRAPH:
                return style.alignment(f.getAlignment() != null ? f.getAlignment() : Alignment.JUSTIFY)
                        .bold(f.isBold())
                        .firstLineIndentCm(f.isIndented() ? config.getFirstLineIndentCm() : 0.0)
                        .build();
            case LIST_ITEM:
                return style.alignment(Alignment.JUSTIFY)
                        .firstLineIndentCm(config.getFirstLineIndentCm())
                        .build();
            case TOC_ENTRY:
            case REFERENCE_ENTRY:
                return style.alignment(Alignment.JUSTIFY)
                        .firstLineIndentCm(0.0)
                        .build();
            case TABLE_CELL:
                return style.alignment(Alignment.LEFT)
                        .bold(f.isBold())
                        .lineSpacingMultiple(config.getTableLineSpacingMultiple())
                        .firstLineIndentCm(0.0)
                        .build();
            case TABLE:
            case PAGE_BREAK:
            default:
                return style.alignment(Alignment.LEFT).build();
        }
    }

    /**
     * Applies the text rules of a kind: upper-casing for chapter headings,
     * list and reference numbering prefixes. Other kinds pass the text through.
     */
    public String formatText(BlockKind kind, StyleFlags flags, String text) {
        Objects.requireNonNull(text, "text");
        StyleFlags f = flags != null ? flags : StyleFlags.NONE;

        switch (kind) {
            case HEADING_1:
                return text.toUpperCase(Locale.ROOT);
            case LIST_ITEM:
                return f.getOrdinal() != null
                        ? f.getOrdinal() + config.getOrdinalSuffix() + text
                        : config.getBulletPrefix() + text;
            case REFERENCE_ENTRY:
                return f.getOrdinal() != null
                        ? f.getOrdinal() + config.getReferenceNumberSuffix() + text
                        : text;
            default:
                return text;
        }
    }

    public StyleConfiguration getConfiguration() {
        return config.toBuilder().build();
    }

    private StyleRecord.StyleRecordBuilder base() {
        return StyleRecord.builder()
                .fontFamily(config.getFontFamily())
                .eastAsiaFontFamily(config.resolveEastAsiaFontFamily())
                .fontSizePt(config.getFontSizePt())
                .bold(false)
                .lineSpacingMultiple(config.getLineSpacingMultiple())
                .spaceBeforePt(0)
                .spaceAfterPt(0);
    }
}
