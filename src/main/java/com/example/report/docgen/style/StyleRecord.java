package com.example.report.docgen.style;

import lombok.Builder;
import lombok.Value;

/**
 * Concrete formatting resolved for one block. Never stored with the block;
 * always recomputed from the block kind and flags.
 */
@Value
@Builder
public class StyleRecord {
    String fontFamily;
    String eastAsiaFontFamily;
    double fontSizePt;
    boolean bold;
    Alignment alignment;
    double lineSpacingMultiple;
    double spaceBeforePt;
    double spaceAfterPt;

    /**
     * First-line indent in centimetres, null when the kind has no indent at all
     */
    Double firstLineIndentCm;

    /**
     * Outline level for headings (0-based), null for body text
     */
    Integer outlineLevel;

    public boolean hasFirstLineIndent() {
        return firstLineIndentCm != null;
    }
}
