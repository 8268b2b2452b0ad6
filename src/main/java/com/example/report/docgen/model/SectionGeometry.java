package com.example.report.docgen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Page size, margins and header/footer offsets of the single document section.
 * All lengths are in centimetres; defaults are GOST 7.32 A4 portrait.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SectionGeometry {

    @Builder.Default
    private double pageHeightCm = 29.7;

    @Builder.Default
    private double pageWidthCm = 21.0;

    @Builder.Default
    private double topMarginCm = 2.0;

    @Builder.Default
    private double bottomMarginCm = 2.0;

    @Builder.Default
    private double leftMarginCm = 3.0;

    @Builder.Default
    private double rightMarginCm = 1.5;

    @Builder.Default
    private double headerDistanceCm = 1.25;

    @Builder.Default
    private double footerDistanceCm = 1.25;

    public static SectionGeometry gost() {
        return SectionGeometry.builder().build();
    }

    /**
     * Width available to body text between the side margins
     */
    public double textWidthCm() {
        return pageWidthCm - leftMarginCm - rightMarginCm;
    }
}
