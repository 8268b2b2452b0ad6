package com.example.report.docgen.style;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Style constants the engine derives every {@link StyleRecord} from.
 * Field defaults are the GOST 7.32 values; bind overrides from
 * {@code docgen.style.*} or build an alternate set for other standards.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StyleConfiguration {

    @Builder.Default
    private String fontFamily = "Times New Roman";

    /**
     * Font used for East-Asian character ranges. Null falls back to {@link #fontFamily}.
     */
    private String eastAsiaFontFamily;

    @Builder.Default
    private double fontSizePt = 14;

    @Builder.Default
    private double lineSpacingMultiple = 1.5;

    @Builder.Default
    private double firstLineIndentCm = 1.25;

    @Builder.Default
    private double heading1SpaceAfterPt = 12;

    @Builder.Default
    private double heading2SpaceBeforePt = 12;

    @Builder.Default
    private double heading2SpaceAfterPt = 6;

    @Builder.Default
    private double tableLineSpacingMultiple = 1.0;

    @Builder.Default
    private String bulletPrefix = "– ";

    @Builder.Default
    private String ordinalSuffix = ") ";

    @Builder.Default
    private String referenceNumberSuffix = ". ";

    public static StyleConfiguration gost() {
        return StyleConfiguration.builder().build();
    }

    public String resolveEastAsiaFontFamily() {
        return eastAsiaFontFamily != null ? eastAsiaFontFamily : fontFamily;
    }
}
