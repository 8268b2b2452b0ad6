package com.example.report.docgen.model;

import com.example.report.docgen.style.Alignment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Where the live page number goes. GOST places it centered in the footer and
 * hides it on the title page, which still counts as page 1.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PageNumbering {

    @Builder.Default
    private HeaderFooterRegion region = HeaderFooterRegion.FOOTER;

    @Builder.Default
    private Alignment alignment = Alignment.CENTER;

    @Builder.Default
    private boolean suppressOnFirstPage = true;

    public static PageNumbering gost() {
        return PageNumbering.builder().build();
    }
}
