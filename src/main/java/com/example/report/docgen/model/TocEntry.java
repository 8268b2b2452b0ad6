package com.example.report.docgen.model;

import com.example.report.docgen.style.BlockKind;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.regex.Pattern;

/**
 * One table-of-contents row. The page number is literal text supplied by the
 * caller, not a computed reference.
 */
@Value
@Builder
@Jacksonized
public class TocEntry implements Block {

    private static final Pattern SUBSECTION_PREFIX = Pattern.compile("^\\d+\\.\\d+.*", Pattern.DOTALL);

    String title;
    String page;

    /**
     * Subsection titles ("1.2 ...") are pushed one tab stop to the right
     */
    public boolean isNested() {
        return title != null && SUBSECTION_PREFIX.matcher(title).matches();
    }

    @Override
    public BlockKind getKind() {
        return BlockKind.TOC_ENTRY;
    }
}
