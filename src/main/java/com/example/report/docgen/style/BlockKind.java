package com.example.report.docgen.style;

/**
 * Semantic kind of a content block. The style engine dispatches on this value.
 */
public enum BlockKind {
    HEADING_1,
    HEADING_2,
    PARAGRAPH,
    LIST_ITEM,
    TOC_ENTRY,
    REFERENCE_ENTRY,
    TABLE_CELL,
    TABLE,
    PAGE_BREAK
}
