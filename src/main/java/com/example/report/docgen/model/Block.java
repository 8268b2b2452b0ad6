package com.example.report.docgen.model;

import com.example.report.docgen.style.BlockKind;
import com.example.report.docgen.style.StyleFlags;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One semantic unit of document content. Blocks are immutable and their order
 * in a {@link ReportDocument} is the reading order.
 *
 * In report definitions the variant is selected by the {@code type} property, e.g.
 * <pre>
 * - type: heading
 *   level: 2
 *   text: "1.1 Описание бизнес-процесса"
 * - type: listItem
 *   ordinal: 1
 *   text: "провести анализ предметной области;"
 * </pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Heading.class, name = "heading"),
        @JsonSubTypes.Type(value = Paragraph.class, name = "paragraph"),
        @JsonSubTypes.Type(value = ListItem.class, name = "listItem"),
        @JsonSubTypes.Type(value = PageBreak.class, name = "pageBreak"),
        @JsonSubTypes.Type(value = Table.class, name = "table"),
        @JsonSubTypes.Type(value = TocEntry.class, name = "tocEntry"),
        @JsonSubTypes.Type(value = ReferenceEntry.class, name = "referenceEntry")
})
public interface Block {

    @JsonIgnore
    BlockKind getKind();

    @JsonIgnore
    default StyleFlags getStyleFlags() {
        return StyleFlags.NONE;
    }
}
