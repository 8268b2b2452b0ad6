package com.example.report.docgen.model;

import com.example.report.docgen.style.BlockKind;
import com.example.report.docgen.style.StyleFlags;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * List entry, numbered when an ordinal is given, dashed otherwise
 */
@Value
@Builder
@Jacksonized
public class ListItem implements Block {
    String text;
    Integer ordinal;

    @Override
    public BlockKind getKind() {
        return BlockKind.LIST_ITEM;
    }

    @Override
    public StyleFlags getStyleFlags() {
        return StyleFlags.numbered(ordinal);
    }
}
