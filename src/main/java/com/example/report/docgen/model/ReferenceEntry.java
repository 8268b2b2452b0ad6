package com.example.report.docgen.model;

import com.example.report.docgen.style.BlockKind;
import com.example.report.docgen.style.StyleFlags;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Bibliography entry, rendered as "{number}. {text}"
 */
@Value
@Builder
@Jacksonized
public class ReferenceEntry implements Block {
    Integer number;
    String text;

    @Override
    public BlockKind getKind() {
        return BlockKind.REFERENCE_ENTRY;
    }

    @Override
    public StyleFlags getStyleFlags() {
        return StyleFlags.numbered(number);
    }
}
