package com.example.report.docgen.model;

import com.example.report.docgen.style.Alignment;
import com.example.report.docgen.style.BlockKind;
import com.example.report.docgen.style.StyleFlags;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Body text paragraph. Alignment is only set for title-page style lines;
 * body paragraphs leave it null and are justified.
 */
@Value
@Builder
@Jacksonized
public class Paragraph implements Block {
    String text;
    boolean bold;

    @Builder.Default
    boolean indented = true;

    Alignment alignment;

    @Override
    public BlockKind getKind() {
        return BlockKind.PARAGRAPH;
    }

    @Override
    public StyleFlags getStyleFlags() {
        return StyleFlags.builder()
                .bold(bold)
                .indented(indented)
                .alignment(alignment)
                .build();
    }
}
