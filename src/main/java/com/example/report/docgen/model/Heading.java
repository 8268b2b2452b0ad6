package com.example.report.docgen.model;

import com.example.report.docgen.style.BlockKind;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Chapter (level 1) or subsection (level 2) heading
 */
@Value
@Builder
@Jacksonized
public class Heading implements Block {
    int level;
    String text;

    @Override
    public BlockKind getKind() {
        return level == 1 ? BlockKind.HEADING_1 : BlockKind.HEADING_2;
    }
}
