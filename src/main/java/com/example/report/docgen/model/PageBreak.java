package com.example.report.docgen.model;

import com.example.report.docgen.style.BlockKind;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@ToString
@EqualsAndHashCode
public class PageBreak implements Block {

    @Override
    public BlockKind getKind() {
        return BlockKind.PAGE_BREAK;
    }
}
