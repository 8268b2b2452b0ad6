package com.example.report.docgen.field;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Opens a field; maps to {@code <w:fldChar w:fldCharType="begin"/>}
 */
@ToString
@EqualsAndHashCode
public final class FieldBegin implements FieldNode {

    @Override
    public Type getType() {
        return Type.BEGIN;
    }
}
