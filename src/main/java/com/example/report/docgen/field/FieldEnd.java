package com.example.report.docgen.field;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Closes a field; maps to {@code <w:fldChar w:fldCharType="end"/>}
 */
@ToString
@EqualsAndHashCode
public final class FieldEnd implements FieldNode {

    @Override
    public Type getType() {
        return Type.END;
    }
}
