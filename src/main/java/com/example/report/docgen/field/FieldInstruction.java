package com.example.report.docgen.field;

import lombok.Value;

/**
 * Field code evaluated by the viewer; maps to {@code <w:instrText>}
 */
@Value
public class FieldInstruction implements FieldNode {
    String instruction;

    @Override
    public Type getType() {
        return Type.INSTRUCTION;
    }
}
