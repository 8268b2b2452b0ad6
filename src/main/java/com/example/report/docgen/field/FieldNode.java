package com.example.report.docgen.field;

/**
 * One element of a low-level field construct inside a text run
 */
public interface FieldNode {

    enum Type {
        BEGIN,
        INSTRUCTION,
        END
    }

    Type getType();
}
