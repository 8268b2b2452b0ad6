package com.example.report.docgen.field;

/**
 * Builds the node triplet for a live "current page number" field.
 * This is the only field type the generator emits.
 */
public class PageNumberFieldBuilder {

    public static final String PAGE_INSTRUCTION = "PAGE";

    public FieldNodes buildPageNumberField() {
        return new FieldNodes(new FieldBegin(), new FieldInstruction(PAGE_INSTRUCTION), new FieldEnd());
    }
}
