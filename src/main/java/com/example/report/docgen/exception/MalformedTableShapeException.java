package com.example.report.docgen.exception;

import lombok.Getter;

/**
 * A table row does not have the header's column count
 */
@Getter
public class MalformedTableShapeException extends DocgenException {

    public static final String MALFORMED_TABLE_SHAPE = "MALFORMED_TABLE_SHAPE";

    private final int expectedColumns;
    private final int rowIndex;
    private final int actualColumns;

    public MalformedTableShapeException(int expectedColumns, int rowIndex, int actualColumns) {
        super(MALFORMED_TABLE_SHAPE, String.format(
                "Data row %d has %d columns, header has %d", rowIndex, actualColumns, expectedColumns));
        this.expectedColumns = expectedColumns;
        this.rowIndex = rowIndex;
        this.actualColumns = actualColumns;
    }

    public MalformedTableShapeException(String description) {
        super(MALFORMED_TABLE_SHAPE, description);
        this.expectedColumns = 0;
        this.rowIndex = -1;
        this.actualColumns = 0;
    }
}
