package com.example.report.docgen.style;

/**
 * Horizontal paragraph alignment supported by the report styles
 */
public enum Alignment {
    LEFT,
    CENTER,
    JUSTIFY
}
