package com.example.report.docgen.model;

/**
 * Page region that carries the live page number
 */
public enum HeaderFooterRegion {
    HEADER,
    FOOTER
}
