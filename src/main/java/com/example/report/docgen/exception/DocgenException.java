package com.example.report.docgen.exception;

import lombok.Getter;

/**
 * Base class for report generation failures. Carries a stable code for API
 * responses and a human readable description.
 */
@Getter
public class DocgenException extends RuntimeException {

    public static final String GENERATION_FAILED = "GENERATION_FAILED";

    private final String code;
    private final String description;

    public DocgenException(String code, String description) {
        super(code + ": " + description);
        this.code = code;
        this.description = description;
    }

    public DocgenException(String code, String description, Throwable cause) {
        super(code + ": " + description, cause);
        this.code = code;
        this.description = description;
    }
}
