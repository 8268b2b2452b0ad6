package com.example.report.docgen.exception;

/**
 * A report definition could not be located or parsed
 */
public class ReportDefinitionLoadingException extends DocgenException {

    public static final String DEFINITION_NOT_FOUND = "DEFINITION_NOT_FOUND";
    public static final String INVALID_DEFINITION = "INVALID_DEFINITION";

    public ReportDefinitionLoadingException(String code, String description) {
        super(code, description);
    }

    public ReportDefinitionLoadingException(String code, String description, Throwable cause) {
        super(code, description, cause);
    }
}
