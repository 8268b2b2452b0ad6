package com.example.report.docgen.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * The finished document could not be written to its destination
 */
@Getter
public class DocumentWriteException extends DocgenException {

    public static final String IO_FAILURE = "IO_FAILURE";

    private final transient Path destination;

    public DocumentWriteException(Path destination, Throwable cause) {
        super(IO_FAILURE, "Failed to write document to " + destination, cause);
        this.destination = destination;
    }

    public DocumentWriteException(String description, Throwable cause) {
        super(IO_FAILURE, description, cause);
        this.destination = null;
    }
}
