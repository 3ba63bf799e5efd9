package com.itrassist.backend.exceptions;

/**
 * Upload rejected before a document record is created: missing, empty, oversized or unsupported file.
 */
public class IngestException extends BadRequestException {

    public IngestException(String message) {
        super(message);
    }

    public IngestException(String message, Throwable cause) {
        super(message, cause);
    }
}
