package com.itrassist.backend.exceptions;

/**
 * Extraction pipeline failed for a document. The worker turns it into status ERROR.
 */
public class DocumentExtractionException extends RuntimeException {

    public DocumentExtractionException(String message) {
        super(message);
    }

    public DocumentExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
