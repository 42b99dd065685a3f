package com.williamcallahan.pdfrag.service;

/**
 * Raised when a document cannot be opened or parsed.
 */
public class DocumentExtractionException extends RuntimeException {

    public DocumentExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
