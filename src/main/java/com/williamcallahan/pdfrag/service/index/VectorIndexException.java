package com.williamcallahan.pdfrag.service.index;

/**
 * Failure talking to the vector index.
 */
public class VectorIndexException extends RuntimeException {

    public VectorIndexException(String message) {
        super(message);
    }

    public VectorIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
