package com.williamcallahan.pdfrag.service.cache;

/**
 * Signals that the cache store cannot serve a request right now, e.g. after it was closed.
 */
public class CacheUnavailableException extends RuntimeException {

    public CacheUnavailableException(String message) {
        super(message);
    }

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
