package com.williamcallahan.pdfrag.service.index;

import java.time.Duration;

/**
 * An index operation did not complete within its timeout.
 */
public class VectorIndexTimeoutException extends VectorIndexException {

    public VectorIndexTimeoutException(String operation, Duration timeout, Throwable cause) {
        super("Qdrant " + operation + " timed out after " + timeout.toMillis() + "ms", cause);
    }
}
