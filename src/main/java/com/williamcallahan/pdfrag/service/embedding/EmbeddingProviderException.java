package com.williamcallahan.pdfrag.service.embedding;

/**
 * Failure reported by an embedding provider.
 *
 * <p>Transient failures (timeouts, connection errors, rate limits, 5xx) may be retried; permanent
 * ones (authentication, validation) must not be.</p>
 */
public class EmbeddingProviderException extends RuntimeException {
    private final boolean transientFailure;

    public EmbeddingProviderException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public EmbeddingProviderException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public static EmbeddingProviderException transientFailure(String message, Throwable cause) {
        return new EmbeddingProviderException(message, true, cause);
    }

    public static EmbeddingProviderException permanentFailure(String message, Throwable cause) {
        return new EmbeddingProviderException(message, false, cause);
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
