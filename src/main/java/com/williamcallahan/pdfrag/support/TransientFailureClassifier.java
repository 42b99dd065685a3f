package com.williamcallahan.pdfrag.support;

import com.williamcallahan.pdfrag.service.embedding.EmbeddingProviderException;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Classifies failures from the embedding provider and the vector index as transient or permanent.
 *
 * <p>Transient failures are retried with backoff; everything else propagates on first sight.</p>
 */
public final class TransientFailureClassifier {
    private TransientFailureClassifier() {}

    /**
     * Determine a stable error category based on exception messages and causes.
     *
     * @param error failure to describe
     * @return normalized error category label, suitable for logs
     */
    public static String determineErrorType(Throwable error) {
        String message = collectMessages(error);

        if (message.contains("404") || message.contains("not found")) {
            return "404 Not Found";
        } else if (message.contains("401") || message.contains("unauthorized")) {
            return "401 Unauthorized";
        } else if (message.contains("403") || message.contains("forbidden")) {
            return "403 Forbidden";
        } else if (message.contains("429") || message.contains("too many requests")) {
            return "429 Rate Limited";
        } else if (message.contains("connection") || message.contains("timeout") || message.contains("timed out")) {
            return "Connection Error";
        }
        return "Unknown Error";
    }

    /**
     * Returns true when the failure, or any cause in its chain, is worth retrying.
     *
     * <p>Embedding provider failures carry their own classification. gRPC failures are transient for
     * UNAVAILABLE, DEADLINE_EXCEEDED, RESOURCE_EXHAUSTED and ABORTED. Timeouts and I/O failures are
     * transient. Argument and state errors are never transient.</p>
     *
     * @param error failure to classify
     * @return true when a retry may succeed
     */
    public static boolean isTransient(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof EmbeddingProviderException providerException) {
                return providerException.isTransient();
            }
            if (current instanceof StatusRuntimeException statusException) {
                return isTransientStatus(statusException.getStatus().getCode());
            }
            if (current instanceof TimeoutException || current instanceof IOException) {
                return true;
            }
            if (current instanceof IllegalArgumentException) {
                return false;
            }
            current = current.getCause();
        }
        String errorType = determineErrorType(error);
        return "Connection Error".equals(errorType) || "429 Rate Limited".equals(errorType);
    }

    /**
     * Returns true for HTTP status codes that signal a temporary provider condition.
     *
     * @param statusCode HTTP status code
     * @return true for 408, 409, 425, 429 and any 5xx
     */
    public static boolean isTransientHttpStatus(int statusCode) {
        return statusCode == 408 || statusCode == 409 || statusCode == 425 || statusCode == 429 || statusCode >= 500;
    }

    private static boolean isTransientStatus(Status.Code code) {
        return code == Status.Code.UNAVAILABLE
                || code == Status.Code.DEADLINE_EXCEEDED
                || code == Status.Code.RESOURCE_EXHAUSTED
                || code == Status.Code.ABORTED;
    }

    private static String collectMessages(Throwable error) {
        StringBuilder messageBuilder = new StringBuilder();
        Throwable current = error;
        while (current != null) {
            String currentMessage = current.getMessage();
            if (currentMessage != null && !currentMessage.isBlank()) {
                if (messageBuilder.length() > 0) {
                    messageBuilder.append(' ');
                }
                messageBuilder.append(currentMessage);
            }
            current = current.getCause();
        }
        return messageBuilder.toString().toLowerCase(Locale.ROOT);
    }
}
