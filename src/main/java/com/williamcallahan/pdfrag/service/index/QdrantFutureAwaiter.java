package com.williamcallahan.pdfrag.service.index;

import com.google.common.util.concurrent.ListenableFuture;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

final class QdrantFutureAwaiter {

    private QdrantFutureAwaiter() {}

    static <T> T awaitFuture(ListenableFuture<T> future, Duration timeout, String operation) {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new VectorIndexException("Qdrant " + operation + " interrupted", interrupted);
        } catch (ExecutionException executionException) {
            Throwable cause = executionException.getCause() == null ? executionException : executionException.getCause();
            throw new VectorIndexException("Qdrant " + operation + " failed: " + cause.getMessage(), cause);
        } catch (TimeoutException timeoutException) {
            future.cancel(true);
            throw new VectorIndexTimeoutException(operation, timeout, timeoutException);
        }
    }
}
