package com.williamcallahan.pdfrag.support;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exponential-backoff retry for operations that may fail transiently.
 *
 * <p>Only failures accepted by the supplied classifier are retried; any other failure, and the last
 * failure once attempts are exhausted, is rethrown unchanged.</p>
 */
public final class RetrySupport {

    private static final Logger log = LoggerFactory.getLogger(RetrySupport.class);

    /** Three attempts, 1s initial backoff doubling up to 8s. */
    public static final RetryPolicy DEFAULT_POLICY =
            new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(8));

    /** Blocking pause used between attempts; replaced in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    /** Sleeper backed by {@link Thread#sleep(long)}. */
    public static final Sleeper THREAD_SLEEPER = duration -> Thread.sleep(duration.toMillis());

    /**
     * Attempt budget and backoff bounds.
     *
     * @param maxAttempts total attempts including the first
     * @param initialBackoff pause after the first failure
     * @param maxBackoff upper bound for any single pause
     */
    public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        public RetryPolicy {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("maxAttempts must be positive");
            }
            Objects.requireNonNull(initialBackoff, "initialBackoff");
            Objects.requireNonNull(maxBackoff, "maxBackoff");
        }

        /**
         * Returns the pause after the given failed attempt: initial × 2^(attempt-1), capped.
         *
         * @param attemptNumber 1-based number of the attempt that failed
         * @return backoff duration
         */
        public Duration backoffAfter(int attemptNumber) {
            long initialMillis = initialBackoff.toMillis();
            int shift = Math.min(Math.max(attemptNumber - 1, 0), 30);
            long candidate = initialMillis << shift;
            if (candidate < initialMillis) {
                candidate = Long.MAX_VALUE;
            }
            return Duration.ofMillis(Math.min(candidate, maxBackoff.toMillis()));
        }
    }

    private RetrySupport() {}

    /**
     * Executes a supplier with the default policy, retrying failures the classifier marks transient.
     *
     * @param operation the operation to execute
     * @param operationName name for logging purposes
     * @param <T> return type
     * @return the result of the operation
     */
    public static <T> T executeWithRetry(Supplier<T> operation, String operationName) {
        return executeWithRetry(
                operation, operationName, DEFAULT_POLICY, TransientFailureClassifier::isTransient, THREAD_SLEEPER);
    }

    /**
     * Executes a supplier with the given policy, classifier and sleeper.
     *
     * @param operation the operation to execute
     * @param operationName name for logging purposes
     * @param policy attempt budget and backoff
     * @param isTransient decides whether a failure may be retried
     * @param sleeper pause implementation
     * @param <T> return type
     * @return the result of the operation
     * @throws RuntimeException the last failure once retries are exhausted, or the first permanent one
     */
    public static <T> T executeWithRetry(
            Supplier<T> operation,
            String operationName,
            RetryPolicy policy,
            Predicate<Throwable> isTransient,
            Sleeper sleeper) {
        RuntimeException lastException = null;
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            try {
                return operation.get();
            } catch (RuntimeException exception) {
                lastException = exception;
                if (!isTransient.test(exception)) {
                    log.warn("{} failed with non-transient error on attempt {}/{}, not retrying",
                            operationName, attempt, policy.maxAttempts());
                    throw exception;
                }
                if (attempt < policy.maxAttempts()) {
                    Duration backoff = policy.backoffAfter(attempt);
                    log.warn("{} failed with transient error on attempt {}/{}, retrying in {}ms",
                            operationName, attempt, policy.maxAttempts(), backoff.toMillis());
                    pause(sleeper, backoff);
                } else {
                    log.error("{} failed after {} attempts, giving up", operationName, policy.maxAttempts());
                }
            }
        }
        throw lastException;
    }

    private static void pause(Sleeper sleeper, Duration backoff) {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Retry interrupted", interrupted);
        }
    }
}
