package com.williamcallahan.pdfrag.service.cache;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Best-effort facade over a {@link CacheBackend}.
 *
 * <p>No operation here ever throws because the store failed. A {@link CacheUnavailableException} is
 * expected when the store is down and is only logged at debug level. Any other failure is unexpected:
 * it is logged at ERROR with its stack trace and counted, then handled exactly like an unavailable
 * store so the caller carries on.</p>
 */
public class CacheService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CacheService.class);

    private final CacheBackend backend;
    private final Duration defaultTtl;
    private final Counter unavailableCounter;
    private final Counter failureCounter;

    public CacheService(CacheBackend backend, Duration defaultTtl) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl");
        this.unavailableCounter = Metrics.counter("pdfrag.cache.unavailable");
        this.failureCounter = Metrics.counter("pdfrag.cache.failures");
    }

    /**
     * Reads a value of the expected type.
     *
     * <p>A stored value of another type is treated as a miss.</p>
     */
    public <T> CacheLookup<T> get(String key, Class<T> type) {
        Objects.requireNonNull(type, "type");
        try {
            Optional<Object> stored = backend.get(key);
            if (stored.isEmpty() || !type.isInstance(stored.get())) {
                return CacheLookup.miss();
            }
            return CacheLookup.hit(type.cast(stored.get()));
        } catch (CacheUnavailableException unavailable) {
            return unavailable("get", unavailable);
        } catch (RuntimeException unexpected) {
            return unexpectedFailure("get", key, unexpected);
        }
    }

    /** Stores a value with the default time-to-live. */
    public boolean put(String key, Object value) {
        return put(key, value, defaultTtl);
    }

    /**
     * Stores a value.
     *
     * @return true when the value was written
     */
    public boolean put(String key, Object value, Duration ttl) {
        try {
            backend.put(key, value, ttl);
            return true;
        } catch (CacheUnavailableException unavailable) {
            unavailable("put", unavailable);
            return false;
        } catch (RuntimeException unexpected) {
            unexpectedFailure("put", key, unexpected);
            return false;
        }
    }

    public boolean delete(String key) {
        try {
            return backend.delete(key);
        } catch (CacheUnavailableException unavailable) {
            unavailable("delete", unavailable);
            return false;
        } catch (RuntimeException unexpected) {
            unexpectedFailure("delete", key, unexpected);
            return false;
        }
    }

    /**
     * Removes every entry under the prefix.
     *
     * @return removed count, 0 when the store failed
     */
    public int invalidatePrefix(String prefix) {
        try {
            return backend.invalidatePrefix(prefix);
        } catch (CacheUnavailableException unavailable) {
            unavailable("invalidatePrefix", unavailable);
            return 0;
        } catch (RuntimeException unexpected) {
            unexpectedFailure("invalidatePrefix", prefix, unexpected);
            return 0;
        }
    }

    public int size() {
        try {
            return backend.size();
        } catch (RuntimeException failure) {
            log.debug("[CACHE] size unavailable: {}", failure.getMessage());
            return 0;
        }
    }

    @Override
    public void close() {
        backend.close();
    }

    private <T> CacheLookup<T> unavailable(String operation, CacheUnavailableException unavailable) {
        unavailableCounter.increment();
        log.debug("[CACHE] {} skipped, cache unavailable: {}", operation, unavailable.getMessage());
        return CacheLookup.unavailable(unavailable.getMessage());
    }

    private <T> CacheLookup<T> unexpectedFailure(String operation, String key, RuntimeException unexpected) {
        failureCounter.increment();
        log.error("[CACHE] Unexpected failure during {} (key={})", operation, key, unexpected);
        return CacheLookup.unavailable(unexpected.getClass().getSimpleName());
    }
}
