package com.williamcallahan.pdfrag.service.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store with per-entry time-to-live shared by the embedding and retrieval caches.
 *
 * <p>Implementations may throw {@link CacheUnavailableException} when the store cannot be reached;
 * callers go through {@link CacheService}, which never lets a cache failure escape.</p>
 */
public interface CacheBackend extends AutoCloseable {

    Optional<Object> get(String key);

    void put(String key, Object value, Duration ttl);

    boolean delete(String key);

    /**
     * Removes every entry whose key starts with the prefix.
     *
     * @return number of removed entries
     */
    int invalidatePrefix(String prefix);

    int size();

    @Override
    void close();
}
