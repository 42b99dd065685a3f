package com.williamcallahan.pdfrag.service.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded in-process cache with per-entry expiry.
 *
 * <p>Entries are kept in insertion order; when the store is full the oldest entry is evicted first.
 * Overwriting a key moves it to the newest position. One lock guards every read and mutation.</p>
 */
public class InMemoryCacheBackend implements CacheBackend {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCacheBackend.class);

    private final int maxEntries;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<>();
    private boolean closed;

    private record Entry(Object value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }

    public InMemoryCacheBackend(int maxEntries) {
        this(maxEntries, Clock.systemUTC());
    }

    public InMemoryCacheBackend(int maxEntries, Clock clock) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.maxEntries = maxEntries;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<Object> get(String key) {
        Objects.requireNonNull(key, "key");
        lock.lock();
        try {
            ensureOpen();
            Entry entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (entry.isExpired(clock.instant())) {
                entries.remove(key);
                return Optional.empty();
            }
            return Optional.of(entry.value());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(String key, Object value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        lock.lock();
        try {
            ensureOpen();
            Instant now = clock.instant();
            entries.remove(key);
            purgeExpired(now);
            while (entries.size() >= maxEntries) {
                evictOldest();
            }
            entries.put(key, new Entry(value, now.plus(ttl)));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String key) {
        Objects.requireNonNull(key, "key");
        lock.lock();
        try {
            ensureOpen();
            return entries.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int invalidatePrefix(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        lock.lock();
        try {
            ensureOpen();
            int removed = 0;
            Iterator<String> keys = entries.keySet().iterator();
            while (keys.hasNext()) {
                if (keys.next().startsWith(prefix)) {
                    keys.remove();
                    removed++;
                }
            }
            if (removed > 0) {
                log.debug("[CACHE] Invalidated {} entries with prefix '{}'", removed, prefix);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            purgeExpired(clock.instant());
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (!closed) {
                log.debug("[CACHE] Closing in-memory cache with {} entries", entries.size());
                entries.clear();
                closed = true;
            }
        } finally {
            lock.unlock();
        }
    }

    private void purgeExpired(Instant now) {
        entries.values().removeIf(entry -> entry.isExpired(now));
    }

    private void evictOldest() {
        Iterator<Map.Entry<String, Entry>> iterator = entries.entrySet().iterator();
        if (iterator.hasNext()) {
            iterator.next();
            iterator.remove();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new CacheUnavailableException("In-memory cache is closed");
        }
    }
}
