package com.williamcallahan.pdfrag.service.cache;

import java.util.Objects;

/**
 * Outcome of a best-effort cache read.
 *
 * @param <T> cached value type
 */
public sealed interface CacheLookup<T> permits CacheLookup.Hit, CacheLookup.Miss, CacheLookup.Unavailable {

    record Hit<T>(T value) implements CacheLookup<T> {
        public Hit {
            Objects.requireNonNull(value, "value");
        }
    }

    record Miss<T>() implements CacheLookup<T> {}

    /** The store failed; callers proceed exactly as on a miss. */
    record Unavailable<T>(String reason) implements CacheLookup<T> {}

    static <T> CacheLookup<T> hit(T value) {
        return new Hit<>(value);
    }

    static <T> CacheLookup<T> miss() {
        return new Miss<>();
    }

    static <T> CacheLookup<T> unavailable(String reason) {
        return new Unavailable<>(reason);
    }

    default boolean isHit() {
        return this instanceof Hit;
    }
}
