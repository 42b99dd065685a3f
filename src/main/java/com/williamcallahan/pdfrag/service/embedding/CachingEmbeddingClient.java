package com.williamcallahan.pdfrag.service.embedding;

import com.williamcallahan.pdfrag.service.ContentHasher;
import com.williamcallahan.pdfrag.service.cache.CacheLookup;
import com.williamcallahan.pdfrag.service.cache.CacheService;
import com.williamcallahan.pdfrag.support.RetrySupport;
import com.williamcallahan.pdfrag.support.TransientFailureClassifier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedding client that reuses cached vectors, batches provider calls and degrades to zero vectors.
 *
 * <p>Per call: short inputs become a placeholder, each input is looked up in the cache by model and
 * normalized-text hash, only misses go to the provider in batches, transient provider failures are
 * retried with backoff, and a batch that still fails yields zero vectors. Permanent provider failures
 * propagate at once. Every vector is checked for the configured dimension; malformed ones become
 * zero vectors. Only valid provider vectors are written back to the cache.</p>
 */
public class CachingEmbeddingClient implements EmbeddingClient {
    private static final Logger log = LoggerFactory.getLogger(CachingEmbeddingClient.class);

    /** Substitute for inputs too short for providers to accept. */
    public static final String PLACEHOLDER_TEXT = "placeholder_text";
    static final int MIN_INPUT_LENGTH = 3;
    static final String CACHE_PREFIX = "emb:";

    private final EmbeddingProvider provider;
    private final CacheService cacheService;
    private final ContentHasher contentHasher;
    private final int dimensions;
    private final int batchSize;
    private final RetrySupport.RetryPolicy retryPolicy;
    private final Duration cacheTtl;
    private final RetrySupport.Sleeper sleeper;
    private final Counter fallbackCounter;

    public CachingEmbeddingClient(
            EmbeddingProvider provider,
            CacheService cacheService,
            ContentHasher contentHasher,
            int batchSize,
            RetrySupport.RetryPolicy retryPolicy,
            Duration cacheTtl) {
        this(provider, cacheService, contentHasher, batchSize, retryPolicy, cacheTtl, RetrySupport.THREAD_SLEEPER);
    }

    CachingEmbeddingClient(
            EmbeddingProvider provider,
            CacheService cacheService,
            ContentHasher contentHasher,
            int batchSize,
            RetrySupport.RetryPolicy retryPolicy,
            Duration cacheTtl,
            RetrySupport.Sleeper sleeper) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.cacheService = Objects.requireNonNull(cacheService, "cacheService");
        this.contentHasher = Objects.requireNonNull(contentHasher, "contentHasher");
        this.dimensions = provider.dimensions();
        if (dimensions <= 0) {
            throw new IllegalArgumentException("Embedding dimensions must be positive");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Embedding batch size must be positive");
        }
        this.batchSize = batchSize;
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.cacheTtl = Objects.requireNonNull(cacheTtl, "cacheTtl");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.fallbackCounter = Metrics.counter("pdfrag.embedding.fallbacks");
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        float[][] results = new float[texts.size()][];
        Map<String, PendingInput> misses = new LinkedHashMap<>();

        for (int index = 0; index < texts.size(); index++) {
            String prepared = prepareInput(texts.get(index));
            String cacheKey = cacheKey(prepared);
            CacheLookup<float[]> cached = cacheService.get(cacheKey, float[].class);
            if (cached instanceof CacheLookup.Hit<float[]> hit && hit.value().length == dimensions) {
                results[index] = hit.value().clone();
                continue;
            }
            misses.computeIfAbsent(cacheKey, key -> new PendingInput(key, prepared)).indices().add(index);
        }

        if (!misses.isEmpty()) {
            log.debug("[EMBEDDING] {} inputs, {} cache hits, {} unique misses",
                    texts.size(), texts.size() - countIndices(misses), misses.size());
            List<PendingInput> pending = new ArrayList<>(misses.values());
            for (int start = 0; start < pending.size(); start += batchSize) {
                List<PendingInput> batch = pending.subList(start, Math.min(start + batchSize, pending.size()));
                embedMisses(batch, results);
            }
        }

        List<float[]> ordered = new ArrayList<>(results.length);
        for (float[] vector : results) {
            ordered.add(vector);
        }
        return ordered;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public String modelId() {
        return provider.modelId();
    }

    private void embedMisses(List<PendingInput> batch, float[][] results) {
        List<String> inputs = batch.stream().map(PendingInput::text).toList();
        List<float[]> vectors = requestWithRetry(inputs);
        for (int i = 0; i < batch.size(); i++) {
            PendingInput input = batch.get(i);
            float[] candidate = vectors == null ? null : vectors.get(i);
            float[] vector;
            if (isValid(candidate)) {
                vector = candidate.clone();
                cacheService.put(input.cacheKey(), vector.clone(), cacheTtl);
            } else {
                if (vectors != null) {
                    log.warn("[EMBEDDING] Discarding malformed vector (length={}, expected={})",
                            candidate == null ? 0 : candidate.length, dimensions);
                }
                vector = new float[dimensions];
            }
            for (int index : input.indices()) {
                results[index] = vector.clone();
            }
        }
    }

    /**
     * Returns provider vectors for the batch, or null when the batch must fall back to zero vectors.
     */
    private List<float[]> requestWithRetry(List<String> inputs) {
        try {
            List<float[]> vectors = RetrySupport.executeWithRetry(
                    () -> provider.embed(inputs),
                    "Embedding batch of " + inputs.size(),
                    retryPolicy,
                    TransientFailureClassifier::isTransient,
                    sleeper);
            if (vectors == null || vectors.size() != inputs.size()) {
                log.warn("[EMBEDDING] Provider returned {} vectors for {} inputs; using zero vectors",
                        vectors == null ? 0 : vectors.size(), inputs.size());
                fallbackCounter.increment(inputs.size());
                return null;
            }
            return vectors;
        } catch (RuntimeException failure) {
            if (!TransientFailureClassifier.isTransient(failure)) {
                throw failure;
            }
            log.error("[EMBEDDING] Provider unavailable after {} attempts; returning zero vectors for {} inputs ({})",
                    retryPolicy.maxAttempts(), inputs.size(), TransientFailureClassifier.determineErrorType(failure));
            fallbackCounter.increment(inputs.size());
            return null;
        }
    }

    private boolean isValid(float[] vector) {
        if (vector == null || vector.length != dimensions) {
            return false;
        }
        for (float component : vector) {
            if (!Float.isFinite(component)) {
                return false;
            }
        }
        return true;
    }

    static String prepareInput(String text) {
        if (text == null || text.strip().length() < MIN_INPUT_LENGTH) {
            return PLACEHOLDER_TEXT;
        }
        return text;
    }

    String cacheKey(String preparedText) {
        return CACHE_PREFIX + provider.modelId() + ":" + contentHasher.hashNormalizedText(preparedText);
    }

    private static int countIndices(Map<String, PendingInput> misses) {
        int count = 0;
        for (PendingInput input : misses.values()) {
            count += input.indices().size();
        }
        return count;
    }

    private record PendingInput(String cacheKey, String text, List<Integer> indices) {
        PendingInput(String cacheKey, String text) {
            this(cacheKey, text, new ArrayList<>());
        }
    }
}
