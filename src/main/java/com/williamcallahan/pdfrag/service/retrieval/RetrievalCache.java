package com.williamcallahan.pdfrag.service.retrieval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.pdfrag.domain.ScoredChunk;
import com.williamcallahan.pdfrag.domain.retrieval.RetrievalFilter;
import com.williamcallahan.pdfrag.service.cache.CacheLookup;
import com.williamcallahan.pdfrag.service.cache.CacheService;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caches final retrieval results under {@code rag:<query>:sr=<0|1>:mmr=<0|1>:<k>:<filter>}.
 *
 * <p>Embeddings are stripped before storing. Empty results are never stored.</p>
 */
public class RetrievalCache {
    private static final Logger log = LoggerFactory.getLogger(RetrievalCache.class);
    static final String PREFIX = "rag:";

    private final CacheService cacheService;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public RetrievalCache(CacheService cacheService, ObjectMapper objectMapper, Duration ttl) {
        this.cacheService = Objects.requireNonNull(cacheService, "cacheService");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
    }

    public Optional<List<ScoredChunk>> get(String key) {
        CacheLookup<CachedResults> lookup = cacheService.get(key, CachedResults.class);
        if (lookup instanceof CacheLookup.Hit<CachedResults> hit) {
            return Optional.of(hit.value().results());
        }
        return Optional.empty();
    }

    public void put(String key, List<ScoredChunk> results) {
        if (results == null || results.isEmpty()) {
            return;
        }
        List<ScoredChunk> stripped = results.stream()
                .map(result -> new ScoredChunk(result.chunk().withoutEmbedding(), result.score()))
                .toList();
        cacheService.put(key, new CachedResults(stripped), ttl);
    }

    /** Drops every cached retrieval result. */
    public int invalidateAll() {
        return cacheService.invalidatePrefix(PREFIX);
    }

    /**
     * Builds the cache key; the filter part is the JSON of its sorted fields, empty when unfiltered.
     */
    public String key(String query, int k, RetrievalFilter filter, boolean semanticRerank, boolean mmr) {
        String normalizedQuery = query == null ? "" : query.strip().toLowerCase(Locale.ROOT);
        return PREFIX + normalizedQuery
                + ":sr=" + (semanticRerank ? 1 : 0)
                + ":mmr=" + (mmr ? 1 : 0)
                + ":" + k
                + ":" + fingerprint(filter);
    }

    private String fingerprint(RetrievalFilter filter) {
        if (filter == null || filter.isEmpty()) {
            return "";
        }
        try {
            return objectMapper.writeValueAsString(filter.fields());
        } catch (JsonProcessingException e) {
            log.debug("[CACHE] Falling back to plain filter fingerprint: {}", e.getMessage());
            return filter.fields().toString();
        }
    }

    record CachedResults(List<ScoredChunk> results) {
        CachedResults {
            results = List.copyOf(results);
        }
    }
}
