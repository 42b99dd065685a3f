package com.williamcallahan.pdfrag.service.retrieval;

import com.williamcallahan.pdfrag.config.AppProperties;
import com.williamcallahan.pdfrag.domain.ChunkMetadata;
import com.williamcallahan.pdfrag.domain.DocumentChunk;
import com.williamcallahan.pdfrag.domain.ScoredChunk;
import com.williamcallahan.pdfrag.domain.retrieval.GatingDecision;
import com.williamcallahan.pdfrag.domain.retrieval.GatingReason;
import com.williamcallahan.pdfrag.domain.retrieval.RetrievalFilter;
import com.williamcallahan.pdfrag.domain.retrieval.RetrievalTrace;
import com.williamcallahan.pdfrag.domain.retrieval.RetrievedChunkView;
import com.williamcallahan.pdfrag.service.embedding.EmbeddingClient;
import com.williamcallahan.pdfrag.service.embedding.EmbeddingProviderException;
import com.williamcallahan.pdfrag.service.index.VectorIndex;
import com.williamcallahan.pdfrag.service.index.VectorIndexException;
import com.williamcallahan.pdfrag.service.index.VectorIndexTimeoutException;
import com.williamcallahan.pdfrag.service.ingestion.IndexChangedEvent;
import com.williamcallahan.pdfrag.support.VectorMath;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Finds the chunks most relevant to a query.
 *
 * <p>Pipeline: trivial-query check, result cache, vector search under a timeout, then either semantic
 * reranking or MMR when the search returned more than {@code k} candidates, and finally a cache
 * store of non-empty results. Search timeouts, index errors and embedding failures yield an empty
 * result that is not cached. Cached results and the gating centroid are dropped whenever the index
 * changes.</p>
 */
@Service
public class RetrievalService {
    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);
    private static final int STATISTICS_LOG_INTERVAL = 5;

    private final EmbeddingClient embeddingClient;
    private final VectorIndex vectorIndex;
    private final TrivialQueryFilter trivialQueryFilter;
    private final SemanticReranker reranker;
    private final MmrSelector mmrSelector;
    private final CentroidGate centroidGate;
    private final ContextFormatter contextFormatter;
    private final RetrievalCache retrievalCache;
    private final PerformanceMetrics performanceMetrics = new PerformanceMetrics();
    private final Counter searchTimeouts;
    private final Counter retrievalFailures;
    private final AppProperties.Rag settings;

    public RetrievalService(
            EmbeddingClient embeddingClient,
            VectorIndex vectorIndex,
            TrivialQueryFilter trivialQueryFilter,
            SemanticReranker reranker,
            CentroidGate centroidGate,
            ContextFormatter contextFormatter,
            RetrievalCache retrievalCache,
            AppProperties appProperties) {
        this.embeddingClient = Objects.requireNonNull(embeddingClient, "embeddingClient");
        this.vectorIndex = Objects.requireNonNull(vectorIndex, "vectorIndex");
        this.trivialQueryFilter = Objects.requireNonNull(trivialQueryFilter, "trivialQueryFilter");
        this.reranker = Objects.requireNonNull(reranker, "reranker");
        this.centroidGate = Objects.requireNonNull(centroidGate, "centroidGate");
        this.contextFormatter = Objects.requireNonNull(contextFormatter, "contextFormatter");
        this.retrievalCache = Objects.requireNonNull(retrievalCache, "retrievalCache");
        this.settings = appProperties.getRag();
        this.mmrSelector = new MmrSelector(settings.getMmrLambda());
        this.searchTimeouts = Metrics.counter("pdfrag.search.timeouts");
        this.retrievalFailures = Metrics.counter("pdfrag.retrieval.failures");
    }

    /**
     * Retrieves up to {@code k} ranked chunks.
     *
     * @param query natural-language query
     * @param k maximum results
     * @param filter metadata constraints, may be null
     * @return ranked chunks; empty for trivial queries, no match, or when the index or embedding provider fails
     */
    public List<ScoredChunk> retrieve(String query, int k, RetrievalFilter filter) {
        long startNanos = System.nanoTime();
        String trimmed = query == null ? "" : query.strip();
        if (k <= 0 || trivialQueryFilter.isTrivial(trimmed)) {
            log.debug("[RAG] Skipping retrieval for trivial query '{}'", abbreviate(trimmed));
            return List.of();
        }
        RetrievalFilter effectiveFilter = filter == null ? RetrievalFilter.none() : filter;
        boolean semanticRerank = settings.isSemanticRerank();
        boolean mmr = settings.isMmrEnabled();

        long cacheStart = System.nanoTime();
        String cacheKey = retrievalCache.key(trimmed, k, effectiveFilter, semanticRerank, mmr);
        Optional<List<ScoredChunk>> cached = retrievalCache.get(cacheKey);
        performanceMetrics.record(PerformanceMetrics.CACHE_OPERATIONS, elapsedSince(cacheStart));
        if (cached.isPresent()) {
            log.debug("[RAG] Cache hit for '{}' k={} ({} chunks)", abbreviate(trimmed), k, cached.get().size());
            return cached.get();
        }

        float[] queryEmbedding;
        try {
            queryEmbedding = embeddingClient.embedOne(trimmed);
        } catch (EmbeddingProviderException e) {
            retrievalFailures.increment();
            log.warn("[RAG] Query embedding failed; returning no results for '{}': {}", abbreviate(trimmed),
                    e.getMessage());
            return List.of();
        }
        if (VectorMath.isZero(queryEmbedding)) {
            log.warn("[RAG] Query embedding unavailable; returning no results for '{}'", abbreviate(trimmed));
            return List.of();
        }

        List<ScoredChunk> candidates = search(queryEmbedding, k, effectiveFilter);
        if (candidates.isEmpty()) {
            log.info("[RAG] 0 chunks retrieved for '{}'", abbreviate(trimmed));
            recordTotal(startNanos);
            return List.of();
        }

        List<ScoredChunk> ranked;
        try {
            ranked = rank(queryEmbedding, candidates, k, semanticRerank, mmr);
        } catch (EmbeddingProviderException e) {
            retrievalFailures.increment();
            log.warn("[RAG] Candidate embedding failed; returning no results for '{}': {}", abbreviate(trimmed),
                    e.getMessage());
            return List.of();
        }

        long storeStart = System.nanoTime();
        retrievalCache.put(cacheKey, ranked);
        performanceMetrics.record(PerformanceMetrics.CACHE_OPERATIONS, elapsedSince(storeStart));
        recordTotal(startNanos);
        log.info("[RAG] Retrieved {} chunks for '{}' from {} candidates", ranked.size(), abbreviate(trimmed),
                candidates.size());
        return List.copyOf(ranked);
    }

    /**
     * Retrieves and describes the results, optionally with the formatted context.
     */
    public RetrievalTrace retrieveWithTrace(String query, int k, RetrievalFilter filter, boolean includeContext) {
        List<ScoredChunk> results = retrieve(query, k, filter);
        List<RetrievedChunkView> views = new ArrayList<>(results.size());
        for (ScoredChunk result : results) {
            views.add(toView(result));
        }
        String context = includeContext ? formatContext(results) : null;
        return new RetrievalTrace(query == null ? "" : query, k, views, context, performanceMetrics.statistics());
    }

    /**
     * Formats ranked chunks as prompt context; a fixed sentence when there are none.
     */
    public String formatContext(List<ScoredChunk> results) {
        List<DocumentChunk> chunks = results == null
                ? List.of()
                : results.stream().map(ScoredChunk::chunk).toList();
        return contextFormatter.format(chunks);
    }

    /**
     * True only when the query is close enough to the indexed corpus for retrieval to help.
     */
    public boolean shouldUseRag(String query) {
        return gatingDecision(query).useRag();
    }

    /**
     * Gating decision with its reason.
     */
    public GatingDecision gatingDecision(String query) {
        String trimmed = query == null ? "" : query.strip();
        if (trivialQueryFilter.isTrivial(trimmed)) {
            return GatingDecision.reject(GatingReason.TRIVIAL);
        }
        float[] queryEmbedding;
        try {
            queryEmbedding = embeddingClient.embedOne(trimmed);
        } catch (EmbeddingProviderException e) {
            log.warn("[RAG] Gating could not embed query: {}", e.getMessage());
            return GatingDecision.reject(GatingReason.EMBEDDINGS_UNAVAILABLE);
        }
        GatingDecision decision = centroidGate.decide(queryEmbedding);
        log.info("[RAG] Gating: {} reason={} q='{}'", decision.useRag() ? "using RAG" : "skipped",
                decision.reason().wireName(), abbreviate(trimmed));
        return decision;
    }

    /** Drops cached results and the centroid. */
    public void invalidate() {
        int dropped = retrievalCache.invalidateAll();
        centroidGate.invalidate();
        log.info("[RAG] Invalidated {} cached results and the centroid", dropped);
    }

    @EventListener
    public void onIndexChanged(IndexChangedEvent event) {
        log.debug("[RAG] Index changed ({} {})", event.reason(), event.source());
        invalidate();
    }

    /**
     * Computes the centroid ahead of the first gating decision.
     *
     * @return true when a centroid is available
     */
    public boolean warmup() {
        boolean ready = centroidGate.recompute();
        log.info("[RAG] Warmup finished, centroid {}", ready ? "ready" : "unavailable");
        return ready;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void warmupOnStartup() {
        warmup();
    }

    /** Result count used when the caller does not choose one. */
    public int defaultK() {
        return settings.getDefaultK();
    }

    public PerformanceMetrics performanceMetrics() {
        return performanceMetrics;
    }

    private List<ScoredChunk> search(float[] queryEmbedding, int k, RetrievalFilter filter) {
        int limit = Math.max(k, Math.min(k * settings.getSearchMultiplier(), settings.getSearchCandidateCap()));
        Duration timeout = settings.getSearchTimeout();
        long searchStart = System.nanoTime();
        List<ScoredChunk> found;
        try {
            found = vectorIndex.search(queryEmbedding, limit, filter, timeout);
        } catch (VectorIndexTimeoutException e) {
            searchTimeouts.increment();
            log.warn("[RAG] Vector search timed out after {}ms; returning no results", timeout.toMillis());
            found = List.of();
        } catch (VectorIndexException e) {
            retrievalFailures.increment();
            log.warn("[RAG] Vector search failed; returning no results: {}", e.getMessage());
            found = List.of();
        } finally {
            performanceMetrics.record(PerformanceMetrics.VECTOR_RETRIEVAL, elapsedSince(searchStart));
        }
        double threshold = settings.getSearchScoreThreshold();
        List<ScoredChunk> kept = found.stream().filter(result -> result.score() >= threshold).toList();
        log.debug("[RAG] Search limit={} returned {} candidates, {} above {}", limit, found.size(), kept.size(),
                threshold);
        return kept;
    }

    private List<ScoredChunk> rank(
            float[] queryEmbedding, List<ScoredChunk> candidates, int k, boolean semanticRerank, boolean mmr) {
        if (candidates.size() <= k) {
            return candidates;
        }
        if (semanticRerank) {
            long rerankStart = System.nanoTime();
            List<ScoredChunk> reranked = reranker.rerank(queryEmbedding, candidates);
            performanceMetrics.record(PerformanceMetrics.SEMANTIC_RERANKING, elapsedSince(rerankStart));
            return new ArrayList<>(reranked.subList(0, k));
        }
        if (mmr) {
            long mmrStart = System.nanoTime();
            List<DocumentChunk> embedded = SemanticReranker.withEmbeddings(candidates, embeddingClient);
            List<ScoredChunk> withVectors = new ArrayList<>(candidates.size());
            for (int i = 0; i < candidates.size(); i++) {
                withVectors.add(new ScoredChunk(embedded.get(i), candidates.get(i).score()));
            }
            List<ScoredChunk> selected =
                    mmrSelector.select(queryEmbedding, withVectors, k, embeddingClient.dimensions());
            performanceMetrics.record(PerformanceMetrics.MMR_APPLICATION, elapsedSince(mmrStart));
            return selected;
        }
        return new ArrayList<>(candidates.subList(0, k));
    }

    private RetrievedChunkView toView(ScoredChunk result) {
        DocumentChunk chunk = result.chunk();
        ChunkMetadata metadata = chunk.metadata();
        String text = chunk.text();
        String preview = text.length() > settings.getPreviewLength()
                ? text.substring(0, settings.getPreviewLength())
                : text;
        return new RetrievedChunkView(
                result.score(),
                metadata.source(),
                metadata.filePath(),
                metadata.contentHash(),
                metadata.chunkType().wireName(),
                metadata.wordCount(),
                preview,
                metadata.pageNumber());
    }

    private void recordTotal(long startNanos) {
        performanceMetrics.record(PerformanceMetrics.TOTAL_TIME, elapsedSince(startNanos));
        if (performanceMetrics.sampleCount(PerformanceMetrics.TOTAL_TIME) % STATISTICS_LOG_INTERVAL == 0) {
            performanceMetrics.logStatistics();
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static String abbreviate(String query) {
        return query.length() <= 160 ? query : query.substring(0, 160) + "...";
    }
}
