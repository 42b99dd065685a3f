package com.williamcallahan.pdfrag.service.retrieval;

import com.williamcallahan.pdfrag.config.AppProperties;
import com.williamcallahan.pdfrag.domain.retrieval.GatingDecision;
import com.williamcallahan.pdfrag.domain.retrieval.GatingReason;
import com.williamcallahan.pdfrag.domain.retrieval.RetrievalFilter;
import com.williamcallahan.pdfrag.service.index.IndexedPoint;
import com.williamcallahan.pdfrag.service.index.ScrollPage;
import com.williamcallahan.pdfrag.service.index.VectorIndex;
import com.williamcallahan.pdfrag.service.index.VectorIndexException;
import com.williamcallahan.pdfrag.support.VectorMath;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Decides whether a query is close enough to the indexed corpus for retrieval to help.
 *
 * <p>The corpus is summarized by its centroid: the normalized mean of every stored embedding,
 * computed lazily by scrolling the whole index. One recomputation runs at a time; readers always
 * see a complete vector or none. {@link #invalidate()} drops the vector, and a scan that started
 * before the invalidation does not publish its result.</p>
 */
@Component
public class CentroidGate {
    private static final Logger log = LoggerFactory.getLogger(CentroidGate.class);

    private final VectorIndex vectorIndex;
    private final int dimensions;
    private final double threshold;
    private final int pageSize;

    private final ReentrantLock recomputeLock = new ReentrantLock();
    private final AtomicReference<float[]> centroid = new AtomicReference<>();
    private final AtomicLong generation = new AtomicLong();

    @Autowired
    public CentroidGate(VectorIndex vectorIndex, AppProperties appProperties) {
        this(vectorIndex,
                appProperties.getEmbeddings().getDimensions(),
                appProperties.getRag().getGatingThreshold(),
                appProperties.getRag().getCentroidPageSize());
    }

    public CentroidGate(VectorIndex vectorIndex, int dimensions, double threshold, int pageSize) {
        this.vectorIndex = Objects.requireNonNull(vectorIndex, "vectorIndex");
        if (dimensions <= 0 || pageSize <= 0) {
            throw new IllegalArgumentException("dimensions and pageSize must be positive");
        }
        this.dimensions = dimensions;
        this.threshold = threshold;
        this.pageSize = pageSize;
    }

    /**
     * Gates a query by the similarity of its embedding to the centroid.
     *
     * <p>Fails closed: an empty index, a missing or zero query vector, or a centroid that cannot be
     * computed all reject retrieval.</p>
     *
     * @param queryEmbedding query vector, may be null when embedding failed
     * @return decision with its reason
     */
    public GatingDecision decide(float[] queryEmbedding) {
        try {
            if (vectorIndex.count(RetrievalFilter.none()) == 0) {
                return GatingDecision.reject(GatingReason.EMPTY_INDEX);
            }
        } catch (VectorIndexException e) {
            log.warn("[RAG] Gating could not count indexed chunks: {}", e.getMessage());
            return GatingDecision.reject(GatingReason.NO_CENTROID);
        }
        float[] query = VectorMath.normalizeOrNull(queryEmbedding, dimensions);
        if (query == null) {
            return GatingDecision.reject(GatingReason.EMBEDDINGS_UNAVAILABLE);
        }
        Optional<float[]> current = centroid();
        if (current.isEmpty()) {
            return GatingDecision.reject(GatingReason.NO_CENTROID);
        }
        double similarity = VectorMath.cosine(query, current.get());
        GatingDecision decision = GatingDecision.scored(similarity, threshold);
        log.info("[RAG] Gating: similarity={} threshold={} reason={}",
                String.format(Locale.ROOT, "%.4f", similarity), threshold, decision.reason().wireName());
        return decision;
    }

    /**
     * Current centroid, computing it first when none is held.
     */
    public Optional<float[]> centroid() {
        float[] current = centroid.get();
        if (current != null) {
            return Optional.of(current.clone());
        }
        recompute();
        current = centroid.get();
        return current == null ? Optional.empty() : Optional.of(current.clone());
    }

    /**
     * Scans the index and publishes a fresh centroid. Callers arriving while a scan runs wait for it
     * and reuse its result.
     *
     * @return true when a centroid is available afterwards
     */
    public boolean recompute() {
        recomputeLock.lock();
        try {
            if (centroid.get() != null) {
                return true;
            }
            long scanGeneration = generation.get();
            float[] computed = scan();
            if (computed == null) {
                return false;
            }
            if (generation.get() != scanGeneration) {
                log.info("[RAG] Discarding centroid computed before an index change");
                return false;
            }
            centroid.set(computed);
            return true;
        } catch (VectorIndexException e) {
            log.warn("[RAG] Centroid computation failed: {}", e.getMessage());
            return false;
        } finally {
            recomputeLock.unlock();
        }
    }

    /** Drops the centroid so the next gate decision recomputes it. */
    public void invalidate() {
        generation.incrementAndGet();
        centroid.set(null);
    }

    public boolean hasCentroid() {
        return centroid.get() != null;
    }

    private float[] scan() {
        VectorMath.MeanAccumulator accumulator = new VectorMath.MeanAccumulator(dimensions);
        long scanned = 0;
        String offset = null;
        do {
            ScrollPage page = vectorIndex.scroll(pageSize, offset);
            for (IndexedPoint point : page.points()) {
                accumulator.add(point.chunk().embedding());
                scanned++;
            }
            offset = page.points().isEmpty() ? null : page.nextOffset();
        } while (offset != null);

        float[] mean = accumulator.normalizedMean();
        if (mean == null) {
            log.info("[RAG] No usable embeddings for a centroid ({} points scanned)", scanned);
            return null;
        }
        log.info("[RAG] Centroid recomputed from {} of {} points", accumulator.count(), scanned);
        return mean;
    }
}
