package com.williamcallahan.pdfrag.service.retrieval;

import com.williamcallahan.pdfrag.config.AppProperties;
import com.williamcallahan.pdfrag.domain.ChunkMetadata;
import com.williamcallahan.pdfrag.domain.DocumentChunk;
import com.williamcallahan.pdfrag.domain.ScoredChunk;
import com.williamcallahan.pdfrag.service.embedding.EmbeddingClient;
import com.williamcallahan.pdfrag.support.VectorMath;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Reorders search candidates by a blend of query similarity and chunk quality signals.
 *
 * <p>score = (0.5 × cosine + 0.35 × quality + 0.10 × length + 0.05 × content type) × boost, where
 * length is {@code min(words / 100, 1)} and the boost applies to PDF sources only. Candidates that
 * come back from the index without a stored vector are embedded together in one call.</p>
 */
@Component
public class SemanticReranker {
    private static final Logger log = LoggerFactory.getLogger(SemanticReranker.class);

    static final double SEMANTIC_WEIGHT = 0.5;
    static final double QUALITY_WEIGHT = 0.35;
    static final double LENGTH_WEIGHT = 0.10;
    static final double CONTENT_TYPE_WEIGHT = 0.05;
    static final double FULL_LENGTH_WORDS = 100.0;

    private final EmbeddingClient embeddingClient;
    private final double pdfBoost;

    @Autowired
    public SemanticReranker(EmbeddingClient embeddingClient, AppProperties appProperties) {
        this(embeddingClient, appProperties.getRag().getPdfBoost());
    }

    public SemanticReranker(EmbeddingClient embeddingClient, double pdfBoost) {
        this.embeddingClient = Objects.requireNonNull(embeddingClient, "embeddingClient");
        if (pdfBoost <= 0.0) {
            throw new IllegalArgumentException("pdfBoost must be positive");
        }
        this.pdfBoost = pdfBoost;
    }

    /**
     * Scores and sorts every candidate, best first.
     *
     * @param queryEmbedding raw query vector
     * @param candidates index results
     * @return candidates carrying their rerank score and embedding, best first
     */
    public List<ScoredChunk> rerank(float[] queryEmbedding, List<ScoredChunk> candidates) {
        int dimensions = embeddingClient.dimensions();
        float[] query = VectorMath.normalizeOrNull(queryEmbedding, dimensions);
        List<DocumentChunk> chunks = withEmbeddings(candidates, embeddingClient);

        List<ScoredChunk> scored = new ArrayList<>(chunks.size());
        for (DocumentChunk chunk : chunks) {
            float[] candidate = VectorMath.normalizeOrNull(chunk.embedding(), dimensions);
            double semantic = query == null || candidate == null ? 0.0 : VectorMath.cosine(query, candidate);
            scored.add(new ScoredChunk(chunk, score(semantic, chunk.metadata())));
        }
        scored.sort(Comparator.comparingDouble(ScoredChunk::score).reversed());
        log.debug("[RAG] Reranked {} candidates", scored.size());
        return scored;
    }

    double score(double semantic, ChunkMetadata metadata) {
        double lengthScore = Math.min(metadata.wordCount() / FULL_LENGTH_WORDS, 1.0);
        double blended = SEMANTIC_WEIGHT * semantic
                + QUALITY_WEIGHT * metadata.qualityScore()
                + LENGTH_WEIGHT * lengthScore
                + CONTENT_TYPE_WEIGHT * metadata.chunkType().rankingWeight();
        return metadata.isPdfSource() ? blended * pdfBoost : blended;
    }

    /**
     * Returns the candidate chunks, embedding in a single batch those that arrived without a vector.
     */
    static List<DocumentChunk> withEmbeddings(List<ScoredChunk> candidates, EmbeddingClient embeddingClient) {
        List<DocumentChunk> chunks = new ArrayList<>(candidates.size());
        List<Integer> missing = new ArrayList<>();
        for (ScoredChunk candidate : candidates) {
            if (!candidate.chunk().hasEmbedding()) {
                missing.add(chunks.size());
            }
            chunks.add(candidate.chunk());
        }
        if (missing.isEmpty()) {
            return chunks;
        }
        List<String> texts = missing.stream().map(index -> chunks.get(index).text()).toList();
        List<float[]> vectors = embeddingClient.embedBatch(texts);
        for (int i = 0; i < missing.size(); i++) {
            int index = missing.get(i);
            chunks.set(index, chunks.get(index).withEmbedding(vectors.get(i)));
        }
        log.debug("[RAG] Embedded {} candidates missing a stored vector", missing.size());
        return chunks;
    }
}
