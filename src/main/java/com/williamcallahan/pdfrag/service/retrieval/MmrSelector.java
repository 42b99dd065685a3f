package com.williamcallahan.pdfrag.service.retrieval;

import com.williamcallahan.pdfrag.domain.DocumentChunk;
import com.williamcallahan.pdfrag.domain.ScoredChunk;
import com.williamcallahan.pdfrag.support.VectorMath;
import java.util.ArrayList;
import java.util.List;

/**
 * Maximum Marginal Relevance selection.
 *
 * <p>Repeatedly picks the candidate maximizing
 * {@code λ × sim(query, c) + (1 − λ) × (1 − max sim(c, selected))}. Candidates without a usable
 * vector are not eligible; when none is eligible the first {@code k} candidates are returned.</p>
 */
public class MmrSelector {
    private final double lambda;

    public MmrSelector(double lambda) {
        if (lambda < 0.0 || lambda > 1.0) {
            throw new IllegalArgumentException("lambda must be within [0, 1]");
        }
        this.lambda = lambda;
    }

    /**
     * @param queryEmbedding raw query vector
     * @param candidates candidates carrying embeddings
     * @param k number to select
     * @param dimensions expected vector length
     * @return selected candidates in selection order, scored by relevance to the query
     */
    public List<ScoredChunk> select(float[] queryEmbedding, List<ScoredChunk> candidates, int k, int dimensions) {
        if (k <= 0 || candidates.isEmpty()) {
            return List.of();
        }
        float[] query = VectorMath.normalizeOrNull(queryEmbedding, dimensions);
        if (query == null) {
            return firstK(candidates, k);
        }

        List<DocumentChunk> eligible = new ArrayList<>();
        List<float[]> vectors = new ArrayList<>();
        List<Double> relevance = new ArrayList<>();
        for (ScoredChunk candidate : candidates) {
            float[] vector = VectorMath.normalizeOrNull(candidate.chunk().embedding(), dimensions);
            if (vector != null) {
                eligible.add(candidate.chunk());
                vectors.add(vector);
                relevance.add(VectorMath.cosine(query, vector));
            }
        }
        if (eligible.isEmpty()) {
            return firstK(candidates, k);
        }

        List<Integer> selected = new ArrayList<>();
        List<Integer> remaining = new ArrayList<>();
        for (int i = 0; i < eligible.size(); i++) {
            remaining.add(i);
        }
        while (selected.size() < k && !remaining.isEmpty()) {
            int best = -1;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (int index : remaining) {
                double diversity = 1.0;
                if (!selected.isEmpty()) {
                    double maxSimilarity = Double.NEGATIVE_INFINITY;
                    for (int chosen : selected) {
                        maxSimilarity = Math.max(maxSimilarity, VectorMath.cosine(vectors.get(index), vectors.get(chosen)));
                    }
                    diversity = 1.0 - maxSimilarity;
                }
                double marginal = lambda * relevance.get(index) + (1.0 - lambda) * diversity;
                if (marginal > bestScore) {
                    bestScore = marginal;
                    best = index;
                }
            }
            selected.add(best);
            remaining.remove(Integer.valueOf(best));
        }

        List<ScoredChunk> result = new ArrayList<>(selected.size());
        for (int index : selected) {
            result.add(new ScoredChunk(eligible.get(index), relevance.get(index)));
        }
        return result;
    }

    private static List<ScoredChunk> firstK(List<ScoredChunk> candidates, int k) {
        return new ArrayList<>(candidates.subList(0, Math.min(k, candidates.size())));
    }
}
