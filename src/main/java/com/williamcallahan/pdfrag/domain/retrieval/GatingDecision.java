package com.williamcallahan.pdfrag.domain.retrieval;

import java.util.Objects;

/**
 * Result of the centroid gate.
 *
 * @param reason why the decision was taken
 * @param useRag true when retrieval is recommended
 * @param similarity cosine between the query and the corpus centroid, NaN when not computed
 */
public record GatingDecision(GatingReason reason, boolean useRag, double similarity) {
    public GatingDecision {
        Objects.requireNonNull(reason, "reason");
        if (useRag && reason != GatingReason.SEMANTIC_MATCH) {
            throw new IllegalArgumentException("Only a semantic match may recommend retrieval");
        }
    }

    public static GatingDecision reject(GatingReason reason) {
        return new GatingDecision(reason, false, Double.NaN);
    }

    public static GatingDecision scored(double similarity, double threshold) {
        boolean match = similarity > threshold;
        return new GatingDecision(
                match ? GatingReason.SEMANTIC_MATCH : GatingReason.LOW_SIMILARITY, match, similarity);
    }
}
