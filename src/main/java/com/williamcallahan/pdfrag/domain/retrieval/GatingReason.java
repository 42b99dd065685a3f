package com.williamcallahan.pdfrag.domain.retrieval;

import com.fasterxml.jackson.annotation.JsonValue;

/** Why the gate did or did not recommend retrieval. */
public enum GatingReason {
    TRIVIAL("trivial"),
    EMPTY_INDEX("empty_index"),
    EMBEDDINGS_UNAVAILABLE("embeddings_unavailable"),
    NO_CENTROID("no_centroid"),
    LOW_SIMILARITY("low_similarity"),
    SEMANTIC_MATCH("semantic_match");

    private final String wireName;

    GatingReason(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
