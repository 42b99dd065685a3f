package com.williamcallahan.pdfrag.domain;

import java.util.Objects;

/**
 * A retrieved chunk with the score that ranked it.
 *
 * @param chunk retrieved chunk
 * @param score similarity from the index, or the rerank score once reranked
 */
public record ScoredChunk(DocumentChunk chunk, double score) {
    public ScoredChunk {
        Objects.requireNonNull(chunk, "chunk");
    }

    public ScoredChunk withScore(double replacement) {
        return new ScoredChunk(chunk, replacement);
    }
}
