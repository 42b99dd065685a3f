package com.williamcallahan.pdfrag.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * Bounded span of document text with its metadata and, once computed, its embedding.
 *
 * <p>The embedding is assigned at most once: {@link #withEmbedding(float[])} returns a new chunk and
 * refuses to replace an existing, different vector.</p>
 *
 * @param text chunk text
 * @param metadata fixed-schema metadata
 * @param embedding dense vector or null when not yet computed
 */
public record DocumentChunk(String text, ChunkMetadata metadata, float[] embedding) {

    public DocumentChunk {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(metadata, "metadata");
        embedding = embedding == null ? null : embedding.clone();
    }

    public static DocumentChunk of(String text, ChunkMetadata metadata) {
        return new DocumentChunk(text, metadata, null);
    }

    @Override
    public float[] embedding() {
        return embedding == null ? null : embedding.clone();
    }

    public boolean hasEmbedding() {
        return embedding != null;
    }

    /**
     * Attaches the embedding.
     *
     * @param vector computed vector
     * @return chunk carrying the vector
     * @throws IllegalStateException when a different vector is already attached
     */
    public DocumentChunk withEmbedding(float[] vector) {
        Objects.requireNonNull(vector, "vector");
        if (embedding != null) {
            if (Arrays.equals(embedding, vector)) {
                return this;
            }
            throw new IllegalStateException("Chunk " + metadata.contentHash() + " already has an embedding");
        }
        return new DocumentChunk(text, metadata, vector);
    }

    /** Same chunk without its vector, used before caching retrieval results. */
    public DocumentChunk withoutEmbedding() {
        return embedding == null ? this : new DocumentChunk(text, metadata, null);
    }

    public DocumentChunk withMetadata(ChunkMetadata replacement) {
        return new DocumentChunk(text, replacement, embedding);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DocumentChunk that)) {
            return false;
        }
        return text.equals(that.text) && metadata.equals(that.metadata) && Arrays.equals(embedding, that.embedding);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, metadata, Arrays.hashCode(embedding));
    }

    @Override
    public String toString() {
        return "DocumentChunk[source=" + metadata.source() + ", contentHash=" + metadata.contentHash()
                + ", chars=" + text.length() + ", embedded=" + hasEmbedding() + "]";
    }
}
