package com.williamcallahan.pdfrag.service.chunking;

import com.williamcallahan.pdfrag.config.AppProperties;

/**
 * Chunking parameters.
 *
 * @param chunkSize target tokens per chunk
 * @param chunkOverlap tokens shared between neighbouring chunks
 * @param minChunkLength minimum characters a kept chunk must have
 * @param qualityFloor chunks scoring below are dropped
 * @param sentenceTrimRatio minimum share of text a sentence-boundary trim must keep
 */
public record ChunkingSettings(
        int chunkSize, int chunkOverlap, int minChunkLength, double qualityFloor, double sentenceTrimRatio) {

    public ChunkingSettings {
        if (chunkSize <= 0 || chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new IllegalArgumentException("Invalid chunk size/overlap: " + chunkSize + "/" + chunkOverlap);
        }
        if (minChunkLength < 0) {
            throw new IllegalArgumentException("minChunkLength must be non-negative");
        }
    }

    public static ChunkingSettings from(AppProperties.Rag rag) {
        return new ChunkingSettings(
                rag.getChunkSize(),
                rag.getChunkOverlap(),
                rag.getMinChunkLength(),
                rag.getQualityFloor(),
                rag.getSentenceTrimRatio());
    }
}
