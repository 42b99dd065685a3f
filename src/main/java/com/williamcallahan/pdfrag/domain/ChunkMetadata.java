package com.williamcallahan.pdfrag.domain;

import java.util.Locale;
import java.util.Objects;

/**
 * Fixed metadata schema carried by every chunk and persisted as point payload.
 *
 * <p>{@code pdfHash} and {@code contentHashGlobal} stay null until the ingestion pipeline stamps
 * the chunk with its document-level hashes. {@code pageNumber} is null when the page is unknown.</p>
 *
 * @param source file name of the source document
 * @param filePath absolute path of the source document at ingestion time
 * @param pdfHash digest of the raw document bytes
 * @param contentHashGlobal digest of the document's normalized extracted text
 * @param contentHash digest of this chunk's normalized text
 * @param chunkType structural kind
 * @param qualityScore heuristic quality in [0, 1]
 * @param wordCount whitespace-delimited word count
 * @param charCount character count
 * @param pageNumber 1-based page the chunk starts on
 */
public record ChunkMetadata(
        String source,
        String filePath,
        String pdfHash,
        String contentHashGlobal,
        String contentHash,
        ChunkType chunkType,
        double qualityScore,
        int wordCount,
        int charCount,
        Integer pageNumber) {

    public ChunkMetadata {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("Chunk source is required");
        }
        filePath = filePath == null ? "" : filePath;
        if (contentHash == null || contentHash.isBlank()) {
            throw new IllegalArgumentException("Chunk content hash is required");
        }
        Objects.requireNonNull(chunkType, "chunkType");
        if (Double.isNaN(qualityScore) || qualityScore < 0.0 || qualityScore > 1.0) {
            throw new IllegalArgumentException("Quality score must be within [0, 1], got " + qualityScore);
        }
        if (wordCount < 0 || charCount < 0) {
            throw new IllegalArgumentException("Word and character counts must be non-negative");
        }
        if (pageNumber != null && pageNumber < 1) {
            throw new IllegalArgumentException("Page number must be 1-based, got " + pageNumber);
        }
    }

    /**
     * Returns a copy carrying the document-level hashes.
     */
    public ChunkMetadata withDocumentHashes(String pdfHash, String contentHashGlobal) {
        return new ChunkMetadata(
                source,
                filePath,
                pdfHash,
                contentHashGlobal,
                contentHash,
                chunkType,
                qualityScore,
                wordCount,
                charCount,
                pageNumber);
    }

    /** True when the source file name ends in {@code .pdf}, ignoring case. */
    public boolean isPdfSource() {
        return source.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }
}
