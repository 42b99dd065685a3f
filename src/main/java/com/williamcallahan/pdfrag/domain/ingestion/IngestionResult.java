package com.williamcallahan.pdfrag.domain.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Outcome of ingesting one document so callers can tell new, duplicate and failed files apart.
 *
 * @param filename source file name
 * @param status terminal status
 * @param chunksOriginal chunks produced by the chunker
 * @param chunksUnique chunks left after chunk-level deduplication
 * @param chunksAdded chunks written to the index
 * @param reason skip reason ({@code duplicate_content}, {@code duplicate_file}) or empty
 * @param error failure description or empty
 */
public record IngestionResult(
        String filename,
        IngestionStatus status,
        @JsonProperty("chunks_original") int chunksOriginal,
        @JsonProperty("chunks_unique") int chunksUnique,
        @JsonProperty("chunks_added") int chunksAdded,
        String reason,
        String error) {

    /** Document text already indexed under another file. */
    public static final String REASON_DUPLICATE_CONTENT = "duplicate_content";
    /** Identical file bytes already indexed. */
    public static final String REASON_DUPLICATE_FILE = "duplicate_file";

    public IngestionResult {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("Filename is required");
        }
        Objects.requireNonNull(status, "status");
        if (chunksOriginal < 0 || chunksUnique < 0 || chunksAdded < 0) {
            throw new IllegalArgumentException("Chunk counts must be non-negative");
        }
        if (chunksUnique > chunksOriginal || chunksAdded > chunksUnique) {
            throw new IllegalArgumentException("Chunk counts must satisfy added <= unique <= original");
        }
        reason = reason == null ? "" : reason;
        error = error == null ? "" : error;
    }

    public static IngestionResult success(String filename, int chunksOriginal, int chunksUnique, int chunksAdded) {
        return new IngestionResult(
                filename, IngestionStatus.SUCCESS, chunksOriginal, chunksUnique, chunksAdded, "", "");
    }

    public static IngestionResult skipped(String filename, String reason) {
        return new IngestionResult(filename, IngestionStatus.SKIPPED, 0, 0, 0, reason, "");
    }

    public static IngestionResult error(String filename, String error) {
        return new IngestionResult(filename, IngestionStatus.ERROR, 0, 0, 0, "", error);
    }

    public boolean isSuccess() {
        return status == IngestionStatus.SUCCESS;
    }
}
