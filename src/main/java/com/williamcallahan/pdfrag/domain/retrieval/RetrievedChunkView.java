package com.williamcallahan.pdfrag.domain.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-result entry of a retrieval trace.
 */
public record RetrievedChunkView(
        double score,
        String source,
        @JsonProperty("file_path") String filePath,
        @JsonProperty("content_hash") String contentHash,
        @JsonProperty("chunk_type") String chunkType,
        @JsonProperty("word_count") int wordCount,
        String preview,
        @JsonProperty("page_number") Integer pageNumber) {}
