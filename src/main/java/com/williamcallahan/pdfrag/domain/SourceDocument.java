package com.williamcallahan.pdfrag.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A document file queued for ingestion.
 *
 * @param name file name, used as the chunk {@code source}
 * @param byteLength size in bytes
 * @param storagePath location on disk
 */
public record SourceDocument(String name, long byteLength, Path storagePath) {
    public SourceDocument {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Document name is required");
        }
        if (byteLength < 0) {
            throw new IllegalArgumentException("Document length must be non-negative");
        }
        Objects.requireNonNull(storagePath, "storagePath");
    }
}
