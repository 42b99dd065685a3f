package com.williamcallahan.pdfrag.service.index;

import com.williamcallahan.pdfrag.domain.DocumentChunk;
import java.util.Objects;

/**
 * A stored chunk and its point identifier.
 */
public record IndexedPoint(String pointId, DocumentChunk chunk) {
    public IndexedPoint {
        Objects.requireNonNull(pointId, "pointId");
        Objects.requireNonNull(chunk, "chunk");
    }
}
