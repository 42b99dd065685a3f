package com.williamcallahan.pdfrag.service.ingestion;

import com.williamcallahan.pdfrag.domain.DocumentChunk;
import com.williamcallahan.pdfrag.support.VectorMath;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drops repeated chunks within one document before upload.
 *
 * <p>A chunk is a duplicate when its content hash was already kept, or when its embedding's cosine
 * similarity to an already kept chunk exceeds the threshold. Zero vectors never match.</p>
 */
public class ChunkDeduplicator {
    private final double similarityThreshold;

    public ChunkDeduplicator(double similarityThreshold) {
        if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("similarityThreshold must be within [0, 1]");
        }
        this.similarityThreshold = similarityThreshold;
    }

    /**
     * @param chunks embedded chunks in document order
     * @return first occurrence of every distinct chunk, order preserved
     */
    public List<DocumentChunk> deduplicate(List<DocumentChunk> chunks) {
        Set<String> seenHashes = new HashSet<>();
        List<DocumentChunk> kept = new ArrayList<>();
        List<float[]> keptVectors = new ArrayList<>();
        for (DocumentChunk chunk : chunks) {
            if (!seenHashes.add(chunk.metadata().contentHash())) {
                continue;
            }
            float[] vector = chunk.embedding();
            if (vector != null && !VectorMath.isZero(vector) && isNearDuplicate(vector, keptVectors)) {
                continue;
            }
            kept.add(chunk);
            if (vector != null && !VectorMath.isZero(vector)) {
                keptVectors.add(vector);
            }
        }
        return kept;
    }

    private boolean isNearDuplicate(float[] vector, List<float[]> keptVectors) {
        for (float[] kept : keptVectors) {
            if (kept.length == vector.length && VectorMath.cosine(vector, kept) > similarityThreshold) {
                return true;
            }
        }
        return false;
    }
}
