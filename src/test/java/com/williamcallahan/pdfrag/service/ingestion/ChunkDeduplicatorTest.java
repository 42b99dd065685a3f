package com.williamcallahan.pdfrag.service.ingestion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.williamcallahan.pdfrag.domain.ChunkMetadata;
import com.williamcallahan.pdfrag.domain.ChunkType;
import com.williamcallahan.pdfrag.domain.DocumentChunk;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies in-document deduplication by content hash and embedding similarity.
 */
class ChunkDeduplicatorTest {

    private final ChunkDeduplicator deduplicator = new ChunkDeduplicator(0.95);

    @Test
    void dropsRepeatedContentHash() {
        DocumentChunk first = chunk("hash-a", "Header repeated on every page", new float[] {1f, 0f});
        DocumentChunk repeat = chunk("hash-a", "Header repeated on every page", new float[] {1f, 0f});

        assertEquals(List.of(first), deduplicator.deduplicate(List.of(first, repeat)));
    }

    @Test
    void dropsNearDuplicateEmbeddingsButKeepsDistinctOnes() {
        DocumentChunk original = chunk("hash-a", "Torque 40 Nm", new float[] {1f, 0f, 0f});
        DocumentChunk nearCopy = chunk("hash-b", "Torque: 40 Nm", new float[] {0.99f, 0.01f, 0f});
        DocumentChunk different = chunk("hash-c", "Wiring diagram", new float[] {0f, 1f, 0f});

        List<DocumentChunk> kept = deduplicator.deduplicate(List.of(original, nearCopy, different));

        assertEquals(List.of(original, different), kept);
    }

    @Test
    void zeroVectorsNeverMatchEachOther() {
        DocumentChunk first = chunk("hash-a", "First fallback chunk", new float[3]);
        DocumentChunk second = chunk("hash-b", "Second fallback chunk", new float[3]);

        assertEquals(2, deduplicator.deduplicate(List.of(first, second)).size());
    }

    @Test
    void rejectsThresholdOutsideUnitInterval() {
        assertThrows(IllegalArgumentException.class, () -> new ChunkDeduplicator(1.2));
    }

    private static DocumentChunk chunk(String contentHash, String text, float[] vector) {
        ChunkMetadata metadata = new ChunkMetadata(
                "manual.pdf", "/docs/manual.pdf", null, null, contentHash, ChunkType.TEXT, 0.6,
                text.split(" ").length, text.length(), 1);
        return DocumentChunk.of(text, metadata).withEmbedding(vector);
    }
}
