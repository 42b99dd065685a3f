package com.williamcallahan.pdfrag.service.retrieval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.pdfrag.domain.ChunkMetadata;
import com.williamcallahan.pdfrag.domain.ChunkType;
import com.williamcallahan.pdfrag.domain.DocumentChunk;
import com.williamcallahan.pdfrag.domain.retrieval.GatingDecision;
import com.williamcallahan.pdfrag.domain.retrieval.GatingReason;
import com.williamcallahan.pdfrag.service.index.InMemoryVectorIndex;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies the corpus-centroid gate fails closed and recomputes after invalidation.
 */
class CentroidGateTest {

    private InMemoryVectorIndex vectorIndex;
    private CentroidGate gate;

    @BeforeEach
    void setUp() {
        vectorIndex = new InMemoryVectorIndex();
        gate = new CentroidGate(vectorIndex, 3, 0.20, 2);
    }

    @Test
    void emptyIndexRejects() {
        GatingDecision decision = gate.decide(new float[] {1f, 0f, 0f});

        assertEquals(GatingReason.EMPTY_INDEX, decision.reason());
        assertFalse(decision.useRag());
    }

    @Test
    void queryCloseToCorpusIsAccepted() {
        store("a", new float[] {1f, 0f, 0f});
        store("b", new float[] {0.8f, 0.2f, 0f});

        GatingDecision decision = gate.decide(new float[] {1f, 0.1f, 0f});

        assertEquals(GatingReason.SEMANTIC_MATCH, decision.reason());
        assertTrue(decision.useRag());
        assertTrue(decision.similarity() > 0.9);
    }

    @Test
    void orthogonalQueryIsRejectedAsLowSimilarity() {
        store("a", new float[] {1f, 0f, 0f});

        GatingDecision decision = gate.decide(new float[] {0f, 0f, 1f});

        assertEquals(GatingReason.LOW_SIMILARITY, decision.reason());
        assertFalse(decision.useRag());
    }

    @Test
    void similarityEqualToThresholdIsNotEnough() {
        assertFalse(GatingDecision.scored(0.20, 0.20).useRag());
        assertTrue(GatingDecision.scored(0.2001, 0.20).useRag());
    }

    @Test
    void zeroQueryVectorRejectsAsEmbeddingsUnavailable() {
        store("a", new float[] {1f, 0f, 0f});

        assertEquals(GatingReason.EMBEDDINGS_UNAVAILABLE, gate.decide(new float[3]).reason());
        assertEquals(GatingReason.EMBEDDINGS_UNAVAILABLE, gate.decide(null).reason());
    }

    @Test
    void corpusOfZeroVectorsHasNoCentroid() {
        store("a", new float[3]);

        assertEquals(GatingReason.NO_CENTROID, gate.decide(new float[] {1f, 0f, 0f}).reason());
        assertFalse(gate.hasCentroid());
    }

    @Test
    void centroidIsReusedUntilInvalidated() {
        store("a", new float[] {1f, 0f, 0f});
        store("b", new float[] {1f, 0f, 0f});
        store("c", new float[] {1f, 0f, 0f});

        gate.decide(new float[] {1f, 0f, 0f});
        int scrollsAfterFirstScan = vectorIndex.scrollCalls();
        gate.decide(new float[] {1f, 0f, 0f});

        assertEquals(2, scrollsAfterFirstScan);
        assertEquals(scrollsAfterFirstScan, vectorIndex.scrollCalls());

        store("d", new float[] {0f, 0f, 1f});
        store("e", new float[] {0f, 0f, 1f});
        store("f", new float[] {0f, 0f, 1f});
        store("g", new float[] {0f, 0f, 1f});
        gate.invalidate();
        assertFalse(gate.hasCentroid());

        GatingDecision decision = gate.decide(new float[] {0f, 0f, 1f});

        assertTrue(vectorIndex.scrollCalls() > scrollsAfterFirstScan);
        assertEquals(GatingReason.SEMANTIC_MATCH, decision.reason());
    }

    private void store(String source, float[] vector) {
        ChunkMetadata metadata = new ChunkMetadata(
                source + ".pdf", "", null, null, "hash-" + source, ChunkType.TEXT, 0.6, 10, 60, 1);
        vectorIndex.add(List.of(DocumentChunk.of("text " + source, metadata)), List.of(vector));
    }
}
