package com.williamcallahan.pdfrag.service.embedding;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies offline mode produces correctly sized zero vectors.
 */
class MockEmbeddingClientTest {

    @Test
    void returnsOneZeroVectorPerInput() {
        MockEmbeddingClient client = new MockEmbeddingClient(4);

        List<float[]> vectors = client.embedBatch(List.of("a", "b"));

        assertEquals(2, vectors.size());
        assertArrayEquals(new float[4], vectors.get(1));
        assertEquals("mock", client.modelId());
    }

    @Test
    void rejectsNonPositiveDimensions() {
        assertThrows(IllegalArgumentException.class, () -> new MockEmbeddingClient(0));
    }
}
