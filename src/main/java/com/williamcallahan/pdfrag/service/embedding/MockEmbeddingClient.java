package com.williamcallahan.pdfrag.service.embedding;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Offline client that returns zero vectors without contacting any provider.
 */
public class MockEmbeddingClient implements EmbeddingClient {
    private static final Logger log = LoggerFactory.getLogger(MockEmbeddingClient.class);

    private final int dimensions;

    public MockEmbeddingClient(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("Embedding dimensions must be positive");
        }
        this.dimensions = dimensions;
        log.info("[EMBEDDING] Mock mode active: returning {}-dimension zero vectors", dimensions);
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            vectors.add(new float[dimensions]);
        }
        return vectors;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public String modelId() {
        return "mock";
    }
}
