package com.williamcallahan.pdfrag.service.embedding;

import java.util.List;

/**
 * Produces fixed-dimension embeddings for text.
 *
 * <p>Output order always matches input order and every vector has {@link #dimensions()} entries.</p>
 */
public interface EmbeddingClient {

    List<float[]> embedBatch(List<String> texts);

    default float[] embedOne(String text) {
        return embedBatch(List.of(text == null ? "" : text)).get(0);
    }

    int dimensions();

    String modelId();
}
