package com.williamcallahan.pdfrag.service.embedding;

import java.util.List;

/**
 * Remote embedding capability: one request in, one vector per input out, in input order.
 *
 * <p>Implementations report failures as {@link EmbeddingProviderException} with the transient flag
 * set when a retry may succeed. They do not retry themselves.</p>
 */
public interface EmbeddingProvider {

    List<float[]> embed(List<String> texts);

    String modelId();

    int dimensions();
}
