package com.williamcallahan.pdfrag.service.index;

import com.williamcallahan.pdfrag.domain.DocumentChunk;
import com.williamcallahan.pdfrag.domain.ScoredChunk;
import com.williamcallahan.pdfrag.domain.retrieval.RetrievalFilter;
import java.time.Duration;
import java.util.List;

/**
 * Persistent store of embedded chunks with cosine similarity search.
 *
 * <p>The index is the source of truth for chunks; callers keep no copy beyond a single operation.</p>
 */
public interface VectorIndex {

    /**
     * Stores chunks with their embeddings; each embedding is also kept with the chunk's metadata.
     *
     * @param chunks chunks to store
     * @param embeddings one vector per chunk, same order
     */
    void add(List<DocumentChunk> chunks, List<float[]> embeddings);

    /**
     * Finds the chunks most similar to the query vector.
     *
     * @param queryEmbedding query vector
     * @param limit maximum results
     * @param filter exact-match metadata constraints
     * @param timeout upper bound on the wait
     * @return chunks with similarity scores, best first, embeddings attached when stored
     * @throws VectorIndexTimeoutException when the timeout expires
     */
    List<ScoredChunk> search(float[] queryEmbedding, int limit, RetrievalFilter filter, Duration timeout);

    /**
     * Deletes every chunk matching the filter; an empty filter deletes everything.
     *
     * @return number of chunks matched before deletion
     */
    long delete(RetrievalFilter filter);

    long count(RetrievalFilter filter);

    /**
     * Pages through stored points.
     *
     * @param limit page size
     * @param offset opaque offset from the previous page, null for the first page
     */
    ScrollPage scroll(int limit, String offset);
}
