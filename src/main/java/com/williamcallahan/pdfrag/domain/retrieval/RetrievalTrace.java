package com.williamcallahan.pdfrag.domain.retrieval;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Diagnostic view of one retrieval call.
 *
 * @param query original query
 * @param k requested result count
 * @param retrieved ranked results
 * @param context formatted context, null when not requested
 * @param timings per-stage timing statistics
 */
public record RetrievalTrace(
        String query,
        int k,
        List<RetrievedChunkView> retrieved,
        @JsonInclude(JsonInclude.Include.NON_NULL) String context,
        Map<String, TimingStats> timings) {

    public RetrievalTrace {
        Objects.requireNonNull(query, "query");
        retrieved = retrieved == null ? List.of() : List.copyOf(retrieved);
        timings = timings == null ? Map.of() : Map.copyOf(timings);
    }
}
