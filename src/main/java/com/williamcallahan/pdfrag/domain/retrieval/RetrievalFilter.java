package com.williamcallahan.pdfrag.domain.retrieval;

import com.williamcallahan.pdfrag.domain.ChunkMetadata;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Exact-match metadata constraints pushed down to the vector index.
 *
 * <p>Keys are persisted payload field names; entries are kept sorted so equal filters always produce
 * the same cache key.</p>
 *
 * @param fields field name to required value
 */
public record RetrievalFilter(SortedMap<String, String> fields) {

    public static final String FIELD_SOURCE = "source";
    public static final String FIELD_FILE_PATH = "file_path";
    public static final String FIELD_PDF_HASH = "pdf_hash";
    public static final String FIELD_CONTENT_HASH_GLOBAL = "content_hash_global";
    public static final String FIELD_CONTENT_HASH = "content_hash";
    public static final String FIELD_CHUNK_TYPE = "chunk_type";

    private static final Set<String> FILTERABLE_FIELDS = Set.of(
            FIELD_SOURCE,
            FIELD_FILE_PATH,
            FIELD_PDF_HASH,
            FIELD_CONTENT_HASH_GLOBAL,
            FIELD_CONTENT_HASH,
            FIELD_CHUNK_TYPE);

    public RetrievalFilter {
        TreeMap<String, String> sanitized = new TreeMap<>();
        if (fields != null) {
            for (Map.Entry<String, String> entry : fields.entrySet()) {
                String key = Objects.requireNonNull(entry.getKey(), "filter key").trim();
                if (!FILTERABLE_FIELDS.contains(key)) {
                    throw new IllegalArgumentException("Unsupported filter field: " + key);
                }
                String value = entry.getValue();
                if (value == null || value.isBlank()) {
                    throw new IllegalArgumentException("Filter value for " + key + " must not be blank");
                }
                sanitized.put(key, value.trim());
            }
        }
        fields = Collections.unmodifiableSortedMap(sanitized);
    }

    /** Unconstrained filter. */
    public static RetrievalFilter none() {
        return new RetrievalFilter(null);
    }

    public static RetrievalFilter of(String field, String value) {
        TreeMap<String, String> single = new TreeMap<>();
        single.put(field, value);
        return new RetrievalFilter(single);
    }

    public static RetrievalFilter of(Map<String, String> fields) {
        return new RetrievalFilter(fields == null ? null : new TreeMap<>(fields));
    }

    public static RetrievalFilter bySource(String filename) {
        return of(FIELD_SOURCE, filename);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * Evaluates the constraints against chunk metadata.
     */
    public boolean matches(ChunkMetadata metadata) {
        for (Map.Entry<String, String> entry : fields.entrySet()) {
            String actual = switch (entry.getKey()) {
                case FIELD_SOURCE -> metadata.source();
                case FIELD_FILE_PATH -> metadata.filePath();
                case FIELD_PDF_HASH -> metadata.pdfHash();
                case FIELD_CONTENT_HASH_GLOBAL -> metadata.contentHashGlobal();
                case FIELD_CONTENT_HASH -> metadata.contentHash();
                case FIELD_CHUNK_TYPE -> metadata.chunkType().wireName();
                default -> null;
            };
            if (!entry.getValue().equals(actual)) {
                return false;
            }
        }
        return true;
    }
}
