package com.williamcallahan.pdfrag.service.index;

import static io.qdrant.client.ValueFactory.list;
import static io.qdrant.client.ValueFactory.value;

import com.williamcallahan.pdfrag.domain.ChunkMetadata;
import com.williamcallahan.pdfrag.domain.ChunkType;
import com.williamcallahan.pdfrag.domain.DocumentChunk;
import com.williamcallahan.pdfrag.domain.retrieval.RetrievalFilter;
import io.qdrant.client.grpc.JsonWithInt.ListValue;
import io.qdrant.client.grpc.JsonWithInt.Value;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts chunks to and from Qdrant point payloads.
 *
 * <p>Field names are the persisted contract shared with every reader of the collection.</p>
 */
final class QdrantPayloadCodec {
    static final String TEXT = "text";
    static final String SOURCE = RetrievalFilter.FIELD_SOURCE;
    static final String FILE_PATH = RetrievalFilter.FIELD_FILE_PATH;
    static final String PDF_HASH = RetrievalFilter.FIELD_PDF_HASH;
    static final String CONTENT_HASH_GLOBAL = RetrievalFilter.FIELD_CONTENT_HASH_GLOBAL;
    static final String CONTENT_HASH = RetrievalFilter.FIELD_CONTENT_HASH;
    static final String CHUNK_TYPE = RetrievalFilter.FIELD_CHUNK_TYPE;
    static final String QUALITY_SCORE = "quality_score";
    static final String WORD_COUNT = "word_count";
    static final String CHAR_COUNT = "char_count";
    static final String PAGE_NUMBER = "page_number";
    static final String EMBEDDING = "embedding";

    /** Keyword fields indexed for filtering. */
    static final List<String> KEYWORD_FIELDS =
            List.of(SOURCE, FILE_PATH, PDF_HASH, CONTENT_HASH_GLOBAL, CONTENT_HASH, CHUNK_TYPE);

    private QdrantPayloadCodec() {}

    static Map<String, Value> toPayload(DocumentChunk chunk, float[] embedding) {
        ChunkMetadata metadata = chunk.metadata();
        Map<String, Value> payload = new LinkedHashMap<>();
        payload.put(TEXT, value(chunk.text()));
        payload.put(SOURCE, value(metadata.source()));
        payload.put(FILE_PATH, value(metadata.filePath()));
        putIfPresent(payload, PDF_HASH, metadata.pdfHash());
        putIfPresent(payload, CONTENT_HASH_GLOBAL, metadata.contentHashGlobal());
        payload.put(CONTENT_HASH, value(metadata.contentHash()));
        payload.put(CHUNK_TYPE, value(metadata.chunkType().wireName()));
        payload.put(QUALITY_SCORE, value(metadata.qualityScore()));
        payload.put(WORD_COUNT, value((long) metadata.wordCount()));
        payload.put(CHAR_COUNT, value((long) metadata.charCount()));
        if (metadata.pageNumber() != null) {
            payload.put(PAGE_NUMBER, value((long) metadata.pageNumber()));
        }
        List<Value> components = new ArrayList<>(embedding.length);
        for (float component : embedding) {
            components.add(value((double) component));
        }
        payload.put(EMBEDDING, list(components));
        return payload;
    }

    static DocumentChunk fromPayload(Map<String, Value> payload) {
        ChunkMetadata metadata = new ChunkMetadata(
                stringField(payload, SOURCE),
                stringField(payload, FILE_PATH),
                nullableString(payload, PDF_HASH),
                nullableString(payload, CONTENT_HASH_GLOBAL),
                stringField(payload, CONTENT_HASH),
                ChunkType.fromWireName(stringField(payload, CHUNK_TYPE)),
                clampUnit(doubleField(payload, QUALITY_SCORE)),
                (int) longField(payload, WORD_COUNT),
                (int) longField(payload, CHAR_COUNT),
                payload.containsKey(PAGE_NUMBER) ? Integer.valueOf((int) longField(payload, PAGE_NUMBER)) : null);
        return new DocumentChunk(stringField(payload, TEXT), metadata, embeddingField(payload));
    }

    private static void putIfPresent(Map<String, Value> payload, String key, String fieldValue) {
        if (fieldValue != null && !fieldValue.isBlank()) {
            payload.put(key, value(fieldValue));
        }
    }

    private static String stringField(Map<String, Value> payload, String key) {
        String fieldValue = nullableString(payload, key);
        return fieldValue == null ? "" : fieldValue;
    }

    private static String nullableString(Map<String, Value> payload, String key) {
        Value payloadValue = payload.get(key);
        if (payloadValue == null || payloadValue.getKindCase() != Value.KindCase.STRING_VALUE) {
            return null;
        }
        return payloadValue.getStringValue();
    }

    private static long longField(Map<String, Value> payload, String key) {
        Value payloadValue = payload.get(key);
        if (payloadValue == null) {
            return 0L;
        }
        return switch (payloadValue.getKindCase()) {
            case INTEGER_VALUE -> payloadValue.getIntegerValue();
            case DOUBLE_VALUE -> (long) payloadValue.getDoubleValue();
            default -> 0L;
        };
    }

    private static double doubleField(Map<String, Value> payload, String key) {
        Value payloadValue = payload.get(key);
        if (payloadValue == null) {
            return 0.0;
        }
        return switch (payloadValue.getKindCase()) {
            case DOUBLE_VALUE -> payloadValue.getDoubleValue();
            case INTEGER_VALUE -> payloadValue.getIntegerValue();
            default -> 0.0;
        };
    }

    private static float[] embeddingField(Map<String, Value> payload) {
        Value payloadValue = payload.get(EMBEDDING);
        if (payloadValue == null || payloadValue.getKindCase() != Value.KindCase.LIST_VALUE) {
            return null;
        }
        ListValue components = payloadValue.getListValue();
        float[] vector = new float[components.getValuesCount()];
        for (int i = 0; i < vector.length; i++) {
            Value component = components.getValues(i);
            vector[i] = component.getKindCase() == Value.KindCase.INTEGER_VALUE
                    ? component.getIntegerValue()
                    : (float) component.getDoubleValue();
        }
        return vector;
    }

    private static double clampUnit(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }
}
