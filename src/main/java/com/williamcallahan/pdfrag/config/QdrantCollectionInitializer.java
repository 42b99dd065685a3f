package com.williamcallahan.pdfrag.config;

import io.qdrant.client.QdrantClient;
import io.qdrant.client.grpc.Collections.Distance;
import io.qdrant.client.grpc.Collections.PayloadSchemaType;
import io.qdrant.client.grpc.Collections.VectorParams;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Creates the chunk collection (cosine distance) and its keyword payload indexes once the application
 * is ready. Failures are logged and startup continues; later index calls surface the problem.
 */
@Component
public class QdrantCollectionInitializer {
    private static final Logger log = LoggerFactory.getLogger(QdrantCollectionInitializer.class);
    private static final long GRPC_TIMEOUT_SECONDS = 30;
    private static final List<String> KEYWORD_FIELDS =
            List.of("source", "file_path", "pdf_hash", "content_hash_global", "content_hash", "chunk_type");

    private final QdrantClient qdrantClient;
    private final AppProperties appProperties;

    public QdrantCollectionInitializer(QdrantClient qdrantClient, AppProperties appProperties) {
        this.qdrantClient = qdrantClient;
        this.appProperties = appProperties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void ensureCollection() {
        if (!appProperties.getQdrant().isInitializeCollection()) {
            return;
        }
        String collection = appProperties.getQdrant().getCollection();
        int dimensions = appProperties.getEmbeddings().getDimensions();
        try {
            Boolean exists = qdrantClient.collectionExistsAsync(collection).get(GRPC_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!Boolean.TRUE.equals(exists)) {
                VectorParams params = VectorParams.newBuilder()
                        .setSize(dimensions)
                        .setDistance(Distance.Cosine)
                        .build();
                qdrantClient.createCollectionAsync(collection, params).get(GRPC_TIMEOUT_SECONDS, TimeUnit.SECONDS);
                log.info("[QDRANT] Created collection '{}' (dimensions={}, distance=cosine)", collection, dimensions);
            }
            for (String field : KEYWORD_FIELDS) {
                qdrantClient
                        .createPayloadIndexAsync(collection, field, PayloadSchemaType.Keyword, null, true, null, null)
                        .get(GRPC_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            }
            log.info("[QDRANT] Ensured {} payload indexes on '{}'", KEYWORD_FIELDS.size(), collection);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            log.warn("[QDRANT] Collection initialization interrupted");
        } catch (ExecutionException | TimeoutException failure) {
            log.warn("[QDRANT] Unable to ensure collection '{}' (will continue): {}", collection, failure.getMessage());
        }
    }
}
