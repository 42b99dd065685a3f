package com.williamcallahan.pdfrag.service.index;

import static io.qdrant.client.ConditionFactory.matchKeyword;
import static io.qdrant.client.PointIdFactory.id;
import static io.qdrant.client.QueryFactory.nearest;
import static io.qdrant.client.VectorsFactory.vectors;

import com.williamcallahan.pdfrag.config.AppProperties;
import com.williamcallahan.pdfrag.domain.DocumentChunk;
import com.williamcallahan.pdfrag.domain.ScoredChunk;
import com.williamcallahan.pdfrag.domain.retrieval.RetrievalFilter;
import com.williamcallahan.pdfrag.support.RetrySupport;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.grpc.Common.Filter;
import io.qdrant.client.grpc.Common.PointId;
import io.qdrant.client.grpc.Points.PointStruct;
import io.qdrant.client.grpc.Points.QueryPoints;
import io.qdrant.client.grpc.Points.RetrievedPoint;
import io.qdrant.client.grpc.Points.ScoredPoint;
import io.qdrant.client.grpc.Points.ScrollPoints;
import io.qdrant.client.grpc.Points.ScrollResponse;
import io.qdrant.client.grpc.Points.WithPayloadSelector;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * {@link VectorIndex} backed by a single Qdrant collection over gRPC.
 *
 * <p>Point ids are derived from the document and chunk hashes, so re-uploading the same chunk
 * overwrites it instead of duplicating it. Writes, deletes and counts are retried on transient
 * failures; searches are not, since they already run under the caller's timeout.</p>
 */
@Service
public class QdrantVectorIndex implements VectorIndex {
    private static final Logger log = LoggerFactory.getLogger(QdrantVectorIndex.class);

    private final QdrantClient qdrantClient;
    private final String collectionName;
    private final Duration operationTimeout;

    public QdrantVectorIndex(QdrantClient qdrantClient, AppProperties appProperties) {
        this(qdrantClient, appProperties.getQdrant().getCollection(), appProperties.getQdrant().getOperationTimeout());
    }

    QdrantVectorIndex(QdrantClient qdrantClient, String collectionName, Duration operationTimeout) {
        this.qdrantClient = Objects.requireNonNull(qdrantClient, "qdrantClient");
        this.collectionName = Objects.requireNonNull(collectionName, "collectionName");
        this.operationTimeout = Objects.requireNonNull(operationTimeout, "operationTimeout");
    }

    @Override
    public void add(List<DocumentChunk> chunks, List<float[]> embeddings) {
        Objects.requireNonNull(chunks, "chunks");
        Objects.requireNonNull(embeddings, "embeddings");
        if (chunks.size() != embeddings.size()) {
            throw new IllegalArgumentException(
                    "Chunk/embedding count mismatch: " + chunks.size() + " vs " + embeddings.size());
        }
        if (chunks.isEmpty()) {
            return;
        }
        List<PointStruct> points = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            DocumentChunk chunk = chunks.get(i);
            float[] embedding = Objects.requireNonNull(embeddings.get(i), "embedding");
            points.add(PointStruct.newBuilder()
                    .setId(id(pointId(chunk)))
                    .setVectors(vectors(embedding))
                    .putAllPayload(QdrantPayloadCodec.toPayload(chunk, embedding))
                    .build());
        }
        RetrySupport.executeWithRetry(
                () -> QdrantFutureAwaiter.awaitFuture(
                        qdrantClient.upsertAsync(collectionName, points), operationTimeout, "upsert"),
                "Qdrant upsert");
        log.info("[QDRANT] Upserted {} points into {}", points.size(), collectionName);
    }

    @Override
    public List<ScoredChunk> search(float[] queryEmbedding, int limit, RetrievalFilter filter, Duration timeout) {
        Objects.requireNonNull(queryEmbedding, "queryEmbedding");
        Objects.requireNonNull(timeout, "timeout");
        if (limit <= 0) {
            return List.of();
        }
        QueryPoints.Builder request = QueryPoints.newBuilder()
                .setCollectionName(collectionName)
                .setQuery(nearest(queryEmbedding))
                .setWithPayload(WithPayloadSelector.newBuilder().setEnable(true).build())
                .setLimit(limit);
        toQdrantFilter(filter).ifPresent(request::setFilter);

        List<ScoredPoint> scoredPoints =
                QdrantFutureAwaiter.awaitFuture(qdrantClient.queryAsync(request.build()), timeout, "search");
        List<ScoredChunk> results = new ArrayList<>(scoredPoints.size());
        for (ScoredPoint scoredPoint : scoredPoints) {
            results.add(new ScoredChunk(
                    QdrantPayloadCodec.fromPayload(scoredPoint.getPayloadMap()), scoredPoint.getScore()));
        }
        return results;
    }

    @Override
    public long delete(RetrievalFilter filter) {
        long matching = count(filter);
        if (matching == 0) {
            return 0;
        }
        Filter qdrantFilter = toQdrantFilter(filter).orElseGet(Filter::getDefaultInstance);
        RetrySupport.executeWithRetry(
                () -> QdrantFutureAwaiter.awaitFuture(
                        qdrantClient.deleteAsync(collectionName, qdrantFilter), operationTimeout, "delete"),
                "Qdrant delete");
        log.info("[QDRANT] Deleted {} points matching {}", matching, describe(filter));
        return matching;
    }

    @Override
    public long count(RetrievalFilter filter) {
        Filter qdrantFilter = toQdrantFilter(filter).orElseGet(Filter::getDefaultInstance);
        Long count = RetrySupport.executeWithRetry(
                () -> QdrantFutureAwaiter.awaitFuture(
                        qdrantClient.countAsync(collectionName, qdrantFilter, true), operationTimeout, "count"),
                "Qdrant count");
        return count == null ? 0L : count;
    }

    @Override
    public ScrollPage scroll(int limit, String offset) {
        ScrollPoints.Builder request = ScrollPoints.newBuilder()
                .setCollectionName(collectionName)
                .setLimit(limit)
                .setWithPayload(WithPayloadSelector.newBuilder().setEnable(true).build());
        if (offset != null && !offset.isBlank()) {
            request.setOffset(parsePointId(offset));
        }
        ScrollResponse response = RetrySupport.executeWithRetry(
                () -> QdrantFutureAwaiter.awaitFuture(
                        qdrantClient.scrollAsync(request.build()), operationTimeout, "scroll"),
                "Qdrant scroll");
        List<IndexedPoint> points = new ArrayList<>(response.getResultCount());
        for (RetrievedPoint retrievedPoint : response.getResultList()) {
            points.add(new IndexedPoint(
                    pointIdText(retrievedPoint.getId()), QdrantPayloadCodec.fromPayload(retrievedPoint.getPayloadMap())));
        }
        String nextOffset = response.hasNextPageOffset() ? pointIdText(response.getNextPageOffset()) : null;
        return new ScrollPage(points, nextOffset);
    }

    /**
     * Deterministic point id for a chunk: same document and chunk content, same id.
     */
    static UUID pointId(DocumentChunk chunk) {
        String documentKey = chunk.metadata().contentHashGlobal() != null
                ? chunk.metadata().contentHashGlobal()
                : chunk.metadata().source();
        String key = documentKey + ":" + chunk.metadata().contentHash();
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8));
    }

    static Optional<Filter> toQdrantFilter(RetrievalFilter filter) {
        if (filter == null || filter.isEmpty()) {
            return Optional.empty();
        }
        Filter.Builder builder = Filter.newBuilder();
        for (Map.Entry<String, String> entry : filter.fields().entrySet()) {
            builder.addMust(matchKeyword(entry.getKey(), entry.getValue()));
        }
        return Optional.of(builder.build());
    }

    private static PointId parsePointId(String offset) {
        if (offset.chars().allMatch(Character::isDigit)) {
            return id(Long.parseLong(offset));
        }
        return id(UUID.fromString(offset));
    }

    private static String pointIdText(PointId pointId) {
        return pointId.hasUuid() ? pointId.getUuid() : Long.toString(pointId.getNum());
    }

    private static String describe(RetrievalFilter filter) {
        return filter == null || filter.isEmpty() ? "{}" : filter.fields().toString();
    }
}
