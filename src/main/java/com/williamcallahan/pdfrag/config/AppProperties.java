package com.williamcallahan.pdfrag.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Binds every {@code app.*} setting used by ingestion, embedding, caching and retrieval.
 *
 * <p>Defaults mirror the values the pipeline was tuned with; {@link #validateConfiguration()} runs
 * once the binder has populated the instance and rejects combinations the components cannot honor.</p>
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Rag rag = new Rag();
    private Ingestion ingestion = new Ingestion();
    private Embeddings embeddings = new Embeddings();
    private RemoteEmbedding remoteEmbedding = new RemoteEmbedding();
    private Cache cache = new Cache();
    private Qdrant qdrant = new Qdrant();

    public Rag getRag() {
        return rag;
    }

    public void setRag(Rag rag) {
        this.rag = rag;
    }

    public Ingestion getIngestion() {
        return ingestion;
    }

    public void setIngestion(Ingestion ingestion) {
        this.ingestion = ingestion;
    }

    public Embeddings getEmbeddings() {
        return embeddings;
    }

    public void setEmbeddings(Embeddings embeddings) {
        this.embeddings = embeddings;
    }

    public RemoteEmbedding getRemoteEmbedding() {
        return remoteEmbedding;
    }

    public void setRemoteEmbedding(RemoteEmbedding remoteEmbedding) {
        this.remoteEmbedding = remoteEmbedding;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Qdrant getQdrant() {
        return qdrant;
    }

    public void setQdrant(Qdrant qdrant) {
        this.qdrant = qdrant;
    }

    /**
     * Rejects settings that would make chunking, embedding or ranking ill-defined.
     *
     * @throws IllegalArgumentException when a setting is out of range
     */
    @PostConstruct
    public void validateConfiguration() {
        requirePositive(rag.getChunkSize(), "app.rag.chunk-size");
        requireNonNegative(rag.getChunkOverlap(), "app.rag.chunk-overlap");
        if (rag.getChunkOverlap() >= rag.getChunkSize()) {
            throw new IllegalArgumentException("app.rag.chunk-overlap must be smaller than app.rag.chunk-size");
        }
        requireNonNegative(rag.getMinChunkLength(), "app.rag.min-chunk-length");
        requireUnitInterval(rag.getQualityFloor(), "app.rag.quality-floor");
        requireUnitInterval(rag.getSentenceTrimRatio(), "app.rag.sentence-trim-ratio");
        requirePositive(rag.getSearchMultiplier(), "app.rag.search-multiplier");
        requirePositive(rag.getSearchCandidateCap(), "app.rag.search-candidate-cap");
        requirePositive(rag.getSearchTimeout(), "app.rag.search-timeout");
        requireUnitInterval(rag.getSearchScoreThreshold(), "app.rag.search-score-threshold");
        requireUnitInterval(rag.getMmrLambda(), "app.rag.mmr-lambda");
        if (rag.getPdfBoost() <= 0) {
            throw new IllegalArgumentException("app.rag.pdf-boost must be positive");
        }
        requireUnitInterval(rag.getGatingThreshold(), "app.rag.gating-threshold");
        requirePositive(rag.getCentroidPageSize(), "app.rag.centroid-page-size");
        requirePositive(rag.getPreviewLength(), "app.rag.preview-length");

        requirePositive(ingestion.getUploadBatchSize(), "app.ingestion.upload-batch-size");
        requirePositive(ingestion.getWorkers(), "app.ingestion.workers");
        requireUnitInterval(ingestion.getDedupThreshold(), "app.ingestion.dedup-threshold");

        requirePositive(embeddings.getDimensions(), "app.embeddings.dimensions");
        requirePositive(embeddings.getBatchSize(), "app.embeddings.batch-size");
        requirePositive(embeddings.getMaxAttempts(), "app.embeddings.max-attempts");
        requirePositive(embeddings.getInitialBackoff(), "app.embeddings.initial-backoff");
        if (embeddings.getMaxBackoff().compareTo(embeddings.getInitialBackoff()) < 0) {
            throw new IllegalArgumentException("app.embeddings.max-backoff must not be below initial-backoff");
        }
        requirePositive(embeddings.getCacheTtl(), "app.embeddings.cache-ttl");
        if (embeddings.getModelId() == null || embeddings.getModelId().isBlank()) {
            throw new IllegalArgumentException("app.embeddings.model-id must be set");
        }

        requirePositive(cache.getMaxEntries(), "app.cache.max-entries");
        requirePositive(cache.getDefaultTtl(), "app.cache.default-ttl");
        requirePositive(cache.getRetrievalTtl(), "app.cache.retrieval-ttl");

        requirePositive(qdrant.getPort(), "app.qdrant.port");
        requirePositive(qdrant.getOperationTimeout(), "app.qdrant.operation-timeout");
        if (qdrant.getCollection() == null || qdrant.getCollection().isBlank()) {
            throw new IllegalArgumentException("app.qdrant.collection must be set");
        }
    }

    private static void requirePositive(int value, String key) {
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive, got " + value);
        }
    }

    private static void requireNonNegative(int value, String key) {
        if (value < 0) {
            throw new IllegalArgumentException(key + " must not be negative, got " + value);
        }
    }

    private static void requirePositive(Duration value, String key) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(key + " must be a positive duration, got " + value);
        }
    }

    private static void requireUnitInterval(double value, String key) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(key + " must be within [0, 1], got " + value);
        }
    }

    /** Chunking and retrieval tuning. */
    public static class Rag {
        private int chunkSize = 700;
        private int chunkOverlap = 150;
        private int minChunkLength = 100;
        private double qualityFloor = 0.3;
        private double sentenceTrimRatio = 0.7;
        private int defaultK = 4;
        private int searchMultiplier = 3;
        private int searchCandidateCap = 20;
        private Duration searchTimeout = Duration.ofSeconds(5);
        private double searchScoreThreshold = 0.3;
        private boolean semanticRerank = true;
        private boolean mmrEnabled = true;
        private double mmrLambda = 0.5;
        private double pdfBoost = 1.5;
        private double gatingThreshold = 0.20;
        private int centroidPageSize = 1000;
        private int previewLength = 300;

        public int getChunkSize() { return chunkSize; }
        public void setChunkSize(int chunkSize) { this.chunkSize = chunkSize; }

        public int getChunkOverlap() { return chunkOverlap; }
        public void setChunkOverlap(int chunkOverlap) { this.chunkOverlap = chunkOverlap; }

        public int getMinChunkLength() { return minChunkLength; }
        public void setMinChunkLength(int minChunkLength) { this.minChunkLength = minChunkLength; }

        public double getQualityFloor() { return qualityFloor; }
        public void setQualityFloor(double qualityFloor) { this.qualityFloor = qualityFloor; }

        public double getSentenceTrimRatio() { return sentenceTrimRatio; }
        public void setSentenceTrimRatio(double sentenceTrimRatio) { this.sentenceTrimRatio = sentenceTrimRatio; }

        public int getDefaultK() { return defaultK; }
        public void setDefaultK(int defaultK) { this.defaultK = defaultK; }

        public int getSearchMultiplier() { return searchMultiplier; }
        public void setSearchMultiplier(int searchMultiplier) { this.searchMultiplier = searchMultiplier; }

        public int getSearchCandidateCap() { return searchCandidateCap; }
        public void setSearchCandidateCap(int searchCandidateCap) { this.searchCandidateCap = searchCandidateCap; }

        public Duration getSearchTimeout() { return searchTimeout; }
        public void setSearchTimeout(Duration searchTimeout) { this.searchTimeout = searchTimeout; }

        public double getSearchScoreThreshold() { return searchScoreThreshold; }
        public void setSearchScoreThreshold(double searchScoreThreshold) { this.searchScoreThreshold = searchScoreThreshold; }

        public boolean isSemanticRerank() { return semanticRerank; }
        public void setSemanticRerank(boolean semanticRerank) { this.semanticRerank = semanticRerank; }

        public boolean isMmrEnabled() { return mmrEnabled; }
        public void setMmrEnabled(boolean mmrEnabled) { this.mmrEnabled = mmrEnabled; }

        public double getMmrLambda() { return mmrLambda; }
        public void setMmrLambda(double mmrLambda) { this.mmrLambda = mmrLambda; }

        public double getPdfBoost() { return pdfBoost; }
        public void setPdfBoost(double pdfBoost) { this.pdfBoost = pdfBoost; }

        public double getGatingThreshold() { return gatingThreshold; }
        public void setGatingThreshold(double gatingThreshold) { this.gatingThreshold = gatingThreshold; }

        public int getCentroidPageSize() { return centroidPageSize; }
        public void setCentroidPageSize(int centroidPageSize) { this.centroidPageSize = centroidPageSize; }

        public int getPreviewLength() { return previewLength; }
        public void setPreviewLength(int previewLength) { this.previewLength = previewLength; }
    }

    /** Document ingestion settings. */
    public static class Ingestion {
        private int uploadBatchSize = 100;
        private int workers = 4;
        private double dedupThreshold = 0.95;

        public int getUploadBatchSize() { return uploadBatchSize; }
        public void setUploadBatchSize(int uploadBatchSize) { this.uploadBatchSize = uploadBatchSize; }

        public int getWorkers() { return workers; }
        public void setWorkers(int workers) { this.workers = workers; }

        public double getDedupThreshold() { return dedupThreshold; }
        public void setDedupThreshold(double dedupThreshold) { this.dedupThreshold = dedupThreshold; }
    }

    public static class Embeddings {
        private boolean mockMode = false;
        private String modelId = "text-embedding-3-small";
        private int dimensions = 1536;
        private int batchSize = 32;
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(8);
        private Duration cacheTtl = Duration.ofHours(1);

        public boolean isMockMode() { return mockMode; }
        public void setMockMode(boolean mockMode) { this.mockMode = mockMode; }

        public String getModelId() { return modelId; }
        public void setModelId(String modelId) { this.modelId = modelId; }

        public int getDimensions() { return dimensions; }
        public void setDimensions(int dimensions) { this.dimensions = dimensions; }

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }

        public Duration getMaxBackoff() { return maxBackoff; }
        public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }

        public Duration getCacheTtl() { return cacheTtl; }
        public void setCacheTtl(Duration cacheTtl) { this.cacheTtl = cacheTtl; }
    }

    /** OpenAI-compatible endpoint used when mock mode is off. */
    public static class RemoteEmbedding {
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey = "";

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    }

    public static class Cache {
        private int maxEntries = 1000;
        private Duration defaultTtl = Duration.ofMinutes(5);
        private Duration retrievalTtl = Duration.ofHours(1);

        public int getMaxEntries() { return maxEntries; }
        public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }

        public Duration getDefaultTtl() { return defaultTtl; }
        public void setDefaultTtl(Duration defaultTtl) { this.defaultTtl = defaultTtl; }

        public Duration getRetrievalTtl() { return retrievalTtl; }
        public void setRetrievalTtl(Duration retrievalTtl) { this.retrievalTtl = retrievalTtl; }
    }

    /** Qdrant gRPC connection and collection settings. */
    public static class Qdrant {
        private String host = "localhost";
        private int port = 6334;
        private boolean useTls = false;
        private String apiKey = "";
        private String collection = "pdf_chunks";
        private boolean initializeCollection = true;
        private Duration operationTimeout = Duration.ofSeconds(30);

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public boolean isUseTls() { return useTls; }
        public void setUseTls(boolean useTls) { this.useTls = useTls; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getCollection() { return collection; }
        public void setCollection(String collection) { this.collection = collection; }

        public boolean isInitializeCollection() { return initializeCollection; }
        public void setInitializeCollection(boolean initializeCollection) { this.initializeCollection = initializeCollection; }

        public Duration getOperationTimeout() { return operationTimeout; }
        public void setOperationTimeout(Duration operationTimeout) { this.operationTimeout = operationTimeout; }
    }
}
