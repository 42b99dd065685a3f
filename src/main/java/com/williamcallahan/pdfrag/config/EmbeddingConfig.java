package com.williamcallahan.pdfrag.config;

import com.williamcallahan.pdfrag.service.ContentHasher;
import com.williamcallahan.pdfrag.service.cache.CacheService;
import com.williamcallahan.pdfrag.service.embedding.CachingEmbeddingClient;
import com.williamcallahan.pdfrag.service.embedding.EmbeddingClient;
import com.williamcallahan.pdfrag.service.embedding.MockEmbeddingClient;
import com.williamcallahan.pdfrag.service.embedding.OpenAiCompatibleEmbeddingProvider;
import com.williamcallahan.pdfrag.support.RetrySupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the embedding client: offline zero vectors in mock mode, otherwise the cached,
 * retrying client over an OpenAI-compatible provider.
 */
@Configuration
public class EmbeddingConfig {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingConfig.class);

    @Bean
    @ConditionalOnProperty(name = "app.embeddings.mock-mode", havingValue = "true")
    public EmbeddingClient mockEmbeddingClient(AppProperties appProperties) {
        return new MockEmbeddingClient(appProperties.getEmbeddings().getDimensions());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "app.embeddings.mock-mode", havingValue = "false", matchIfMissing = true)
    public OpenAiCompatibleEmbeddingProvider openAiCompatibleEmbeddingProvider(AppProperties appProperties) {
        AppProperties.RemoteEmbedding remote = appProperties.getRemoteEmbedding();
        AppProperties.Embeddings embeddings = appProperties.getEmbeddings();
        if (remote.getApiKey() == null || remote.getApiKey().isBlank()) {
            throw new IllegalStateException(
                    "app.remote-embedding.api-key is required unless app.embeddings.mock-mode=true");
        }
        log.info("[EMBEDDING] Remote provider {} model={} dimensions={}",
                remote.getBaseUrl(), embeddings.getModelId(), embeddings.getDimensions());
        return OpenAiCompatibleEmbeddingProvider.create(
                remote.getBaseUrl(), remote.getApiKey(), embeddings.getModelId(), embeddings.getDimensions());
    }

    @Bean
    @ConditionalOnProperty(name = "app.embeddings.mock-mode", havingValue = "false", matchIfMissing = true)
    public EmbeddingClient cachingEmbeddingClient(
            OpenAiCompatibleEmbeddingProvider provider,
            CacheService cacheService,
            ContentHasher contentHasher,
            AppProperties appProperties) {
        AppProperties.Embeddings embeddings = appProperties.getEmbeddings();
        RetrySupport.RetryPolicy policy = new RetrySupport.RetryPolicy(
                embeddings.getMaxAttempts(), embeddings.getInitialBackoff(), embeddings.getMaxBackoff());
        return new CachingEmbeddingClient(
                provider, cacheService, contentHasher, embeddings.getBatchSize(), policy, embeddings.getCacheTtl());
    }
}
