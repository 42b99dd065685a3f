package com.williamcallahan.pdfrag.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.pdfrag.service.cache.CacheService;
import com.williamcallahan.pdfrag.service.cache.InMemoryCacheBackend;
import com.williamcallahan.pdfrag.service.retrieval.RetrievalCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shared cache used by the embedding client and the retrieval engine; closed with the context.
 */
@Configuration
public class CacheConfig {
    private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

    @Bean(destroyMethod = "close")
    public CacheService cacheService(AppProperties appProperties) {
        AppProperties.Cache cache = appProperties.getCache();
        log.info("[CACHE] In-memory cache: maxEntries={}, defaultTtl={}", cache.getMaxEntries(), cache.getDefaultTtl());
        return new CacheService(new InMemoryCacheBackend(cache.getMaxEntries()), cache.getDefaultTtl());
    }

    @Bean
    public RetrievalCache retrievalCache(CacheService cacheService, ObjectMapper objectMapper, AppProperties appProperties) {
        return new RetrievalCache(cacheService, objectMapper, appProperties.getCache().getRetrievalTtl());
    }
}
