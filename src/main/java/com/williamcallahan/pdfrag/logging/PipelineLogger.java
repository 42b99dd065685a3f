package com.williamcallahan.pdfrag.logging;

import com.williamcallahan.pdfrag.domain.ingestion.IngestionResult;
import java.util.Collection;
import java.util.concurrent.atomic.AtomicLong;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Logs every step of the ingestion and retrieval pipelines on the {@code PIPELINE} logger,
 * tagging each call with a per-thread request id.
 */
@Aspect
@Component
public class PipelineLogger {
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");
    private static final AtomicLong SEQUENCE = new AtomicLong();

    private static final ThreadLocal<String> REQUEST_ID = ThreadLocal.withInitial(() ->
            "REQ-" + System.currentTimeMillis() + "-" + SEQUENCE.incrementAndGet());

    /**
     * Log document ingestion
     */
    @Around("execution(* com.williamcallahan.pdfrag.service.ingestion.DocumentIngestionService.ingestDocument(..))")
    public Object logIngestion(ProceedingJoinPoint joinPoint) throws Throwable {
        return logStep(joinPoint, "STEP 1: DOCUMENT INGESTION");
    }

    /**
     * Log embedding generation
     */
    @Around("execution(* com.williamcallahan.pdfrag.service.embedding.EmbeddingClient+.embedBatch(..))")
    public Object logEmbeddingGeneration(ProceedingJoinPoint joinPoint) throws Throwable {
        Object[] args = joinPoint.getArgs();
        if (args.length > 0 && args[0] instanceof Collection<?> inputs) {
            PIPELINE_LOG.debug("[{}] Embedding {} inputs", REQUEST_ID.get(), inputs.size());
        }
        return logStep(joinPoint, "STEP 2: EMBEDDING GENERATION");
    }

    /**
     * Log RAG retrieval
     */
    @Around("execution(* com.williamcallahan.pdfrag.service.retrieval.RetrievalService.retrieve*(..))")
    public Object logRetrieval(ProceedingJoinPoint joinPoint) throws Throwable {
        return logStep(joinPoint, "STEP 3: RAG RETRIEVAL");
    }

    /**
     * Log RAG gating
     */
    @Around("execution(* com.williamcallahan.pdfrag.service.retrieval.RetrievalService.gatingDecision(..))")
    public Object logGating(ProceedingJoinPoint joinPoint) throws Throwable {
        return logStep(joinPoint, "STEP 4: RAG GATING");
    }

    private Object logStep(ProceedingJoinPoint joinPoint, String step) throws Throwable {
        String requestId = REQUEST_ID.get();
        long startTime = System.currentTimeMillis();
        PIPELINE_LOG.info("[{}] {} - Starting", requestId, step);
        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;
            PIPELINE_LOG.info("[{}] {} - Completed in {}ms{}", requestId, step, duration, describe(result));
            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] {} - Failed: {}", requestId, step, e.getMessage());
            throw e;
        }
    }

    private static String describe(Object result) {
        if (result instanceof Collection<?> items) {
            return " (" + items.size() + " items)";
        }
        if (result instanceof IngestionResult ingestion) {
            return " (" + ingestion.status().wireName() + ")";
        }
        return "";
    }
}
