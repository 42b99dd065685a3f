package com.williamcallahan.pdfrag.service.ingestion;

import com.williamcallahan.pdfrag.config.AppProperties;
import com.williamcallahan.pdfrag.domain.DocumentChunk;
import com.williamcallahan.pdfrag.domain.PageText;
import com.williamcallahan.pdfrag.domain.SourceDocument;
import com.williamcallahan.pdfrag.domain.ingestion.IngestionResult;
import com.williamcallahan.pdfrag.domain.retrieval.RetrievalFilter;
import com.williamcallahan.pdfrag.service.ContentHasher;
import com.williamcallahan.pdfrag.service.DocumentTextExtractor;
import com.williamcallahan.pdfrag.service.chunking.DocumentChunker;
import com.williamcallahan.pdfrag.service.embedding.EmbeddingClient;
import com.williamcallahan.pdfrag.service.index.VectorIndex;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Ingests PDF documents into the vector index.
 *
 * <p>Per document: extract pages, hash the file bytes and the normalized text, skip documents whose
 * text or bytes are already indexed (unless forced, in which case the old chunks are removed first),
 * chunk, embed, drop near-duplicate chunks and upload in batches. Every outcome is reported as an
 * {@link IngestionResult}; failures never escape {@link #ingestDocument(Path, boolean)}.</p>
 */
@Service
public class DocumentIngestionService {
    private static final Logger log = LoggerFactory.getLogger(DocumentIngestionService.class);
    private static final Logger INDEXING_LOG = LoggerFactory.getLogger("INDEXING");

    private final DocumentTextExtractor textExtractor;
    private final DocumentChunker chunker;
    private final ContentHasher contentHasher;
    private final EmbeddingClient embeddingClient;
    private final VectorIndex vectorIndex;
    private final ApplicationEventPublisher eventPublisher;
    private final ChunkDeduplicator deduplicator;
    private final int uploadBatchSize;
    private final int workers;

    public DocumentIngestionService(
            DocumentTextExtractor textExtractor,
            DocumentChunker chunker,
            ContentHasher contentHasher,
            EmbeddingClient embeddingClient,
            VectorIndex vectorIndex,
            ApplicationEventPublisher eventPublisher,
            AppProperties appProperties) {
        this.textExtractor = Objects.requireNonNull(textExtractor, "textExtractor");
        this.chunker = Objects.requireNonNull(chunker, "chunker");
        this.contentHasher = Objects.requireNonNull(contentHasher, "contentHasher");
        this.embeddingClient = Objects.requireNonNull(embeddingClient, "embeddingClient");
        this.vectorIndex = Objects.requireNonNull(vectorIndex, "vectorIndex");
        this.eventPublisher = Objects.requireNonNull(eventPublisher, "eventPublisher");
        AppProperties.Ingestion ingestion = appProperties.getIngestion();
        this.deduplicator = new ChunkDeduplicator(ingestion.getDedupThreshold());
        this.uploadBatchSize = ingestion.getUploadBatchSize();
        this.workers = ingestion.getWorkers();
    }

    /**
     * Ingests one document.
     *
     * @param document PDF file
     * @param forceUpdate re-ingest even when the content or file is already indexed
     * @return outcome; never null
     */
    public IngestionResult ingestDocument(Path document, boolean forceUpdate) {
        Objects.requireNonNull(document, "document");
        String filename = document.getFileName() == null ? document.toString() : document.getFileName().toString();
        long startMillis = System.currentTimeMillis();
        IndexChanges changes = new IndexChanges();
        try {
            if (!Files.isRegularFile(document)) {
                INDEXING_LOG.warn("[INDEXING] File not found: {}", document);
                return IngestionResult.error(filename, "File not found: " + document);
            }
            List<PageText> pages = textExtractor.extractPages(document);
            String fullText = chunker.cleanedFullText(pages);
            if (fullText.isBlank()) {
                INDEXING_LOG.warn("[INDEXING] No extractable text in {}", filename);
                return IngestionResult.error(filename, "No extractable text");
            }

            String contentHashGlobal = contentHasher.hashNormalizedText(fullText);
            String pdfHash = contentHasher.hashFile(document);
            RetrievalFilter byContent = RetrievalFilter.of(RetrievalFilter.FIELD_CONTENT_HASH_GLOBAL, contentHashGlobal);
            RetrievalFilter byFile = RetrievalFilter.of(RetrievalFilter.FIELD_PDF_HASH, pdfHash);

            if (forceUpdate) {
                changes.removed += vectorIndex.delete(byContent);
                changes.removed += vectorIndex.delete(byFile);
                if (changes.removed > 0) {
                    INDEXING_LOG.info("[INDEXING] Force update of {}: removed {} existing chunks", filename,
                            changes.removed);
                }
            } else if (vectorIndex.count(byContent) > 0) {
                INDEXING_LOG.info("[INDEXING] Skipping {}: content already indexed", filename);
                return IngestionResult.skipped(filename, IngestionResult.REASON_DUPLICATE_CONTENT);
            } else if (vectorIndex.count(byFile) > 0) {
                INDEXING_LOG.info("[INDEXING] Skipping {}: file already indexed", filename);
                return IngestionResult.skipped(filename, IngestionResult.REASON_DUPLICATE_FILE);
            }

            List<DocumentChunk> chunks = new ArrayList<>();
            for (DocumentChunk chunk : chunker.chunk(filename, document.toAbsolutePath().toString(), pages)) {
                chunks.add(chunk.withMetadata(chunk.metadata().withDocumentHashes(pdfHash, contentHashGlobal)));
            }
            if (chunks.isEmpty()) {
                notifyIfChanged(changes.total(), filename, "force_update");
                INDEXING_LOG.warn("[INDEXING] No chunks survived filtering for {}", filename);
                return IngestionResult.error(filename, "No chunks produced");
            }

            List<float[]> vectors = embeddingClient.embedBatch(chunks.stream().map(DocumentChunk::text).toList());
            List<DocumentChunk> embedded = new ArrayList<>(chunks.size());
            for (int i = 0; i < chunks.size(); i++) {
                embedded.add(chunks.get(i).withEmbedding(vectors.get(i)));
            }
            List<DocumentChunk> unique = deduplicator.deduplicate(embedded);

            upload(unique, changes);
            notifyIfChanged(changes.total(), filename, "ingest");

            INDEXING_LOG.info("[INDEXING] ✔ Completed {}: {}/{} unique chunks added in {}ms",
                    filename, changes.added, chunks.size(), System.currentTimeMillis() - startMillis);
            return IngestionResult.success(filename, chunks.size(), unique.size(), (int) changes.added);
        } catch (IOException | RuntimeException e) {
            // Deletes and committed batches are not rolled back.
            notifyIfChanged(changes.total(), filename, "ingest_failed");
            INDEXING_LOG.error("[INDEXING] ✗ Failed to ingest {}: {}", filename, e.getMessage());
            log.error("Processing error details:", e);
            return IngestionResult.error(filename, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    /**
     * Ingests every {@code .pdf} file directly inside a directory, in file name order.
     *
     * @param directory folder to scan
     * @param parallel process files on the configured worker pool
     * @param forceUpdate passed to each document
     * @return one result per file, in file name order
     * @throws IOException when the directory cannot be listed
     */
    public List<IngestionResult> ingestDirectory(Path directory, boolean parallel, boolean forceUpdate)
            throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Document directory does not exist: " + directory);
        }
        List<SourceDocument> documents = listDocuments(directory);
        INDEXING_LOG.info("[INDEXING] Found {} PDF files in {}", documents.size(), directory);
        if (!parallel || workers <= 1 || documents.size() <= 1) {
            List<IngestionResult> results = new ArrayList<>(documents.size());
            for (SourceDocument document : documents) {
                results.add(ingestDocument(document.storagePath(), forceUpdate));
            }
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(workers, documents.size()));
        try {
            List<Future<IngestionResult>> futures = new ArrayList<>(documents.size());
            for (SourceDocument document : documents) {
                futures.add(executor.submit(() -> ingestDocument(document.storagePath(), forceUpdate)));
            }
            List<IngestionResult> results = new ArrayList<>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                results.add(awaitResult(futures.get(i), documents.get(i)));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Removes every chunk whose source is the given file name.
     *
     * @return number of chunks removed
     */
    public long deleteDocument(String filename) {
        long removed = vectorIndex.delete(RetrievalFilter.bySource(filename));
        INDEXING_LOG.info("[INDEXING] Deleted {} chunks for {}", removed, filename);
        notifyIfChanged(removed, filename, "delete");
        return removed;
    }

    /**
     * Removes every chunk from the index.
     *
     * @return number of chunks removed
     */
    public long clearIndex() {
        long removed = vectorIndex.delete(RetrievalFilter.none());
        INDEXING_LOG.info("[INDEXING] Cleared index ({} chunks)", removed);
        eventPublisher.publishEvent(new IndexChangedEvent("clear", ""));
        return removed;
    }

    private void upload(List<DocumentChunk> chunks, IndexChanges changes) {
        for (int start = 0; start < chunks.size(); start += uploadBatchSize) {
            List<DocumentChunk> batch = chunks.subList(start, Math.min(start + uploadBatchSize, chunks.size()));
            vectorIndex.add(batch, batch.stream().map(DocumentChunk::embedding).toList());
            changes.added += batch.size();
        }
    }

    private void notifyIfChanged(long changedChunks, String filename, String reason) {
        if (changedChunks > 0) {
            eventPublisher.publishEvent(new IndexChangedEvent(reason, filename));
        }
    }

    /** Chunks removed and committed so far by one ingestion run. */
    private static final class IndexChanges {
        private long removed;
        private long added;

        long total() {
            return removed + added;
        }
    }

    private IngestionResult awaitResult(Future<IngestionResult> future, SourceDocument document) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return IngestionResult.error(document.name(), "Interrupted");
        } catch (ExecutionException e) {
            log.error("Ingestion worker failed for {}", document.name(), e.getCause());
            return IngestionResult.error(document.name(), String.valueOf(e.getCause()));
        }
    }

    private static List<SourceDocument> listDocuments(Path directory) throws IOException {
        try (Stream<Path> paths = Files.list(directory)) {
            List<SourceDocument> documents = new ArrayList<>();
            for (Path path : paths
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf"))
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList()) {
                documents.add(new SourceDocument(path.getFileName().toString(), Files.size(path), path));
            }
            return documents;
        }
    }
}
