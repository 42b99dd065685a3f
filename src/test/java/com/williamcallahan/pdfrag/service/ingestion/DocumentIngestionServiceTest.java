package com.williamcallahan.pdfrag.service.ingestion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.pdfrag.config.AppProperties;
import com.williamcallahan.pdfrag.domain.ChunkType;
import com.williamcallahan.pdfrag.domain.DocumentChunk;
import com.williamcallahan.pdfrag.domain.PageText;
import com.williamcallahan.pdfrag.domain.ScoredChunk;
import com.williamcallahan.pdfrag.domain.ingestion.IngestionResult;
import com.williamcallahan.pdfrag.domain.ingestion.IngestionStatus;
import com.williamcallahan.pdfrag.domain.retrieval.RetrievalFilter;
import com.williamcallahan.pdfrag.service.ContentHasher;
import com.williamcallahan.pdfrag.service.DocumentTextExtractor;
import com.williamcallahan.pdfrag.service.PdfContentExtractor;
import com.williamcallahan.pdfrag.service.TestPdfs;
import com.williamcallahan.pdfrag.service.cache.CacheService;
import com.williamcallahan.pdfrag.service.cache.InMemoryCacheBackend;
import com.williamcallahan.pdfrag.service.chunking.ChunkQualityScorer;
import com.williamcallahan.pdfrag.service.chunking.ChunkTypeDetector;
import com.williamcallahan.pdfrag.service.chunking.ChunkingSettings;
import com.williamcallahan.pdfrag.service.chunking.DocumentChunker;
import com.williamcallahan.pdfrag.service.chunking.TextCleaner;
import com.williamcallahan.pdfrag.service.chunking.TokenCounter;
import com.williamcallahan.pdfrag.service.embedding.BagOfWordsEmbeddingClient;
import com.williamcallahan.pdfrag.service.embedding.EmbeddingClient;
import com.williamcallahan.pdfrag.service.embedding.EmbeddingProviderException;
import com.williamcallahan.pdfrag.service.index.InMemoryVectorIndex;
import com.williamcallahan.pdfrag.service.index.VectorIndexException;
import com.williamcallahan.pdfrag.service.retrieval.CentroidGate;
import com.williamcallahan.pdfrag.service.retrieval.ContextFormatter;
import com.williamcallahan.pdfrag.service.retrieval.RetrievalCache;
import com.williamcallahan.pdfrag.service.retrieval.RetrievalService;
import com.williamcallahan.pdfrag.service.retrieval.SemanticReranker;
import com.williamcallahan.pdfrag.service.retrieval.TrivialQueryFilter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Verifies document-level deduplication, forced re-ingestion, index change notifications and the
 * PDF-to-retrieval round trip.
 */
class DocumentIngestionServiceTest {

    private static final String PUMP_PAGE = "The centrifugal pump must be primed before the first start. "
            + "Open the vent valve until water flows steadily from the casing.";
    private static final String BEARING_PAGE = "Bearings are greased every two thousand operating hours. "
            + "Use lithium complex grease and wipe excess lubricant from the housing.";
    private static final String SEAL_PAGE = "Mechanical seal replacement requires draining the casing completely. "
            + "Inspect the shaft sleeve for scoring before fitting the new seal.";

    private static final List<String> BEARING_LINES = List.of(
            "Bearings are greased every two thousand operating hours with lithium",
            "complex grease. Excess lubricant must be wiped from the housing, since",
            "overfilled bearings run hot and shorten the service life of the motor.");
    private static final String BEARING_QUERY = String.join(" ", BEARING_LINES);

    @TempDir
    Path tempDir;

    private DocumentTextExtractor textExtractor;
    private InMemoryVectorIndex vectorIndex;
    private BagOfWordsEmbeddingClient embeddingClient;
    private List<Object> publishedEvents;
    private DocumentIngestionService ingestionService;

    @BeforeEach
    void setUp() {
        textExtractor = mock(DocumentTextExtractor.class);
        vectorIndex = new InMemoryVectorIndex();
        embeddingClient = new BagOfWordsEmbeddingClient();
        publishedEvents = new ArrayList<>();
        ingestionService = newService(embeddingClient);
    }

    @Test
    void ingestDocument_indexesChunksStampedWithDocumentHashes() throws IOException {
        Path manual = writeDocument("pump-manual.pdf", List.of(PUMP_PAGE, BEARING_PAGE));

        IngestionResult result = ingestionService.ingestDocument(manual, false);

        assertEquals(IngestionStatus.SUCCESS, result.status());
        assertEquals(2, result.chunksAdded());
        assertEquals(2, vectorIndex.storedChunks().size());
        String expectedFileHash = new ContentHasher().hashFile(manual);
        for (DocumentChunk chunk : vectorIndex.storedChunks()) {
            assertEquals(expectedFileHash, chunk.metadata().pdfHash());
            assertFalse(chunk.metadata().contentHashGlobal().isBlank());
            assertEquals("pump-manual.pdf", chunk.metadata().source());
        }
        assertEquals(List.of(new IndexChangedEvent("ingest", "pump-manual.pdf")), publishedEvents);
    }

    @Test
    void ingestDocument_skipsSameTextUnderAnotherFile() throws IOException {
        ingestionService.ingestDocument(writeDocument("original.pdf", List.of(PUMP_PAGE)), false);
        Path renamedCopy = writeDocument("renamed.pdf", List.of("  " + PUMP_PAGE.toUpperCase() + "  "));

        IngestionResult result = ingestionService.ingestDocument(renamedCopy, false);

        assertEquals(IngestionStatus.SKIPPED, result.status());
        assertEquals(IngestionResult.REASON_DUPLICATE_CONTENT, result.reason());
        assertEquals(1, vectorIndex.storedChunks().size());
        assertEquals(1, publishedEvents.size());
    }

    @Test
    void ingestDocument_skipsSameBytesEvenWhenExtractedTextChanged() throws IOException {
        Path original = writeDocument("manual.pdf", List.of(PUMP_PAGE));
        ingestionService.ingestDocument(original, false);
        Path sameBytes = tempDir.resolve("manual-copy.pdf");
        Files.copy(original, sameBytes);
        when(textExtractor.extractPages(sameBytes)).thenReturn(List.of(new PageText(1, BEARING_PAGE)));

        IngestionResult result = ingestionService.ingestDocument(sameBytes, false);

        assertEquals(IngestionStatus.SKIPPED, result.status());
        assertEquals(IngestionResult.REASON_DUPLICATE_FILE, result.reason());
    }

    @Test
    void ingestDocument_forceUpdateReplacesExistingChunks() {
        Path manual = writeDocument("manual.pdf", List.of(PUMP_PAGE, SEAL_PAGE));
        ingestionService.ingestDocument(manual, false);

        IngestionResult result = ingestionService.ingestDocument(manual, true);

        assertEquals(IngestionStatus.SUCCESS, result.status());
        assertEquals(2, vectorIndex.storedChunks().size());
        assertEquals(2, publishedEvents.size());
    }

    @Test
    void ingestDocument_countsRepeatedChunksOnlyOnce() {
        Path manual = writeDocument("repeated.pdf", List.of(PUMP_PAGE, PUMP_PAGE, SEAL_PAGE));

        IngestionResult result = ingestionService.ingestDocument(manual, false);

        assertEquals(3, result.chunksOriginal());
        assertEquals(2, result.chunksUnique());
        assertEquals(2, result.chunksAdded());
    }

    @Test
    void ingestDocument_reportsMissingFileAsError() {
        IngestionResult result = ingestionService.ingestDocument(tempDir.resolve("absent.pdf"), false);

        assertEquals(IngestionStatus.ERROR, result.status());
        assertTrue(result.error().startsWith("File not found"));
        assertEquals(0, vectorIndex.addCalls());
    }

    @Test
    void ingestDocument_reportsDocumentWithoutTextAsError() {
        Path scanned = writeDocument("scanned.pdf", List.of("   ", ""));

        IngestionResult result = ingestionService.ingestDocument(scanned, false);

        assertEquals(IngestionStatus.ERROR, result.status());
        assertEquals("No extractable text", result.error());
        assertTrue(publishedEvents.isEmpty());
    }

    @Test
    void ingestDocument_reportsPermanentEmbeddingFailureAsError() {
        EmbeddingClient failingClient = mock(EmbeddingClient.class);
        when(failingClient.embedBatch(anyList()))
                .thenThrow(EmbeddingProviderException.permanentFailure("HTTP 401: invalid API key", null));
        DocumentIngestionService service = newService(failingClient);

        IngestionResult result = service.ingestDocument(writeDocument("manual.pdf", List.of(PUMP_PAGE)), false);

        assertEquals(IngestionStatus.ERROR, result.status());
        assertTrue(result.error().contains("401"));
        assertEquals(0, vectorIndex.storedChunks().size());
    }

    @Test
    void ingestDirectory_processesPdfFilesInNameOrder() throws IOException {
        writeDocument("b-bearings.pdf", List.of(BEARING_PAGE));
        writeDocument("a-pump.pdf", List.of(PUMP_PAGE));
        writeDocument("c-seal.pdf", List.of(SEAL_PAGE));
        Files.writeString(tempDir.resolve("notes.txt"), "not a pdf");

        List<IngestionResult> results = ingestionService.ingestDirectory(tempDir, true, false);

        assertEquals(List.of("a-pump.pdf", "b-bearings.pdf", "c-seal.pdf"),
                results.stream().map(IngestionResult::filename).toList());
        assertTrue(results.stream().allMatch(IngestionResult::isSuccess));
        assertEquals(3, vectorIndex.storedChunks().size());
    }

    @Test
    void deleteDocument_removesOnlyThatSourceAndNotifies() {
        ingestionService.ingestDocument(writeDocument("keep.pdf", List.of(PUMP_PAGE)), false);
        ingestionService.ingestDocument(writeDocument("drop.pdf", List.of(SEAL_PAGE)), false);
        publishedEvents.clear();

        assertEquals(1, ingestionService.deleteDocument("drop.pdf"));
        assertEquals(0, ingestionService.deleteDocument("never-indexed.pdf"));

        assertEquals(List.of(new IndexChangedEvent("delete", "drop.pdf")), publishedEvents);
        assertEquals("keep.pdf", vectorIndex.storedChunks().get(0).metadata().source());
    }

    @Test
    void clearIndex_removesEverythingAndNotifies() {
        ingestionService.ingestDocument(writeDocument("manual.pdf", List.of(PUMP_PAGE, SEAL_PAGE)), false);
        publishedEvents.clear();

        assertEquals(2, ingestionService.clearIndex());
        assertTrue(vectorIndex.storedChunks().isEmpty());
        assertEquals(List.of(new IndexChangedEvent("clear", "")), publishedEvents);
    }

    @Test
    void ingestDocument_failedForceUpdateStillNotifiesAboutRemovedChunks() {
        Path manual = writeDocument("manual.pdf", List.of(PUMP_PAGE, SEAL_PAGE));
        ingestionService.ingestDocument(manual, false);
        publishedEvents.clear();
        vectorIndex.failAddsWith(new VectorIndexException("Qdrant upsert failed: UNAVAILABLE: io exception"));

        IngestionResult result = ingestionService.ingestDocument(manual, true);

        assertEquals(IngestionStatus.ERROR, result.status());
        assertTrue(vectorIndex.storedChunks().isEmpty());
        assertEquals(List.of(new IndexChangedEvent("ingest_failed", "manual.pdf")), publishedEvents);
    }

    @Test
    void ingestDocument_failureAfterCommittedBatchNotifies() {
        vectorIndex.failAddsWith(new VectorIndexException("Qdrant upsert failed: connection reset"), 1);

        IngestionResult result =
                ingestionService.ingestDocument(writeDocument("manual.pdf", List.of(PUMP_PAGE, SEAL_PAGE)), false);

        assertEquals(IngestionStatus.ERROR, result.status());
        assertEquals(1, vectorIndex.storedChunks().size());
        assertEquals(List.of(new IndexChangedEvent("ingest_failed", "manual.pdf")), publishedEvents);
    }

    @Test
    void ingestDocument_failureBeforeAnyChangePublishesNothing() {
        vectorIndex.failAddsWith(new VectorIndexException("Qdrant upsert failed: UNAVAILABLE"));

        IngestionResult result = ingestionService.ingestDocument(writeDocument("manual.pdf", List.of(PUMP_PAGE)), false);

        assertEquals(IngestionStatus.ERROR, result.status());
        assertTrue(publishedEvents.isEmpty());
    }

    @Test
    void pdfDocument_isChunkedByStructureRetrievableAndGoneAfterDelete() throws IOException {
        Path pdf = writeServicePdf("pump-service.pdf");
        PdfPipeline pipeline = new PdfPipeline();

        IngestionResult result = pipeline.ingestion.ingestDocument(pdf, false);

        assertEquals(IngestionStatus.SUCCESS, result.status());
        List<DocumentChunk> stored = vectorIndex.storedChunks();
        assertTrue(stored.size() >= 3, "chunks: " + stored.size());
        Map<Integer, ChunkType> typeByPage = new HashMap<>();
        for (DocumentChunk chunk : stored) {
            double quality = chunk.metadata().qualityScore();
            assertTrue(quality >= 0.0 && quality <= 1.0, "quality " + quality);
            typeByPage.putIfAbsent(chunk.metadata().pageNumber(), chunk.metadata().chunkType());
        }
        assertEquals(ChunkType.NUMBERED_LIST, typeByPage.get(1));
        assertEquals(ChunkType.PARAGRAPH, typeByPage.get(2));
        assertEquals(ChunkType.PARAGRAPH, typeByPage.get(3));

        RetrievalFilter bySource = RetrievalFilter.bySource("pump-service.pdf");
        List<ScoredChunk> before = pipeline.retrieval.retrieve(BEARING_QUERY, 4, bySource);
        assertFalse(before.isEmpty());
        assertTrue(before.get(0).chunk().text().contains("lithium"));

        assertEquals(stored.size(), pipeline.ingestion.deleteDocument("pump-service.pdf"));

        assertTrue(pipeline.retrieval.retrieve(BEARING_QUERY, 4, bySource).isEmpty());
    }

    @Test
    void pdfDocument_ingestedTwiceWithoutForceIsSkipped() throws IOException {
        Path pdf = writeServicePdf("pump-service.pdf");
        PdfPipeline pipeline = new PdfPipeline();
        pipeline.ingestion.ingestDocument(pdf, false);
        long indexedBefore = vectorIndex.count(RetrievalFilter.none());
        int addCallsBefore = vectorIndex.addCalls();

        IngestionResult second = pipeline.ingestion.ingestDocument(pdf, false);

        assertEquals(IngestionStatus.SKIPPED, second.status());
        assertEquals(IngestionResult.REASON_DUPLICATE_CONTENT, second.reason());
        assertEquals(indexedBefore, vectorIndex.count(RetrievalFilter.none()));
        assertEquals(addCallsBefore, vectorIndex.addCalls());
    }

    private Path writeServicePdf(String filename) throws IOException {
        return TestPdfs.write(tempDir.resolve(filename), List.of(
                List.of(
                        "1. Close the discharge valve before priming the pump casing.",
                        "2. Open the vent valve on top of the volute housing.",
                        "3. Fill the casing with clean water until it flows from the vent.",
                        "4. Close the vent valve and start the motor briefly to check rotation."),
                List.of(
                        "The centrifugal pump must never run dry because the mechanical seal",
                        "depends on the pumped liquid for cooling and lubrication. Operators",
                        "should confirm that suction lines are airtight and that the foot valve",
                        "holds water, otherwise the pump loses its prime within a few minutes."),
                BEARING_LINES));
    }

    /** Real PDF extraction and chunking feeding both ingestion and retrieval over the shared index. */
    private final class PdfPipeline {
        private final DocumentIngestionService ingestion;
        private final RetrievalService retrieval;

        PdfPipeline() {
            AppProperties appProperties = new AppProperties();
            appProperties.getEmbeddings().setDimensions(BagOfWordsEmbeddingClient.DIMENSIONS);
            ContentHasher contentHasher = new ContentHasher();
            DocumentChunker chunker = new DocumentChunker(
                    new TokenCounter(),
                    new TextCleaner(),
                    new ChunkQualityScorer(),
                    new ChunkTypeDetector(),
                    contentHasher,
                    new ChunkingSettings(500, 50, 100, 0.3, 0.7));
            CacheService cacheService = new CacheService(new InMemoryCacheBackend(100), Duration.ofHours(1));
            retrieval = new RetrievalService(
                    embeddingClient,
                    vectorIndex,
                    new TrivialQueryFilter(),
                    new SemanticReranker(embeddingClient, appProperties),
                    new CentroidGate(vectorIndex, appProperties),
                    new ContextFormatter(),
                    new RetrievalCache(cacheService, new ObjectMapper(), Duration.ofMinutes(30)),
                    appProperties);
            ApplicationEventPublisher publisher = event -> {
                publishedEvents.add(event);
                if (event instanceof IndexChangedEvent) {
                    retrieval.onIndexChanged((IndexChangedEvent) event);
                }
            };
            ingestion = new DocumentIngestionService(
                    new PdfContentExtractor(), chunker, contentHasher, embeddingClient, vectorIndex, publisher,
                    appProperties);
        }
    }

    private DocumentIngestionService newService(EmbeddingClient client) {
        AppProperties appProperties = new AppProperties();
        appProperties.getIngestion().setUploadBatchSize(1);
        appProperties.getIngestion().setWorkers(2);
        ContentHasher contentHasher = new ContentHasher();
        DocumentChunker chunker = new DocumentChunker(
                new TokenCounter(),
                new TextCleaner(),
                new ChunkQualityScorer(),
                new ChunkTypeDetector(),
                contentHasher,
                new ChunkingSettings(80, 10, 30, 0.3, 0.6));
        return new DocumentIngestionService(
                textExtractor, chunker, contentHasher, client, vectorIndex, publishedEvents::add, appProperties);
    }

    private Path writeDocument(String filename, List<String> pageTexts) {
        Path document = tempDir.resolve(filename);
        List<PageText> pages = new ArrayList<>();
        for (int i = 0; i < pageTexts.size(); i++) {
            pages.add(new PageText(i + 1, pageTexts.get(i)));
        }
        try {
            Files.write(document, (filename + "\n" + String.join("\f", pageTexts)).getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
        when(textExtractor.extractPages(document)).thenReturn(pages);
        return document;
    }
}
