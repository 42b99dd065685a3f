package com.williamcallahan.pdfrag.cli;

import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.pdfrag.domain.ingestion.IngestionResult;
import com.williamcallahan.pdfrag.domain.retrieval.GatingDecision;
import com.williamcallahan.pdfrag.domain.retrieval.GatingReason;
import com.williamcallahan.pdfrag.domain.retrieval.RetrievalFilter;
import com.williamcallahan.pdfrag.service.ingestion.DocumentIngestionService;
import com.williamcallahan.pdfrag.service.retrieval.RetrievalService;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies command dispatch and JSON output of the command-line runner.
 */
class DocumentProcessorTest {

    @TempDir
    Path tempDir;

    private DocumentIngestionService ingestionService;
    private RetrievalService retrievalService;
    private ByteArrayOutputStream output;
    private DocumentProcessor processor;

    @BeforeEach
    void setUp() {
        ingestionService = mock(DocumentIngestionService.class);
        retrievalService = mock(RetrievalService.class);
        output = new ByteArrayOutputStream();
        processor = new DocumentProcessor(
                ingestionService,
                retrievalService,
                new ObjectMapper(),
                new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    @Test
    void clearPrintsDeletedCount() throws Exception {
        when(ingestionService.clearIndex()).thenReturn(7L);

        processor.run("clear");

        assertTrue(printed().contains("\"deleted\" : 7"));
    }

    @Test
    void ingestSingleFileHonoursForceFlag() throws Exception {
        Path pdf = Files.write(tempDir.resolve("manual.pdf"), new byte[] {1, 2, 3});
        when(ingestionService.ingestDocument(pdf, true)).thenReturn(IngestionResult.success("manual.pdf", 3, 2, 2));

        processor.run("ingest", pdf.toString(), "--force");

        verify(ingestionService).ingestDocument(pdf, true);
        assertTrue(printed().contains("\"status\" : \"success\""));
    }

    @Test
    void queryPassesExplicitK() throws Exception {
        processor.run("query", "pump", "priming", "--k=2");

        verify(retrievalService).retrieveWithTrace("pump priming", 2, RetrievalFilter.none(), true);
    }

    @Test
    void gatePrintsDecision() throws Exception {
        when(retrievalService.gatingDecision("seal kit"))
                .thenReturn(GatingDecision.reject(GatingReason.EMPTY_INDEX));

        processor.run("gate", "seal", "kit");

        assertTrue(printed().contains("\"reason\" : \"empty_index\""));
    }

    @Test
    void unknownCommandPrintsUsage() throws Exception {
        processor.run("reindex");

        assertTrue(printed().startsWith("Usage: ingest <dir|file.pdf>"));
        verifyNoInteractions(ingestionService, retrievalService);
    }
}
