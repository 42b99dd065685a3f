package com.williamcallahan.pdfrag.service.retrieval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.pdfrag.domain.ChunkMetadata;
import com.williamcallahan.pdfrag.domain.ChunkType;
import com.williamcallahan.pdfrag.domain.DocumentChunk;
import com.williamcallahan.pdfrag.domain.ScoredChunk;
import com.williamcallahan.pdfrag.service.embedding.BagOfWordsEmbeddingClient;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies the blended rerank score, the PDF boost and batch embedding of vectorless candidates.
 */
class SemanticRerankerTest {

    private BagOfWordsEmbeddingClient embeddingClient;
    private SemanticReranker reranker;

    @BeforeEach
    void setUp() {
        embeddingClient = new BagOfWordsEmbeddingClient();
        reranker = new SemanticReranker(embeddingClient, 1.5);
    }

    @Test
    void scoreBlendsSimilarityQualityLengthAndType() {
        ChunkMetadata notes = metadata("notes.txt", ChunkType.PARAGRAPH, 0.8, 50);

        assertEquals(0.5 * 0.6 + 0.35 * 0.8 + 0.10 * 0.5 + 0.05 * 0.8, reranker.score(0.6, notes), 1e-9);
    }

    @Test
    void listChunksUseTheDefaultTypeWeight() {
        ChunkMetadata numbered = metadata("steps.txt", ChunkType.NUMBERED_LIST, 0.5, 100);
        ChunkMetadata bullets = metadata("parts.txt", ChunkType.BULLET_LIST, 0.5, 100);
        double expected = 0.5 * 0.4 + 0.35 * 0.5 + 0.10 + 0.05 * 0.6;

        assertEquals(expected, reranker.score(0.4, numbered), 1e-9);
        assertEquals(expected, reranker.score(0.4, bullets), 1e-9);
    }

    @Test
    void scoreCapsLengthAndBoostsPdfSources() {
        ChunkMetadata pdf = metadata("manual.PDF", ChunkType.HEADER, 1.0, 400);

        assertEquals((0.5 + 0.35 + 0.10 + 0.05) * 1.5, reranker.score(1.0, pdf), 1e-9);
    }

    @Test
    void rerankOrdersByBlendedScoreNotIndexScore() {
        String query = "replace mechanical seal casing";
        ScoredChunk offTopic = new ScoredChunk(
                DocumentChunk.of("Bearings need lithium grease", metadata("manual.pdf", ChunkType.PARAGRAPH, 0.8, 40)),
                0.9);
        ScoredChunk onTopic = new ScoredChunk(
                DocumentChunk.of("Replace the mechanical seal after draining the casing",
                        metadata("manual.pdf", ChunkType.PARAGRAPH, 0.8, 40)),
                0.4);

        List<ScoredChunk> reranked =
                reranker.rerank(BagOfWordsEmbeddingClient.embed(query), List.of(offTopic, onTopic));

        assertEquals("Replace the mechanical seal after draining the casing", reranked.get(0).chunk().text());
        assertTrue(reranked.get(0).score() > reranked.get(1).score());
        assertTrue(reranked.get(0).chunk().hasEmbedding());
    }

    @Test
    void embedsAllVectorlessCandidatesInOneBatch() {
        List<ScoredChunk> candidates = List.of(
                new ScoredChunk(DocumentChunk.of("first candidate text", metadata("a.pdf", ChunkType.TEXT, 0.5, 3)), 0.5),
                new ScoredChunk(DocumentChunk.of("second candidate text", metadata("b.pdf", ChunkType.TEXT, 0.5, 3))
                        .withEmbedding(BagOfWordsEmbeddingClient.embed("second candidate text")), 0.5),
                new ScoredChunk(DocumentChunk.of("third candidate text", metadata("c.pdf", ChunkType.TEXT, 0.5, 3)), 0.5));

        List<DocumentChunk> embedded = SemanticReranker.withEmbeddings(candidates, embeddingClient);

        assertEquals(1, embeddingClient.batchCalls());
        assertEquals(2, embeddingClient.embeddedTexts());
        assertTrue(embedded.stream().allMatch(DocumentChunk::hasEmbedding));
    }

    private static ChunkMetadata metadata(String source, ChunkType type, double quality, int words) {
        return new ChunkMetadata(source, "", null, null, "hash-" + source + words + type, type, quality, words,
                words * 6, 1);
    }
}
