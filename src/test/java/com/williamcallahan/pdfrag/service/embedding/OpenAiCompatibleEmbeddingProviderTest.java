package com.williamcallahan.pdfrag.service.embedding;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.openai.client.OpenAIClient;
import com.openai.core.RequestOptions;
import com.openai.models.embeddings.CreateEmbeddingResponse;
import com.openai.models.embeddings.Embedding;
import com.openai.services.blocking.EmbeddingService;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies the OpenAI-compatible provider keeps request ordering and classifies failures.
 */
class OpenAiCompatibleEmbeddingProviderTest {

    private static final String MODEL = "text-embedding-3-small";

    @Test
    void embedPreservesRequestOrderingFromResponseIndices() {
        OpenAIClient client = mock(OpenAIClient.class);
        EmbeddingService embeddingService = mock(EmbeddingService.class);
        when(client.embeddings()).thenReturn(embeddingService);
        when(embeddingService.create(any(), any(RequestOptions.class))).thenReturn(response(
                Embedding.builder().index(1L).embedding(List.of(0.0f, 1.0f)).build(),
                Embedding.builder().index(0L).embedding(List.of(0.25f, -0.5f)).build()));

        try (OpenAiCompatibleEmbeddingProvider provider = new OpenAiCompatibleEmbeddingProvider(client, MODEL, 2)) {
            List<float[]> vectors = provider.embed(List.of("first", "second"));

            assertEquals(2, vectors.size());
            assertEquals(0.25f, vectors.get(0)[0]);
            assertEquals(-0.5f, vectors.get(0)[1]);
            assertEquals(1.0f, vectors.get(1)[1]);
            verify(embeddingService).create(any(), any(RequestOptions.class));
        }
    }

    @Test
    void missingIndexIsReportedAsTransient() {
        OpenAIClient client = mock(OpenAIClient.class);

        try (OpenAiCompatibleEmbeddingProvider provider = new OpenAiCompatibleEmbeddingProvider(client, MODEL, 2)) {
            CreateEmbeddingResponse partial = response(
                    Embedding.builder().index(7L).embedding(List.of(0.5f, 0.6f)).build());

            EmbeddingProviderException thrown =
                    assertThrows(EmbeddingProviderException.class, () -> provider.parseResponse(partial, 1));
            assertTrue(thrown.isTransient());
        }
    }

    @Test
    void unexpectedClientFailureIsPermanent() {
        OpenAIClient client = mock(OpenAIClient.class);
        EmbeddingService embeddingService = mock(EmbeddingService.class);
        when(client.embeddings()).thenReturn(embeddingService);
        when(embeddingService.create(any(), any(RequestOptions.class)))
                .thenThrow(new IllegalArgumentException("bad request body"));

        try (OpenAiCompatibleEmbeddingProvider provider = new OpenAiCompatibleEmbeddingProvider(client, MODEL, 2)) {
            EmbeddingProviderException thrown =
                    assertThrows(EmbeddingProviderException.class, () -> provider.embed(List.of("text")));
            assertFalse(thrown.isTransient());
        }
    }

    @Test
    void normalizeBaseUrlAddsVersionSegmentOnce() {
        assertEquals("https://api.openai.com/v1", OpenAiCompatibleEmbeddingProvider.normalizeBaseUrl("https://api.openai.com"));
        assertEquals("https://api.openai.com/v1", OpenAiCompatibleEmbeddingProvider.normalizeBaseUrl("https://api.openai.com/v1/"));
        assertEquals("http://localhost:8080/v1",
                OpenAiCompatibleEmbeddingProvider.normalizeBaseUrl("http://localhost:8080/v1/embeddings"));
        assertThrows(IllegalStateException.class, () -> OpenAiCompatibleEmbeddingProvider.normalizeBaseUrl(" "));
    }

    private static CreateEmbeddingResponse response(Embedding... entries) {
        return CreateEmbeddingResponse.builder()
                .model(MODEL)
                .usage(CreateEmbeddingResponse.Usage.builder()
                        .promptTokens(1L)
                        .totalTokens(1L)
                        .build())
                .data(List.of(entries))
                .build();
    }
}
