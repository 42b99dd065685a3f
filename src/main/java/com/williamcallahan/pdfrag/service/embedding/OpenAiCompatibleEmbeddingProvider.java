package com.williamcallahan.pdfrag.service.embedding;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.core.RequestOptions;
import com.openai.core.Timeout;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIRetryableException;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.embeddings.CreateEmbeddingResponse;
import com.openai.models.embeddings.Embedding;
import com.openai.models.embeddings.EmbeddingCreateParams;
import com.williamcallahan.pdfrag.support.TransientFailureClassifier;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Calls an OpenAI-compatible {@code /embeddings} endpoint through the OpenAI Java SDK.
 *
 * <p>Every failure is translated into an {@link EmbeddingProviderException} whose transient flag
 * drives the caller's retry policy. Vectors are returned as received; dimension validation belongs
 * to the caller.</p>
 */
public class OpenAiCompatibleEmbeddingProvider implements EmbeddingProvider, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleEmbeddingProvider.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);
    private static final int MAX_ERROR_SNIPPET = 512;

    private final OpenAIClient client;
    private final String modelName;
    private final int dimensions;

    /**
     * Creates a provider backed by a remote endpoint.
     *
     * @param baseUrl base URL, with or without the {@code /v1} suffix
     * @param apiKey API key
     * @param modelName embedding model identifier
     * @param dimensions expected vector length
     * @return configured provider
     */
    public static OpenAiCompatibleEmbeddingProvider create(
            String baseUrl, String apiKey, String modelName, int dimensions) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("Remote embedding API key is not configured");
        }
        OpenAIClient client = OpenAIOkHttpClient.builder()
                .apiKey(apiKey)
                .baseUrl(normalizeBaseUrl(baseUrl))
                .build();
        return new OpenAiCompatibleEmbeddingProvider(client, modelName, dimensions);
    }

    OpenAiCompatibleEmbeddingProvider(OpenAIClient client, String modelName, int dimensions) {
        this.client = Objects.requireNonNull(client, "client");
        if (modelName == null || modelName.isBlank()) {
            throw new IllegalStateException("Remote embedding model is not configured");
        }
        if (dimensions <= 0) {
            throw new IllegalArgumentException("Embedding dimensions must be positive");
        }
        this.modelName = modelName;
        this.dimensions = dimensions;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        EmbeddingCreateParams params = EmbeddingCreateParams.builder()
                .model(modelName)
                .inputOfArrayOfStrings(texts)
                .build();
        RequestOptions options = RequestOptions.builder()
                .timeout(Timeout.builder()
                        .connect(CONNECT_TIMEOUT)
                        .request(REQUEST_TIMEOUT)
                        .read(REQUEST_TIMEOUT)
                        .build())
                .build();
        CreateEmbeddingResponse response;
        try {
            response = client.embeddings().create(params, options);
        } catch (OpenAIServiceException serviceException) {
            boolean retryable = TransientFailureClassifier.isTransientHttpStatus(serviceException.statusCode());
            throw new EmbeddingProviderException(
                    "Embedding provider returned HTTP " + serviceException.statusCode() + ": "
                            + sanitizeMessage(serviceException.getMessage()),
                    retryable,
                    serviceException);
        } catch (OpenAIRetryableException retryableException) {
            throw EmbeddingProviderException.transientFailure(
                    "Embedding provider unreachable: " + sanitizeMessage(retryableException.getMessage()),
                    retryableException);
        } catch (RuntimeException unexpected) {
            boolean retryable = unexpected instanceof OpenAIIoException
                    || TransientFailureClassifier.isTransient(unexpected);
            throw new EmbeddingProviderException(
                    "Embedding request failed: " + sanitizeMessage(unexpected.getMessage()), retryable, unexpected);
        }
        return parseResponse(response, texts.size());
    }

    @Override
    public String modelId() {
        return modelName;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    List<float[]> parseResponse(CreateEmbeddingResponse response, int expectedCount) {
        if (response == null || response.data().isEmpty()) {
            throw EmbeddingProviderException.transientFailure("Embedding response missing embedding entries", null);
        }
        float[][] embeddingsByIndex = new float[expectedCount][];
        List<Embedding> entries = response.data();
        for (int itemIndex = 0; itemIndex < entries.size(); itemIndex++) {
            Embedding entry = entries.get(itemIndex);
            long responseIndex = entry.index();
            if (responseIndex < 0 || responseIndex >= expectedCount) {
                log.debug("[EMBEDDING] Ignoring embedding index={} (expectedCount={})", responseIndex, expectedCount);
                continue;
            }
            embeddingsByIndex[(int) responseIndex] = toFloatVector(entry.embedding());
        }
        List<float[]> ordered = new ArrayList<>(expectedCount);
        for (int index = 0; index < expectedCount; index++) {
            if (embeddingsByIndex[index] == null) {
                throw EmbeddingProviderException.transientFailure(
                        "Embedding response missing embedding for index " + index, null);
            }
            ordered.add(embeddingsByIndex[index]);
        }
        return ordered;
    }

    private static float[] toFloatVector(List<? extends Number> values) {
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            Number value = values.get(i);
            vector[i] = value == null ? Float.NaN : value.floatValue();
        }
        return vector;
    }

    static String normalizeBaseUrl(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalStateException("Remote embedding base URL is not configured");
        }
        String trimmed = baseUrl.trim();
        if (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.endsWith("/embeddings")) {
            trimmed = trimmed.substring(0, trimmed.length() - "/embeddings".length());
        }
        return trimmed.endsWith("/v1") ? trimmed : trimmed + "/v1";
    }

    private static String sanitizeMessage(String message) {
        if (message == null || message.isBlank()) {
            return "";
        }
        String sanitized = message.replace("\r", " ").replace("\n", " ").trim();
        if (sanitized.length() > MAX_ERROR_SNIPPET) {
            return sanitized.substring(0, MAX_ERROR_SNIPPET) + "...";
        }
        return sanitized;
    }

    @Override
    public void close() {
        client.close();
    }
}
