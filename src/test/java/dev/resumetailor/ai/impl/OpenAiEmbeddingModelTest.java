package dev.resumetailor.ai.impl;

import dev.resumetailor.ai.ModelInvocationException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiEmbeddingModelTest {

    private MockWebServer mockWebServer;
    private OpenAiEmbeddingModel model;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        String baseUrl = mockWebServer.url("/v1").toString();
        model = new OpenAiEmbeddingModel("test-api-key", "text-embedding-3-small", baseUrl, 5);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    @DisplayName("Should post the batch and return vectors ordered by index")
    void shouldReturnVectorsInInputOrder() throws InterruptedException {
        mockWebServer.enqueue(new MockResponse()
                .setBody("""
                        {
                          "object": "list",
                          "data": [
                            {"object": "embedding", "index": 1, "embedding": [0.0, 1.0]},
                            {"object": "embedding", "index": 0, "embedding": [1.0, 0.0]}
                          ],
                          "model": "text-embedding-3-small",
                          "usage": {"prompt_tokens": 4, "total_tokens": 4}
                        }
                        """)
                .setHeader("Content-Type", "application/json"));

        List<float[]> vectors = model.embedAll(List.of("kafka", "java"));

        assertThat(vectors).hasSize(2);
        assertThat(vectors.get(0)).containsExactly(1.0f, 0.0f);
        assertThat(vectors.get(1)).containsExactly(0.0f, 1.0f);

        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getPath()).isEqualTo("/v1/embeddings");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer test-api-key");
        assertThat(request.getBody().readUtf8())
                .contains("\"model\":\"text-embedding-3-small\"")
                .contains("\"input\":[\"kafka\",\"java\"]");
    }

    @Test
    @DisplayName("Should emit an error for a failed request")
    void shouldEmitErrorOnHttpFailure() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(500).setBody("overloaded"));

        StepVerifier.create(model.requestEmbeddings(List.of("kafka")))
                .expectErrorMatches(error -> error instanceof ModelInvocationException
                        && error.getMessage().contains("overloaded"))
                .verify();
    }

    @Test
    @DisplayName("Should wrap failures in ModelInvocationException")
    void shouldWrapFailures() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(401).setBody("invalid key"));

        assertThatThrownBy(() -> model.embedAll(List.of("kafka")))
                .isInstanceOf(ModelInvocationException.class)
                .hasMessageContaining("401");
    }

    @Test
    @DisplayName("Should fail when fewer vectors than texts come back")
    void shouldFailOnMissingVectors() {
        mockWebServer.enqueue(new MockResponse()
                .setBody("{\"data\": [{\"index\": 0, \"embedding\": [1.0]}]}")
                .setHeader("Content-Type", "application/json"));

        assertThatThrownBy(() -> model.embedAll(List.of("kafka", "java")))
                .isInstanceOf(ModelInvocationException.class)
                .hasMessageContaining("1 vectors for 2 texts");
    }

    @Test
    @DisplayName("Should not call the endpoint for an empty batch")
    void shouldSkipEmptyBatch() {
        assertThat(model.embedAll(List.of())).isEmpty();
        assertThat(mockWebServer.getRequestCount()).isZero();
    }

    @Test
    @DisplayName("Should expose the model in its name")
    void shouldExposeName() {
        assertThat(model.getName()).isEqualTo("openai:text-embedding-3-small");
    }
}
