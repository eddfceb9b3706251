package dev.resumetailor.ai.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.resumetailor.ai.EmbeddingModel;
import dev.resumetailor.ai.ModelInvocationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Embeddings from an OpenAI-compatible {@code /embeddings} endpoint. Any server that
 * speaks that protocol (OpenAI, Ollama, LocalAI, vLLM) can back it.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.embedding.provider", havingValue = "openai")
public class OpenAiEmbeddingModel implements EmbeddingModel {

    private final WebClient webClient;
    private final String model;
    private final Duration timeout;

    public OpenAiEmbeddingModel(
            @Value("${app.ai.embedding.openai.api-key:}") String apiKey,
            @Value("${app.ai.embedding.openai.model:text-embedding-3-small}") String model,
            @Value("${app.ai.embedding.openai.base-url:https://api.openai.com/v1}") String baseUrl,
            @Value("${app.ai.embedding.openai.timeout-seconds:60}") long timeoutSeconds) {
        this.model = model;
        this.timeout = Duration.ofSeconds(timeoutSeconds);

        WebClient.Builder builder = WebClient.builder()
                .baseUrl(Objects.requireNonNull(baseUrl))
                .codecs(config -> config.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .defaultHeader("Content-Type", "application/json");
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader("Authorization", "Bearer " + apiKey);
        } else {
            log.warn("No API key configured for embeddings endpoint {} - sending unauthenticated requests", baseUrl);
        }
        this.webClient = builder.build();

        log.info("OpenAI-compatible embeddings enabled with model: {}", model);
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        try {
            List<float[]> vectors = requestEmbeddings(texts).block();
            if (vectors == null || vectors.size() != texts.size()) {
                throw new ModelInvocationException(String.format(
                        "Embedding endpoint returned %d vectors for %d texts",
                        vectors == null ? 0 : vectors.size(), texts.size()));
            }
            return vectors;
        } catch (ModelInvocationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ModelInvocationException("Embedding request failed: " + e.getMessage(), e);
        }
    }

    /**
     * Request embeddings for a batch of texts, ordered as the input.
     */
    public Mono<List<float[]>> requestEmbeddings(List<String> texts) {
        EmbeddingRequest request = new EmbeddingRequest(model, texts);
        log.debug("Requesting {} embeddings from model {}", texts.size(), model);

        return webClient.post()
                .uri("/embeddings")
                .contentType(Objects.requireNonNull(MediaType.APPLICATION_JSON))
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError,
                        clientResponse -> clientResponse.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(errorBody -> {
                                    log.error("Embeddings API error {}: {}", clientResponse.statusCode(), errorBody);
                                    return Mono.error(new ModelInvocationException(
                                            "Embeddings API error " + clientResponse.statusCode() + ": " + errorBody));
                                }))
                .bodyToMono(EmbeddingResponse.class)
                .timeout(timeout)
                .map(this::extractVectors);
    }

    private List<float[]> extractVectors(EmbeddingResponse response) {
        if (response.data() == null) {
            return List.of();
        }
        return response.data().stream()
                .sorted(Comparator.comparingInt(EmbeddingData::index))
                .map(EmbeddingData::embedding)
                .toList();
    }

    @Override
    public String getName() {
        return "openai:" + model;
    }

    record EmbeddingRequest(String model, List<String> input) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingResponse(List<EmbeddingData> data) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingData(int index, float[] embedding) {
    }
}
