package dev.resumetailor.ai.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.resumetailor.ai.ModelInvocationException;
import dev.resumetailor.ai.RelevanceModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Cross-encoder scores from a Hugging Face text-embeddings-inference server
 * ({@code POST /rerank}), e.g. one serving {@code cross-encoder/ms-marco-MiniLM-L-6-v2}.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.reranker.provider", havingValue = "tei")
public class TeiRelevanceModel implements RelevanceModel {

    private final WebClient webClient;
    private final boolean rawScores;
    private final Duration timeout;

    public TeiRelevanceModel(
            @Value("${app.ai.reranker.tei.base-url:http://localhost:8081}") String baseUrl,
            @Value("${app.ai.reranker.tei.raw-scores:false}") boolean rawScores,
            @Value("${app.ai.reranker.tei.timeout-seconds:60}") long timeoutSeconds) {
        this.rawScores = rawScores;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
        this.webClient = WebClient.builder()
                .baseUrl(Objects.requireNonNull(baseUrl))
                .defaultHeader("Content-Type", "application/json")
                .build();

        log.info("TEI reranker enabled at {} (raw scores: {})", baseUrl, rawScores);
    }

    @Override
    public List<Double> score(String query, List<String> candidates) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        try {
            RerankHit[] hits = requestScores(query, candidates).block();
            return alignScores(hits, candidates.size());
        } catch (ModelInvocationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ModelInvocationException("Rerank request failed: " + e.getMessage(), e);
        }
    }

    public Mono<RerankHit[]> requestScores(String query, List<String> candidates) {
        RerankRequest request = new RerankRequest(query, candidates, rawScores, true);
        log.debug("Requesting relevance scores for {} candidates", candidates.size());

        return webClient.post()
                .uri("/rerank")
                .contentType(Objects.requireNonNull(MediaType.APPLICATION_JSON))
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError,
                        clientResponse -> clientResponse.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(errorBody -> {
                                    log.error("Rerank API error {}: {}", clientResponse.statusCode(), errorBody);
                                    return Mono.error(new ModelInvocationException(
                                            "Rerank API error " + clientResponse.statusCode() + ": " + errorBody));
                                }))
                .bodyToMono(RerankHit[].class)
                .timeout(timeout);
    }

    private List<Double> alignScores(RerankHit[] hits, int expected) {
        if (hits == null) {
            throw new ModelInvocationException("Rerank endpoint returned no scores");
        }
        Double[] scores = new Double[expected];
        for (RerankHit hit : hits) {
            if (hit.index() < 0 || hit.index() >= expected) {
                throw new ModelInvocationException("Rerank endpoint returned out-of-range index " + hit.index());
            }
            scores[hit.index()] = hit.score();
        }
        if (Arrays.stream(scores).anyMatch(Objects::isNull)) {
            throw new ModelInvocationException(String.format(
                    "Rerank endpoint scored %d of %d candidates", hits.length, expected));
        }
        return new ArrayList<>(Arrays.asList(scores));
    }

    @Override
    public String getName() {
        return "tei";
    }

    record RerankRequest(
            String query,
            List<String> texts,
            @JsonProperty("raw_scores") boolean rawScores,
            boolean truncate) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RerankHit(int index, double score) {
    }
}
