package dev.resumetailor.service;

import dev.resumetailor.ai.EmbeddingModel;
import dev.resumetailor.ai.ModelInvocationException;
import dev.resumetailor.ai.VectorMath;
import dev.resumetailor.model.RankedCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Two-tower retrieval: embeds the job description and every candidate independently and
 * ranks candidates by cosine similarity.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SemanticRetriever {

    private final EmbeddingModel embeddingModel;

    /**
     * Return the {@code topN} candidates most similar to the job text.
     * <p>
     * Each hit keeps the candidate's index in {@code candidateTexts}, so callers can map
     * hits back to their records even when two candidates share the same text.
     *
     * @param jobText        The query text
     * @param candidateTexts Texts to rank
     * @param topN           Maximum number of hits
     * @return Hits sorted by descending similarity; ties keep input order
     */
    public List<RankedCandidate> retrieve(String jobText, List<String> candidateTexts, int topN) {
        if (candidateTexts == null || candidateTexts.isEmpty() || topN <= 0) {
            return List.of();
        }

        float[] jobVector = embeddingModel.embed(jobText);
        List<float[]> vectors = embeddingModel.embedAll(candidateTexts);
        if (vectors.size() != candidateTexts.size()) {
            throw new ModelInvocationException(String.format("%s returned %d vectors for %d candidates",
                    embeddingModel.getName(), vectors.size(), candidateTexts.size()));
        }

        List<RankedCandidate> hits = new ArrayList<>(candidateTexts.size());
        for (int i = 0; i < candidateTexts.size(); i++) {
            hits.add(new RankedCandidate(i, candidateTexts.get(i), VectorMath.cosine(jobVector, vectors.get(i))));
        }
        hits.sort(Comparator.comparingDouble(RankedCandidate::score).reversed());

        List<RankedCandidate> top = List.copyOf(hits.subList(0, Math.min(topN, hits.size())));
        log.debug("Retrieved {} of {} candidates with {}", top.size(), candidateTexts.size(), embeddingModel.getName());
        return top;
    }
}
