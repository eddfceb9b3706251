package dev.resumetailor.service;

import dev.resumetailor.ai.ModelInvocationException;
import dev.resumetailor.ai.RelevanceModel;
import dev.resumetailor.config.RecommenderConfig;
import dev.resumetailor.model.RankedCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Second-pass ordering of a retrieved shortlist with a joint (job, candidate) relevance model.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CrossEncoderReranker {

    private final RelevanceModel relevanceModel;
    private final RecommenderConfig recommenderConfig;

    /**
     * Replace every candidate's score with its scaled relevance score and reorder.
     * Scores are then shifted so the lowest one is exactly 1, keeping every score positive.
     *
     * @param jobText    The job description
     * @param candidates Shortlist from retrieval
     * @return Candidates sorted by descending relevance, all scores &gt;= 1
     */
    public List<RankedCandidate> rerank(String jobText, List<RankedCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }

        List<String> texts = candidates.stream().map(RankedCandidate::text).toList();
        List<Double> relevance = relevanceModel.score(jobText, texts);
        if (relevance.size() != candidates.size()) {
            throw new ModelInvocationException(String.format("%s returned %d scores for %d candidates",
                    relevanceModel.getName(), relevance.size(), candidates.size()));
        }

        List<RankedCandidate> rescored = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            rescored.add(candidates.get(i).withScore(relevance.get(i) * recommenderConfig.getScoreScale()));
        }
        rescored.sort(Comparator.comparingDouble(RankedCandidate::score).reversed());

        double minScore = rescored.get(rescored.size() - 1).score();
        List<RankedCandidate> normalized = rescored.stream()
                .map(candidate -> candidate.withScore(candidate.score() - minScore + 1))
                .toList();

        log.debug("Re-ranked {} candidates with {} (raw min {})", normalized.size(), relevanceModel.getName(), minScore);
        return normalized;
    }
}
