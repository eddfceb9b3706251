package dev.resumetailor.service;

import dev.resumetailor.config.ScoringConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Lexical relevance of a short candidate string (a skill name or a phrase) to a job description.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CandidateScorer {

    private static final Map<String, Pattern> PATTERN_CACHE = new ConcurrentHashMap<>();
    private static final Pattern TOKEN_EDGES = Pattern.compile("^[^\\p{L}\\p{N}]+|[^\\p{L}\\p{N}+#]+$");

    private final ScoringConfig scoringConfig;

    /**
     * Result of scoring one candidate.
     */
    public record ScoringResult(
            double score,
            Map<String, Double> breakdown) {
    }

    /**
     * Score a candidate against a job description.
     *
     * @return a non-negative score; 0 means no signal at all
     */
    public double score(String candidate, String jobText) {
        return explain(candidate, jobText).score();
    }

    /**
     * Score a candidate and report which signals contributed.
     *
     * @param candidate The skill or phrase to score
     * @param jobText   The job description
     * @return ScoringResult with total and per-signal breakdown
     */
    public ScoringResult explain(String candidate, String jobText) {
        if (candidate == null || candidate.isBlank() || jobText == null || jobText.isBlank()) {
            return new ScoringResult(0.0, Map.of());
        }

        String cand = candidate.toLowerCase(Locale.ROOT);
        String job = jobText.toLowerCase(Locale.ROOT);
        Map<String, Double> breakdown = new LinkedHashMap<>();
        double total = 0.0;

        // 1. Direct mention anywhere
        if (job.contains(cand)) {
            breakdown.put("direct_match", scoringConfig.getDirectMatch());
            total += scoringConfig.getDirectMatch();
        }

        // 2. Whole-word mention
        if (containsWord(job, cand)) {
            breakdown.put("word_boundary", scoringConfig.getWordBoundary());
            total += scoringConfig.getWordBoundary();
        }

        // 3. Individual words of the candidate standing alone in the job text
        Set<String> jobTokens = tokenize(job);
        double wordScore = 0.0;
        for (String word : cand.trim().split("\\s+")) {
            if (jobTokens.contains(word)) {
                wordScore += scoringConfig.getWordToken();
            }
        }
        if (wordScore > 0) {
            breakdown.put("word_tokens", wordScore);
            total += wordScore;
        }

        // 4. Related technology terms
        double relatedScore = calculateRelatedTermScore(cand, job);
        if (relatedScore > 0) {
            breakdown.put("related_terms", relatedScore);
            total += relatedScore;
        }

        log.debug("Candidate '{}' scored {} {}", candidate, total, breakdown);
        return new ScoringResult(total, breakdown);
    }

    private double calculateRelatedTermScore(String candidate, String job) {
        double score = 0.0;
        for (Map.Entry<String, List<String>> entry : scoringConfig.getRelatedTerms().entrySet()) {
            if (!candidate.contains(entry.getKey().toLowerCase(Locale.ROOT))) {
                continue;
            }
            for (String term : entry.getValue()) {
                if (job.contains(term.toLowerCase(Locale.ROOT))) {
                    score += scoringConfig.getRelatedTerm();
                }
            }
        }
        return score;
    }

    private Set<String> tokenize(String text) {
        return Arrays.stream(text.split("\\s+"))
                .map(token -> TOKEN_EDGES.matcher(token).replaceAll(""))
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toSet());
    }

    /**
     * Check if text contains a word with word boundaries.
     */
    private boolean containsWord(String text, String word) {
        String regex = "\\b" + Pattern.quote(word) + "\\b";
        Pattern pattern = PATTERN_CACHE.computeIfAbsent(regex, Pattern::compile);
        return pattern.matcher(text).find();
    }
}
