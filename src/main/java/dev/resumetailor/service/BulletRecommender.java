package dev.resumetailor.service;

import dev.resumetailor.ai.EmbeddingModel;
import dev.resumetailor.ai.VectorMath;
import dev.resumetailor.config.RecommenderConfig;
import dev.resumetailor.model.BulletRecord;
import dev.resumetailor.model.PrioritySet;
import dev.resumetailor.model.RankedCandidate;
import dev.resumetailor.model.ScoredBullet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.IntStream;

/**
 * Ranks a role's bullet pool against a job description.
 * <p>
 * Pipeline: semantic retrieval, cross-encoder re-ranking, then priority boosting with
 * phrase-match evidence. Every stage consumes the full output of the previous one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BulletRecommender {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final SemanticRetriever semanticRetriever;
    private final CrossEncoderReranker reranker;
    private final PriorityExtractor priorityExtractor;
    private final PhraseExtractor phraseExtractor;
    private final EmbeddingModel embeddingModel;
    private final RecommenderConfig recommenderConfig;

    /**
     * Recommend bullets with integer scores and the job phrases each one matched.
     *
     * @param bullets The role's bullet pool
     * @param jobText The job description
     * @param topN    How many bullets to keep; pass the pool size to rank all of them
     * @return Bullets sorted by descending score
     */
    public List<ScoredBullet> recommendWithMatches(List<BulletRecord> bullets, String jobText, int topN) {
        if (bullets == null || bullets.isEmpty() || jobText == null || jobText.isBlank() || topN <= 0) {
            return List.of();
        }

        List<String> texts = bullets.stream().map(bullet -> normalize(bullet.getBullet())).toList();

        List<RankedCandidate> retrieved = semanticRetriever.retrieve(jobText, texts, topN).stream()
                .map(hit -> hit.withScore(hit.score() * recommenderConfig.getScoreScale()))
                .toList();

        List<RankedCandidate> reranked = reranker.rerank(jobText, retrieved);

        List<ScoredBullet> boosted = applyPriorityBoosting(bullets, reranked, jobText);
        log.debug("Ranked {} of {} bullets", boosted.size(), bullets.size());
        return boosted;
    }

    /**
     * Lowercase and collapse whitespace; this is the text that gets embedded and re-ranked.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text.toLowerCase(Locale.ROOT).strip()).replaceAll(" ");
    }

    private List<ScoredBullet> applyPriorityBoosting(List<BulletRecord> bullets, List<RankedCandidate> reranked,
                                                     String jobText) {
        if (reranked.isEmpty()) {
            return List.of();
        }

        List<String> phrases = phraseExtractor.extract(jobText);
        List<float[]> phraseVectors = phrases.isEmpty() ? List.of() : embeddingModel.embedAll(phrases);
        List<float[]> bulletVectors = phrases.isEmpty()
                ? List.of()
                : embeddingModel.embedAll(reranked.stream().map(RankedCandidate::text).toList());

        PrioritySet priorities = priorityExtractor.extract(jobText);

        List<ScoredBullet> adjusted = new ArrayList<>(reranked.size());
        for (int i = 0; i < reranked.size(); i++) {
            RankedCandidate candidate = reranked.get(i);
            String text = candidate.text();

            List<String> matched = phrases.isEmpty()
                    ? List.of()
                    : matchPhrases(bulletVectors.get(i), phrases, phraseVectors);

            double score = candidate.score();
            for (String mustHave : priorities.mustHave()) {
                if (text.contains(mustHave.toLowerCase(Locale.ROOT))) {
                    score += recommenderConfig.getMustHaveBoost();
                }
            }
            for (String niceToHave : priorities.niceToHave()) {
                if (text.contains(niceToHave.toLowerCase(Locale.ROOT))) {
                    score += recommenderConfig.getNiceToHaveBoost();
                }
            }

            BulletRecord bullet = bullets.get(candidate.index());
            adjusted.add(new ScoredBullet(bullet, (int) score, matched));
            log.debug("Bullet '{}' -> {} (matches {})", abbreviate(bullet.getBullet()), (int) score, matched);
        }

        adjusted.sort(Comparator.comparingInt(ScoredBullet::score).reversed());
        return adjusted;
    }

    /**
     * Top phrases by cosine similarity to the bullet that clear the match threshold.
     */
    private List<String> matchPhrases(float[] bulletVector, List<String> phrases, List<float[]> phraseVectors) {
        double[] similarities = new double[phrases.size()];
        for (int j = 0; j < phrases.size(); j++) {
            similarities[j] = VectorMath.cosine(bulletVector, phraseVectors.get(j));
        }
        return IntStream.range(0, phrases.size())
                .boxed()
                .sorted(Comparator.comparingDouble((Integer j) -> similarities[j]).reversed())
                .limit(recommenderConfig.getMaxMatchedPhrases())
                .filter(j -> similarities[j] > recommenderConfig.getMatchThreshold())
                .map(phrases::get)
                .toList();
    }

    private String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 60 ? text.substring(0, 60) + "..." : text;
    }
}
