package dev.resumetailor.model;

import java.util.List;

/**
 * A bullet with its final integer relevance score and the job phrases it matched.
 */
public record ScoredBullet(
        BulletRecord bullet,
        int score,
        List<String> matchedPhrases) {

    public ScoredBullet {
        matchedPhrases = matchedPhrases == null ? List.of() : List.copyOf(matchedPhrases);
    }
}
