package dev.resumetailor.model;

/**
 * Relative strength of a bullet's score within its role's ranked list.
 */
public enum ScoreBand {
    HIGH,
    MEDIUM,
    LOW;

    public static ScoreBand of(int score, int minScore, int maxScore) {
        double fraction = maxScore == minScore
                ? 1.0
                : (score - minScore) / (double) (maxScore - minScore);
        if (fraction > 0.7) {
            return HIGH;
        }
        if (fraction > 0.4) {
            return MEDIUM;
        }
        return LOW;
    }
}
