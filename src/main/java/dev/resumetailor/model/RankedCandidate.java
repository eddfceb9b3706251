package dev.resumetailor.model;

/**
 * A candidate text travelling through retrieval and re-ranking.
 *
 * @param index position of the candidate in the caller's input list, used to map the
 *              result back to its record regardless of text collisions
 * @param text  the text that was embedded and re-ranked
 * @param score current stage score
 */
public record RankedCandidate(int index, String text, double score) {

    public RankedCandidate withScore(double newScore) {
        return new RankedCandidate(index, text, newScore);
    }
}
