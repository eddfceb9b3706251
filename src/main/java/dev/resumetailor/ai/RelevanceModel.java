package dev.resumetailor.ai;

import java.util.List;

/**
 * Joint (query, candidate) relevance scorer in the style of a cross-encoder.
 */
public interface RelevanceModel {

    /**
     * Score every candidate against the query.
     *
     * @param query      The query text, typically a job description
     * @param candidates Candidate texts
     * @return One score per candidate, in input order; higher means more relevant
     * @throws ModelInvocationException if the backing model fails
     */
    List<Double> score(String query, List<String> candidates);

    String getName();
}
