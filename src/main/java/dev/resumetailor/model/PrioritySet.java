package dev.resumetailor.model;

import java.util.List;

/**
 * Requirement phrases pulled from the "must have" and "nice to have" sections of a job description.
 */
public record PrioritySet(List<String> mustHave, List<String> niceToHave) {

    public PrioritySet {
        mustHave = mustHave == null ? List.of() : List.copyOf(mustHave);
        niceToHave = niceToHave == null ? List.of() : List.copyOf(niceToHave);
    }

    public static PrioritySet empty() {
        return new PrioritySet(List.of(), List.of());
    }

    public boolean isEmpty() {
        return mustHave.isEmpty() && niceToHave.isEmpty();
    }
}
