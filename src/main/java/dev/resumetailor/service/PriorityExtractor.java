package dev.resumetailor.service;

import dev.resumetailor.ai.TextAnalyzer;
import dev.resumetailor.model.PrioritySet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits a job description's requirements into "must have" and "nice to have" phrases
 * by following section headings.
 * <p>
 * A sentence containing a heading switches the current section and contributes nothing
 * else. Sentences before the first heading are ignored. Missed headings are expected;
 * this is a structural heuristic, not a requirement parser.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PriorityExtractor {

    private enum Section {
        MUST_HAVE,
        NICE_TO_HAVE
    }

    private record Header(Section section, List<String> tokens) {
    }

    private static final List<Header> HEADERS = List.of(
            new Header(Section.MUST_HAVE, List.of("must", "have")),
            new Header(Section.MUST_HAVE, List.of("must-have")),
            new Header(Section.MUST_HAVE, List.of("required")),
            new Header(Section.MUST_HAVE, List.of("essential")),
            new Header(Section.NICE_TO_HAVE, List.of("nice", "to", "have")),
            new Header(Section.NICE_TO_HAVE, List.of("nice-to-have")),
            new Header(Section.NICE_TO_HAVE, List.of("preferred")),
            new Header(Section.NICE_TO_HAVE, List.of("might", "also", "have")));

    private final TextAnalyzer textAnalyzer;

    /**
     * Extract prioritized requirement phrases from a job description.
     *
     * @param jobText The job description
     * @return Deduplicated phrases per section, in first-seen order
     */
    public PrioritySet extract(String jobText) {
        if (jobText == null || jobText.isBlank()) {
            return PrioritySet.empty();
        }

        Set<String> mustHave = new LinkedHashSet<>();
        Set<String> niceToHave = new LinkedHashSet<>();
        Section current = null;

        for (String sentence : textAnalyzer.sentences(jobText)) {
            Section header = detectHeader(textAnalyzer.tokens(sentence));
            if (header != null) {
                current = header;
                continue;
            }
            if (current == null) {
                continue;
            }
            Set<String> target = current == Section.MUST_HAVE ? mustHave : niceToHave;
            for (String chunk : textAnalyzer.nounChunks(sentence)) {
                String phrase = chunk.strip();
                if (!phrase.isEmpty()) {
                    target.add(phrase);
                }
            }
        }

        log.debug("Priorities: must have {}, nice to have {}", mustHave, niceToHave);
        return new PrioritySet(new ArrayList<>(mustHave), new ArrayList<>(niceToHave));
    }

    /**
     * Find the heading that starts earliest in the sentence.
     */
    private Section detectHeader(List<String> tokens) {
        for (int start = 0; start < tokens.size(); start++) {
            for (Header header : HEADERS) {
                if (matchesAt(tokens, start, header.tokens())) {
                    return header.section();
                }
            }
        }
        return null;
    }

    private boolean matchesAt(List<String> tokens, int start, List<String> pattern) {
        if (start + pattern.size() > tokens.size()) {
            return false;
        }
        for (int i = 0; i < pattern.size(); i++) {
            if (!tokens.get(start + i).equals(pattern.get(i))) {
                return false;
            }
        }
        return true;
    }
}
