package dev.resumetailor.ai.impl;

import dev.resumetailor.ai.RelevanceModel;
import dev.resumetailor.service.PhraseExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Local stand-in for a cross-encoder: the share of a candidate's content words that
 * also occur in the query, in [0, 1].
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.reranker.provider", havingValue = "overlap", matchIfMissing = true)
public class TokenOverlapRelevanceModel implements RelevanceModel {

    private static final Pattern WORD = Pattern.compile("\\w{3,}", Pattern.UNICODE_CHARACTER_CLASS);

    public TokenOverlapRelevanceModel() {
        log.info("Using local token-overlap relevance model");
    }

    @Override
    public List<Double> score(String query, List<String> candidates) {
        Set<String> queryWords = new HashSet<>(contentWords(query));
        List<Double> scores = new ArrayList<>(candidates.size());
        for (String candidate : candidates) {
            Set<String> words = contentWords(candidate);
            if (words.isEmpty()) {
                scores.add(0.0);
                continue;
            }
            long hits = words.stream().filter(queryWords::contains).count();
            scores.add(hits / (double) words.size());
        }
        return scores;
    }

    @Override
    public String getName() {
        return "token-overlap";
    }

    private Set<String> contentWords(String text) {
        Set<String> words = new LinkedHashSet<>();
        if (text == null) {
            return words;
        }
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String word = matcher.group();
            if (!PhraseExtractor.STOPWORDS.contains(word)) {
                words.add(word);
            }
        }
        return words;
    }
}
