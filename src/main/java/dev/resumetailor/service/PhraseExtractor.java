package dev.resumetailor.service;

import dev.resumetailor.config.RecommenderConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the most salient skill-like phrases (unigrams, bigrams and trigrams) out of a job description.
 */
@Service
@RequiredArgsConstructor
public class PhraseExtractor {

    public static final Set<String> STOPWORDS = Set.of(
            "using", "with", "and", "or", "the", "for", "in", "on", "at", "to", "from", "by", "of",
            "experience", "experienced", "years", "year", "skills", "skill", "ability", "abilities",
            "work", "works", "working", "used", "use", "apply", "applied", "that", "is", "are",
            "a", "an", "as", "be", "have", "has", "will", "would", "should", "can", "may", "technologies");

    private static final Pattern WORD = Pattern.compile("\\w{3,}", Pattern.UNICODE_CHARACTER_CLASS);

    private final RecommenderConfig recommenderConfig;

    /**
     * Extract the configured number of candidate phrases.
     */
    public List<String> extract(String jobText) {
        return extract(jobText, recommenderConfig.getPhraseTopK());
    }

    /**
     * Extract up to {@code topK} phrases ranked by frequency, then by length.
     * <p>
     * Unigrams are counted once each; bigrams and trigrams are counted per occurrence in
     * the filtered token stream, so repeated multi-word phrases rise to the top.
     *
     * @param jobText The job description
     * @param topK    Maximum number of phrases to return
     * @return Lowercase phrases, best first
     */
    public List<String> extract(String jobText, int topK) {
        if (jobText == null || jobText.isBlank() || topK <= 0) {
            return List.of();
        }

        List<String> words = new ArrayList<>();
        Matcher matcher = WORD.matcher(jobText.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String word = matcher.group();
            if (!STOPWORDS.contains(word)) {
                words.add(word);
            }
        }
        if (words.isEmpty()) {
            return List.of();
        }

        List<String> candidates = new ArrayList<>(new LinkedHashSet<>(words));
        for (int i = 0; i + 1 < words.size(); i++) {
            candidates.add(words.get(i) + " " + words.get(i + 1));
        }
        for (int i = 0; i + 2 < words.size(); i++) {
            candidates.add(words.get(i) + " " + words.get(i + 1) + " " + words.get(i + 2));
        }

        Map<String, Integer> frequency = new LinkedHashMap<>();
        for (String candidate : candidates) {
            frequency.merge(candidate, 1, Integer::sum);
        }

        return frequency.entrySet().stream()
                .sorted(Comparator.comparing(Map.Entry<String, Integer>::getValue, Comparator.reverseOrder())
                        .thenComparing(entry -> entry.getKey().length(), Comparator.reverseOrder()))
                .limit(topK)
                .map(Map.Entry::getKey)
                .toList();
    }
}
