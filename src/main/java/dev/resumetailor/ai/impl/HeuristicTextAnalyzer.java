package dev.resumetailor.ai.impl;

import dev.resumetailor.ai.TextAnalyzer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based sentence splitter and noun-phrase chunker for job descriptions.
 * <p>
 * Sentences end at line breaks and after {@code . ! ? ; :} followed by whitespace, so a
 * heading such as "Must have:" stands apart from the requirement that follows it.
 * Noun chunks are the longest runs of words between punctuation and closed-class words
 * (determiners, prepositions, conjunctions, pronouns, auxiliaries and frequent verbs).
 */
@Component
public class HeuristicTextAnalyzer implements TextAnalyzer {

    private static final Pattern LINE_BREAK = Pattern.compile("\\R+");
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?;:])\\s+");
    private static final Pattern LIST_MARKER = Pattern.compile("^(?:[-*•·▪–]|\\d+[.)])\\s+");
    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]+(?:-[\\p{L}\\p{N}]+)*");
    private static final Pattern CHUNK_BOUNDARY =
            Pattern.compile("[,;:()\\[\\]{}!?\"“”]|\\.(?=\\s|$)|\\s[-–—]\\s");
    private static final Pattern WORD_EDGES = Pattern.compile("^[^\\p{L}\\p{N}]+|[^\\p{L}\\p{N}+#]+$");

    static final Set<String> CLOSED_CLASS = Set.of(
            // determiners
            "a", "an", "the", "this", "that", "these", "those", "our", "your", "their", "its", "my",
            "his", "her", "any", "some", "all", "each", "every", "no", "another", "other", "such",
            // prepositions
            "of", "in", "on", "at", "to", "for", "with", "by", "from", "into", "about", "across",
            "through", "over", "under", "within", "without", "as", "per", "via", "like", "including",
            "between", "among", "around", "towards", "toward", "using",
            // conjunctions
            "and", "or", "but", "nor", "so", "yet", "while", "if", "than", "then", "because",
            "although", "whether", "plus", "etc",
            // pronouns
            "you", "we", "they", "i", "he", "she", "it", "us", "them", "who", "which", "what",
            "whom", "whose", "where", "when", "how",
            // auxiliaries and modals
            "is", "are", "was", "were", "be", "been", "being", "am", "have", "has", "had", "do",
            "does", "did", "will", "would", "shall", "should", "can", "could", "may", "might",
            "must", "need", "needs", "not", "also", "very", "well", "more", "most",
            // verbs that open requirement sentences
            "work", "build", "design", "develop", "lead", "manage", "join", "help", "ensure",
            "support", "collaborate", "write", "own", "drive", "deliver", "create", "looking",
            "seeking", "know", "understand", "apply", "bring", "want", "required", "preferred",
            "prefer", "ideally",
            // contractions
            "we'd", "we'll", "we're", "we've", "you'd", "you'll", "you're", "you've", "they'd",
            "they'll", "they're", "it's", "i'd", "i'm", "i've", "there's", "that's", "don't",
            "doesn't", "isn't", "aren't", "won't", "can't", "shouldn't", "wouldn't");

    @Override
    public List<String> sentences(String text) {
        List<String> sentences = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return sentences;
        }
        for (String line : LINE_BREAK.split(text)) {
            String stripped = LIST_MARKER.matcher(line.strip()).replaceFirst("");
            for (String piece : SENTENCE_END.split(stripped)) {
                String sentence = piece.strip();
                if (!sentence.isEmpty()) {
                    sentences.add(sentence);
                }
            }
        }
        return sentences;
    }

    @Override
    public List<String> tokens(String sentence) {
        List<String> tokens = new ArrayList<>();
        if (sentence == null) {
            return tokens;
        }
        Matcher matcher = TOKEN.matcher(sentence.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    @Override
    public List<String> nounChunks(String sentence) {
        List<String> chunks = new ArrayList<>();
        if (sentence == null || sentence.isBlank()) {
            return chunks;
        }
        for (String segment : CHUNK_BOUNDARY.split(sentence)) {
            List<String> current = new ArrayList<>();
            for (String word : segment.strip().split("\\s+")) {
                String bare = WORD_EDGES.matcher(word).replaceAll("");
                if (bare.isEmpty() || isClosedClass(bare)) {
                    flush(current, chunks);
                } else {
                    current.add(bare);
                }
            }
            flush(current, chunks);
        }
        return chunks;
    }

    private static boolean isClosedClass(String word) {
        return CLOSED_CLASS.contains(word.toLowerCase(Locale.ROOT).replace('\u2019', '\''));
    }

    private void flush(List<String> words, List<String> chunks) {
        if (!words.isEmpty()) {
            chunks.add(String.join(" ", words).strip());
            words.clear();
        }
    }
}
