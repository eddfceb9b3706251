package dev.resumetailor.ai;

import java.util.List;

/**
 * Sentence segmentation, tokenization and noun-phrase chunking.
 */
public interface TextAnalyzer {

    /**
     * Split text into trimmed, non-blank sentences in document order.
     */
    List<String> sentences(String text);

    /**
     * Lowercase word tokens of a sentence. Hyphenated compounds stay a single token.
     */
    List<String> tokens(String sentence);

    /**
     * Noun-phrase spans of a sentence, verbatim and trimmed, in order of appearance.
     */
    List<String> nounChunks(String sentence);
}
