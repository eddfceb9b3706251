package dev.resumetailor.ai;

import java.util.List;

/**
 * Turns texts into dense vectors. Implementations hold their model state for the
 * lifetime of the application and are shared across recommendation calls.
 */
public interface EmbeddingModel {

    /**
     * Embed a batch of texts in one call.
     *
     * @param texts Texts to embed
     * @return One vector per text, in input order
     * @throws ModelInvocationException if the backing model cannot produce embeddings
     */
    List<float[]> embedAll(List<String> texts);

    /**
     * Embed a single text.
     */
    default float[] embed(String text) {
        return embedAll(List.of(text)).get(0);
    }

    /**
     * Name used in logs and metrics.
     */
    String getName();
}
