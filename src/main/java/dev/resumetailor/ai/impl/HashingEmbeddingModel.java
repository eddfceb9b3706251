package dev.resumetailor.ai.impl;

import dev.resumetailor.ai.EmbeddingModel;
import dev.resumetailor.ai.VectorMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Local embedding model based on signed feature hashing of word unigrams and bigrams.
 * Needs no model files or network and is fully deterministic; texts sharing words end
 * up close in cosine space.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.embedding.provider", havingValue = "hashing", matchIfMissing = true)
public class HashingEmbeddingModel implements EmbeddingModel {

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}+#]+");
    private static final float BIGRAM_WEIGHT = 0.5f;

    private final int dimensions;

    public HashingEmbeddingModel(@Value("${app.ai.embedding.hashing.dimensions:384}") int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("Embedding dimensions must be positive: " + dimensions);
        }
        this.dimensions = dimensions;
        log.info("Using local hashing embeddings ({} dimensions)", dimensions);
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embedOne(text));
        }
        return vectors;
    }

    @Override
    public String getName() {
        return "hashing";
    }

    private float[] embedOne(String text) {
        float[] vector = new float[dimensions];
        if (text == null || text.isBlank()) {
            return vector;
        }

        List<String> words = new ArrayList<>();
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            words.add(matcher.group());
        }

        for (int i = 0; i < words.size(); i++) {
            addFeature(vector, "w:" + words.get(i), 1.0f);
            if (i + 1 < words.size()) {
                addFeature(vector, "b:" + words.get(i) + " " + words.get(i + 1), BIGRAM_WEIGHT);
            }
        }
        return VectorMath.normalize(vector);
    }

    private void addFeature(float[] vector, String feature, float weight) {
        int hash = feature.hashCode() * 0x9E3779B9;
        int slot = Math.floorMod(hash, dimensions);
        float sign = ((hash >>> 29) & 1) == 0 ? 1.0f : -1.0f;
        vector[slot] += sign * weight;
    }
}
