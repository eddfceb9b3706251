package dev.resumetailor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Tuning for the bullet and skill recommenders.
 * Loaded from application.yml under 'recommender' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "recommender")
public class RecommenderConfig {

    // Retrieval similarity and cross-encoder scores are multiplied by this
    private double scoreScale = 100.0;

    private int phraseTopK = 40;
    private double matchThreshold = 0.1;
    private int maxMatchedPhrases = 3;

    private int mustHaveBoost = 20;
    private int niceToHaveBoost = 10;

    private int numCategories = 4;
    private int maxSkillsPerCategory = 4;
    private int skillCharLimit = 50;
}
