package dev.resumetailor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weights for lexical candidate scoring.
 * Loaded from application.yml under 'scoring' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scoring")
public class ScoringConfig {

    private double directMatch = 10.0;
    private double wordBoundary = 5.0;
    private double wordToken = 1.0;
    private double relatedTerm = 0.5;

    // base skill -> terms whose presence in the job text hints at it
    private Map<String, List<String>> relatedTerms = defaultRelatedTerms();

    public static Map<String, List<String>> defaultRelatedTerms() {
        Map<String, List<String>> terms = new LinkedHashMap<>();
        terms.put("python", List.of("django", "flask", "pandas", "numpy", "scikit"));
        terms.put("javascript", List.of("js", "react", "angular", "vue", "node"));
        terms.put("java", List.of("spring", "maven", "gradle"));
        terms.put("sql", List.of("database", "mysql", "postgresql", "oracle"));
        terms.put("cloud", List.of("aws", "azure", "gcp", "kubernetes", "docker"));
        terms.put("machine learning", List.of("ml", "ai", "neural", "tensorflow", "pytorch"));
        terms.put("frontend", List.of("react", "angular", "vue", "css", "html"));
        terms.put("backend", List.of("api", "server", "database", "microservices"));
        terms.put("devops", List.of("ci/cd", "deployment", "automation", "infrastructure"));
        return terms;
    }
}
