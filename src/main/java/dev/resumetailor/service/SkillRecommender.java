package dev.resumetailor.service;

import dev.resumetailor.model.CategoryType;
import dev.resumetailor.model.SkillGroup;
import dev.resumetailor.model.SkillTaxonomy;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recommends skill categories, and the best skills within each, for a job description.
 * <p>
 * Built once per taxonomy; the category index is computed at construction and never
 * modified afterwards, so an instance may be shared by concurrent readers.
 */
@Slf4j
public class SkillRecommender {

    private final SkillTaxonomy taxonomy;
    private final CandidateScorer candidateScorer;
    private final int maxSkillsPerCategory;
    private final Map<String, List<String>> categoriesToSkills;

    public SkillRecommender(SkillTaxonomy taxonomy, CandidateScorer candidateScorer, int maxSkillsPerCategory) {
        this.taxonomy = taxonomy;
        this.candidateScorer = candidateScorer;
        this.maxSkillsPerCategory = maxSkillsPerCategory;
        this.categoriesToSkills = buildCategoryIndex(taxonomy);
    }

    private static Map<String, List<String>> buildCategoryIndex(SkillTaxonomy taxonomy) {
        Map<String, List<String>> index = new LinkedHashMap<>();
        for (String skill : taxonomy.skills()) {
            for (String category : taxonomy.categoriesOf(skill)) {
                if (category != null && !category.isBlank()) {
                    index.computeIfAbsent(category, key -> new ArrayList<>()).add(skill);
                }
            }
        }
        index.replaceAll((category, skills) -> List.copyOf(skills));
        return Collections.unmodifiableMap(index);
    }

    public Map<String, List<String>> getCategoryIndex() {
        return categoriesToSkills;
    }

    /**
     * Recommend up to {@code numCategories} categories with at most the configured
     * number of skills each.
     * <p>
     * A selected category whose skills all scored zero is left out, so fewer groups than
     * requested may come back even when more categories exist.
     *
     * @param jobText       The job description
     * @param numCategories Number of categories wanted
     * @return Groups in category selection order
     */
    public List<SkillGroup> recommendSkills(String jobText, int numCategories) {
        if (jobText == null || jobText.isBlank() || numCategories <= 0 || taxonomy.isEmpty()) {
            return List.of();
        }

        Map<String, Double> skillScores = scoreSkills(jobText);
        Map<String, Double> categoryScores = scoreCategories(skillScores);
        List<String> topCategories = selectTopCategories(categoryScores, numCategories);

        List<SkillGroup> result = new ArrayList<>();
        for (String category : topCategories) {
            List<String> relevant = categoriesToSkills.getOrDefault(category, List.of()).stream()
                    .filter(skillScores::containsKey)
                    .sorted(Comparator.comparingDouble((String skill) -> skillScores.get(skill)).reversed())
                    .limit(maxSkillsPerCategory)
                    .toList();

            if (relevant.isEmpty()) {
                log.debug("Dropping category '{}' - no scoring skills left", category);
                continue;
            }
            result.add(new SkillGroup(category, relevant));
        }

        log.debug("Recommended skill groups: {}", result);
        return result;
    }

    /**
     * Score every skill; skills with no signal are left out.
     */
    Map<String, Double> scoreSkills(String jobText) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (String skill : taxonomy.skills()) {
            double score = candidateScorer.score(skill, jobText);
            if (score > 0) {
                scores.put(skill, score);
            }
        }
        return scores;
    }

    /**
     * Sum the scores of each category's skills.
     */
    Map<String, Double> scoreCategories(Map<String, Double> skillScores) {
        Map<String, Double> scores = new LinkedHashMap<>();
        skillScores.forEach((skill, score) -> {
            for (String category : taxonomy.categoriesOf(skill)) {
                if (category != null && !category.isBlank()) {
                    scores.merge(category, score, Double::sum);
                }
            }
        });
        return scores;
    }

    /**
     * Pick categories by score while keeping their types varied.
     * <p>
     * First pass walks categories best first and takes one whose type is new, always
     * taking the first two. Second pass fills any remaining slots by score alone.
     */
    List<String> selectTopCategories(Map<String, Double> categoryScores, int numCategories) {
        List<String> sorted = categoryScores.entrySet().stream()
                .sorted(Comparator.comparing(Map.Entry<String, Double>::getValue, Comparator.reverseOrder()))
                .map(Map.Entry::getKey)
                .toList();

        Set<String> selected = new LinkedHashSet<>();
        Set<CategoryType> seenTypes = EnumSet.noneOf(CategoryType.class);

        for (String category : sorted) {
            if (selected.size() >= numCategories) {
                break;
            }
            CategoryType type = CategoryType.classify(category);
            if (!seenTypes.contains(type) || selected.size() < 2) {
                selected.add(category);
                seenTypes.add(type);
            }
        }

        for (String category : sorted) {
            if (selected.size() >= numCategories) {
                break;
            }
            selected.add(category);
        }

        return new ArrayList<>(selected);
    }
}
