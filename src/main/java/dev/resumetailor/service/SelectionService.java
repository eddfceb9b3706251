package dev.resumetailor.service;

import dev.resumetailor.config.TailorConfig;
import dev.resumetailor.model.ScoreBand;
import dev.resumetailor.model.ScoredBullet;
import dev.resumetailor.model.SelectionReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the default bullets per role and checks a selection against the page constraints.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SelectionService {

    private final TailorConfig tailorConfig;

    /**
     * Take the first N ranked bullets of every role that has a selection requirement.
     * Roles without a requirement are not selected.
     */
    public Map<String, List<ScoredBullet>> defaultSelection(Map<String, List<ScoredBullet>> rankedByRole) {
        Map<String, List<ScoredBullet>> selection = new LinkedHashMap<>();
        tailorConfig.getSelectionRequirements().forEach((role, required) -> {
            List<ScoredBullet> ranked = rankedByRole.get(role);
            if (ranked == null) {
                log.warn("No bullets available for role '{}'", role);
                selection.put(role, List.of());
                return;
            }
            selection.put(role, List.copyOf(ranked.subList(0, Math.min(Math.max(required, 0), ranked.size()))));
        });
        return Collections.unmodifiableMap(selection);
    }

    /**
     * Check per-role counts and the total line cost of a selection.
     */
    public SelectionReport validate(Map<String, List<ScoredBullet>> selection) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        List<String> issues = new ArrayList<>();

        tailorConfig.getSelectionRequirements().forEach((role, required) -> {
            int count = selection.getOrDefault(role, List.of()).size();
            counts.put(role, count);
            if (count != required) {
                issues.add(String.format("Select exactly %d bullets for %s (currently %d)", required, role, count));
            }
        });

        int totalLines = selection.values().stream()
                .flatMap(List::stream)
                .mapToInt(scored -> scored.bullet().getLines())
                .sum();
        int budget = tailorConfig.getLineBudget();

        SelectionReport report = new SelectionReport(counts, issues, totalLines, budget,
                SelectionReport.lineStatus(totalLines, budget));
        log.info("Selection: {} lines of {} ({}), {} issue(s)", totalLines, budget, report.lineStatus(), issues.size());
        issues.forEach(issue -> log.debug("Selection issue: {}", issue));
        return report;
    }

    /**
     * Band of every bullet relative to the best and worst score in its role's list.
     */
    public List<ScoreBand> bands(List<ScoredBullet> ranked) {
        if (ranked.isEmpty()) {
            return List.of();
        }
        int min = ranked.stream().mapToInt(ScoredBullet::score).min().orElse(0);
        int max = ranked.stream().mapToInt(ScoredBullet::score).max().orElse(0);
        return ranked.stream()
                .map(scored -> ScoreBand.of(scored.score(), min, max))
                .toList();
    }
}
