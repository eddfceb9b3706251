package dev.resumetailor.service;

import dev.resumetailor.ai.ModelInvocationException;
import dev.resumetailor.config.RecommenderConfig;
import dev.resumetailor.metrics.TailorMetrics;
import dev.resumetailor.model.BulletRecord;
import dev.resumetailor.model.CandidateData;
import dev.resumetailor.model.ScoredBullet;
import dev.resumetailor.model.SelectionReport;
import dev.resumetailor.model.SkillGroup;
import dev.resumetailor.model.SkillLine;
import dev.resumetailor.model.TailoringResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Main orchestration service: ranks every role's bullets, recommends skills and
 * prepares the default selection for one job description.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TailoringService {

    static final String STAGE_BULLETS = "bullets";
    static final String STAGE_SKILLS = "skills";

    private final BulletRecommender bulletRecommender;
    private final CandidateScorer candidateScorer;
    private final SkillFormatter skillFormatter;
    private final SelectionService selectionService;
    private final TemplateDataAssembler templateDataAssembler;
    private final RecommenderConfig recommenderConfig;
    private final TailorMetrics metrics;

    /**
     * Run the full tailoring pipeline.
     *
     * @param jobText   Job description text
     * @param candidate Bullet pools and skill taxonomy
     * @return Ranked bullets, skills, default selection and template data
     * @throws ModelInvocationException if an embedding or relevance model call fails
     */
    public TailoringResult tailor(String jobText, CandidateData candidate) {
        Map<String, List<ScoredBullet>> ranked = rankAllRoles(jobText, candidate);
        List<SkillGroup> skillGroups = recommendSkills(jobText, candidate);

        Map<String, SkillLine> skillLines = new LinkedHashMap<>();
        for (int i = 0; i < skillGroups.size(); i++) {
            SkillGroup group = skillGroups.get(i);
            String text = skillFormatter.formatWithLimit(group.category(), group.skills());
            skillLines.put("SKILL_" + (i + 1), SkillLine.of(text, recommenderConfig.getSkillCharLimit()));
        }

        Map<String, List<ScoredBullet>> selection = selectionService.defaultSelection(ranked);
        SelectionReport report = selectionService.validate(selection);
        Map<String, String> templateData = templateDataAssembler.assemble(selection, skillLines);

        metrics.recordRun();
        metrics.updateLastRunStats(report.totalLines(), report.lineBudget());

        return new TailoringResult(ranked, selection, skillGroups,
                Collections.unmodifiableMap(skillLines), report, templateData);
    }

    private Map<String, List<ScoredBullet>> rankAllRoles(String jobText, CandidateData candidate) {
        try {
            return metrics.getStageTimer(STAGE_BULLETS).record(() -> {
                Map<String, List<ScoredBullet>> ranked = new LinkedHashMap<>();
                candidate.getBulletsByRole().forEach((role, pool) -> {
                    List<ScoredBullet> scored = rankRole(role, pool, jobText);
                    ranked.put(role, scored);
                });
                return Collections.unmodifiableMap(ranked);
            });
        } catch (ModelInvocationException e) {
            metrics.recordModelFailure(STAGE_BULLETS);
            throw e;
        }
    }

    private List<ScoredBullet> rankRole(String role, List<BulletRecord> pool, String jobText) {
        List<ScoredBullet> scored = bulletRecommender.recommendWithMatches(pool, jobText, pool.size());
        metrics.recordBulletsRanked(scored.size());
        log.info("Ranked {} bullet(s) for {}", scored.size(), role);
        return scored;
    }

    private List<SkillGroup> recommendSkills(String jobText, CandidateData candidate) {
        List<SkillGroup> groups = metrics.getStageTimer(STAGE_SKILLS).record(() -> {
            SkillRecommender recommender = new SkillRecommender(candidate.getSkills(), candidateScorer,
                    recommenderConfig.getMaxSkillsPerCategory());
            return recommender.recommendSkills(jobText, recommenderConfig.getNumCategories());
        });
        metrics.recordSkillGroups(groups.size());
        log.info("Recommended {} skill group(s)", groups.size());
        return groups;
    }
}
