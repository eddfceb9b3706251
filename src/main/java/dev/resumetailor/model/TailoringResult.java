package dev.resumetailor.model;

import java.util.List;
import java.util.Map;

/**
 * Full output of one tailoring run.
 *
 * @param rankedBullets  every role's bullet pool, best first
 * @param selectedBullets default pick per role, honouring the selection requirements
 * @param skillGroups    recommended skill categories in selection order
 * @param skillLines     budgeted skill strings keyed SKILL_1, SKILL_2, ...
 * @param selectionReport count and line budget check of the default pick
 * @param templateData   placeholder values for the document renderer
 */
public record TailoringResult(
        Map<String, List<ScoredBullet>> rankedBullets,
        Map<String, List<ScoredBullet>> selectedBullets,
        List<SkillGroup> skillGroups,
        Map<String, SkillLine> skillLines,
        SelectionReport selectionReport,
        Map<String, String> templateData) {
}
