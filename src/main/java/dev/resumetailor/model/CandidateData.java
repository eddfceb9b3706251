package dev.resumetailor.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything the candidate supplies: bullet pools grouped by role and the skill taxonomy.
 */
@Value
@Builder
public class CandidateData {

    @Builder.Default
    Map<String, List<BulletRecord>> bulletsByRole = Map.of();

    @Builder.Default
    SkillTaxonomy skills = SkillTaxonomy.empty();

    public List<BulletRecord> bulletsFor(String role) {
        return bulletsByRole.getOrDefault(role, List.of());
    }
}
