package dev.resumetailor.service;

import dev.resumetailor.ai.EmbeddingModel;
import dev.resumetailor.ai.ModelInvocationException;
import dev.resumetailor.ai.impl.HashingEmbeddingModel;
import dev.resumetailor.ai.impl.HeuristicTextAnalyzer;
import dev.resumetailor.ai.impl.TokenOverlapRelevanceModel;
import dev.resumetailor.config.RecommenderConfig;
import dev.resumetailor.config.ScoringConfig;
import dev.resumetailor.config.TailorConfig;
import dev.resumetailor.metrics.TailorMetrics;
import dev.resumetailor.model.BulletRecord;
import dev.resumetailor.model.CandidateData;
import dev.resumetailor.model.ScoredBullet;
import dev.resumetailor.model.SkillGroup;
import dev.resumetailor.model.SkillLine;
import dev.resumetailor.model.SkillTaxonomy;
import dev.resumetailor.model.TailoringResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TailoringServiceTest {

    private static final String JOB = """
            Backend Engineer - Payments
            Must have:
            - Java and Spring Boot
            - Kafka streams
            Nice to have:
            - AWS and Kubernetes
            """;

    private MeterRegistry meterRegistry;
    private TailorConfig tailorConfig;
    private RecommenderConfig recommenderConfig;
    private CandidateData candidate;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        recommenderConfig = new RecommenderConfig();
        tailorConfig = new TailorConfig();
        tailorConfig.getSelectionRequirements().put("Nodelink", 2);
        tailorConfig.getSelectionRequirements().put("MAMM", 1);
        tailorConfig.setLineBudget(4);

        Map<String, List<BulletRecord>> bullets = new LinkedHashMap<>();
        bullets.put("Nodelink", List.of(
                bullet("Nodelink", "Built Kafka streams consumers for payment events", 1),
                bullet("Nodelink", "Organized weekly demo sessions", 1),
                bullet("Nodelink", "Migrated Java services to Spring Boot 3", 2)));
        bullets.put("MAMM", List.of(
                bullet("MAMM", "Deployed models on AWS with Kubernetes", 1),
                bullet("MAMM", "Wrote documentation", 1)));

        Map<String, List<String>> skills = new LinkedHashMap<>();
        skills.put("Java", List.of("Programming Languages"));
        skills.put("Kafka", List.of("Messaging"));
        skills.put("AWS", List.of("Cloud Platforms"));
        skills.put("Kubernetes", List.of("Cloud Platforms"));

        candidate = CandidateData.builder()
                .bulletsByRole(bullets)
                .skills(SkillTaxonomy.of(skills))
                .build();
    }

    private static BulletRecord bullet(String role, String text, int lines) {
        return BulletRecord.builder().role(role).bullet(text).lines(lines).build();
    }

    private TailoringService service(EmbeddingModel embeddingModel) {
        BulletRecommender bulletRecommender = new BulletRecommender(
                new SemanticRetriever(embeddingModel),
                new CrossEncoderReranker(new TokenOverlapRelevanceModel(), recommenderConfig),
                new PriorityExtractor(new HeuristicTextAnalyzer()),
                new PhraseExtractor(recommenderConfig),
                embeddingModel,
                recommenderConfig);
        return new TailoringService(
                bulletRecommender,
                new CandidateScorer(new ScoringConfig()),
                new SkillFormatter(recommenderConfig),
                new SelectionService(tailorConfig),
                new TemplateDataAssembler(tailorConfig),
                recommenderConfig,
                new TailorMetrics(meterRegistry));
    }

    @Test
    @DisplayName("Should rank every role, recommend skills and prepare the default selection")
    void shouldTailorEndToEnd() {
        TailoringResult result = service(new HashingEmbeddingModel(384)).tailor(JOB, candidate);

        assertThat(result.rankedBullets()).containsOnlyKeys("Nodelink", "MAMM");
        assertThat(result.rankedBullets().get("Nodelink")).hasSize(3);
        assertThat(result.rankedBullets().get("MAMM")).hasSize(2);
        assertThat(result.rankedBullets().get("MAMM").get(0).bullet().getBullet())
                .isEqualTo("Deployed models on AWS with Kubernetes");

        assertThat(result.selectedBullets().get("Nodelink")).hasSize(2);
        assertThat(result.selectedBullets().get("MAMM")).hasSize(1);
        assertThat(result.selectionReport().issues()).isEmpty();

        assertThat(result.skillGroups()).extracting(SkillGroup::category)
                .contains("Cloud Platforms", "Programming Languages", "Messaging");
        assertThat(result.skillLines()).containsKey("SKILL_1");
        assertThat(result.skillLines().values()).allSatisfy(line ->
                assertThat(line.status()).isNotEqualTo(SkillLine.Status.OVER_LIMIT));

        assertThat(result.templateData())
                .containsKeys("NODELINK_P1", "NODELINK_P5", "MAMM_P1", "SKILL_4")
                .containsEntry("MAMM_P1", "Deployed models on AWS with Kubernetes");
    }

    @Test
    @DisplayName("Should boost must-have bullets to the top of their role")
    void shouldBoostMustHaveBullets() {
        TailoringResult result = service(new HashingEmbeddingModel(384)).tailor(JOB, candidate);

        List<ScoredBullet> nodelink = result.rankedBullets().get("Nodelink");
        assertThat(nodelink.get(nodelink.size() - 1).bullet().getBullet()).isEqualTo("Organized weekly demo sessions");
    }

    @Test
    @DisplayName("Should record run metrics")
    void shouldRecordMetrics() {
        TailoringResult result = service(new HashingEmbeddingModel(384)).tailor(JOB, candidate);

        assertThat(meterRegistry.counter("resume_tailor_runs_total").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("resume_tailor_bullets_ranked_total").count()).isEqualTo(5.0);
        assertThat(meterRegistry.counter("resume_tailor_skill_groups_total").count())
                .isEqualTo(result.skillGroups().size());
        assertThat(meterRegistry.get("resume_tailor_last_run_line_budget").gauge().value()).isEqualTo(4.0);
        assertThat(meterRegistry.get("resume_tailor_stage_duration").tag("stage", "bullets").timer().count())
                .isEqualTo(1);
    }

    @Test
    @DisplayName("Should return empty rankings for a blank job description")
    void shouldHandleBlankJob() {
        TailoringResult result = service(new HashingEmbeddingModel(384)).tailor("  ", candidate);

        assertThat(result.rankedBullets().get("Nodelink")).isEmpty();
        assertThat(result.skillGroups()).isEmpty();
        assertThat(result.selectionReport().isValid()).isFalse();
    }

    @Test
    @DisplayName("Should count model failures and rethrow")
    void shouldRecordModelFailure() {
        EmbeddingModel failing = new EmbeddingModel() {
            @Override
            public List<float[]> embedAll(List<String> texts) {
                throw new ModelInvocationException("embeddings unavailable");
            }

            @Override
            public String getName() {
                return "failing";
            }
        };

        TailoringService service = service(failing);

        assertThatThrownBy(() -> service.tailor(JOB, candidate))
                .isInstanceOf(ModelInvocationException.class);
        assertThat(meterRegistry.counter("resume_tailor_model_failures_total").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("resume_tailor_runs_total").count()).isZero();
    }
}
