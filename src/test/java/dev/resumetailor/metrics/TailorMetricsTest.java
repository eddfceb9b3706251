package dev.resumetailor.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TailorMetricsTest {

    private MeterRegistry meterRegistry;
    private TailorMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new TailorMetrics(meterRegistry);
    }

    @Nested
    @DisplayName("Counters")
    class CounterTests {

        @Test
        @DisplayName("Should record runs")
        void shouldRecordRuns() {
            metrics.recordRun();
            metrics.recordRun();

            assertThat(meterRegistry.counter("resume_tailor_runs_total").count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("Should accumulate bullets ranked")
        void shouldAccumulateBulletsRanked() {
            metrics.recordBulletsRanked(5);
            metrics.recordBulletsRanked(3);

            assertThat(meterRegistry.counter("resume_tailor_bullets_ranked_total").count()).isEqualTo(8.0);
        }

        @Test
        @DisplayName("Should record skill groups")
        void shouldRecordSkillGroups() {
            metrics.recordSkillGroups(4);

            assertThat(meterRegistry.counter("resume_tailor_skill_groups_total").count()).isEqualTo(4.0);
        }

        @Test
        @DisplayName("Should record model failures in total and by stage")
        void shouldRecordModelFailures() {
            metrics.recordModelFailure("bullets");

            assertThat(meterRegistry.counter("resume_tailor_model_failures_total").count()).isEqualTo(1.0);
            assertThat(meterRegistry.counter("resume_tailor_model_failures_by_stage_total", "stage", "bullets").count())
                    .isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Timers")
    class TimerTests {

        @Test
        @DisplayName("Should reuse the timer of a stage")
        void shouldReuseStageTimer() {
            var timer1 = metrics.getStageTimer("bullets");
            var timer2 = metrics.getStageTimer("bullets");

            assertThat(timer1).isSameAs(timer2);
        }

        @Test
        @DisplayName("Should keep stages apart")
        void shouldSeparateStages() {
            metrics.getStageTimer("bullets").record(Duration.ofMillis(120));

            assertThat(metrics.getStageTimer("bullets").count()).isEqualTo(1);
            assertThat(metrics.getStageTimer("skills").count()).isZero();
        }
    }

    @Test
    @DisplayName("Should overwrite last run gauges")
    void shouldUpdateLastRunStats() {
        metrics.updateLastRunStats(19, 21);
        metrics.updateLastRunStats(21, 21);

        assertThat(meterRegistry.get("resume_tailor_last_run_selected_lines").gauge().value()).isEqualTo(21.0);
        assertThat(meterRegistry.get("resume_tailor_last_run_line_budget").gauge().value()).isEqualTo(21.0);
    }
}
