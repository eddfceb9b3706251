package dev.resumetailor.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for tailoring runs.
 */
@Component
public class TailorMetrics {

    private static final String TAG_STAGE = "stage";
    private final MeterRegistry registry;

    private final Counter runsCounter;
    private final Counter bulletsRankedCounter;
    private final Counter skillGroupsCounter;
    private final Counter modelFailuresCounter;

    // Timers (per stage)
    private final ConcurrentHashMap<String, Timer> stageTimers = new ConcurrentHashMap<>();

    // Gauges
    private final AtomicInteger lastRunSelectedLines = new AtomicInteger(0);
    private final AtomicInteger lastRunLineBudget = new AtomicInteger(0);

    public TailorMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.runsCounter = Counter.builder("resume_tailor_runs_total")
                .description("Total tailoring runs completed")
                .register(registry);

        this.bulletsRankedCounter = Counter.builder("resume_tailor_bullets_ranked_total")
                .description("Total bullets ranked across all roles")
                .register(registry);

        this.skillGroupsCounter = Counter.builder("resume_tailor_skill_groups_total")
                .description("Total skill groups recommended")
                .register(registry);

        this.modelFailuresCounter = Counter.builder("resume_tailor_model_failures_total")
                .description("Total embedding or relevance model failures")
                .register(registry);

        Gauge.builder("resume_tailor_last_run_selected_lines", lastRunSelectedLines, AtomicInteger::get)
                .description("Lines taken by the default selection in the last run")
                .register(registry);

        Gauge.builder("resume_tailor_last_run_line_budget", lastRunLineBudget, AtomicInteger::get)
                .description("Line budget of the last run")
                .register(registry);
    }

    /**
     * Get or create a timer for a pipeline stage.
     */
    public Timer getStageTimer(String stage) {
        return stageTimers.computeIfAbsent(stage, name ->
                Timer.builder("resume_tailor_stage_duration")
                        .description("Time spent in a tailoring stage")
                        .tag(TAG_STAGE, name)
                        .register(registry)
        );
    }

    public void recordRun() {
        runsCounter.increment();
    }

    public void recordBulletsRanked(int count) {
        bulletsRankedCounter.increment(count);
    }

    public void recordSkillGroups(int count) {
        skillGroupsCounter.increment(count);
    }

    /**
     * Record a model failure in a stage.
     */
    public void recordModelFailure(String stage) {
        modelFailuresCounter.increment();
        Counter.builder("resume_tailor_model_failures_by_stage_total")
                .tag(TAG_STAGE, stage)
                .register(registry)
                .increment();
    }

    public void updateLastRunStats(int selectedLines, int lineBudget) {
        lastRunSelectedLines.set(selectedLines);
        lastRunLineBudget.set(lineBudget);
    }
}
