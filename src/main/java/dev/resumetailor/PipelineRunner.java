package dev.resumetailor;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.resumetailor.config.TailorConfig;
import dev.resumetailor.loader.CandidateDataLoader;
import dev.resumetailor.model.CandidateData;
import dev.resumetailor.model.ScoreBand;
import dev.resumetailor.model.ScoredBullet;
import dev.resumetailor.model.TailoringResult;
import dev.resumetailor.service.SelectionService;
import dev.resumetailor.service.TailoringService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs one tailoring pass over the configured candidate and job files.
 * Separated from the Application class so it can be tested without exiting.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineRunner {

  private static final String SEPARATOR = "========================================";

  private final TailoringService tailoringService;
  private final CandidateDataLoader candidateDataLoader;
  private final SelectionService selectionService;
  private final TailorConfig tailorConfig;
  private final ObjectMapper objectMapper;

  @Value("${tailor.metrics-wait-seconds:0}")
  private int metricsWaitSeconds;

  /**
   * Loads the inputs, tailors, reports and optionally writes the result.
   *
   * @return The tailoring result
   */
  public TailoringResult execute() {
    log.info(SEPARATOR);
    log.info("Resume Tailor Starting");
    log.info(SEPARATOR);

    try {
      CandidateData candidate = candidateDataLoader.loadCandidate(Path.of(tailorConfig.getCandidateFile()));
      String jobText = candidateDataLoader.loadJobDescription(Path.of(tailorConfig.getJobFile()));
      if (jobText.isBlank()) {
        log.warn("Job description {} is empty, nothing will be ranked", tailorConfig.getJobFile());
      }

      TailoringResult result = tailoringService.tailor(jobText, candidate);
      report(result);
      writeOutput(result);

      log.info(SEPARATOR);
      log.info("Resume Tailor Completed Successfully");
      log.info("Selection valid: {}", result.selectionReport().isValid());
      log.info(SEPARATOR);

      handleMetricsWait();

      return result;
    } catch (Exception e) {
      log.error("Resume Tailor failed: {}", e.getMessage(), e);
      throw new IllegalStateException("Tailoring run failed", e);
    }
  }

  private void report(TailoringResult result) {
    result.rankedBullets().forEach((role, ranked) -> {
      log.info("--- {} ---", role);
      List<ScoreBand> bands = selectionService.bands(ranked);
      for (int i = 0; i < ranked.size(); i++) {
        ScoredBullet scored = ranked.get(i);
        log.info("[{}] {} {} matched={}", scored.score(), bands.get(i), scored.bullet().getBullet(),
            scored.matchedPhrases());
      }
    });
    result.skillLines().forEach((key, line) ->
        log.info("{}: {} ({} chars, {})", key, line.text(), line.length(), line.status()));
    result.selectionReport().issues().forEach(issue -> log.warn(issue));
  }

  private void writeOutput(TailoringResult result) throws IOException {
    String outputFile = tailorConfig.getOutputFile();
    if (outputFile == null || outputFile.isBlank()) {
      return;
    }
    Path path = Path.of(outputFile);
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), result);
    log.info("Wrote tailoring result to {}", path);
  }

  private void handleMetricsWait() {
    if (metricsWaitSeconds > 0) {
      log.info("Keeping alive for {} seconds (metrics scrape)...", metricsWaitSeconds);
      try {
        Thread.sleep(metricsWaitSeconds * 1000L);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        log.warn("Metrics wait interrupted");
      }
    }
  }
}
