package dev.jobintel;

import dev.jobintel.config.PipelineProperties;
import dev.jobintel.model.BatchSummary;
import dev.jobintel.service.JobIntelService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Runs one batch for the configured run date and waits for the metrics scrape.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineRunner {

  private static final String SEPARATOR = "========================================";

  private final JobIntelService jobIntelService;
  private final PipelineProperties pipelineProperties;

  /**
   * Executes the batch pipeline and handles the post-execution wait.
   *
   * @return summary of the processed run date
   */
  public BatchSummary execute() {
    LocalDate runDate = pipelineProperties.resolveRunDate();
    log.info(SEPARATOR);
    log.info("Job Intel Starting (run date {})", runDate);
    log.info(SEPARATOR);

    try {
      BatchSummary summary = jobIntelService.runBatch(runDate).block();
      if (summary == null) {
        throw new IllegalStateException("Batch for " + runDate + " produced no summary");
      }

      log.info(SEPARATOR);
      log.info("Job Intel Completed Successfully");
      log.info("Canonical records: {}, rejects: {}", summary.canonicalRecords(), summary.totalRejects());
      log.info(SEPARATOR);

      handleMetricsWait();

      return summary;
    } catch (Exception e) {
      log.error("Job Intel failed: {}", e.getMessage(), e);
      throw new IllegalStateException("Pipeline execution failed", e);
    }
  }

  private void handleMetricsWait() {
    int metricsWaitSeconds = pipelineProperties.getMetricsWaitSeconds();
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
