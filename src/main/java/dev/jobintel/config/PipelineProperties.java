package dev.jobintel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.LocalDate;

/**
 * Batch run settings.
 * Loaded from application.yml under 'pipeline' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /** Root of connector dumps, laid out as {rawDir}/{runDate}/... */
    private String rawDir = "data/raw";

    /** Run date to process; today when unset. */
    private LocalDate runDate;

    /** Optional JSON file overriding the enrichment rules from application.yml. */
    private String rulesFile;

    private boolean dryRun = false;

    private int metricsWaitSeconds = 0;

    public LocalDate resolveRunDate() {
        return runDate != null ? runDate : LocalDate.now();
    }
}
