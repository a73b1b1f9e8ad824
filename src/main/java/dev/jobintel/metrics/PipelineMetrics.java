package dev.jobintel.metrics;

import dev.jobintel.model.BatchSummary;
import dev.jobintel.model.RejectReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for the transform and load pipeline.
 */
@Component
public class PipelineMetrics {

    private static final String TAG_SOURCE = "source";
    private static final String TAG_REASON = "reason";
    private final MeterRegistry registry;

    // Counters
    private final Counter postingsReceivedCounter;
    private final Counter canonicalRecordsCounter;
    private final Counter rejectsCounter;
    private final Counter duplicatesCounter;
    private final Counter partitionsWrittenCounter;

    private final Timer batchTimer;

    // Gauges
    private final AtomicInteger lastRunPostings = new AtomicInteger(0);
    private final AtomicInteger lastRunCanonical = new AtomicInteger(0);
    private final AtomicInteger lastRunRejects = new AtomicInteger(0);
    private final AtomicInteger lastRunNewJobs = new AtomicInteger(0);
    private final AtomicInteger snapshotSize = new AtomicInteger(0);

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.postingsReceivedCounter = Counter.builder("job_intel_postings_received_total")
                .description("Total raw postings received from all sources")
                .register(registry);

        this.canonicalRecordsCounter = Counter.builder("job_intel_canonical_records_total")
                .description("Total postings accepted as canonical US records")
                .register(registry);

        this.rejectsCounter = Counter.builder("job_intel_rejects_total")
                .description("Total postings rejected (non-US, ambiguous, invalid)")
                .register(registry);

        this.duplicatesCounter = Counter.builder("job_intel_duplicates_dropped_total")
                .description("Total duplicate job keys dropped within a batch")
                .register(registry);

        this.partitionsWrittenCounter = Counter.builder("job_intel_partitions_written_total")
                .description("Total (run date, source) partitions written")
                .register(registry);

        this.batchTimer = Timer.builder("job_intel_batch_duration")
                .description("Time to process one run date")
                .register(registry);

        Gauge.builder("job_intel_last_run_postings", lastRunPostings, AtomicInteger::get)
                .description("Postings received in last run")
                .register(registry);

        Gauge.builder("job_intel_last_run_canonical", lastRunCanonical, AtomicInteger::get)
                .description("Canonical records in last run")
                .register(registry);

        Gauge.builder("job_intel_last_run_rejects", lastRunRejects, AtomicInteger::get)
                .description("Rejects in last run")
                .register(registry);

        Gauge.builder("job_intel_last_run_new_jobs", lastRunNewJobs, AtomicInteger::get)
                .description("Jobs first seen in last run")
                .register(registry);

        Gauge.builder("job_intel_latest_snapshot_size", snapshotSize, AtomicInteger::get)
                .description("Distinct jobs in the latest snapshot")
                .register(registry);
    }

    public void recordPostingsReceived(String source, int count) {
        postingsReceivedCounter.increment(count);
        Counter.builder("job_intel_postings_received_by_source_total")
                .tag(TAG_SOURCE, source)
                .register(registry)
                .increment(count);
    }

    public void recordCanonical(int count) {
        canonicalRecordsCounter.increment(count);
    }

    /**
     * Record rejects for one reason code.
     */
    public void recordRejects(RejectReason reason, int count) {
        rejectsCounter.increment(count);
        Counter.builder("job_intel_rejects_by_reason_total")
                .tag(TAG_REASON, reason.getCode())
                .register(registry)
                .increment(count);
    }

    public void recordDuplicatesDropped(int count) {
        duplicatesCounter.increment(count);
    }

    public void recordPartitionWritten(String source) {
        partitionsWrittenCounter.increment();
        Counter.builder("job_intel_partitions_written_by_source_total")
                .tag(TAG_SOURCE, source)
                .register(registry)
                .increment();
    }

    public void recordBatchDuration(Duration duration) {
        batchTimer.record(duration);
    }

    /**
     * Update last run statistics from a finished batch.
     */
    public void updateLastRunStats(BatchSummary summary) {
        lastRunPostings.set(summary.postingsReceived());
        lastRunCanonical.set(summary.canonicalRecords());
        lastRunRejects.set(summary.totalRejects());
        lastRunNewJobs.set(summary.newJobs());
        snapshotSize.set(summary.snapshotSize());
    }
}
