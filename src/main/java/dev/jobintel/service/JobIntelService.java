package dev.jobintel.service;

import dev.jobintel.config.PipelineProperties;
import dev.jobintel.metrics.PipelineMetrics;
import dev.jobintel.model.BatchSummary;
import dev.jobintel.model.BuildOutcome;
import dev.jobintel.model.CanonicalJobRecord;
import dev.jobintel.model.RawJobPosting;
import dev.jobintel.model.RejectReason;
import dev.jobintel.model.RejectRecord;
import dev.jobintel.service.DeduplicationService.HistorySplit;
import dev.jobintel.source.PostingSource;
import dev.jobintel.storage.PartitionWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Main orchestration service for the transform, dedupe and load pipeline.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobIntelService {

    private static final String SEPARATOR = "========================================";
    static final String UNKNOWN_SOURCE = "unknown";

    private final List<PostingSource> postingSources;
    private final CanonicalRecordBuilder recordBuilder;
    private final DeduplicationService deduplicationService;
    private final PartitionWriter partitionWriter;
    private final LatestSnapshotService latestSnapshotService;
    private final PipelineMetrics metrics;
    private final PipelineProperties pipelineProperties;
    private final Clock clock;

    /**
     * Process every posting captured for a run date.
     *
     * <p>All partitions of the batch are written before the latest snapshot is rebuilt.
     *
     * @param runDate partition date of this batch
     * @return counts of the finished batch
     */
    public Mono<BatchSummary> runBatch(LocalDate runDate) {
        boolean dryRun = pipelineProperties.isDryRun();
        Instant batchTimestamp = clock.instant();

        log.info(SEPARATOR);
        log.info("Job Intel Batch Starting: {}", runDate);
        log.info(SEPARATOR);
        log.info("Sources configured: {}", postingSources.size());
        log.info("Dry run mode: {}", dryRun);

        return fetchAllPostings(runDate)
                .collectList()
                .flatMap(postings -> Mono.fromCallable(() -> processBatch(postings, runDate, batchTimestamp, dryRun))
                        .subscribeOn(Schedulers.boundedElastic()))
                .doOnNext(summary -> {
                    metrics.updateLastRunStats(summary);
                    metrics.recordBatchDuration(Duration.between(batchTimestamp, clock.instant()));
                    logSummary(summary);
                });
    }

    /**
     * Fetch postings from all enabled sources.
     */
    private Flux<RawJobPosting> fetchAllPostings(LocalDate runDate) {
        return Flux.fromIterable(postingSources)
                .filter(PostingSource::isEnabled)
                .concatMap(source -> {
                    log.info("Fetching from source: {}", source.getName());
                    return source.fetchPostings(runDate)
                            .collectList()
                            .doOnNext(postings -> {
                                log.info("{} returned {} postings", source.getName(), postings.size());
                                metrics.recordPostingsReceived(source.getName(), postings.size());
                            })
                            .flatMapMany(Flux::fromIterable);
                });
    }

    private BatchSummary processBatch(List<RawJobPosting> postings, LocalDate runDate,
                                      Instant batchTimestamp, boolean dryRun) {
        log.info("Total postings fetched: {}", postings.size());

        Map<String, List<CanonicalJobRecord>> recordsBySource = new TreeMap<>();
        Map<String, List<RejectRecord>> rejectsBySource = new TreeMap<>();
        for (RawJobPosting posting : postings) {
            BuildOutcome outcome = recordBuilder.build(posting, runDate, batchTimestamp);
            if (outcome.isAccepted()) {
                CanonicalJobRecord record = outcome.record();
                recordsBySource.computeIfAbsent(record.getSource(), k -> new ArrayList<>()).add(record);
            } else {
                RejectRecord reject = outcome.reject();
                rejectsBySource.computeIfAbsent(partitionSource(reject.getSource()), k -> new ArrayList<>())
                        .add(reject);
            }
        }

        Map<RejectReason, Integer> rejectsByReason = countByReason(rejectsBySource);
        rejectsByReason.forEach(metrics::recordRejects);

        // Every source seen in the batch gets its partition rewritten, even when empty
        TreeSet<String> sources = new TreeSet<>(recordsBySource.keySet());
        sources.addAll(rejectsBySource.keySet());

        List<CanonicalJobRecord> batchRecords = new ArrayList<>();
        int duplicatesDropped = 0;
        int partitionsWritten = 0;
        for (String source : sources) {
            List<CanonicalJobRecord> built = recordsBySource.getOrDefault(source, List.of());
            List<CanonicalJobRecord> unique = deduplicationService.dedupeWithinBatch(built);
            duplicatesDropped += built.size() - unique.size();
            batchRecords.addAll(unique);

            List<RejectRecord> rejects = rejectsBySource.getOrDefault(source, List.of());
            if (dryRun) {
                log.info("DRY RUN - Would write partition {}/{}: {} records, {} rejects",
                        runDate, source, unique.size(), rejects.size());
                continue;
            }
            partitionWriter.writePartition(runDate, source, unique);
            partitionWriter.writeRejects(runDate, source, rejects);
            metrics.recordPartitionWritten(source);
            partitionsWritten++;
        }

        metrics.recordCanonical(batchRecords.size());
        metrics.recordDuplicatesDropped(duplicatesDropped);

        HistorySplit split = deduplicationService.splitNewAndReturning(batchRecords, runDate);
        int snapshotSize = latestSnapshotService.buildSnapshot().size();

        return new BatchSummary(runDate, postings.size(), batchRecords.size(), duplicatesDropped,
                rejectsByReason, partitionsWritten, split.newJobs().size(), split.returningJobs().size(),
                snapshotSize);
    }

    private static Map<RejectReason, Integer> countByReason(Map<String, List<RejectRecord>> rejectsBySource) {
        Map<RejectReason, Integer> counts = new EnumMap<>(RejectReason.class);
        rejectsBySource.values().stream()
                .flatMap(List::stream)
                .forEach(reject -> counts.merge(reject.getReason(), 1, Integer::sum));
        return counts;
    }

    static String partitionSource(String source) {
        if (source == null || source.isBlank()) {
            return UNKNOWN_SOURCE;
        }
        return source.trim().toLowerCase(Locale.ROOT);
    }

    private void logSummary(BatchSummary summary) {
        log.info(SEPARATOR);
        log.info("BATCH SUMMARY {}", summary.runDate());
        log.info("Postings received: {}", summary.postingsReceived());
        log.info("Canonical records: {} ({} duplicates dropped)",
                summary.canonicalRecords(), summary.duplicatesDropped());
        summary.rejectsByReason().forEach((reason, count) -> log.info("Rejected [{}]: {}", reason.getCode(), count));
        log.info("Partitions written: {}", summary.partitionsWritten());
        log.info("New jobs: {}, returning jobs: {}", summary.newJobs(), summary.returningJobs());
        log.info("Latest snapshot size: {}", summary.snapshotSize());
        log.info(SEPARATOR);
    }
}
