package dev.jobintel.service;

import dev.jobintel.model.CanonicalJobRecord;
import dev.jobintel.repository.JobRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Service for job deduplication within a batch and against stored history.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeduplicationService {

    // Stay well below SQLite's bound-parameter limit
    private static final int KEY_QUERY_CHUNK = 500;

    private final JobRecordRepository jobRecordRepository;

    /**
     * Split of a batch into jobs seen for the first time and jobs already in history.
     */
    public record HistorySplit(List<CanonicalJobRecord> newJobs, List<CanonicalJobRecord> returningJobs) {
    }

    /**
     * Keep the first record of each job key, preserving input order.
     *
     * @param records canonical records of one batch
     * @return records with unique job keys
     */
    public List<CanonicalJobRecord> dedupeWithinBatch(List<CanonicalJobRecord> records) {
        if (records.isEmpty()) {
            return List.of();
        }

        Map<String, CanonicalJobRecord> unique = new LinkedHashMap<>();
        for (CanonicalJobRecord record : records) {
            unique.putIfAbsent(record.getJobKey(), record);
        }

        int removed = records.size() - unique.size();
        if (removed > 0) {
            log.info("Deduplication: {} total records, {} duplicates removed, {} unique",
                    records.size(), removed, unique.size());
        }
        return List.copyOf(unique.values());
    }

    /**
     * Split records into jobs never seen on an earlier run date and jobs already in history.
     * Only earlier run dates count, so reprocessing a date gives the same split.
     *
     * @param records deduplicated canonical records of one batch
     * @param runDate the batch run date
     * @return new and returning jobs
     */
    @Transactional(readOnly = true)
    public HistorySplit splitNewAndReturning(List<CanonicalJobRecord> records, LocalDate runDate) {
        if (records.isEmpty()) {
            return new HistorySplit(List.of(), List.of());
        }

        Set<String> seen = keysSeenBefore(records.stream().map(CanonicalJobRecord::getJobKey).toList(), runDate);

        List<CanonicalJobRecord> newJobs = new ArrayList<>();
        List<CanonicalJobRecord> returningJobs = new ArrayList<>();
        for (CanonicalJobRecord record : records) {
            if (seen.contains(record.getJobKey())) {
                returningJobs.add(record);
            } else {
                newJobs.add(record);
            }
        }

        log.info("Dedupe vs history: {} new, {} returning", newJobs.size(), returningJobs.size());
        return new HistorySplit(List.copyOf(newJobs), List.copyOf(returningJobs));
    }

    private Set<String> keysSeenBefore(List<String> jobKeys, LocalDate runDate) {
        Set<String> seen = new HashSet<>();
        for (int start = 0; start < jobKeys.size(); start += KEY_QUERY_CHUNK) {
            List<String> chunk = jobKeys.subList(start, Math.min(start + KEY_QUERY_CHUNK, jobKeys.size()));
            seen.addAll(jobRecordRepository.findKeysSeenBefore(chunk, runDate));
        }
        return seen;
    }
}
