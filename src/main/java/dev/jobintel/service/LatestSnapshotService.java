package dev.jobintel.service;

import dev.jobintel.entity.JobRecordEntity;
import dev.jobintel.model.CanonicalJobRecord;
import dev.jobintel.repository.JobRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Stream;

/**
 * Recomputes the latest snapshot from every stored partition. No state is kept between calls.
 * Callers must not run it while a partition of the batch is still being written.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LatestSnapshotService {

    private final JobRecordRepository jobRecordRepository;
    private final LatestSnapshotMerger merger;

    /**
     * Build the latest snapshot over the full history.
     *
     * @return one record per job key, ordered by job key
     */
    @Transactional(readOnly = true)
    public List<CanonicalJobRecord> buildSnapshot() {
        try (Stream<JobRecordEntity> history = jobRecordRepository.streamAllInMergeOrder()) {
            List<CanonicalJobRecord> latest = merger.mergeSorted(history.map(JobRecordEntity::toRecord));
            log.info("Latest snapshot: {} unique jobs", latest.size());
            return latest;
        }
    }
}
