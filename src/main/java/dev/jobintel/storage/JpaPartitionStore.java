package dev.jobintel.storage;

import dev.jobintel.entity.JobRecordEntity;
import dev.jobintel.entity.RejectRecordEntity;
import dev.jobintel.model.CanonicalJobRecord;
import dev.jobintel.model.RejectRecord;
import dev.jobintel.repository.JobRecordRepository;
import dev.jobintel.repository.RejectRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.IntSupplier;

/**
 * Partition store on the JPA repositories. Each write deletes the partition and inserts the
 * new rows in a single transaction; writers of the same key are serialized.
 */
@Slf4j
@Component
public class JpaPartitionStore implements PartitionWriter {

    private final JobRecordRepository jobRecordRepository;
    private final RejectRecordRepository rejectRecordRepository;
    private final TransactionTemplate transactionTemplate;

    private final Map<String, ReentrantLock> partitionLocks = new ConcurrentHashMap<>();

    public JpaPartitionStore(JobRecordRepository jobRecordRepository,
                             RejectRecordRepository rejectRecordRepository,
                             PlatformTransactionManager transactionManager) {
        this.jobRecordRepository = jobRecordRepository;
        this.rejectRecordRepository = rejectRecordRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public int writePartition(LocalDate runDate, String source, List<CanonicalJobRecord> records) {
        validatePartition(runDate, source, records);

        List<JobRecordEntity> entities = records.stream()
                .sorted(Comparator.comparing(CanonicalJobRecord::getJobKey))
                .map(JobRecordEntity::from)
                .toList();

        return withPartitionLock("jobs", runDate, source, () -> {
            int removed = jobRecordRepository.deletePartition(runDate, source);
            jobRecordRepository.saveAll(entities);
            log.info("Partition run_date={} source={}: replaced {} records with {}",
                    runDate, source, removed, entities.size());
            return entities.size();
        });
    }

    @Override
    public int writeRejects(LocalDate runDate, String source, List<RejectRecord> rejects) {
        Objects.requireNonNull(runDate, "runDate");
        Objects.requireNonNull(source, "source");

        List<RejectRecordEntity> entities = rejects.stream()
                .map(reject -> RejectRecordEntity.from(reject, source))
                .toList();

        return withPartitionLock("rejects", runDate, source, () -> {
            rejectRecordRepository.deletePartition(runDate, source);
            rejectRecordRepository.saveAll(entities);
            log.info("Rejects run_date={} source={}: stored {}", runDate, source, entities.size());
            return entities.size();
        });
    }

    /**
     * Read one canonical partition, ordered by job key.
     */
    public List<CanonicalJobRecord> readPartition(LocalDate runDate, String source) {
        return jobRecordRepository.findByRunDateAndSourceOrderByJobKeyAsc(runDate, source).stream()
                .map(JobRecordEntity::toRecord)
                .toList();
    }

    public List<RejectRecord> readRejects(LocalDate runDate, String source) {
        return rejectRecordRepository.findByRunDateAndSource(runDate, source).stream()
                .map(RejectRecordEntity::toRecord)
                .toList();
    }

    private int withPartitionLock(String kind, LocalDate runDate, String source, IntSupplier write) {
        ReentrantLock lock = partitionLocks.computeIfAbsent(kind + "|" + runDate + "|" + source, k -> new ReentrantLock());
        lock.lock();
        try {
            Integer written = transactionTemplate.execute(status -> write.getAsInt());
            return written != null ? written : 0;
        } finally {
            lock.unlock();
        }
    }

    private static void validatePartition(LocalDate runDate, String source, List<CanonicalJobRecord> records) {
        Objects.requireNonNull(runDate, "runDate");
        Objects.requireNonNull(source, "source");
        Set<String> keys = new HashSet<>();
        for (CanonicalJobRecord record : records) {
            if (!runDate.equals(record.getRunDate()) || !source.equals(record.getSource())) {
                throw new IllegalArgumentException("Record " + record.getJobKey() + " belongs to partition "
                        + record.getRunDate() + "/" + record.getSource() + ", not " + runDate + "/" + source);
            }
            if (!CanonicalJobRecord.COUNTRY_US.equals(record.getCountry())) {
                throw new IllegalArgumentException("Record " + record.getJobKey() + " is not a US record");
            }
            if (!keys.add(record.getJobKey())) {
                throw new IllegalArgumentException("Duplicate job key in partition: " + record.getJobKey());
            }
        }
    }
}
