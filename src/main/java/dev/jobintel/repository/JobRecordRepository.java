package dev.jobintel.repository;

import dev.jobintel.entity.JobRecordEntity;
import jakarta.persistence.QueryHint;
import org.hibernate.jpa.HibernateHints;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Repository for the partitioned canonical job history.
 */
@Repository
public interface JobRecordRepository extends JpaRepository<JobRecordEntity, Long> {

    /**
     * Remove every record of one (run_date, source) partition.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM JobRecordEntity j WHERE j.runDate = :runDate AND j.source = :source")
    int deletePartition(LocalDate runDate, String source);

    List<JobRecordEntity> findByRunDateAndSourceOrderByJobKeyAsc(LocalDate runDate, String source);

    /**
     * Full history in merge order: job key, then newest observation first.
     * Must be consumed inside a transaction.
     */
    @QueryHints({
            @QueryHint(name = HibernateHints.HINT_FETCH_SIZE, value = "500"),
            @QueryHint(name = HibernateHints.HINT_READ_ONLY, value = "true")
    })
    @Query("SELECT j FROM JobRecordEntity j "
            + "ORDER BY j.jobKey ASC, j.runDate DESC, j.scrapedAt DESC, j.jobUrl ASC NULLS LAST, j.id ASC")
    Stream<JobRecordEntity> streamAllInMergeOrder();

    /**
     * Job keys from the given set already observed on an earlier run date.
     */
    @Query("SELECT DISTINCT j.jobKey FROM JobRecordEntity j WHERE j.jobKey IN :jobKeys AND j.runDate < :runDate")
    Set<String> findKeysSeenBefore(Collection<String> jobKeys, LocalDate runDate);

    long countByRunDate(LocalDate runDate);
}
