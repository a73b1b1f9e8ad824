package dev.jobintel.repository;

import dev.jobintel.entity.RejectRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Repository for rejected postings, kept for audit.
 */
@Repository
public interface RejectRecordRepository extends JpaRepository<RejectRecordEntity, Long> {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM RejectRecordEntity r WHERE r.runDate = :runDate AND r.source = :source")
    int deletePartition(LocalDate runDate, String source);

    List<RejectRecordEntity> findByRunDateAndSource(LocalDate runDate, String source);

    long countByRunDateAndReasonCode(LocalDate runDate, String reasonCode);
}
