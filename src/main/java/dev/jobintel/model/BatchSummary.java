package dev.jobintel.model;

import java.time.LocalDate;
import java.util.Map;

/**
 * Counts for one processed run date.
 */
public record BatchSummary(
        LocalDate runDate,
        int postingsReceived,
        int canonicalRecords,
        int duplicatesDropped,
        Map<RejectReason, Integer> rejectsByReason,
        int partitionsWritten,
        int newJobs,
        int returningJobs,
        int snapshotSize) {

    public int totalRejects() {
        return rejectsByReason.values().stream().mapToInt(Integer::intValue).sum();
    }
}
