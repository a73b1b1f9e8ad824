package dev.jobintel.storage;

import dev.jobintel.model.CanonicalJobRecord;
import dev.jobintel.model.RejectRecord;

import java.time.LocalDate;
import java.util.List;

/**
 * Writes partitions keyed by (run date, source). A write replaces the whole partition, so
 * writing the same run date twice leaves one copy of the data, never two.
 */
public interface PartitionWriter {

    /**
     * Replace the canonical partition for (runDate, source).
     *
     * @return number of records stored
     */
    int writePartition(LocalDate runDate, String source, List<CanonicalJobRecord> records);

    /**
     * Replace the reject audit rows for (runDate, source).
     *
     * @return number of rejects stored
     */
    int writeRejects(LocalDate runDate, String source, List<RejectRecord> rejects);
}
