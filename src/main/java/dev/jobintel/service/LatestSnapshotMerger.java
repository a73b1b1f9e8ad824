package dev.jobintel.service;

import dev.jobintel.model.CanonicalJobRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reduces the partitioned history to one record per job key, keeping the latest observation.
 *
 * <p>Within a key the winner has the greatest run date, then the greatest scrape timestamp,
 * then the smallest job URL (records without a URL last). The reduction is a sort by key
 * followed by a single scan, so a pre-sorted stream is merged in constant memory.
 */
@Component
public class LatestSnapshotMerger {

    /**
     * Merge order: job key ascending, then the preferred observation first.
     */
    public static final Comparator<CanonicalJobRecord> MERGE_ORDER = Comparator
            .comparing(CanonicalJobRecord::getJobKey)
            .thenComparing(CanonicalJobRecord::getRunDate, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(CanonicalJobRecord::getScrapedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(CanonicalJobRecord::getJobUrl, Comparator.nullsLast(Comparator.naturalOrder()));

    /**
     * Merge an unordered history.
     *
     * @return one record per job key, ordered by job key
     */
    public List<CanonicalJobRecord> merge(Collection<CanonicalJobRecord> history) {
        List<CanonicalJobRecord> sorted = new ArrayList<>(history);
        sorted.sort(MERGE_ORDER);
        return mergeSorted(sorted.stream());
    }

    /**
     * Merge a history already in {@link #MERGE_ORDER}: the first record of each key wins.
     */
    public List<CanonicalJobRecord> mergeSorted(Stream<CanonicalJobRecord> sortedHistory) {
        List<CanonicalJobRecord> latest = new ArrayList<>();
        String currentKey = null;
        Iterator<CanonicalJobRecord> records = sortedHistory.iterator();
        while (records.hasNext()) {
            CanonicalJobRecord record = records.next();
            if (!record.getJobKey().equals(currentKey)) {
                latest.add(record);
                currentKey = record.getJobKey();
            }
        }
        return latest;
    }
}
