package dev.jobintel.source;

import dev.jobintel.model.RawJobPosting;
import reactor.core.publisher.Flux;

import java.time.LocalDate;

/**
 * Interface for raw posting sources.
 * Connector output enters the pipeline through an implementation of this interface.
 */
public interface PostingSource {

    /**
     * Get the name of this source (e.g., "raw-files")
     */
    String getName();

    /**
     * Fetch all raw postings captured for a run date.
     */
    Flux<RawJobPosting> fetchPostings(LocalDate runDate);

    /**
     * Check if this source is enabled.
     */
    default boolean isEnabled() {
        return true;
    }
}
