package dev.jobintel.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One job posting as delivered by an ATS connector, before any normalization.
 */
@Value
@Builder(toBuilder = true)
public class RawJobPosting {
    String source;          // ATS name (greenhouse, lever, ...)
    String sourceJobId;
    String title;
    String description;
    String locationRaw;
    String department;
    String employmentType;
    LocalDate datePosted;

    String companyName;
    String companyId;
    String companyDomain;
    String jobUrl;

    // When the connector fetched the posting, if known
    Instant fetchedAt;
}
