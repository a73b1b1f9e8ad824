package dev.jobintel.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Normalized, enriched, US-accepted representation of one job posting.
 * Only {@link dev.jobintel.service.CanonicalRecordBuilder} creates these, and only for accepted locations.
 */
@Value
@Builder(toBuilder = true)
public class CanonicalJobRecord {

    public static final String COUNTRY_US = "US";

    // Source metadata
    String source;
    String sourceJobId;
    String jobUrl;

    // Company
    String companyName;
    String companyId;
    String companyDomain;

    // Job details
    String title;
    String description;
    String department;
    String employmentType;
    String seniority;
    LocalDate datePosted;

    // Location
    String locationRaw;
    String city;
    String state;
    String postalCode;
    String msa;
    boolean remote;
    @Builder.Default
    String country = COUNTRY_US;

    // Enrichment
    String roleFamily;
    @Builder.Default
    List<String> skills = List.of();
    String industryTag;

    // Pipeline metadata
    LocalDate runDate;
    Instant scrapedAt;
    String jobKey;
}
