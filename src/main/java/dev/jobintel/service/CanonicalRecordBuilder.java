package dev.jobintel.service;

import dev.jobintel.model.BuildOutcome;
import dev.jobintel.model.CanonicalJobRecord;
import dev.jobintel.model.EnrichmentRules;
import dev.jobintel.model.LocationResult;
import dev.jobintel.model.RawJobPosting;
import dev.jobintel.model.RejectReason;
import dev.jobintel.model.RejectRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Turns one raw posting into one canonical record or one reject.
 *
 * <p>The location is classified first; rejected postings get no further enrichment.
 * The result depends only on the posting, the run date, the batch timestamp and the
 * enrichment rules, so reprocessing the same input yields the same records.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CanonicalRecordBuilder {

    private final LocationClassifier locationClassifier;
    private final RoleTaxonomyClassifier roleTaxonomyClassifier;
    private final SkillsExtractor skillsExtractor;
    private final IndustryTagger industryTagger;
    private final SeniorityClassifier seniorityClassifier;
    private final EnrichmentRules enrichmentRules;

    /**
     * Build the canonical form of a posting.
     *
     * @param posting        raw posting from a connector
     * @param runDate        batch date, the partition key
     * @param batchTimestamp used as scrape timestamp when the posting carries none
     * @return accepted record or reject with reason code; never throws for bad input
     */
    public BuildOutcome build(RawJobPosting posting, LocalDate runDate, Instant batchTimestamp) {
        Objects.requireNonNull(posting, "posting");

        String missing = firstMissingRequiredField(posting);
        if (missing != null) {
            log.debug("Posting {}/{} rejected: missing {}", posting.getSource(), posting.getSourceJobId(), missing);
            return reject(posting, RejectReason.MISSING_REQUIRED_FIELD, "missing " + missing, runDate);
        }

        try {
            LocationResult location = locationClassifier.classify(posting.getLocationRaw());
            if (!location.accepted()) {
                return reject(posting, location.reason(), "location '" + posting.getLocationRaw() + "'", runDate);
            }
            return BuildOutcome.accepted(enrich(posting, location, runDate, batchTimestamp));
        } catch (RuntimeException e) {
            log.warn("Failed to build posting {}/{}: {}", posting.getSource(), posting.getSourceJobId(), e.getMessage());
            return reject(posting, RejectReason.ENRICHMENT_ERROR,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), runDate);
        }
    }

    private CanonicalJobRecord enrich(RawJobPosting posting, LocationResult location,
                                      LocalDate runDate, Instant batchTimestamp) {
        String title = TextNormalizer.collapseWhitespace(posting.getTitle());
        String description = TextNormalizer.trimToNull(TextNormalizer.cleanText(posting.getDescription()));
        String companyName = TextNormalizer.trimToNull(posting.getCompanyName());

        String roleFamily = roleTaxonomyClassifier.classify(title, description, enrichmentRules.roleTaxonomy());
        List<String> skills = skillsExtractor.extract(title, description, enrichmentRules.skillLexicon());
        String industryTag = industryTagger.tag(companyName, description, enrichmentRules.industryRules());
        String seniority = seniorityClassifier.classify(title, enrichmentRules.seniorityRules());

        String source = posting.getSource().trim().toLowerCase(Locale.ROOT);
        String sourceJobId = posting.getSourceJobId().trim();
        String companyId = posting.getCompanyId().trim();

        return CanonicalJobRecord.builder()
                .source(source)
                .sourceJobId(sourceJobId)
                .jobUrl(cleanUrl(posting.getJobUrl()))
                .companyName(companyName)
                .companyId(companyId)
                .companyDomain(TextNormalizer.trimToNull(posting.getCompanyDomain()))
                .title(title)
                .description(description)
                .department(TextNormalizer.trimToNull(posting.getDepartment()))
                .employmentType(TextNormalizer.trimToNull(posting.getEmploymentType()))
                .seniority(seniority)
                .datePosted(posting.getDatePosted())
                .locationRaw(TextNormalizer.collapseWhitespace(posting.getLocationRaw()))
                .city(location.city())
                .state(location.state())
                .postalCode(location.postalCode())
                .msa(location.msa())
                .remote(location.remote())
                .country(CanonicalJobRecord.COUNTRY_US)
                .roleFamily(roleFamily)
                .skills(skills)
                .industryTag(industryTag)
                .runDate(runDate)
                .scrapedAt(posting.getFetchedAt() != null ? posting.getFetchedAt() : batchTimestamp)
                .jobKey(JobKeyHasher.jobKey(source, sourceJobId, companyId))
                .build();
    }

    private static String firstMissingRequiredField(RawJobPosting posting) {
        if (isBlank(posting.getSource())) {
            return "source";
        }
        if (isBlank(posting.getSourceJobId())) {
            return "source_job_id";
        }
        if (isBlank(posting.getCompanyId())) {
            return "company_id";
        }
        if (isBlank(posting.getTitle())) {
            return "title";
        }
        if (isBlank(posting.getLocationRaw())) {
            return "location_raw";
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Remove whitespace and zero-width characters; add a scheme when missing.
     */
    static String cleanUrl(String url) {
        if (url == null) {
            return null;
        }
        String clean = url.trim()
                .replaceAll("\\s+", "")
                .replaceAll("[\\u200B-\\u200D\\uFEFF]", "");
        if (clean.isEmpty()) {
            return null;
        }
        if (!clean.startsWith("http")) {
            clean = "https://" + clean;
        }
        return clean;
    }

    private static BuildOutcome reject(RawJobPosting posting, RejectReason reason, String detail, LocalDate runDate) {
        return BuildOutcome.rejected(RejectRecord.of(posting, reason, detail, runDate));
    }
}
