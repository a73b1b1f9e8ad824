package dev.jobintel.service;

import dev.jobintel.config.LocationRulesConfig;
import dev.jobintel.model.BuildOutcome;
import dev.jobintel.model.CanonicalJobRecord;
import dev.jobintel.model.RawJobPosting;
import dev.jobintel.model.RejectReason;
import dev.jobintel.model.RejectRecord;
import dev.jobintel.model.SkillLexicon;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CanonicalRecordBuilderTest {

    private static final LocalDate RUN_DATE = LocalDate.of(2024, 5, 1);
    private static final Instant BATCH_TIME = Instant.parse("2024-05-01T06:00:00Z");

    private CanonicalRecordBuilder builder;

    @BeforeEach
    void setUp() {
        builder = newBuilder(new SkillsExtractor());
    }

    private CanonicalRecordBuilder newBuilder(SkillsExtractor skillsExtractor) {
        return new CanonicalRecordBuilder(
                new LocationClassifier(new LocationRulesConfig()),
                new RoleTaxonomyClassifier(),
                skillsExtractor,
                new IndustryTagger(),
                new SeniorityClassifier(),
                RuleFixtures.enrichmentRules());
    }

    private RawJobPosting.RawJobPostingBuilder posting() {
        return RawJobPosting.builder()
                .source("greenhouse")
                .sourceJobId("4001")
                .title("Senior Software Engineer")
                .description("<p>Build <b>payments</b> services in Java and Python.</p>")
                .locationRaw("San Francisco, CA")
                .department(" Engineering ")
                .employmentType("Full-time")
                .datePosted(LocalDate.of(2024, 4, 28))
                .companyName("Acme Payments")
                .companyId("acme0001")
                .jobUrl("boards.greenhouse.io/acme/jobs/4001");
    }

    @Nested
    @DisplayName("Accepted postings")
    class AcceptedTests {

        @Test
        @DisplayName("Should build a fully enriched canonical record")
        void shouldBuildCanonicalRecord() {
            BuildOutcome outcome = builder.build(posting().build(), RUN_DATE, BATCH_TIME);

            assertThat(outcome.isAccepted()).isTrue();
            assertThat(outcome.reject()).isNull();
            CanonicalJobRecord record = outcome.record();
            assertThat(record.getCountry()).isEqualTo("US");
            assertThat(record.getState()).isEqualTo("CA");
            assertThat(record.getCity()).isEqualTo("San Francisco");
            assertThat(record.getRoleFamily()).isEqualTo("Tech/Engineering");
            assertThat(record.getSeniority()).isEqualTo("Senior");
            assertThat(record.getSkills()).containsExactly("Python", "Java");
            assertThat(record.getIndustryTag()).isEqualTo("Financial Services");
            assertThat(record.getRunDate()).isEqualTo(RUN_DATE);
            assertThat(record.getJobKey()).isEqualTo(JobKeyHasher.jobKey("greenhouse", "4001", "acme0001"));
        }

        @Test
        @DisplayName("Should normalize text fields")
        void shouldNormalizeTextFields() {
            RawJobPosting raw = posting().source(" GreenHouse ").title("  Senior   Software Engineer ").build();

            CanonicalJobRecord record = builder.build(raw, RUN_DATE, BATCH_TIME).record();

            assertThat(record.getSource()).isEqualTo("greenhouse");
            assertThat(record.getTitle()).isEqualTo("Senior Software Engineer");
            assertThat(record.getDescription()).isEqualTo("Build payments services in Java and Python.");
            assertThat(record.getDepartment()).isEqualTo("Engineering");
            assertThat(record.getJobUrl()).isEqualTo("https://boards.greenhouse.io/acme/jobs/4001");
        }

        @ParameterizedTest
        @NullSource
        @ValueSource(strings = {"   ", "<p> </p>"})
        @DisplayName("Should keep a missing description as null")
        void shouldKeepMissingDescriptionNull(String description) {
            BuildOutcome outcome = builder.build(posting().description(description).build(), RUN_DATE, BATCH_TIME);

            assertThat(outcome.isAccepted()).isTrue();
            assertThat(outcome.record().getDescription()).isNull();
            assertThat(outcome.record().getSkills()).isEmpty();
        }

        @Test
        @DisplayName("Should use the posting's fetch time as scrape time")
        void shouldUseFetchTime() {
            Instant fetched = Instant.parse("2024-05-01T01:02:03Z");

            CanonicalJobRecord record = builder.build(posting().fetchedAt(fetched).build(), RUN_DATE, BATCH_TIME)
                    .record();

            assertThat(record.getScrapedAt()).isEqualTo(fetched);
        }

        @Test
        @DisplayName("Should fall back to the batch timestamp when the fetch time is missing")
        void shouldFallBackToBatchTimestamp() {
            CanonicalJobRecord record = builder.build(posting().build(), RUN_DATE, BATCH_TIME).record();

            assertThat(record.getScrapedAt()).isEqualTo(BATCH_TIME);
        }

        @Test
        @DisplayName("Should produce identical records when reprocessing the same input")
        void shouldBeIdempotent() {
            RawJobPosting raw = posting().build();

            CanonicalJobRecord first = builder.build(raw, RUN_DATE, BATCH_TIME).record();
            CanonicalJobRecord second = builder.build(raw, RUN_DATE, BATCH_TIME).record();

            assertThat(second).isEqualTo(first);
        }

        @Test
        @DisplayName("Should keep the job key when title, location or run date change")
        void shouldKeepJobKeyAcrossEdits() {
            CanonicalJobRecord original = builder.build(posting().build(), RUN_DATE, BATCH_TIME).record();
            CanonicalJobRecord edited = builder.build(
                    posting().title("Staff Software Engineer").locationRaw("Austin, TX").build(),
                    RUN_DATE.plusDays(1), BATCH_TIME).record();

            assertThat(edited.getJobKey()).isEqualTo(original.getJobKey());
        }

        @Test
        @DisplayName("Should leave enrichment fields empty when no rule matches")
        void shouldLeaveEnrichmentEmpty() {
            RawJobPosting raw = posting().title("Chef").description("Cook meals.").companyName("Acme").build();

            CanonicalJobRecord record = builder.build(raw, RUN_DATE, BATCH_TIME).record();

            assertThat(record.getRoleFamily()).isNull();
            assertThat(record.getIndustryTag()).isNull();
            assertThat(record.getSeniority()).isNull();
            assertThat(record.getSkills()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Rejected postings")
    class RejectedTests {

        @Test
        @DisplayName("Should reject a non-US location with reason and audit fields")
        void shouldRejectNonUs() {
            BuildOutcome outcome = builder.build(posting().locationRaw("London, UK").build(), RUN_DATE, BATCH_TIME);

            assertThat(outcome.isAccepted()).isFalse();
            assertThat(outcome.record()).isNull();
            RejectRecord reject = outcome.reject();
            assertThat(reject.getReason()).isEqualTo(RejectReason.NON_US);
            assertThat(reject.getSourceJobId()).isEqualTo("4001");
            assertThat(reject.getLocationRaw()).isEqualTo("London, UK");
            assertThat(reject.getRunDate()).isEqualTo(RUN_DATE);
        }

        @Test
        @DisplayName("Should reject a remote-only location as ambiguous")
        void shouldRejectAmbiguous() {
            BuildOutcome outcome = builder.build(posting().locationRaw("Remote").build(), RUN_DATE, BATCH_TIME);

            assertThat(outcome.reject().getReason()).isEqualTo(RejectReason.AMBIGUOUS);
        }

        @ParameterizedTest(name = "missing {0}")
        @CsvSource({"source", "sourceJobId", "companyId", "title", "locationRaw"})
        @DisplayName("Should reject postings missing a required field")
        void shouldRejectMissingRequiredField(String field) {
            RawJobPosting.RawJobPostingBuilder raw = posting();
            switch (field) {
                case "source" -> raw.source(null);
                case "sourceJobId" -> raw.sourceJobId(" ");
                case "companyId" -> raw.companyId(null);
                case "title" -> raw.title("");
                default -> raw.locationRaw(null);
            }

            BuildOutcome outcome = builder.build(raw.build(), RUN_DATE, BATCH_TIME);

            assertThat(outcome.isAccepted()).isFalse();
            assertThat(outcome.reject().getReason()).isEqualTo(RejectReason.MISSING_REQUIRED_FIELD);
        }

        @Test
        @DisplayName("Should convert an enrichment failure into a reject for that posting only")
        void shouldIsolateEnrichmentFailure() {
            SkillsExtractor failing = mock(SkillsExtractor.class);
            when(failing.extract(anyString(), anyString(), any(SkillLexicon.class)))
                    .thenThrow(new IllegalStateException("boom"));
            CanonicalRecordBuilder failingBuilder = newBuilder(failing);

            BuildOutcome outcome = failingBuilder.build(posting().build(), RUN_DATE, BATCH_TIME);

            assertThat(outcome.isAccepted()).isFalse();
            assertThat(outcome.reject().getReason()).isEqualTo(RejectReason.ENRICHMENT_ERROR);
            assertThat(outcome.reject().getDetail()).contains("boom");
        }
    }

    @Nested
    @DisplayName("URL cleanup")
    class UrlTests {

        @ParameterizedTest
        @CsvSource(nullValues = "null", value = {
                "'https://example.com/job/1', 'https://example.com/job/1'",
                "'example.com/job/1', 'https://example.com/job/1'",
                "' https://example.com/ job/1 ', 'https://example.com/job/1'",
                "'   ', null"
        })
        void cleanUrl(String raw, String expected) {
            assertThat(CanonicalRecordBuilder.cleanUrl(raw)).isEqualTo(expected);
        }
    }
}
