package dev.jobintel.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobKeyHasherTest {

    @Nested
    @DisplayName("Job key")
    class JobKeyTests {

        @Test
        @DisplayName("Should produce 64 lower-case hex characters")
        void shouldProduceHexDigest() {
            String key = JobKeyHasher.jobKey("greenhouse", "12345", "abc123");

            assertThat(key).hasSize(JobKeyHasher.JOB_KEY_LENGTH).matches("[0-9a-f]{64}");
        }

        @Test
        @DisplayName("Should hash source|sourceJobId|companyId")
        void shouldHashPipeJoinedIdentity() {
            assertThat(JobKeyHasher.jobKey("greenhouse", "12345", "abc123"))
                    .isEqualTo(JobKeyHasher.sha256Hex("greenhouse|12345|abc123"));
        }

        @Test
        @DisplayName("Should be stable across calls")
        void shouldBeStable() {
            assertThat(JobKeyHasher.jobKey("lever", "a-1", "c1"))
                    .isEqualTo(JobKeyHasher.jobKey("lever", "a-1", "c1"));
        }

        @Test
        @DisplayName("Should ignore source case and surrounding whitespace")
        void shouldNormalizeSource() {
            assertThat(JobKeyHasher.jobKey(" Greenhouse ", " 12345", "abc123 "))
                    .isEqualTo(JobKeyHasher.jobKey("greenhouse", "12345", "abc123"));
        }

        @Test
        @DisplayName("Should differ when any identity part differs")
        void shouldDifferOnIdentity() {
            String base = JobKeyHasher.jobKey("greenhouse", "12345", "abc123");

            assertThat(JobKeyHasher.jobKey("lever", "12345", "abc123")).isNotEqualTo(base);
            assertThat(JobKeyHasher.jobKey("greenhouse", "12346", "abc123")).isNotEqualTo(base);
            assertThat(JobKeyHasher.jobKey("greenhouse", "12345", "abc124")).isNotEqualTo(base);
        }

        @Test
        @DisplayName("Should keep the delimiter so parts cannot shift")
        void shouldNotCollideOnShiftedParts() {
            assertThat(JobKeyHasher.jobKey("gh", "1|2", "c"))
                    .isNotEqualTo(JobKeyHasher.jobKey("gh", "1", "2|c"));
        }

        @Test
        @DisplayName("Should reject missing identity parts")
        void shouldRejectMissingParts() {
            assertThatThrownBy(() -> JobKeyHasher.jobKey(null, "1", "c"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Company id")
    class CompanyIdTests {

        @Test
        @DisplayName("Should produce the first 16 hex characters of the name hash")
        void shouldTruncateNameHash() {
            assertThat(JobKeyHasher.companyId("Acme Corp", null))
                    .hasSize(16)
                    .isEqualTo(JobKeyHasher.sha256Hex("acme corp").substring(0, 16));
        }

        @Test
        @DisplayName("Should include the domain when known")
        void shouldIncludeDomain() {
            assertThat(JobKeyHasher.companyId(" ACME Corp ", "Acme.com"))
                    .isEqualTo(JobKeyHasher.sha256Hex("acme corp|acme.com").substring(0, 16));
        }

        @Test
        @DisplayName("Should reject a blank name")
        void shouldRejectBlankName() {
            assertThatThrownBy(() -> JobKeyHasher.companyId(" ", null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
