package dev.jobintel.storage;

import dev.jobintel.entity.JobRecordEntity;
import dev.jobintel.entity.RejectRecordEntity;
import dev.jobintel.model.CanonicalJobRecord;
import dev.jobintel.model.RejectReason;
import dev.jobintel.model.RejectRecord;
import dev.jobintel.repository.JobRecordRepository;
import dev.jobintel.repository.RejectRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JpaPartitionStoreTest {

    private static final LocalDate RUN_DATE = LocalDate.of(2024, 5, 2);

    @Mock
    private JobRecordRepository jobRecordRepository;

    @Mock
    private RejectRecordRepository rejectRecordRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    @Captor
    private ArgumentCaptor<List<JobRecordEntity>> entitiesCaptor;

    @Captor
    private ArgumentCaptor<List<RejectRecordEntity>> rejectEntitiesCaptor;

    private JpaPartitionStore store;

    @BeforeEach
    void setUp() {
        store = new JpaPartitionStore(jobRecordRepository, rejectRecordRepository, transactionManager);
    }

    private CanonicalJobRecord createRecord(String jobKey, String source, LocalDate runDate) {
        return CanonicalJobRecord.builder()
                .source(source)
                .sourceJobId(jobKey)
                .companyId("acme")
                .title("Engineer")
                .locationRaw("Austin, TX")
                .state("TX")
                .runDate(runDate)
                .scrapedAt(Instant.parse("2024-05-02T06:00:00Z"))
                .jobKey(jobKey)
                .build();
    }

    @Nested
    @DisplayName("Canonical partitions")
    class PartitionTests {

        @Test
        @DisplayName("Should delete the partition, then insert rows sorted by job key in one transaction")
        @SuppressWarnings("null")
        void shouldReplacePartition() {
            List<CanonicalJobRecord> records = List.of(
                    createRecord("k3", "lever", RUN_DATE),
                    createRecord("k1", "lever", RUN_DATE),
                    createRecord("k2", "lever", RUN_DATE));

            int written = store.writePartition(RUN_DATE, "lever", records);

            assertThat(written).isEqualTo(3);
            InOrder inOrder = inOrder(transactionManager, jobRecordRepository);
            inOrder.verify(transactionManager).getTransaction(any());
            inOrder.verify(jobRecordRepository).deletePartition(RUN_DATE, "lever");
            inOrder.verify(jobRecordRepository).saveAll(entitiesCaptor.capture());
            inOrder.verify(transactionManager).commit(any());
            assertThat(entitiesCaptor.getValue()).extracting(JobRecordEntity::getJobKey)
                    .containsExactly("k1", "k2", "k3");
        }

        @Test
        @DisplayName("Should clear the partition when the new content is empty")
        void shouldClearPartitionForEmptyContent() {
            int written = store.writePartition(RUN_DATE, "lever", List.of());

            assertThat(written).isZero();
            verify(jobRecordRepository).deletePartition(RUN_DATE, "lever");
        }

        @Test
        @DisplayName("Should refuse records of another partition")
        void shouldRefuseForeignRecords() {
            List<CanonicalJobRecord> records = List.of(createRecord("k1", "greenhouse", RUN_DATE));

            assertThatThrownBy(() -> store.writePartition(RUN_DATE, "lever", records))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("belongs to partition");
            verifyNoInteractions(jobRecordRepository);
        }

        @Test
        @DisplayName("Should refuse duplicate job keys")
        void shouldRefuseDuplicateKeys() {
            List<CanonicalJobRecord> records = List.of(
                    createRecord("k1", "lever", RUN_DATE),
                    createRecord("k1", "lever", RUN_DATE));

            assertThatThrownBy(() -> store.writePartition(RUN_DATE, "lever", records))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Duplicate job key");
        }

        @Test
        @DisplayName("Should refuse non-US records")
        void shouldRefuseNonUsRecords() {
            List<CanonicalJobRecord> records = List.of(
                    createRecord("k1", "lever", RUN_DATE).toBuilder().country("CA").build());

            assertThatThrownBy(() -> store.writePartition(RUN_DATE, "lever", records))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("not a US record");
        }

        @Test
        @DisplayName("Should roll back when the insert fails")
        void shouldRollBackOnFailure() {
            when(jobRecordRepository.saveAll(any())).thenThrow(new IllegalStateException("constraint"));

            List<CanonicalJobRecord> records = List.of(createRecord("k1", "lever", RUN_DATE));
            assertThatThrownBy(() -> store.writePartition(RUN_DATE, "lever", records))
                    .isInstanceOf(IllegalStateException.class);

            verify(transactionManager).rollback(any());
            verify(transactionManager, never()).commit(any());
        }
    }

    @Nested
    @DisplayName("Reject partitions")
    class RejectTests {

        @Test
        @DisplayName("Should replace rejects and store the reason code")
        @SuppressWarnings("null")
        void shouldReplaceRejects() {
            RejectRecord reject = RejectRecord.builder()
                    .source(null)
                    .sourceJobId("7")
                    .reason(RejectReason.MISSING_REQUIRED_FIELD)
                    .detail("missing source")
                    .runDate(RUN_DATE)
                    .build();

            int written = store.writeRejects(RUN_DATE, "unknown", List.of(reject));

            assertThat(written).isEqualTo(1);
            verify(rejectRecordRepository).deletePartition(RUN_DATE, "unknown");
            verify(rejectRecordRepository).saveAll(rejectEntitiesCaptor.capture());
            RejectRecordEntity entity = rejectEntitiesCaptor.getValue().get(0);
            assertThat(entity.getSource()).isEqualTo("unknown");
            assertThat(entity.getReasonCode()).isEqualTo("missing-required-field");
        }
    }
}
