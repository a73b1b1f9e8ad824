package dev.jobintel.entity;

import dev.jobintel.model.RejectReason;
import dev.jobintel.model.RejectRecord;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Audit row for a rejected posting. Never merged into canonical data.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "job_rejects", indexes = {
        @Index(name = "idx_reject_partition", columnList = "runDate,source")
})
public class RejectRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private LocalDate runDate;

    @Column(nullable = false)
    private String source;

    private String sourceJobId;
    private String companyId;
    private String companyName;

    @Column(length = 500)
    private String locationRaw;

    @Column(nullable = false, length = 32)
    private String reasonCode;

    @Column(length = 1000)
    private String detail;

    public static RejectRecordEntity from(RejectRecord reject, String partitionSource) {
        return RejectRecordEntity.builder()
                .runDate(reject.getRunDate())
                .source(partitionSource)
                .sourceJobId(reject.getSourceJobId())
                .companyId(reject.getCompanyId())
                .companyName(reject.getCompanyName())
                .locationRaw(truncate(reject.getLocationRaw(), 500))
                .reasonCode(reject.getReason().getCode())
                .detail(truncate(reject.getDetail(), 1000))
                .build();
    }

    public RejectRecord toRecord() {
        return RejectRecord.builder()
                .runDate(runDate)
                .source(source)
                .sourceJobId(sourceJobId)
                .companyId(companyId)
                .companyName(companyName)
                .locationRaw(locationRaw)
                .reason(RejectReason.fromCode(reasonCode))
                .detail(detail)
                .build();
    }

    private static String truncate(String value, int max) {
        return value != null && value.length() > max ? value.substring(0, max) : value;
    }
}
