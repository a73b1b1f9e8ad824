package dev.jobintel.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Audit record for a posting that was not accepted into the canonical dataset.
 */
@Value
@Builder
public class RejectRecord {
    String source;
    String sourceJobId;
    String companyId;
    String companyName;
    String locationRaw;
    RejectReason reason;
    String detail;
    LocalDate runDate;

    public static RejectRecord of(RawJobPosting posting, RejectReason reason, String detail, LocalDate runDate) {
        return RejectRecord.builder()
                .source(posting.getSource())
                .sourceJobId(posting.getSourceJobId())
                .companyId(posting.getCompanyId())
                .companyName(posting.getCompanyName())
                .locationRaw(posting.getLocationRaw())
                .reason(reason)
                .detail(detail)
                .runDate(runDate)
                .build();
    }
}
