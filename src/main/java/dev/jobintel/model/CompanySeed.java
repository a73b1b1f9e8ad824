package dev.jobintel.model;

import dev.jobintel.service.JobKeyHasher;
import lombok.Builder;
import lombok.Value;

/**
 * A company to ingest, as configured for the connectors.
 */
@Value
@Builder
public class CompanySeed {
    String companyName;
    String companyDomain;
    String careersUrl;
    String atsType;   // greenhouse | lever | unknown
    boolean portfolio;

    /**
     * Stable company identifier stamped on every posting of this company.
     */
    public String companyId() {
        return JobKeyHasher.companyId(companyName, companyDomain);
    }
}
