package dev.jobintel.model;

/**
 * Why a posting did not become a canonical record. Codes are part of the audit output.
 */
public enum RejectReason {
    NON_US("non-US"),
    AMBIGUOUS("ambiguous"),
    MISSING_REQUIRED_FIELD("missing-required-field"),
    ENRICHMENT_ERROR("enrichment-error");

    private final String code;

    RejectReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static RejectReason fromCode(String code) {
        for (RejectReason reason : values()) {
            if (reason.code.equals(code)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown reject reason code: " + code);
    }
}
