package dev.jobintel.model;

/**
 * Either a canonical record or a reject, never both.
 */
public record BuildOutcome(CanonicalJobRecord record, RejectRecord reject) {

    public static BuildOutcome accepted(CanonicalJobRecord record) {
        return new BuildOutcome(record, null);
    }

    public static BuildOutcome rejected(RejectRecord reject) {
        return new BuildOutcome(null, reject);
    }

    public boolean isAccepted() {
        return record != null;
    }
}
