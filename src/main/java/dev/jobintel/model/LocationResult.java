package dev.jobintel.model;

/**
 * Result of classifying a free-text location.
 */
public record LocationResult(
        String country,
        String state,
        String city,
        String postalCode,
        String msa,
        boolean remote,
        boolean accepted,
        RejectReason reason) {

    public static LocationResult accepted(String state, String city, String postalCode, String msa, boolean remote) {
        return new LocationResult(CanonicalJobRecord.COUNTRY_US, state, city, postalCode, msa, remote, true, null);
    }

    public static LocationResult rejected(RejectReason reason, boolean remote) {
        return new LocationResult(null, null, null, null, null, remote, false, reason);
    }
}
