package dev.jobintel.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

/**
 * Stable identity hashes.
 *
 * <p>The job key depends only on (source, source job id, company id). Titles, descriptions
 * and locations are edited between scrapes and must not create a new job. Changing the key
 * format is a breaking change for every downstream consumer.
 */
public final class JobKeyHasher {

    public static final int JOB_KEY_LENGTH = 64;
    private static final int COMPANY_ID_LENGTH = 16;

    private JobKeyHasher() {
    }

    public static String jobKey(String source, String sourceJobId, String companyId) {
        if (source == null || sourceJobId == null || companyId == null) {
            throw new IllegalArgumentException("source, sourceJobId and companyId are required for a job key");
        }
        String material = source.trim().toLowerCase(Locale.ROOT)
                + "|" + sourceJobId.trim()
                + "|" + companyId.trim();
        return sha256Hex(material);
    }

    public static String companyId(String companyName, String companyDomain) {
        if (companyName == null || companyName.isBlank()) {
            throw new IllegalArgumentException("companyName is required for a company id");
        }
        String key = companyName.trim().toLowerCase(Locale.ROOT);
        if (companyDomain != null && !companyDomain.isBlank()) {
            key = key + "|" + companyDomain.trim().toLowerCase(Locale.ROOT);
        }
        return sha256Hex(key).substring(0, COMPANY_ID_LENGTH);
    }

    static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder out = new StringBuilder(JOB_KEY_LENGTH);
            for (byte b : hash) {
                out.append(String.format("%02x", b));
            }
            return out.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
