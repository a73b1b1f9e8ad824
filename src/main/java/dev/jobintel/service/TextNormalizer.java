package dev.jobintel.service;

import org.jsoup.Jsoup;

/**
 * Text cleanup applied to raw posting fields.
 */
public final class TextNormalizer {

    private TextNormalizer() {
    }

    /**
     * Strip HTML tags and collapse whitespace. Null becomes empty.
     */
    public static String cleanText(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String plain = text.indexOf('<') >= 0 ? Jsoup.parse(text).text() : text;
        return collapseWhitespace(plain);
    }

    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return text.replaceAll("[\\u200B-\\u200D\\uFEFF]", "").replaceAll("\\s+", " ").trim();
    }

    /**
     * Trimmed value, or null when blank.
     */
    public static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = collapseWhitespace(value);
        return trimmed.isEmpty() ? null : trimmed;
    }
}
