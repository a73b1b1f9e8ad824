package dev.jobintel.service;

import dev.jobintel.model.ClassificationRule;
import dev.jobintel.model.RuleTable;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Case-insensitive, word-bounded keyword matching shared by the classifiers.
 * Boundaries are "not a letter, digit or underscore", so "go" does not match "google"
 * while "c++" and ".net" still match.
 */
public final class KeywordMatcher {

    private static final Map<String, Pattern> PATTERN_CACHE = new ConcurrentHashMap<>();

    private KeywordMatcher() {
    }

    /**
     * Check if text contains a keyword with word boundaries.
     */
    public static boolean containsWord(String text, String keyword) {
        if (text == null || text.isEmpty() || keyword == null || keyword.isBlank()) {
            return false;
        }
        Pattern pattern = PATTERN_CACHE.computeIfAbsent(keyword.trim().toLowerCase(Locale.ROOT), KeywordMatcher::compile);
        return pattern.matcher(text).find();
    }

    /**
     * Check if text contains any of the rule's patterns.
     */
    public static boolean matches(String text, ClassificationRule rule) {
        for (String pattern : rule.patterns()) {
            if (containsWord(text, pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Ordered scan with early return: the label of the first rule matching the text, or null.
     */
    public static String firstMatch(String text, RuleTable table) {
        if (text == null || text.isBlank()) {
            return null;
        }
        for (ClassificationRule rule : table.getRules()) {
            if (matches(text, rule)) {
                return rule.label();
            }
        }
        return null;
    }

    private static Pattern compile(String keyword) {
        String regex = "(?<![\\p{Alnum}_])" + Pattern.quote(keyword) + "(?![\\p{Alnum}_])";
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
