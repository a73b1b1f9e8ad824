package dev.jobintel.service;

import dev.jobintel.config.LocationRulesConfig;
import dev.jobintel.model.LocationResult;
import dev.jobintel.model.RejectReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies free-text posting locations and decides whether they are in the US.
 *
 * <p>Decision order, first match wins:
 * <ol>
 *   <li>upper-case state code after "City, " or standing alone before a separator ("Austin, TX"),
 *   skipped when a non-US place is named ("Vancouver, BC, CA")</li>
 *   <li>full state name ("Boston, Massachusetts")</li>
 *   <li>explicit country ("United States", "USA", "US")</li>
 *   <li>explicit non-US country/region/city: rejected as non-US</li>
 *   <li>remote-only or multi-location phrasing: rejected as ambiguous</li>
 *   <li>anything else: rejected as non-US</li>
 * </ol>
 * Postal code and MSA are best-effort and never affect the decision.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LocationClassifier {

    static final Map<String, String> US_STATES = new LinkedHashMap<>();

    static {
        US_STATES.put("AL", "Alabama");
        US_STATES.put("AK", "Alaska");
        US_STATES.put("AZ", "Arizona");
        US_STATES.put("AR", "Arkansas");
        US_STATES.put("CA", "California");
        US_STATES.put("CO", "Colorado");
        US_STATES.put("CT", "Connecticut");
        US_STATES.put("DE", "Delaware");
        US_STATES.put("FL", "Florida");
        US_STATES.put("GA", "Georgia");
        US_STATES.put("HI", "Hawaii");
        US_STATES.put("ID", "Idaho");
        US_STATES.put("IL", "Illinois");
        US_STATES.put("IN", "Indiana");
        US_STATES.put("IA", "Iowa");
        US_STATES.put("KS", "Kansas");
        US_STATES.put("KY", "Kentucky");
        US_STATES.put("LA", "Louisiana");
        US_STATES.put("ME", "Maine");
        US_STATES.put("MD", "Maryland");
        US_STATES.put("MA", "Massachusetts");
        US_STATES.put("MI", "Michigan");
        US_STATES.put("MN", "Minnesota");
        US_STATES.put("MS", "Mississippi");
        US_STATES.put("MO", "Missouri");
        US_STATES.put("MT", "Montana");
        US_STATES.put("NE", "Nebraska");
        US_STATES.put("NV", "Nevada");
        US_STATES.put("NH", "New Hampshire");
        US_STATES.put("NJ", "New Jersey");
        US_STATES.put("NM", "New Mexico");
        US_STATES.put("NY", "New York");
        US_STATES.put("NC", "North Carolina");
        US_STATES.put("ND", "North Dakota");
        US_STATES.put("OH", "Ohio");
        US_STATES.put("OK", "Oklahoma");
        US_STATES.put("OR", "Oregon");
        US_STATES.put("PA", "Pennsylvania");
        US_STATES.put("RI", "Rhode Island");
        US_STATES.put("SC", "South Carolina");
        US_STATES.put("SD", "South Dakota");
        US_STATES.put("TN", "Tennessee");
        US_STATES.put("TX", "Texas");
        US_STATES.put("UT", "Utah");
        US_STATES.put("VT", "Vermont");
        US_STATES.put("VA", "Virginia");
        US_STATES.put("WA", "Washington");
        US_STATES.put("WV", "West Virginia");
        US_STATES.put("WI", "Wisconsin");
        US_STATES.put("WY", "Wyoming");
        US_STATES.put("DC", "District of Columbia");
    }

    // Longest names first so "West Virginia" wins over "Virginia"
    private static final List<Map.Entry<String, String>> STATES_BY_NAME_LENGTH = US_STATES.entrySet().stream()
            .sorted(Comparator.comparingInt((Map.Entry<String, String> e) -> e.getValue().length()).reversed())
            .toList();

    // Metro areas keyed by "city|ST"
    private static final Map<String, String> MSA_BY_CITY = Map.ofEntries(
            Map.entry("new york|NY", "New York-Newark-Jersey City, NY-NJ-PA"),
            Map.entry("brooklyn|NY", "New York-Newark-Jersey City, NY-NJ-PA"),
            Map.entry("jersey city|NJ", "New York-Newark-Jersey City, NY-NJ-PA"),
            Map.entry("los angeles|CA", "Los Angeles-Long Beach-Anaheim, CA"),
            Map.entry("san francisco|CA", "San Francisco-Oakland-Berkeley, CA"),
            Map.entry("oakland|CA", "San Francisco-Oakland-Berkeley, CA"),
            Map.entry("san jose|CA", "San Jose-Sunnyvale-Santa Clara, CA"),
            Map.entry("sunnyvale|CA", "San Jose-Sunnyvale-Santa Clara, CA"),
            Map.entry("palo alto|CA", "San Jose-Sunnyvale-Santa Clara, CA"),
            Map.entry("mountain view|CA", "San Jose-Sunnyvale-Santa Clara, CA"),
            Map.entry("san diego|CA", "San Diego-Chula Vista-Carlsbad, CA"),
            Map.entry("seattle|WA", "Seattle-Tacoma-Bellevue, WA"),
            Map.entry("bellevue|WA", "Seattle-Tacoma-Bellevue, WA"),
            Map.entry("redmond|WA", "Seattle-Tacoma-Bellevue, WA"),
            Map.entry("boston|MA", "Boston-Cambridge-Newton, MA-NH"),
            Map.entry("cambridge|MA", "Boston-Cambridge-Newton, MA-NH"),
            Map.entry("chicago|IL", "Chicago-Naperville-Elgin, IL-IN-WI"),
            Map.entry("austin|TX", "Austin-Round Rock-Georgetown, TX"),
            Map.entry("dallas|TX", "Dallas-Fort Worth-Arlington, TX"),
            Map.entry("houston|TX", "Houston-The Woodlands-Sugar Land, TX"),
            Map.entry("denver|CO", "Denver-Aurora-Lakewood, CO"),
            Map.entry("boulder|CO", "Boulder, CO"),
            Map.entry("atlanta|GA", "Atlanta-Sandy Springs-Alpharetta, GA"),
            Map.entry("miami|FL", "Miami-Fort Lauderdale-Pompano Beach, FL"),
            Map.entry("washington|DC", "Washington-Arlington-Alexandria, DC-VA-MD-WV"),
            Map.entry("arlington|VA", "Washington-Arlington-Alexandria, DC-VA-MD-WV"),
            Map.entry("philadelphia|PA", "Philadelphia-Camden-Wilmington, PA-NJ-DE-MD"),
            Map.entry("pittsburgh|PA", "Pittsburgh, PA"),
            Map.entry("phoenix|AZ", "Phoenix-Mesa-Chandler, AZ"),
            Map.entry("minneapolis|MN", "Minneapolis-St. Paul-Bloomington, MN-WI"),
            Map.entry("detroit|MI", "Detroit-Warren-Dearborn, MI"),
            Map.entry("portland|OR", "Portland-Vancouver-Hillsboro, OR-WA"),
            Map.entry("salt lake city|UT", "Salt Lake City, UT"),
            Map.entry("raleigh|NC", "Raleigh-Cary, NC"),
            Map.entry("nashville|TN", "Nashville-Davidson--Murfreesboro--Franklin, TN"));

    private static final Pattern STATE_AFTER_CITY = Pattern.compile(",\\s*([A-Z]{2})\\b");
    private static final Pattern STATE_CODE = Pattern.compile(
            "\\b([A-Z]{2})\\b(?:\\s+\\d{5}(?:-\\d{4})?)?(?=\\s*(?:[,;/|()\\-]|$))");
    private static final Pattern POSTAL_CODE = Pattern.compile("\\b(\\d{5})(?:-\\d{4})?\\b");
    private static final Pattern US_TOKEN = Pattern.compile("\\bUS\\b");
    private static final Pattern CITY_PREFIX = Pattern.compile(
            "^(?:(?:remote|hybrid)\\s*[-:/(]\\s*|(?:greater|metro)\\s+)", Pattern.CASE_INSENSITIVE);
    private static final List<String> US_COUNTRY_NAMES = List.of(
            "united states of america", "united states", "usa", "u.s.a.", "u.s.");

    private final LocationRulesConfig locationRules;

    /**
     * Classify a raw location string.
     *
     * @param locationRaw free-text location, may be null
     * @return accepted result with parsed parts, or a rejection with its reason
     */
    public LocationResult classify(String locationRaw) {
        if (locationRaw == null || locationRaw.isBlank()) {
            return LocationResult.rejected(RejectReason.MISSING_REQUIRED_FIELD, false);
        }

        String text = TextNormalizer.collapseWhitespace(locationRaw);
        boolean remote = hasAny(text, locationRules.getRemoteKeywords());
        boolean nonUsPlace = hasAny(text, locationRules.getNonUsMarkers());

        // 1. State code
        String stateCode = nonUsPlace ? null : extractStateCode(text);
        if (stateCode != null) {
            String city = extractCity(text, stateCode);
            return accept(text, stateCode, city, remote);
        }

        // 2. Full state name
        Map.Entry<String, String> namedState = findStateByName(text);
        if (namedState != null) {
            String city = cityBeforeComma(text, namedState.getValue());
            return accept(text, namedState.getKey(), city, remote);
        }

        // 3. Country only
        if (mentionsUnitedStates(text)) {
            return LocationResult.accepted(null, null, extractPostalCode(text), null, remote);
        }

        // 4. Explicit non-US signal beats ambiguity ("Remote - UK")
        if (nonUsPlace) {
            log.debug("Location '{}' rejected: non-US marker", text);
            return LocationResult.rejected(RejectReason.NON_US, remote);
        }

        // 5. Remote-only / multi-location phrasing
        if (hasAny(text, locationRules.getAmbiguousPhrases())) {
            log.debug("Location '{}' rejected: ambiguous", text);
            return LocationResult.rejected(RejectReason.AMBIGUOUS, remote);
        }

        log.debug("Location '{}' rejected: no US signal", text);
        return LocationResult.rejected(RejectReason.NON_US, remote);
    }

    private LocationResult accept(String text, String stateCode, String city, boolean remote) {
        String msa = city != null ? MSA_BY_CITY.get(city.toLowerCase(Locale.ROOT) + "|" + stateCode) : null;
        return LocationResult.accepted(stateCode, city, extractPostalCode(text), msa, remote);
    }

    static String extractStateCode(String text) {
        String afterCity = firstKnownState(STATE_AFTER_CITY.matcher(text));
        return afterCity != null ? afterCity : firstKnownState(STATE_CODE.matcher(text));
    }

    private static String firstKnownState(Matcher matcher) {
        while (matcher.find()) {
            String candidate = matcher.group(1);
            if (US_STATES.containsKey(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private static Map.Entry<String, String> findStateByName(String text) {
        for (Map.Entry<String, String> state : STATES_BY_NAME_LENGTH) {
            if (KeywordMatcher.containsWord(text, state.getValue())) {
                return state;
            }
        }
        return null;
    }

    private static boolean mentionsUnitedStates(String text) {
        if (US_TOKEN.matcher(text).find()) {
            return true;
        }
        return US_COUNTRY_NAMES.stream().anyMatch(name -> KeywordMatcher.containsWord(text, name));
    }

    private static String extractCity(String text, String stateCode) {
        Pattern cityPattern = Pattern.compile("(?:^|[;/|])\\s*([^;/|,]+?),\\s*" + stateCode + "\\b",
                Pattern.CASE_INSENSITIVE);
        Matcher matcher = cityPattern.matcher(text);
        if (matcher.find()) {
            return cleanCity(matcher.group(1));
        }
        return null;
    }

    private static String cityBeforeComma(String text, String stateName) {
        int comma = text.indexOf(',');
        if (comma <= 0) {
            return null;
        }
        String candidate = cleanCity(text.substring(0, comma));
        if (candidate == null || candidate.equalsIgnoreCase(stateName) || US_STATES.containsKey(candidate.toUpperCase(Locale.ROOT))) {
            return null;
        }
        return candidate;
    }

    private static String cleanCity(String raw) {
        String city = CITY_PREFIX.matcher(raw.trim()).replaceFirst("").trim();
        if (city.isEmpty() || city.equalsIgnoreCase("remote") || city.equalsIgnoreCase("hybrid")) {
            return null;
        }
        return city;
    }

    static String extractPostalCode(String text) {
        Matcher matcher = POSTAL_CODE.matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static boolean hasAny(String text, List<String> keywords) {
        if (keywords == null) {
            return false;
        }
        for (String keyword : keywords) {
            if (KeywordMatcher.containsWord(text, keyword)) {
                return true;
            }
        }
        return false;
    }
}
