package dev.jobintel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Keyword lists used by the location classifier.
 * Loaded from application.yml under 'location' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "location")
public class LocationRulesConfig {

    private List<String> remoteKeywords = new ArrayList<>(List.of(
            "remote", "work from home", "wfh", "anywhere", "distributed", "virtual"));

    private List<String> ambiguousPhrases = new ArrayList<>(List.of(
            "remote", "multiple locations", "various locations", "anywhere",
            "global", "worldwide", "distributed", "virtual", "work from home", "wfh", "hybrid", "flexible", "tbd"));

    private List<String> nonUsMarkers = new ArrayList<>(List.of(
            "uk", "united kingdom", "england", "london", "ireland", "dublin",
            "canada", "toronto", "vancouver", "montreal", "ontario",
            "germany", "berlin", "munich", "france", "paris", "spain", "madrid", "barcelona",
            "netherlands", "amsterdam", "poland", "warsaw", "portugal", "lisbon",
            "europe", "emea", "apac", "latam", "india", "bangalore", "bengaluru", "chennai", "hyderabad", "pune", "mumbai",
            "singapore", "japan", "tokyo", "australia", "sydney", "melbourne",
            "brazil", "sao paulo", "mexico", "mexico city", "argentina", "israel", "tel aviv"));
}
