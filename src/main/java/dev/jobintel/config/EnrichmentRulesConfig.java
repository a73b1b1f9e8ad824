package dev.jobintel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered enrichment rule definitions.
 * Loaded from application.yml under 'enrichment' prefix, or from the JSON file named by
 * {@code pipeline.rules-file}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "enrichment")
public class EnrichmentRulesConfig {

    private List<RuleDefinition> roleFamilies = new ArrayList<>();
    private List<RuleDefinition> skills = new ArrayList<>();
    private List<RuleDefinition> industries = new ArrayList<>();
    private List<RuleDefinition> seniority = new ArrayList<>();

    @Data
    public static class RuleDefinition {
        private String label;
        private List<String> patterns = new ArrayList<>();
    }
}
