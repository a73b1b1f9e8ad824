package dev.jobintel.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobintel.config.EnrichmentRulesConfig.RuleDefinition;
import dev.jobintel.model.ClassificationRule;
import dev.jobintel.model.EnrichmentRules;
import dev.jobintel.model.IndustryRules;
import dev.jobintel.model.RoleTaxonomy;
import dev.jobintel.model.SeniorityRules;
import dev.jobintel.model.SkillLexicon;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Builds the immutable enrichment rule tables once per run.
 * A malformed table fails context startup, so no posting is ever classified against it.
 */
@Slf4j
@Configuration
public class RuleTablesConfig {

    @Bean
    public EnrichmentRules enrichmentRules(EnrichmentRulesConfig rulesConfig,
                                           PipelineProperties pipelineProperties,
                                           ObjectMapper objectMapper) {
        EnrichmentRulesConfig source = resolveSource(rulesConfig, pipelineProperties.getRulesFile(), objectMapper);
        try {
            EnrichmentRules rules = new EnrichmentRules(
                    new RoleTaxonomy(toRules(source.getRoleFamilies())),
                    new SkillLexicon(toRules(source.getSkills())),
                    new IndustryRules(toRules(source.getIndustries())),
                    new SeniorityRules(toRules(source.getSeniority())));
            log.info("Loaded enrichment rules: {} role families, {} skills, {} industries, {} seniority levels",
                    rules.roleTaxonomy().size(), rules.skillLexicon().size(),
                    rules.industryRules().size(), rules.seniorityRules().size());
            return rules;
        } catch (IllegalArgumentException e) {
            log.error("Invalid enrichment rules: {}", e.getMessage());
            throw new IllegalStateException("Invalid enrichment rules: " + e.getMessage(), e);
        }
    }

    static EnrichmentRulesConfig resolveSource(EnrichmentRulesConfig rulesConfig, String rulesFile,
                                               ObjectMapper objectMapper) {
        if (rulesFile == null || rulesFile.isBlank()) {
            return rulesConfig;
        }

        File file = new File(rulesFile);
        if (!file.exists()) {
            throw new IllegalStateException("Rules file not found: " + rulesFile);
        }

        try {
            EnrichmentRulesConfig loaded = objectMapper.readValue(file, EnrichmentRulesConfig.class);
            log.info("Loaded enrichment rules from {}", rulesFile);
            return loaded;
        } catch (IOException e) {
            log.error("Failed to load {}. Ensure it matches the required structure.", rulesFile, e);
            throw new IllegalStateException("Could not load enrichment rules from " + rulesFile, e);
        }
    }

    private static List<ClassificationRule> toRules(List<RuleDefinition> definitions) {
        if (definitions == null) {
            return List.of();
        }
        return definitions.stream()
                .map(d -> d == null ? null : new ClassificationRule(d.getLabel(), d.getPatterns()))
                .toList();
    }
}
