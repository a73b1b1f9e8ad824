package dev.jobintel.model;

/**
 * The rule tables for one run. Loaded once at startup and shared read-only by every classification call.
 */
public record EnrichmentRules(
        RoleTaxonomy roleTaxonomy,
        SkillLexicon skillLexicon,
        IndustryRules industryRules,
        SeniorityRules seniorityRules) {
}
