package dev.jobintel.model;

import java.util.List;

/**
 * Seniority level to title keywords.
 */
public final class SeniorityRules extends RuleTable {

    public SeniorityRules(List<ClassificationRule> rules) {
        super("seniority", rules);
    }
}
