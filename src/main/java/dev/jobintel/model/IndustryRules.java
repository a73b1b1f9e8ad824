package dev.jobintel.model;

import java.util.List;

/**
 * Industry tag to company/description keywords.
 */
public final class IndustryRules extends RuleTable {

    public IndustryRules(List<ClassificationRule> rules) {
        super("industries", rules);
    }
}
