package dev.jobintel.model;

import java.util.List;

/**
 * Role family label to title/description keywords.
 */
public final class RoleTaxonomy extends RuleTable {

    public RoleTaxonomy(List<ClassificationRule> rules) {
        super("role-families", rules);
    }
}
