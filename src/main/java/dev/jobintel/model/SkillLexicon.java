package dev.jobintel.model;

import java.util.List;

/**
 * Skill name to its surface forms.
 */
public final class SkillLexicon extends RuleTable {

    public SkillLexicon(List<ClassificationRule> rules) {
        super("skills", rules);
    }
}
