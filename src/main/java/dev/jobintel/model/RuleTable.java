package dev.jobintel.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable, ordered list of classification rules. Declaration order is significant:
 * classifiers scan it front to back and the first match wins.
 */
public abstract class RuleTable {

    private final String name;
    private final List<ClassificationRule> rules;

    protected RuleTable(String name, List<ClassificationRule> rules) {
        this.name = name;
        this.rules = List.copyOf(validate(name, rules));
    }

    public String getName() {
        return name;
    }

    public List<ClassificationRule> getRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    private static List<ClassificationRule> validate(String name, List<ClassificationRule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException(name + ": no rules defined");
        }
        Set<String> labels = new HashSet<>();
        for (int i = 0; i < rules.size(); i++) {
            ClassificationRule rule = rules.get(i);
            if (rule == null || rule.label() == null || rule.label().isBlank()) {
                throw new IllegalArgumentException(name + ": rule #" + i + " has no label");
            }
            if (!labels.add(rule.label())) {
                throw new IllegalArgumentException(name + ": duplicate label '" + rule.label() + "'");
            }
            if (rule.patterns().isEmpty()) {
                throw new IllegalArgumentException(name + ": rule '" + rule.label() + "' has no patterns");
            }
            if (rule.patterns().stream().anyMatch(p -> p == null || p.isBlank())) {
                throw new IllegalArgumentException(name + ": rule '" + rule.label() + "' has a blank pattern");
            }
        }
        return rules;
    }
}
