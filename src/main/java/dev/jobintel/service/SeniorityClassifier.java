package dev.jobintel.service;

import dev.jobintel.model.SeniorityRules;
import org.springframework.stereotype.Service;

/**
 * Derives a seniority level from the job title only.
 */
@Service
public class SeniorityClassifier {

    public String classify(String title, SeniorityRules rules) {
        return KeywordMatcher.firstMatch(title, rules);
    }
}
