package dev.jobintel.service;

import dev.jobintel.model.IndustryRules;
import org.springframework.stereotype.Service;

/**
 * Tags a posting with an industry from its company name and description.
 */
@Service
public class IndustryTagger {

    /**
     * First rule, in declared order, matching the company name; failing that, the first
     * rule matching the description. Null when nothing matches.
     */
    public String tag(String companyName, String description, IndustryRules rules) {
        String byCompany = KeywordMatcher.firstMatch(companyName, rules);
        return byCompany != null ? byCompany : KeywordMatcher.firstMatch(description, rules);
    }
}
