package dev.jobintel.service;

import dev.jobintel.model.ClassificationRule;
import dev.jobintel.model.SkillLexicon;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Extracts skills from a posting's title and description using a skill lexicon.
 */
@Service
public class SkillsExtractor {

    /**
     * Extract matched skills.
     *
     * @param title       job title, may be null
     * @param description cleaned description, may be null
     * @param lexicon     skill name to surface forms
     * @return skill names in lexicon declaration order, without duplicates
     */
    public List<String> extract(String title, String description, SkillLexicon lexicon) {
        String text = join(title, description);
        if (text.isEmpty()) {
            return List.of();
        }

        List<String> found = new ArrayList<>();
        for (ClassificationRule skill : lexicon.getRules()) {
            if (KeywordMatcher.matches(text, skill)) {
                found.add(skill.label());
            }
        }
        return Collections.unmodifiableList(found);
    }

    private static String join(String title, String description) {
        String t = title == null ? "" : title;
        String d = description == null ? "" : description;
        return (t + " " + d).trim();
    }
}
