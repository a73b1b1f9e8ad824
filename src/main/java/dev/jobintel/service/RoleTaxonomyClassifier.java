package dev.jobintel.service;

import dev.jobintel.model.RoleTaxonomy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Maps a job title (and description) to a role family.
 */
@Slf4j
@Service
public class RoleTaxonomyClassifier {

    /**
     * Classify a posting into a role family.
     * A rule matching the title always beats a rule matching only the description, so keywords
     * buried in boilerplate do not override the title. Within each pass the taxonomy order decides.
     *
     * @return role family label, or null when nothing matches
     */
    public String classify(String title, String description, RoleTaxonomy taxonomy) {
        String byTitle = KeywordMatcher.firstMatch(title, taxonomy);
        if (byTitle != null) {
            return byTitle;
        }

        String byDescription = KeywordMatcher.firstMatch(description, taxonomy);
        if (byDescription == null) {
            log.debug("No role family for title '{}'", title);
        }
        return byDescription;
    }
}
