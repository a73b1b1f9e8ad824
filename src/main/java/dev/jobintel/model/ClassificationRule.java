package dev.jobintel.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One ordered rule: a label and the surface forms that select it.
 */
public record ClassificationRule(String label, List<String> patterns) {

    public ClassificationRule {
        patterns = patterns == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(patterns));
    }
}
