package ru.tigran.stylistengine.quiz;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Weighted style distribution built from one quiz submission.
 *
 * @param scores         every configured category -> tally, zero-filled, in configured order
 * @param secondaryStyle null when only one category received votes
 * @param confidence     primary tally / total tally, in [0,1]
 * @param hybrid         top two tallies are within the tie threshold
 * @param styleMessage   human-readable summary, e.g. "Classic with a hint of Edgy"
 */
public record StyleProfile(
        Map<String, Double> scores,
        String primaryStyle,
        String secondaryStyle,
        double confidence,
        boolean hybrid,
        String styleMessage
) {
    public StyleProfile {
        scores = scores == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    }

    public double scoreOf(String category) {
        return scores.getOrDefault(category, 0.0);
    }
}
