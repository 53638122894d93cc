package ru.tigran.stylistengine.matching;

import ru.tigran.stylistengine.scoring.ScoringUtils;

/**
 * Component scores of one candidate for one role. Every field is in [0,1].
 */
public record ScoreBreakdown(
        double semantic,
        double styleConsistency,
        double categoryAppropriateness,
        double colorHarmony,
        double overall
) {
    public ScoreBreakdown {
        semantic = ScoringUtils.clamp01(semantic);
        styleConsistency = ScoringUtils.clamp01(styleConsistency);
        categoryAppropriateness = ScoringUtils.clamp01(categoryAppropriateness);
        colorHarmony = ScoringUtils.clamp01(colorHarmony);
        overall = ScoringUtils.clamp01(overall);
    }
}
