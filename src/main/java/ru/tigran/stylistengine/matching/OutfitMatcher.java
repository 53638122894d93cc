package ru.tigran.stylistengine.matching;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.tigran.stylistengine.feature.FeatureNames;
import ru.tigran.stylistengine.quiz.StyleProfile;
import ru.tigran.stylistengine.scoring.ScoringUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Picks the best garment from the user's inventory for every target of an outfit description.
 *
 * Roles are processed strictly in {@link OutfitRole#SCORING_ORDER}. The color palette of
 * garments already chosen is threaded from role to role, so a later role's color harmony
 * accounts for earlier picks. A garment is used at most once per outfit.
 */
@Slf4j
@Component
public class OutfitMatcher {

    static final double NEUTRAL_STYLE = 0.5;
    private static final double SECONDARY_STYLE_WEIGHT = 0.5;
    private static final double TARGET_COLOR_SHARE = 0.6;

    private final MatchingProperties properties;
    private final Counter matchCompletedCounter;

    public OutfitMatcher(MatchingProperties properties, MeterRegistry meterRegistry) {
        this.properties = properties;
        this.matchCompletedCounter = Counter.builder("outfit.match.completed")
                .description("Outfit match passes completed")
                .register(meterRegistry);
    }

    public OutfitMatchResult match(OutfitRequestSpec spec, List<GarmentRecord> inventory, StyleProfile profile) {
        return match(spec, inventory, profile, OutfitRole.SCORING_ORDER);
    }

    /**
     * Same as {@link #match(OutfitRequestSpec, List, StyleProfile)} with an explicit role order.
     * Only single-role requests are order independent.
     */
    public OutfitMatchResult match(OutfitRequestSpec spec, List<GarmentRecord> inventory,
                                   StyleProfile profile, List<OutfitRole> roleOrder) {
        List<GarmentRecord> garments = inventory == null ? List.of() : inventory;
        Set<Integer> used = new HashSet<>();
        ColorPalette palette = ColorPalette.empty();

        List<RoleMatch> matches = new ArrayList<>();
        Set<OutfitRole> missing = new LinkedHashSet<>();
        double overallSum = 0;
        int matched = 0;

        for (OutfitRole role : roleOrder) {
            for (RoleTarget target : spec.targetsFor(role)) {
                Candidate best = findBest(role, target, garments, used, palette, profile);
                if (best == null || best.breakdown().overall() < properties.getMinOverall()) {
                    log.debug("No garment for role {} (type '{}')", role.getValue(), target.type());
                    matches.add(RoleMatch.unmatched(role, target));
                    missing.add(role);
                    continue;
                }
                used.add(best.index());
                palette = palette.with(colorOf(best.garment()));
                matches.add(new RoleMatch(role, target, best.garment(), best.breakdown()));
                overallSum += best.breakdown().overall();
                matched++;
            }
        }

        double quality = matched == 0 ? 0.0 : ScoringUtils.clamp01(overallSum / matched);
        matchCompletedCounter.increment();
        if (!missing.isEmpty()) {
            log.warn("Outfit matched {}/{} targets, missing roles: {}", matched, matches.size(), missing);
        }
        return new OutfitMatchResult(matches, quality, new ArrayList<>(missing));
    }

    private Candidate findBest(OutfitRole role, RoleTarget target, List<GarmentRecord> garments,
                               Set<Integer> used, ColorPalette palette, StyleProfile profile) {
        Candidate best = null;
        for (int i = 0; i < garments.size(); i++) {
            if (used.contains(i)) {
                continue;
            }
            GarmentRecord garment = garments.get(i);
            double categoryScore = CategoryCompatibility.score(role, target.type(), garment.category());
            if (categoryScore <= 0) {
                continue;
            }
            ScoreBreakdown breakdown = score(target, garment, categoryScore, palette, profile);
            if (best == null || isBetter(breakdown, best.breakdown())) {
                best = new Candidate(i, garment, breakdown);
            }
        }
        return best;
    }

    // strict comparison: on a full tie the earlier inventory index stays
    private static boolean isBetter(ScoreBreakdown candidate, ScoreBreakdown current) {
        int byOverall = Double.compare(candidate.overall(), current.overall());
        if (byOverall != 0) {
            return byOverall > 0;
        }
        return Double.compare(candidate.semantic(), current.semantic()) > 0;
    }

    /**
     * Scores one candidate against one target given the colors committed so far.
     */
    public ScoreBreakdown score(OutfitRole role, RoleTarget target, GarmentRecord garment,
                                ColorPalette palette, StyleProfile profile) {
        double categoryScore = CategoryCompatibility.score(role, target.type(), garment.category());
        return score(target, garment, categoryScore, palette, profile);
    }

    private ScoreBreakdown score(RoleTarget target, GarmentRecord garment, double categoryScore,
                                 ColorPalette palette, StyleProfile profile) {
        double semantic = semantic(target, garment);
        double style = styleConsistency(garment, profile);
        double color = colorHarmony(target, garment, palette);

        MatchingProperties.Weights w = properties.getWeights();
        double overall = ScoringUtils.clamp01(ScoringUtils.weightedSum(
                List.of(semantic, style, categoryScore, color),
                List.of(w.getSemantic(), w.getStyle(), w.getCategory(), w.getColor())));
        return new ScoreBreakdown(semantic, style, categoryScore, color, overall);
    }

    static double semantic(RoleTarget target, GarmentRecord garment) {
        float[] targetEmbedding = target.embedding();
        float[] garmentEmbedding = garment.embedding();
        if (targetEmbedding.length > 0 && targetEmbedding.length == garmentEmbedding.length) {
            return ScoringUtils.normalizedCosine(garmentEmbedding, targetEmbedding);
        }
        return ScoringUtils.weightedJaccard(garment.features(), target.features());
    }

    static double styleConsistency(GarmentRecord garment, StyleProfile profile) {
        if (profile == null || profile.primaryStyle() == null) {
            return NEUTRAL_STYLE;
        }
        double primary = StyleAffinity.score(garment.features(), profile.primaryStyle());
        if (profile.hybrid() && profile.secondaryStyle() != null) {
            double secondary = StyleAffinity.score(garment.features(), profile.secondaryStyle());
            return ScoringUtils.clamp01((primary + SECONDARY_STYLE_WEIGHT * secondary) / (1.0 + SECONDARY_STYLE_WEIGHT));
        }
        return ScoringUtils.clamp01(primary);
    }

    static double colorHarmony(RoleTarget target, GarmentRecord garment, ColorPalette palette) {
        String color = colorOf(garment);
        if (ColorHarmony.canonical(color) == null) {
            return ColorHarmony.UNKNOWN;
        }
        boolean hasTarget = target.color() != null;
        boolean hasPalette = !palette.isEmpty();
        if (hasTarget && hasPalette) {
            return TARGET_COLOR_SHARE * ColorHarmony.pair(color, target.color())
                    + (1 - TARGET_COLOR_SHARE) * ColorHarmony.withPalette(color, palette);
        }
        if (hasTarget) {
            return ColorHarmony.pair(color, target.color());
        }
        if (hasPalette) {
            return ColorHarmony.withPalette(color, palette);
        }
        return ColorHarmony.UNKNOWN;
    }

    /**
     * Stored color, else the strongest {@code color:*} feature (ties by name), else null.
     */
    static String colorOf(GarmentRecord garment) {
        if (garment.color() != null && !garment.color().isBlank()) {
            return garment.color();
        }
        String best = null;
        double bestScore = -1;
        for (Map.Entry<String, Double> entry : garment.features().entrySet()) {
            if (!FeatureNames.COLOR.equals(FeatureNames.namespace(entry.getKey()))) {
                continue;
            }
            String value = FeatureNames.value(entry.getKey());
            if (entry.getValue() > bestScore || (entry.getValue() == bestScore && value.compareTo(best) < 0)) {
                best = value;
                bestScore = entry.getValue();
            }
        }
        return best;
    }

    private record Candidate(int index, GarmentRecord garment, ScoreBreakdown breakdown) {
    }
}
