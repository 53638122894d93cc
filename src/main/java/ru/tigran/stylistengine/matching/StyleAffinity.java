package ru.tigran.stylistengine.matching;

import ru.tigran.stylistengine.feature.FeatureNames;

import java.util.Locale;
import java.util.Map;

/**
 * Links quiz style categories (Bohemian, Classic, ...) to the {@code style:*} vocabulary
 * the image models emit (casual, formal, romantic, ...).
 */
final class StyleAffinity {

    private static final Map<String, Map<String, Double>> AFFINITIES = Map.of(
            "bohemian", Map.of("bohemian", 1.0, "vintage", 0.6, "romantic", 0.6, "casual", 0.4),
            "streetwear", Map.of("streetwear", 1.0, "edgy", 0.6, "sporty", 0.6, "trendy", 0.6, "casual", 0.5),
            "classic", Map.of("classic", 1.0, "preppy", 0.8, "business", 0.8, "formal", 0.7,
                    "professional", 0.7, "elegant", 0.6, "minimalist", 0.5),
            "feminine", Map.of("feminine", 1.0, "romantic", 0.9, "elegant", 0.7, "bohemian", 0.4),
            "edgy", Map.of("edgy", 1.0, "streetwear", 0.6, "modern", 0.5, "vintage", 0.3),
            "athleisure", Map.of("athleisure", 1.0, "sporty", 0.9, "casual", 0.6, "streetwear", 0.5),
            "vintage", Map.of("vintage", 1.0, "bohemian", 0.5, "preppy", 0.4, "romantic", 0.4),
            "glamorous", Map.of("glamorous", 1.0, "elegant", 0.8, "formal", 0.6, "trendy", 0.6),
            "eclectic", Map.of("eclectic", 1.0, "bohemian", 0.6, "vintage", 0.5, "trendy", 0.5, "streetwear", 0.4),
            "minimalist", Map.of("minimalist", 1.0, "modern", 0.7, "classic", 0.6, "professional", 0.5)
    );

    private StyleAffinity() {
    }

    /**
     * How strongly a garment expresses a quiz style category, in [0,1]:
     * max over related style features of (feature confidence x affinity).
     * Categories without a table entry only match their own name.
     */
    static double score(Map<String, Double> garmentFeatures, String styleCategory) {
        if (styleCategory == null || styleCategory.isBlank()) {
            return 0.0;
        }
        String key = FeatureNames.normalize(styleCategory).toLowerCase(Locale.ROOT);
        Map<String, Double> related = AFFINITIES.getOrDefault(key, Map.of(key, 1.0));
        double best = 0.0;
        for (Map.Entry<String, Double> entry : related.entrySet()) {
            Double confidence = garmentFeatures.get(FeatureNames.of(FeatureNames.STYLE, entry.getKey()));
            if (confidence != null) {
                best = Math.max(best, confidence * entry.getValue());
            }
        }
        return Math.min(1.0, best);
    }
}
