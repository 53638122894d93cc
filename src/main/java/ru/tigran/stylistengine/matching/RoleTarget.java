package ru.tigran.stylistengine.matching;

import ru.tigran.stylistengine.feature.FeatureNames;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What the outfit description asks for in one slot.
 *
 * @param type      free-text garment type, e.g. "shirt" or "chelsea boots"
 * @param features  target feature name -> confidence
 * @param color     preferred color, may be null
 * @param embedding semantic vector of the description, empty when not available
 */
public record RoleTarget(
        String type,
        Map<String, Double> features,
        String color,
        float[] embedding
) {
    public RoleTarget {
        type = type == null ? "" : type.trim();
        Map<String, Double> cleaned = new LinkedHashMap<>();
        if (features != null) {
            features.forEach((name, confidence) -> {
                if (name != null && confidence != null && !confidence.isNaN()) {
                    cleaned.merge(FeatureNames.normalize(name), Math.max(0.0, Math.min(1.0, confidence)), Math::max);
                }
            });
        }
        features = Collections.unmodifiableMap(cleaned);
        color = color == null || color.isBlank() ? null : FeatureNames.normalize(color);
        embedding = embedding == null ? new float[0] : embedding.clone();
    }

    public RoleTarget(String type, Map<String, Double> features, String color) {
        this(type, features, color, null);
    }

    @Override
    public float[] embedding() {
        return embedding.clone();
    }

    public boolean hasEmbedding() {
        return embedding.length > 0;
    }
}
