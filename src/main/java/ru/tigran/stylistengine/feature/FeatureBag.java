package ru.tigran.stylistengine.feature;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One source's raw output for one image: namespaced feature names with confidences.
 *
 * Names are normalized, confidences clamped to [0,1] and NaN values dropped on
 * construction, so a bag is always well-formed once built. Immutable.
 *
 * @param source    which signal produced the bag
 * @param features  feature name -> confidence in [0,1]
 * @param embedding optional semantic vector (only the fashion model supplies one), never null
 */
public record FeatureBag(
        FeatureSource source,
        Map<String, Double> features,
        float[] embedding
) {
    public FeatureBag {
        if (source == null) {
            throw new IllegalArgumentException("FeatureBag source must not be null");
        }
        Map<String, Double> cleaned = new LinkedHashMap<>();
        if (features != null) {
            features.forEach((name, confidence) -> {
                if (name == null || confidence == null || confidence.isNaN()) {
                    return;
                }
                String normalized = FeatureNames.normalize(name);
                if (normalized.isEmpty()) {
                    return;
                }
                double clamped = Math.max(0.0, Math.min(1.0, confidence));
                cleaned.merge(normalized, clamped, Math::max);
            });
        }
        features = Collections.unmodifiableMap(cleaned);
        embedding = embedding == null ? new float[0] : embedding.clone();
    }

    public FeatureBag(FeatureSource source, Map<String, Double> features) {
        this(source, features, null);
    }

    @Override
    public float[] embedding() {
        return embedding.clone();
    }

    public boolean hasEmbedding() {
        return embedding.length > 0;
    }

    public boolean isEmpty() {
        return features.isEmpty();
    }
}
