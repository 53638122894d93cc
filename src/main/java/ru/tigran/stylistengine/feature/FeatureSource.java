package ru.tigran.stylistengine.feature;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Independent image-analysis signals fused into one consensus feature set.
 */
public enum FeatureSource {
    FASHION_MODEL("fashion-model", "fashionModel"),
    VISION_MODEL("vision-model", "visionModel"),
    COLOR_HEURISTIC("color-heuristic", "colorHeuristic");

    private final String value;
    private final String circuitBreakerName;

    FeatureSource(String value, String circuitBreakerName) {
        this.value = value;
        this.circuitBreakerName = circuitBreakerName;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getCircuitBreakerName() {
        return circuitBreakerName;
    }
}
