package ru.tigran.stylistengine.matching;

import java.util.Map;

/**
 * Read-only view of a closet item for matching.
 *
 * @param features consensus features of the item image, empty when never analyzed
 * @param color    dominant color name, may be null
 */
public record GarmentRecord(
        Long id,
        String category,
        Map<String, Double> features,
        float[] embedding,
        String color,
        String brand
) {
    public GarmentRecord {
        features = features == null ? Map.of() : Map.copyOf(features);
        embedding = embedding == null ? new float[0] : embedding.clone();
    }

    @Override
    public float[] embedding() {
        return embedding.clone();
    }

    public boolean hasEmbedding() {
        return embedding.length > 0;
    }
}
