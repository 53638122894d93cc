package ru.tigran.stylistengine.dto;

import ru.tigran.stylistengine.feature.FeatureSource;
import ru.tigran.stylistengine.model.ClothingItem;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Set;

/**
 * Вещь из гардероба вместе с сохраненным результатом анализа (features пустые, если анализа не было).
 */
public record ClothingItemResponse(
        Long id,
        String name,
        String category,
        String color,
        String brand,
        String imageHash,
        Map<String, Double> features,
        Map<String, Set<FeatureSource>> provenance,
        LocalDateTime analyzedAt
) {
    public static ClothingItemResponse from(ClothingItem item) {
        return new ClothingItemResponse(
                item.getId(),
                item.getName(),
                item.getCategory(),
                item.getColor(),
                item.getBrand(),
                item.getImageHash(),
                item.getFeatures() == null ? Map.of() : item.getFeatures(),
                item.getProvenance() == null ? Map.of() : item.getProvenance(),
                item.getAnalyzedAt()
        );
    }
}
