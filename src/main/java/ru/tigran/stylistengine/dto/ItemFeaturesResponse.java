package ru.tigran.stylistengine.dto;

import ru.tigran.stylistengine.feature.FeatureSource;
import ru.tigran.stylistengine.model.ClothingItem;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Set;

/**
 * Сохраненный consensus вещи. analyzed = false, если изображение еще не загружали.
 */
public record ItemFeaturesResponse(
        Long itemId,
        String imageHash,
        boolean analyzed,
        Map<String, Double> features,
        Map<String, Set<FeatureSource>> provenance,
        int embeddingDimensions,
        LocalDateTime analyzedAt
) {
    public static ItemFeaturesResponse from(ClothingItem item) {
        return new ItemFeaturesResponse(
                item.getId(),
                item.getImageHash(),
                item.getAnalyzedAt() != null,
                item.getFeatures() == null ? Map.of() : item.getFeatures(),
                item.getProvenance() == null ? Map.of() : item.getProvenance(),
                item.getEmbedding() == null ? 0 : item.getEmbedding().size(),
                item.getAnalyzedAt()
        );
    }
}
