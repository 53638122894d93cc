package ru.tigran.stylistengine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.tigran.stylistengine.dto.ClothingItemRequest;
import ru.tigran.stylistengine.dto.ClothingItemResponse;
import ru.tigran.stylistengine.dto.ItemFeaturesResponse;
import ru.tigran.stylistengine.exception.ResourceNotFoundException;
import ru.tigran.stylistengine.feature.FeatureNames;
import ru.tigran.stylistengine.matching.GarmentRecord;
import ru.tigran.stylistengine.model.ClothingItem;
import ru.tigran.stylistengine.repository.ClothingItemRepository;

import java.util.List;

/**
 * Сервис гардероба: CRUD вещей и выдача инвентаря для подбора образа.
 */
@Slf4j
@Service
public class ClosetService {

    private final ClothingItemRepository clothingItemRepository;

    public ClosetService(ClothingItemRepository clothingItemRepository) {
        this.clothingItemRepository = clothingItemRepository;
    }

    @Transactional
    public ClothingItemResponse createItem(Long userId, ClothingItemRequest request) {
        ClothingItem item = new ClothingItem();
        item.setUserId(userId);
        item.setName(request.name().trim());
        item.setCategory(normalizeOrNull(request.category()));
        item.setColor(normalizeOrNull(request.color()));
        item.setBrand(request.brand() == null || request.brand().isBlank() ? null : request.brand().trim());

        ClothingItem saved = clothingItemRepository.save(item);
        log.info("Clothing item {} created for user {}", saved.getId(), userId);
        return ClothingItemResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public ClothingItemResponse getItem(Long userId, Long itemId) {
        return ClothingItemResponse.from(findOwned(userId, itemId));
    }

    @Transactional(readOnly = true)
    public ItemFeaturesResponse getFeatures(Long userId, Long itemId) {
        return ItemFeaturesResponse.from(findOwned(userId, itemId));
    }

    @Transactional(readOnly = true)
    public List<ClothingItemResponse> listItems(Long userId) {
        return clothingItemRepository.findByUserIdOrderByIdAsc(userId).stream()
                .map(ClothingItemResponse::from)
                .toList();
    }

    /**
     * Инвентарь пользователя для OutfitMatcher в порядке добавления.
     */
    @Transactional(readOnly = true)
    public List<GarmentRecord> loadInventory(Long userId) {
        return clothingItemRepository.findByUserIdOrderByIdAsc(userId).stream()
                .map(ClosetService::toGarmentRecord)
                .toList();
    }

    static GarmentRecord toGarmentRecord(ClothingItem item) {
        List<Float> stored = item.getEmbedding();
        float[] embedding = new float[stored == null ? 0 : stored.size()];
        for (int i = 0; i < embedding.length; i++) {
            Float value = stored.get(i);
            embedding[i] = value == null ? 0f : value;
        }
        return new GarmentRecord(
                item.getId(),
                item.getCategory(),
                item.getFeatures(),
                embedding,
                item.getColor(),
                item.getBrand()
        );
    }

    private ClothingItem findOwned(Long userId, Long itemId) {
        return clothingItemRepository.findByUserIdAndId(userId, itemId)
                .orElseThrow(() -> ResourceNotFoundException.clothingItem(itemId));
    }

    private static String normalizeOrNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return FeatureNames.normalize(value);
    }
}
