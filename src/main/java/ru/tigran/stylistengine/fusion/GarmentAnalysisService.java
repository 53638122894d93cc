package ru.tigran.stylistengine.fusion;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.tigran.stylistengine.dto.ClothingItemResponse;
import ru.tigran.stylistengine.exception.ResourceNotFoundException;
import ru.tigran.stylistengine.exception.ValidationException;
import ru.tigran.stylistengine.feature.FeatureExtractionService;
import ru.tigran.stylistengine.feature.FeatureNames;
import ru.tigran.stylistengine.model.ClothingItem;
import ru.tigran.stylistengine.repository.ClothingItemRepository;
import ru.tigran.stylistengine.util.CacheKeyUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Анализ изображения вещи: hash -> (кэш | извлечение признаков + fusion) -> сохранение на ClothingItem.
 *
 * Транзакция не держится во время обращения к внешним источникам: вещь читается,
 * затем идут сетевые вызовы, затем результат сохраняется отдельным save().
 */
@Slf4j
@Service
public class GarmentAnalysisService {

    private final ClothingItemRepository clothingItemRepository;
    private final FeatureExtractionService featureExtractionService;
    private final FusionEngine fusionEngine;

    public GarmentAnalysisService(
            ClothingItemRepository clothingItemRepository,
            FeatureExtractionService featureExtractionService,
            FusionEngine fusionEngine
    ) {
        this.clothingItemRepository = clothingItemRepository;
        this.featureExtractionService = featureExtractionService;
        this.fusionEngine = fusionEngine;
    }

    /**
     * @throws ru.tigran.stylistengine.exception.FeatureExtractionUnavailableException если все источники недоступны
     */
    public ClothingItemResponse analyze(Long userId, Long itemId, byte[] image) {
        if (image == null || image.length == 0) {
            throw ValidationException.emptyImage();
        }

        ClothingItem item = clothingItemRepository.findByUserIdAndId(userId, itemId)
                .orElseThrow(() -> ResourceNotFoundException.clothingItem(itemId));

        String imageHash = CacheKeyUtils.imageHash(image);
        log.info("Analyzing image {} for item {} of user {}", imageHash, itemId, userId);

        ConsensusFeatureSet consensus = fusionEngine.fuse(imageHash,
                () -> featureExtractionService.extract(imageHash, image));

        String previousHash = item.getImageHash();
        if (previousHash != null && !previousHash.equals(imageHash)) {
            // картинку заменили: старая запись кэша больше не соответствует вещи
            fusionEngine.invalidate(previousHash);
        }

        apply(item, imageHash, consensus);
        ClothingItem saved = clothingItemRepository.save(item);
        log.info("Item {} analyzed: {} features, color={}, category={}",
                saved.getId(), consensus.features().size(), saved.getColor(), saved.getCategory());
        return ClothingItemResponse.from(saved);
    }

    /**
     * Переносит consensus на вещь. Значения пользователя не трогаются; пустые category/color/brand
     * заполняются из анализа и помечаются как выведенные, чтобы следующий анализ их сбросил.
     */
    static void apply(ClothingItem item, String imageHash, ConsensusFeatureSet consensus) {
        item.setImageHash(imageHash);
        item.setFeatures(consensus.features());
        item.setProvenance(consensus.provenance());

        float[] embedding = consensus.embedding();
        List<Float> values = new ArrayList<>(embedding.length);
        for (float value : embedding) {
            values.add(value);
        }
        item.setEmbedding(values);

        Set<String> derived = item.getDerivedAttributes() == null
                ? new HashSet<>()
                : new HashSet<>(item.getDerivedAttributes());

        // значения от прошлого изображения к новому не относятся
        if (derived.remove(FeatureNames.CATEGORY)) {
            item.setCategory(null);
        }
        if (derived.remove(FeatureNames.COLOR)) {
            item.setColor(null);
        }
        if (derived.remove(FeatureNames.BRAND)) {
            item.setBrand(null);
        }

        fillIfBlank(item.getCategory(), FeatureNames.CATEGORY, consensus, item::setCategory, derived);
        fillIfBlank(item.getColor(), FeatureNames.COLOR, consensus, item::setColor, derived);
        fillIfBlank(item.getBrand(), FeatureNames.BRAND, consensus, item::setBrand, derived);
        item.setDerivedAttributes(derived);
        item.setAnalyzedAt(LocalDateTime.now());
    }

    private static void fillIfBlank(String current, String namespace, ConsensusFeatureSet consensus,
                                    Consumer<String> setter, Set<String> derived) {
        if (current != null && !current.isBlank()) {
            return;
        }
        consensus.dominant(namespace).ifPresent(value -> {
            setter.accept(value);
            derived.add(namespace);
        });
    }
}
