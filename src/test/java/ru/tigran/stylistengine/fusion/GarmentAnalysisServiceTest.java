package ru.tigran.stylistengine.fusion;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ru.tigran.stylistengine.dto.ClothingItemResponse;
import ru.tigran.stylistengine.exception.ErrorCode;
import ru.tigran.stylistengine.exception.ResourceNotFoundException;
import ru.tigran.stylistengine.exception.ValidationException;
import ru.tigran.stylistengine.feature.FeatureBag;
import ru.tigran.stylistengine.feature.FeatureExtractionService;
import ru.tigran.stylistengine.feature.FeatureSource;
import ru.tigran.stylistengine.model.ClothingItem;
import ru.tigran.stylistengine.repository.ClothingItemRepository;
import ru.tigran.stylistengine.util.CacheKeyUtils;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit-тесты для GarmentAnalysisService.
 * FusionEngine настоящий, с in-memory кешем; источники признаков замоканы.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("GarmentAnalysisService unit тесты")
class GarmentAnalysisServiceTest {

    private static final Long USER_ID = 1L;
    private static final Long ITEM_ID = 10L;
    private static final byte[] IMAGE = {9, 8, 7, 6};

    @Mock
    private ClothingItemRepository clothingItemRepository;

    @Mock
    private FeatureExtractionService featureExtractionService;

    private InMemoryConsensusCache cache;
    private GarmentAnalysisService service;

    @BeforeEach
    void setUp() {
        cache = new InMemoryConsensusCache();
        FusionEngine fusionEngine = new FusionEngine(cache, new FusionProperties(), new SimpleMeterRegistry());
        service = new GarmentAnalysisService(clothingItemRepository, featureExtractionService, fusionEngine);
    }

    private ClothingItem item() {
        ClothingItem item = new ClothingItem();
        item.setId(ITEM_ID);
        item.setUserId(USER_ID);
        item.setName("Oxford shirt");
        return item;
    }

    private static List<FeatureBag> bags() {
        return List.of(
                new FeatureBag(FeatureSource.FASHION_MODEL,
                        Map.of("category:shirt", 0.9, "style:classic", 0.8), new float[]{0.5f, 0.5f}),
                new FeatureBag(FeatureSource.COLOR_HEURISTIC,
                        Map.of("color:white", 0.7, "brand:ralph-lauren", 0.8)));
    }

    @Test
    @DisplayName("analyze - consensus сохраняется на вещи, цвет/бренд/категория заполняются")
    void analyzeStoresConsensus() {
        when(clothingItemRepository.findByUserIdAndId(USER_ID, ITEM_ID)).thenReturn(Optional.of(item()));
        when(featureExtractionService.extract(anyString(), eq(IMAGE))).thenReturn(bags());
        when(clothingItemRepository.save(any(ClothingItem.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ClothingItemResponse response = service.analyze(USER_ID, ITEM_ID, IMAGE);

        assertEquals(CacheKeyUtils.imageHash(IMAGE), response.imageHash());
        assertEquals("shirt", response.category());
        assertEquals("white", response.color());
        assertEquals("ralph-lauren", response.brand());
        assertEquals(Set.of(FeatureSource.FASHION_MODEL), response.provenance().get("style:classic"));
        assertNotNull(response.analyzedAt());
        verify(clothingItemRepository).save(argThat(saved -> saved.getEmbedding().size() == 2));
    }

    @Test
    @DisplayName("analyze - то же изображение второй раз не идет в источники")
    void sameImageUsesCache() {
        when(clothingItemRepository.findByUserIdAndId(USER_ID, ITEM_ID)).thenReturn(Optional.of(item()));
        when(featureExtractionService.extract(anyString(), eq(IMAGE))).thenReturn(bags());
        when(clothingItemRepository.save(any(ClothingItem.class))).thenAnswer(invocation -> invocation.getArgument(0));

        service.analyze(USER_ID, ITEM_ID, IMAGE);
        service.analyze(USER_ID, ITEM_ID, IMAGE);

        verify(featureExtractionService, times(1)).extract(anyString(), any());
        assertEquals(1, cache.size());
    }

    @Test
    @DisplayName("analyze - заданная пользователем категория не перезаписывается")
    void userCategoryIsKept() {
        ClothingItem item = item();
        item.setCategory("blouse");
        when(clothingItemRepository.findByUserIdAndId(USER_ID, ITEM_ID)).thenReturn(Optional.of(item));
        when(featureExtractionService.extract(anyString(), eq(IMAGE))).thenReturn(bags());
        when(clothingItemRepository.save(any(ClothingItem.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ClothingItemResponse response = service.analyze(USER_ID, ITEM_ID, IMAGE);

        assertEquals("blouse", response.category());
    }

    @Test
    @DisplayName("analyze - замена фото инвалидирует старую запись кеша")
    void replacedImageInvalidatesOldEntry() {
        ClothingItem item = item();
        byte[] oldImage = {1, 1, 1};
        String oldHash = CacheKeyUtils.imageHash(oldImage);
        item.setImageHash(oldHash);
        cache.put(oldHash, ConsensusFeatureSet.empty());
        when(clothingItemRepository.findByUserIdAndId(USER_ID, ITEM_ID)).thenReturn(Optional.of(item));
        when(featureExtractionService.extract(anyString(), eq(IMAGE))).thenReturn(bags());
        when(clothingItemRepository.save(any(ClothingItem.class))).thenAnswer(invocation -> invocation.getArgument(0));

        service.analyze(USER_ID, ITEM_ID, IMAGE);

        assertTrue(cache.get(oldHash).isEmpty());
        assertTrue(cache.get(CacheKeyUtils.imageHash(IMAGE)).isPresent());
    }

    @Test
    @DisplayName("analyze - чужая или несуществующая вещь")
    void itemNotFound() {
        when(clothingItemRepository.findByUserIdAndId(USER_ID, ITEM_ID)).thenReturn(Optional.empty());

        ResourceNotFoundException exception = assertThrows(ResourceNotFoundException.class,
                () -> service.analyze(USER_ID, ITEM_ID, IMAGE));

        assertEquals(ErrorCode.CLOTHING_ITEM_NOT_FOUND.getCode(), exception.getErrorCode());
        verifyNoInteractions(featureExtractionService);
    }

    @Test
    @DisplayName("analyze - пустое изображение")
    void emptyImage() {
        ValidationException exception = assertThrows(ValidationException.class,
                () -> service.analyze(USER_ID, ITEM_ID, new byte[0]));

        assertEquals(ErrorCode.EMPTY_IMAGE.getCode(), exception.getErrorCode());
        verifyNoInteractions(clothingItemRepository);
    }

    @Test
    @DisplayName("apply - новое фото сбрасывает цвет и бренд, выведенные из старого")
    void replacedImageDropsStaleDerivedAttributes() {
        ClothingItem item = item();

        GarmentAnalysisService.apply(item, "h1", new ConsensusFeatureSet(
                Map.of("color:red", 0.9, "brand:nike", 0.8, "category:sneakers", 0.7), Map.of(), null));
        assertEquals("red", item.getColor());
        assertEquals("nike", item.getBrand());
        assertEquals(Set.of("color", "brand", "category"), item.getDerivedAttributes());

        GarmentAnalysisService.apply(item, "h2", new ConsensusFeatureSet(
                Map.of("style:casual", 0.6), Map.of(), null));

        assertNull(item.getColor());
        assertNull(item.getBrand());
        assertNull(item.getCategory());
        assertTrue(item.getDerivedAttributes().isEmpty());
        assertEquals("h2", item.getImageHash());
        assertEquals(Map.of("style:casual", 0.6), item.getFeatures());
    }

    @Test
    @DisplayName("apply - значения пользователя переживают повторный анализ")
    void userAttributesSurviveReanalysis() {
        ClothingItem item = item();
        item.setColor("navy");

        GarmentAnalysisService.apply(item, "h1", new ConsensusFeatureSet(
                Map.of("color:red", 0.9, "brand:nike", 0.8), Map.of(), null));
        GarmentAnalysisService.apply(item, "h2", new ConsensusFeatureSet(
                Map.of("brand:adidas", 0.7), Map.of(), null));

        assertEquals("navy", item.getColor());
        assertEquals("adidas", item.getBrand());
        assertEquals(Set.of("brand"), item.getDerivedAttributes());
    }
}
