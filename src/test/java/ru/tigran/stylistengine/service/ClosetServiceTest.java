package ru.tigran.stylistengine.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ru.tigran.stylistengine.dto.ClothingItemRequest;
import ru.tigran.stylistengine.dto.ClothingItemResponse;
import ru.tigran.stylistengine.dto.ItemFeaturesResponse;
import ru.tigran.stylistengine.exception.ResourceNotFoundException;
import ru.tigran.stylistengine.matching.GarmentRecord;
import ru.tigran.stylistengine.model.ClothingItem;
import ru.tigran.stylistengine.repository.ClothingItemRepository;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ClosetService unit тесты")
class ClosetServiceTest {

    private static final Long USER_ID = 3L;

    @Mock
    private ClothingItemRepository clothingItemRepository;

    private ClosetService closetService;

    @BeforeEach
    void setUp() {
        closetService = new ClosetService(clothingItemRepository);
    }

    @Test
    @DisplayName("createItem - категория и цвет нормализуются")
    void createItemNormalizes() {
        when(clothingItemRepository.save(any(ClothingItem.class))).thenAnswer(invocation -> {
            ClothingItem item = invocation.getArgument(0);
            item.setId(11L);
            return item;
        });

        ClothingItemResponse response = closetService.createItem(USER_ID,
                new ClothingItemRequest(" Denim jacket ", "Jacket", "Light Blue", " "));

        assertEquals(11L, response.id());
        assertEquals("Denim jacket", response.name());
        assertEquals("jacket", response.category());
        assertEquals("light-blue", response.color());
        assertNull(response.brand());
        assertTrue(response.features().isEmpty());
    }

    @Test
    @DisplayName("getFeatures - вещь без анализа")
    void featuresOfUnanalyzedItem() {
        ClothingItem item = new ClothingItem();
        item.setId(11L);
        item.setUserId(USER_ID);
        when(clothingItemRepository.findByUserIdAndId(USER_ID, 11L)).thenReturn(Optional.of(item));

        ItemFeaturesResponse response = closetService.getFeatures(USER_ID, 11L);

        assertFalse(response.analyzed());
        assertTrue(response.features().isEmpty());
        assertEquals(0, response.embeddingDimensions());
    }

    @Test
    @DisplayName("getItem - чужая вещь не найдена")
    void getItemNotOwned() {
        when(clothingItemRepository.findByUserIdAndId(USER_ID, 99L)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> closetService.getItem(USER_ID, 99L));
    }

    @Test
    @DisplayName("loadInventory - вещи в порядке добавления с embedding")
    void loadInventory() {
        ClothingItem first = new ClothingItem();
        first.setId(1L);
        first.setCategory("shirt");
        first.setFeatures(Map.of("color:white", 0.8));
        first.setEmbedding(List.of(0.1f, 0.2f));
        ClothingItem second = new ClothingItem();
        second.setId(2L);
        second.setCategory("jeans");
        when(clothingItemRepository.findByUserIdOrderByIdAsc(USER_ID)).thenReturn(List.of(first, second));

        List<GarmentRecord> inventory = closetService.loadInventory(USER_ID);

        assertEquals(List.of(1L, 2L), inventory.stream().map(GarmentRecord::id).toList());
        assertArrayEquals(new float[]{0.1f, 0.2f}, inventory.get(0).embedding());
        assertFalse(inventory.get(1).hasEmbedding());
        assertTrue(inventory.get(1).features().isEmpty());
    }
}
