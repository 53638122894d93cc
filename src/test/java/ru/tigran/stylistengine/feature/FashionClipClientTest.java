package ru.tigran.stylistengine.feature;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FashionClipClient unit тесты")
class FashionClipClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final FashionClipClient client = new FashionClipClient(null, objectMapper, "", 5000);

    @Test
    @DisplayName("toFeatureBag - категория, стили, ткани и детали с уверенностями модели")
    void mapsModelResponse() throws Exception {
        String json = """
                {
                  "category": "shirt",
                  "styles": ["casual", "Business"],
                  "features": ["cotton", "button down"],
                  "confidence_scores": {"category": 0.92, "style": 0.7},
                  "embedding": [0.1, 0.2, 0.3]
                }
                """;

        FeatureBag bag = client.toFeatureBag(objectMapper.readTree(json));

        assertEquals(0.92, bag.features().get("category:shirt"), 1e-9);
        assertEquals(0.7, bag.features().get("style:business"), 1e-9);
        assertEquals(FashionClipClient.DEFAULT_CONFIDENCE, bag.features().get("material:cotton"), 1e-9);
        assertTrue(bag.features().containsKey("detail:button-down"));
        assertEquals(3, bag.embedding().length);
    }

    @Test
    @DisplayName("extract - без URL источник отказывает")
    void notConfigured() {
        assertThrows(FeatureSourceException.class, () -> client.extract(new byte[]{1}));
    }
}
