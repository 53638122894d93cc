package ru.tigran.stylistengine.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.tigran.stylistengine.exception.AIGatewayException;
import ru.tigran.stylistengine.exception.ErrorCode;
import ru.tigran.stylistengine.matching.OutfitRequestSpec;
import ru.tigran.stylistengine.matching.OutfitRole;
import ru.tigran.stylistengine.matching.RoleTarget;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OutfitSpecParser unit тесты")
class OutfitSpecParserTest {

    private final OutfitSpecParser parser = new OutfitSpecParser(new ObjectMapper());

    @Test
    @DisplayName("parse - роли, тип как category-признак, слова получают namespace")
    void parsesOutfit() {
        OutfitRequestSpec spec = parser.parse("""
                {
                  "top": {"type": "Oxford Shirt", "features": ["cotton", "classic", "button down"], "color": "white"},
                  "bottom": {"type": "chinos", "features": ["slim"], "color": "beige"},
                  "shoes": {"type": "loafers", "features": ["leather", "material:suede"], "color": "brown"},
                  "accessories": [
                    {"type": "watch", "features": ["silver"], "color": "silver"},
                    {"type": "belt", "features": [], "color": "brown"}
                  ]
                }
                """);

        RoleTarget top = spec.targetsFor(OutfitRole.TOP).get(0);
        assertEquals("Oxford Shirt", top.type());
        assertEquals("white", top.color());
        assertEquals(Map.of(
                "category:oxford-shirt", 1.0,
                "color:white", 1.0,
                "material:cotton", 1.0,
                "style:classic", 1.0,
                "detail:button-down", 1.0), top.features());

        assertEquals(1.0, spec.targetsFor(OutfitRole.SHOES).get(0).features().get("material:suede"));
        assertEquals(2, spec.targetsFor(OutfitRole.ACCESSORIES).size());
        assertTrue(spec.targetsFor(OutfitRole.OUTERWEAR).isEmpty());
    }

    @Test
    @DisplayName("parse - одиночный аксессуар объектом и ключ accessory")
    void singleAccessoryObject() {
        OutfitRequestSpec spec = parser.parse("""
                {"top": {"type": "tee"}, "accessory": {"type": "cap", "color": "black"}}
                """);

        assertEquals(1, spec.targetsFor(OutfitRole.ACCESSORIES).size());
        assertEquals("cap", spec.targetsFor(OutfitRole.ACCESSORIES).get(0).type());
    }

    @Test
    @DisplayName("parse - невалидный JSON")
    void invalidJson() {
        AIGatewayException exception = assertThrows(AIGatewayException.class, () -> parser.parse("{not json"));

        assertEquals(ErrorCode.INVALID_JSON_RESPONSE.getCode(), exception.getErrorCode());
    }

    @Test
    @DisplayName("parse - ни одной вещи")
    void noGarments() {
        AIGatewayException exception = assertThrows(AIGatewayException.class,
                () -> parser.parse("{\"comment\": \"nothing to wear\"}"));

        assertEquals(ErrorCode.INVALID_AI_RESPONSE.getCode(), exception.getErrorCode());
    }

    @Test
    @DisplayName("namespaced - словарь цветов, тканей и стилей")
    void namespacedWords() {
        assertEquals("color:navy", OutfitSpecParser.namespaced("Navy"));
        assertEquals("material:denim", OutfitSpecParser.namespaced("denim"));
        assertEquals("style:minimalist", OutfitSpecParser.namespaced("minimalist"));
        assertEquals("detail:high-waisted", OutfitSpecParser.namespaced("high waisted"));
        assertEquals("occasion:office", OutfitSpecParser.namespaced("occasion:office"));
    }
}
