package ru.tigran.stylistengine.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.tigran.stylistengine.quiz.StyleProfile;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OutfitPromptBuilder unit тесты")
class OutfitPromptBuilderTest {

    @Test
    @DisplayName("buildUserPrompt - контекст профиля, погоды и повода")
    void userPromptWithContext() {
        StyleProfile profile = new StyleProfile(Map.of("Classic", 2.0, "Edgy", 2.0),
                "Classic", "Edgy", 0.4, true, "Classic with a hint of Edgy");

        String prompt = OutfitPromptBuilder.buildUserPrompt("  Brunch \n with   friends ", "female", profile,
                "cool, light rain", "weekend");

        assertTrue(prompt.contains("\"Brunch with friends\""));
        assertTrue(prompt.contains("- Gender: female"));
        assertTrue(prompt.contains("- Personal style: Classic mixed with Edgy"));
        assertTrue(prompt.contains("- Weather: cool, light rain"));
        assertTrue(prompt.contains("- Occasion: weekend"));
    }

    @Test
    @DisplayName("buildUserPrompt - без контекста секция не выводится")
    void userPromptWithoutContext() {
        String prompt = OutfitPromptBuilder.buildUserPrompt("office day", null, null, " ", null);

        assertFalse(prompt.contains("CONTEXT"));
        assertTrue(prompt.contains("\"office day\""));
    }

    @Test
    @DisplayName("sanitize - кавычки экранируются, длина ограничена")
    void sanitize() {
        assertEquals("say \\\"hi\\\"", OutfitPromptBuilder.sanitize("say \"hi\""));
        assertEquals(OutfitPromptBuilder.MAX_PROMPT_LENGTH,
                OutfitPromptBuilder.sanitize("a".repeat(5000)).length());
    }

    @Test
    @DisplayName("buildSystemPrompt - описывает все роли")
    void systemPrompt() {
        String system = OutfitPromptBuilder.buildSystemPrompt();

        for (String role : new String[]{"\"top\"", "\"bottom\"", "\"shoes\"", "\"outerwear\"", "\"accessories\""}) {
            assertTrue(system.contains(role), role);
        }
    }
}
