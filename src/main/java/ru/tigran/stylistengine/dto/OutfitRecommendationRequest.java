package ru.tigran.stylistengine.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO для генерации образа по свободному описанию.
 * Example: { "prompt": "brunch with friends", "gender": "female", "weather": "cool", "occasion": "weekend" }
 */
public record OutfitRecommendationRequest(
        @NotBlank(message = "Описание не может быть пустым")
        @Size(max = 1000, message = "Описание не должно превышать 1000 символов")
        String prompt,

        @Size(max = 20, message = "Пол не должен превышать 20 символов")
        String gender,

        @Size(max = 100, message = "Погода не должна превышать 100 символов")
        String weather,

        @Size(max = 100, message = "Повод не должен превышать 100 символов")
        String occasion
) {
}
