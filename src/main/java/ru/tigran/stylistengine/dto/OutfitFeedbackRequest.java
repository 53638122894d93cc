package ru.tigran.stylistengine.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Оценка подобранного образа.
 * Example: { "rating": 4, "comments": "обувь не та", "favorite": true }
 *
 * @param favorite null оставляет отметку избранного как есть
 */
public record OutfitFeedbackRequest(
        @NotNull(message = "Оценка обязательна")
        @Min(value = 1, message = "Оценка от 1 до 5")
        @Max(value = 5, message = "Оценка от 1 до 5")
        Integer rating,

        @Size(max = 2000, message = "Комментарий не должен превышать 2000 символов")
        String comments,

        Boolean favorite
) {
}
