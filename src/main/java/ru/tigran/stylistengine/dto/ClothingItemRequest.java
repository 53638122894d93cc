package ru.tigran.stylistengine.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO для добавления вещи в гардероб.
 * category/color/brand опциональны: если не заданы, берутся из анализа изображения.
 */
public record ClothingItemRequest(
        @NotBlank(message = "Название вещи не может быть пустым")
        @Size(max = 150, message = "Название не должно превышать 150 символов")
        String name,

        @Size(max = 50, message = "Категория не должна превышать 50 символов")
        String category,

        @Size(max = 50, message = "Цвет не должен превышать 50 символов")
        String color,

        @Size(max = 100, message = "Бренд не должен превышать 100 символов")
        String brand
) {
}
