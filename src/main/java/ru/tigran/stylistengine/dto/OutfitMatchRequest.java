package ru.tigran.stylistengine.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;
import java.util.Map;

/**
 * Request DTO для подбора образа по готовому описанию.
 * Ключи: top, outerwear, bottom, shoes, accessories.
 */
public record OutfitMatchRequest(
        @NotEmpty(message = "Нужно указать хотя бы одну роль")
        Map<String, List<@Valid RoleTargetRequest>> roles
) {
}
