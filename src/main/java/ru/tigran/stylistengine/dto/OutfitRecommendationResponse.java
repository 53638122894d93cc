package ru.tigran.stylistengine.dto;

import ru.tigran.stylistengine.matching.OutfitRequestSpec;

/**
 * @param id     id сохраненной рекомендации
 * @param outfit the generated outfit description the closet was matched against
 * @param model  generator model id
 */
public record OutfitRecommendationResponse(
        Long id,
        OutfitRequestSpec outfit,
        OutfitMatchResponse match,
        String primaryStyle,
        String model
) {
}
