package ru.tigran.stylistengine.dto;

import ru.tigran.stylistengine.model.OutfitRecommendation;

import java.time.LocalDateTime;

/**
 * Запись истории подборов. prompt и model пустые для подбора по готовому описанию.
 */
public record SavedOutfitResponse(
        Long id,
        String prompt,
        String occasion,
        String weather,
        String model,
        String primaryStyle,
        OutfitMatchResponse match,
        Integer feedbackScore,
        String feedbackComments,
        boolean favorite,
        LocalDateTime createdAt
) {
    public static SavedOutfitResponse from(OutfitRecommendation saved) {
        return new SavedOutfitResponse(
                saved.getId(),
                saved.getPrompt(),
                saved.getOccasion(),
                saved.getWeather(),
                saved.getAiModel(),
                saved.getPrimaryStyle(),
                OutfitMatchResponse.from(saved),
                saved.getFeedbackScore(),
                saved.getFeedbackComments(),
                Boolean.TRUE.equals(saved.getFavorite()),
                saved.getCreatedAt()
        );
    }
}
