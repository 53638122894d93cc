package ru.tigran.stylistengine.dto;

import ru.tigran.stylistengine.matching.OutfitMatchResult;
import ru.tigran.stylistengine.matching.OutfitRole;
import ru.tigran.stylistengine.model.OutfitRecommendation;

import java.util.List;

/**
 * @param recommendationId id сохраненного подбора, по нему отправляется оценка
 */
public record OutfitMatchResponse(
        Long recommendationId,
        List<RoleMatchResponse> matches,
        double overallQuality,
        List<OutfitRole> missingRoles,
        boolean complete
) {
    public static OutfitMatchResponse from(Long recommendationId, OutfitMatchResult result) {
        return new OutfitMatchResponse(
                recommendationId,
                result.matches().stream().map(RoleMatchResponse::from).toList(),
                result.overallQuality(),
                result.missingRoles(),
                result.isComplete()
        );
    }

    public static OutfitMatchResponse from(OutfitRecommendation saved) {
        return new OutfitMatchResponse(
                saved.getId(),
                saved.getMatches() == null ? List.of() : saved.getMatches(),
                saved.getOverallQuality() == null ? 0.0 : saved.getOverallQuality(),
                saved.getMissingRoles() == null ? List.of() : saved.getMissingRoles(),
                Boolean.TRUE.equals(saved.getComplete())
        );
    }
}
