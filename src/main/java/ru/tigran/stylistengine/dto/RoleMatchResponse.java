package ru.tigran.stylistengine.dto;

import ru.tigran.stylistengine.matching.OutfitRole;
import ru.tigran.stylistengine.matching.RoleMatch;
import ru.tigran.stylistengine.matching.ScoreBreakdown;

public record RoleMatchResponse(
        OutfitRole role,
        String targetType,
        Long itemId,
        String itemCategory,
        String itemColor,
        ScoreBreakdown scores
) {
    public static RoleMatchResponse from(RoleMatch match) {
        return new RoleMatchResponse(
                match.role(),
                match.target().type(),
                match.isMatched() ? match.garment().id() : null,
                match.isMatched() ? match.garment().category() : null,
                match.isMatched() ? match.garment().color() : null,
                match.breakdown()
        );
    }
}
