package ru.tigran.stylistengine.matching;

/**
 * Outcome for one target. {@code garment} and {@code breakdown} are null when nothing matched.
 */
public record RoleMatch(
        OutfitRole role,
        RoleTarget target,
        GarmentRecord garment,
        ScoreBreakdown breakdown
) {
    public static RoleMatch unmatched(OutfitRole role, RoleTarget target) {
        return new RoleMatch(role, target, null, null);
    }

    public boolean isMatched() {
        return garment != null;
    }
}
