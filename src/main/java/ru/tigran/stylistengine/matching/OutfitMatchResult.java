package ru.tigran.stylistengine.matching;

import java.util.List;

/**
 * @param matches        one entry per requested target, in scoring order
 * @param overallQuality mean overall score over matched targets, 0 when nothing matched
 * @param missingRoles   roles that had targets but got no garment; each role listed once
 */
public record OutfitMatchResult(
        List<RoleMatch> matches,
        double overallQuality,
        List<OutfitRole> missingRoles
) {
    public OutfitMatchResult {
        matches = List.copyOf(matches);
        missingRoles = List.copyOf(missingRoles);
    }

    public boolean isComplete() {
        return missingRoles.isEmpty();
    }
}
