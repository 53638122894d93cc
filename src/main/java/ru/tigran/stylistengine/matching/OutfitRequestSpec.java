package ru.tigran.stylistengine.matching;

import ru.tigran.stylistengine.exception.ErrorCode;
import ru.tigran.stylistengine.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Structured outfit target: role -> targets. Single-slot roles hold at most one target,
 * {@link OutfitRole#ACCESSORIES} may hold several.
 */
public record OutfitRequestSpec(Map<OutfitRole, List<RoleTarget>> targets) {

    public OutfitRequestSpec {
        EnumMap<OutfitRole, List<RoleTarget>> copy = new EnumMap<>(OutfitRole.class);
        if (targets != null) {
            targets.forEach((role, list) -> {
                if (role == null || list == null || list.isEmpty()) {
                    return;
                }
                if (!role.isMultiple() && list.size() > 1) {
                    throw new ValidationException(
                            "Role " + role.getValue() + " accepts at most one target, got " + list.size(),
                            ErrorCode.VALIDATION_ERROR.getCode());
                }
                copy.put(role, List.copyOf(list));
            });
        }
        targets = Collections.unmodifiableMap(copy);
    }

    public List<RoleTarget> targetsFor(OutfitRole role) {
        return targets.getOrDefault(role, List.of());
    }

    public boolean isEmpty() {
        return targets.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final EnumMap<OutfitRole, List<RoleTarget>> targets = new EnumMap<>(OutfitRole.class);

        private Builder() {
        }

        public Builder role(OutfitRole role, RoleTarget target) {
            targets.computeIfAbsent(role, r -> new ArrayList<>()).add(target);
            return this;
        }

        public OutfitRequestSpec build() {
            return new OutfitRequestSpec(targets);
        }
    }
}
