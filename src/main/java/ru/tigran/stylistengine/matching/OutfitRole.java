package ru.tigran.stylistengine.matching;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Outfit slots. Declaration order is the scoring order: colors chosen for earlier
 * roles feed the color-harmony score of later ones.
 */
public enum OutfitRole {
    TOP("top", false),
    OUTERWEAR("outerwear", false),
    BOTTOM("bottom", false),
    SHOES("shoes", false),
    ACCESSORIES("accessories", true);

    public static final List<OutfitRole> SCORING_ORDER = List.of(values());

    private final String value;
    private final boolean multiple;

    OutfitRole(String value, boolean multiple) {
        this.value = value;
        this.multiple = multiple;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Whether the role holds a list of targets rather than at most one.
     */
    public boolean isMultiple() {
        return multiple;
    }

    @JsonCreator
    public static OutfitRole fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Outfit role must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("accessory")) {
            return ACCESSORIES;
        }
        for (OutfitRole role : values()) {
            if (role.value.equals(normalized)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown outfit role: " + value);
    }
}
