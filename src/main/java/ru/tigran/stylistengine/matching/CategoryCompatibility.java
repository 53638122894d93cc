package ru.tigran.stylistengine.matching;

import ru.tigran.stylistengine.feature.FeatureNames;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Which garment categories may fill which outfit role, and how well.
 *
 * Exact aliases of a role score 1.0, sibling categories that can stand in for it score
 * 0.6-0.9, everything else is incompatible (0). A garment whose category equals the
 * target's requested type scores 1.0 for any role it is compatible with.
 */
public final class CategoryCompatibility {

    private static final Map<OutfitRole, Map<String, Double>> TABLE = new EnumMap<>(OutfitRole.class);

    static {
        TABLE.put(OutfitRole.TOP, table(
                new String[]{"top", "tops", "shirt", "t-shirt", "tee", "dress-shirt", "blouse", "sweater",
                        "tank", "tank-top", "crop-top", "polo", "turtleneck", "sweatshirt"},
                Map.of("hoodie", 0.8, "cardigan", 0.6, "vest", 0.6, "dress", 0.6)));
        TABLE.put(OutfitRole.OUTERWEAR, table(
                new String[]{"outerwear", "jacket", "coat", "blazer", "parka", "trench", "trench-coat", "puffer"},
                Map.of("cardigan", 0.8, "hoodie", 0.7, "vest", 0.7, "sweater", 0.6)));
        TABLE.put(OutfitRole.BOTTOM, table(
                new String[]{"bottom", "bottoms", "pants", "trousers", "jeans", "shorts", "skirt",
                        "leggings", "chinos", "joggers"},
                Map.of("jumpsuit", 0.6, "activewear", 0.6)));
        TABLE.put(OutfitRole.SHOES, table(
                new String[]{"shoes", "shoe", "footwear", "sneakers", "boots", "sandals", "heels", "flats",
                        "loafers", "oxfords"},
                Map.of()));
        TABLE.put(OutfitRole.ACCESSORIES, table(
                new String[]{"accessory", "accessories", "bag", "hat", "cap", "jewelry", "belt", "scarf",
                        "watch", "sunglasses", "necklace", "earrings", "bracelet", "tie", "gloves"},
                Map.of()));
    }

    private CategoryCompatibility() {
        // Private constructor to prevent instantiation
    }

    /**
     * @param role         slot being filled
     * @param targetType   type requested by the outfit description, may be blank
     * @param category     garment category, may carry a {@code category:} prefix
     * @return score in [0,1], 0 meaning incompatible
     */
    public static double score(OutfitRole role, String targetType, String category) {
        String garment = normalize(category);
        if (garment.isEmpty()) {
            return 0.0;
        }
        double roleScore = TABLE.get(role).getOrDefault(garment, 0.0);
        if (roleScore <= 0) {
            return 0.0;
        }
        String requested = normalize(targetType);
        if (!requested.isEmpty() && (requested.equals(garment) || requested.equals(garment + "s")
                || garment.equals(requested + "s"))) {
            return 1.0;
        }
        return roleScore;
    }

    public static boolean isCompatible(OutfitRole role, String category) {
        return score(role, null, category) > 0;
    }

    static String normalize(String category) {
        if (category == null) {
            return "";
        }
        String name = FeatureNames.normalize(category);
        if (FeatureNames.CATEGORY.equals(FeatureNames.namespace(name))) {
            name = FeatureNames.value(name);
        }
        return name.toLowerCase(Locale.ROOT);
    }

    private static Map<String, Double> table(String[] exact, Map<String, Double> siblings) {
        Map<String, Double> scores = new HashMap<>(siblings);
        for (String alias : exact) {
            scores.put(alias, 1.0);
        }
        return scores;
    }
}
