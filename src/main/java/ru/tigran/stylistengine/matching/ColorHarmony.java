package ru.tigran.stylistengine.matching;

import ru.tigran.stylistengine.feature.ColorNamer;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Pairwise color compatibility.
 *
 * Rules, first match wins: same color 1.0, either color neutral 0.9, complementary 0.85,
 * analogous 0.8, same color family 0.7, anything else 0.4.
 */
public final class ColorHarmony {

    public static final double SAME = 1.0;
    public static final double NEUTRAL = 0.9;
    public static final double COMPLEMENTARY = 0.85;
    public static final double ANALOGOUS = 0.8;
    public static final double SAME_FAMILY = 0.7;
    public static final double CLASH = 0.4;
    public static final double UNKNOWN = 0.5;

    private static final Set<String> NEUTRALS = Set.of("white", "black", "gray", "beige", "brown", "tan", "cream");

    private static final Map<String, Set<String>> COMPLEMENTARY_COLORS = Map.of(
            "red", Set.of("green", "teal"),
            "blue", Set.of("orange", "yellow"),
            "purple", Set.of("yellow", "lime"),
            "green", Set.of("red", "pink"),
            "orange", Set.of("blue", "navy"),
            "yellow", Set.of("purple", "violet")
    );

    private static final Map<String, Set<String>> ANALOGOUS_COLORS = Map.of(
            "red", Set.of("orange", "pink", "burgundy"),
            "blue", Set.of("purple", "teal", "navy"),
            "green", Set.of("yellow", "teal", "lime"),
            "orange", Set.of("red", "yellow", "coral"),
            "purple", Set.of("blue", "pink", "violet"),
            "yellow", Set.of("orange", "lime", "gold")
    );

    private static final List<Set<String>> FAMILIES = List.of(
            Set.of("black", "white", "gray", "beige", "navy", "cream"),
            Set.of("brown", "tan", "khaki", "olive", "camel", "rust"),
            Set.of("blue", "navy", "teal", "turquoise", "sky", "cyan"),
            Set.of("red", "burgundy", "wine", "crimson", "coral", "maroon"),
            Set.of("green", "olive", "forest", "sage", "mint", "lime")
    );

    private ColorHarmony() {
        // Private constructor to prevent instantiation
    }

    public static double pair(String first, String second) {
        String a = canonical(first);
        String b = canonical(second);
        if (a == null || b == null) {
            return UNKNOWN;
        }
        if (a.equals(b)) {
            return SAME;
        }
        if (NEUTRALS.contains(a) || NEUTRALS.contains(b)) {
            return NEUTRAL;
        }
        if (related(COMPLEMENTARY_COLORS, a, b)) {
            return COMPLEMENTARY;
        }
        if (related(ANALOGOUS_COLORS, a, b)) {
            return ANALOGOUS;
        }
        for (Set<String> family : FAMILIES) {
            if (family.contains(a) && family.contains(b)) {
                return SAME_FAMILY;
            }
        }
        return CLASH;
    }

    /**
     * Mean pairwise harmony of a color against every color of the palette.
     * {@link #UNKNOWN} for an empty palette.
     */
    public static double withPalette(String color, ColorPalette palette) {
        if (palette.isEmpty()) {
            return UNKNOWN;
        }
        double sum = 0;
        for (String committed : palette.colors()) {
            sum += pair(color, committed);
        }
        return sum / palette.colors().size();
    }

    /**
     * Lower-case base color: "Light-Gray" -> "gray", "grey" -> "gray", "navy blue" -> "blue".
     * Null for blank or unknown input.
     */
    static String canonical(String color) {
        if (color == null) {
            return null;
        }
        String normalized = color.trim().toLowerCase(Locale.ROOT).replace('_', '-').replaceAll("\\s+", "-");
        if (normalized.isEmpty() || normalized.equals(ColorNamer.UNKNOWN)) {
            return null;
        }
        int dash = normalized.lastIndexOf('-');
        if (dash >= 0 && dash < normalized.length() - 1) {
            normalized = normalized.substring(dash + 1);
        }
        return normalized.equals("grey") ? "gray" : normalized;
    }

    private static boolean related(Map<String, Set<String>> table, String a, String b) {
        return table.getOrDefault(a, Set.of()).contains(b) || table.getOrDefault(b, Set.of()).contains(a);
    }
}
