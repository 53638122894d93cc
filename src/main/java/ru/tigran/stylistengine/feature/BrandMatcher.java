package ru.tigran.stylistengine.feature;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Matches OCR text fragments against a fixed list of fashion brands.
 */
public final class BrandMatcher {

    // canonical brand -> accepted spellings
    private static final Map<String, List<String>> BRANDS = new LinkedHashMap<>();

    static {
        for (String brand : List.of(
                "nike", "adidas", "puma", "reebok", "converse", "vans", "gap", "zara",
                "uniqlo", "lacoste", "champion", "supreme", "gucci", "prada", "versace",
                "armani", "burberry", "coach", "patagonia", "columbia", "timberland",
                "hollister", "abercrombie")) {
            BRANDS.put(brand, List.of(brand));
        }
        BRANDS.put("levis", List.of("levi's", "levis", "levi"));
        BRANDS.put("h&m", List.of("h&m", "h and m"));
        BRANDS.put("calvin klein", List.of("calvin klein", "calvin", "klein"));
        BRANDS.put("tommy hilfiger", List.of("tommy hilfiger", "hilfiger"));
        BRANDS.put("polo ralph lauren", List.of("polo ralph lauren", "ralph lauren"));
        BRANDS.put("under armour", List.of("under armour", "underarmour"));
        BRANDS.put("north face", List.of("the north face", "north face", "northface"));
        BRANDS.put("dr. martens", List.of("dr. martens", "dr martens", "doc martens"));
        BRANDS.put("dolce & gabbana", List.of("dolce & gabbana", "dolce gabbana"));
        BRANDS.put("michael kors", List.of("michael kors"));
        BRANDS.put("kate spade", List.of("kate spade"));
        BRANDS.put("marc jacobs", List.of("marc jacobs"));
        BRANDS.put("tory burch", List.of("tory burch"));
        BRANDS.put("forever 21", List.of("forever 21", "forever21"));
        BRANDS.put("old navy", List.of("old navy"));
        BRANDS.put("american eagle", List.of("american eagle"));
    }

    private BrandMatcher() {
        // Private constructor to prevent instantiation
    }

    /**
     * Canonical brand named by the text, if any. Single-word spellings must match a
     * whole token so that "gap" does not fire on "gaping".
     */
    public static Optional<String> match(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String normalized = " " + text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9&.' ]", " ").replaceAll("\\s+", " ").trim() + " ";
        for (Map.Entry<String, List<String>> entry : BRANDS.entrySet()) {
            for (String spelling : entry.getValue()) {
                if (normalized.contains(" " + spelling + " ")) {
                    return Optional.of(entry.getKey());
                }
            }
        }
        return Optional.empty();
    }
}
