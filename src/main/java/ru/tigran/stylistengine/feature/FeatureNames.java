package ru.tigran.stylistengine.feature;

import java.util.Locale;

/**
 * Helpers for namespaced feature names such as {@code color:navy} or {@code style:casual}.
 */
public final class FeatureNames {

    public static final String COLOR = "color";
    public static final String STYLE = "style";
    public static final String CATEGORY = "category";
    public static final String MATERIAL = "material";
    public static final String OCCASION = "occasion";
    public static final String BRAND = "brand";
    public static final String DETAIL = "detail";

    private static final char SEPARATOR = ':';

    private FeatureNames() {
        // Private constructor to prevent instantiation
    }

    /**
     * Lower-cases, trims and hyphenates whitespace on both sides of the separator.
     * Example: " Color: Light Gray " -> "color:light-gray"
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String lower = name.trim().toLowerCase(Locale.ROOT);
        int idx = lower.indexOf(SEPARATOR);
        if (idx < 0) {
            return hyphenate(lower);
        }
        return hyphenate(lower.substring(0, idx)) + SEPARATOR + hyphenate(lower.substring(idx + 1));
    }

    public static String of(String namespace, String value) {
        return normalize(namespace + SEPARATOR + value);
    }

    /**
     * Namespace part of a feature name, or an empty string when the name has no namespace.
     */
    public static String namespace(String name) {
        int idx = name.indexOf(SEPARATOR);
        return idx < 0 ? "" : name.substring(0, idx);
    }

    public static String value(String name) {
        int idx = name.indexOf(SEPARATOR);
        return idx < 0 ? name : name.substring(idx + 1);
    }

    public static boolean isNamespaced(String name) {
        int idx = name.indexOf(SEPARATOR);
        return idx > 0 && idx < name.length() - 1;
    }

    private static String hyphenate(String part) {
        return part.trim().replaceAll("\\s+", "-");
    }
}
