package ru.tigran.stylistengine.feature;

/**
 * Maps an sRGB triple to a coarse color name.
 *
 * Thresholds are tuned for product photos: very dark pixels are black, very
 * light ones white, near-equal channels gray, then dominant-channel rules with
 * a few mixed-color buckets. Returns {@link #UNKNOWN} when no rule applies.
 */
public final class ColorNamer {

    public static final String UNKNOWN = "unknown";

    private ColorNamer() {
        // Private constructor to prevent instantiation
    }

    public static String name(int r, int g, int b) {
        int total = r + g + b;
        if (total < 50) {
            return "black";
        }
        if (total > 650) {
            return "white";
        }
        if (Math.abs(r - g) < 30 && Math.abs(g - b) < 30 && Math.abs(r - b) < 30) {
            return total < 300 ? "gray" : "light-gray";
        }

        int max = Math.max(r, Math.max(g, b));
        if (max == r && r > g + 50 && r > b + 50) {
            if (g > 100) {
                return g > b ? "orange" : "pink";
            }
            if (b > 100) {
                return "purple";
            }
            return "red";
        }
        if (max == g && g > r + 50 && g > b + 50) {
            if (r > 100) {
                return r > b ? "yellow" : "lime";
            }
            return "green";
        }
        if (max == b && b > r + 50 && b > g + 50) {
            if (r > 100) {
                return "purple";
            }
            if (g > 100) {
                return "teal";
            }
            return total < 250 ? "navy" : "blue";
        }

        // mixed colors
        if (r > 150 && g > 150 && b < 100) {
            return "yellow";
        }
        if (r > 150 && b > 150 && g < 100) {
            return "magenta";
        }
        if (g > 150 && b > 150 && r < 100) {
            return "cyan";
        }
        if (r > 100 && g > 50 && b < 50) {
            return g < 100 ? "orange" : "yellow";
        }
        if (r > 50 && g > 100 && b < 50) {
            return "lime";
        }
        if (r < 50 && g > 100 && b > 50) {
            return "teal";
        }
        if (r < 100 && g < 100 && b > 150) {
            return total < 400 ? "navy" : "blue";
        }
        if (r > 100 && g < 100 && b < 100) {
            return total < 300 ? "maroon" : "red";
        }
        if (r > 100 && g > 70 && b > 70 && total < 400) {
            return "brown";
        }
        if (r > 180 && g > 160 && b > 120 && r >= g && g >= b) {
            return "beige";
        }
        return UNKNOWN;
    }

    public static String name(int rgb) {
        return name((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF);
    }
}
