package ru.tigran.stylistengine.util;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Utility class for cache key generation.
 * Consensus features are cached by the content hash of the raw image bytes,
 * so identical uploads share one entry regardless of which garment they belong to.
 */
public class CacheKeyUtils {

    public static final String CONSENSUS_KEY_PREFIX = "consensus:";

    private CacheKeyUtils() {
        // Private constructor to prevent instantiation
    }

    /**
     * SHA-256 of the raw image bytes, lower-case hex.
     *
     * @param image raw image bytes
     * @return 64-character hex digest
     */
    public static String imageHash(byte[] image) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(image));
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is mandatory on every JRE
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Generates the Redis key for a consensus feature set.
     *
     * @param imageHash content hash of the image
     * @return key in format "consensus:imageHash"
     */
    public static String consensusKey(String imageHash) {
        return CONSENSUS_KEY_PREFIX + normalizeHash(imageHash);
    }

    /**
     * Collapses whitespace in a user prompt so that equivalent prompts render identically.
     * Example: "  Brunch \n with   friends " -> "Brunch with friends"
     */
    public static String normalizePrompt(String prompt) {
        if (prompt == null) {
            return "";
        }
        return prompt
                .trim()
                .replaceAll("[\\n\\r\\t]+", " ")
                .replaceAll("\\s+", " ");
    }

    public static String normalizeHash(String imageHash) {
        return imageHash.trim().toLowerCase(Locale.ROOT);
    }
}
