package ru.tigran.stylistengine.feature;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Local color analysis plus optional OCR-based brand detection.
 *
 * Pixels are sampled on a grid, named with {@link ColorNamer} and counted. When the
 * border of the photo is mostly near-white, near-white pixels are treated as studio
 * background and ignored. Each of the top colors becomes {@code color:<name>} with
 * its share of the classified pixels as confidence.
 */
@Slf4j
@Component
public class ColorBrandHeuristicClient implements FeatureSourceClient {

    static final int MAX_SAMPLES = 10_000;
    static final int MAX_COLORS = 3;
    static final double MIN_SHARE = 0.05;
    private static final int NEAR_WHITE = 235;
    private static final double BACKGROUND_BORDER_SHARE = 0.6;
    private static final double DEFAULT_BRAND_CONFIDENCE = 0.8;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String ocrUrl;
    private final Duration timeout;

    public ColorBrandHeuristicClient(
            RestClient restClient,
            ObjectMapper objectMapper,
            @Value("${app.features.color-heuristic.ocr-url:}") String ocrUrl,
            @Value("${app.features.color-heuristic.timeout-ms:3000}") long timeoutMs
    ) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.ocrUrl = ocrUrl;
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    @Override
    public FeatureSource source() {
        return FeatureSource.COLOR_HEURISTIC;
    }

    @Override
    public Duration timeout() {
        return timeout;
    }

    @Override
    public FeatureBag extract(byte[] image) {
        BufferedImage decoded = decode(image);
        Map<String, Double> features = new LinkedHashMap<>(dominantColors(decoded));
        detectBrand(image).ifPresent(brand -> features.put(FeatureNames.of(FeatureNames.BRAND, brand.name()), brand.confidence()));
        return new FeatureBag(FeatureSource.COLOR_HEURISTIC, features);
    }

    /**
     * Named colors with their share of classified pixels, strongest first.
     */
    Map<String, Double> dominantColors(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int step = Math.max(1, (int) Math.ceil(Math.sqrt((double) width * height / MAX_SAMPLES)));
        boolean suppressBackground = borderIsBackground(image);

        Map<String, Integer> counts = new HashMap<>();
        int classified = 0;
        for (int y = 0; y < height; y += step) {
            for (int x = 0; x < width; x += step) {
                int argb = image.getRGB(x, y);
                if (((argb >>> 24) & 0xFF) < 128) {
                    continue;
                }
                if (suppressBackground && isNearWhite(argb)) {
                    continue;
                }
                String name = ColorNamer.name(argb);
                if (ColorNamer.UNKNOWN.equals(name)) {
                    continue;
                }
                counts.merge(name, 1, Integer::sum);
                classified++;
            }
        }

        Map<String, Double> colors = new LinkedHashMap<>();
        if (classified == 0) {
            return colors;
        }
        final int total = classified;
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .filter(entry -> (double) entry.getValue() / total >= MIN_SHARE)
                .limit(MAX_COLORS)
                .forEach(entry -> colors.put(FeatureNames.of(FeatureNames.COLOR, entry.getKey()),
                        (double) entry.getValue() / total));
        return colors;
    }

    private boolean borderIsBackground(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        List<Integer> border = new ArrayList<>();
        int stepX = Math.max(1, width / 50);
        int stepY = Math.max(1, height / 50);
        for (int x = 0; x < width; x += stepX) {
            border.add(image.getRGB(x, 0));
            border.add(image.getRGB(x, height - 1));
        }
        for (int y = 0; y < height; y += stepY) {
            border.add(image.getRGB(0, y));
            border.add(image.getRGB(width - 1, y));
        }
        long nearWhite = border.stream().filter(ColorBrandHeuristicClient::isNearWhite).count();
        return !border.isEmpty() && (double) nearWhite / border.size() > BACKGROUND_BORDER_SHARE;
    }

    private static boolean isNearWhite(int argb) {
        int r = (argb >> 16) & 0xFF;
        int g = (argb >> 8) & 0xFF;
        int b = argb & 0xFF;
        return r >= NEAR_WHITE && g >= NEAR_WHITE && b >= NEAR_WHITE;
    }

    private static BufferedImage decode(byte[] image) {
        try {
            BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(image));
            if (decoded == null) {
                throw new FeatureSourceException("Unsupported image format");
            }
            return decoded;
        } catch (IOException e) {
            throw new FeatureSourceException("Failed to decode image: " + e.getMessage(), e);
        }
    }

    /**
     * Brand from OCR text. OCR is optional: a failed OCR call degrades to color-only output.
     * Expected OCR response: {@code {"texts": [{"text": "LEVI'S", "confidence": 0.93}, ...]}}
     */
    private Optional<DetectedBrand> detectBrand(byte[] image) {
        if (ocrUrl == null || ocrUrl.isBlank()) {
            return Optional.empty();
        }
        try {
            String response = restClient.post()
                    .uri(ocrUrl)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("image", Base64.getEncoder().encodeToString(image)))
                    .retrieve()
                    .body(String.class);
            if (response == null || response.isBlank()) {
                return Optional.empty();
            }
            for (JsonNode text : objectMapper.readTree(response).path("texts")) {
                Optional<String> brand = BrandMatcher.match(text.path("text").asText());
                if (brand.isPresent()) {
                    double confidence = text.path("confidence").isNumber()
                            ? text.path("confidence").asDouble()
                            : DEFAULT_BRAND_CONFIDENCE;
                    return Optional.of(new DetectedBrand(brand.get(), confidence));
                }
            }
            return Optional.empty();
        } catch (Exception e) {
            log.warn("OCR brand detection failed, continuing with colors only: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private record DetectedBrand(String name, double confidence) {
    }
}
