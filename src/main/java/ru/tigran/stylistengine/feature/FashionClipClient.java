package ru.tigran.stylistengine.feature;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Fashion-specialized embedding model (Fashion-CLIP inference endpoint).
 *
 * Request: {@code {"image": "<base64>"}}.
 * Response:
 * <pre>
 * {
 *   "category": "jeans",
 *   "styles": ["casual", "streetwear"],
 *   "features": ["denim", "distressed"],
 *   "confidence_scores": {"category": 0.91, "style": 0.74, "features": 0.6},
 *   "embedding": [0.013, -0.204, ...]
 * }
 * </pre>
 */
@Slf4j
@Component
public class FashionClipClient implements FeatureSourceClient {

    static final double DEFAULT_CONFIDENCE = 0.5;

    private static final Set<String> FABRICS = Set.of(
            "cotton", "denim", "silk", "wool", "leather", "linen", "polyester", "cashmere",
            "velvet", "lace", "knit", "woven", "mesh", "sequined", "embroidered"
    );

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String url;
    private final Duration timeout;

    public FashionClipClient(
            RestClient restClient,
            ObjectMapper objectMapper,
            @Value("${app.features.fashion-model.url:}") String url,
            @Value("${app.features.fashion-model.timeout-ms:5000}") long timeoutMs
    ) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.url = url;
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    @Override
    public FeatureSource source() {
        return FeatureSource.FASHION_MODEL;
    }

    @Override
    public Duration timeout() {
        return timeout;
    }

    @Override
    public FeatureBag extract(byte[] image) {
        if (url == null || url.isBlank()) {
            throw new FeatureSourceException("Fashion model endpoint is not configured");
        }

        Map<String, String> request = Map.of("image", Base64.getEncoder().encodeToString(image));
        String response = restClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    throw new FeatureSourceException("Fashion model returned HTTP " + res.getStatusCode().value());
                })
                .body(String.class);

        return toFeatureBag(parse(response));
    }

    FeatureBag toFeatureBag(JsonNode root) {
        JsonNode scores = root.path("confidence_scores");
        Map<String, Double> features = new LinkedHashMap<>();

        String category = root.path("category").asText("");
        if (!category.isBlank()) {
            features.put(FeatureNames.of(FeatureNames.CATEGORY, category), score(scores, "category"));
        }

        double styleConfidence = score(scores, "style");
        JsonNode styles = root.has("styles") ? root.path("styles") : root.path("style");
        for (JsonNode style : styles) {
            features.merge(FeatureNames.of(FeatureNames.STYLE, style.asText()), styleConfidence, Math::max);
        }

        double featureConfidence = score(scores, "features");
        for (JsonNode feature : root.path("features")) {
            String word = FeatureNames.normalize(feature.asText());
            String namespace = FABRICS.contains(word) ? FeatureNames.MATERIAL : FeatureNames.DETAIL;
            features.merge(FeatureNames.of(namespace, word), featureConfidence, Math::max);
        }

        JsonNode embeddingNode = root.path("embedding");
        float[] embedding = new float[embeddingNode.isArray() ? embeddingNode.size() : 0];
        for (int i = 0; i < embedding.length; i++) {
            embedding[i] = (float) embeddingNode.get(i).asDouble();
        }

        log.debug("Fashion model produced {} features, embedding dim {}", features.size(), embedding.length);
        return new FeatureBag(FeatureSource.FASHION_MODEL, features, embedding);
    }

    private JsonNode parse(String response) {
        if (response == null || response.isBlank()) {
            throw new FeatureSourceException("Fashion model returned an empty body");
        }
        try {
            return objectMapper.readTree(response);
        } catch (Exception e) {
            throw new FeatureSourceException("Fashion model returned invalid JSON: " + e.getMessage(), e);
        }
    }

    private static double score(JsonNode scores, String field) {
        JsonNode value = scores.path(field);
        return value.isNumber() ? value.asDouble() : DEFAULT_CONFIDENCE;
    }
}
