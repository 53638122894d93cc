package ru.tigran.stylistengine.feature;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import ru.tigran.stylistengine.exception.AIGatewayException;
import ru.tigran.stylistengine.service.AIGatewayService;

import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * General vision-language model, reached through the OpenRouter gateway.
 */
@Slf4j
@Component
public class VisionModelClient implements FeatureSourceClient {

    private final AIGatewayService aiGatewayService;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public VisionModelClient(
            AIGatewayService aiGatewayService,
            ObjectMapper objectMapper,
            @Value("${app.features.vision-model.timeout-ms:15000}") long timeoutMs
    ) {
        this.aiGatewayService = aiGatewayService;
        this.objectMapper = objectMapper;
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    @Override
    public FeatureSource source() {
        return FeatureSource.VISION_MODEL;
    }

    @Override
    public Duration timeout() {
        return timeout;
    }

    @Override
    public FeatureBag extract(byte[] image) {
        String json;
        try {
            json = aiGatewayService.describeImage(image);
        } catch (AIGatewayException e) {
            throw new FeatureSourceException("Vision model call failed: " + e.getMessage(), e);
        }
        return toFeatureBag(json);
    }

    FeatureBag toFeatureBag(String json) {
        JsonNode featuresNode;
        try {
            featuresNode = objectMapper.readTree(json).path("features");
        } catch (Exception e) {
            throw new FeatureSourceException("Vision model returned invalid JSON: " + e.getMessage(), e);
        }

        Map<String, Double> features = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = featuresNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isNumber()) {
                log.debug("Skipping non-numeric vision feature {}", field.getKey());
                continue;
            }
            String name = FeatureNames.normalize(field.getKey());
            if (name.isEmpty()) {
                continue;
            }
            if (!FeatureNames.isNamespaced(name)) {
                name = FeatureNames.of(FeatureNames.DETAIL, name);
            }
            features.merge(name, field.getValue().asDouble(), Math::max);
        }
        return new FeatureBag(FeatureSource.VISION_MODEL, features);
    }
}
