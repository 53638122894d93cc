package ru.tigran.stylistengine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.tigran.stylistengine.exception.AIGatewayException;
import ru.tigran.stylistengine.exception.ErrorCode;
import ru.tigran.stylistengine.feature.FeatureNames;
import ru.tigran.stylistengine.matching.OutfitRequestSpec;
import ru.tigran.stylistengine.matching.OutfitRole;
import ru.tigran.stylistengine.matching.RoleTarget;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Converts the generator's outfit JSON into an {@link OutfitRequestSpec}.
 *
 * Plain feature words get a namespace from a small vocabulary (colors, materials, styles),
 * anything else becomes {@code detail:<word>}. Words already carrying a namespace are kept.
 * The garment type is added as {@code category:<type>}. Every parsed feature has confidence 1.0.
 */
@Slf4j
@Component
public class OutfitSpecParser {

    private static final Set<String> COLORS = Set.of(
            "black", "white", "gray", "grey", "light-gray", "beige", "cream", "brown", "tan", "khaki",
            "camel", "olive", "navy", "blue", "light-blue", "teal", "turquoise", "green", "lime", "mint",
            "yellow", "gold", "orange", "coral", "red", "burgundy", "maroon", "pink", "purple", "violet",
            "magenta", "cyan", "silver"
    );

    private static final Set<String> MATERIALS = Set.of(
            "cotton", "denim", "silk", "wool", "leather", "linen", "polyester", "cashmere", "velvet",
            "lace", "knit", "woven", "mesh", "sequined", "embroidered", "suede", "satin", "fleece", "corduroy"
    );

    private static final Set<String> STYLES = Set.of(
            "casual", "formal", "business", "sporty", "elegant", "vintage", "modern", "bohemian", "edgy",
            "minimalist", "preppy", "streetwear", "romantic", "professional", "trendy", "classic"
    );

    private final ObjectMapper objectMapper;

    public OutfitSpecParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public OutfitRequestSpec parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new AIGatewayException("Outfit description is not valid JSON: " + e.getMessage(),
                    ErrorCode.INVALID_JSON_RESPONSE.getCode(), e);
        }
        if (root == null || !root.isObject()) {
            throw AIGatewayException.invalidResponse("Outfit description is not a JSON object");
        }

        OutfitRequestSpec.Builder builder = OutfitRequestSpec.builder();
        for (OutfitRole role : OutfitRole.SCORING_ORDER) {
            JsonNode node = role.isMultiple() ? accessoriesNode(root) : root.get(role.getValue());
            if (node == null || node.isNull()) {
                continue;
            }
            if (role.isMultiple() && node.isArray()) {
                for (JsonNode item : node) {
                    addTarget(builder, role, item);
                }
            } else {
                addTarget(builder, role, node);
            }
        }

        OutfitRequestSpec spec = builder.build();
        if (spec.isEmpty()) {
            throw AIGatewayException.invalidResponse("Outfit description contains no garments");
        }
        return spec;
    }

    private static JsonNode accessoriesNode(JsonNode root) {
        JsonNode node = root.get("accessories");
        return node != null ? node : root.get("accessory");
    }

    private static void addTarget(OutfitRequestSpec.Builder builder, OutfitRole role, JsonNode node) {
        if (!node.isObject()) {
            log.debug("Skipping non-object entry for role {}", role.getValue());
            return;
        }
        String type = node.path("type").asText("").trim();
        String color = node.path("color").asText("").trim();

        Map<String, Double> features = new LinkedHashMap<>();
        if (!type.isEmpty()) {
            features.put(FeatureNames.of(FeatureNames.CATEGORY, type), 1.0);
        }
        if (!color.isEmpty()) {
            features.put(FeatureNames.of(FeatureNames.COLOR, color), 1.0);
        }
        for (JsonNode word : node.path("features")) {
            String feature = namespaced(word.asText(""));
            if (!feature.isEmpty()) {
                features.put(feature, 1.0);
            }
        }
        if (type.isEmpty() && features.isEmpty()) {
            return;
        }
        builder.role(role, new RoleTarget(type, features, color.isEmpty() ? null : color));
    }

    static String namespaced(String word) {
        String normalized = FeatureNames.normalize(word);
        if (normalized.isEmpty() || FeatureNames.isNamespaced(normalized)) {
            return normalized;
        }
        if (COLORS.contains(normalized)) {
            return FeatureNames.of(FeatureNames.COLOR, normalized);
        }
        if (MATERIALS.contains(normalized)) {
            return FeatureNames.of(FeatureNames.MATERIAL, normalized);
        }
        if (STYLES.contains(normalized)) {
            return FeatureNames.of(FeatureNames.STYLE, normalized);
        }
        return FeatureNames.of(FeatureNames.DETAIL, normalized);
    }
}
