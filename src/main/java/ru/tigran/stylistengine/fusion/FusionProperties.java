package ru.tigran.stylistengine.fusion;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import ru.tigran.stylistengine.feature.FeatureNames;
import ru.tigran.stylistengine.feature.FeatureSource;

import java.util.HashMap;
import java.util.Map;

/**
 * Binds app.fusion.* from application.yml.
 *
 * <pre>
 * app:
 *   fusion:
 *     min-confidence: 0.35
 *     cache:
 *       type: redis
 *     namespaces:
 *       color:
 *         exclusive: true
 *         weights:
 *           COLOR_HEURISTIC: 1.0
 *           VISION_MODEL: 0.5
 *           FASHION_MODEL: 0.4
 * </pre>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "app.fusion")
public class FusionProperties {

    public static final double DEFAULT_MIN_CONFIDENCE = 0.35;

    /** Fused confidence below this value is discarded. */
    private double minConfidence = DEFAULT_MIN_CONFIDENCE;

    /** Namespace -> policy. Namespaces not listed use a plain average and are not exclusive. */
    private Map<String, NamespacePolicy> namespaces = defaultNamespaces();

    private Cache cache = new Cache();

    public NamespacePolicy policyFor(String namespace) {
        NamespacePolicy policy = namespaces.get(namespace);
        return policy == null ? NamespacePolicy.plainAverage() : policy;
    }

    public void setNamespaces(Map<String, NamespacePolicy> namespaces) {
        this.namespaces = namespaces == null ? new HashMap<>() : namespaces;
    }

    public static Map<String, NamespacePolicy> defaultNamespaces() {
        Map<String, NamespacePolicy> defaults = new HashMap<>();
        Map<FeatureSource, Double> modelLed = Map.of(
                FeatureSource.FASHION_MODEL, 1.0,
                FeatureSource.VISION_MODEL, 0.6,
                FeatureSource.COLOR_HEURISTIC, 0.2);
        defaults.put(FeatureNames.STYLE, new NamespacePolicy(modelLed, false));
        defaults.put(FeatureNames.CATEGORY, new NamespacePolicy(modelLed, true));
        defaults.put(FeatureNames.COLOR, new NamespacePolicy(Map.of(
                FeatureSource.COLOR_HEURISTIC, 1.0,
                FeatureSource.VISION_MODEL, 0.5,
                FeatureSource.FASHION_MODEL, 0.4), true));
        return defaults;
    }

    @Getter
    @Setter
    public static class Cache {
        /** redis | memory */
        private String type = "redis";
    }
}
