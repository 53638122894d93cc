package ru.tigran.stylistengine.fusion;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import ru.tigran.stylistengine.feature.FeatureSource;

import java.util.EnumMap;
import java.util.Map;

/**
 * How sources are combined inside one feature namespace.
 * A source without an explicit weight counts with 1.0; a non-positive weight excludes it.
 */
@Getter
@Setter
@NoArgsConstructor
public class NamespacePolicy {

    private Map<FeatureSource, Double> weights = new EnumMap<>(FeatureSource.class);

    /**
     * Only the single strongest feature of the namespace survives fusion.
     */
    private boolean exclusive;

    public NamespacePolicy(Map<FeatureSource, Double> weights, boolean exclusive) {
        this.weights = new EnumMap<>(FeatureSource.class);
        this.weights.putAll(weights);
        this.exclusive = exclusive;
    }

    public double weightFor(FeatureSource source) {
        Double weight = weights.get(source);
        return weight == null ? 1.0 : weight;
    }

    public static NamespacePolicy plainAverage() {
        return new NamespacePolicy(Map.of(), false);
    }
}
