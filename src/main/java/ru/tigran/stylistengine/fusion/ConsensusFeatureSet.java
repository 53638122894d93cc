package ru.tigran.stylistengine.fusion;

import com.fasterxml.jackson.annotation.JsonIgnore;
import ru.tigran.stylistengine.feature.FeatureNames;
import ru.tigran.stylistengine.feature.FeatureSource;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Fused description of one garment image.
 *
 * @param features   surviving feature name -> fused confidence in [0,1]
 * @param provenance surviving feature name -> sources that proposed it
 * @param embedding  semantic vector taken over from the sources, empty when none supplied one
 */
public record ConsensusFeatureSet(
        Map<String, Double> features,
        Map<String, Set<FeatureSource>> provenance,
        float[] embedding
) {
    private static final ConsensusFeatureSet EMPTY = new ConsensusFeatureSet(Map.of(), Map.of(), new float[0]);

    public ConsensusFeatureSet {
        features = features == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(features));
        TreeMap<String, Set<FeatureSource>> copy = new TreeMap<>();
        if (provenance != null) {
            provenance.forEach((name, sources) -> copy.put(name,
                    sources == null || sources.isEmpty()
                            ? Set.of()
                            : Collections.unmodifiableSet(EnumSet.copyOf(sources))));
        }
        provenance = Collections.unmodifiableMap(copy);
        embedding = embedding == null ? new float[0] : embedding.clone();
    }

    /**
     * Valid low-information result: no features, no provenance, no embedding.
     */
    public static ConsensusFeatureSet empty() {
        return EMPTY;
    }

    @Override
    public float[] embedding() {
        return embedding.clone();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return features.isEmpty();
    }

    /**
     * Value of the strongest feature in a namespace, e.g. "navy" for {@code color:navy}.
     * Ties go to the lexicographically smaller name.
     */
    public Optional<String> dominant(String namespace) {
        String best = null;
        double bestScore = -1;
        for (Map.Entry<String, Double> entry : features.entrySet()) {
            if (!namespace.equals(FeatureNames.namespace(entry.getKey()))) {
                continue;
            }
            if (entry.getValue() > bestScore) {
                best = entry.getKey();
                bestScore = entry.getValue();
            }
        }
        return Optional.ofNullable(best).map(FeatureNames::value);
    }
}
