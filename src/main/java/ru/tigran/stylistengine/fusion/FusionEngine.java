package ru.tigran.stylistengine.fusion;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.tigran.stylistengine.feature.FeatureBag;
import ru.tigran.stylistengine.feature.FeatureNames;
import ru.tigran.stylistengine.feature.FeatureSource;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Combines per-source feature bags into one consensus feature set.
 *
 * Алгоритм:
 * 1. fused(f) = Σ w(ns, s)·c_s(f) / Σ w(ns, s) по источникам, предложившим f
 * 2. отбрасываются признаки ниже min-confidence
 * 3. в exclusive namespace остается один признак (max, при равенстве меньшее имя)
 * 4. provenance = источники, предложившие оставшийся признак
 *
 * Results are cached by image hash; the cache is consulted before any work.
 */
@Slf4j
@Service
public class FusionEngine {

    private final ConsensusCache cache;
    private final FusionProperties properties;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public FusionEngine(ConsensusCache cache, FusionProperties properties, MeterRegistry meterRegistry) {
        this.cache = cache;
        this.properties = properties;
        this.cacheHitCounter = Counter.builder("fusion.cache.hit")
                .description("Consensus sets served from cache")
                .register(meterRegistry);
        this.cacheMissCounter = Counter.builder("fusion.cache.miss")
                .description("Consensus sets computed from feature bags")
                .register(meterRegistry);
    }

    public ConsensusFeatureSet fuse(String imageHash, List<FeatureBag> bags) {
        return fuse(imageHash, () -> bags);
    }

    /**
     * Like {@link #fuse(String, List)}, but the bags are only produced on a cache miss,
     * so a known image never reaches the feature sources.
     */
    public ConsensusFeatureSet fuse(String imageHash, Supplier<List<FeatureBag>> bagSupplier) {
        Optional<ConsensusFeatureSet> cached = cache.get(imageHash);
        if (cached.isPresent()) {
            cacheHitCounter.increment();
            log.debug("Consensus cache hit for {}", imageHash);
            return cached.get();
        }
        cacheMissCounter.increment();
        log.debug("Consensus cache miss for {}", imageHash);

        List<FeatureBag> bags = bagSupplier.get();
        ConsensusFeatureSet result = compute(bags);
        cache.put(imageHash, result);
        log.info("Fused {} bags into {} features for image {}", bags == null ? 0 : bags.size(),
                result.features().size(), imageHash);
        return result;
    }

    public void invalidate(String imageHash) {
        cache.invalidate(imageHash);
        log.debug("Consensus cache entry invalidated for {}", imageHash);
    }

    /**
     * Pure fusion without the cache.
     */
    public ConsensusFeatureSet compute(List<FeatureBag> bags) {
        if (bags == null || bags.isEmpty()) {
            return ConsensusFeatureSet.empty();
        }

        Map<String, Double> weightedSums = new HashMap<>();
        Map<String, Double> weightTotals = new HashMap<>();
        Map<String, Set<FeatureSource>> proposers = new HashMap<>();

        for (FeatureBag bag : bags) {
            for (Map.Entry<String, Double> entry : bag.features().entrySet()) {
                String name = entry.getKey();
                double weight = properties.policyFor(FeatureNames.namespace(name)).weightFor(bag.source());
                if (weight <= 0) {
                    continue;
                }
                weightedSums.merge(name, weight * entry.getValue(), Double::sum);
                weightTotals.merge(name, weight, Double::sum);
                proposers.computeIfAbsent(name, k -> EnumSet.noneOf(FeatureSource.class)).add(bag.source());
            }
        }

        Map<String, Double> survivors = new TreeMap<>();
        for (Map.Entry<String, Double> entry : weightedSums.entrySet()) {
            double fused = Math.max(0.0, Math.min(1.0, entry.getValue() / weightTotals.get(entry.getKey())));
            if (fused >= properties.getMinConfidence()) {
                survivors.put(entry.getKey(), fused);
            }
        }

        applyExclusivity(survivors);

        Map<String, Set<FeatureSource>> provenance = new TreeMap<>();
        for (String name : survivors.keySet()) {
            provenance.put(name, proposers.get(name));
        }
        return new ConsensusFeatureSet(survivors, provenance, pickEmbedding(bags));
    }

    /**
     * Keeps one feature per exclusive namespace. Iteration is in name order, so with
     * a strict comparison the lexicographically smaller name wins ties.
     */
    private void applyExclusivity(Map<String, Double> survivors) {
        Map<String, String> winners = new HashMap<>();
        Set<String> exclusiveNamespaces = new HashSet<>();
        for (Map.Entry<String, Double> entry : survivors.entrySet()) {
            String namespace = FeatureNames.namespace(entry.getKey());
            if (!properties.policyFor(namespace).isExclusive()) {
                continue;
            }
            exclusiveNamespaces.add(namespace);
            String current = winners.get(namespace);
            if (current == null || entry.getValue() > survivors.get(current)) {
                winners.put(namespace, entry.getKey());
            }
        }
        if (exclusiveNamespaces.isEmpty()) {
            return;
        }
        survivors.keySet().removeIf(name -> {
            String namespace = FeatureNames.namespace(name);
            return exclusiveNamespaces.contains(namespace) && !name.equals(winners.get(namespace));
        });
    }

    private static float[] pickEmbedding(List<FeatureBag> bags) {
        for (FeatureBag bag : bags) {
            if (bag.source() == FeatureSource.FASHION_MODEL && bag.hasEmbedding()) {
                return bag.embedding();
            }
        }
        for (FeatureBag bag : bags) {
            if (bag.hasEmbedding()) {
                return bag.embedding();
            }
        }
        return new float[0];
    }
}
