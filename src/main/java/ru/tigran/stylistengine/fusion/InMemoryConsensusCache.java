package ru.tigran.stylistengine.fusion;

import ru.tigran.stylistengine.util.CacheKeyUtils;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local cache, used when Redis is not available (app.fusion.cache.type=memory) and in tests.
 */
public class InMemoryConsensusCache implements ConsensusCache {

    private final Map<String, ConsensusFeatureSet> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<ConsensusFeatureSet> get(String imageHash) {
        return Optional.ofNullable(entries.get(CacheKeyUtils.normalizeHash(imageHash)));
    }

    @Override
    public void put(String imageHash, ConsensusFeatureSet featureSet) {
        entries.put(CacheKeyUtils.normalizeHash(imageHash), featureSet);
    }

    @Override
    public void invalidate(String imageHash) {
        entries.remove(CacheKeyUtils.normalizeHash(imageHash));
    }

    public int size() {
        return entries.size();
    }
}
