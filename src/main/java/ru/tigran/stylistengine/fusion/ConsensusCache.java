package ru.tigran.stylistengine.fusion;

import java.util.Optional;

/**
 * Consensus feature sets keyed by image content hash. Entries never expire on their own.
 */
public interface ConsensusCache {

    Optional<ConsensusFeatureSet> get(String imageHash);

    /**
     * Idempotent: writing the same hash twice with equal content is harmless.
     */
    void put(String imageHash, ConsensusFeatureSet featureSet);

    void invalidate(String imageHash);
}
