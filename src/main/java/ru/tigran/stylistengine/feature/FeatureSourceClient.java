package ru.tigran.stylistengine.feature;

import java.time.Duration;

/**
 * One image-analysis signal.
 *
 * Implementations are plain request/response adapters: no caching, no retries
 * beyond what the remote call itself does. Any exception thrown from
 * {@link #extract(byte[])} is treated as a failure of this source only.
 */
public interface FeatureSourceClient {

    FeatureSource source();

    /**
     * Strict per-call deadline. Exceeding it counts as a source failure.
     */
    Duration timeout();

    FeatureBag extract(byte[] image);
}
