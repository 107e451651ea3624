package com.github.rudygunawan.tiercache.metrics;

import com.github.rudygunawan.tiercache.policy.CacheTier;

import java.util.Set;

/**
 * Interface for cache implementations to provide metrics data.
 * This is used by {@link MicrometerCacheMetrics} to collect and expose metrics.
 */
public interface CacheMetrics {

    /**
     * Returns the current number of entries in the fast tier.
     */
    long size();

    /**
     * Returns the bytes currently accounted to the fast tier.
     */
    long usedBytes();

    /**
     * Returns the total number of cache hits since creation or the last full reset.
     */
    long hitCount();

    /**
     * Returns the total number of cache misses since creation or the last full reset.
     */
    long missCount();

    /**
     * Returns the total number of evictions since creation or the last full reset.
     */
    long evictionCount();

    /**
     * Returns the total number of operations since creation or the last full reset.
     */
    long operationCount();

    /**
     * Returns the hit rate of the recent window.
     */
    double recentHitRate();

    /**
     * Returns the mean get latency of the recent window in milliseconds.
     */
    double meanLatencyMillis();

    /**
     * Returns the tiers this cache is made of, fast tier included.
     */
    Set<CacheTier> tiers();

    /**
     * Returns the entry count of a tier, or 0 if unknown.
     */
    long tierEntries(CacheTier tier);

    /**
     * Returns the byte count of a tier, or 0 if unknown.
     */
    long tierBytes(CacheTier tier);
}
