package com.github.rudygunawan.tiercache.model;

import com.github.rudygunawan.tiercache.policy.CacheTier;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Point-in-time snapshot of a cache's counters. Instances of this class are immutable.
 *
 * <p>Two sets of counters are reported:
 * <ul>
 *   <li>the <em>recent</em> window ({@link #hitCount()}, {@link #missCount()},
 *       {@link #evictionCount()}, {@link #operationCount()}, {@link #hitRate()},
 *       {@link #meanLatencyMillis()}), which the background metrics reset and {@code clear()}
 *       set back to zero;
 *   <li>the lifetime totals ({@code lifetime*}), which only an explicit full reset clears.
 * </ul>
 *
 * <p>Counting rules:
 * <ul>
 *   <li>Every {@code get} counts exactly one hit or one miss and one operation.
 *   <li>Every other public call (set, delete, invalidate, clear, each warmed entry) counts one
 *       operation.
 *   <li>Every entry removed to satisfy the budget, or dropped by the expiry sweep, counts one
 *       eviction.
 * </ul>
 */
public class CacheStats {
    private final long hitCount;
    private final long missCount;
    private final long evictionCount;
    private final long operationCount;
    private final double meanLatencyMillis;
    private final long lifetimeHitCount;
    private final long lifetimeMissCount;
    private final long lifetimeEvictionCount;
    private final long lifetimeOperationCount;
    private final Map<CacheTier, TierStats> tiers;

    /**
     * Constructs a new {@code CacheStats} instance.
     */
    public CacheStats(
            long hitCount,
            long missCount,
            long evictionCount,
            long operationCount,
            double meanLatencyMillis,
            long lifetimeHitCount,
            long lifetimeMissCount,
            long lifetimeEvictionCount,
            long lifetimeOperationCount,
            Map<CacheTier, TierStats> tiers) {
        this.hitCount = hitCount;
        this.missCount = missCount;
        this.evictionCount = evictionCount;
        this.operationCount = operationCount;
        this.meanLatencyMillis = meanLatencyMillis;
        this.lifetimeHitCount = lifetimeHitCount;
        this.lifetimeMissCount = lifetimeMissCount;
        this.lifetimeEvictionCount = lifetimeEvictionCount;
        this.lifetimeOperationCount = lifetimeOperationCount;
        EnumMap<CacheTier, TierStats> copy = new EnumMap<>(CacheTier.class);
        copy.putAll(tiers);
        this.tiers = Collections.unmodifiableMap(copy);
    }

    public long hitCount() {
        return hitCount;
    }

    public long missCount() {
        return missCount;
    }

    /**
     * Returns {@code hitCount + missCount}.
     */
    public long requestCount() {
        return hitCount + missCount;
    }

    public long evictionCount() {
        return evictionCount;
    }

    public long operationCount() {
        return operationCount;
    }

    /**
     * Returns {@code hitCount / requestCount} for the recent window, or {@code 0.0} when no
     * {@code get} has been counted.
     */
    public double hitRate() {
        long requestCount = requestCount();
        return (requestCount == 0) ? 0.0 : (double) hitCount / requestCount;
    }

    /**
     * Returns the mean {@code get} latency in milliseconds over the recent window.
     */
    public double meanLatencyMillis() {
        return meanLatencyMillis;
    }

    public long lifetimeHitCount() {
        return lifetimeHitCount;
    }

    public long lifetimeMissCount() {
        return lifetimeMissCount;
    }

    public long lifetimeEvictionCount() {
        return lifetimeEvictionCount;
    }

    public long lifetimeOperationCount() {
        return lifetimeOperationCount;
    }

    /**
     * Returns the all-time hit rate, or {@code 0.0} when no {@code get} was ever counted.
     */
    public double lifetimeHitRate() {
        long requestCount = lifetimeHitCount + lifetimeMissCount;
        return (requestCount == 0) ? 0.0 : (double) lifetimeHitCount / requestCount;
    }

    /**
     * Returns the per-tier counts, keyed by tier, covering the fast tier and every configured
     * slower tier.
     */
    public Map<CacheTier, TierStats> tiers() {
        return tiers;
    }

    /**
     * Returns the counts for one tier, or {@code null} if that tier is not configured.
     */
    public TierStats tier(CacheTier tier) {
        return tiers.get(tier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hitCount, missCount, evictionCount, operationCount, meanLatencyMillis,
                lifetimeHitCount, lifetimeMissCount, lifetimeEvictionCount, lifetimeOperationCount, tiers);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof CacheStats)) {
            return false;
        }
        CacheStats other = (CacheStats) obj;
        return hitCount == other.hitCount
                && missCount == other.missCount
                && evictionCount == other.evictionCount
                && operationCount == other.operationCount
                && Double.compare(meanLatencyMillis, other.meanLatencyMillis) == 0
                && lifetimeHitCount == other.lifetimeHitCount
                && lifetimeMissCount == other.lifetimeMissCount
                && lifetimeEvictionCount == other.lifetimeEvictionCount
                && lifetimeOperationCount == other.lifetimeOperationCount
                && tiers.equals(other.tiers);
    }

    @Override
    public String toString() {
        return "CacheStats{"
                + "hitCount=" + hitCount
                + ", missCount=" + missCount
                + ", evictionCount=" + evictionCount
                + ", operationCount=" + operationCount
                + ", hitRate=" + String.format("%.2f%%", hitRate() * 100)
                + ", meanLatencyMillis=" + String.format("%.3f", meanLatencyMillis)
                + ", tiers=" + tiers.values()
                + '}';
    }
}
