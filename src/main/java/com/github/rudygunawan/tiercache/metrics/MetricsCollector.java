package com.github.rudygunawan.tiercache.metrics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters for a cache: a recent window that is periodically reset, and lifetime totals
 * that are not.
 *
 * <p>All counters are atomics, so recording never takes the cache lock. A reset clears the
 * window counters one by one; a read racing with a reset can see a mix of old and new values,
 * which is acceptable for monitoring.
 */
public class MetricsCollector {
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong operations = new AtomicLong();
    private final AtomicLong latencyTotalNanos = new AtomicLong();
    private final AtomicLong latencySamples = new AtomicLong();

    private final AtomicLong lifetimeHits = new AtomicLong();
    private final AtomicLong lifetimeMisses = new AtomicLong();
    private final AtomicLong lifetimeEvictions = new AtomicLong();
    private final AtomicLong lifetimeOperations = new AtomicLong();

    /**
     * Records a {@code get} that found a value.
     */
    public void recordHit(long latencyNanos) {
        hits.incrementAndGet();
        lifetimeHits.incrementAndGet();
        recordLatency(latencyNanos);
        recordOperation();
    }

    /**
     * Records a {@code get} that found nothing.
     */
    public void recordMiss(long latencyNanos) {
        misses.incrementAndGet();
        lifetimeMisses.incrementAndGet();
        recordLatency(latencyNanos);
        recordOperation();
    }

    public void recordOperation() {
        operations.incrementAndGet();
        lifetimeOperations.incrementAndGet();
    }

    public void recordEvictions(long count) {
        if (count > 0) {
            evictions.addAndGet(count);
            lifetimeEvictions.addAndGet(count);
        }
    }

    private void recordLatency(long latencyNanos) {
        latencyTotalNanos.addAndGet(Math.max(0, latencyNanos));
        latencySamples.incrementAndGet();
    }

    /**
     * Clears the recent window. Lifetime totals are unaffected.
     */
    public void resetRecent() {
        hits.set(0);
        misses.set(0);
        evictions.set(0);
        operations.set(0);
        latencyTotalNanos.set(0);
        latencySamples.set(0);
    }

    /**
     * Clears the recent window and the lifetime totals.
     */
    public void resetAll() {
        resetRecent();
        lifetimeHits.set(0);
        lifetimeMisses.set(0);
        lifetimeEvictions.set(0);
        lifetimeOperations.set(0);
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    public long evictions() {
        return evictions.get();
    }

    public long operations() {
        return operations.get();
    }

    /**
     * Returns {@code hits / (hits + misses)} for the recent window, 0 when there were no gets.
     */
    public double hitRate() {
        long h = hits.get();
        long total = h + misses.get();
        return total == 0 ? 0.0 : (double) h / total;
    }

    /**
     * Returns the mean get latency of the recent window in milliseconds, 0 without samples.
     */
    public double meanLatencyMillis() {
        long samples = latencySamples.get();
        if (samples == 0) {
            return 0.0;
        }
        return latencyTotalNanos.get() / (double) samples / 1_000_000.0;
    }

    public long lifetimeHits() {
        return lifetimeHits.get();
    }

    public long lifetimeMisses() {
        return lifetimeMisses.get();
    }

    public long lifetimeEvictions() {
        return lifetimeEvictions.get();
    }

    public long lifetimeOperations() {
        return lifetimeOperations.get();
    }
}
