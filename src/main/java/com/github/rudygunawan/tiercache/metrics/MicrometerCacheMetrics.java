package com.github.rudygunawan.tiercache.metrics;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Collections;

/**
 * Micrometer integration for tiered cache metrics.
 * Binds cache statistics to a MeterRegistry for monitoring and observability.
 *
 * <p>Exposes the following metrics:
 * <ul>
 *   <li>cache.size - Current number of entries in the fast tier
 *   <li>cache.bytes - Bytes accounted to the fast tier
 *   <li>cache.hits - Total number of cache hits
 *   <li>cache.misses - Total number of cache misses
 *   <li>cache.evictions - Total number of evictions
 *   <li>cache.operations - Total number of operations
 *   <li>cache.hit.ratio - Hit rate of the recent window (0.0 to 1.0)
 *   <li>cache.latency.mean - Mean get latency of the recent window, in milliseconds
 *   <li>cache.tier.entries - Entries per tier, tagged {@code tier}
 *   <li>cache.tier.bytes - Bytes per tier, tagged {@code tier}
 * </ul>
 *
 * <p>Usage example:
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * TieredCache<String> cache = TieredCacheBuilder.newBuilder()
 *     .maximumBytes(10_000_000)
 *     .build();
 *
 * MicrometerCacheMetrics.monitor(registry, cache, "analysisCache");
 * }</pre>
 */
public class MicrometerCacheMetrics implements MeterBinder {

    private final CacheMetrics cache;
    private final String cacheName;
    private final Iterable<Tag> tags;

    /**
     * Creates a new MicrometerCacheMetrics instance.
     *
     * @param cache the cache to monitor
     * @param cacheName the name of the cache for metric tags
     * @param tags additional tags to apply to all metrics
     */
    public MicrometerCacheMetrics(CacheMetrics cache, String cacheName, Iterable<Tag> tags) {
        this.cache = cache;
        this.cacheName = cacheName;
        this.tags = tags;
    }

    /**
     * Convenience method to monitor a cache with Micrometer.
     *
     * @param registry the meter registry
     * @param cache the cache to monitor
     * @param cacheName the name of the cache
     * @param <C> the cache type
     * @return the cache (for chaining)
     */
    public static <C extends CacheMetrics> C monitor(MeterRegistry registry, C cache, String cacheName) {
        return monitor(registry, cache, cacheName, Collections.emptyList());
    }

    /**
     * Convenience method to monitor a cache with Micrometer with additional tags.
     *
     * @param registry the meter registry
     * @param cache the cache to monitor
     * @param cacheName the name of the cache
     * @param tags additional tags
     * @param <C> the cache type
     * @return the cache (for chaining)
     */
    public static <C extends CacheMetrics> C monitor(
            MeterRegistry registry, C cache, String cacheName, Iterable<Tag> tags) {
        new MicrometerCacheMetrics(cache, cacheName, tags).bindTo(registry);
        return cache;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Tags allTags = Tags.of("cache", cacheName).and(tags);

        Gauge.builder("cache.size", cache, CacheMetrics::size)
                .tags(allTags)
                .description("Current number of entries in the fast tier")
                .register(registry);

        Gauge.builder("cache.bytes", cache, CacheMetrics::usedBytes)
                .tags(allTags)
                .baseUnit("bytes")
                .description("Bytes accounted to the fast tier")
                .register(registry);

        FunctionCounter.builder("cache.hits", cache, CacheMetrics::hitCount)
                .tags(allTags)
                .description("Total number of cache hits")
                .register(registry);

        FunctionCounter.builder("cache.misses", cache, CacheMetrics::missCount)
                .tags(allTags)
                .description("Total number of cache misses")
                .register(registry);

        FunctionCounter.builder("cache.evictions", cache, CacheMetrics::evictionCount)
                .tags(allTags)
                .description("Total number of cache evictions")
                .register(registry);

        FunctionCounter.builder("cache.operations", cache, CacheMetrics::operationCount)
                .tags(allTags)
                .description("Total number of cache operations")
                .register(registry);

        Gauge.builder("cache.hit.ratio", cache, CacheMetrics::recentHitRate)
                .tags(allTags)
                .description("Hit ratio of the recent window (0.0 to 1.0)")
                .register(registry);

        Gauge.builder("cache.latency.mean", cache, CacheMetrics::meanLatencyMillis)
                .tags(allTags)
                .baseUnit("milliseconds")
                .description("Mean get latency of the recent window")
                .register(registry);

        // Per-tier breakdown
        cache.tiers().forEach(tier -> {
            Tags tierTags = allTags.and("tier", tier.name().toLowerCase());
            Gauge.builder("cache.tier.entries", cache, c -> c.tierEntries(tier))
                    .tags(tierTags)
                    .description("Number of entries held by the tier")
                    .register(registry);
            Gauge.builder("cache.tier.bytes", cache, c -> c.tierBytes(tier))
                    .tags(tierTags)
                    .baseUnit("bytes")
                    .description("Bytes held by the tier")
                    .register(registry);
        });
    }
}
