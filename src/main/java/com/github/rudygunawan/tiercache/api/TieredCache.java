package com.github.rudygunawan.tiercache.api;

import com.github.rudygunawan.tiercache.model.CacheStats;
import com.github.rudygunawan.tiercache.policy.CacheTier;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A layered cache: a bounded in-process fast tier in front of optional slower tiers.
 *
 * <p>Reads check the fast tier first and then each slower tier in configuration order; a value
 * found in a slower tier is promoted into the fast tier before it is returned. Writes go to the
 * fast tier (evicting to stay within the byte and entry budget) and, in write-through mode, are
 * mirrored into the slower tiers. Entries can carry tags, and every entry with a given tag can be
 * dropped in one call.
 *
 * <p>Implementations are thread-safe. An instance owns background maintenance tasks and a tier
 * I/O executor; {@link #close()} releases them.
 *
 * <p>Usage example:
 * <pre>{@code
 * try (TieredCache<String> cache = TieredCacheBuilder.newBuilder()
 *         .maximumBytes(64 * 1024 * 1024)
 *         .evictionPolicy(EvictionPolicy.LRU)
 *         .slowerTier(new ConcurrentMapTier<>(CacheTier.L2_REMOTE))
 *         .build()) {
 *
 *     cache.set("doc:42:summary", summary, Duration.ofMinutes(30), List.of("doc:42"));
 *     Optional<String> hit = cache.get("doc:42:summary");
 *     cache.invalidateByTags(List.of("doc:42"));
 * }
 * }</pre>
 *
 * @param <V> the type of cached values
 */
public interface TieredCache<V> extends AutoCloseable {

    /**
     * Returns the value for {@code key}, probing the fast tier and then each slower tier.
     *
     * <p>An expired fast-tier entry counts as absent and is removed on the way. A slower tier that
     * fails or times out is skipped. Every call records exactly one hit or one miss.
     *
     * @param key the key whose value is to be returned
     * @return the value, or empty if no tier holds a live entry for {@code key}
     */
    Optional<V> get(String key);

    /**
     * Like {@link #get(String)}, but gives up once {@code timeout} has elapsed.
     *
     * @param key the key whose value is to be returned
     * @param timeout the maximum time to wait
     * @param unit the unit of {@code timeout}
     * @return the value, or empty if no tier holds a live entry for {@code key}
     * @throws TimeoutException if the deadline passed before every tier could be consulted
     */
    Optional<V> get(String key, long timeout, TimeUnit unit) throws TimeoutException;

    /**
     * Returns the value for {@code key}, computing and storing it with the default TTL if no tier
     * has it.
     *
     * @param key the key whose value is to be returned
     * @param loader computes the value on a miss; must not return null
     * @return the cached or computed value
     * @throws Exception if the loader throws; nothing is stored in that case
     */
    V getOrCompute(String key, Callable<? extends V> loader) throws Exception;

    /**
     * Stores {@code value} under {@code key} with the default TTL and no tags.
     *
     * @throws com.github.rudygunawan.tiercache.exception.CapacityExceededException if the entry
     *         cannot fit in the fast tier
     */
    void set(String key, V value);

    /**
     * Stores {@code value} under {@code key}.
     *
     * @param key the key
     * @param value the value
     * @param ttl time to live; {@code null} for the default TTL, zero for no expiry
     * @param tags invalidation tags; {@code null} or empty for none
     */
    void set(String key, V value, Duration ttl, Collection<String> tags);

    /**
     * Stores {@code value} under {@code key} in a specific tier.
     *
     * <p>With {@code tier == null} the write goes to the fast tier and follows the configured
     * write mode. With {@link CacheTier#L1_MEMORY} it goes to the fast tier only. Naming a slower
     * tier writes to that tier alone and drops any fast-tier copy, so the key never has two
     * authoritative records.
     *
     * <p>The write is all-or-nothing: when it fails, no entry, partial eviction or tag
     * registration is left behind.
     *
     * @param key the key
     * @param value the value
     * @param ttl time to live; {@code null} for the default TTL, zero for no expiry
     * @param tags invalidation tags; {@code null} or empty for none
     * @param tier the target tier, or {@code null} for the default placement
     * @throws com.github.rudygunawan.tiercache.exception.CapacityExceededException if the entry
     *         cannot fit in the fast tier even after maximal eviction
     * @throws com.github.rudygunawan.tiercache.exception.CacheException if the named slower tier
     *         is not configured or fails
     */
    void set(String key, V value, Duration ttl, Collection<String> tags, CacheTier tier);

    /**
     * Like {@link #set(String, Object, Duration, Collection, CacheTier)}, but gives up once
     * {@code timeout} has elapsed while waiting for the fast-tier lock.
     *
     * @throws TimeoutException if the deadline passed before the write could be applied; nothing
     *         is written in that case
     */
    void set(String key, V value, Duration ttl, Collection<String> tags, CacheTier tier,
             long timeout, TimeUnit unit) throws TimeoutException;

    /**
     * Removes {@code key} from every tier and from the tag index.
     *
     * @param key the key
     * @return true if any tier held the key; deleting an absent key returns false
     */
    boolean delete(String key);

    /**
     * Deletes every key registered under any of {@code tags}, as of the moment the index is read.
     *
     * @param tags the tags to invalidate
     * @return the number of keys actually removed
     */
    int invalidateByTags(Collection<String> tags);

    /**
     * Stores precomputed values with the default TTL, typically before traffic starts. A value
     * that cannot be stored is skipped; the rest of the batch still goes in.
     *
     * @param entries key/value pairs to store
     * @return the number of entries stored
     */
    int warm(Map<String, ? extends V> entries);

    /**
     * Returns a point-in-time snapshot of the counters and per-tier sizes.
     */
    CacheStats stats();

    /**
     * Removes every entry from every tier, clears the tag index and resets the recent counters.
     * Lifetime totals are kept.
     *
     * @return the number of entries removed from the fast tier
     */
    int clear();

    /**
     * Like {@link #clear()}, optionally resetting the lifetime totals as well.
     *
     * @param resetLifetimeStats whether lifetime hit, miss, eviction and operation totals are
     *                           reset too
     * @return the number of entries removed from the fast tier
     */
    int clear(boolean resetLifetimeStats);

    /**
     * Runs one expiry sweep of the fast tier now.
     *
     * @return the number of expired entries removed
     */
    int cleanUp();

    /**
     * Returns the number of entries in the fast tier.
     */
    long size();

    /**
     * Stops background maintenance and the tier I/O executor. Further calls to slower tiers fail
     * as unavailable; the fast tier stays readable.
     */
    @Override
    void close();
}
