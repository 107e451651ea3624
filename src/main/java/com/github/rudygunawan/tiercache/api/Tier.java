package com.github.rudygunawan.tiercache.api;

import com.github.rudygunawan.tiercache.exception.TierUnavailableException;
import com.github.rudygunawan.tiercache.model.CacheEntry;
import com.github.rudygunawan.tiercache.model.TierStats;
import com.github.rudygunawan.tiercache.policy.CacheTier;

import java.util.Optional;

/**
 * One storage level of a {@link TieredCache}.
 *
 * <p>The fast tier is always an in-process {@link com.github.rudygunawan.tiercache.tier.MemoryTier}.
 * Slower tiers implement this interface on top of whatever store they front (a remote key-value
 * server, a database table); the cache never needs to know which. Serialization, connection
 * handling and persistence format are the implementation's business.
 *
 * <p>A tier must tell "not there" apart from "could not ask": a missing key is an empty
 * {@link Optional}, a failure is a {@link TierUnavailableException}. The cache treats the latter
 * as a transient miss and moves on to the next tier.
 *
 * <p>Implementations must be thread-safe.
 *
 * @param <V> the type of cached values
 */
public interface Tier<V> {

    /**
     * Returns which tier this is. Each configured tier must report a distinct value.
     */
    CacheTier type();

    /**
     * Looks up an entry.
     *
     * @param key the cache key
     * @return the stored entry, or empty if the tier holds nothing for {@code key}
     * @throws TierUnavailableException if the tier failed to answer
     */
    Optional<CacheEntry<V>> read(String key) throws TierUnavailableException;

    /**
     * Stores an entry, replacing any entry with the same key.
     *
     * @param entry the entry to store
     * @throws TierUnavailableException if the tier failed to store the entry
     */
    void write(CacheEntry<V> entry) throws TierUnavailableException;

    /**
     * Removes an entry.
     *
     * @param key the cache key
     * @return true if an entry was removed
     * @throws TierUnavailableException if the tier failed to answer
     */
    boolean remove(String key) throws TierUnavailableException;

    /**
     * Removes every entry.
     *
     * @throws TierUnavailableException if the tier failed to answer
     */
    void clear() throws TierUnavailableException;

    /**
     * Returns the current entry and byte counts.
     *
     * @throws TierUnavailableException if the tier failed to answer
     */
    TierStats size() throws TierUnavailableException;
}
