package com.github.rudygunawan.tiercache.tier;

import com.github.rudygunawan.tiercache.api.Tier;
import com.github.rudygunawan.tiercache.model.CacheEntry;
import com.github.rudygunawan.tiercache.model.TierStats;
import com.github.rudygunawan.tiercache.policy.CacheTier;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The fast tier: an insertion-ordered hash map kept in recency order, least recently used first.
 *
 * <p>Lookups are O(1) and {@link #touch(String)} moves a key to the most-recently-used end in
 * O(1). The map itself is not synchronized: every mutating call must be made while holding the
 * owning cache's lock. The entry and byte totals are volatile so statistics can be read without
 * that lock.
 *
 * @param <V> the type of cached values
 */
public class MemoryTier<V> implements Tier<V> {
    private final LinkedHashMap<String, CacheEntry<V>> entries;
    private volatile long usedBytes;
    private volatile int entryCount;

    public MemoryTier(int initialCapacity) {
        this.entries = new LinkedHashMap<>(initialCapacity, 0.75f, false);
    }

    @Override
    public CacheTier type() {
        return CacheTier.L1_MEMORY;
    }

    /**
     * Returns the entry for {@code key} without changing its recency position.
     */
    @Override
    public Optional<CacheEntry<V>> read(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Stores {@code entry} at the most-recently-used end. Does not enforce any budget; callers
     * evict first.
     */
    @Override
    public void write(CacheEntry<V> entry) {
        put(entry);
    }

    /**
     * Stores {@code entry} at the most-recently-used end and returns the entry it replaced.
     */
    public CacheEntry<V> put(CacheEntry<V> entry) {
        Objects.requireNonNull(entry, "entry cannot be null");
        CacheEntry<V> previous = entries.remove(entry.getKey());
        entries.put(entry.getKey(), entry);
        long bytes = usedBytes + entry.getSizeBytes();
        if (previous != null) {
            bytes -= previous.getSizeBytes();
        }
        usedBytes = bytes;
        entryCount = entries.size();
        return previous;
    }

    @Override
    public boolean remove(String key) {
        return take(key) != null;
    }

    /**
     * Removes and returns the entry for {@code key}, or {@code null} if absent.
     */
    public CacheEntry<V> take(String key) {
        CacheEntry<V> removed = entries.remove(key);
        if (removed != null) {
            usedBytes = usedBytes - removed.getSizeBytes();
            entryCount = entries.size();
        }
        return removed;
    }

    /**
     * Moves {@code key} to the most-recently-used end.
     */
    public void touch(String key) {
        CacheEntry<V> entry = entries.remove(key);
        if (entry != null) {
            entries.put(key, entry);
        }
    }

    /**
     * Returns a snapshot of the entries, least recently used first.
     */
    public List<CacheEntry<V>> entriesByRecency() {
        return new ArrayList<>(entries.values());
    }

    /**
     * Returns the keys of the entries that are expired at {@code now}, least recently used first.
     */
    public List<String> expiredKeys(long now) {
        List<String> expired = new ArrayList<>();
        for (Map.Entry<String, CacheEntry<V>> e : entries.entrySet()) {
            if (e.getValue().isExpired(now)) {
                expired.add(e.getKey());
            }
        }
        return expired;
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    @Override
    public void clear() {
        entries.clear();
        usedBytes = 0;
        entryCount = 0;
    }

    @Override
    public TierStats size() {
        return new TierStats(CacheTier.L1_MEMORY, entryCount, usedBytes);
    }

    public long usedBytes() {
        return usedBytes;
    }

    public int entryCount() {
        return entryCount;
    }
}
