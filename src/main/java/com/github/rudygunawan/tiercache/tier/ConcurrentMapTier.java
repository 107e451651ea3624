package com.github.rudygunawan.tiercache.tier;

import com.github.rudygunawan.tiercache.api.Tier;
import com.github.rudygunawan.tiercache.model.CacheEntry;
import com.github.rudygunawan.tiercache.model.TierStats;
import com.github.rudygunawan.tiercache.policy.CacheTier;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A slower tier backed by an unbounded in-process concurrent map.
 *
 * <p>Useful as a large secondary tier behind a small fast tier, and as a stand-in for a remote
 * store in tests and local development. Entries are stored as tier-specific copies.
 *
 * @param <V> the type of cached values
 */
public class ConcurrentMapTier<V> implements Tier<V> {
    private final CacheTier type;
    private final ConcurrentHashMap<String, CacheEntry<V>> storage = new ConcurrentHashMap<>();

    public ConcurrentMapTier(CacheTier type) {
        this.type = Objects.requireNonNull(type, "tier cannot be null");
        if (!type.isSlower()) {
            throw new IllegalArgumentException("ConcurrentMapTier cannot act as " + type);
        }
    }

    @Override
    public CacheTier type() {
        return type;
    }

    @Override
    public Optional<CacheEntry<V>> read(String key) {
        return Optional.ofNullable(storage.get(key));
    }

    @Override
    public void write(CacheEntry<V> entry) {
        storage.put(entry.getKey(), entry.getTier() == type ? entry : entry.copyFor(type));
    }

    @Override
    public boolean remove(String key) {
        return storage.remove(key) != null;
    }

    @Override
    public void clear() {
        storage.clear();
    }

    @Override
    public TierStats size() {
        long bytes = 0;
        long count = 0;
        for (CacheEntry<V> entry : storage.values()) {
            bytes += entry.getSizeBytes();
            count++;
        }
        return new TierStats(type, count, bytes);
    }

    @Override
    public String toString() {
        return "ConcurrentMapTier(" + type + ")";
    }
}
