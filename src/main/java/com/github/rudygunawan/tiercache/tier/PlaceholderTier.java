package com.github.rudygunawan.tiercache.tier;

import com.github.rudygunawan.tiercache.api.Tier;
import com.github.rudygunawan.tiercache.model.CacheEntry;
import com.github.rudygunawan.tiercache.model.TierStats;
import com.github.rudygunawan.tiercache.policy.CacheTier;

import java.util.Objects;
import java.util.Optional;

/**
 * A slower tier that stores nothing: reads always miss, writes are accepted and dropped, and
 * removes report that nothing was there. Lets a deployment wire in an L2/L3 slot before the
 * real store exists.
 *
 * @param <V> the type of cached values
 */
public class PlaceholderTier<V> implements Tier<V> {
    private final CacheTier type;

    public PlaceholderTier(CacheTier type) {
        this.type = Objects.requireNonNull(type, "tier cannot be null");
        if (!type.isSlower()) {
            throw new IllegalArgumentException("PlaceholderTier cannot act as " + type);
        }
    }

    @Override
    public CacheTier type() {
        return type;
    }

    @Override
    public Optional<CacheEntry<V>> read(String key) {
        return Optional.empty();
    }

    @Override
    public void write(CacheEntry<V> entry) {
    }

    @Override
    public boolean remove(String key) {
        return false;
    }

    @Override
    public void clear() {
    }

    @Override
    public TierStats size() {
        return new TierStats(type, 0, 0);
    }

    @Override
    public String toString() {
        return "PlaceholderTier(" + type + ")";
    }
}
