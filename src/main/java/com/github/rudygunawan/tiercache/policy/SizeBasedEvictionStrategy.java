package com.github.rudygunawan.tiercache.policy;

import com.github.rudygunawan.tiercache.model.CacheEntry;

import java.util.Comparator;

/**
 * Evicts the largest entries first until the freed bytes cover the request. Entries of equal
 * size are taken in fast-tier recency order, least recently used first.
 */
public class SizeBasedEvictionStrategy extends OrderedEvictionStrategy {
    private static final Comparator<CacheEntry<?>> ORDER =
            Comparator.<CacheEntry<?>>comparingLong(CacheEntry::getSizeBytes).reversed();

    @Override
    protected Comparator<CacheEntry<?>> victimOrder() {
        return ORDER;
    }

    @Override
    public EvictionPolicy policy() {
        return EvictionPolicy.SIZE_BASED;
    }
}
