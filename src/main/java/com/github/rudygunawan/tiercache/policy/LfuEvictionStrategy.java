package com.github.rudygunawan.tiercache.policy;

import com.github.rudygunawan.tiercache.model.CacheEntry;

import java.util.Comparator;

/**
 * Evicts the entries with the smallest access count; among equals, the oldest created first,
 * then fast-tier recency order.
 */
public class LfuEvictionStrategy extends OrderedEvictionStrategy {
    private static final Comparator<CacheEntry<?>> ORDER =
            Comparator.<CacheEntry<?>>comparingLong(CacheEntry::getAccessCount)
                    .thenComparingLong(CacheEntry::getCreatedAt);

    @Override
    protected Comparator<CacheEntry<?>> victimOrder() {
        return ORDER;
    }

    @Override
    public EvictionPolicy policy() {
        return EvictionPolicy.LFU;
    }
}
