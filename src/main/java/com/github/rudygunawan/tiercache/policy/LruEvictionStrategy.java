package com.github.rudygunawan.tiercache.policy;

import com.github.rudygunawan.tiercache.model.CacheEntry;

import java.util.Comparator;

/**
 * Evicts the entries whose last access is oldest. Entries with identical access timestamps
 * (a coarse or fake ticker) are taken in fast-tier recency order, which the fast tier keeps
 * exact by moving every hit to the end.
 */
public class LruEvictionStrategy extends OrderedEvictionStrategy {
    private static final Comparator<CacheEntry<?>> ORDER =
            Comparator.comparingLong(CacheEntry::getLastAccessedAt);

    @Override
    protected Comparator<CacheEntry<?>> victimOrder() {
        return ORDER;
    }

    @Override
    public EvictionPolicy policy() {
        return EvictionPolicy.LRU;
    }
}
