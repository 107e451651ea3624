package com.github.rudygunawan.tiercache.policy;

import com.github.rudygunawan.tiercache.model.CacheEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Gives up only entries whose TTL has elapsed, in fast-tier recency order. Without a fallback,
 * unexpired entries are never selected even when that leaves the request unsatisfied.
 */
public class TtlEvictionStrategy implements EvictionStrategy {
    private final EvictionStrategy fallback;

    /**
     * @param fallback strategy applied to the unexpired entries when the expired ones are not
     *                 enough, or {@code null} for a pure TTL sweep
     */
    public TtlEvictionStrategy(EvictionStrategy fallback) {
        this.fallback = fallback;
    }

    @Override
    public List<String> selectVictims(List<? extends CacheEntry<?>> candidates,
                                      long bytesNeeded, int entriesNeeded, long now) {
        if (bytesNeeded <= 0 && entriesNeeded <= 0) {
            return Collections.emptyList();
        }
        List<CacheEntry<?>> expired = new ArrayList<>();
        List<CacheEntry<?>> live = new ArrayList<>();
        for (CacheEntry<?> entry : candidates) {
            if (entry.isExpired(now)) {
                expired.add(entry);
            } else {
                live.add(entry);
            }
        }

        List<String> victims = OrderedEvictionStrategy.takeUntilSatisfied(expired, bytesNeeded, entriesNeeded);
        if (fallback == null) {
            return victims;
        }

        long freedBytes = 0;
        Set<String> taken = new HashSet<>(victims);
        for (CacheEntry<?> entry : expired) {
            if (taken.contains(entry.getKey())) {
                freedBytes += entry.getSizeBytes();
            }
        }
        long remainingBytes = bytesNeeded - freedBytes;
        int remainingEntries = entriesNeeded - victims.size();
        if (remainingBytes <= 0 && remainingEntries <= 0) {
            return victims;
        }
        List<String> combined = new ArrayList<>(victims);
        combined.addAll(fallback.selectVictims(live, remainingBytes, remainingEntries, now));
        return combined;
    }

    @Override
    public EvictionPolicy policy() {
        return EvictionPolicy.TTL;
    }

    @Override
    public String toString() {
        return fallback == null ? "TtlEvictionStrategy" : "TtlEvictionStrategy(fallback=" + fallback + ")";
    }
}
