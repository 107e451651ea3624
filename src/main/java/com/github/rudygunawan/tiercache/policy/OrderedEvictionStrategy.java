package com.github.rudygunawan.tiercache.policy;

import com.github.rudygunawan.tiercache.model.CacheEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Base for strategies that rank every candidate and take victims from the front of the ranking.
 * The sort is stable, so candidates that compare equal keep their recency order.
 */
abstract class OrderedEvictionStrategy implements EvictionStrategy {

    /**
     * Returns the ranking, first element evicted first.
     */
    protected abstract Comparator<CacheEntry<?>> victimOrder();

    @Override
    public List<String> selectVictims(List<? extends CacheEntry<?>> candidates,
                                      long bytesNeeded, int entriesNeeded, long now) {
        if (bytesNeeded <= 0 && entriesNeeded <= 0) {
            return Collections.emptyList();
        }
        List<CacheEntry<?>> ranked = new ArrayList<>(candidates);
        ranked.sort(victimOrder());
        return takeUntilSatisfied(ranked, bytesNeeded, entriesNeeded);
    }

    static List<String> takeUntilSatisfied(List<? extends CacheEntry<?>> ranked,
                                           long bytesNeeded, int entriesNeeded) {
        List<String> victims = new ArrayList<>();
        long freedBytes = 0;
        for (CacheEntry<?> entry : ranked) {
            if (freedBytes >= bytesNeeded && victims.size() >= entriesNeeded) {
                break;
            }
            victims.add(entry.getKey());
            freedBytes += entry.getSizeBytes();
        }
        return victims;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }
}
