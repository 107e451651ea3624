package com.github.rudygunawan.tiercache.policy;

/**
 * Eviction policy for choosing which fast-tier entries to remove when a write would exceed the
 * byte or entry budget.
 *
 * <p>Available policies:
 * <ul>
 *   <li>{@link #LRU} - Least Recently Used
 *   <li>{@link #LFU} - Least Frequently Used
 *   <li>{@link #TTL} - expired entries only
 *   <li>{@link #SIZE_BASED} - largest entries first
 * </ul>
 *
 * @see EvictionStrategy#forPolicy(EvictionPolicy)
 */
public enum EvictionPolicy {
    /**
     * Least Recently Used - evicts the entry whose last access is oldest. This is the default
     * policy and works well for most use cases.
     */
    LRU,

    /**
     * Least Frequently Used - evicts the entry with the lowest access count, oldest creation
     * time first among equals.
     */
    LFU,

    /**
     * Time To Live sweep - evicts only entries whose TTL has already elapsed. Never gives up an
     * unexpired entry, so writes can fail under pressure unless a fallback strategy is supplied
     * through {@link EvictionStrategy#ttlWithFallback(EvictionPolicy)}.
     */
    TTL,

    /**
     * Size-based - evicts the largest entries first until enough bytes are freed.
     */
    SIZE_BASED
}
