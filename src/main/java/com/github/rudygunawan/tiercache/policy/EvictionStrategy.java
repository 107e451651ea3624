package com.github.rudygunawan.tiercache.policy;

import com.github.rudygunawan.tiercache.model.CacheEntry;

import java.util.List;
import java.util.Objects;

/**
 * Chooses which fast-tier entries to give up when a write needs room.
 *
 * <p>Strategies are stateless: everything they decide on is carried by the entries handed to
 * them, and they are always called while the fast-tier lock is held. An entry that a concurrent
 * read is promoting or touching is therefore never among the candidates.
 *
 * <p>Implementations must be deterministic: the same candidates in the same order with the same
 * requirements must yield the same victims in the same order.
 */
public interface EvictionStrategy {

    /**
     * Selects victims in eviction order.
     *
     * <p>The returned list is the shortest prefix of the strategy's ordering that frees at least
     * {@code bytesNeeded} bytes and at least {@code entriesNeeded} entries. If the strategy
     * cannot satisfy both, it returns every candidate it is willing to give up and the caller
     * decides whether the write can proceed.
     *
     * @param candidates the evictable entries in fast-tier recency order, least recently used first
     * @param bytesNeeded bytes that must be freed, 0 or less if none
     * @param entriesNeeded entries that must be freed, 0 or less if none
     * @param now the current ticker reading
     * @return keys of the selected victims, never null
     */
    List<String> selectVictims(List<? extends CacheEntry<?>> candidates,
                               long bytesNeeded, int entriesNeeded, long now);

    /**
     * Returns the policy this strategy implements.
     */
    EvictionPolicy policy();

    /**
     * Returns the built-in strategy for a policy.
     *
     * @param policy the eviction policy
     * @return a strategy implementing it
     */
    static EvictionStrategy forPolicy(EvictionPolicy policy) {
        Objects.requireNonNull(policy, "eviction policy cannot be null");
        return switch (policy) {
            case LRU -> new LruEvictionStrategy();
            case LFU -> new LfuEvictionStrategy();
            case TTL -> new TtlEvictionStrategy(null);
            case SIZE_BASED -> new SizeBasedEvictionStrategy();
        };
    }

    /**
     * Returns a TTL sweep strategy that gives up expired entries first and, if that is not
     * enough, falls back to another policy for the remainder.
     *
     * @param fallback the policy used once no expired entry is left; must not be TTL
     * @return the combined strategy
     */
    static EvictionStrategy ttlWithFallback(EvictionPolicy fallback) {
        Objects.requireNonNull(fallback, "fallback policy cannot be null");
        if (fallback == EvictionPolicy.TTL) {
            throw new IllegalArgumentException("fallback policy must differ from TTL");
        }
        return new TtlEvictionStrategy(forPolicy(fallback));
    }
}
