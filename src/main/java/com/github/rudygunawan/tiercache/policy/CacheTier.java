package com.github.rudygunawan.tiercache.policy;

/**
 * Identifies a tier of the cache. {@link #L1_MEMORY} is the mandatory in-process fast tier;
 * the others are optional slower tiers reached through {@link com.github.rudygunawan.tiercache.api.Tier}.
 */
public enum CacheTier {
    /**
     * Bounded in-process store, consulted first on every operation.
     */
    L1_MEMORY,

    /**
     * Out-of-process shared store, typically a remote key-value server.
     */
    L2_REMOTE,

    /**
     * Durable store, typically a database table.
     */
    L3_PERSISTENT;

    /**
     * Returns {@code true} for every tier except the fast tier.
     */
    public boolean isSlower() {
        return this != L1_MEMORY;
    }
}
