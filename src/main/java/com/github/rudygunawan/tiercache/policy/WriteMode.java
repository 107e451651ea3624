package com.github.rudygunawan.tiercache.policy;

/**
 * How a default write (one that does not name a tier) is distributed across tiers.
 */
public enum WriteMode {
    /**
     * Write to the fast tier and mirror into every configured slower tier.
     */
    WRITE_THROUGH,

    /**
     * Write to the fast tier only. Slower tiers receive data only through writes that name
     * them explicitly.
     */
    WRITE_AROUND
}
