package com.github.rudygunawan.tiercache.exception;

import com.github.rudygunawan.tiercache.policy.CacheTier;

/**
 * Signals that a tier could not answer a request: the backing store is unreachable, failed, or
 * did not respond within its timeout. This is distinct from "not found"; callers are expected
 * to fall through to the next tier instead of recording a permanent miss.
 */
public class TierUnavailableException extends Exception {
    private final CacheTier tier;

    public TierUnavailableException(CacheTier tier, String message) {
        super(tier + " unavailable: " + message);
        this.tier = tier;
    }

    public TierUnavailableException(CacheTier tier, String message, Throwable cause) {
        super(tier + " unavailable: " + message, cause);
        this.tier = tier;
    }

    /**
     * Returns the tier that failed.
     */
    public CacheTier getTier() {
        return tier;
    }
}
