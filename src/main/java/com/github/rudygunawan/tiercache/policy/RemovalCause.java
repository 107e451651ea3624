package com.github.rudygunawan.tiercache.policy;

/**
 * The reason why an entry was removed from the fast tier.
 */
public enum RemovalCause {
    /**
     * The entry was removed by {@code delete}.
     */
    EXPLICIT,

    /**
     * The entry was replaced by a newer write of the same key.
     */
    REPLACED,

    /**
     * The entry was evicted to make room under the byte or entry budget.
     */
    SIZE,

    /**
     * The entry's TTL elapsed and it was removed by a read or by the expiry sweep.
     */
    EXPIRED,

    /**
     * The entry carried a tag passed to {@code invalidateByTags}.
     */
    TAG_INVALIDATED;

    /**
     * Returns {@code true} if the removal was caused by eviction (either SIZE or EXPIRED),
     * rather than by a caller.
     */
    public boolean wasEvicted() {
        return this == SIZE || this == EXPIRED;
    }
}
