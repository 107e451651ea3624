package com.github.rudygunawan.tiercache.exception;

/**
 * Thrown by a write when the fast tier cannot hold the new entry even after evicting every
 * candidate the eviction strategy is willing to give up. Nothing is written and nothing is
 * evicted when this is thrown.
 */
public class CapacityExceededException extends CacheException {
    private final String key;
    private final long requestedBytes;
    private final long budgetBytes;

    public CapacityExceededException(String key, long requestedBytes, long budgetBytes, String reason) {
        super("Cannot store key '" + key + "' (" + requestedBytes + " bytes, budget "
                + budgetBytes + " bytes): " + reason);
        this.key = key;
        this.requestedBytes = requestedBytes;
        this.budgetBytes = budgetBytes;
    }

    public String getKey() {
        return key;
    }

    public long getRequestedBytes() {
        return requestedBytes;
    }

    public long getBudgetBytes() {
        return budgetBytes;
    }
}
