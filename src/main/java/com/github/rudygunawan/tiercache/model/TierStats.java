package com.github.rudygunawan.tiercache.model;

import com.github.rudygunawan.tiercache.policy.CacheTier;

import java.util.Objects;

/**
 * Entry and byte counts of a single tier at the time of a snapshot. Immutable.
 */
public class TierStats {
    private final CacheTier tier;
    private final long entries;
    private final long bytes;
    private final boolean available;

    public TierStats(CacheTier tier, long entries, long bytes) {
        this(tier, entries, bytes, true);
    }

    private TierStats(CacheTier tier, long entries, long bytes, boolean available) {
        this.tier = Objects.requireNonNull(tier, "tier cannot be null");
        this.entries = entries;
        this.bytes = bytes;
        this.available = available;
    }

    /**
     * Returns stats for a tier that could not report its size.
     */
    public static TierStats unavailable(CacheTier tier) {
        return new TierStats(tier, 0, 0, false);
    }

    public CacheTier tier() {
        return tier;
    }

    public long entries() {
        return entries;
    }

    public long bytes() {
        return bytes;
    }

    /**
     * Returns false if the tier failed or timed out while being measured; counts are zero then.
     */
    public boolean isAvailable() {
        return available;
    }

    @Override
    public int hashCode() {
        return Objects.hash(tier, entries, bytes, available);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof TierStats)) {
            return false;
        }
        TierStats other = (TierStats) obj;
        return tier == other.tier
                && entries == other.entries
                && bytes == other.bytes
                && available == other.available;
    }

    @Override
    public String toString() {
        return tier + "{entries=" + entries + ", bytes=" + bytes
                + (available ? "" : ", unavailable") + '}';
    }
}
