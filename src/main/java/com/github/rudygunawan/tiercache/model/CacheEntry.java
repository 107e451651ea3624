package com.github.rudygunawan.tiercache.model;

import com.github.rudygunawan.tiercache.policy.CacheTier;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The unit of storage: a value plus the metadata the cache needs for expiry, eviction, capacity
 * accounting and tag invalidation.
 *
 * <p>All timestamps are {@link com.github.rudygunawan.tiercache.time.Ticker} readings in
 * nanoseconds. The access timestamp and access count are updated on every fast-tier hit;
 * everything else is fixed at construction. Replacing a key always creates a new entry, which is
 * the only way the access count goes back to zero.
 *
 * @param <V> the type of the cached value
 */
public class CacheEntry<V> {
    private final String key;
    private final V value;
    private final long createdAt;
    private final long ttlNanos;
    private final long sizeBytes;
    private final CacheTier tier;
    private final Set<String> tags;
    private final boolean mirrored;
    private final AtomicLong lastAccessedAt;
    private final AtomicLong accessCount;

    /**
     * Creates a new entry.
     *
     * @param key the cache key
     * @param value the value to cache
     * @param now the current ticker reading
     * @param ttlNanos the time-to-live in nanoseconds, or 0 for no expiration
     * @param sizeBytes the estimated serialized size of the value
     * @param tier the tier holding the authoritative copy
     * @param tags invalidation tags, may be empty
     * @param mirrored whether a copy of this entry also lives in a slower tier
     */
    public CacheEntry(String key, V value, long now, long ttlNanos, long sizeBytes,
                      CacheTier tier, Collection<String> tags, boolean mirrored) {
        this.key = Objects.requireNonNull(key, "key cannot be null");
        this.value = Objects.requireNonNull(value, "value cannot be null");
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("size must not be negative: " + sizeBytes);
        }
        this.createdAt = now;
        this.ttlNanos = Math.max(0, ttlNanos);
        this.sizeBytes = sizeBytes;
        this.tier = Objects.requireNonNull(tier, "tier cannot be null");
        this.tags = tags == null || tags.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        this.mirrored = mirrored;
        this.lastAccessedAt = new AtomicLong(now);
        this.accessCount = new AtomicLong(0);
    }

    public String getKey() {
        return key;
    }

    public V getValue() {
        return value;
    }

    /**
     * Returns the ticker reading when this entry was created.
     */
    public long getCreatedAt() {
        return createdAt;
    }

    /**
     * Returns the ticker reading of the most recent hit, or the creation time if never read.
     */
    public long getLastAccessedAt() {
        return lastAccessedAt.get();
    }

    /**
     * Returns the number of hits served by this entry.
     */
    public long getAccessCount() {
        return accessCount.get();
    }

    /**
     * Returns the time-to-live in nanoseconds, 0 meaning the entry never expires through TTL.
     */
    public long getTtlNanos() {
        return ttlNanos;
    }

    public boolean hasTtl() {
        return ttlNanos > 0;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public CacheTier getTier() {
        return tier;
    }

    /**
     * Returns the unmodifiable tag set.
     */
    public Set<String> getTags() {
        return tags;
    }

    /**
     * Returns true if a slower tier holds a copy of this entry, so dropping it from the fast tier
     * is a demotion rather than a removal.
     */
    public boolean isMirrored() {
        return mirrored;
    }

    /**
     * Records a hit at the given time.
     */
    public void recordAccess(long now) {
        lastAccessedAt.set(now);
        accessCount.incrementAndGet();
    }

    /**
     * Returns true once more than the TTL has elapsed since creation.
     */
    public boolean isExpired(long now) {
        return ttlNanos > 0 && now - createdAt > ttlNanos;
    }

    /**
     * Returns the nanoseconds left before expiry, {@code Long.MAX_VALUE} for entries without TTL
     * and 0 for entries that already expired.
     */
    public long remainingTtlNanos(long now) {
        if (ttlNanos <= 0) {
            return Long.MAX_VALUE;
        }
        return Math.max(0, createdAt + ttlNanos - now);
    }

    /**
     * Returns a copy of this entry to be stored in another tier. Creation time and TTL carry
     * over so the copy expires at the same instant.
     */
    public CacheEntry<V> copyFor(CacheTier targetTier) {
        CacheEntry<V> copy = new CacheEntry<>(key, value, createdAt, ttlNanos, sizeBytes,
                targetTier, tags, mirrored);
        copy.lastAccessedAt.set(lastAccessedAt.get());
        copy.accessCount.set(accessCount.get());
        return copy;
    }

    /**
     * Returns a fresh fast-tier entry for a value found in a slower tier. Timestamps and access
     * count start over; the TTL is the time this entry had left, so promotion never extends
     * the lifetime of a value.
     */
    public CacheEntry<V> promote(long now) {
        long remaining = remainingTtlNanos(now);
        long ttl = remaining == Long.MAX_VALUE ? 0 : Math.max(1, remaining);
        return new CacheEntry<>(key, value, now, ttl, sizeBytes, CacheTier.L1_MEMORY, tags, true);
    }

    @Override
    public String toString() {
        return "CacheEntry{"
                + "key='" + key + '\''
                + ", tier=" + tier
                + ", sizeBytes=" + sizeBytes
                + ", ttlNanos=" + ttlNanos
                + ", accessCount=" + accessCount.get()
                + ", tags=" + tags
                + '}';
    }
}
