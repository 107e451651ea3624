package com.github.rudygunawan.tiercache.impl;

import com.github.rudygunawan.tiercache.api.SizeEstimator;
import com.github.rudygunawan.tiercache.api.Tier;
import com.github.rudygunawan.tiercache.api.TieredCache;
import com.github.rudygunawan.tiercache.builder.TieredCacheBuilder;
import com.github.rudygunawan.tiercache.exception.CacheException;
import com.github.rudygunawan.tiercache.exception.CapacityExceededException;
import com.github.rudygunawan.tiercache.exception.TierUnavailableException;
import com.github.rudygunawan.tiercache.listener.RemovalListener;
import com.github.rudygunawan.tiercache.metrics.CacheMetrics;
import com.github.rudygunawan.tiercache.metrics.MetricsCollector;
import com.github.rudygunawan.tiercache.model.CacheEntry;
import com.github.rudygunawan.tiercache.model.CacheStats;
import com.github.rudygunawan.tiercache.model.TierStats;
import com.github.rudygunawan.tiercache.policy.CacheTier;
import com.github.rudygunawan.tiercache.policy.EvictionStrategy;
import com.github.rudygunawan.tiercache.policy.RemovalCause;
import com.github.rudygunawan.tiercache.policy.WriteMode;
import com.github.rudygunawan.tiercache.tag.TagIndex;
import com.github.rudygunawan.tiercache.tier.MemoryTier;
import com.github.rudygunawan.tiercache.tier.TimeLimitedTier;
import com.github.rudygunawan.tiercache.time.Ticker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The cache coordinator: a {@link MemoryTier} fast tier in front of an ordered list of slower
 * tiers, with a {@link TagIndex} for bulk invalidation.
 *
 * <p>One {@link ReentrantLock} guards the fast tier and every tag index mutation. Each of the
 * following runs as a single region under that lock, so an eviction never picks an entry a read
 * is touching or promoting, and tags never disagree with the entries present:
 * <ul>
 *   <li>read: lookup, expiry check, access update;
 *   <li>write: victim selection, sufficiency check, eviction, insert, tag registration;
 *   <li>promotion: existence check, eviction, insert, tag registration;
 *   <li>delete: fast-tier removal and tag removal.
 * </ul>
 *
 * <p>Slower-tier I/O never runs under the lock. Every slower-tier call goes through a
 * {@link TimeLimitedTier} on a dedicated executor, so a hung store costs at most one tier
 * timeout per call. A per-key pending record, registered under the lock, says what the slower
 * tiers must end up holding; a writer that finds it was overtaken syncs them again.
 *
 * @param <V> the type of cached values
 */
public class TieredCacheImpl<V> implements TieredCache<V>, CacheMetrics {
    /**
     * Logger for cache operations. Logger name: "com.github.rudygunawan.tiercache.Cache"
     *
     * <p>Log levels used:
     * <ul>
     *   <li>SEVERE: A background task failed as a whole</li>
     *   <li>WARNING: Tier failures, listener failures, per-entry sweep failures (operations continue)</li>
     *   <li>INFO: Lifecycle, clear, bulk invalidation and warming totals</li>
     *   <li>FINE: Evictions, promotions and sweeps</li>
     *   <li>FINER: Entry-level operations (get, set, delete)</li>
     * </ul>
     */
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.tiercache.Cache");

    private final MemoryTier<V> fastTier;
    private final TagIndex tagIndex = new TagIndex();
    private final ReentrantLock lock = new ReentrantLock();
    private final List<TimeLimitedTier<V>> slowerTiers;
    private final Map<CacheTier, TimeLimitedTier<V>> slowerTiersByType;
    private final EvictionStrategy evictionStrategy;
    private final SizeEstimator<? super V> sizeEstimator;
    private final RemovalListener<? super V> removalListener;
    private final MetricsCollector metrics = new MetricsCollector();
    private final Ticker ticker;

    private final long maximumBytes;
    private final int maximumEntries;
    private final long defaultTtlNanos;
    private final WriteMode writeMode;
    private final long tierTimeoutNanos;
    private final int sweepBatchSize;

    // Bumped under the lock by every write, delete, invalidation and clear. A promotion that
    // started before the bump must not bring back a value the cache no longer holds.
    private long changeEpoch;

    // Keys whose slower-tier copies are being written or removed, guarded by the lock.
    private final Map<String, PendingWrite<V>> pendingWrites = new HashMap<>();

    private final ExecutorService tierExecutor;
    private final ScheduledExecutorService maintenanceScheduler;
    private final ScheduledFuture<?> sweepTask;
    private final ScheduledFuture<?> metricsResetTask;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    @SuppressWarnings("unchecked")
    public TieredCacheImpl(TieredCacheBuilder<?> builder) {
        this.fastTier = new MemoryTier<>(builder.getInitialCapacity());
        this.evictionStrategy = builder.getEvictionStrategy();
        this.sizeEstimator = (SizeEstimator<? super V>) builder.getSizeEstimator();
        this.removalListener = (RemovalListener<? super V>) builder.getRemovalListener();
        this.ticker = builder.getTicker();
        this.maximumBytes = builder.getMaximumBytes();
        this.maximumEntries = builder.getMaximumEntries();
        this.defaultTtlNanos = builder.getDefaultTtlNanos();
        this.writeMode = builder.getWriteMode();
        this.tierTimeoutNanos = builder.getTierTimeoutNanos();
        this.sweepBatchSize = builder.getSweepBatchSize();

        List<Tier<?>> configured = builder.getSlowerTiers();
        if (configured.isEmpty()) {
            this.tierExecutor = null;
            this.slowerTiers = Collections.emptyList();
            this.slowerTiersByType = Collections.emptyMap();
        } else {
            this.tierExecutor = Executors.newCachedThreadPool(daemonThreadFactory("tiercache-tier-io"));
            List<TimeLimitedTier<V>> tiers = new ArrayList<>(configured.size());
            Map<CacheTier, TimeLimitedTier<V>> byType = new EnumMap<>(CacheTier.class);
            for (Tier<?> tier : configured) {
                TimeLimitedTier<V> limited = new TimeLimitedTier<>((Tier<V>) tier, tierExecutor, tierTimeoutNanos);
                tiers.add(limited);
                byType.put(limited.type(), limited);
            }
            this.slowerTiers = Collections.unmodifiableList(tiers);
            this.slowerTiersByType = Collections.unmodifiableMap(byType);
        }

        long sweepInterval = builder.getSweepIntervalNanos();
        long resetInterval = builder.getMetricsResetIntervalNanos();
        if (sweepInterval > 0 || resetInterval > 0) {
            this.maintenanceScheduler = Executors.newSingleThreadScheduledExecutor(
                    daemonThreadFactory("tiercache-maintenance"));
            this.sweepTask = sweepInterval > 0
                    ? maintenanceScheduler.scheduleWithFixedDelay(
                            () -> runSafely("expiry sweep", this::cleanUp),
                            sweepInterval, sweepInterval, TimeUnit.NANOSECONDS)
                    : null;
            this.metricsResetTask = resetInterval > 0
                    ? maintenanceScheduler.scheduleAtFixedRate(
                            () -> runSafely("metrics reset", metrics::resetRecent),
                            resetInterval, resetInterval, TimeUnit.NANOSECONDS)
                    : null;
        } else {
            this.maintenanceScheduler = null;
            this.sweepTask = null;
            this.metricsResetTask = null;
        }

        LOGGER.info("Started tiered cache: maximumBytes=" + maximumBytes
                + ", maximumEntries=" + maximumEntries
                + ", policy=" + evictionStrategy.policy()
                + ", writeMode=" + writeMode
                + ", slowerTiers=" + slowerTiersByType.keySet());
    }

    // ---------------------------------------------------------------- reads

    @Override
    public Optional<V> get(String key) {
        try {
            return lookup(key, false, 0L);
        } catch (TimeoutException e) {
            throw new CacheException("unbounded read of key '" + key + "' timed out", e);
        }
    }

    @Override
    public Optional<V> get(String key, long timeout, TimeUnit unit) throws TimeoutException {
        Objects.requireNonNull(unit, "unit cannot be null");
        return lookup(key, true, System.nanoTime() + unit.toNanos(timeout));
    }

    @Override
    public V getOrCompute(String key, Callable<? extends V> loader) throws Exception {
        Objects.requireNonNull(loader, "loader cannot be null");
        Optional<V> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        V value = loader.call();
        if (value == null) {
            throw new NullPointerException("loader returned null for key: " + key);
        }
        set(key, value);
        return value;
    }

    private Optional<V> lookup(String key, boolean bounded, long deadline) throws TimeoutException {
        Objects.requireNonNull(key, "key cannot be null");
        long start = System.nanoTime();

        CacheEntry<V> local;
        PendingWrite<V> pending;
        CacheEntry<V> pendingLatest = null;
        long epoch;
        try {
            acquire(bounded, deadline);
        } catch (TimeoutException e) {
            metrics.recordMiss(System.nanoTime() - start);
            throw e;
        }
        try {
            local = readFastLocked(key);
            pending = local == null ? pendingWrites.get(key) : null;
            if (pending != null) {
                pendingLatest = pending.latest;
            }
            epoch = changeEpoch;
        } finally {
            lock.unlock();
        }

        if (pending != null) {
            // the slower tiers are still catching up with the newest write, which is the answer
            if (pendingLatest != null && !pendingLatest.isExpired(ticker.read())) {
                local = pendingLatest;
            } else {
                metrics.recordMiss(System.nanoTime() - start);
                return Optional.empty();
            }
        }
        if (local != null) {
            metrics.recordHit(System.nanoTime() - start);
            if (LOGGER.isLoggable(Level.FINER)) {
                LOGGER.finer("Fast tier hit: key=" + key);
            }
            return Optional.of(local.getValue());
        }

        Optional<V> promoted;
        try {
            promoted = readSlower(key, bounded, deadline, epoch);
        } catch (TimeoutException e) {
            metrics.recordMiss(System.nanoTime() - start);
            throw e;
        }
        if (promoted.isPresent()) {
            metrics.recordHit(System.nanoTime() - start);
            return promoted;
        }
        metrics.recordMiss(System.nanoTime() - start);
        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer("Cache miss: key=" + key);
        }
        return Optional.empty();
    }

    /**
     * Returns the live fast-tier entry for {@code key}, recording the access, or null. An expired
     * entry is removed on the way. Must be called while holding the lock.
     */
    private CacheEntry<V> readFastLocked(String key) {
        CacheEntry<V> entry = fastTier.read(key).orElse(null);
        if (entry == null) {
            return null;
        }
        long now = ticker.read();
        if (entry.isExpired(now)) {
            fastTier.take(key);
            tagIndex.remove(key);
            notifyRemoval(entry, RemovalCause.EXPIRED);
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Removed expired entry on read: key=" + key);
            }
            return null;
        }
        entry.recordAccess(now);
        fastTier.touch(key);
        return entry;
    }

    /**
     * Reads the slower tiers in order and promotes the first live hit. A miss becomes a
     * {@link TimeoutException} only when the deadline cut at least one read short.
     */
    private Optional<V> readSlower(String key, boolean bounded, long deadline, long epoch) throws TimeoutException {
        boolean cutShort = false;
        for (TimeLimitedTier<V> tier : slowerTiers) {
            long waitNanos = bounded ? deadline - System.nanoTime() : tierTimeoutNanos;
            Optional<CacheEntry<V>> found;
            try {
                found = tier.read(key, waitNanos);
            } catch (TierUnavailableException e) {
                if (bounded && System.nanoTime() - deadline >= 0) {
                    cutShort = true;
                    if (LOGGER.isLoggable(Level.FINE)) {
                        LOGGER.fine("Deadline reached before tier " + tier.type() + " answered: key=" + key);
                    }
                } else {
                    LOGGER.log(Level.WARNING, "Tier " + tier.type() + " unavailable on read, falling through: key="
                            + key + ", reason=" + e.getMessage());
                }
                continue;
            }
            if (!found.isPresent()) {
                continue;
            }
            CacheEntry<V> entry = found.get();
            long now = ticker.read();
            if (entry.isExpired(now)) {
                removeFromTier(tier, key);
                dropTagsIfAbsent(key);
                continue;
            }
            promote(entry, now, epoch);
            return Optional.of(entry.getValue());
        }
        if (cutShort) {
            throw new TimeoutException("read of key '" + key + "' did not reach every tier before the deadline");
        }
        return Optional.empty();
    }

    private void dropTagsIfAbsent(String key) {
        lock.lock();
        try {
            if (!fastTier.contains(key)) {
                tagIndex.remove(key);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copies a slower-tier hit into the fast tier. Skipped when anything changed since the read
     * started or the key's slower-tier copies are being rewritten; the value is returned either
     * way.
     */
    private void promote(CacheEntry<V> found, long now, long epoch) {
        String key = found.getKey();
        CacheEntry<V> promoted = found.promote(now);
        lock.lock();
        try {
            if (changeEpoch != epoch || fastTier.contains(key) || pendingWrites.containsKey(key)) {
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine("Skipped promotion after concurrent change: key=" + key);
                }
                return;
            }
            insertLocked(promoted, now);
            tagIndex.replace(key, promoted.getTags());
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Promoted entry from " + found.getTier() + ": key=" + key);
            }
        } catch (CapacityExceededException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Promotion did not fit the fast tier: " + e.getMessage());
            }
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- writes

    @Override
    public void set(String key, V value) {
        set(key, value, null, null, null);
    }

    @Override
    public void set(String key, V value, Duration ttl, Collection<String> tags) {
        set(key, value, ttl, tags, null);
    }

    @Override
    public void set(String key, V value, Duration ttl, Collection<String> tags, CacheTier tier) {
        try {
            write(key, value, ttl, tags, tier, false, 0L);
        } catch (TimeoutException e) {
            throw new CacheException("unbounded write of key '" + key + "' timed out", e);
        }
    }

    @Override
    public void set(String key, V value, Duration ttl, Collection<String> tags, CacheTier tier,
                    long timeout, TimeUnit unit) throws TimeoutException {
        Objects.requireNonNull(unit, "unit cannot be null");
        write(key, value, ttl, tags, tier, true, System.nanoTime() + unit.toNanos(timeout));
    }

    private void write(String key, V value, Duration ttl, Collection<String> tags, CacheTier tier,
                       boolean bounded, long deadline) throws TimeoutException {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        List<String> tagList = copyTags(tags);
        long ttlNanos = resolveTtl(ttl);
        long sizeBytes = estimateSize(key, value);
        metrics.recordOperation();

        if (tier != null && tier.isSlower()) {
            writeAround(key, value, ttlNanos, sizeBytes, tagList, tier, bounded, deadline);
            return;
        }
        if (sizeBytes > maximumBytes) {
            throw new CapacityExceededException(key, sizeBytes, maximumBytes,
                    "entry is larger than the whole fast tier");
        }

        boolean mirror = tier == null && writeMode == WriteMode.WRITE_THROUGH && !slowerTiers.isEmpty();
        CacheEntry<V> entry;
        acquire(bounded, deadline);
        try {
            long now = ticker.read();
            entry = new CacheEntry<>(key, value, now, ttlNanos, sizeBytes, CacheTier.L1_MEMORY, tagList, mirror);
            insertLocked(entry, now);
            tagIndex.replace(key, tagList);
            changeEpoch++;
            if (!slowerTiers.isEmpty()) {
                beginSlowerWriteLocked(key, mirror ? entry : null);
            }
        } finally {
            lock.unlock();
        }
        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer("Stored entry: key=" + key + ", sizeBytes=" + sizeBytes + ", tags=" + tagList);
        }

        // a fast-only write still clears older slower-tier copies, or eviction would expose them
        if (!slowerTiers.isEmpty()) {
            syncSlowerTiers(key, mirror ? entry : null, null, bounded, deadline);
        }
    }

    /**
     * Puts {@code entry} into the fast tier, first evicting whatever the strategy selects to make
     * room. Either the entry is stored and every selected victim is gone, or nothing changes and
     * {@link CapacityExceededException} is thrown. Must be called while holding the lock.
     */
    private void insertLocked(CacheEntry<V> entry, long now) {
        String key = entry.getKey();
        CacheEntry<V> existing = fastTier.read(key).orElse(null);
        long bytesNeeded = fastTier.usedBytes() + entry.getSizeBytes() - maximumBytes;
        int entriesNeeded = fastTier.entryCount() + 1 - maximumEntries;
        if (existing != null) {
            bytesNeeded -= existing.getSizeBytes();
            entriesNeeded -= 1;
        }

        if (bytesNeeded > 0 || entriesNeeded > 0) {
            List<CacheEntry<V>> candidates = new ArrayList<>(fastTier.entryCount());
            for (CacheEntry<V> candidate : fastTier.entriesByRecency()) {
                if (!candidate.getKey().equals(key)) {
                    candidates.add(candidate);
                }
            }
            List<String> selected = evictionStrategy.selectVictims(candidates, bytesNeeded, entriesNeeded, now);

            List<CacheEntry<V>> victims = new ArrayList<>(selected.size());
            long freedBytes = 0;
            for (String victimKey : new LinkedHashSet<>(selected)) {
                CacheEntry<V> victim = victimKey.equals(key) ? null : fastTier.read(victimKey).orElse(null);
                if (victim != null) {
                    victims.add(victim);
                    freedBytes += victim.getSizeBytes();
                }
            }
            if (freedBytes < bytesNeeded || victims.size() < entriesNeeded) {
                throw new CapacityExceededException(key, entry.getSizeBytes(), maximumBytes,
                        evictionStrategy.policy() + " eviction can free " + freedBytes + " of "
                                + Math.max(0, bytesNeeded) + " bytes and " + victims.size() + " of "
                                + Math.max(0, entriesNeeded) + " entries");
            }
            for (CacheEntry<V> victim : victims) {
                evictLocked(victim);
            }
            metrics.recordEvictions(victims.size());
        }

        CacheEntry<V> previous = fastTier.put(entry);
        if (previous != null) {
            notifyRemoval(previous, RemovalCause.REPLACED);
        }
    }

    /**
     * Drops a victim from the fast tier. Its tags go with it unless a slower tier still holds a
     * copy, in which case the eviction is a demotion and the tags stay registered so tag
     * invalidation still reaches that copy.
     */
    private void evictLocked(CacheEntry<V> victim) {
        fastTier.take(victim.getKey());
        if (!victim.isMirrored()) {
            tagIndex.remove(victim.getKey());
        }
        notifyRemoval(victim, RemovalCause.SIZE);
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Evicted entry due to byte/entry budget: key=" + victim.getKey()
                    + ", sizeBytes=" + victim.getSizeBytes() + ", policy=" + evictionStrategy.policy());
        }
    }

    private void writeAround(String key, V value, long ttlNanos, long sizeBytes, List<String> tags,
                             CacheTier target, boolean bounded, long deadline) throws TimeoutException {
        TimeLimitedTier<V> tier = slowerTiersByType.get(target);
        if (tier == null) {
            throw new CacheException("Tier " + target + " is not configured");
        }
        CacheEntry<V> entry = new CacheEntry<>(key, value, ticker.read(), ttlNanos, sizeBytes, target, tags, false);
        try {
            tier.write(entry, bounded ? deadline - System.nanoTime() : tierTimeoutNanos);
        } catch (TierUnavailableException e) {
            if (bounded && System.nanoTime() - deadline >= 0) {
                TimeoutException timeout = new TimeoutException("write of key '" + key + "' to " + target
                        + " did not finish before the deadline");
                timeout.initCause(e);
                throw timeout;
            }
            throw new CacheException("Write of key '" + key + "' to " + target + " failed", e);
        }

        // the target already holds the value, so the fast tier must follow even past the deadline
        lock.lock();
        try {
            CacheEntry<V> stale = fastTier.take(key);
            if (stale != null) {
                notifyRemoval(stale, RemovalCause.REPLACED);
            }
            tagIndex.replace(key, tags);
            changeEpoch++;
            beginSlowerWriteLocked(key, entry);
        } finally {
            lock.unlock();
        }
        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer("Stored entry in " + target + " only: key=" + key);
        }
        syncSlowerTiers(key, entry, target, bounded, deadline);
    }

    /**
     * Records that the slower tiers of {@code key} are about to be brought in line with
     * {@code latest}, or emptied of the key when it is null. Must be called while holding the
     * lock.
     */
    private void beginSlowerWriteLocked(String key, CacheEntry<V> latest) {
        PendingWrite<V> pending = pendingWrites.computeIfAbsent(key, k -> new PendingWrite<>());
        pending.latest = latest;
        pending.inFlight++;
    }

    /**
     * Writes {@code target} to every slower tier it belongs in and removes the key from the rest.
     * Only the first round of writes is bounded by the caller's deadline, and it skips
     * {@code alreadyWritten}, the tier the caller stored the value in itself. If a newer write
     * or a removal overtook this one while the I/O ran, the tiers are synced again to that newer
     * state, so a late write never leaves an overwritten value behind.
     */
    private void syncSlowerTiers(String key, CacheEntry<V> target, CacheTier alreadyWritten,
                                 boolean bounded, long deadline) {
        CacheEntry<V> current = target;
        boolean firstPass = true;
        while (true) {
            for (TimeLimitedTier<V> tier : slowerTiers) {
                if (firstPass && tier.type() == alreadyWritten) {
                    continue;
                }
                long waitNanos = firstPass && bounded ? deadline - System.nanoTime() : tierTimeoutNanos;
                applyToTier(tier, key, current, waitNanos);
            }
            lock.lock();
            try {
                PendingWrite<V> pending = pendingWrites.get(key);
                if (pending.latest == current) {
                    if (--pending.inFlight == 0) {
                        pendingWrites.remove(key);
                    }
                    return;
                }
                current = pending.latest;
            } finally {
                lock.unlock();
            }
            firstPass = false;
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Slower tiers overtaken by a newer change, syncing again: key=" + key);
            }
        }
    }

    private void applyToTier(TimeLimitedTier<V> tier, String key, CacheEntry<V> target, long waitNanos) {
        CacheTier type = tier.type();
        if (target != null && (target.isMirrored() || target.getTier() == type)) {
            try {
                tier.write(target.copyFor(type), waitNanos);
                return;
            } catch (TierUnavailableException e) {
                LOGGER.log(Level.WARNING, "Write to tier " + type + " failed, dropping its older copy: key=" + key
                        + ", reason=" + e.getMessage());
            }
        }
        // removals ignore the caller's deadline
        try {
            tier.remove(key, tierTimeoutNanos);
        } catch (TierUnavailableException e) {
            LOGGER.log(Level.WARNING, "Remove from tier " + type + " failed: key=" + key
                    + ", reason=" + e.getMessage());
        }
    }

    // ---------------------------------------------------------------- removal

    @Override
    public boolean delete(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        metrics.recordOperation();
        boolean removed = removeEverywhere(key, RemovalCause.EXPLICIT);
        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer("Deleted key=" + key + ", removed=" + removed);
        }
        return removed;
    }

    @Override
    public int invalidateByTags(Collection<String> tags) {
        Objects.requireNonNull(tags, "tags cannot be null");
        metrics.recordOperation();
        Set<String> keys = tagIndex.keysForTags(tags);
        int removed = 0;
        for (String key : keys) {
            if (removeEverywhere(key, RemovalCause.TAG_INVALIDATED)) {
                removed++;
            }
        }
        LOGGER.info("Invalidated " + removed + " of " + keys.size() + " keys for tags " + tags);
        return removed;
    }

    private boolean removeEverywhere(String key, RemovalCause cause) {
        CacheEntry<V> removed;
        lock.lock();
        try {
            removed = fastTier.take(key);
            tagIndex.remove(key);
            PendingWrite<V> pending = pendingWrites.get(key);
            if (pending != null) {
                pending.latest = null;
            }
            changeEpoch++;
        } finally {
            lock.unlock();
        }
        if (removed != null) {
            notifyRemoval(removed, cause);
        }
        boolean found = removed != null;
        for (TimeLimitedTier<V> tier : slowerTiers) {
            found |= removeFromTier(tier, key);
        }
        return found;
    }

    private boolean removeFromTier(TimeLimitedTier<V> tier, String key) {
        try {
            return tier.remove(key);
        } catch (TierUnavailableException e) {
            LOGGER.log(Level.WARNING, "Remove from tier " + tier.type() + " failed: key=" + key
                    + ", reason=" + e.getMessage());
            return false;
        }
    }

    @Override
    public int warm(Map<String, ? extends V> entries) {
        Objects.requireNonNull(entries, "entries cannot be null");
        int stored = 0;
        for (Map.Entry<String, ? extends V> e : entries.entrySet()) {
            try {
                set(e.getKey(), e.getValue());
                stored++;
            } catch (CacheException ex) {
                LOGGER.log(Level.WARNING, "Skipped warming entry: key=" + e.getKey() + ", reason=" + ex.getMessage());
            }
        }
        LOGGER.info("Warmed " + stored + " of " + entries.size() + " entries");
        return stored;
    }

    @Override
    public int clear() {
        return clear(false);
    }

    @Override
    public int clear(boolean resetLifetimeStats) {
        metrics.recordOperation();
        List<CacheEntry<V>> removed;
        lock.lock();
        try {
            removed = fastTier.entriesByRecency();
            fastTier.clear();
            tagIndex.clear();
            for (PendingWrite<V> pending : pendingWrites.values()) {
                pending.latest = null;
            }
            changeEpoch++;
        } finally {
            lock.unlock();
        }
        for (CacheEntry<V> entry : removed) {
            notifyRemoval(entry, RemovalCause.EXPLICIT);
        }
        for (TimeLimitedTier<V> tier : slowerTiers) {
            try {
                tier.clear();
            } catch (TierUnavailableException e) {
                LOGGER.log(Level.WARNING, "Clear of tier " + tier.type() + " failed: " + e.getMessage());
            }
        }
        if (resetLifetimeStats) {
            metrics.resetAll();
        } else {
            metrics.resetRecent();
        }
        LOGGER.info("Cleared " + removed.size() + " entries from the fast tier");
        return removed.size();
    }

    @Override
    public int cleanUp() {
        long now = ticker.read();
        List<String> expired;
        lock.lock();
        try {
            expired = fastTier.expiredKeys(now);
        } finally {
            lock.unlock();
        }
        if (expired.isEmpty()) {
            return 0;
        }

        int removed = 0;
        for (int from = 0; from < expired.size(); from += sweepBatchSize) {
            List<String> batch = expired.subList(from, Math.min(expired.size(), from + sweepBatchSize));
            lock.lock();
            try {
                for (String key : batch) {
                    try {
                        if (expireLocked(key, now)) {
                            removed++;
                        }
                    } catch (RuntimeException e) {
                        LOGGER.log(Level.WARNING, "Failed to expire entry: key=" + key, e);
                    }
                }
            } finally {
                lock.unlock();
            }
        }
        metrics.recordEvictions(removed);
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Expiry sweep removed " + removed + " entries");
        }
        return removed;
    }

    private boolean expireLocked(String key, long now) {
        CacheEntry<V> entry = fastTier.read(key).orElse(null);
        // replaced since the snapshot
        if (entry == null || !entry.isExpired(now)) {
            return false;
        }
        fastTier.take(key);
        tagIndex.remove(key);
        notifyRemoval(entry, RemovalCause.EXPIRED);
        return true;
    }

    // ---------------------------------------------------------------- stats

    @Override
    public CacheStats stats() {
        Map<CacheTier, TierStats> tiers = new EnumMap<>(CacheTier.class);
        tiers.put(CacheTier.L1_MEMORY, fastTier.size());
        for (TimeLimitedTier<V> tier : slowerTiers) {
            tiers.put(tier.type(), tierStats(tier));
        }
        return new CacheStats(
                metrics.hits(),
                metrics.misses(),
                metrics.evictions(),
                metrics.operations(),
                metrics.meanLatencyMillis(),
                metrics.lifetimeHits(),
                metrics.lifetimeMisses(),
                metrics.lifetimeEvictions(),
                metrics.lifetimeOperations(),
                tiers);
    }

    private TierStats tierStats(TimeLimitedTier<V> tier) {
        try {
            return tier.size();
        } catch (TierUnavailableException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Size of tier " + tier.type() + " unavailable: " + e.getMessage());
            }
            return TierStats.unavailable(tier.type());
        }
    }

    @Override
    public long size() {
        return fastTier.entryCount();
    }

    // CacheMetrics interface implementation for Micrometer integration

    @Override
    public long usedBytes() {
        return fastTier.usedBytes();
    }

    @Override
    public long hitCount() {
        return metrics.lifetimeHits();
    }

    @Override
    public long missCount() {
        return metrics.lifetimeMisses();
    }

    @Override
    public long evictionCount() {
        return metrics.lifetimeEvictions();
    }

    @Override
    public long operationCount() {
        return metrics.lifetimeOperations();
    }

    @Override
    public double recentHitRate() {
        return metrics.hitRate();
    }

    @Override
    public double meanLatencyMillis() {
        return metrics.meanLatencyMillis();
    }

    @Override
    public Set<CacheTier> tiers() {
        Set<CacheTier> tiers = EnumSet.of(CacheTier.L1_MEMORY);
        tiers.addAll(slowerTiersByType.keySet());
        return tiers;
    }

    @Override
    public long tierEntries(CacheTier tier) {
        if (tier == CacheTier.L1_MEMORY) {
            return fastTier.entryCount();
        }
        TimeLimitedTier<V> slower = slowerTiersByType.get(tier);
        return slower == null ? 0 : tierStats(slower).entries();
    }

    @Override
    public long tierBytes(CacheTier tier) {
        if (tier == CacheTier.L1_MEMORY) {
            return fastTier.usedBytes();
        }
        TimeLimitedTier<V> slower = slowerTiersByType.get(tier);
        return slower == null ? 0 : tierStats(slower).bytes();
    }

    // ---------------------------------------------------------------- lifecycle

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (sweepTask != null) {
            sweepTask.cancel(false);
        }
        if (metricsResetTask != null) {
            metricsResetTask.cancel(false);
        }
        if (maintenanceScheduler != null) {
            maintenanceScheduler.shutdown();
        }
        if (tierExecutor != null) {
            tierExecutor.shutdown();
        }
        LOGGER.info("Closed tiered cache: entries=" + fastTier.entryCount() + ", bytes=" + fastTier.usedBytes());
    }

    // ---------------------------------------------------------------- helpers

    private void acquire(boolean bounded, long deadline) throws TimeoutException {
        if (!bounded) {
            lock.lock();
            return;
        }
        try {
            if (!lock.tryLock(deadline - System.nanoTime(), TimeUnit.NANOSECONDS)) {
                throw new TimeoutException("cache lock not acquired before the deadline");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheException("Interrupted while waiting for the cache lock", e);
        }
    }

    private long resolveTtl(Duration ttl) {
        if (ttl == null) {
            return defaultTtlNanos;
        }
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative: " + ttl);
        }
        return ttl.toNanos();
    }

    private static List<String> copyTags(Collection<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> copy = new ArrayList<>(tags.size());
        for (String tag : tags) {
            copy.add(Objects.requireNonNull(tag, "tag cannot be null"));
        }
        return copy;
    }

    private long estimateSize(String key, V value) {
        try {
            long size = sizeEstimator.estimate(value);
            if (size >= 0) {
                return size;
            }
            LOGGER.log(Level.WARNING, "Size estimator returned a negative size for key: " + key
                    + ", using " + SizeEstimator.FALLBACK_SIZE_BYTES + " bytes");
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Error in size estimator for key: " + key
                    + ", using " + SizeEstimator.FALLBACK_SIZE_BYTES + " bytes", e);
        }
        return SizeEstimator.FALLBACK_SIZE_BYTES;
    }

    private void notifyRemoval(CacheEntry<V> entry, RemovalCause cause) {
        if (removalListener == null) {
            return;
        }
        try {
            removalListener.onRemoval(entry.getKey(), entry.getValue(), cause);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "RemovalListener threw exception for key: " + entry.getKey()
                    + ", cause: " + cause, e);
        }
    }

    private static void runSafely(String task, Runnable body) {
        try {
            body.run();
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Background " + task + " failed", e);
        }
    }

    private static ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class PendingWrite<V> {
        // what the slower tiers must end up holding; null when the key must be absent
        private CacheEntry<V> latest;
        private int inFlight;
    }
}
