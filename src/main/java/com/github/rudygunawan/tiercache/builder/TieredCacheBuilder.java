package com.github.rudygunawan.tiercache.builder;

import com.github.rudygunawan.tiercache.api.SizeEstimator;
import com.github.rudygunawan.tiercache.api.Tier;
import com.github.rudygunawan.tiercache.api.TieredCache;
import com.github.rudygunawan.tiercache.exception.InvalidConfigurationException;
import com.github.rudygunawan.tiercache.impl.TieredCacheImpl;
import com.github.rudygunawan.tiercache.listener.RemovalListener;
import com.github.rudygunawan.tiercache.policy.CacheTier;
import com.github.rudygunawan.tiercache.policy.EvictionPolicy;
import com.github.rudygunawan.tiercache.policy.EvictionStrategy;
import com.github.rudygunawan.tiercache.policy.WriteMode;
import com.github.rudygunawan.tiercache.time.Ticker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

/**
 * A builder of {@link TieredCache} instances.
 *
 * <p>Every setting has a default, so {@code TieredCacheBuilder.newBuilder().build()} yields a
 * single-tier LRU cache with a 100 MiB byte budget, at most 10&nbsp;000 entries and a one hour
 * default TTL. Slower tiers are consulted in the order they are added.
 *
 * <p>Usage example:
 * <pre>{@code
 * TieredCache<byte[]> cache = TieredCacheBuilder.newBuilder()
 *     .maximumBytes(256L * 1024 * 1024)
 *     .maximumEntries(50_000)
 *     .defaultTtl(Duration.ofMinutes(30))
 *     .evictionPolicy(EvictionPolicy.LFU)
 *     .slowerTier(new ConcurrentMapTier<>(CacheTier.L2_REMOTE))
 *     .sizeEstimator(SizeEstimator.byteArrayEstimator())
 *     .build();
 * }</pre>
 *
 * <p>The same settings can be read from a {@link Properties} source with
 * {@link #fromProperties(Properties)}.
 *
 * @param <V> the type of values
 */
public class TieredCacheBuilder<V> {
    public static final long DEFAULT_MAXIMUM_BYTES = 100L * 1024 * 1024;
    public static final int DEFAULT_MAXIMUM_ENTRIES = 10_000;
    public static final Duration DEFAULT_TTL = Duration.ofHours(1);
    public static final Duration DEFAULT_TIER_TIMEOUT = Duration.ofMillis(500);
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofMinutes(5);
    public static final int DEFAULT_SWEEP_BATCH_SIZE = 100;
    public static final Duration DEFAULT_METRICS_RESET_INTERVAL = Duration.ofHours(1);

    private static final int DEFAULT_INITIAL_CAPACITY = 16;

    static final String PREFIX = "tiercache.";
    static final String MAX_BYTES = PREFIX + "fast.max-bytes";
    static final String MAX_ENTRIES = PREFIX + "fast.max-entries";
    static final String DEFAULT_TTL_SECONDS = PREFIX + "default-ttl-seconds";
    static final String EVICTION_POLICY = PREFIX + "eviction-policy";
    static final String WRITE_MODE = PREFIX + "write-mode";
    static final String TIER_TIMEOUT_MILLIS = PREFIX + "tier-timeout-millis";
    static final String SWEEP_INTERVAL_SECONDS = PREFIX + "sweep-interval-seconds";
    static final String SWEEP_BATCH_SIZE = PREFIX + "sweep-batch-size";
    static final String METRICS_RESET_INTERVAL_SECONDS = PREFIX + "metrics-reset-interval-seconds";

    private int initialCapacity = DEFAULT_INITIAL_CAPACITY;
    private long maximumBytes = DEFAULT_MAXIMUM_BYTES;
    private int maximumEntries = DEFAULT_MAXIMUM_ENTRIES;
    private long defaultTtlNanos = DEFAULT_TTL.toNanos();
    private EvictionPolicy evictionPolicy = EvictionPolicy.LRU;
    private EvictionStrategy evictionStrategy;
    private WriteMode writeMode = WriteMode.WRITE_THROUGH;
    private final List<Tier<?>> slowerTiers = new ArrayList<>();
    private long tierTimeoutNanos = DEFAULT_TIER_TIMEOUT.toNanos();
    private long sweepIntervalNanos = DEFAULT_SWEEP_INTERVAL.toNanos();
    private int sweepBatchSize = DEFAULT_SWEEP_BATCH_SIZE;
    private long metricsResetIntervalNanos = DEFAULT_METRICS_RESET_INTERVAL.toNanos();
    private SizeEstimator<? super V> sizeEstimator;
    private RemovalListener<? super V> removalListener;
    private Ticker ticker;

    private TieredCacheBuilder() {
    }

    /**
     * Constructs a new {@code TieredCacheBuilder} instance with default settings.
     */
    public static TieredCacheBuilder<Object> newBuilder() {
        return new TieredCacheBuilder<>();
    }

    /**
     * Constructs a builder from {@code tiercache.*} properties. Keys that are absent keep their
     * defaults; unknown keys are ignored.
     *
     * <p>Recognised keys: {@code tiercache.fast.max-bytes}, {@code tiercache.fast.max-entries},
     * {@code tiercache.default-ttl-seconds}, {@code tiercache.eviction-policy},
     * {@code tiercache.write-mode}, {@code tiercache.tier-timeout-millis},
     * {@code tiercache.sweep-interval-seconds}, {@code tiercache.sweep-batch-size} and
     * {@code tiercache.metrics-reset-interval-seconds}.
     *
     * @param properties the property source
     * @return a builder carrying the configured settings
     * @throws InvalidConfigurationException if a value is malformed or out of range
     */
    public static TieredCacheBuilder<Object> fromProperties(Properties properties) {
        if (properties == null) {
            throw new NullPointerException("properties cannot be null");
        }
        TieredCacheBuilder<Object> builder = newBuilder();
        String value;
        if ((value = property(properties, MAX_BYTES)) != null) {
            builder.maximumBytes(parseLong(MAX_BYTES, value));
        }
        if ((value = property(properties, MAX_ENTRIES)) != null) {
            builder.maximumEntries(parseInt(MAX_ENTRIES, value));
        }
        if ((value = property(properties, DEFAULT_TTL_SECONDS)) != null) {
            builder.defaultTtl(parseLong(DEFAULT_TTL_SECONDS, value), TimeUnit.SECONDS);
        }
        if ((value = property(properties, EVICTION_POLICY)) != null) {
            builder.evictionPolicy(parseEnum(EvictionPolicy.class, EVICTION_POLICY, value));
        }
        if ((value = property(properties, WRITE_MODE)) != null) {
            builder.writeMode(parseEnum(WriteMode.class, WRITE_MODE, value));
        }
        if ((value = property(properties, TIER_TIMEOUT_MILLIS)) != null) {
            builder.tierTimeout(parseLong(TIER_TIMEOUT_MILLIS, value), TimeUnit.MILLISECONDS);
        }
        if ((value = property(properties, SWEEP_INTERVAL_SECONDS)) != null) {
            builder.sweepInterval(parseLong(SWEEP_INTERVAL_SECONDS, value), TimeUnit.SECONDS);
        }
        if ((value = property(properties, SWEEP_BATCH_SIZE)) != null) {
            builder.sweepBatchSize(parseInt(SWEEP_BATCH_SIZE, value));
        }
        if ((value = property(properties, METRICS_RESET_INTERVAL_SECONDS)) != null) {
            builder.metricsResetInterval(parseLong(METRICS_RESET_INTERVAL_SECONDS, value), TimeUnit.SECONDS);
        }
        return builder;
    }

    /**
     * Sets the initial capacity of the fast tier's hash table.
     *
     * @throws InvalidConfigurationException if {@code initialCapacity} is negative
     */
    public TieredCacheBuilder<V> initialCapacity(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new InvalidConfigurationException("initial capacity must not be negative");
        }
        this.initialCapacity = initialCapacity;
        return this;
    }

    /**
     * Specifies the fast-tier byte budget. Entry sizes come from the {@link SizeEstimator}; a
     * single entry larger than the whole budget is rejected with a
     * {@link com.github.rudygunawan.tiercache.exception.CapacityExceededException}.
     *
     * @param bytes the maximum total estimated size of fast-tier entries
     * @return this builder instance
     * @throws InvalidConfigurationException if {@code bytes} is not positive
     */
    public TieredCacheBuilder<V> maximumBytes(long bytes) {
        if (bytes <= 0) {
            throw new InvalidConfigurationException("maximum bytes must be positive: " + bytes);
        }
        this.maximumBytes = bytes;
        return this;
    }

    /**
     * Specifies the maximum number of fast-tier entries.
     *
     * @throws InvalidConfigurationException if {@code entries} is not positive
     */
    public TieredCacheBuilder<V> maximumEntries(int entries) {
        if (entries <= 0) {
            throw new InvalidConfigurationException("maximum entries must be positive: " + entries);
        }
        this.maximumEntries = entries;
        return this;
    }

    /**
     * Specifies the TTL applied when {@code set} is called without one. Zero means entries never
     * expire through TTL unless the caller says otherwise.
     *
     * @throws InvalidConfigurationException if {@code duration} is negative
     */
    public TieredCacheBuilder<V> defaultTtl(long duration, TimeUnit unit) {
        if (duration < 0) {
            throw new InvalidConfigurationException("default TTL must not be negative");
        }
        this.defaultTtlNanos = unit.toNanos(duration);
        return this;
    }

    public TieredCacheBuilder<V> defaultTtl(Duration ttl) {
        return defaultTtl(requireDuration(ttl, "default TTL").toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Specifies the eviction policy used when a write needs room.
     *
     * <p>Available policies:
     * <ul>
     *   <li>{@link EvictionPolicy#LRU} - Least Recently Used (default)
     *   <li>{@link EvictionPolicy#LFU} - Least Frequently Used, oldest first on ties
     *   <li>{@link EvictionPolicy#TTL} - expired entries only
     *   <li>{@link EvictionPolicy#SIZE_BASED} - largest entries first
     * </ul>
     *
     * @param policy the eviction policy to use
     * @return this builder instance
     */
    public TieredCacheBuilder<V> evictionPolicy(EvictionPolicy policy) {
        if (policy == null) {
            throw new NullPointerException("eviction policy cannot be null");
        }
        this.evictionPolicy = policy;
        this.evictionStrategy = null;
        return this;
    }

    /**
     * Installs a custom eviction strategy, for instance
     * {@link EvictionStrategy#ttlWithFallback(EvictionPolicy)}. Overrides
     * {@link #evictionPolicy(EvictionPolicy)}.
     */
    public TieredCacheBuilder<V> evictionStrategy(EvictionStrategy strategy) {
        if (strategy == null) {
            throw new NullPointerException("eviction strategy cannot be null");
        }
        this.evictionStrategy = strategy;
        this.evictionPolicy = strategy.policy();
        return this;
    }

    /**
     * Specifies whether default writes are mirrored into the slower tiers.
     */
    public TieredCacheBuilder<V> writeMode(WriteMode writeMode) {
        if (writeMode == null) {
            throw new NullPointerException("write mode cannot be null");
        }
        this.writeMode = writeMode;
        return this;
    }

    /**
     * Appends a slower tier. Tiers are read in the order they are added.
     *
     * @param tier the tier; must not be the fast tier and must not repeat a tier type already added
     * @return this builder instance
     * @throws InvalidConfigurationException if the tier is the fast tier or duplicates one
     */
    public TieredCacheBuilder<V> slowerTier(Tier<?> tier) {
        if (tier == null) {
            throw new NullPointerException("tier cannot be null");
        }
        CacheTier type = tier.type();
        if (type == null || !type.isSlower()) {
            throw new InvalidConfigurationException("the fast tier cannot be registered as a slower tier");
        }
        for (Tier<?> existing : slowerTiers) {
            if (existing.type() == type) {
                throw new InvalidConfigurationException("slower tier " + type + " was already added");
            }
        }
        slowerTiers.add(tier);
        return this;
    }

    /**
     * Bounds every call to a slower tier. A call that takes longer counts as unavailable.
     *
     * @throws InvalidConfigurationException if {@code duration} is not positive
     */
    public TieredCacheBuilder<V> tierTimeout(long duration, TimeUnit unit) {
        if (duration <= 0) {
            throw new InvalidConfigurationException("tier timeout must be positive");
        }
        this.tierTimeoutNanos = unit.toNanos(duration);
        return this;
    }

    public TieredCacheBuilder<V> tierTimeout(Duration timeout) {
        return tierTimeout(requireDuration(timeout, "tier timeout").toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Sets how often the background expiry sweep runs. Zero disables it; expired entries are then
     * removed only when read or by {@link TieredCache#cleanUp()}.
     *
     * @throws InvalidConfigurationException if {@code duration} is negative
     */
    public TieredCacheBuilder<V> sweepInterval(long duration, TimeUnit unit) {
        if (duration < 0) {
            throw new InvalidConfigurationException("sweep interval must not be negative");
        }
        this.sweepIntervalNanos = unit.toNanos(duration);
        return this;
    }

    public TieredCacheBuilder<V> sweepInterval(Duration interval) {
        return sweepInterval(requireDuration(interval, "sweep interval").toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Sets how many expired entries one sweep removes per lock acquisition.
     *
     * @throws InvalidConfigurationException if {@code batchSize} is not positive
     */
    public TieredCacheBuilder<V> sweepBatchSize(int batchSize) {
        if (batchSize <= 0) {
            throw new InvalidConfigurationException("sweep batch size must be positive: " + batchSize);
        }
        this.sweepBatchSize = batchSize;
        return this;
    }

    /**
     * Sets how often the recent counters are reset. Zero disables the reset, making the recent
     * window identical to the lifetime totals until {@code clear()} is called.
     *
     * @throws InvalidConfigurationException if {@code duration} is negative
     */
    public TieredCacheBuilder<V> metricsResetInterval(long duration, TimeUnit unit) {
        if (duration < 0) {
            throw new InvalidConfigurationException("metrics reset interval must not be negative");
        }
        this.metricsResetIntervalNanos = unit.toNanos(duration);
        return this;
    }

    public TieredCacheBuilder<V> metricsResetInterval(Duration interval) {
        return metricsResetInterval(requireDuration(interval, "metrics reset interval").toNanos(),
                TimeUnit.NANOSECONDS);
    }

    /**
     * Specifies how the size of a value is estimated for the byte budget.
     *
     * <p><b>Important:</b> Instead of returning {@code this} as a {@code TieredCacheBuilder}
     * instance, this method returns {@code TieredCacheBuilder<V1>}. From this point on the builder
     * is assumed to be of the estimator's value type, and {@code build()} returns caches of that
     * type.
     *
     * @param <V1> the value type of the estimator
     * @param estimator the estimator; called once per write, outside the cache lock
     * @return this builder instance, with its type parameter adjusted to match the estimator
     */
    public <V1 extends V> TieredCacheBuilder<V1> sizeEstimator(SizeEstimator<? super V1> estimator) {
        if (estimator == null) {
            throw new NullPointerException("size estimator cannot be null");
        }
        @SuppressWarnings("unchecked")
        TieredCacheBuilder<V1> me = (TieredCacheBuilder<V1>) this;
        me.sizeEstimator = estimator;
        return me;
    }

    /**
     * Specifies a listener notified whenever an entry leaves the fast tier.
     *
     * @param <V1> the value type of the listener
     * @param listener the listener
     * @return this builder instance, with its type parameter adjusted to match the listener
     * @see RemovalListener
     */
    public <V1 extends V> TieredCacheBuilder<V1> removalListener(RemovalListener<? super V1> listener) {
        if (listener == null) {
            throw new NullPointerException("removal listener cannot be null");
        }
        @SuppressWarnings("unchecked")
        TieredCacheBuilder<V1> me = (TieredCacheBuilder<V1>) this;
        me.removalListener = listener;
        return me;
    }

    /**
     * Specifies a nanosecond-precision time source for expiry and access timestamps. Useful for
     * testing; defaults to {@link Ticker#systemTicker()}.
     */
    public TieredCacheBuilder<V> ticker(Ticker ticker) {
        if (ticker == null) {
            throw new NullPointerException("ticker cannot be null");
        }
        this.ticker = ticker;
        return this;
    }

    /**
     * Builds the cache and starts its background maintenance.
     *
     * @return a cache having the requested features
     */
    public <V1 extends V> TieredCache<V1> build() {
        return new TieredCacheImpl<V1>(this);
    }

    public int getInitialCapacity() {
        return initialCapacity;
    }

    public long getMaximumBytes() {
        return maximumBytes;
    }

    public int getMaximumEntries() {
        return maximumEntries;
    }

    public long getDefaultTtlNanos() {
        return defaultTtlNanos;
    }

    public EvictionPolicy getEvictionPolicy() {
        return evictionPolicy;
    }

    /**
     * Returns the custom strategy, or the built-in one for the configured policy.
     */
    public EvictionStrategy getEvictionStrategy() {
        return evictionStrategy != null ? evictionStrategy : EvictionStrategy.forPolicy(evictionPolicy);
    }

    public WriteMode getWriteMode() {
        return writeMode;
    }

    public List<Tier<?>> getSlowerTiers() {
        return Collections.unmodifiableList(new ArrayList<>(slowerTiers));
    }

    public long getTierTimeoutNanos() {
        return tierTimeoutNanos;
    }

    public long getSweepIntervalNanos() {
        return sweepIntervalNanos;
    }

    public int getSweepBatchSize() {
        return sweepBatchSize;
    }

    public long getMetricsResetIntervalNanos() {
        return metricsResetIntervalNanos;
    }

    public SizeEstimator<? super V> getSizeEstimator() {
        return sizeEstimator != null ? sizeEstimator : SizeEstimator.defaultEstimator();
    }

    public RemovalListener<? super V> getRemovalListener() {
        return removalListener;
    }

    public Ticker getTicker() {
        return ticker != null ? ticker : Ticker.systemTicker();
    }

    private static Duration requireDuration(Duration duration, String name) {
        if (duration == null) {
            throw new NullPointerException(name + " cannot be null");
        }
        if (duration.isNegative()) {
            throw new InvalidConfigurationException(name + " must not be negative: " + duration);
        }
        return duration;
    }

    private static String property(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            return null;
        }
        value = value.trim();
        return value.isEmpty() ? null : value;
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(key + " is not a number: " + value, e);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(key + " is not a number: " + value, e);
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String value) {
        String normalized = value.toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return Enum.valueOf(type, normalized);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException(key + " has unknown value: " + value, e);
        }
    }
}
