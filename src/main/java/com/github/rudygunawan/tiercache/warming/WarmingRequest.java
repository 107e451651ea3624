package com.github.rudygunawan.tiercache.warming;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * A batch of keys to precompute and store, with the function that computes each value.
 *
 * <p>Requests with a higher priority are warmed first; requests of equal priority are warmed in
 * the order they were scheduled.
 *
 * @param <V> the type of values
 */
public final class WarmingRequest<V> {
    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 10;
    public static final int DEFAULT_PRIORITY = 5;

    private final List<String> keys;
    private final Function<String, ? extends V> compute;
    private final int priority;
    private final Duration ttl;
    private final List<String> tags;

    /**
     * @param keys the keys to warm, in order
     * @param compute computes the value for a key; a null result counts as a failure
     * @param priority 1 to 10, higher first
     * @param ttl time to live of warmed entries, or {@code null} for the cache default
     * @param tags tags attached to every warmed entry, may be {@code null}
     */
    public WarmingRequest(Collection<String> keys, Function<String, ? extends V> compute, int priority,
                          Duration ttl, Collection<String> tags) {
        Objects.requireNonNull(keys, "keys cannot be null");
        this.compute = Objects.requireNonNull(compute, "compute function cannot be null");
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new IllegalArgumentException("priority must be between " + MIN_PRIORITY + " and "
                    + MAX_PRIORITY + ": " + priority);
        }
        List<String> keyCopy = new ArrayList<>(keys.size());
        for (String key : keys) {
            keyCopy.add(Objects.requireNonNull(key, "key cannot be null"));
        }
        this.keys = Collections.unmodifiableList(keyCopy);
        this.priority = priority;
        this.ttl = ttl;
        this.tags = tags == null ? Collections.emptyList() : List.copyOf(tags);
    }

    public static <V> WarmingRequest<V> of(Collection<String> keys, Function<String, ? extends V> compute) {
        return new WarmingRequest<>(keys, compute, DEFAULT_PRIORITY, null, null);
    }

    public static <V> WarmingRequest<V> of(Collection<String> keys, Function<String, ? extends V> compute,
                                           int priority) {
        return new WarmingRequest<>(keys, compute, priority, null, null);
    }

    public List<String> getKeys() {
        return keys;
    }

    public Function<String, ? extends V> getCompute() {
        return compute;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Returns the TTL for warmed entries, or {@code null} for the cache default.
     */
    public Duration getTtl() {
        return ttl;
    }

    public List<String> getTags() {
        return tags;
    }

    /**
     * Returns a request for the keys after the first {@code count}, keeping everything else.
     */
    WarmingRequest<V> remainderAfter(int count) {
        return new WarmingRequest<>(keys.subList(count, keys.size()), compute, priority, ttl, tags);
    }

    @Override
    public String toString() {
        return "WarmingRequest{keys=" + keys.size() + ", priority=" + priority + ", tags=" + tags + '}';
    }
}
