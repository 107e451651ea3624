package com.github.rudygunawan.tiercache.listener;

import com.github.rudygunawan.tiercache.policy.RemovalCause;

/**
 * A listener that receives notification when an entry leaves the fast tier.
 *
 * <p>Called synchronously on the thread that caused the removal, often while the cache lock is
 * held, so implementations must be fast, must not block, and must not call back into the cache.
 * Exceptions thrown by the listener are logged and otherwise ignored.
 *
 * <p>Usage example:
 * <pre>{@code
 * TieredCache<String> cache = TieredCacheBuilder.newBuilder()
 *     .removalListener((key, value, cause) -> {
 *         if (cause.wasEvicted()) {
 *             evicted.increment();
 *         }
 *     })
 *     .build();
 * }</pre>
 *
 * @param <V> the type of values
 */
@FunctionalInterface
public interface RemovalListener<V> {

    /**
     * Notifies the listener that an entry was removed.
     *
     * @param key the key of the removed entry
     * @param value the value of the removed entry
     * @param cause the reason for the removal
     */
    void onRemoval(String key, V value, RemovalCause cause);
}
