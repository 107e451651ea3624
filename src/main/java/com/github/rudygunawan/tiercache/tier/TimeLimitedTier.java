package com.github.rudygunawan.tiercache.tier;

import com.github.rudygunawan.tiercache.api.Tier;
import com.github.rudygunawan.tiercache.exception.TierUnavailableException;
import com.github.rudygunawan.tiercache.model.CacheEntry;
import com.github.rudygunawan.tiercache.model.TierStats;
import com.github.rudygunawan.tiercache.policy.CacheTier;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounds every call to a slower tier by a timeout. The delegate runs on the supplied executor;
 * if it has not answered in time the call is cancelled and reported as a
 * {@link TierUnavailableException}, so a hung store costs one timeout rather than a blocked
 * caller.
 *
 * @param <V> the type of cached values
 */
public class TimeLimitedTier<V> implements Tier<V> {
    private final Tier<V> delegate;
    private final ExecutorService executor;
    private final long timeoutNanos;

    public TimeLimitedTier(Tier<V> delegate, ExecutorService executor, long timeoutNanos) {
        this.delegate = Objects.requireNonNull(delegate, "delegate cannot be null");
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
        if (timeoutNanos <= 0) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.timeoutNanos = timeoutNanos;
    }

    @Override
    public CacheTier type() {
        return delegate.type();
    }

    @Override
    public Optional<CacheEntry<V>> read(String key) throws TierUnavailableException {
        return read(key, timeoutNanos);
    }

    /**
     * Reads with a tighter bound than the configured timeout, for callers working against a
     * deadline. The effective bound is the smaller of the two.
     */
    public Optional<CacheEntry<V>> read(String key, long maxWaitNanos) throws TierUnavailableException {
        return call(() -> delegate.read(key), "read", Math.min(timeoutNanos, maxWaitNanos));
    }

    @Override
    public void write(CacheEntry<V> entry) throws TierUnavailableException {
        write(entry, timeoutNanos);
    }

    public void write(CacheEntry<V> entry, long maxWaitNanos) throws TierUnavailableException {
        call(() -> {
            delegate.write(entry);
            return null;
        }, "write", Math.min(timeoutNanos, maxWaitNanos));
    }

    @Override
    public boolean remove(String key) throws TierUnavailableException {
        return remove(key, timeoutNanos);
    }

    public boolean remove(String key, long maxWaitNanos) throws TierUnavailableException {
        return call(() -> delegate.remove(key), "remove", Math.min(timeoutNanos, maxWaitNanos));
    }

    @Override
    public void clear() throws TierUnavailableException {
        call(() -> {
            delegate.clear();
            return null;
        }, "clear", timeoutNanos);
    }

    @Override
    public TierStats size() throws TierUnavailableException {
        return call(delegate::size, "size", timeoutNanos);
    }

    private <T> T call(Callable<T> task, String operation, long waitNanos) throws TierUnavailableException {
        if (waitNanos <= 0) {
            throw new TierUnavailableException(type(), operation + " skipped, no time left");
        }
        Future<T> future;
        try {
            future = executor.submit(task);
        } catch (RejectedExecutionException e) {
            throw new TierUnavailableException(type(), operation + " rejected, cache is shut down", e);
        }
        try {
            return future.get(waitNanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TierUnavailableException(type(), operation + " timed out after "
                    + TimeUnit.NANOSECONDS.toMillis(waitNanos) + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TierUnavailableException(type(), operation + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TierUnavailableException) {
                throw (TierUnavailableException) cause;
            }
            throw new TierUnavailableException(type(), operation + " failed: " + cause, cause);
        }
    }

    @Override
    public String toString() {
        return "TimeLimitedTier(" + delegate + ", " + TimeUnit.NANOSECONDS.toMillis(timeoutNanos) + " ms)";
    }
}
