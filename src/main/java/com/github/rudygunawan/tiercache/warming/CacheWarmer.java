package com.github.rudygunawan.tiercache.warming;

import com.github.rudygunawan.tiercache.api.TieredCache;
import com.github.rudygunawan.tiercache.exception.CacheException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A priority queue of {@link WarmingRequest}s drained into a {@link TieredCache} on demand.
 *
 * <p>{@link #schedule(WarmingRequest)} is cheap and may be called from any thread. Work happens
 * in {@link #executeWarming(int)}, typically from a scheduled task or before traffic starts.
 * Only one run executes at a time; a concurrent call returns immediately with
 * {@link WarmingResult.Status#ALREADY_IN_PROGRESS}.
 *
 * <p>Usage example:
 * <pre>{@code
 * CacheWarmer<String> warmer = new CacheWarmer<>(cache);
 * warmer.schedule(WarmingRequest.of(popularDocIds, summarizer::summarize, 8));
 * WarmingResult result = warmer.executeWarming(100);
 * }</pre>
 *
 * @param <V> the type of values
 */
public class CacheWarmer<V> {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.tiercache.Warming");

    public static final int DEFAULT_MAX_ITEMS = 100;

    private final TieredCache<V> cache;
    private final PriorityQueue<Queued<V>> queue = new PriorityQueue<>(
            Comparator.<Queued<V>>comparingInt(q -> -q.request.getPriority())
                    .thenComparingLong(q -> q.sequence));
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicBoolean inProgress = new AtomicBoolean(false);

    public CacheWarmer(TieredCache<V> cache) {
        this.cache = Objects.requireNonNull(cache, "cache cannot be null");
    }

    /**
     * Queues a request behind every request of higher or equal priority.
     */
    public void schedule(WarmingRequest<V> request) {
        Objects.requireNonNull(request, "request cannot be null");
        if (request.getKeys().isEmpty()) {
            return;
        }
        synchronized (queue) {
            queue.add(new Queued<>(request, sequence.getAndIncrement()));
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Scheduled " + request.getKeys().size() + " keys for warming (priority: "
                    + request.getPriority() + ")");
        }
    }

    /**
     * Returns the number of queued requests.
     */
    public int queueSize() {
        synchronized (queue) {
            return queue.size();
        }
    }

    public WarmingResult executeWarming() {
        return executeWarming(DEFAULT_MAX_ITEMS);
    }

    /**
     * Computes and stores up to {@code maxItems} queued keys, highest priority first. A request
     * that does not fit in the remaining budget is split and its unwarmed keys stay at the head
     * of their priority.
     *
     * @param maxItems the most keys to warm in this run
     * @return the outcome of the run
     */
    public WarmingResult executeWarming(int maxItems) {
        if (maxItems <= 0) {
            throw new IllegalArgumentException("maxItems must be positive: " + maxItems);
        }
        if (!inProgress.compareAndSet(false, true)) {
            return WarmingResult.alreadyInProgress(queueSize());
        }
        long start = System.nanoTime();
        try {
            int warmed = 0;
            int failed = 0;
            List<String> errors = new ArrayList<>();
            int budget = maxItems;
            while (budget > 0) {
                Queued<V> next;
                synchronized (queue) {
                    next = queue.poll();
                    if (next != null && next.request.getKeys().size() > budget) {
                        queue.add(new Queued<>(next.request.remainderAfter(budget), next.sequence));
                    }
                }
                if (next == null) {
                    break;
                }
                List<String> keys = next.request.getKeys();
                for (String key : keys.subList(0, Math.min(budget, keys.size()))) {
                    String error = warm(next.request, key);
                    if (error == null) {
                        warmed++;
                    } else {
                        failed++;
                        errors.add(error);
                    }
                    budget--;
                }
            }
            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            WarmingResult result = new WarmingResult(WarmingResult.Status.COMPLETED, warmed, failed, errors,
                    queueSize(), duration);
            LOGGER.info("Cache warming completed: " + warmed + " items warmed, " + failed + " failed in "
                    + duration.toMillis() + " ms");
            return result;
        } finally {
            inProgress.set(false);
        }
    }

    /**
     * Warms one key, returning null on success or the error message.
     */
    private String warm(WarmingRequest<V> request, String key) {
        try {
            V value = request.getCompute().apply(key);
            if (value == null) {
                return logFailure(key, "compute function returned null", null);
            }
            cache.set(key, value, request.getTtl(), request.getTags());
            return null;
        } catch (CacheException e) {
            return logFailure(key, e.getMessage(), e);
        } catch (RuntimeException e) {
            return logFailure(key, "compute function failed: " + e, e);
        }
    }

    private static String logFailure(String key, String reason, Throwable cause) {
        String message = "Error warming key '" + key + "': " + reason;
        LOGGER.log(Level.WARNING, message, cause);
        return message;
    }

    private static final class Queued<V> {
        private final WarmingRequest<V> request;
        private final long sequence;

        private Queued(WarmingRequest<V> request, long sequence) {
            this.request = request;
            this.sequence = sequence;
        }
    }
}
