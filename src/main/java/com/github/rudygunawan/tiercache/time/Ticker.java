package com.github.rudygunawan.tiercache.time;

/**
 * A time source that returns the current time in nanoseconds.
 *
 * <p>Every timestamp the cache records (entry creation, last access, expiry checks, latency
 * measurement) is read from a ticker, so tests can drive TTL expiry and LRU ordering without
 * sleeping.
 *
 * <p><b>Testing usage:</b>
 * <pre>{@code
 * FakeTicker ticker = new FakeTicker();
 *
 * TieredCache<String> cache = TieredCacheBuilder.newBuilder()
 *     .ticker(ticker)
 *     .build();
 *
 * cache.set("report", bytes, Duration.ofSeconds(1), null);
 * ticker.advance(2, TimeUnit.SECONDS);
 * assertFalse(cache.get("report").isPresent());
 * }</pre>
 */
@FunctionalInterface
public interface Ticker {

    /**
     * Returns the number of nanoseconds elapsed since some fixed but arbitrary point in time.
     * Must have the same properties as {@link System#nanoTime()}: monotonic and unrelated to
     * wall-clock time.
     *
     * @return the number of nanoseconds elapsed since some arbitrary point in time
     */
    long read();

    /**
     * Returns a ticker that reads the current time using {@link System#nanoTime()}.
     *
     * @return the system ticker
     */
    static Ticker systemTicker() {
        return SystemTicker.INSTANCE;
    }

    /**
     * Default system ticker implementation using System.nanoTime().
     */
    enum SystemTicker implements Ticker {
        INSTANCE;

        @Override
        public long read() {
            return System.nanoTime();
        }

        @Override
        public String toString() {
            return "Ticker.systemTicker()";
        }
    }
}
