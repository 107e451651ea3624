package com.github.rudygunawan.tiercache;

import com.github.rudygunawan.tiercache.api.Tier;
import com.github.rudygunawan.tiercache.api.TieredCache;
import com.github.rudygunawan.tiercache.builder.TieredCacheBuilder;
import com.github.rudygunawan.tiercache.exception.CacheException;
import com.github.rudygunawan.tiercache.exception.CapacityExceededException;
import com.github.rudygunawan.tiercache.exception.TierUnavailableException;
import com.github.rudygunawan.tiercache.metrics.CacheMetrics;
import com.github.rudygunawan.tiercache.model.CacheEntry;
import com.github.rudygunawan.tiercache.model.CacheStats;
import com.github.rudygunawan.tiercache.model.TierStats;
import com.github.rudygunawan.tiercache.policy.CacheTier;
import com.github.rudygunawan.tiercache.policy.EvictionPolicy;
import com.github.rudygunawan.tiercache.policy.RemovalCause;
import com.github.rudygunawan.tiercache.policy.WriteMode;
import com.github.rudygunawan.tiercache.tier.ConcurrentMapTier;
import com.github.rudygunawan.tiercache.time.FakeTicker;
import com.github.rudygunawan.tiercache.time.Ticker;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class TieredCacheTest {

    private static TieredCacheBuilder<Object> quietBuilder() {
        return TieredCacheBuilder.newBuilder()
                .sweepInterval(0, TimeUnit.SECONDS)
                .metricsResetInterval(0, TimeUnit.SECONDS);
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            assertTrue(System.nanoTime() - deadline < 0, "condition not met within 5 seconds");
            Thread.sleep(10);
        }
    }

    @Test
    void testBasicOperations() {
        try (TieredCache<String> cache = quietBuilder().build()) {
            cache.set("key1", "value1");
            assertEquals(Optional.of("value1"), cache.get("key1"));
            assertEquals(Optional.empty(), cache.get("missing"));

            cache.set("key2", "value2");
            assertEquals(2, cache.size());

            assertTrue(cache.delete("key1"));
            assertEquals(Optional.empty(), cache.get("key1"));
            assertEquals(1, cache.size());
        }
    }

    @Test
    void testLruEvictsLeastRecentlyUsedEntry() {
        try (TieredCache<String> cache = quietBuilder()
                .maximumBytes(100)
                .evictionPolicy(EvictionPolicy.LRU)
                .sizeEstimator(value -> 40)
                .build()) {

            cache.set("A", "a");
            cache.set("B", "b");
            assertEquals(80, cache.stats().tier(CacheTier.L1_MEMORY).bytes());

            assertTrue(cache.get("A").isPresent());
            cache.set("C", "c");

            assertEquals(Optional.of("a"), cache.get("A"));
            assertEquals(Optional.of("c"), cache.get("C"));
            assertEquals(Optional.empty(), cache.get("B"));
            assertEquals(1, cache.stats().evictionCount());
            assertEquals(80, cache.stats().tier(CacheTier.L1_MEMORY).bytes());
        }
    }

    @Test
    void testEntryCountLimitEvicts() {
        try (TieredCache<String> cache = quietBuilder()
                .maximumEntries(2)
                .build()) {

            cache.set("one", "1");
            cache.set("two", "2");
            cache.set("three", "3");

            assertEquals(2, cache.size());
            assertEquals(Optional.empty(), cache.get("one"));
            assertEquals(Optional.of("3"), cache.get("three"));
        }
    }

    @Test
    void testInvalidateByTags() {
        try (TieredCache<String> cache = quietBuilder().build()) {
            cache.set("X", "x", null, List.of("t1", "t2"));
            cache.set("Y", "y", null, List.of("t2"));
            cache.set("W", "w", null, List.of("t3"));

            assertEquals(2, cache.invalidateByTags(List.of("t2")));

            assertEquals(Optional.empty(), cache.get("X"));
            assertEquals(Optional.empty(), cache.get("Y"));
            assertEquals(Optional.of("w"), cache.get("W"));

            // t1 went with X
            assertEquals(0, cache.invalidateByTags(List.of("t1")));
        }
    }

    @Test
    void testOverwriteReplacesTags() {
        try (TieredCache<String> cache = quietBuilder().build()) {
            cache.set("doc", "v1", null, List.of("old"));
            cache.set("doc", "v2", null, List.of("new"));

            assertEquals(0, cache.invalidateByTags(List.of("old")));
            assertEquals(Optional.of("v2"), cache.get("doc"));
            assertEquals(1, cache.invalidateByTags(List.of("new")));
        }
    }

    @Test
    void testTtlExpiry() {
        FakeTicker ticker = new FakeTicker();
        try (TieredCache<String> cache = quietBuilder().ticker(ticker).build()) {
            cache.set("Z", "z", Duration.ofSeconds(1), List.of("zt"));
            assertEquals(Optional.of("z"), cache.get("Z"));

            ticker.advance(2, TimeUnit.SECONDS);

            assertEquals(Optional.empty(), cache.get("Z"));
            assertEquals(0, cache.size());
            assertEquals(0, cache.invalidateByTags(List.of("zt")));
        }
    }

    @Test
    void testExpiryIsStrictlyAfterTtl() {
        FakeTicker ticker = new FakeTicker();
        try (TieredCache<String> cache = quietBuilder().ticker(ticker).build()) {
            cache.set("k", "v", Duration.ofSeconds(1), null);

            ticker.advance(1, TimeUnit.SECONDS);
            assertEquals(Optional.of("v"), cache.get("k"));

            ticker.advance(1);
            assertEquals(Optional.empty(), cache.get("k"));
        }
    }

    @Test
    void testDefaultTtlAndZeroTtl() {
        FakeTicker ticker = new FakeTicker();
        try (TieredCache<String> cache = quietBuilder()
                .ticker(ticker)
                .defaultTtl(Duration.ofSeconds(5))
                .build()) {

            cache.set("defaulted", "d");
            cache.set("forever", "f", Duration.ZERO, null);

            ticker.advance(10, TimeUnit.DAYS);

            assertEquals(Optional.empty(), cache.get("defaulted"));
            assertEquals(Optional.of("f"), cache.get("forever"));
        }
    }

    @Test
    void testCleanUpRemovesExpiredEntries() {
        FakeTicker ticker = new FakeTicker();
        try (TieredCache<String> cache = quietBuilder()
                .ticker(ticker)
                .sweepBatchSize(2)
                .build()) {

            for (int i = 0; i < 5; i++) {
                cache.set("short" + i, "v", Duration.ofSeconds(1), List.of("batch"));
            }
            cache.set("long", "v", Duration.ofHours(1), null);

            ticker.advance(2, TimeUnit.SECONDS);

            assertEquals(5, cache.cleanUp());
            assertEquals(1, cache.size());
            assertEquals(5, cache.stats().evictionCount());
            assertEquals(0, cache.invalidateByTags(List.of("batch")));
            assertEquals(0, cache.cleanUp());
        }
    }

    @Test
    void testDeleteIsIdempotent() {
        try (TieredCache<String> cache = quietBuilder().build()) {
            cache.set("k", "v", null, List.of("t"));

            assertTrue(cache.delete("k"));
            assertFalse(cache.delete("k"));
            assertFalse(cache.delete("never-set"));
            assertEquals(0, cache.invalidateByTags(List.of("t")));
        }
    }

    @Test
    void testPromotionFromSlowerTier() throws Exception {
        ConcurrentMapTier<String> l2 = new ConcurrentMapTier<>(CacheTier.L2_REMOTE);
        try (TieredCache<String> cache = quietBuilder().slowerTier(l2).build()) {
            cache.set("remote", "value", null, List.of("t"), CacheTier.L2_REMOTE);
            assertEquals(0, cache.size());
            assertTrue(l2.read("remote").isPresent());

            assertEquals(Optional.of("value"), cache.get("remote"));

            assertEquals(1, cache.size());
            CacheStats stats = cache.stats();
            assertEquals(1, stats.tier(CacheTier.L1_MEMORY).entries());
            assertEquals(1, stats.tier(CacheTier.L2_REMOTE).entries());
            assertEquals(1, stats.hitCount());

            assertEquals(1, cache.invalidateByTags(List.of("t")));
            assertFalse(l2.read("remote").isPresent());
        }
    }

    @Test
    void testPromotionKeepsRemainingTtl() {
        FakeTicker ticker = new FakeTicker();
        ConcurrentMapTier<String> l2 = new ConcurrentMapTier<>(CacheTier.L2_REMOTE);
        try (TieredCache<String> cache = quietBuilder().ticker(ticker).slowerTier(l2).build()) {
            cache.set("k", "v", Duration.ofSeconds(10), null, CacheTier.L2_REMOTE);

            ticker.advance(8, TimeUnit.SECONDS);
            assertEquals(Optional.of("v"), cache.get("k"));

            ticker.advance(3, TimeUnit.SECONDS);
            assertEquals(Optional.empty(), cache.get("k"));
            assertEquals(0, cache.size());
        }
    }

    @Test
    void testWriteThroughMirrorsIntoSlowerTiers() throws Exception {
        ConcurrentMapTier<String> l2 = new ConcurrentMapTier<>(CacheTier.L2_REMOTE);
        try (TieredCache<String> cache = quietBuilder().slowerTier(l2).build()) {
            cache.set("k", "v");

            Optional<CacheEntry<String>> mirrored = l2.read("k");
            assertTrue(mirrored.isPresent());
            assertEquals("v", mirrored.get().getValue());
            assertEquals(CacheTier.L2_REMOTE, mirrored.get().getTier());

            assertTrue(cache.delete("k"));
            assertFalse(l2.read("k").isPresent());
        }
    }

    @Test
    void testWriteAroundModeKeepsValueOutOfSlowerTiers() throws Exception {
        ConcurrentMapTier<String> l2 = new ConcurrentMapTier<>(CacheTier.L2_REMOTE);
        try (TieredCache<String> cache = quietBuilder()
                .writeMode(WriteMode.WRITE_AROUND)
                .slowerTier(l2)
                .build()) {

            cache.set("k", "v");

            assertEquals(1, cache.size());
            assertFalse(l2.read("k").isPresent());
        }
    }

    @Test
    void testWriteAroundModeDropsOlderSlowerCopy() throws Exception {
        ConcurrentMapTier<String> l2 = new ConcurrentMapTier<>(CacheTier.L2_REMOTE);
        try (TieredCache<String> cache = quietBuilder()
                .writeMode(WriteMode.WRITE_AROUND)
                .slowerTier(l2)
                .build()) {

            cache.set("k", "old", null, List.of("t"), CacheTier.L2_REMOTE);
            assertTrue(l2.read("k").isPresent());

            cache.set("k", "new");

            assertFalse(l2.read("k").isPresent());
            assertEquals(Optional.of("new"), cache.get("k"));
            assertTrue(cache.delete("k"));
            assertEquals(Optional.empty(), cache.get("k"));
        }
    }

    @Test
    void testFastOnlyWriteDropsOlderSlowerCopy() throws Exception {
        ConcurrentMapTier<String> l2 = new ConcurrentMapTier<>(CacheTier.L2_REMOTE);
        try (TieredCache<String> cache = quietBuilder()
                .maximumBytes(100)
                .evictionPolicy(EvictionPolicy.LRU)
                .sizeEstimator(value -> 40)
                .slowerTier(l2)
                .build()) {

            cache.set("k", "v1", null, List.of("t1"));
            assertTrue(l2.read("k").isPresent());

            cache.set("k", "v2", null, List.of("t2"), CacheTier.L1_MEMORY);
            assertFalse(l2.read("k").isPresent());

            // k is the least recently used entry and goes first
            cache.set("a", "a");
            cache.set("b", "b");
            assertEquals(2, cache.size());

            assertEquals(Optional.empty(), cache.get("k"));
            assertEquals(0, cache.invalidateByTags(List.of("t1")));
        }
    }

    @Test
    @Timeout(10)
    void testLateMirrorWriteDoesNotOverwriteNewerValue() throws Exception {
        BlockingWriteTier l2 = new BlockingWriteTier(CacheTier.L2_REMOTE, "v1");
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try (TieredCache<String> cache = quietBuilder()
                .maximumBytes(100)
                .evictionPolicy(EvictionPolicy.LRU)
                .sizeEstimator(value -> 40)
                .tierTimeout(5, TimeUnit.SECONDS)
                .slowerTier(l2)
                .build()) {

            Future<?> first = executor.submit(() -> cache.set("k", "v1"));
            assertTrue(l2.entered.await(5, TimeUnit.SECONDS));

            cache.set("k", "v2");
            l2.release.countDown();
            first.get(5, TimeUnit.SECONDS);

            assertEquals("v2", l2.read("k").get().getValue());

            cache.set("a", "a");
            cache.set("b", "b");
            assertEquals(2, cache.size());
            assertEquals(Optional.of("v2"), cache.get("k"));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @Timeout(10)
    void testDeleteDuringMirrorWriteKeepsKeyAbsent() throws Exception {
        BlockingWriteTier l2 = new BlockingWriteTier(CacheTier.L2_REMOTE, "v1");
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try (TieredCache<String> cache = quietBuilder()
                .tierTimeout(5, TimeUnit.SECONDS)
                .slowerTier(l2)
                .build()) {

            Future<?> first = executor.submit(() -> cache.set("k", "v1", null, List.of("t")));
            assertTrue(l2.entered.await(5, TimeUnit.SECONDS));

            assertTrue(cache.delete("k"));
            // the held write has not landed yet, but the key already reads as deleted
            assertEquals(Optional.empty(), cache.get("k"));

            l2.release.countDown();
            first.get(5, TimeUnit.SECONDS);

            assertFalse(l2.read("k").isPresent());
            assertEquals(Optional.empty(), cache.get("k"));
            assertEquals(0, cache.invalidateByTags(List.of("t")));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testEvictedMirroredEntryStaysReachable() throws Exception {
        ConcurrentMapTier<String> l2 = new ConcurrentMapTier<>(CacheTier.L2_REMOTE);
        try (TieredCache<String> cache = quietBuilder()
                .maximumBytes(100)
                .sizeEstimator(value -> 40)
                .slowerTier(l2)
                .build()) {

            cache.set("A", "a", null, List.of("ta"));
            cache.set("B", "b");
            cache.set("C", "c");
            assertEquals(2, cache.size());

            // A was demoted, not lost
            assertEquals(Optional.of("a"), cache.get("A"));
            assertEquals(2, cache.size());

            assertEquals(1, cache.invalidateByTags(List.of("ta")));
            assertEquals(Optional.empty(), cache.get("A"));
            assertFalse(l2.read("A").isPresent());
        }
    }

    @Test
    void testExplicitSlowerTierWriteDropsFastCopy() throws Exception {
        ConcurrentMapTier<String> l2 = new ConcurrentMapTier<>(CacheTier.L2_REMOTE);
        try (TieredCache<String> cache = quietBuilder().slowerTier(l2).build()) {
            cache.set("k", "old", null, null, CacheTier.L1_MEMORY);
            assertEquals(1, cache.size());
            assertFalse(l2.read("k").isPresent());

            cache.set("k", "new", null, null, CacheTier.L2_REMOTE);

            assertEquals(0, cache.size());
            assertEquals(Optional.of("new"), cache.get("k"));
        }
    }

    @Test
    void testWriteToUnconfiguredTierFails() {
        try (TieredCache<String> cache = quietBuilder().build()) {
            assertThrows(CacheException.class,
                    () -> cache.set("k", "v", null, null, CacheTier.L3_PERSISTENT));
            assertEquals(0, cache.size());
        }
    }

    @Test
    void testHitRateArithmetic() {
        try (TieredCache<String> cache = quietBuilder().build()) {
            assertEquals(0.0, cache.stats().hitRate());

            cache.set("k", "v");
            cache.get("k");
            cache.get("k");
            cache.get("k");
            cache.get("missing");

            CacheStats stats = cache.stats();
            assertEquals(3, stats.hitCount());
            assertEquals(1, stats.missCount());
            assertEquals(0.75, stats.hitRate());
            // one set plus four gets
            assertEquals(5, stats.operationCount());
        }
    }

    @Test
    void testCapacityExceededForOversizedEntry() {
        try (TieredCache<String> cache = quietBuilder()
                .maximumBytes(100)
                .sizeEstimator((String value) -> value.length())
                .build()) {

            cache.set("small", "x".repeat(50), null, List.of("t"));

            CapacityExceededException e = assertThrows(CapacityExceededException.class,
                    () -> cache.set("big", "y".repeat(101), null, List.of("t")));
            assertEquals("big", e.getKey());
            assertEquals(101, e.getRequestedBytes());
            assertEquals(100, e.getBudgetBytes());

            assertEquals(Optional.of("x".repeat(50)), cache.get("small"));
            assertEquals(Optional.empty(), cache.get("big"));
            assertEquals(1, cache.invalidateByTags(List.of("t")));
        }
    }

    @Test
    void testCapacityExceededEvictsNothing() {
        FakeTicker ticker = new FakeTicker();
        List<String> removed = new CopyOnWriteArrayList<>();
        try (TieredCache<String> cache = quietBuilder()
                .ticker(ticker)
                .maximumBytes(100)
                .evictionPolicy(EvictionPolicy.TTL)
                .sizeEstimator(value -> 40)
                .removalListener((key, value, cause) -> removed.add(key))
                .build()) {

            cache.set("A", "a", Duration.ofSeconds(1), null);
            cache.set("B", "b", Duration.ofHours(1), null);

            ticker.advance(2, TimeUnit.SECONDS);
            cache.set("C", "c");

            // A was the only expired entry; nothing unexpired may go under TTL eviction
            assertThrows(CapacityExceededException.class,
                    () -> cache.set("D", "d", Duration.ofHours(1), List.of("t")));

            assertEquals(List.of("A"), removed);
            assertEquals(Optional.of("b"), cache.get("B"));
            assertEquals(Optional.of("c"), cache.get("C"));
            assertEquals(Optional.empty(), cache.get("D"));
            assertEquals(0, cache.invalidateByTags(List.of("t")));
            assertEquals(80, cache.stats().tier(CacheTier.L1_MEMORY).bytes());
        }
    }

    @Test
    void testFailingTierFallsThrough() {
        ConcurrentMapTier<String> l3 = new ConcurrentMapTier<>(CacheTier.L3_PERSISTENT);
        try (TieredCache<String> cache = quietBuilder()
                .slowerTier(new FailingTier(CacheTier.L2_REMOTE))
                .slowerTier(l3)
                .build()) {

            cache.set("k", "from-l3", null, null, CacheTier.L3_PERSISTENT);

            assertEquals(Optional.of("from-l3"), cache.get("k"));
            assertEquals(Optional.empty(), cache.get("missing"));

            TierStats l2Stats = cache.stats().tier(CacheTier.L2_REMOTE);
            assertFalse(l2Stats.isAvailable());
        }
    }

    @Test
    void testWriteThroughFailureDoesNotFailSet() {
        try (TieredCache<String> cache = quietBuilder()
                .slowerTier(new FailingTier(CacheTier.L2_REMOTE))
                .build()) {

            cache.set("k", "v");
            assertEquals(Optional.of("v"), cache.get("k"));
            assertTrue(cache.delete("k"));
        }
    }

    @Test
    void testExplicitWriteToFailingTierThrows() {
        try (TieredCache<String> cache = quietBuilder()
                .slowerTier(new FailingTier(CacheTier.L2_REMOTE))
                .build()) {

            cache.set("k", "fast");
            CacheException e = assertThrows(CacheException.class,
                    () -> cache.set("k", "slow", null, List.of("t"), CacheTier.L2_REMOTE));
            assertInstanceOf(TierUnavailableException.class, e.getCause());

            assertEquals(Optional.of("fast"), cache.get("k"));
            assertEquals(0, cache.invalidateByTags(List.of("t")));
        }
    }

    @Test
    @Timeout(10)
    void testSlowTierIsTreatedAsMiss() {
        try (TieredCache<String> cache = quietBuilder()
                .tierTimeout(50, TimeUnit.MILLISECONDS)
                .slowerTier(new SlowTier(CacheTier.L2_REMOTE, 5_000))
                .build()) {

            long start = System.nanoTime();
            assertEquals(Optional.empty(), cache.get("k"));
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertTrue(elapsedMillis < 2_000, "slow tier should be abandoned, took " + elapsedMillis + " ms");
            assertEquals(1, cache.stats().missCount());
        }
    }

    @Test
    @Timeout(10)
    void testGetWithDeadlineTimesOut() {
        try (TieredCache<String> cache = quietBuilder()
                .tierTimeout(5, TimeUnit.SECONDS)
                .slowerTier(new SlowTier(CacheTier.L2_REMOTE, 5_000))
                .build()) {

            assertThrows(TimeoutException.class, () -> cache.get("k", 50, TimeUnit.MILLISECONDS));
            assertEquals(1, cache.stats().missCount());
        }
    }

    @Test
    void testGetWithDeadlineReturnsFastHit() throws Exception {
        try (TieredCache<String> cache = quietBuilder()
                .slowerTier(new SlowTier(CacheTier.L2_REMOTE, 5_000))
                .writeMode(WriteMode.WRITE_AROUND)
                .build()) {

            cache.set("k", "v");
            assertEquals(Optional.of("v"), cache.get("k", 1, TimeUnit.SECONDS));
        }
    }

    @Test
    void testSetWithDeadline() throws Exception {
        try (TieredCache<String> cache = quietBuilder().build()) {
            cache.set("k", "v", null, null, null, 1, TimeUnit.SECONDS);
            assertEquals(Optional.of("v"), cache.get("k"));
        }
    }

    @Test
    @Timeout(10)
    void testSetWithDeadlineTimesOutOnSlowTier() {
        try (TieredCache<String> cache = quietBuilder()
                .tierTimeout(5, TimeUnit.SECONDS)
                .slowerTier(new SlowTier(CacheTier.L2_REMOTE, 5_000))
                .build()) {

            assertThrows(TimeoutException.class, () -> cache.set("k", "v", null, List.of("t"),
                    CacheTier.L2_REMOTE, 50, TimeUnit.MILLISECONDS));

            assertEquals(0, cache.size());
            assertEquals(0, cache.invalidateByTags(List.of("t")));
        }
    }

    @Test
    @Timeout(10)
    void testDeadlineAppliesWhileLockIsBusy() throws Exception {
        CountDownLatch listenerEntered = new CountDownLatch(1);
        CountDownLatch releaseListener = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try (TieredCache<String> cache = quietBuilder()
                .removalListener((key, value, cause) -> {
                    if (cause == RemovalCause.REPLACED) {
                        listenerEntered.countDown();
                        try {
                            releaseListener.await();
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                    }
                })
                .build()) {

            cache.set("busy", "1");
            // the listener runs under the cache lock and keeps it until released
            Future<?> replace = executor.submit(() -> cache.set("busy", "2"));
            assertTrue(listenerEntered.await(5, TimeUnit.SECONDS));

            assertThrows(TimeoutException.class,
                    () -> cache.set("other", "v", null, null, null, 50, TimeUnit.MILLISECONDS));
            assertThrows(TimeoutException.class, () -> cache.get("busy", 50, TimeUnit.MILLISECONDS));

            releaseListener.countDown();
            replace.get(5, TimeUnit.SECONDS);

            assertEquals(Optional.empty(), cache.get("other"));
            assertEquals(Optional.of("2"), cache.get("busy"));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testGetWithDeadlineMissesWithoutTimeout() throws Exception {
        ConcurrentMapTier<String> l3 = new ConcurrentMapTier<>(CacheTier.L3_PERSISTENT);
        try (TieredCache<String> cache = quietBuilder()
                .slowerTier(new FailingTier(CacheTier.L2_REMOTE))
                .slowerTier(l3)
                .build()) {

            // every tier answered or failed well before the deadline
            assertEquals(Optional.empty(), cache.get("missing", 5, TimeUnit.SECONDS));
            assertEquals(1, cache.stats().missCount());
        }
    }

    @Test
    void testWarmSkipsEntriesThatDoNotFit() {
        try (TieredCache<String> cache = quietBuilder()
                .maximumBytes(100)
                .sizeEstimator((String value) -> value.length())
                .build()) {

            Map<String, String> entries = new LinkedHashMap<>();
            entries.put("a", "x".repeat(10));
            entries.put("huge", "y".repeat(500));
            entries.put("b", "z".repeat(10));

            assertEquals(2, cache.warm(entries));
            assertTrue(cache.get("a").isPresent());
            assertTrue(cache.get("b").isPresent());
            assertFalse(cache.get("huge").isPresent());
        }
    }

    @Test
    void testClearResetsRecentCountersOnly() {
        try (TieredCache<String> cache = quietBuilder().build()) {
            cache.set("a", "1", null, List.of("t"));
            cache.set("b", "2");
            cache.get("a");
            cache.get("missing");

            assertEquals(2, cache.clear());

            CacheStats stats = cache.stats();
            assertEquals(0, cache.size());
            assertEquals(0, stats.hitCount());
            assertEquals(0, stats.missCount());
            assertEquals(1, stats.lifetimeHitCount());
            assertEquals(1, stats.lifetimeMissCount());
            assertEquals(0, cache.invalidateByTags(List.of("t")));

            cache.set("c", "3");
            assertEquals(1, cache.clear(true));
            assertEquals(0, cache.stats().lifetimeHitCount());
            assertEquals(0, cache.stats().lifetimeOperationCount());
        }
    }

    @Test
    void testClearEmptiesSlowerTiers() throws Exception {
        ConcurrentMapTier<String> l2 = new ConcurrentMapTier<>(CacheTier.L2_REMOTE);
        try (TieredCache<String> cache = quietBuilder().slowerTier(l2).build()) {
            cache.set("a", "1");
            cache.set("b", "2", null, null, CacheTier.L2_REMOTE);

            assertEquals(1, cache.clear());
            assertEquals(0, l2.size().entries());
            assertEquals(Optional.empty(), cache.get("b"));
        }
    }

    @Test
    void testRemovalListenerCauses() {
        FakeTicker ticker = new FakeTicker();
        Map<String, RemovalCause> causes = new ConcurrentHashMap<>();
        try (TieredCache<String> cache = quietBuilder()
                .ticker(ticker)
                .maximumEntries(2)
                .removalListener((key, value, cause) -> causes.put(key + "=" + value, cause))
                .build()) {

            cache.set("r", "1");
            cache.set("r", "2");
            assertEquals(RemovalCause.REPLACED, causes.get("r=1"));

            cache.set("t", "x", null, List.of("tag"));
            cache.invalidateByTags(List.of("tag"));
            assertEquals(RemovalCause.TAG_INVALIDATED, causes.get("t=x"));

            cache.delete("r");
            assertEquals(RemovalCause.EXPLICIT, causes.get("r=2"));

            cache.set("e", "x", Duration.ofSeconds(1), null);
            ticker.advance(2, TimeUnit.SECONDS);
            cache.get("e");
            assertEquals(RemovalCause.EXPIRED, causes.get("e=x"));

            cache.set("s1", "x");
            cache.set("s2", "x");
            cache.set("s3", "x");
            assertEquals(RemovalCause.SIZE, causes.get("s1=x"));
        }
    }

    @Test
    void testFailingRemovalListenerDoesNotBreakCache() {
        try (TieredCache<String> cache = quietBuilder()
                .removalListener((key, value, cause) -> {
                    throw new IllegalStateException("listener failure");
                })
                .build()) {

            cache.set("k", "1");
            cache.set("k", "2");
            assertTrue(cache.delete("k"));
            assertEquals(0, cache.size());
        }
    }

    @Test
    void testGetOrCompute() throws Exception {
        AtomicInteger loads = new AtomicInteger();
        try (TieredCache<String> cache = quietBuilder().build()) {
            assertEquals("computed", cache.getOrCompute("k", () -> {
                loads.incrementAndGet();
                return "computed";
            }));
            assertEquals("computed", cache.getOrCompute("k", () -> {
                loads.incrementAndGet();
                return "recomputed";
            }));
            assertEquals(1, loads.get());

            assertThrows(java.io.IOException.class, () -> cache.getOrCompute("failing", () -> {
                throw new java.io.IOException("boom");
            }));
            assertFalse(cache.get("failing").isPresent());
        }
    }

    @Test
    void testNullArgumentsRejected() {
        try (TieredCache<String> cache = quietBuilder().build()) {
            assertThrows(NullPointerException.class, () -> cache.get(null));
            assertThrows(NullPointerException.class, () -> cache.set(null, "v"));
            assertThrows(NullPointerException.class, () -> cache.set("k", null));
            assertThrows(NullPointerException.class, () -> cache.set("k", "v", null, Arrays.asList("t", null)));
            assertThrows(IllegalArgumentException.class, () -> cache.set("k", "v", Duration.ofSeconds(-1), null));
            assertEquals(0, cache.size());
        }
    }

    @Test
    @Timeout(10)
    void testScheduledSweepRemovesExpiredEntries() throws Exception {
        FakeTicker ticker = new FakeTicker();
        try (TieredCache<String> cache = TieredCacheBuilder.newBuilder()
                .ticker(ticker)
                .sweepInterval(20, TimeUnit.MILLISECONDS)
                .metricsResetInterval(0, TimeUnit.SECONDS)
                .build()) {

            cache.set("short", "v", Duration.ofSeconds(1), List.of("t"));
            cache.set("long", "v", Duration.ofHours(1), null);
            ticker.advance(2, TimeUnit.SECONDS);

            awaitCondition(() -> cache.stats().evictionCount() == 1);
            assertEquals(1, cache.size());
            assertEquals(0, cache.invalidateByTags(List.of("t")));
        }
    }

    @Test
    @Timeout(10)
    void testScheduledMetricsResetKeepsLifetimeCounters() throws Exception {
        try (TieredCache<String> cache = TieredCacheBuilder.newBuilder()
                .sweepInterval(0, TimeUnit.SECONDS)
                .metricsResetInterval(20, TimeUnit.MILLISECONDS)
                .build()) {

            cache.set("k", "v");
            cache.get("k");
            cache.get("missing");

            awaitCondition(() -> cache.stats().hitCount() == 0 && cache.stats().missCount() == 0);

            CacheStats stats = cache.stats();
            assertEquals(1, stats.lifetimeHitCount());
            assertEquals(1, stats.lifetimeMissCount());
            assertEquals(1, cache.size());
        }
    }

    @Test
    @Timeout(10)
    void testFailedSweepDoesNotStopLaterSweeps() throws Exception {
        FakeTicker clock = new FakeTicker();
        AtomicInteger sweepReads = new AtomicInteger();
        Ticker ticker = () -> {
            if (Thread.currentThread().getName().startsWith("tiercache-maintenance")
                    && sweepReads.incrementAndGet() <= 2) {
                throw new IllegalStateException("clock unavailable");
            }
            return clock.read();
        };
        try (TieredCache<String> cache = TieredCacheBuilder.newBuilder()
                .ticker(ticker)
                .sweepInterval(20, TimeUnit.MILLISECONDS)
                .metricsResetInterval(0, TimeUnit.SECONDS)
                .build()) {

            cache.set("k", "v", Duration.ofSeconds(1), null);
            clock.advance(2, TimeUnit.SECONDS);

            awaitCondition(() -> cache.size() == 0);
            assertTrue(sweepReads.get() > 2);
        }
    }

    @Test
    @Timeout(10)
    void testCloseStopsBackgroundTasks() throws Exception {
        FakeTicker ticker = new FakeTicker();
        TieredCache<String> cache = TieredCacheBuilder.newBuilder()
                .ticker(ticker)
                .sweepInterval(100, TimeUnit.MILLISECONDS)
                .metricsResetInterval(100, TimeUnit.MILLISECONDS)
                .build();
        cache.set("k", "v", Duration.ofSeconds(1), null);
        cache.set("other", "v");
        cache.get("other");
        cache.close();

        ticker.advance(2, TimeUnit.SECONDS);
        Thread.sleep(400);

        assertEquals(2, cache.size());
        assertEquals(1, cache.stats().hitCount());
        assertEquals(0, cache.stats().evictionCount());
    }

    @Test
    @Timeout(30)
    void testConcurrentAccessKeepsBudgetAndTags() throws Exception {
        int threads = 8;
        int opsPerThread = 2_000;
        long budget = 400;
        try (TieredCache<String> cache = quietBuilder()
                .maximumBytes(budget)
                .sizeEstimator(value -> 40)
                .build()) {

            CacheMetrics metrics = (CacheMetrics) cache;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger overBudget = new AtomicInteger();
            List<Future<?>> futures = new ArrayList<>();

            for (int t = 0; t < threads; t++) {
                int seed = t;
                futures.add(executor.submit(() -> {
                    Random random = new Random(seed);
                    start.await();
                    for (int i = 0; i < opsPerThread; i++) {
                        String key = "key" + random.nextInt(50);
                        String tag = "tag" + random.nextInt(5);
                        switch (random.nextInt(4)) {
                            case 0, 1 -> cache.set(key, "v" + i, null, List.of(tag));
                            case 2 -> cache.get(key);
                            default -> {
                                if (random.nextBoolean()) {
                                    cache.delete(key);
                                } else {
                                    cache.invalidateByTags(List.of(tag));
                                }
                            }
                        }
                        if (metrics.usedBytes() > budget) {
                            overBudget.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
            executor.shutdown();

            assertEquals(0, overBudget.get());
            assertTrue(cache.size() <= 10);
            assertEquals(cache.size() * 40, metrics.usedBytes());

            // every stored entry carries a tag, so invalidating all tags must empty the cache
            long present = cache.size();
            assertEquals(present, cache.invalidateByTags(List.of("tag0", "tag1", "tag2", "tag3", "tag4")));
            assertEquals(0, cache.size());
        }
    }

    /**
     * A slower tier whose store is unreachable.
     */
    private static final class FailingTier implements Tier<String> {
        private final CacheTier type;

        FailingTier(CacheTier type) {
            this.type = type;
        }

        @Override
        public CacheTier type() {
            return type;
        }

        @Override
        public Optional<CacheEntry<String>> read(String key) throws TierUnavailableException {
            throw new TierUnavailableException(type, "connection refused");
        }

        @Override
        public void write(CacheEntry<String> entry) throws TierUnavailableException {
            throw new TierUnavailableException(type, "connection refused");
        }

        @Override
        public boolean remove(String key) throws TierUnavailableException {
            throw new TierUnavailableException(type, "connection refused");
        }

        @Override
        public void clear() throws TierUnavailableException {
            throw new TierUnavailableException(type, "connection refused");
        }

        @Override
        public TierStats size() throws TierUnavailableException {
            throw new TierUnavailableException(type, "connection refused");
        }
    }

    /**
     * A slower tier that never answers reads or writes in time.
     */
    private static final class SlowTier implements Tier<String> {
        private final CacheTier type;
        private final long delayMillis;

        SlowTier(CacheTier type, long delayMillis) {
            this.type = type;
            this.delayMillis = delayMillis;
        }

        @Override
        public CacheTier type() {
            return type;
        }

        @Override
        public Optional<CacheEntry<String>> read(String key) throws TierUnavailableException {
            try {
                Thread.sleep(delayMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TierUnavailableException(type, "interrupted");
            }
            return Optional.empty();
        }

        @Override
        public void write(CacheEntry<String> entry) throws TierUnavailableException {
            try {
                Thread.sleep(delayMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TierUnavailableException(type, "interrupted");
            }
        }

        @Override
        public boolean remove(String key) {
            return false;
        }

        @Override
        public void clear() {
        }

        @Override
        public TierStats size() {
            return new TierStats(type, 0, 0);
        }
    }

    /**
     * An in-memory slower tier that holds back writes of one value until released.
     */
    private static final class BlockingWriteTier extends ConcurrentMapTier<String> {
        private final String heldValue;
        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);

        BlockingWriteTier(CacheTier type, String heldValue) {
            super(type);
            this.heldValue = heldValue;
        }

        @Override
        public void write(CacheEntry<String> entry) {
            if (heldValue.equals(entry.getValue())) {
                entered.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("interrupted while holding a write", e);
                }
            }
            super.write(entry);
        }
    }
}
