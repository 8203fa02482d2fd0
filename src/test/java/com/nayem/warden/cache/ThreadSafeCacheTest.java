package com.nayem.warden.cache;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static org.junit.jupiter.api.Assertions.*;

public class ThreadSafeCacheTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    public void testEntryExpiresAfterTtl() {
        ThreadSafeCache cache = new ThreadSafeCache(
                new CacheConfiguration(null, Duration.ofSeconds(60)), clock, CacheMetrics.noOp());

        cache.set("k", "v");
        clock.advance(Duration.ofSeconds(30));
        assertEquals(Optional.of(new CacheValue.Scalar("v")), cache.get("k"));

        clock.advance(Duration.ofSeconds(31));
        assertTrue(cache.get("k").isEmpty(), "Entry older than its TTL must read as a miss");
        assertEquals(0, cache.size(), "Expired entry is purged on access");
    }

    @Test
    public void testEntryAtExactTtlIsExpired() {
        ThreadSafeCache cache = new ThreadSafeCache(
                new CacheConfiguration(null, Duration.ofSeconds(10)), clock, CacheMetrics.noOp());

        cache.set("k", 1);
        clock.advance(Duration.ofSeconds(10));

        assertFalse(cache.contains("k"));
    }

    @Test
    public void testSetResetsInsertionTime() {
        ThreadSafeCache cache = new ThreadSafeCache(
                new CacheConfiguration(null, Duration.ofSeconds(10)), clock, CacheMetrics.noOp());

        cache.set("k", 1);
        clock.advance(Duration.ofSeconds(8));
        cache.set("k", 2);
        clock.advance(Duration.ofSeconds(8));

        assertEquals(2, cache.get("k").orElseThrow().unwrap());
    }

    @Test
    public void testReadDoesNotExtendTtl() {
        ThreadSafeCache cache = new ThreadSafeCache(
                new CacheConfiguration(null, Duration.ofSeconds(10)), clock, CacheMetrics.noOp());

        cache.set("k", 1);
        clock.advance(Duration.ofSeconds(6));
        assertTrue(cache.get("k").isPresent());
        clock.advance(Duration.ofSeconds(6));

        assertTrue(cache.get("k").isEmpty());
    }

    /**
     * maxSize=2: set a, set b, read a, set c. b is least recently used.
     */
    @Test
    public void testLeastRecentlyUsedIsEvicted() {
        ThreadSafeCache cache = new ThreadSafeCache(CacheConfiguration.of(2, null), clock, CacheMetrics.noOp());

        cache.set("a", 1);
        cache.set("b", 2);
        cache.get("a");
        cache.set("c", 3);

        assertTrue(cache.contains("a"));
        assertFalse(cache.contains("b"));
        assertTrue(cache.contains("c"));
        assertEquals(2, cache.size());
    }

    @Test
    public void testOverwritingExistingKeyDoesNotEvict() {
        ThreadSafeCache cache = new ThreadSafeCache(CacheConfiguration.of(2, null), clock, CacheMetrics.noOp());

        cache.set("a", 1);
        cache.set("b", 2);
        cache.set("a", 10);

        assertTrue(cache.contains("a"));
        assertTrue(cache.contains("b"));
        assertEquals(10, cache.get("a").orElseThrow().unwrap());
    }

    @Test
    public void testUpsertMergesStructuredFields() {
        ThreadSafeCache cache = new ThreadSafeCache(CacheConfiguration.unbounded());

        cache.set("user", Map.of("name", "ada", "age", 36));
        cache.upsert("user", Map.of("age", 37, "city", "London"));

        Object merged = cache.get("user").orElseThrow().unwrap();
        assertEquals(Map.of("name", "ada", "age", 37, "city", "London"), merged);
    }

    @Test
    public void testUpsertReplacesScalars() {
        ThreadSafeCache cache = new ThreadSafeCache(CacheConfiguration.unbounded());

        cache.set("counter", 1);
        cache.upsert("counter", 2);
        assertEquals(2, cache.get("counter").orElseThrow().unwrap());

        cache.upsert("counter", Map.of("value", 3));
        assertEquals(Map.of("value", 3), cache.get("counter").orElseThrow().unwrap());

        cache.upsert("counter", "plain");
        assertEquals("plain", cache.get("counter").orElseThrow().unwrap());
    }

    @Test
    public void testUpsertOnMissingKeyStoresValue() {
        ThreadSafeCache cache = new ThreadSafeCache(CacheConfiguration.unbounded());

        cache.upsert("fresh", Map.of("x", 1));

        assertEquals(Map.of("x", 1), cache.get("fresh").orElseThrow().unwrap());
    }

    @Test
    public void testDeleteAndClear() {
        ThreadSafeCache cache = new ThreadSafeCache(CacheConfiguration.unbounded());
        cache.set("a", 1);
        cache.set("b", 2);

        cache.delete("a");
        cache.delete("missing");
        assertFalse(cache.contains("a"));
        assertTrue(cache.contains("b"));

        cache.clear();
        assertEquals(0, cache.size());
    }

    @Test
    public void testExternalLockIsUsed() {
        ThreadSafeCache cache = new ThreadSafeCache(CacheConfiguration.unbounded());
        ReentrantLock external = new ReentrantLock();

        external.lock();
        try {
            cache.set("k", CacheValue.of(1), external);
            cache.upsert("k", CacheValue.of(2), external);
            assertEquals(2, cache.get("k", external).orElseThrow().unwrap());
            assertEquals(1, external.getHoldCount(), "Nested operations must release what they take");
        } finally {
            external.unlock();
        }
        cache.delete("k", external);
        assertFalse(external.isLocked());
        assertFalse(cache.contains("k"));
    }

    @Test
    public void testNullValueRejected() {
        ThreadSafeCache cache = new ThreadSafeCache(CacheConfiguration.unbounded());
        assertThrows(IllegalArgumentException.class, () -> cache.set("k", (CacheValue) null));
    }

    @Test
    public void testConcurrentUpsertsKeepEveryField() throws Exception {
        ThreadSafeCache cache = new ThreadSafeCache(CacheConfiguration.unbounded());
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                String field = "f" + i;
                futures.add(CompletableFuture.runAsync(() -> cache.upsert("doc", Map.of(field, true)), executor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        Map<?, ?> fields = (Map<?, ?>) cache.get("doc").orElseThrow().unwrap();
        assertEquals(100, fields.size());
    }

    @Test
    public void testMetricsRecorded() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ThreadSafeCache cache = new ThreadSafeCache(CacheConfiguration.of(1, Duration.ofSeconds(5)), clock,
                new CacheMetrics(registry, "thread-safe"));

        cache.set("a", 1);
        cache.get("a");
        cache.get("missing");
        cache.set("b", 2);
        clock.advance(Duration.ofSeconds(5));
        cache.get("b");

        assertEquals(1.0, registry.get("warden.cache.hits").counter().count());
        assertEquals(2.0, registry.get("warden.cache.misses").counter().count());
        assertEquals(1.0, registry.get("warden.cache.evictions").counter().count());
        assertEquals(1.0, registry.get("warden.cache.expirations").counter().count());
    }

    @Test
    public void testInvalidConfigurationRejected() {
        assertThrows(IllegalArgumentException.class, () -> new CacheConfiguration(0, null));
        assertThrows(IllegalArgumentException.class, () -> new CacheConfiguration(null, Duration.ZERO));
    }
}
