package dev.callguard.core;

import dev.callguard.cache.CacheStore;
import dev.callguard.cache.InMemoryCacheStore;
import dev.callguard.config.CacheConfig;
import dev.callguard.config.StoreType;
import dev.callguard.error.CacheFetchException;
import dev.callguard.error.StoreFailureException;
import dev.callguard.ser.JsonSerializer;
import dev.callguard.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class CacheLayerTest {

    private final MutableClock clock = MutableClock.startingAtMillis(1_000_000L);
    private final List<AutoCloseable> toClose = new ArrayList<>();

    @AfterEach
    void tearDown() throws Exception {
        for (AutoCloseable c : toClose) c.close();
    }

    private CacheConfig config(String prefix) {
        return new CacheConfig().setKeyPrefix(prefix).setSweepIntervalMillis(0).setDefaultTtlSeconds(3600);
    }

    private CacheLayer layer(String prefix) {
        CacheLayer layer = new CacheLayer(config(prefix), clock);
        toClose.add(layer);
        return layer;
    }

    private CacheLayer layer(String prefix, CacheStore store) {
        CacheLayer layer = new CacheLayer(config(prefix), store, clock);
        toClose.add(layer);
        return layer;
    }

    private InMemoryCacheStore sharedStore() {
        InMemoryCacheStore store = new InMemoryCacheStore(1_000_000, 3600, 0, new JsonSerializer<>(), clock);
        toClose.add(store);
        return store;
    }

    @Test
    void setThenGet_respectsTtl() {
        CacheLayer cache = layer("t:");
        assertTrue(cache.set("k", "v", 5L));
        assertEquals("v", cache.<String>get("k"));

        clock.advanceMillis(5_000);
        assertNull(cache.get("k"));
    }

    @Test
    void prefixes_isolateLayersSharingOneStore() {
        InMemoryCacheStore store = sharedStore();
        CacheLayer a = layer("a:", store);
        CacheLayer b = layer("b:", store);

        a.set("k", "from-a");
        b.set("k", "from-b");

        assertEquals("from-a", a.<String>get("k"));
        assertEquals("from-b", b.<String>get("k"));
        assertEquals(List.of("a:k"), store.keys("a:*"));

        a.invalidatePattern("*");
        assertNull(a.get("k"));
        assertEquals("from-b", b.<String>get("k"));
    }

    @Test
    void del_removesOneKey() {
        CacheLayer cache = layer("t:");
        cache.set("k", 1);
        assertTrue(cache.del("k"));
        assertFalse(cache.del("k"));
        assertNull(cache.get("k"));
    }

    @Test
    void invalidatePattern_deletesOnlyMatchingKeys() {
        CacheLayer cache = layer("t:");
        cache.set("user:1", "a");
        cache.set("user:2", "b");
        cache.set("order:1", "c");

        assertEquals(2, cache.invalidatePattern("user:*"));
        assertNull(cache.get("user:1"));
        assertNull(cache.get("user:2"));
        assertEquals("c", cache.<String>get("order:1"));
        assertEquals(0, cache.invalidatePattern("user:*"));
    }

    @Test
    void stats_countHitsMissesAndOperations() {
        CacheLayer cache = layer("t:");
        assertNull(cache.get("k"));
        cache.set("k", "v");
        assertEquals("v", cache.<String>get("k"));

        CacheStats stats = cache.getStats();
        assertEquals(1, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(0, stats.errors());
        assertEquals(3, stats.operations());
        assertEquals(1.0 / 3, stats.hitRate(), 1e-9);
        assertFalse(stats.circuitBreakerOpen());
        assertEquals(0, stats.pendingRequests());
    }

    @Test
    void stats_hitRateIsZeroWithoutOperations() {
        assertEquals(0.0, layer("t:").getStats().hitRate());
    }

    @Test
    void failingStore_opensBreaker_andStopsCallingStore() {
        FlakyStore store = new FlakyStore();
        CacheLayer cache = layer("t:", store);

        for (int i = 0; i < 5; i++) {
            assertNull(cache.get("k"));
        }
        assertEquals(5, store.calls.get());
        assertEquals(CircuitBreakerState.OPEN, cache.getCircuitBreakerState());

        assertNull(cache.get("k"));
        assertFalse(cache.set("k", "v"));
        assertEquals(5, store.calls.get());

        CacheStats stats = cache.getStats();
        assertEquals(5, stats.errors());
        assertEquals(6, stats.misses());
        assertTrue(stats.circuitBreakerOpen());
        assertEquals(2, cache.getCircuitBreakerMetrics().rejectedCalls());
    }

    @Test
    void breaker_probesAfterResetTimeout_andClosesWhenStoreRecovers() {
        FlakyStore store = new FlakyStore();
        CacheLayer cache = layer("t:", store);
        for (int i = 0; i < 5; i++) cache.get("k");

        store.failing = false;
        clock.advance(Duration.ofSeconds(60));

        assertTrue(cache.set("k", "v"));
        assertEquals(CircuitBreakerState.HALF_OPEN, cache.getCircuitBreakerState());
        cache.get("k");
        cache.get("k");
        assertEquals(CircuitBreakerState.CLOSED, cache.getCircuitBreakerState());
    }

    @Test
    void getOrSet_concurrentMissesFetchOnce_andShareTheValue() throws Exception {
        CacheLayer cache = layer("t:");
        AtomicInteger fetches = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        ConcurrentLinkedQueue<Object> results = new ConcurrentLinkedQueue<>();

        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            Thread t = new Thread(() -> results.add(cache.getOrSet("k", () -> {
                fetches.incrementAndGet();
                release.await();
                return "value";
            }, 60L)));
            threads.add(t);
            t.start();
        }

        awaitAllWaiting(threads);
        assertEquals(1, cache.getStats().pendingRequests());
        release.countDown();
        for (Thread t : threads) t.join(5_000);

        assertEquals(1, fetches.get());
        assertEquals(8, results.size());
        assertTrue(results.stream().allMatch("value"::equals));
        assertEquals(0, cache.getStats().pendingRequests());
        assertEquals("value", cache.<String>get("k"));
    }

    @Test
    void getOrSet_failureReachesEveryWaiter_andIsNotCached() throws Exception {
        CacheLayer cache = layer("t:");
        IllegalStateException boom = new IllegalStateException("boom");
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger fetches = new AtomicInteger();
        ConcurrentLinkedQueue<Throwable> failures = new ConcurrentLinkedQueue<>();

        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            Thread t = new Thread(() -> {
                try {
                    cache.getOrSet("k", () -> {
                        fetches.incrementAndGet();
                        release.await();
                        throw boom;
                    });
                } catch (Throwable e) {
                    failures.add(e);
                }
            });
            threads.add(t);
            t.start();
        }

        awaitAllWaiting(threads);
        release.countDown();
        for (Thread t : threads) t.join(5_000);

        assertEquals(1, fetches.get());
        assertEquals(4, failures.size());
        assertTrue(failures.stream().allMatch(e -> e == boom));
        assertEquals(0, cache.getStats().pendingRequests());

        assertEquals("ok", cache.getOrSet("k", () -> "ok"));
    }

    @Test
    void getOrSet_wrapsCheckedFailures() {
        CacheLayer cache = layer("t:");
        IOException io = new IOException("disk");
        CacheFetchException e = assertThrows(CacheFetchException.class,
                () -> cache.getOrSet("k", () -> { throw io; }));
        assertSame(io, e.getCause());
    }

    @Test
    void getOrSet_checkedFailureIsOneInstanceForEveryWaiter() throws Exception {
        CacheLayer cache = layer("t:");
        IOException io = new IOException("disk");
        CountDownLatch release = new CountDownLatch(1);
        ConcurrentLinkedQueue<Throwable> failures = new ConcurrentLinkedQueue<>();

        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            Thread t = new Thread(() -> {
                try {
                    cache.getOrSet("k", () -> {
                        release.await();
                        throw io;
                    });
                } catch (Throwable e) {
                    failures.add(e);
                }
            });
            threads.add(t);
            t.start();
        }

        awaitAllWaiting(threads);
        release.countDown();
        for (Thread t : threads) t.join(5_000);

        assertEquals(4, failures.size());
        Throwable first = failures.peek();
        assertInstanceOf(CacheFetchException.class, first);
        assertSame(io, first.getCause());
        assertTrue(failures.stream().allMatch(e -> e == first));
    }

    @Test
    void tags_getByTagsRequiresEveryTag() {
        CacheLayer cache = layer("t:");
        assertTrue(cache.set("u1", "alice", 60L, List.of("users", "active")));
        assertTrue(cache.set("u2", "bob", 60L, List.of("users")));
        cache.set("plain", "x");

        Map<String, String> active = cache.getByTags(List.of("users", "active"));
        assertEquals(Map.of("u1", "alice"), active);
        assertEquals(Map.of("u1", "alice", "u2", "bob"), cache.<String>getByTags(List.of("users")));
        assertTrue(cache.getByTags(List.of()).isEmpty());
    }

    @Test
    void tags_invalidateByTagsDeletesKeysWithAnyTag() {
        CacheLayer cache = layer("t:");
        cache.set("a", 1, 60L, List.of("red"));
        cache.set("b", 2, 60L, List.of("blue"));
        cache.set("c", 3, 60L, List.of("green"));

        assertEquals(2, cache.invalidateByTags(List.of("red", "blue")));
        assertNull(cache.get("a"));
        assertNull(cache.get("b"));
        assertEquals(Integer.valueOf(3), cache.<Integer>get("c"));
        assertEquals(0, cache.invalidateByTags(List.of("red")));
    }

    @Test
    void tags_areDroppedByPlainSetDelAndExpiry() {
        CacheLayer cache = layer("t:");
        cache.set("a", "v", 60L, List.of("grp"));
        cache.set("a", "v2");
        assertTrue(cache.getByTags(List.of("grp")).isEmpty());

        cache.set("b", "v", 60L, List.of("grp"));
        cache.del("b");
        cache.set("b", "v3");
        assertEquals(0, cache.invalidateByTags(List.of("grp")));
        assertEquals("v3", cache.<String>get("b"));

        cache.set("c", "v", 5L, List.of("grp"));
        clock.advanceMillis(5_000);
        assertTrue(cache.getByTags(List.of("grp")).isEmpty());
    }

    @Test
    void getOrSet_hitSkipsFetch_andNullResultsAreNotCached() {
        CacheLayer cache = layer("t:");
        cache.set("k", "cached");
        assertEquals("cached", cache.getOrSet("k", () -> fail("fetch must not run on a hit")));

        AtomicInteger fetches = new AtomicInteger();
        assertNull(cache.getOrSet("nothing", () -> { fetches.incrementAndGet(); return null; }));
        assertNull(cache.getOrSet("nothing", () -> { fetches.incrementAndGet(); return null; }));
        assertEquals(2, fetches.get());
    }

    @Test
    void getOrSet_stillReturnsFetchedValueWhenStoreIsDown() {
        CacheLayer cache = layer("t:", new FlakyStore());
        assertEquals("fresh", cache.getOrSet("k", () -> "fresh"));
        // miss, re-check after registering the fetch, write
        assertEquals(3, cache.getStats().errors());
    }

    @Test
    void externalStore_fallsBackToMemoryWhenAllowed() {
        CacheLayer cache = layer("t:");
        CacheLayer external = new CacheLayer(config("x:").setStoreType(StoreType.EXTERNAL)
                .setExternalStoreUrl("redis://localhost:6379").setFallbackToMemory(true), clock);
        toClose.add(external);

        assertTrue(external.set("k", "v"));
        assertEquals("v", external.<String>get("k"));
        assertNull(cache.get("k"));
    }

    @Test
    void externalStore_withoutFallbackDegradesToMisses() {
        CacheLayer cache = new CacheLayer(config("x:").setStoreType(StoreType.EXTERNAL)
                .setExternalStoreUrl("redis://localhost:6379").setFallbackToMemory(false), clock);
        toClose.add(cache);

        assertFalse(cache.set("k", "v"));
        assertNull(cache.get("k"));
        assertFalse(cache.del("k"));
        assertEquals(0, cache.invalidatePattern("*"));
        assertEquals(4, cache.getStats().errors());
    }

    @Test
    void close_leavesSharedStoreOpen() {
        InMemoryCacheStore store = sharedStore();
        CacheLayer cache = new CacheLayer(config("t:"), store, clock);
        cache.set("k", "v");
        cache.close();
        cache.close();

        assertFalse(store.isClosed());
        assertEquals("v", store.get("t:k"));
    }

    private static void awaitAllWaiting(List<Thread> threads) {
        await().atMost(5, TimeUnit.SECONDS)
                .until(() -> threads.stream().allMatch(t -> t.getState() == Thread.State.WAITING));
    }

    /** Store whose operations fail while {@code failing} is set. */
    private static final class FlakyStore implements CacheStore {
        final AtomicInteger calls = new AtomicInteger();
        volatile boolean failing = true;
        private final Map<String, Object> values = new ConcurrentHashMap<>();

        private void call(String op) {
            calls.incrementAndGet();
            if (failing) throw new StoreFailureException("store down during " + op);
        }

        @Override public Object get(String key) { call("get"); return values.get(key); }
        @Override public boolean set(String key, Object value, Long ttlSeconds) { call("set"); values.put(key, value); return true; }
        @Override public boolean del(String key) { call("del"); return values.remove(key) != null; }
        @Override public boolean exists(String key) { call("exists"); return values.containsKey(key); }
        @Override public boolean expire(String key, long ttlSeconds) { call("expire"); return values.containsKey(key); }
        @Override public List<String> keys(String pattern) { call("keys"); return new ArrayList<>(values.keySet()); }
        @Override public long ttl(String key) { call("ttl"); return values.containsKey(key) ? 3600 : TTL_ABSENT; }
        @Override public long incr(String key) { call("incr"); return 0; }
        @Override public long decr(String key) { call("decr"); return 0; }
        @Override public void clear() { call("clear"); values.clear(); }
    }
}
