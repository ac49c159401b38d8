package dev.callguard.cache;

import dev.callguard.config.CacheConfig;
import dev.callguard.core.CacheLayer;
import dev.callguard.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class CachedTest {

    private final MutableClock clock = MutableClock.startingAtMillis(0);
    private CacheLayer cache;

    @BeforeEach
    void setUp() {
        cache = new CacheLayer(new CacheConfig().setKeyPrefix("cached-test:").setSweepIntervalMillis(0), clock);
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    @Test
    void wrap_callsOperationOncePerKeyWithinTtl() {
        AtomicInteger calls = new AtomicInteger();
        Function<Integer, String> square = Cached.wrap(cache, n -> "square:" + n, n -> {
            calls.incrementAndGet();
            return String.valueOf(n * n);
        }, 30L);

        assertEquals("9", square.apply(3));
        assertEquals("9", square.apply(3));
        assertEquals("16", square.apply(4));
        assertEquals(2, calls.get());

        clock.advanceMillis(30_000);
        assertEquals("9", square.apply(3));
        assertEquals(3, calls.get());
    }

    @Test
    void wrapSupplier_cachesUnderFixedKey() {
        AtomicInteger calls = new AtomicInteger();
        Supplier<Integer> config = Cached.wrapSupplier(cache, "config", calls::incrementAndGet, null);

        assertEquals(1, config.get());
        assertEquals(1, config.get());
        assertEquals(1, calls.get());

        cache.del("config");
        assertEquals(2, config.get());
    }

    @Test
    void wrap_propagatesOperationFailure_andDoesNotCache() {
        AtomicInteger calls = new AtomicInteger();
        Function<String, String> failing = Cached.wrap(cache, s -> s, s -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalArgumentException("bad " + s);
            }
            return s.toUpperCase();
        }, null);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> failing.apply("x"));
        assertEquals("bad x", e.getMessage());
        assertEquals("X", failing.apply("x"));
    }
}
