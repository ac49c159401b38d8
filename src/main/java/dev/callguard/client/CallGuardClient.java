package dev.callguard.client;

import dev.callguard.config.CacheConfig;
import dev.callguard.config.RateLimitOptions;
import dev.callguard.core.CacheLayer;
import dev.callguard.ratelimit.RateLimitManager;
import dev.callguard.ratelimit.RequestFunction;
import dev.callguard.ratelimit.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * CallGuardClient owns a {@link CacheLayer} and a {@link RateLimitManager} and combines them:
 * a cached value is served without touching the remote API, a miss goes through the rate limiter
 * exactly once however many callers ask for it concurrently.
 *
 * <p><strong>Usage Pattern:</strong>
 * <pre>{@code
 * try (CallGuardClient client = new CallGuardClient(new CacheConfig().setKeyPrefix("market:"))) {
 *     // 1. Register credentials and pacing
 *     client.rateLimiter().registerApiKeys("quotes", List.of(keyA, keyB));
 *     client.rateLimiter().configureEndpoint("quotes/latest", 5, 1000);
 *
 *     // 2. Fetch through cache and limiter
 *     Quote q = client.fetch("AAPL",
 *             apiKey -> quoteApi.latest(apiKey, "AAPL"),
 *             new RateLimitOptions("quotes", "quotes/latest"),
 *             60L);
 * }
 * }</pre>
 */
public class CallGuardClient implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(CallGuardClient.class);

    private final CacheLayer cache;
    private final RateLimitManager rateLimiter;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public CallGuardClient(CacheConfig config) {
        this(config, null, null);
    }

    public CallGuardClient(CacheConfig config, Clock clock, Sleeper sleeper) {
        this(new CacheLayer(Objects.requireNonNull(config, "config cannot be null"), clock),
                new RateLimitManager(clock, sleeper));
    }

    /**
     * Wraps existing components; both are closed with this client.
     */
    public CallGuardClient(CacheLayer cache, RateLimitManager rateLimiter) {
        this.cache = Objects.requireNonNull(cache, "cache cannot be null");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter cannot be null");
    }

    public CacheLayer cache() {
        return cache;
    }

    public RateLimitManager rateLimiter() {
        return rateLimiter;
    }

    /**
     * Returns the cached value of {@code key}, or runs {@code requestFn} through the rate limiter,
     * caches a non-null result for {@code ttlSeconds} and returns it.
     *
     * @param ttlSeconds entry TTL, null for the cache's default
     * @throws IllegalStateException if the client is closed
     */
    public <T> T fetch(String key, RequestFunction<T> requestFn, RateLimitOptions options, Long ttlSeconds) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(requestFn, "requestFn cannot be null");
        Objects.requireNonNull(options, "options cannot be null");
        if (closed.get()) {
            throw new IllegalStateException("CallGuardClient is closed");
        }

        return cache.getOrSet(key, () -> rateLimiter.executeRateLimitedRequest(requestFn, options), ttlSeconds);
    }

    public <T> T fetch(String key, RequestFunction<T> requestFn, RateLimitOptions options) {
        return fetch(key, requestFn, options, null);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        cache.close();
        logger.info("CallGuardClient closed");
    }
}
