package dev.callguard.core;

import dev.callguard.api.Cache;
import dev.callguard.cache.CacheStore;
import dev.callguard.cache.ExternalCacheStore;
import dev.callguard.cache.InMemoryCacheStore;
import dev.callguard.config.CacheConfig;
import dev.callguard.config.StoreType;
import dev.callguard.error.CacheFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;

/**
 * Namespaced, circuit-broken cache in front of a {@link CacheStore}, with single-flight fetches.
 *
 * <p>This implementation provides:
 * <ul>
 *   <li>Key namespacing: every key is prefixed with {@link CacheConfig#getKeyPrefix()}, so several
 *       layers can share one store</li>
 *   <li>A {@link CircuitBreaker} around store calls: a store that keeps failing is skipped for the
 *       reset timeout instead of being hammered</li>
 *   <li>Hit/miss/error statistics</li>
 *   <li>Request deduplication: concurrent {@link #getOrSet} misses for one key run the fetch once</li>
 *   <li>Tags: entries written with tags can be read or invalidated as a group. The tag index is
 *       local to this layer; keys written through other layers sharing the store are not tagged.</li>
 * </ul>
 *
 * <p>Store failures are logged and absorbed: reads become misses, writes and deletes report false.
 *
 * <p><strong>Usage Example:</strong>
 * <pre>{@code
 * try (CacheLayer cache = new CacheLayer(new CacheConfig().setKeyPrefix("quotes:"))) {
 *     Quote q = cache.getOrSet("AAPL", () -> quoteClient.fetch("AAPL"), 30L);
 *     cache.invalidatePattern("A*");
 * }
 * }</pre>
 */
public class CacheLayer implements Cache {
    private static final Logger logger = LoggerFactory.getLogger(CacheLayer.class);

    static final String PENDING_PREFIX = "pending:";

    private final CacheConfig config;
    private final CacheStore store;
    private final boolean ownsStore;
    private final CircuitBreaker circuitBreaker;
    private final Clock clock;
    private final Map<String, PendingRequest<?>> pendingRequests = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> tagsByKey = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder errors = new LongAdder();
    private final LongAdder operations = new LongAdder();

    public CacheLayer(CacheConfig config) {
        this(config, (Clock) null);
    }

    /**
     * Creates a layer over a store selected from {@link CacheConfig#getStoreType()}. The layer owns
     * that store and closes it on {@link #close()}.
     */
    public CacheLayer(CacheConfig config, Clock clock) {
        this(config, createStore(Objects.requireNonNull(config, "config cannot be null"),
                clock != null ? clock : Clock.systemUTC()), true, clock);
    }

    /**
     * Creates a layer over a caller-supplied store, which may be shared with other layers.
     * The store is not closed by this layer.
     */
    public CacheLayer(CacheConfig config, CacheStore store, Clock clock) {
        this(config, store, false, clock);
    }

    private CacheLayer(CacheConfig config, CacheStore store, boolean ownsStore, Clock clock) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.ownsStore = ownsStore;
        this.clock = (clock != null) ? clock : Clock.systemUTC();
        this.circuitBreaker = new CircuitBreaker("cache:" + config.getKeyPrefix(), config.getCircuitBreaker(),
                this.clock);

        logger.info("Initialized cache layer with prefix '{}' over {}", config.getKeyPrefix(),
                store.getClass().getSimpleName());
    }

    private static CacheStore createStore(CacheConfig config, Clock clock) {
        if (config.getStoreType() == StoreType.EXTERNAL) {
            if (config.isFallbackToMemory()) {
                logger.warn("External cache store '{}' is not supported, falling back to memory cache",
                        config.getExternalStoreUrl());
                return new InMemoryCacheStore(config, clock);
            }
            return new ExternalCacheStore(config.getExternalStoreUrl());
        }
        return new InMemoryCacheStore(config, clock);
    }

    @Override
    public <T> T get(String key) {
        return lookup(key, true);
    }

    @SuppressWarnings("unchecked")
    private <T> T lookup(String key, boolean countStats) {
        String fullKey = fullKey(key);

        if (!circuitBreaker.tryAcquire()) {
            if (countStats) misses.increment();
            logger.debug("Circuit open, skipping store read for '{}'", fullKey);
            return null;
        }

        try {
            if (countStats) operations.increment();
            Object value = store.get(fullKey);
            circuitBreaker.recordSuccess();
            if (countStats) {
                if (value != null) hits.increment();
                else misses.increment();
            }
            return (T) value;
        } catch (RuntimeException e) {
            recordStoreFailure();
            if (countStats) misses.increment();
            logger.error("Get operation failed for key '{}': {}", fullKey, e.getMessage(), e);
            return null;
        }
    }

    @Override
    public boolean set(String key, Object value, Long ttlSeconds) {
        return set(key, value, ttlSeconds, null);
    }

    @Override
    public boolean set(String key, Object value, Long ttlSeconds, Collection<String> tags) {
        boolean stored = write(key, value, ttlSeconds);
        if (stored) {
            if (tags == null || tags.isEmpty()) {
                tagsByKey.remove(key);
            } else {
                tagsByKey.put(key, Set.copyOf(tags));
            }
        }
        return stored;
    }

    private boolean write(String key, Object value, Long ttlSeconds) {
        String fullKey = fullKey(key);
        Objects.requireNonNull(value, "value cannot be null");

        if (!circuitBreaker.tryAcquire()) {
            logger.debug("Circuit open, skipping store write for '{}'", fullKey);
            return false;
        }

        try {
            operations.increment();
            boolean stored = store.set(fullKey, value, ttlSeconds != null ? ttlSeconds : config.getDefaultTtlSeconds());
            circuitBreaker.recordSuccess();
            return stored;
        } catch (RuntimeException e) {
            recordStoreFailure();
            logger.error("Set operation failed for key '{}': {}", fullKey, e.getMessage(), e);
            return false;
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T getOrSet(String key, Callable<T> fetchFn, Long ttlSeconds) {
        Objects.requireNonNull(fetchFn, "fetchFn cannot be null");

        T cached = get(key);
        if (cached != null) {
            return cached;
        }

        String pendingKey = PENDING_PREFIX + key;
        PendingRequest<T> mine = new PendingRequest<>(key, new CompletableFuture<>(), clock.millis());
        PendingRequest<?> existing = pendingRequests.putIfAbsent(pendingKey, mine);
        if (existing != null) {
            logger.debug("Joining in-flight fetch for '{}' started at {}", key, existing.startedAt());
            return (T) await(existing);
        }

        try {
            // a fetch that finished between our miss and our registration has already stored its value
            T result = lookup(key, false);
            if (result == null) {
                result = fetchAndCache(key, fetchFn, ttlSeconds);
            }
            mine.result().complete(result);
            return result;
        } catch (Throwable t) {
            if (t instanceof Error) {
                mine.result().completeExceptionally(t);
                throw (Error) t;
            }
            // waiters rethrow this exact instance
            RuntimeException failure = propagate(key, t);
            mine.result().completeExceptionally(failure);
            throw failure;
        } finally {
            pendingRequests.remove(pendingKey, mine);
        }
    }

    private <T> T fetchAndCache(String key, Callable<T> fetchFn, Long ttlSeconds) throws Exception {
        T result;
        try {
            result = fetchFn.call();
        } catch (Exception e) {
            logger.error("Fetch function failed for key '{}': {}", key, e.getMessage());
            throw e;
        }
        if (result != null) {
            set(key, result, ttlSeconds);
        }
        return result;
    }

    private Object await(PendingRequest<?> pending) {
        try {
            return pending.result().get();
        } catch (ExecutionException e) {
            throw propagate(pending.key(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheFetchException("Interrupted while waiting for in-flight fetch of '" + pending.key() + "'", e);
        }
    }

    private static RuntimeException propagate(String key, Throwable t) {
        if (t instanceof RuntimeException) {
            return (RuntimeException) t;
        }
        if (t instanceof Error) {
            throw (Error) t;
        }
        return new CacheFetchException("Fetch failed for key '" + key + "'", t);
    }

    @Override
    public boolean del(String key) {
        String fullKey = fullKey(key);
        tagsByKey.remove(key);
        try {
            boolean deleted = store.del(fullKey);
            circuitBreaker.recordSuccess();
            return deleted;
        } catch (RuntimeException e) {
            recordStoreFailure();
            logger.error("Delete operation failed for key '{}': {}", fullKey, e.getMessage(), e);
            return false;
        }
    }

    @Override
    public int invalidatePattern(String pattern) {
        String fullPattern = fullKey(pattern);
        Pattern regex = Utils.globToRegex(pattern);
        tagsByKey.keySet().removeIf(k -> regex.matcher(k).matches());
        try {
            List<String> keys = store.keys(fullPattern);
            int deleted = 0;
            for (String k : keys) {
                if (store.del(k)) {
                    deleted++;
                }
            }
            circuitBreaker.recordSuccess();
            logger.info("Invalidated {} keys matching pattern '{}'", deleted, pattern);
            return deleted;
        } catch (RuntimeException e) {
            recordStoreFailure();
            logger.error("Pattern invalidation failed for '{}': {}", fullPattern, e.getMessage(), e);
            return 0;
        }
    }

    @Override
    public <T> Map<String, T> getByTags(Collection<String> tags) {
        Objects.requireNonNull(tags, "tags cannot be null");
        Map<String, T> found = new LinkedHashMap<>();
        if (tags.isEmpty()) {
            return found;
        }
        for (Map.Entry<String, Set<String>> e : tagsByKey.entrySet()) {
            if (!e.getValue().containsAll(tags)) {
                continue;
            }
            T value = get(e.getKey());
            if (value != null) {
                found.put(e.getKey(), value);
            } else if (!circuitBreaker.isOpen()) {
                // expired or evicted
                tagsByKey.remove(e.getKey(), e.getValue());
            }
        }
        return found;
    }

    @Override
    public int invalidateByTags(Collection<String> tags) {
        Objects.requireNonNull(tags, "tags cannot be null");
        List<String> tagged = new ArrayList<>();
        for (Map.Entry<String, Set<String>> e : tagsByKey.entrySet()) {
            for (String tag : tags) {
                if (e.getValue().contains(tag)) {
                    tagged.add(e.getKey());
                    break;
                }
            }
        }
        int deleted = 0;
        for (String key : tagged) {
            if (del(key)) {
                deleted++;
            }
        }
        logger.info("Invalidated {} keys tagged with {}", deleted, tags);
        return deleted;
    }

    @Override
    public CacheStats getStats() {
        long h = hits.sum();
        long ops = operations.sum();
        double hitRate = ops > 0 ? (double) h / ops : 0.0;
        return new CacheStats(h, misses.sum(), errors.sum(), ops, hitRate, circuitBreaker.isOpen(),
                pendingRequests.size());
    }

    public CircuitBreakerMetrics getCircuitBreakerMetrics() {
        return circuitBreaker.metrics();
    }

    public CircuitBreakerState getCircuitBreakerState() {
        return circuitBreaker.getState();
    }

    @Override
    public void clear() {
        tagsByKey.clear();
        try {
            store.clear();
            logger.info("Cache cleared");
        } catch (RuntimeException e) {
            logger.error("Clear operation failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Closes the underlying store if this layer created it. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (ownsStore) {
            try {
                store.close();
            } catch (Exception e) {
                logger.warn("Failed to close cache store: {}", e.getMessage(), e);
            }
        }
        logger.info("Closed cache layer with prefix '{}'", config.getKeyPrefix());
    }

    private void recordStoreFailure() {
        errors.increment();
        circuitBreaker.recordFailure();
    }

    private String fullKey(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        return config.getKeyPrefix() + key;
    }
}
