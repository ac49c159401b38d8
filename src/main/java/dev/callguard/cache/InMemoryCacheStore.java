package dev.callguard.cache;

import dev.callguard.config.CacheConfig;
import dev.callguard.core.Utils;
import dev.callguard.ser.JsonSerializer;
import dev.callguard.ser.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;

/**
 * In-process store with per-entry expiry and an estimated memory ceiling.
 *
 * <p>Entries are kept in insertion order, so the head of the map is always the entry with the
 * oldest {@code createdAt}; when a write would push the estimated size over the ceiling,
 * entries are evicted from the head until it fits. Re-setting a key counts as a new insertion.
 *
 * <p>Expired entries are removed by a periodic sweep running on a daemon thread owned by this
 * store, and lazily by {@link #get(String)}. {@link #close()} stops the sweep.
 *
 * <p><strong>Thread Safety:</strong> all operations are serialized on one lock. Value
 * serialization for size accounting happens outside it.
 */
public class InMemoryCacheStore implements CacheStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryCacheStore.class);

    /** Added to every entry's serialized length to account for key, metadata and map overhead. */
    static final long ENTRY_OVERHEAD_BYTES = 64;

    private final long maxMemoryBytes;
    private final long defaultTtlSeconds;
    private final Serializer<Object> serializer;
    private final Clock clock;
    private final Object lock = new Object();
    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final ScheduledExecutorService sweeper;

    private long memoryUsageBytes;
    private long evictionCount;
    private long expirationCount;

    public InMemoryCacheStore(CacheConfig config, Clock clock) {
        this(config.getMaxMemoryBytes(), config.getDefaultTtlSeconds(), config.getSweepIntervalMillis(),
                new JsonSerializer<>(), clock);
    }

    /**
     * @param maxMemoryBytes      estimated size ceiling
     * @param defaultTtlSeconds   TTL applied when a write passes none
     * @param sweepIntervalMillis period of the expiry sweep; {@code <= 0} disables the background task
     * @param serializer          used to estimate value sizes
     * @param clock               time source, null for system UTC
     */
    public InMemoryCacheStore(long maxMemoryBytes,
                              long defaultTtlSeconds,
                              long sweepIntervalMillis,
                              Serializer<Object> serializer,
                              Clock clock) {
        if (maxMemoryBytes <= 0) {
            throw new IllegalArgumentException("maxMemoryBytes must be > 0, got " + maxMemoryBytes);
        }
        if (defaultTtlSeconds <= 0) {
            throw new IllegalArgumentException("defaultTtlSeconds must be > 0, got " + defaultTtlSeconds);
        }
        this.maxMemoryBytes = maxMemoryBytes;
        this.defaultTtlSeconds = defaultTtlSeconds;
        this.serializer = Objects.requireNonNull(serializer, "serializer cannot be null");
        this.clock = (clock != null) ? clock : Clock.systemUTC();

        if (sweepIntervalMillis > 0) {
            this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "callguard-sweep");
                t.setDaemon(true);
                return t;
            });
            sweeper.scheduleWithFixedDelay(this::sweepQuietly, sweepIntervalMillis, sweepIntervalMillis,
                    TimeUnit.MILLISECONDS);
        } else {
            this.sweeper = null;
        }

        logger.info("Initialized in-memory cache store: ceiling {} bytes, default TTL {}s, sweep every {}ms",
                maxMemoryBytes, defaultTtlSeconds, sweepIntervalMillis > 0 ? sweepIntervalMillis : "never");
    }

    @Override
    public Object get(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        ensureOpen();
        synchronized (lock) {
            CacheEntry entry = liveEntry(key, clock.millis());
            if (entry == null) {
                return null;
            }
            entry.touch();
            return entry.value();
        }
    }

    @Override
    public boolean set(String key, Object value, Long ttlSeconds) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        ensureOpen();

        long size = estimateSize(value);
        if (size > maxMemoryBytes) {
            logger.warn("Refusing to cache key '{}': estimated {} bytes exceeds the {} byte ceiling",
                    key, size, maxMemoryBytes);
            return false;
        }

        synchronized (lock) {
            putLocked(key, value, resolveTtl(ttlSeconds), size);
        }
        return true;
    }

    @Override
    public boolean del(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        ensureOpen();
        synchronized (lock) {
            return removeLocked(key) != null;
        }
    }

    @Override
    public boolean exists(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        ensureOpen();
        synchronized (lock) {
            return liveEntry(key, clock.millis()) != null;
        }
    }

    @Override
    public boolean expire(String key, long ttlSeconds) {
        Objects.requireNonNull(key, "key cannot be null");
        ensureOpen();
        synchronized (lock) {
            long now = clock.millis();
            CacheEntry entry = liveEntry(key, now);
            if (entry == null) {
                return false;
            }
            entry.expireAt(deadline(now, ttlSeconds));
            return true;
        }
    }

    @Override
    public List<String> keys(String pattern) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        ensureOpen();
        Pattern regex = Utils.globToRegex(pattern);
        List<String> matched = new ArrayList<>();
        synchronized (lock) {
            long now = clock.millis();
            for (Map.Entry<String, CacheEntry> e : entries.entrySet()) {
                if (!e.getValue().isExpired(now) && regex.matcher(e.getKey()).matches()) {
                    matched.add(e.getKey());
                }
            }
        }
        return matched;
    }

    @Override
    public long ttl(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        ensureOpen();
        synchronized (lock) {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                return TTL_ABSENT;
            }
            long remaining = entry.expiresAt() - clock.millis();
            return remaining > 0 ? remaining / 1000 : TTL_EXPIRED;
        }
    }

    @Override
    public long incr(String key) {
        return addAndGet(key, 1);
    }

    @Override
    public long decr(String key) {
        return addAndGet(key, -1);
    }

    private long addAndGet(String key, long delta) {
        Objects.requireNonNull(key, "key cannot be null");
        ensureOpen();
        synchronized (lock) {
            CacheEntry entry = liveEntry(key, clock.millis());
            long current = 0;
            if (entry != null) {
                if (!(entry.value() instanceof Number)) {
                    throw new IllegalStateException("Value at key '" + key + "' is not numeric: "
                            + entry.value().getClass().getSimpleName());
                }
                current = ((Number) entry.value()).longValue();
            }
            long updated = current + delta;
            putLocked(key, updated, defaultTtlSeconds, estimateSize(updated));
            return updated;
        }
    }

    @Override
    public void clear() {
        ensureOpen();
        synchronized (lock) {
            int size = entries.size();
            entries.clear();
            memoryUsageBytes = 0;
            logger.debug("Cleared {} entries", size);
        }
    }

    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    public int sweepExpired() {
        int removed = 0;
        synchronized (lock) {
            long now = clock.millis();
            Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                CacheEntry entry = it.next().getValue();
                if (entry.isExpired(now)) {
                    it.remove();
                    memoryUsageBytes -= entry.sizeBytes();
                    removed++;
                }
            }
            expirationCount += removed;
        }
        if (removed > 0) {
            logger.debug("Swept {} expired entries", removed);
        }
        return removed;
    }

    private void sweepQuietly() {
        try {
            sweepExpired();
        } catch (RuntimeException e) {
            // keep the schedule alive; the next run retries
            logger.warn("Expiry sweep failed: {}", e.getMessage(), e);
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public long memoryUsageBytes() {
        synchronized (lock) {
            return memoryUsageBytes;
        }
    }

    public long evictionCount() {
        synchronized (lock) {
            return evictionCount;
        }
    }

    public long expirationCount() {
        synchronized (lock) {
            return expirationCount;
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Stops the expiry sweep and drops all entries. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            logger.debug("Close called on already closed in-memory cache store");
            return;
        }
        if (sweeper != null) {
            sweeper.shutdownNow();
        }
        synchronized (lock) {
            entries.clear();
            memoryUsageBytes = 0;
        }
        logger.info("Closed in-memory cache store");
    }

    private void putLocked(String key, Object value, long ttlSeconds, long size) {
        removeLocked(key);

        while (!entries.isEmpty() && memoryUsageBytes + size > maxMemoryBytes) {
            Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
            Map.Entry<String, CacheEntry> oldest = it.next();
            it.remove();
            memoryUsageBytes -= oldest.getValue().sizeBytes();
            evictionCount++;
            logger.debug("Evicted oldest entry '{}' ({} bytes) to make room for '{}'",
                    oldest.getKey(), oldest.getValue().sizeBytes(), key);
        }

        long now = clock.millis();
        entries.put(key, new CacheEntry(value, now, deadline(now, ttlSeconds), size));
        memoryUsageBytes += size;
    }

    private CacheEntry removeLocked(String key) {
        CacheEntry removed = entries.remove(key);
        if (removed != null) {
            memoryUsageBytes -= removed.sizeBytes();
        }
        return removed;
    }

    private CacheEntry liveEntry(String key, long now) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(now)) {
            removeLocked(key);
            expirationCount++;
            return null;
        }
        return entry;
    }

    // saturating: a TTL too large to represent never expires
    static long deadline(long now, long ttlSeconds) {
        try {
            return Math.addExact(now, Math.multiplyExact(ttlSeconds, 1000L));
        } catch (ArithmeticException e) {
            return ttlSeconds < 0 ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }

    private long resolveTtl(Long ttlSeconds) {
        return (ttlSeconds == null || ttlSeconds <= 0) ? defaultTtlSeconds : ttlSeconds;
    }

    private long estimateSize(Object value) {
        return serializer.serialize(value).length + ENTRY_OVERHEAD_BYTES;
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("In-memory cache store is closed");
        }
    }
}
