package dev.callguard.cache;

import java.util.List;

/**
 * A key/value store with per-entry expiry, addressed with Redis-style operations.
 *
 * Used by the cache layer for:
 * - get / set / del / exists
 * - expire / ttl
 * - keys (glob)
 * - incr / decr
 * - clear
 *
 * Implementations may be purely in-process or delegate to an external service.
 * Any method may throw; callers treat a throwing store as failed, not as empty.
 */
public interface CacheStore extends AutoCloseable {
    int TTL_ABSENT = -2;
    int TTL_EXPIRED = -1;

    /**
     * @return the stored value, or null when absent or expired
     */
    Object get(String key);

    /**
     * Stores a value. A null or non-positive TTL means the store's default TTL.
     *
     * @return true if the value was stored
     */
    boolean set(String key, Object value, Long ttlSeconds);

    /**
     * @return true if the key was present
     */
    boolean del(String key);

    boolean exists(String key);

    /**
     * Re-arms the expiry of a present key.
     *
     * @return false if the key is absent
     */
    boolean expire(String key, long ttlSeconds);

    /**
     * Keys matching an anchored glob where {@code *} is any run of characters and {@code ?} one character.
     */
    List<String> keys(String pattern);

    /**
     * @return whole seconds remaining, {@link #TTL_ABSENT} for an unknown key,
     *         {@link #TTL_EXPIRED} for an expired key not yet swept
     */
    long ttl(String key);

    /**
     * Increments a numeric value, treating a missing key as 0.
     */
    long incr(String key);

    /**
     * Decrements a numeric value, treating a missing key as 0.
     */
    long decr(String key);

    void clear();

    default void flushAll() {
        clear();
    }

    @Override
    default void close() { /* no-op by default */ }
}
