package dev.callguard.api;

import dev.callguard.core.CacheStats;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Best-effort cache semantics:
 * - A failing or short-circuited backing store never fails the caller: reads miss, writes report false,
 *   deletes report false/0.
 * - The only failure that propagates is the one thrown by a {@code getOrSet} fetch function.
 * - Concurrent {@code getOrSet} misses for one key share a single fetch.
 * - Concurrent writes to one key resolve last-writer-wins.
 */
public interface Cache extends AutoCloseable {

    /**
     * @return the cached value, or null on miss, store failure or open circuit
     */
    <T> T get(String key);

    /**
     * Stores a value. A null TTL uses the configured default.
     *
     * @return false if nothing was written
     */
    boolean set(String key, Object value, Long ttlSeconds);

    default boolean set(String key, Object value) {
        return set(key, value, null);
    }

    /**
     * Stores a value labelled with {@code tags}, replacing any tags the key had before.
     * A plain {@link #set(String, Object, Long)} leaves the key untagged.
     */
    boolean set(String key, Object value, Long ttlSeconds, Collection<String> tags);

    /**
     * @return live values of the keys carrying every one of {@code tags}, by key
     */
    <T> Map<String, T> getByTags(Collection<String> tags);

    /**
     * Deletes every key carrying at least one of {@code tags}.
     *
     * @return how many keys were deleted
     */
    int invalidateByTags(Collection<String> tags);

    /**
     * Returns the cached value, or runs {@code fetchFn} once for all concurrent callers of the
     * same key and caches its non-null result.
     *
     * @throws RuntimeException the fetch function's failure; checked exceptions arrive wrapped in
     *                          {@link dev.callguard.error.CacheFetchException}
     */
    <T> T getOrSet(String key, Callable<T> fetchFn, Long ttlSeconds);

    default <T> T getOrSet(String key, Callable<T> fetchFn) {
        return getOrSet(key, fetchFn, null);
    }

    boolean del(String key);

    /**
     * Deletes every key matching the glob, one at a time.
     *
     * @return how many keys were deleted
     */
    int invalidatePattern(String pattern);

    CacheStats getStats();

    void clear();

    @Override
    void close();
}
