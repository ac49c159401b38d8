package dev.callguard.cache;

import dev.callguard.api.Cache;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Wraps plain functions so that their results are served through {@link Cache#getOrSet}.
 *
 * <pre>{@code
 * Function<String, Profile> profiles = Cached.wrap(cache, id -> "profile:" + id, api::loadProfile, 600L);
 * Profile p = profiles.apply("42"); // loads once, then served from cache for 10 minutes
 * }</pre>
 */
public final class Cached {

    private Cached() {
    }

    /**
     * @param cache     cache to read through
     * @param keyFn     derives the cache key from the argument
     * @param operation the computation to cache
     * @param ttlSeconds TTL for stored results, null for the cache default
     */
    public static <A, R> Function<A, R> wrap(Cache cache,
                                             Function<? super A, String> keyFn,
                                             Function<? super A, ? extends R> operation,
                                             Long ttlSeconds) {
        Objects.requireNonNull(cache, "cache cannot be null");
        Objects.requireNonNull(keyFn, "keyFn cannot be null");
        Objects.requireNonNull(operation, "operation cannot be null");
        return arg -> cache.getOrSet(keyFn.apply(arg), () -> operation.apply(arg), ttlSeconds);
    }

    public static <R> Supplier<R> wrapSupplier(Cache cache, String key, Supplier<? extends R> operation,
                                               Long ttlSeconds) {
        Objects.requireNonNull(cache, "cache cannot be null");
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(operation, "operation cannot be null");
        return () -> cache.getOrSet(key, operation::get, ttlSeconds);
    }
}
