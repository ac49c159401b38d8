package dev.callguard.core;

/**
 * Counters of one cache layer.
 *
 * @param operations store reads and writes actually attempted (short-circuited calls excluded)
 * @param hitRate    hits / operations, 0 when nothing was attempted
 */
public record CacheStats(
        long hits,
        long misses,
        long errors,
        long operations,
        double hitRate,
        boolean circuitBreakerOpen,
        int pendingRequests
) {
}
