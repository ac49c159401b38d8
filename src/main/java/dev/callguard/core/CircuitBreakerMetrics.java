package dev.callguard.core;

/**
 * Point-in-time view of a circuit breaker.
 *
 * @param lastFailureAt epoch millis of the last failure, 0 if none
 * @param lastSuccessAt epoch millis of the last success, 0 if none
 * @param totalCalls    calls admitted or rejected by {@code tryAcquire}
 * @param rejectedCalls calls short-circuited while OPEN
 */
public record CircuitBreakerMetrics(
        CircuitBreakerState state,
        int failureCount,
        int successCount,
        long lastFailureAt,
        long lastSuccessAt,
        long totalCalls,
        long rejectedCalls
) {
}
