package dev.callguard.core;

import dev.callguard.config.CircuitBreakerConfig;
import dev.callguard.error.CircuitBreakerOpenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Failure-counting gate in front of a guarded resource.
 *
 * <p>Usage:
 * <pre>{@code
 * if (!breaker.tryAcquire()) {
 *     return null; // short-circuited
 * }
 * try {
 *     Object v = store.get(key);
 *     breaker.recordSuccess();
 *     return v;
 * } catch (RuntimeException e) {
 *     breaker.recordFailure();
 *     return null;
 * }
 * }</pre>
 *
 * <p>or, for a call whose failures should propagate, {@code breaker.execute(() -> client.send(req))}.
 *
 * <p>The failure count only grows while CLOSED; it is cleared when a HALF_OPEN probe period
 * completes or on {@link #reset()}. Every error counts, whatever its type.
 *
 * <p><strong>Thread Safety:</strong> all transitions happen under this instance's monitor, so
 * concurrent completions are applied one after another.
 */
public class CircuitBreaker {
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final int failureThreshold;
    private final int successThreshold;
    private final long resetTimeoutMillis;
    private final Clock clock;

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int failureCount;
    private int successCount;
    private int halfOpenSuccesses;
    private long lastFailureAt;
    private long lastSuccessAt;
    private long halfOpenSince;
    private long totalCalls;
    private long rejectedCalls;

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        Objects.requireNonNull(config, "config cannot be null");
        this.name = Objects.requireNonNull(name, "name cannot be null");
        if (config.getFailureThreshold() <= 0) {
            throw new IllegalArgumentException("failureThreshold must be > 0, got " + config.getFailureThreshold());
        }
        if (config.getSuccessThreshold() <= 0) {
            throw new IllegalArgumentException("successThreshold must be > 0, got " + config.getSuccessThreshold());
        }
        Objects.requireNonNull(config.getResetTimeout(), "resetTimeout cannot be null");
        this.failureThreshold = config.getFailureThreshold();
        this.successThreshold = config.getSuccessThreshold();
        this.resetTimeoutMillis = config.getResetTimeout().toMillis();
        this.clock = (clock != null) ? clock : Clock.systemUTC();
    }

    /**
     * Decides whether a call may proceed. While OPEN, the first call made after the reset
     * timeout moves the breaker to HALF_OPEN and is admitted as a probe.
     *
     * @return false if the call must be short-circuited
     */
    public synchronized boolean tryAcquire() {
        totalCalls++;
        if (state != CircuitBreakerState.OPEN) {
            return true;
        }
        long now = clock.millis();
        if (now - lastFailureAt >= resetTimeoutMillis) {
            state = CircuitBreakerState.HALF_OPEN;
            halfOpenSince = now;
            halfOpenSuccesses = 0;
            logger.info("[{}] Circuit breaker half-open after {}ms without failures", name, now - lastFailureAt);
            return true;
        }
        rejectedCalls++;
        return false;
    }

    public synchronized void recordSuccess() {
        successCount++;
        lastSuccessAt = clock.millis();
        if (state == CircuitBreakerState.HALF_OPEN && ++halfOpenSuccesses >= successThreshold) {
            state = CircuitBreakerState.CLOSED;
            failureCount = 0;
            halfOpenSuccesses = 0;
            logger.info("[{}] Circuit breaker closed after {} successful probes", name, successThreshold);
        }
    }

    public synchronized void recordFailure() {
        failureCount++;
        lastFailureAt = clock.millis();
        if (state == CircuitBreakerState.HALF_OPEN) {
            state = CircuitBreakerState.OPEN;
            halfOpenSuccesses = 0;
            logger.warn("[{}] Circuit breaker re-opened: probe failed after {}ms half-open",
                    name, lastFailureAt - halfOpenSince);
        } else if (state == CircuitBreakerState.CLOSED && failureCount >= failureThreshold) {
            state = CircuitBreakerState.OPEN;
            logger.warn("[{}] Circuit breaker opened after {} failures", name, failureCount);
        }
    }

    /**
     * Runs {@code operation} through the breaker, recording its outcome.
     *
     * @throws CircuitBreakerOpenException if the call is short-circuited
     * @throws Exception                   whatever {@code operation} throws, after it is counted
     */
    public <T> T execute(Callable<T> operation) throws Exception {
        Objects.requireNonNull(operation, "operation cannot be null");
        if (!tryAcquire()) {
            throw new CircuitBreakerOpenException(name);
        }
        T result;
        try {
            result = operation.call();
        } catch (Exception e) {
            recordFailure();
            throw e;
        }
        recordSuccess();
        return result;
    }

    public synchronized CircuitBreakerState getState() {
        return state;
    }

    public synchronized boolean isOpen() {
        return state == CircuitBreakerState.OPEN;
    }

    public synchronized CircuitBreakerMetrics metrics() {
        return new CircuitBreakerMetrics(state, failureCount, successCount, lastFailureAt, lastSuccessAt,
                totalCalls, rejectedCalls);
    }

    /**
     * Forces CLOSED and clears the counters.
     */
    public synchronized void reset() {
        state = CircuitBreakerState.CLOSED;
        failureCount = 0;
        successCount = 0;
        halfOpenSuccesses = 0;
        logger.info("[{}] Circuit breaker reset", name);
    }
}
