package dev.callguard.core;

/**
 * <pre>
 * CLOSED --(failureThreshold failures)--> OPEN
 * OPEN --(resetTimeout since last failure, next call)--> HALF_OPEN
 * HALF_OPEN --(successThreshold successes)--> CLOSED
 * HALF_OPEN --(any failure)--> OPEN
 * </pre>
 */
public enum CircuitBreakerState {
    /** Calls pass through. */
    CLOSED,
    /** Calls are rejected without reaching the guarded resource. */
    OPEN,
    /** Probe calls pass through while recovery is being confirmed. */
    HALF_OPEN
}
