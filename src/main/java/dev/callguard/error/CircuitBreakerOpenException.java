package dev.callguard.error;

import lombok.Getter;

/**
 * A call was short-circuited because its circuit breaker is open.
 */
@Getter
public class CircuitBreakerOpenException extends RuntimeException {
    private final String breakerName;

    public CircuitBreakerOpenException(String breakerName) {
        super("Circuit breaker '" + breakerName + "' is open");
        this.breakerName = breakerName;
    }
}
