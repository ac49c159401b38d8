package dev.callguard.config;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

import java.time.Duration;

@Getter
@Setter
@Accessors(chain = true)
public class CircuitBreakerConfig {
    private int failureThreshold = 5;            // failures before CLOSED -> OPEN
    private int successThreshold = 3;            // consecutive HALF_OPEN successes before -> CLOSED
    private Duration resetTimeout = Duration.ofSeconds(60); // quiet time after the last failure before probing
}
