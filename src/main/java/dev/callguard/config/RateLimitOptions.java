package dev.callguard.config;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Per-call policy for {@code RateLimitManager.executeRateLimitedRequest}.
 * Provider and endpoint are required; everything else has a default.
 */
@Getter
@Setter
@Accessors(chain = true)
public class RateLimitOptions {
    private final String provider;
    private final String endpoint;

    private int maxRetries = 5;
    private long initialDelayMs = 1000;
    private long maxDelayMs = 60_000;
    private long timeoutMs = 30_000;             // wall-clock budget from the first attempt
    private boolean useJitter = true;            // wait delay * uniform(0.5, 1.0)
    private boolean rotateKeysOnRateLimit = true;
    private boolean failFast = false;            // propagate non rate-limit failures immediately

    public RateLimitOptions(String provider, String endpoint) {
        this.provider = Objects.requireNonNull(provider, "provider cannot be null");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint cannot be null");
    }
}
