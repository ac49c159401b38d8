package dev.callguard.ratelimit;

import dev.callguard.config.RateLimitOptions;
import dev.callguard.error.ApiException;
import dev.callguard.error.NoCredentialsException;
import dev.callguard.error.RequestTimeoutException;
import dev.callguard.error.RetriesExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Executes outbound calls under per-endpoint pacing, with retries, exponential backoff and
 * rotation across a provider's interchangeable API keys.
 *
 * <p>Retry policy:
 * <ul>
 *   <li>Rate-limit failures (an {@link ApiException} with status 429 or 403) block the key used for
 *       {@link #KEY_COOLDOWN} and retry at once with another key. When no unblocked key remains, the
 *       caller waits the current backoff delay (scaled into its upper half when jitter is on) and
 *       the blocked keys are released when that wait ends. The delay doubles on every
 *       rate-limited attempt up to {@code maxDelayMs}.</li>
 *   <li>Any other failure waits the fixed {@code initialDelayMs} before retrying, or propagates
 *       immediately with {@code failFast}.</li>
 *   <li>The loop ends after {@code maxRetries} attempts or {@code timeoutMs} from the first attempt.
 *       No wait extends past {@code timeoutMs}.</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> key pools and throttles are individually synchronized; any
 * number of threads may execute requests concurrently.
 *
 * <p><strong>Usage Example:</strong>
 * <pre>{@code
 * RateLimitManager limiter = new RateLimitManager();
 * limiter.registerApiKeys("search", List.of(keyA, keyB));
 * limiter.configureEndpoint("search/query", 10, 1000);
 *
 * Result r = limiter.executeRateLimitedRequest(
 *         apiKey -> searchClient.query(apiKey, "java"),
 *         new RateLimitOptions("search", "search/query").setMaxRetries(3));
 * }</pre>
 */
public class RateLimitManager {
    private static final Logger logger = LoggerFactory.getLogger(RateLimitManager.class);

    public static final Duration KEY_COOLDOWN = Duration.ofMinutes(5);

    private final Map<String, ApiKeyPool> keyPools = new ConcurrentHashMap<>();
    private final Map<String, EndpointThrottle> throttles = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    public RateLimitManager() {
        this(null, null);
    }

    public RateLimitManager(Clock clock, Sleeper sleeper) {
        this(clock, sleeper, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param clock   time source, null for system UTC
     * @param sleeper blocking wait, null for {@link Thread#sleep(long)}
     * @param random  uniform source in [0, 1) for jitter
     */
    public RateLimitManager(Clock clock, Sleeper sleeper, DoubleSupplier random) {
        this.clock = (clock != null) ? clock : Clock.systemUTC();
        this.sleeper = (sleeper != null) ? sleeper : Sleeper.THREAD;
        this.random = Objects.requireNonNull(random, "random cannot be null");
    }

    /**
     * Registers (or replaces) the credentials of a provider. An empty list is ignored.
     */
    public void registerApiKeys(String provider, List<String> credentials) {
        Objects.requireNonNull(provider, "provider cannot be null");
        if (credentials == null || credentials.isEmpty()) {
            logger.warn("No API keys provided for '{}'", provider);
            return;
        }
        for (String credential : credentials) {
            Objects.requireNonNull(credential, "credential cannot be null");
        }
        keyPools.put(provider, new ApiKeyPool(provider, credentials));
        logger.info("Registered {} API keys for '{}'", credentials.size(), provider);
    }

    /**
     * Limits an endpoint to {@code requestsPerInterval} requests per {@code intervalMs}.
     */
    public void configureEndpoint(String endpoint, int requestsPerInterval, long intervalMs) {
        Objects.requireNonNull(endpoint, "endpoint cannot be null");
        throttles.put(endpoint, new EndpointThrottle(endpoint, requestsPerInterval, intervalMs, clock.millis()));
        logger.debug("Configured rate limits for '{}': {} requests per {}ms", endpoint, requestsPerInterval, intervalMs);
    }

    /**
     * Runs {@code requestFn} with a credential of {@code options.provider}, applying throttling,
     * key rotation and retries.
     *
     * @return the first successful result
     * @throws NoCredentialsException     if the provider has no registered keys
     * @throws RetriesExhaustedException  after {@code maxRetries} failed attempts
     * @throws RequestTimeoutException    when {@code timeoutMs} elapses before success
     * @throws RuntimeException           a non rate-limit failure when {@code failFast} is set
     */
    public <T> T executeRateLimitedRequest(RequestFunction<T> requestFn, RateLimitOptions options) {
        Objects.requireNonNull(requestFn, "requestFn cannot be null");
        Objects.requireNonNull(options, "options cannot be null");
        if (options.getMaxRetries() < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1, got " + options.getMaxRetries());
        }

        MDC.put("provider", options.getProvider());
        MDC.put("endpoint", options.getEndpoint());
        try {
            return executeInternal(requestFn, options);
        } finally {
            MDC.remove("provider");
            MDC.remove("endpoint");
        }
    }

    private <T> T executeInternal(RequestFunction<T> requestFn, RateLimitOptions options) {
        String provider = options.getProvider();
        String endpoint = options.getEndpoint();

        ApiKeyPool pool = keyPools.get(provider);
        if (pool == null || pool.size() == 0) {
            throw new NoCredentialsException(provider, endpoint);
        }

        EndpointThrottle throttle = throttles.get(endpoint);
        if (throttle != null) {
            long waitMs = throttle.reserve(clock.millis());
            if (waitMs > 0) {
                logger.debug("Throttling request: waiting {}ms to respect rate limits for '{}'", waitMs, endpoint);
                pause(waitMs, endpoint);
            }
        }

        int maxRetries = options.getMaxRetries();
        long currentDelay = options.getInitialDelayMs();
        long startedAt = clock.millis();
        int attempts = 0;
        Exception lastFailure = null;

        while (attempts < maxRetries) {
            long now = clock.millis();
            if (now - startedAt > options.getTimeoutMs()) {
                throw new RequestTimeoutException(endpoint, options.getTimeoutMs(), attempts, lastFailure);
            }

            ApiKeyRecord key = pool.acquire(now);
            if (key == null) {
                pool.releaseBlockedAt(now, now + currentDelay);
                logger.warn("All API keys for '{}' are blocked, waiting {}ms for release", provider, currentDelay);
                pauseWithinBudget(currentDelay, startedAt, options, attempts, lastFailure);
                continue;
            }

            try {
                T result = requestFn.apply(key.credential());
                if (attempts > 0) {
                    logger.info("Request to '{}' succeeded after {} failed attempts", endpoint, attempts);
                }
                return result;
            } catch (Exception e) {
                attempts++;
                lastFailure = e;

                if (ApiException.isRateLimited(e)) {
                    logger.warn("Rate limit hit for '{}' on '{}' with key {}, attempt {}/{}",
                            provider, endpoint, key.index(), attempts, maxRetries);

                    long waitMs = backoff(currentDelay, options.isUseJitter());
                    if (options.isRotateKeysOnRateLimit()) {
                        long blockedAt = clock.millis();
                        pool.block(key, blockedAt + KEY_COOLDOWN.toMillis());
                        if (pool.hasAvailable(blockedAt)) {
                            logger.debug("Switched away from API key {} for '{}'", key.index(), provider);
                            continue;
                        }
                        // every key is blocked: release them all when this backoff ends
                        logger.warn("All API keys for '{}' are blocked, waiting for backoff", provider);
                        pool.releaseBlockedAt(blockedAt, blockedAt + waitMs);
                    }

                    if (attempts < maxRetries) {
                        logger.debug("Backing off {}ms before retrying '{}'", waitMs, endpoint);
                        pauseWithinBudget(waitMs, startedAt, options, attempts, lastFailure);
                    }
                    currentDelay = Math.min(currentDelay * 2, options.getMaxDelayMs());
                } else {
                    if (options.isFailFast()) {
                        throw propagate(e, endpoint);
                    }
                    logger.error("Error during request to '{}', attempt {}/{}: {}",
                            endpoint, attempts, maxRetries, e.getMessage(), e);
                    if (attempts < maxRetries) {
                        pauseWithinBudget(options.getInitialDelayMs(), startedAt, options, attempts, lastFailure);
                    }
                }
            }
        }

        throw new RetriesExhaustedException(endpoint, attempts, lastFailure);
    }

    /**
     * Unblocks every key of a provider immediately.
     *
     * @return number of keys that were blocked
     */
    public int resetBlockedKeys(String provider) {
        ApiKeyPool pool = keyPools.get(provider);
        if (pool == null) {
            return 0;
        }
        int reset = pool.resetBlocked(clock.millis());
        logger.debug("Reset {} blocked API keys for '{}'", reset, provider);
        return reset;
    }

    /**
     * @return copies of the provider's key records, in registration order
     */
    public List<ApiKeyRecord> getKeyUsage(String provider) {
        ApiKeyPool pool = keyPools.get(provider);
        return pool == null ? Collections.emptyList() : pool.snapshot();
    }

    public boolean hasApiKeys(String provider) {
        ApiKeyPool pool = keyPools.get(provider);
        return pool != null && pool.size() > 0;
    }

    /**
     * @return the endpoint's throttle, or null if the endpoint is not throttled
     */
    public EndpointThrottle getThrottle(String endpoint) {
        return throttles.get(endpoint);
    }

    long backoff(long delayMs, boolean useJitter) {
        if (!useJitter) {
            return delayMs;
        }
        double factor = 0.5 + random.getAsDouble() * 0.5;
        return (long) (delayMs * factor);
    }

    /**
     * Waits at most until {@code timeoutMs} after {@code startedAt}, and times out if that is
     * where the wait ended.
     */
    private void pauseWithinBudget(long millis, long startedAt, RateLimitOptions options, int attempts,
                                   Exception lastFailure) {
        long deadline = startedAt + options.getTimeoutMs();
        pause(Math.min(millis, Math.max(0, deadline - clock.millis())), options.getEndpoint());
        if (clock.millis() >= deadline) {
            throw new RequestTimeoutException(options.getEndpoint(), options.getTimeoutMs(), attempts, lastFailure);
        }
    }

    private void pause(long millis, String endpoint) {
        if (millis <= 0) {
            return;
        }
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApiException("Interrupted while waiting to call " + endpoint, 0, endpoint, false, e);
        }
    }

    private static RuntimeException propagate(Exception e, String endpoint) {
        if (e instanceof RuntimeException) {
            return (RuntimeException) e;
        }
        return new ApiException("Request to " + endpoint + " failed: " + e.getMessage(), 0, endpoint, false, e);
    }
}
