package dev.callguard.ratelimit;

/**
 * Request pacing for one endpoint: at most {@code requestsPerInterval} per interval, spaced
 * {@code intervalMs / requestsPerInterval} apart.
 *
 * <p>The interval counter resets once a full interval has elapsed since it started. When the
 * interval's budget is spent, the next request waits for the interval to end and opens the
 * next one; otherwise it waits until {@code minInterval} has passed since the previous request.
 *
 * <p>Thread-safety: reservations are synchronized; each caller gets its own slot and sleeps
 * for it outside the lock.
 */
public final class EndpointThrottle {
    private final String endpoint;
    private final int requestsPerInterval;
    private final long intervalMs;
    private final double minIntervalMs;

    private long intervalStartedAt;
    private int requestCountInInterval;
    private long lastRequestAt;
    private boolean anyRequest;

    EndpointThrottle(String endpoint, int requestsPerInterval, long intervalMs, long nowMillis) {
        if (requestsPerInterval <= 0) throw new IllegalArgumentException("requestsPerInterval <= 0");
        if (intervalMs <= 0) throw new IllegalArgumentException("intervalMs <= 0");
        this.endpoint = endpoint;
        this.requestsPerInterval = requestsPerInterval;
        this.intervalMs = intervalMs;
        this.minIntervalMs = (double) intervalMs / requestsPerInterval;
        this.intervalStartedAt = nowMillis;
    }

    /**
     * Claims the next request slot.
     *
     * @return how long the caller must wait before sending, in millis
     */
    synchronized long reserve(long nowMillis) {
        if (nowMillis - intervalStartedAt >= intervalMs) {
            intervalStartedAt = nowMillis;
            requestCountInInterval = 0;
        }

        long waitMs = 0;
        if (requestCountInInterval >= requestsPerInterval) {
            waitMs = Math.max(0, intervalStartedAt + intervalMs - nowMillis);
            intervalStartedAt = nowMillis + waitMs;
            requestCountInInterval = 0;
        } else if (anyRequest) {
            waitMs = Math.max(0, (long) Math.ceil(lastRequestAt + minIntervalMs - nowMillis));
        }

        requestCountInInterval++;
        lastRequestAt = nowMillis + waitMs;
        anyRequest = true;
        return waitMs;
    }

    public String endpoint() {
        return endpoint;
    }

    public int requestsPerInterval() {
        return requestsPerInterval;
    }

    public double minIntervalMs() {
        return minIntervalMs;
    }

    public synchronized long intervalStartedAt() {
        return intervalStartedAt;
    }

    public synchronized int requestCountInInterval() {
        return requestCountInInterval;
    }

    public synchronized long lastRequestAt() {
        return lastRequestAt;
    }
}
