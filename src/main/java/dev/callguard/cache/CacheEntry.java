package dev.callguard.cache;

import java.util.Objects;

/**
 * A stored value with its expiry and size estimate.
 *
 * <p>Instances are owned by a single store and only mutated under that store's lock.
 */
public final class CacheEntry {
    private final Object value;
    private final long createdAt;
    private final long sizeBytes;
    private long expiresAt;
    private long accessCount;

    public CacheEntry(Object value, long createdAt, long expiresAt, long sizeBytes) {
        this.value = Objects.requireNonNull(value, "value cannot be null");
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes must be >= 0, got " + sizeBytes);
        }
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.sizeBytes = sizeBytes;
    }

    public Object value() {
        return value;
    }

    public long createdAt() {
        return createdAt;
    }

    public long expiresAt() {
        return expiresAt;
    }

    public long sizeBytes() {
        return sizeBytes;
    }

    public long accessCount() {
        return accessCount;
    }

    public boolean isExpired(long nowMillis) {
        return nowMillis >= expiresAt;
    }

    void touch() {
        accessCount++;
    }

    void expireAt(long expiresAtMillis) {
        this.expiresAt = expiresAtMillis;
    }
}
