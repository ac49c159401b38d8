package dev.callguard.ratelimit;

import dev.callguard.core.Utils;

import java.util.Objects;

/**
 * Usage state of one credential in a provider's pool.
 *
 * <p>A key is blocked until {@code blockedUntil}; blocking is a deadline rather than a flag so
 * that it lapses on its own once the clock passes it. Mutated only under the owning
 * {@link ApiKeyPool}'s lock; callers outside the pool only ever see copies.
 */
public final class ApiKeyRecord {
    private final String credential;
    private final String provider;
    private final int index;
    private long requestCount;
    private long lastUsedAt;
    private long blockedUntil;

    ApiKeyRecord(String credential, String provider, int index) {
        this.credential = Objects.requireNonNull(credential, "credential cannot be null");
        this.provider = Objects.requireNonNull(provider, "provider cannot be null");
        this.index = index;
    }

    private ApiKeyRecord(ApiKeyRecord other) {
        this.credential = other.credential;
        this.provider = other.provider;
        this.index = other.index;
        this.requestCount = other.requestCount;
        this.lastUsedAt = other.lastUsedAt;
        this.blockedUntil = other.blockedUntil;
    }

    public String credential() {
        return credential;
    }

    public String provider() {
        return provider;
    }

    /** Position in the pool, used in logs instead of the credential. */
    public int index() {
        return index;
    }

    public long requestCount() {
        return requestCount;
    }

    public long lastUsedAt() {
        return lastUsedAt;
    }

    public long blockedUntil() {
        return blockedUntil;
    }

    public boolean isBlocked(long nowMillis) {
        return nowMillis < blockedUntil;
    }

    void track(long nowMillis) {
        requestCount++;
        lastUsedAt = nowMillis;
    }

    void blockUntil(long untilMillis) {
        blockedUntil = untilMillis;
    }

    ApiKeyRecord copy() {
        return new ApiKeyRecord(this);
    }

    @Override
    public String toString() {
        return "ApiKeyRecord{provider=" + provider + ", index=" + index + ", credential=" + Utils.mask(credential)
                + ", requestCount=" + requestCount + ", lastUsedAt=" + lastUsedAt + ", blockedUntil=" + blockedUntil + '}';
    }
}
