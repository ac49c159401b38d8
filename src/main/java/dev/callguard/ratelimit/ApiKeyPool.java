package dev.callguard.ratelimit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, interchangeable credentials of one provider.
 *
 * <p>Selection is least-recently-used among keys that are not blocked; ties go to the
 * lower index. A blocked key is never selected while an unblocked one exists.
 */
public final class ApiKeyPool {
    private final String provider;
    private final List<ApiKeyRecord> keys;

    ApiKeyPool(String provider, List<String> credentials) {
        this.provider = Objects.requireNonNull(provider, "provider cannot be null");
        List<ApiKeyRecord> records = new ArrayList<>(credentials.size());
        for (int i = 0; i < credentials.size(); i++) {
            records.add(new ApiKeyRecord(credentials.get(i), provider, i));
        }
        this.keys = Collections.unmodifiableList(records);
    }

    public String provider() {
        return provider;
    }

    public int size() {
        return keys.size();
    }

    /**
     * Picks the least recently used unblocked key and records the request against it.
     *
     * @return the selected key, or null when every key is blocked
     */
    synchronized ApiKeyRecord acquire(long nowMillis) {
        ApiKeyRecord selected = null;
        for (ApiKeyRecord key : keys) {
            if (key.isBlocked(nowMillis)) {
                continue;
            }
            if (selected == null || key.lastUsedAt() < selected.lastUsedAt()) {
                selected = key;
            }
        }
        if (selected != null) {
            selected.track(nowMillis);
        }
        return selected;
    }

    synchronized boolean hasAvailable(long nowMillis) {
        for (ApiKeyRecord key : keys) {
            if (!key.isBlocked(nowMillis)) {
                return true;
            }
        }
        return false;
    }

    synchronized void block(ApiKeyRecord key, long untilMillis) {
        key.blockUntil(untilMillis);
    }

    /**
     * Brings every blocked key's release forward to {@code releaseAtMillis}, if it is later than that.
     *
     * @return number of keys affected
     */
    synchronized int releaseBlockedAt(long nowMillis, long releaseAtMillis) {
        int affected = 0;
        for (ApiKeyRecord key : keys) {
            if (key.isBlocked(nowMillis) && key.blockedUntil() > releaseAtMillis) {
                key.blockUntil(releaseAtMillis);
                affected++;
            }
        }
        return affected;
    }

    /**
     * Unblocks every key immediately.
     *
     * @return number of keys that were blocked
     */
    synchronized int resetBlocked(long nowMillis) {
        int reset = 0;
        for (ApiKeyRecord key : keys) {
            if (key.isBlocked(nowMillis)) {
                reset++;
            }
            key.blockUntil(0);
        }
        return reset;
    }

    synchronized List<ApiKeyRecord> snapshot() {
        List<ApiKeyRecord> copies = new ArrayList<>(keys.size());
        for (ApiKeyRecord key : keys) {
            copies.add(key.copy());
        }
        return copies;
    }
}
