package dev.callguard.cache;

import dev.callguard.error.StoreFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Placeholder for an out-of-process store such as Redis.
 *
 * <p>No client protocol is implemented: every operation fails with a
 * {@link StoreFailureException}. A cache layer configured with this store and without
 * memory fallback therefore degrades to "always miss" once its circuit breaker opens.
 */
public final class ExternalCacheStore implements CacheStore {
    private static final Logger logger = LoggerFactory.getLogger(ExternalCacheStore.class);

    private final String url;

    public ExternalCacheStore(String url) {
        this.url = url;
        logger.warn("External cache store at '{}' is not supported; all operations will fail", url);
    }

    public String url() {
        return url;
    }

    @Override
    public Object get(String key) {
        throw unsupported("get");
    }

    @Override
    public boolean set(String key, Object value, Long ttlSeconds) {
        throw unsupported("set");
    }

    @Override
    public boolean del(String key) {
        throw unsupported("del");
    }

    @Override
    public boolean exists(String key) {
        throw unsupported("exists");
    }

    @Override
    public boolean expire(String key, long ttlSeconds) {
        throw unsupported("expire");
    }

    @Override
    public List<String> keys(String pattern) {
        throw unsupported("keys");
    }

    @Override
    public long ttl(String key) {
        throw unsupported("ttl");
    }

    @Override
    public long incr(String key) {
        throw unsupported("incr");
    }

    @Override
    public long decr(String key) {
        throw unsupported("decr");
    }

    @Override
    public void clear() {
        throw unsupported("clear");
    }

    private StoreFailureException unsupported(String operation) {
        return new StoreFailureException("External cache store not supported (" + operation + " on " + url + ")");
    }
}
