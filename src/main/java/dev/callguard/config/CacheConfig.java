package dev.callguard.config;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

@Getter
@Setter
@Accessors(chain = true)
public class CacheConfig {
    // System property helpers for deploy-time overrides (safe fallbacks)
    private static String prop(String key, String def) {
        String v = System.getProperty(key);
        return v == null ? def : v;
    }
    private static long longProp(String key, long def) {
        String v = System.getProperty(key);
        if (v == null) return def;
        try { return Long.parseLong(v.trim()); } catch (NumberFormatException e) { return def; }
    }
    private static StoreType storeTypeProp() {
        try { return StoreType.valueOf(prop("cg.storeType", "IN_MEMORY")); }
        catch (IllegalArgumentException e) { return StoreType.IN_MEMORY; }
    }

    // Entries
    private long defaultTtlSeconds = longProp("cg.defaultTtlSeconds", 3600);  // used when a call passes no TTL
    private long maxMemorySizeMB = longProp("cg.maxMemorySizeMB", 100);       // estimated ceiling for the in-memory store
    private String keyPrefix = prop("cg.keyPrefix", "callguard:");            // namespace prepended to every key

    // Backing store
    private StoreType storeType = storeTypeProp();
    private String externalStoreUrl = null;           // target of the EXTERNAL store
    private boolean fallbackToMemory = true;          // EXTERNAL is not supported yet; use memory instead
    private long sweepIntervalMillis = longProp("cg.sweepIntervalMillis", 60_000); // expiry sweep period

    // Guard around store calls
    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();

    public long getMaxMemoryBytes() {
        return maxMemorySizeMB * 1024L * 1024L;
    }
}
