package dev.callguard.core;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * An in-flight fetch that other callers for the same key wait on.
 *
 * @param key       logical (unprefixed) cache key
 * @param result    completed with the fetched value or the fetch failure
 * @param startedAt epoch millis when the fetch began
 * @param <T>       the fetched type
 */
public record PendingRequest<T>(String key, CompletableFuture<T> result, long startedAt) {
    public PendingRequest {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(result, "result cannot be null");
    }
}
