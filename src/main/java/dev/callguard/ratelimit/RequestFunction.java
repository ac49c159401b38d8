package dev.callguard.ratelimit;

/**
 * An outbound call made with one credential. Throw an {@link dev.callguard.error.ApiException}
 * with status 429 or 403 to report that the credential was rate limited.
 *
 * @param <T> the call's result
 */
@FunctionalInterface
public interface RequestFunction<T> {
    T apply(String apiKey) throws Exception;
}
