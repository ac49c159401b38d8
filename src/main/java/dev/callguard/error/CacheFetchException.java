package dev.callguard.error;

/**
 * Carries a checked exception thrown by a {@code getOrSet} fetch function, or an
 * interruption while waiting for another caller's fetch.
 */
public class CacheFetchException extends RuntimeException {
    public CacheFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
