package dev.callguard.error;

/**
 * A backing store could not complete an operation. The cache layer absorbs these.
 */
public class StoreFailureException extends RuntimeException {
    public StoreFailureException(String message) {
        super(message);
    }

    public StoreFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
