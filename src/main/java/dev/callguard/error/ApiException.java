package dev.callguard.error;

import lombok.Getter;

/**
 * Failure of an outbound API call, or of the rate-limited execution around it.
 *
 * <p>{@code status} follows HTTP semantics; {@code 0} means no status was available.
 * Request functions signal provider throttling by throwing an instance with status 429 or 403.
 */
@Getter
public class ApiException extends RuntimeException {
    public static final int STATUS_FORBIDDEN = 403;
    public static final int STATUS_TOO_MANY_REQUESTS = 429;

    private final int status;
    private final String endpoint;
    private final boolean retryable;

    public ApiException(String message, int status, String endpoint, boolean retryable) {
        this(message, status, endpoint, retryable, null);
    }

    public ApiException(String message, int status, String endpoint, boolean retryable, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.endpoint = endpoint;
        this.retryable = retryable;
    }

    public static ApiException rateLimited(String endpoint) {
        return new ApiException("Rate limited by " + endpoint, STATUS_TOO_MANY_REQUESTS, endpoint, true);
    }

    public boolean isRateLimited() {
        return status == STATUS_TOO_MANY_REQUESTS || status == STATUS_FORBIDDEN;
    }

    public static boolean isRateLimited(Throwable t) {
        return t instanceof ApiException && ((ApiException) t).isRateLimited();
    }
}
