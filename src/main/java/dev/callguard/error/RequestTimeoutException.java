package dev.callguard.error;

import lombok.Getter;

@Getter
public class RequestTimeoutException extends ApiException {
    private final long timeoutMs;
    private final int attempts;

    public RequestTimeoutException(String endpoint, long timeoutMs, int attempts, Throwable lastFailure) {
        super("Request timed out after " + timeoutMs + "ms for " + endpoint + " (" + attempts + " attempts)",
                408, endpoint, false, lastFailure);
        this.timeoutMs = timeoutMs;
        this.attempts = attempts;
    }
}
