package dev.callguard.error;

import lombok.Getter;

@Getter
public class RetriesExhaustedException extends ApiException {
    private final int attempts;

    public RetriesExhaustedException(String endpoint, int attempts, Throwable lastFailure) {
        super("Rate limit exceeded for " + endpoint + " after " + attempts + " attempts"
                        + (lastFailure == null ? "" : "; last failure: " + lastFailure.getMessage()),
                STATUS_TOO_MANY_REQUESTS, endpoint, false, lastFailure);
        this.attempts = attempts;
    }
}
