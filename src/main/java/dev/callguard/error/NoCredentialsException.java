package dev.callguard.error;

public class NoCredentialsException extends ApiException {
    public NoCredentialsException(String provider, String endpoint) {
        super("No API keys registered for " + provider, 401, endpoint, false);
    }
}
