package dev.callguard.ratelimit;

/**
 * Blocking wait used for backoff and throttling.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
