package dev.simpleemailapi.client;

import java.time.Duration;

/**
 * Exponential reconnect delay: {@code min(initial * multiplier^(n-1), max)} before attempt {@code n}.
 *
 * <p>The delay only grows; it is never reset after a successful session.
 */
final class Backoff {
    private final long maxNanos;
    private final double multiplier;
    private long currentNanos;

    Backoff(Duration initial, Duration max, double multiplier) {
        this.currentNanos = initial.toNanos();
        this.maxNanos = max.toNanos();
        this.multiplier = multiplier;
    }

    static Backoff from(StreamingOptions options) {
        return new Backoff(options.initialDelay(), options.maxDelay(), options.multiplier());
    }

    Duration current() {
        return Duration.ofNanos(currentNanos);
    }

    /**
     * Advances to the next delay, capped at the maximum.
     */
    void increase() {
        double next = currentNanos * multiplier;
        currentNanos = next >= maxNanos ? maxNanos : (long) next;
    }
}
