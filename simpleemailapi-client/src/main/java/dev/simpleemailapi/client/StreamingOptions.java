package dev.simpleemailapi.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Reconnection and acknowledgment batching settings of an event subscription.
 *
 * @param initialDelay delay before the first reconnect
 * @param maxDelay upper bound of the reconnect delay
 * @param multiplier growth factor applied after every ended session
 * @param ackBatchSize pending acknowledgments that trigger an immediate flush
 * @param ackFlushInterval maximum time an acknowledgment waits for its batch to fill
 * @param ackTimeout upper bound of a single acknowledgment call
 */
public record StreamingOptions(
        Duration initialDelay,
        Duration maxDelay,
        double multiplier,
        int ackBatchSize,
        Duration ackFlushInterval,
        Duration ackTimeout
) {
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final int DEFAULT_ACK_BATCH_SIZE = 10;
    public static final Duration DEFAULT_ACK_FLUSH_INTERVAL = Duration.ofMillis(1000);
    public static final Duration DEFAULT_ACK_TIMEOUT = Duration.ofSeconds(5);

    public StreamingOptions {
        requirePositive(initialDelay, "initialDelay");
        requirePositive(maxDelay, "maxDelay");
        requirePositive(ackFlushInterval, "ackFlushInterval");
        requirePositive(ackTimeout, "ackTimeout");
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        if (!(multiplier >= 1.0)) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
        if (ackBatchSize <= 0) {
            throw new IllegalArgumentException("ackBatchSize must be > 0");
        }
    }

    public static StreamingOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }

    public static final class Builder {
        private Duration initialDelay = DEFAULT_INITIAL_DELAY;
        private Duration maxDelay = DEFAULT_MAX_DELAY;
        private double multiplier = DEFAULT_MULTIPLIER;
        private int ackBatchSize = DEFAULT_ACK_BATCH_SIZE;
        private Duration ackFlushInterval = DEFAULT_ACK_FLUSH_INTERVAL;
        private Duration ackTimeout = DEFAULT_ACK_TIMEOUT;

        private Builder() {}

        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        public Builder ackBatchSize(int ackBatchSize) {
            this.ackBatchSize = ackBatchSize;
            return this;
        }

        public Builder ackFlushInterval(Duration ackFlushInterval) {
            this.ackFlushInterval = ackFlushInterval;
            return this;
        }

        public Builder ackTimeout(Duration ackTimeout) {
            this.ackTimeout = ackTimeout;
            return this;
        }

        public StreamingOptions build() {
            return new StreamingOptions(initialDelay, maxDelay, multiplier, ackBatchSize, ackFlushInterval, ackTimeout);
        }
    }
}
