package dev.simpleemailapi.client;

import dev.simpleemailapi.core.EventPayload;
import dev.simpleemailapi.core.EventType;

import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Callbacks for email events. Define only the callbacks you care about; events without a
 * callback are dropped after dispatch.
 *
 * <pre>{@code
 * EventHandlers handlers = EventHandlers.builder()
 *         .onDelivered(e -> log.info("delivered to {}", e.recipients()))
 *         .onBounced(e -> log.info("bounced: {}", e.bounceType()))
 *         .onError(err -> log.warn("stream error", err))
 *         .build();
 * }</pre>
 *
 * <p>Instances are immutable.
 */
public final class EventHandlers {

    /** Default number of events the server may buffer per batch. */
    public static final int DEFAULT_BATCH_SIZE = 10;

    private final Consumer<EventPayload.EmailSent> onSent;
    private final Consumer<EventPayload.EmailDelivered> onDelivered;
    private final Consumer<EventPayload.EmailBounced> onBounced;
    private final Consumer<EventPayload.EmailComplained> onComplained;
    private final Consumer<EventPayload.EmailRejected> onRejected;
    private final Consumer<EventPayload.EmailDelayed> onDelayed;
    private final Consumer<EventPayload.EmailReplied> onReplied;
    private final Consumer<EventPayload.EmailFailed> onFailed;
    private final Consumer<Throwable> onError;
    private final AckMode ackMode;
    private final int batchSize;
    private final Set<EventType> eventTypes;

    private EventHandlers(Builder b) {
        this.onSent = b.onSent;
        this.onDelivered = b.onDelivered;
        this.onBounced = b.onBounced;
        this.onComplained = b.onComplained;
        this.onRejected = b.onRejected;
        this.onDelayed = b.onDelayed;
        this.onReplied = b.onReplied;
        this.onFailed = b.onFailed;
        this.onError = b.onError;
        this.ackMode = b.ackMode == null ? AckMode.AUTO : b.ackMode;
        this.batchSize = b.batchSize <= 0 ? DEFAULT_BATCH_SIZE : b.batchSize;
        this.eventTypes = Set.copyOf(b.eventTypes);
    }

    public static Builder builder() {
        return new Builder();
    }

    Consumer<EventPayload.EmailSent> onSent() {
        return onSent;
    }

    Consumer<EventPayload.EmailDelivered> onDelivered() {
        return onDelivered;
    }

    Consumer<EventPayload.EmailBounced> onBounced() {
        return onBounced;
    }

    Consumer<EventPayload.EmailComplained> onComplained() {
        return onComplained;
    }

    Consumer<EventPayload.EmailRejected> onRejected() {
        return onRejected;
    }

    Consumer<EventPayload.EmailDelayed> onDelayed() {
        return onDelayed;
    }

    Consumer<EventPayload.EmailReplied> onReplied() {
        return onReplied;
    }

    Consumer<EventPayload.EmailFailed> onFailed() {
        return onFailed;
    }

    Consumer<Throwable> onError() {
        return onError;
    }

    public AckMode ackMode() {
        return ackMode;
    }

    public int batchSize() {
        return batchSize;
    }

    /**
     * Event types requested from the server; empty means all.
     *
     * @return the type filter
     */
    public Set<EventType> eventTypes() {
        return eventTypes;
    }

    public static final class Builder {
        private Consumer<EventPayload.EmailSent> onSent;
        private Consumer<EventPayload.EmailDelivered> onDelivered;
        private Consumer<EventPayload.EmailBounced> onBounced;
        private Consumer<EventPayload.EmailComplained> onComplained;
        private Consumer<EventPayload.EmailRejected> onRejected;
        private Consumer<EventPayload.EmailDelayed> onDelayed;
        private Consumer<EventPayload.EmailReplied> onReplied;
        private Consumer<EventPayload.EmailFailed> onFailed;
        private Consumer<Throwable> onError;
        private AckMode ackMode = AckMode.AUTO;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private Set<EventType> eventTypes = Set.of();

        private Builder() {}

        /** Called when an email is accepted for delivery. */
        public Builder onSent(Consumer<EventPayload.EmailSent> handler) {
            this.onSent = handler;
            return this;
        }

        /** Called when an email is successfully delivered. */
        public Builder onDelivered(Consumer<EventPayload.EmailDelivered> handler) {
            this.onDelivered = handler;
            return this;
        }

        /** Called when an email bounces. */
        public Builder onBounced(Consumer<EventPayload.EmailBounced> handler) {
            this.onBounced = handler;
            return this;
        }

        /** Called when a recipient marks the email as spam. */
        public Builder onComplained(Consumer<EventPayload.EmailComplained> handler) {
            this.onComplained = handler;
            return this;
        }

        /** Called when the sending provider rejects the email. */
        public Builder onRejected(Consumer<EventPayload.EmailRejected> handler) {
            this.onRejected = handler;
            return this;
        }

        /** Called when delivery is delayed. */
        public Builder onDelayed(Consumer<EventPayload.EmailDelayed> handler) {
            this.onDelayed = handler;
            return this;
        }

        /** Called when a reply is received. */
        public Builder onReplied(Consumer<EventPayload.EmailReplied> handler) {
            this.onReplied = handler;
            return this;
        }

        /** Called when sending fails permanently. */
        public Builder onFailed(Consumer<EventPayload.EmailFailed> handler) {
            this.onFailed = handler;
            return this;
        }

        /**
         * Called for stream failures and for exceptions thrown by the other handlers.
         *
         * @param handler the error callback
         * @return this builder
         */
        public Builder onError(Consumer<Throwable> handler) {
            this.onError = handler;
            return this;
        }

        public Builder ackMode(AckMode ackMode) {
            this.ackMode = ackMode;
            return this;
        }

        /**
         * Number of events the server may buffer per batch. Non-positive values fall back to
         * {@value #DEFAULT_BATCH_SIZE}.
         *
         * @param batchSize the batch size
         * @return this builder
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder eventTypes(Set<EventType> eventTypes) {
            this.eventTypes = Objects.requireNonNull(eventTypes, "eventTypes");
            return this;
        }

        public EventHandlers build() {
            return new EventHandlers(this);
        }
    }
}
