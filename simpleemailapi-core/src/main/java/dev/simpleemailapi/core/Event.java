package dev.simpleemailapi.core;

import java.util.Objects;

/**
 * One immutable notification received from the event stream.
 *
 * @param id identifier used for acknowledgment; empty when the event is not ackable
 * @param type event discriminant
 * @param payload business payload, {@code null} for heartbeats and unknown variants
 */
public record Event(String id, EventType type, EventPayload payload) {
    public Event {
        id = id == null ? "" : id;
        Objects.requireNonNull(type, "type");
    }

    /**
     * Creates a keep-alive event.
     *
     * @return a heartbeat event without id or payload
     */
    public static Event heartbeat() {
        return new Event("", EventType.HEARTBEAT, null);
    }

    public boolean isHeartbeat() {
        return type == EventType.HEARTBEAT;
    }

    public boolean isAckable() {
        return !id.isEmpty();
    }
}
