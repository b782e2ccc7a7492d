package dev.simpleemailapi.client;

import dev.simpleemailapi.core.EventType;

import java.util.Set;

/**
 * Request to open an event stream.
 *
 * @param eventTypes types to receive; empty means all types
 * @param batchSize number of events the server may buffer per batch
 */
public record StreamEventsRequest(Set<EventType> eventTypes, int batchSize) {
    public StreamEventsRequest {
        eventTypes = eventTypes == null ? Set.of() : Set.copyOf(eventTypes);
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
    }
}
