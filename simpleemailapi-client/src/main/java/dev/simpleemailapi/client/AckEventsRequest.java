package dev.simpleemailapi.client;

import java.util.List;

/**
 * Request to acknowledge processed events.
 *
 * @param eventIds ids of the events to acknowledge
 */
public record AckEventsRequest(List<String> eventIds) {
    public AckEventsRequest {
        eventIds = eventIds == null ? List.of() : List.copyOf(eventIds);
    }
}
