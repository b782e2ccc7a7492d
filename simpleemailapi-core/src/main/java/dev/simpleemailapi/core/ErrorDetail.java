package dev.simpleemailapi.core;

import java.util.Objects;
import java.util.Optional;

/**
 * A typed detail attached to a transport failure.
 *
 * @param type the detail type name, e.g. {@value Protocol#ERROR_DETAIL_TYPE}
 * @param payload the decoded payload, empty when the transport could not decode it
 */
public record ErrorDetail(String type, Optional<ErrorDetailPayload> payload) {
    public ErrorDetail {
        Objects.requireNonNull(type, "type");
        payload = (payload == null) ? Optional.empty() : payload;
    }
}
