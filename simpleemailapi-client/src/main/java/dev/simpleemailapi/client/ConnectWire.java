package dev.simpleemailapi.client;

import dev.simpleemailapi.core.ErrorDetail;
import dev.simpleemailapi.core.ErrorDetailPayload;
import dev.simpleemailapi.core.Event;
import dev.simpleemailapi.core.EventPayload;
import dev.simpleemailapi.core.EventType;
import dev.simpleemailapi.core.RpcCode;
import dev.simpleemailapi.core.RpcException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * JSON message shapes exchanged with the service.
 */
final class ConnectWire {
    private ConnectWire() {}

    private static final String TYPE_URL_PREFIX = "type.googleapis.com/";

    record StreamEventsMessage(List<String> eventTypes, int batchSize) {
        static StreamEventsMessage of(StreamEventsRequest request) {
            List<String> types = request.eventTypes().stream()
                    .map(EventType::wireName)
                    .sorted()
                    .toList();
            return new StreamEventsMessage(types, request.batchSize());
        }
    }

    record AckEventsMessage(List<String> eventIds) {}

    record EventMessage(
            String id,
            String type,
            EventPayload.EmailSent emailSent,
            EventPayload.EmailDelivered emailDelivered,
            EventPayload.EmailBounced emailBounced,
            EventPayload.EmailComplained emailComplained,
            EventPayload.EmailRejected emailRejected,
            EventPayload.EmailDelayed emailDelayed,
            EventPayload.EmailReplied emailReplied,
            EventPayload.EmailFailed emailFailed
    ) {
        Event toEvent() {
            EventPayload payload = Stream.<EventPayload>of(
                            emailSent, emailDelivered, emailBounced, emailComplained,
                            emailRejected, emailDelayed, emailReplied, emailFailed)
                    .filter(p -> p != null)
                    .findFirst()
                    .orElse(null);
            return new Event(id, EventType.fromWireName(type), payload);
        }
    }

    record ErrorBody(String code, String message, List<DetailBody> details) {
        RpcException toException(RpcCode fallback) {
            RpcCode rpcCode = code == null ? fallback : RpcCode.fromWireName(code);
            List<ErrorDetail> out = new ArrayList<>();
            if (details != null) {
                for (DetailBody d : details) {
                    if (d != null && d.type() != null) {
                        out.add(d.toDetail());
                    }
                }
            }
            return new RpcException(rpcCode, message, out);
        }
    }

    /**
     * Connect error detail; {@code value} is the binary message, {@code debug} its JSON form.
     */
    record DetailBody(String type, String value, ErrorDetailPayload debug) {
        ErrorDetail toDetail() {
            String name = type.startsWith(TYPE_URL_PREFIX) ? type.substring(TYPE_URL_PREFIX.length()) : type;
            return new ErrorDetail(name, Optional.ofNullable(debug));
        }
    }

    record EndStreamMessage(ErrorBody error, Map<String, List<String>> metadata) {}
}
