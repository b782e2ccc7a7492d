package dev.simpleemailapi.client;

import dev.simpleemailapi.core.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * One live {@code StreamEvents} connection: receives events until the server ends the stream,
 * the transport fails, or the scope is cancelled.
 *
 * <p>This class is not intended to be used directly by clients.
 */
final class StreamSession {
    private static final Logger log = LoggerFactory.getLogger(StreamSession.class);

    private final EmailApiTransport transport;
    private final EventHandlers handlers;
    private final EventDispatcher dispatcher;
    private final AckBatcher acks;
    private final CancellationScope scope;

    StreamSession(EmailApiTransport transport, EventHandlers handlers, EventDispatcher dispatcher,
                  AckBatcher acks, CancellationScope scope) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.handlers = Objects.requireNonNull(handlers, "handlers");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.acks = Objects.requireNonNull(acks, "acks");
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    /**
     * Runs the session to completion. The stream is closed on every exit path.
     *
     * @throws Exception the terminal transport error; nothing is thrown on a clean end or on cancellation
     */
    void run() throws Exception {
        StreamEventsRequest request = new StreamEventsRequest(handlers.eventTypes(), handlers.batchSize());
        int received = 0;
        try (EventStream stream = transport.openEventStream(request);
             CancellationScope.Registration abort = scope.onCancel(stream::close)) {
            log.debug("event stream opened (batchSize={})", request.batchSize());

            Event event;
            while (!scope.isCancelled() && (event = stream.next()) != null) {
                if (scope.isCancelled()) {
                    break;
                }
                if (event.isHeartbeat()) {
                    continue;
                }
                received++;
                dispatcher.dispatch(event);
                if (handlers.ackMode() == AckMode.AUTO && event.isAckable()) {
                    acks.queue(event.id());
                }
            }
        } catch (Exception e) {
            if (scope.isCancelled()) {
                log.debug("event stream aborted by cancellation after {} events", received);
                return;
            }
            throw e;
        }
        log.debug("event stream ended after {} events", received);
    }
}
