package dev.simpleemailapi.client;

import java.time.Duration;

/**
 * Transport used by {@link EmailApiClient} to reach the service.
 *
 * <p>Implementations report service failures as {@link dev.simpleemailapi.core.RpcException}.
 */
public interface EmailApiTransport {

    /**
     * Opens a server-streaming {@code StreamEvents} call.
     *
     * @param request the stream request
     * @return an open stream, to be closed by the caller
     * @throws Exception if the call could not be opened
     */
    EventStream openEventStream(StreamEventsRequest request) throws Exception;

    /**
     * Acknowledges processed events.
     *
     * @param request the event ids to acknowledge
     * @param timeout upper bound for the call, or {@code null} for the transport default
     * @throws Exception if the call fails
     */
    void ackEvents(AckEventsRequest request, Duration timeout) throws Exception;

    /**
     * Performs a request/response call.
     *
     * @param procedure the procedure path, e.g. {@link dev.simpleemailapi.core.Protocol#SEND_EMAIL}
     * @param request the request message
     * @param responseType the response message type, {@code Void.class} to discard the body
     * @param <T> the response type
     * @return the decoded response
     * @throws Exception if the call fails
     */
    <T> T unary(String procedure, Object request, Class<T> responseType) throws Exception;
}
