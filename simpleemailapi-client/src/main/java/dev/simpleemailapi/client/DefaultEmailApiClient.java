package dev.simpleemailapi.client;

import dev.simpleemailapi.core.Protocol;

import java.util.List;
import java.util.Objects;

final class DefaultEmailApiClient implements EmailApiClient {

    private static final DaemonThreadFactory STREAM_THREADS = new DaemonThreadFactory("events");

    private final EmailApiTransport transport;
    private final StreamingOptions streamingOptions;
    private final DomainsClient domains;

    DefaultEmailApiClient(EmailApiTransport transport, StreamingOptions streamingOptions) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.streamingOptions = Objects.requireNonNull(streamingOptions, "streamingOptions");
        this.domains = new TransportDomainsClient(transport);
    }

    @Override
    public SendEmailResponse send(SendEmailRequest request) throws Exception {
        Objects.requireNonNull(request, "request");
        return transport.unary(Protocol.SEND_EMAIL, request, SendEmailResponse.class);
    }

    @Override
    public DomainsClient domains() {
        return domains;
    }

    @Override
    public void ackEvents(List<String> eventIds) throws Exception {
        if (eventIds == null || eventIds.isEmpty()) {
            return;
        }
        transport.ackEvents(new AckEventsRequest(eventIds), streamingOptions.ackTimeout());
    }

    @Override
    public EventSubscription onReceive(CancellationScope scope, EventHandlers handlers) {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(handlers, "handlers");
        EventStreamer streamer = new EventStreamer(transport, handlers, streamingOptions, scope);
        Thread worker = STREAM_THREADS.newThread(streamer);
        worker.start();
        return new EventSubscription(scope, worker);
    }
}
