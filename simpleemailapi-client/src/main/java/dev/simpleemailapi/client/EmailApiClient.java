package dev.simpleemailapi.client;

import java.util.List;

/**
 * SimpleEmailAPI client.
 *
 * <pre>{@code
 * EmailApiClient client = EmailApiClient.create("em_...");
 *
 * SendEmailResponse resp = client.send(SendEmailRequest.of(
 *         "hello@yourdomain.com", List.of("user@example.com"), "Hello!", "World"));
 *
 * EventSubscription sub = client.onReceive(EventHandlers.builder()
 *         .onDelivered(e -> System.out.println("Delivered to: " + e.recipients()))
 *         .build());
 * // later
 * sub.close();
 * }</pre>
 */
public interface EmailApiClient {

    /**
     * Sends an email.
     *
     * @param request the email
     * @return the send result
     * @throws Exception if the call fails; see {@link dev.simpleemailapi.core.EmailApiErrors#parse(Throwable)}
     */
    SendEmailResponse send(SendEmailRequest request) throws Exception;

    /**
     * Domain management operations.
     *
     * @return the domains client
     */
    DomainsClient domains();

    /**
     * Acknowledges events explicitly, for subscriptions in {@link AckMode#MANUAL}.
     *
     * @param eventIds ids of processed events
     * @throws Exception if the call fails
     */
    void ackEvents(List<String> eventIds) throws Exception;

    /**
     * Starts streaming events on a background daemon thread. The stream reconnects with
     * exponential backoff until {@code scope} is cancelled.
     *
     * @param scope cancellation signal controlling the subscription lifetime
     * @param handlers the callbacks
     * @return a handle on the running subscription
     */
    EventSubscription onReceive(CancellationScope scope, EventHandlers handlers);

    /**
     * Starts streaming events with a fresh scope; close the returned handle to stop.
     *
     * @param handlers the callbacks
     * @return a handle on the running subscription
     */
    default EventSubscription onReceive(EventHandlers handlers) {
        return onReceive(new CancellationScope(), handlers);
    }

    static EmailApiClient create(String apiKey) {
        return builder().apiKey(apiKey).build();
    }

    static EmailApiClientBuilder builder() {
        return new EmailApiClientBuilder();
    }
}
