package dev.simpleemailapi.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Keeps an event subscription alive: runs {@link StreamSession}s back to back, reporting each
 * failure to {@code onError} and waiting an exponentially growing delay between attempts.
 *
 * <p>Only cancellation of the scope stops the loop. Pending acknowledgments are flushed at every
 * transition and once more on shutdown.
 *
 * <p>This class is not intended to be used directly by clients.
 */
final class EventStreamer implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(EventStreamer.class);

    /** Waits between attempts; returns {@code true} if the scope was cancelled meanwhile. */
    @FunctionalInterface
    interface Sleeper {
        boolean sleep(Duration delay) throws InterruptedException;
    }

    private final CancellationScope scope;
    private final StreamingOptions options;
    private final EventDispatcher dispatcher;
    private final AckBatcher acks;
    private final StreamSession session;
    private final Sleeper sleeper;

    EventStreamer(EmailApiTransport transport, EventHandlers handlers, StreamingOptions options, CancellationScope scope) {
        this(transport, handlers, options, scope, scope::await);
    }

    EventStreamer(EmailApiTransport transport, EventHandlers handlers, StreamingOptions options,
                  CancellationScope scope, Sleeper sleeper) {
        this.scope = Objects.requireNonNull(scope, "scope");
        this.options = Objects.requireNonNull(options, "options");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.dispatcher = new EventDispatcher(handlers);
        this.acks = new AckBatcher(transport, options);
        this.session = new StreamSession(transport, handlers, dispatcher, acks, scope);
    }

    @Override
    public void run() {
        try {
            loop();
        } finally {
            acks.close();
            log.info("event stream stopped");
        }
    }

    private void loop() {
        Backoff backoff = Backoff.from(options);
        int attempt = 0;

        while (!scope.isCancelled()) {
            attempt++;
            Exception failure = null;
            try {
                session.run();
            } catch (Exception e) {
                failure = e;
            }

            if (scope.isCancelled()) {
                return;
            }

            if (failure != null) {
                log.debug("event stream attempt {} failed: {}", attempt, failure.toString());
                dispatcher.reportError(failure);
            }

            acks.flush();

            Duration delay = backoff.current();
            log.debug("reconnecting event stream in {} ms", delay.toMillis());
            try {
                if (sleeper.sleep(delay)) {
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            backoff.increase();
        }
    }

    AckBatcher acks() {
        return acks;
    }
}
