package dev.simpleemailapi.client;

import dev.simpleemailapi.core.EmailApiException;
import dev.simpleemailapi.core.ErrorCodes;
import dev.simpleemailapi.core.Event;
import dev.simpleemailapi.core.EventPayload;
import dev.simpleemailapi.core.RpcCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Routes events to the matching {@link EventHandlers} callback.
 *
 * <p>A handler that throws never aborts the stream: the failure, {@link Error}s included, is
 * reported to {@code onError} as an {@link ErrorCodes#INTERNAL} error and logged. Only a
 * {@link VirtualMachineError} propagates.
 */
final class EventDispatcher {
    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    static final String HANDLER_FAILURE_MESSAGE = "exception in event handler";

    private final EventHandlers handlers;

    EventDispatcher(EventHandlers handlers) {
        this.handlers = Objects.requireNonNull(handlers, "handlers");
    }

    /**
     * Invokes at most one callback for the event.
     *
     * @param event the event
     * @return {@code true} if a callback was invoked, even if it failed
     */
    boolean dispatch(Event event) {
        EventPayload payload = event.payload();
        if (event.isHeartbeat() || payload == null) {
            return false;
        }
        try {
            return route(payload);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            reportError(new EmailApiException(ErrorCodes.INTERNAL, HANDLER_FAILURE_MESSAGE, "",
                    Map.of("eventId", event.id(), "eventType", event.type().name()), RpcCode.INTERNAL, e));
            log.warn("{} for event {} ({})", HANDLER_FAILURE_MESSAGE, event.id(), event.type(), e);
            return true;
        }
    }

    /**
     * Delivers an error to {@code onError}, if set. Failures of the error callback itself are logged.
     *
     * @param error the error
     */
    void reportError(Throwable error) {
        Consumer<Throwable> onError = handlers.onError();
        if (onError == null) {
            return;
        }
        try {
            onError.accept(error);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            log.warn("onError handler threw while reporting {}", error.toString(), e);
        }
    }

    private boolean route(EventPayload payload) {
        if (payload instanceof EventPayload.EmailSent p) {
            return accept(handlers.onSent(), p);
        }
        if (payload instanceof EventPayload.EmailDelivered p) {
            return accept(handlers.onDelivered(), p);
        }
        if (payload instanceof EventPayload.EmailBounced p) {
            return accept(handlers.onBounced(), p);
        }
        if (payload instanceof EventPayload.EmailComplained p) {
            return accept(handlers.onComplained(), p);
        }
        if (payload instanceof EventPayload.EmailRejected p) {
            return accept(handlers.onRejected(), p);
        }
        if (payload instanceof EventPayload.EmailDelayed p) {
            return accept(handlers.onDelayed(), p);
        }
        if (payload instanceof EventPayload.EmailReplied p) {
            return accept(handlers.onReplied(), p);
        }
        if (payload instanceof EventPayload.EmailFailed p) {
            return accept(handlers.onFailed(), p);
        }
        return false;
    }

    private static <T> boolean accept(Consumer<T> handler, T payload) {
        if (handler == null) {
            return false;
        }
        handler.accept(payload);
        return true;
    }
}
