package dev.simpleemailapi.client;

import dev.simpleemailapi.core.Event;

/**
 * Receive side of an open {@code StreamEvents} call.
 *
 * <p>{@link #close()} may be called from another thread to abort a blocked {@link #next()}.
 */
public interface EventStream extends AutoCloseable {

    /**
     * Blocks until the next event arrives.
     *
     * @return the next event, or {@code null} once the server ended the stream cleanly
     * @throws Exception the terminal transport error
     */
    Event next() throws Exception;

    @Override
    void close();
}
