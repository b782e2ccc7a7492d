package dev.simpleemailapi.client;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Daemon threads named {@code simpleemailapi-<role>-<n>}, so an open subscription never keeps the JVM alive.
 */
final class DaemonThreadFactory implements ThreadFactory {
    private static final String PREFIX = "simpleemailapi-";

    private final String role;
    private final AtomicInteger sequence = new AtomicInteger();

    DaemonThreadFactory(String role) {
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("role must not be blank");
        }
        this.role = role;
    }

    @Override
    public Thread newThread(Runnable task) {
        Thread thread = new Thread(task, PREFIX + role + "-" + sequence.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    }
}
