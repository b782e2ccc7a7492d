package dev.simpleemailapi.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Handle of a running event subscription started by {@link EmailApiClient#onReceive}.
 *
 * <p>Closing the handle cancels its {@link CancellationScope}; the background thread then flushes
 * pending acknowledgments and exits.
 */
public final class EventSubscription implements AutoCloseable {
    private final CancellationScope scope;
    private final Thread worker;

    EventSubscription(CancellationScope scope, Thread worker) {
        this.scope = Objects.requireNonNull(scope, "scope");
        this.worker = Objects.requireNonNull(worker, "worker");
    }

    public CancellationScope scope() {
        return scope;
    }

    public boolean isRunning() {
        return worker.isAlive();
    }

    /**
     * Waits for the background thread to exit.
     *
     * @param timeout maximum time to wait
     * @return {@code true} if the thread exited
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        worker.join(Math.max(1L, timeout.toMillis()));
        return !worker.isAlive();
    }

    @Override
    public void close() {
        scope.cancel();
    }
}
