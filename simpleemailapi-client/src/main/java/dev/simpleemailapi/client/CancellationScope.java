package dev.simpleemailapi.client;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal shared between a caller and a background subscription.
 *
 * <p>Cancellation is one-way and idempotent. This class is thread-safe.
 */
public final class CancellationScope {

    /** Handle that removes a listener registered with {@link #onCancel(Runnable)}. */
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> listeners = new ArrayList<>();

    /**
     * Cancels the scope and runs the registered listeners on the calling thread.
     */
    public void cancel() {
        List<Runnable> toRun;
        synchronized (listeners) {
            if (cancelled.getCount() == 0) {
                return;
            }
            cancelled.countDown();
            toRun = new ArrayList<>(listeners);
            listeners.clear();
        }
        RuntimeException failure = null;
        for (Runnable listener : toRun) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Waits for cancellation.
     *
     * @param timeout maximum time to wait
     * @return {@code true} if the scope was cancelled before the timeout elapsed
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Registers a listener run once on cancellation. If the scope is already cancelled the
     * listener runs immediately on the calling thread.
     *
     * @param listener the listener
     * @return a registration that removes the listener when closed
     */
    public Registration onCancel(Runnable listener) {
        synchronized (listeners) {
            if (cancelled.getCount() != 0) {
                listeners.add(listener);
                return () -> {
                    synchronized (listeners) {
                        listeners.remove(listener);
                    }
                };
            }
        }
        listener.run();
        return () -> { };
    }
}
