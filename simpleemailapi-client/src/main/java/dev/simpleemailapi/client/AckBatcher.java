package dev.simpleemailapi.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Batches event acknowledgments, flushing when the batch is full or when the flush interval
 * elapses, whichever comes first.
 *
 * <p>Flushes are fire-and-forget: a failed acknowledgment is logged and dropped, the server
 * redelivers unacknowledged events on the next session. The pending list and the flush timer
 * are only touched under {@link #lock}.
 */
final class AckBatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AckBatcher.class);

    private final EmailApiTransport transport;
    private final int batchSize;
    private final Duration flushInterval;
    private final Duration ackTimeout;
    private final ScheduledExecutorService timer;
    private final ExecutorService senders;

    private final ReentrantLock lock = new ReentrantLock();
    private List<String> pending;
    private ScheduledFuture<?> flushTask;
    private boolean closed;

    AckBatcher(EmailApiTransport transport, StreamingOptions options) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.batchSize = options.ackBatchSize();
        this.flushInterval = options.ackFlushInterval();
        this.ackTimeout = options.ackTimeout();
        this.pending = new ArrayList<>(batchSize);
        this.timer = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("ack-timer"));
        this.senders = Executors.newCachedThreadPool(new DaemonThreadFactory("ack"));
    }

    /**
     * Adds an event id to the pending batch.
     *
     * @param eventId the id to acknowledge
     */
    void queue(String eventId) {
        lock.lock();
        try {
            if (closed) {
                log.debug("ack batcher closed, dropping ack for {}", eventId);
                return;
            }
            pending.add(eventId);
            if (pending.size() >= batchSize) {
                flushLocked();
                return;
            }
            if (flushTask == null) {
                flushTask = timer.schedule(this::flush, flushInterval.toNanos(), TimeUnit.NANOSECONDS);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sends all pending ids now. No-op when nothing is pending.
     */
    void flush() {
        lock.lock();
        try {
            flushLocked();
        } finally {
            lock.unlock();
        }
    }

    int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    private void flushLocked() {
        if (flushTask != null) {
            flushTask.cancel(false);
            flushTask = null;
        }
        if (pending.isEmpty()) {
            return;
        }
        List<String> ids = pending;
        pending = new ArrayList<>(batchSize);
        send(ids);
    }

    private void send(List<String> ids) {
        AckEventsRequest request = new AckEventsRequest(ids);
        log.debug("flushing {} acks", ids.size());
        try {
            CompletableFuture
                    .runAsync(() -> {
                        try {
                            transport.ackEvents(request, ackTimeout);
                        } catch (Exception e) {
                            throw new CompletionException(e);
                        }
                    }, senders)
                    .orTimeout(ackTimeout.toNanos(), TimeUnit.NANOSECONDS)
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            log.warn("failed to ack {} events", ids.size(), unwrap(error));
                        }
                    });
        } catch (RejectedExecutionException e) {
            log.warn("failed to ack {} events", ids.size(), e);
        }
    }

    /**
     * Flushes what is pending and releases the timer. In-flight acknowledgments are left to finish.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            flushLocked();
            closed = true;
        } finally {
            lock.unlock();
        }
        timer.shutdownNow();
        senders.shutdown();
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
