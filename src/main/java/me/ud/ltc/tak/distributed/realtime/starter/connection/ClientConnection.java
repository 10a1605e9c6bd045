package me.ud.ltc.tak.distributed.realtime.starter.connection;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import me.ud.ltc.tak.distributed.realtime.starter.model.ConnectionState;
import me.ud.ltc.tak.distributed.realtime.starter.model.Event;
import me.ud.ltc.tak.distributed.realtime.starter.model.TransportType;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * A push connection owned by this process.
 * <p>
 * Messages are queued in a bounded send queue and written by at most one drain task at a time on the shared
 * sender executor, so writes to one connection keep their order and a slow peer never blocks the producer.
 * <p>
 * When a write executor is set, each write runs there and the drain task waits for it at most the write timeout.
 * A stalled write then fails the connection and releases the sender thread; the stuck write is interrupted and
 * abandoned.
 *
 * @author takltc
 */
@Slf4j
public class ClientConnection {

    @Getter
    private final String connectionId;

    @Getter
    private final String userId;

    @Getter
    private final Set<String> roles;

    @Getter
    private final TransportType transport;

    @Getter
    private final long openedAt;

    private final EventSink sink;
    private final Executor sendExecutor;
    private final Executor writeExecutor;
    private final long writeTimeout;
    private final BlockingQueue<OutboundMessage> sendQueue;
    private final ConnectionFailureListener failureListener;
    private final DeliveryStatistics statistics;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private final AtomicBoolean draining = new AtomicBoolean(false);

    private volatile long lastActivity;
    private volatile long writeStartedAt;
    private volatile ScheduledFuture<?> heartbeatTask;

    @Builder
    private ClientConnection(String connectionId, String userId, Collection<String> roles, TransportType transport,
        EventSink sink, Executor sendExecutor, Executor writeExecutor, long writeTimeout, int sendQueueCapacity,
        ConnectionFailureListener failureListener, DeliveryStatistics statistics) {
        this.connectionId = connectionId;
        this.userId = userId;
        this.roles = roles == null ? Collections.emptySet()
            : Collections.unmodifiableSet(new LinkedHashSet<>(roles));
        this.transport = transport != null ? transport : TransportType.PUSH;
        this.sink = sink;
        this.sendExecutor = sendExecutor;
        this.writeExecutor = writeExecutor;
        this.writeTimeout = writeTimeout;
        this.sendQueue = new ArrayBlockingQueue<>(Math.max(1, sendQueueCapacity));
        this.failureListener = failureListener != null ? failureListener : (connection, cause) -> {
        };
        this.statistics = statistics != null ? statistics : new DeliveryStatistics();
        this.openedAt = System.currentTimeMillis();
        this.lastActivity = openedAt;
        sink.onTermination(this::onSinkTerminated);
    }

    public ConnectionState getState() {
        return state.get();
    }

    public boolean isOpen() {
        return state.get() == ConnectionState.OPEN;
    }

    public long getLastActivity() {
        return lastActivity;
    }

    public int getQueuedMessages() {
        return sendQueue.size();
    }

    /**
     * Whether the event targets this connection's user or one of its roles
     */
    public boolean matches(Event event) {
        return event.isVisibleTo(userId, roles);
    }

    /**
     * Move between two states if the lifecycle allows it
     *
     * @return true if the state changed
     */
    public boolean transition(ConnectionState from, ConnectionState to) {
        return from.canTransitionTo(to) && state.compareAndSet(from, to);
    }

    /**
     * Queue a message for delivery without blocking
     *
     * @param message Message
     * @return false if the connection is not open or its send queue is full
     */
    public boolean enqueue(OutboundMessage message) {
        if (state.get() != ConnectionState.OPEN) {
            return false;
        }
        if (!sendQueue.offer(message)) {
            return false;
        }
        scheduleDrain();
        return true;
    }

    /**
     * Stop accepting messages and complete the sink once the queued ones are written
     *
     * @return true if this call started the close
     */
    public boolean beginClose() {
        if (!transition(ConnectionState.OPEN, ConnectionState.CLOSING)) {
            return false;
        }
        scheduleDrain();
        return true;
    }

    /**
     * Close immediately, discarding queued messages, and notify the failure listener
     *
     * @param cause Cause, null for a normal termination
     * @return true if this call closed the connection
     */
    public boolean fail(Throwable cause) {
        return closeNow(cause, true);
    }

    /**
     * Whether a single write has been in progress for longer than the timeout
     */
    public boolean isWriteStalled(long now, long writeTimeout) {
        long started = writeStartedAt;
        return started > 0 && now - started > writeTimeout;
    }

    /**
     * Whether nothing was written successfully for longer than the timeout
     */
    public boolean isIdle(long now, long idleTimeout) {
        return writeStartedAt == 0 && now - lastActivity > idleTimeout;
    }

    public void setHeartbeatTask(ScheduledFuture<?> heartbeatTask) {
        this.heartbeatTask = heartbeatTask;
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            sendExecutor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            fail(e);
        }
    }

    private void drain() {
        try {
            OutboundMessage message;
            while ((message = sendQueue.poll()) != null) {
                if (state.get() == ConnectionState.CLOSED) {
                    sendQueue.clear();
                    return;
                }
                writeStartedAt = System.currentTimeMillis();
                try {
                    write(message);
                } finally {
                    writeStartedAt = 0;
                }
                lastActivity = System.currentTimeMillis();
                statistics.recordSent(message);
            }
            if (state.get() == ConnectionState.CLOSING) {
                finishClose();
            }
        } catch (Exception e) {
            log.debug("Write to connection {} failed", connectionId, e);
            statistics.recordWriteError();
            fail(e);
        } finally {
            draining.set(false);
            ConnectionState current = state.get();
            if (current == ConnectionState.CLOSING || (current == ConnectionState.OPEN && !sendQueue.isEmpty())) {
                scheduleDrain();
            }
        }
    }

    private void write(OutboundMessage message) throws Exception {
        if (writeExecutor == null || writeTimeout <= 0) {
            sink.send(message);
            return;
        }
        FutureTask<Void> task = new FutureTask<>(() -> {
            sink.send(message);
            return null;
        });
        writeExecutor.execute(task);
        try {
            task.get(writeTimeout, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            statistics.recordWriteTimeout();
            log.warn("Write to connection {} exceeded {}ms, abandoning it", connectionId, writeTimeout);
            throw new TimeoutException("Write timed out after " + writeTimeout + "ms");
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception)cause;
            }
            throw e;
        }
    }

    private void finishClose() {
        if (!state.compareAndSet(ConnectionState.CLOSING, ConnectionState.CLOSED)) {
            return;
        }
        cancelHeartbeat();
        completeSink(null);
    }

    private void onSinkTerminated(Throwable cause) {
        if (state.get() == ConnectionState.CLOSING && cause == null) {
            finishClose();
            return;
        }
        closeNow(cause, false);
    }

    private boolean closeNow(Throwable cause, boolean completeSink) {
        ConnectionState previous = state.getAndSet(ConnectionState.CLOSED);
        if (previous == ConnectionState.CLOSED) {
            return false;
        }
        cancelHeartbeat();
        sendQueue.clear();
        if (completeSink) {
            completeSink(cause);
        }
        failureListener.onFailure(this, cause);
        return true;
    }

    /**
     * Complete the sink off the calling thread when writes are bounded: a sink may hold the same lock for a stuck
     * write and for completion.
     */
    private void completeSink(Throwable cause) {
        Runnable completion = () -> {
            try {
                if (cause == null) {
                    sink.complete();
                } else {
                    sink.completeWithError(cause);
                }
            } catch (Exception e) {
                log.debug("Error completing connection {}", connectionId, e);
            }
        };
        if (writeExecutor == null || writeTimeout <= 0) {
            completion.run();
            return;
        }
        try {
            writeExecutor.execute(completion);
        } catch (RejectedExecutionException e) {
            log.debug("Write executor rejected completion of connection {}, completing inline", connectionId);
            completion.run();
        }
    }

    private void cancelHeartbeat() {
        ScheduledFuture<?> task = heartbeatTask;
        if (task != null) {
            task.cancel(false);
        }
    }
}
