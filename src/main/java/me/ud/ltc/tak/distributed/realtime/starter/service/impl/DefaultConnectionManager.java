package me.ud.ltc.tak.distributed.realtime.starter.service.impl;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import me.ud.ltc.tak.distributed.realtime.starter.config.RealtimeProperties;
import me.ud.ltc.tak.distributed.realtime.starter.connection.ClientConnection;
import me.ud.ltc.tak.distributed.realtime.starter.connection.ConnectionFailureListener;
import me.ud.ltc.tak.distributed.realtime.starter.connection.DeliveryStatistics;
import me.ud.ltc.tak.distributed.realtime.starter.connection.EventSink;
import me.ud.ltc.tak.distributed.realtime.starter.connection.OutboundMessage;
import me.ud.ltc.tak.distributed.realtime.starter.exception.ConnectionLimitExceededException;
import me.ud.ltc.tak.distributed.realtime.starter.exception.RealtimeDeliveryException;
import me.ud.ltc.tak.distributed.realtime.starter.model.ConnectionMetrics;
import me.ud.ltc.tak.distributed.realtime.starter.model.ConnectionState;
import me.ud.ltc.tak.distributed.realtime.starter.model.TransportType;
import me.ud.ltc.tak.distributed.realtime.starter.service.ConnectionManager;
import me.ud.ltc.tak.distributed.realtime.starter.service.LocalBroadcaster;

import lombok.extern.slf4j.Slf4j;

/**
 * Connection manager backed by a shared sender pool and a heartbeat scheduler.
 * <p>
 * Drain tasks run on the fixed sender pool; each write runs on an elastic writer pool and is bounded by the write
 * timeout, so stalled peers cannot hold the sender threads that healthy connections need.
 *
 * @author takltc
 */
@Slf4j
public class DefaultConnectionManager implements ConnectionManager, ConnectionFailureListener {

    private final RealtimeProperties.Connection config;
    private final LocalBroadcaster broadcaster;
    private final DeliveryStatistics statistics;

    private final Map<String, ClientConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, Long> connectionTimes = new ConcurrentHashMap<>();
    private final Object capacityLock = new Object();

    private volatile Executor senderExecutor;
    private volatile Executor writeExecutor;
    private volatile ScheduledExecutorService heartbeatExecutor;
    private final boolean ownsSenderExecutor;
    private final boolean ownsWriteExecutor;

    // Metrics
    private final AtomicInteger peakConnections = new AtomicInteger(0);
    private final AtomicLong totalOpened = new AtomicLong(0);
    private final AtomicLong totalClosed = new AtomicLong(0);
    private final AtomicLong totalErrors = new AtomicLong(0);
    private final AtomicLong idleTimeouts = new AtomicLong(0);

    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public DefaultConnectionManager(RealtimeProperties properties, LocalBroadcaster broadcaster,
        DeliveryStatistics statistics) {
        this(properties, broadcaster, statistics, null, null, null);
    }

    /**
     * @param senderExecutor Executor draining send queues, created on start when null
     * @param writeExecutor Executor running single bounded writes, created on start when null
     * @param heartbeatExecutor Heartbeat scheduler, created on start when null
     */
    public DefaultConnectionManager(RealtimeProperties properties, LocalBroadcaster broadcaster,
        DeliveryStatistics statistics, Executor senderExecutor, Executor writeExecutor,
        ScheduledExecutorService heartbeatExecutor) {
        this.config = properties.getConnection();
        this.broadcaster = broadcaster;
        this.statistics = statistics;
        this.senderExecutor = senderExecutor;
        this.writeExecutor = writeExecutor;
        this.heartbeatExecutor = heartbeatExecutor;
        this.ownsSenderExecutor = senderExecutor == null;
        this.ownsWriteExecutor = writeExecutor == null;
    }

    /**
     * Validate configuration parameters
     */
    private void validateConfiguration() {
        if (config.getTimeout() < 0) {
            throw new IllegalStateException("Connection timeout must not be negative");
        }
        if (config.getHeartbeat() <= 0) {
            throw new IllegalStateException("Heartbeat interval must be greater than 0");
        }
        if (config.getMaxIdleHeartbeats() <= 0) {
            throw new IllegalStateException("Maximum idle heartbeats must be greater than 0");
        }
        if (config.getWriteTimeout() <= 0) {
            throw new IllegalStateException("Write timeout must be greater than 0");
        }
        if (config.getMaxConnections() <= 0) {
            throw new IllegalStateException("Maximum connections must be greater than 0");
        }
        if (config.getMaxConnectionsPerUser() <= 0) {
            throw new IllegalStateException("Maximum connections per user must be greater than 0");
        }
        if (config.getSendQueueCapacity() <= 0) {
            throw new IllegalStateException("Send queue capacity must be greater than 0");
        }
        if (config.getSenderThreads() <= 0) {
            throw new IllegalStateException("Sender thread count must be greater than 0");
        }
    }

    private ScheduledExecutorService createNamedScheduledThreadPool(int corePoolSize, String name) {
        AtomicInteger counter = new AtomicInteger(0);
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(corePoolSize, r -> {
            Thread t = new Thread(r, name + "-thread-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    private ExecutorService createNamedThreadPool(int poolSize, String name) {
        AtomicInteger counter = new AtomicInteger(0);
        return new ThreadPoolExecutor(poolSize, poolSize, 60L, TimeUnit.SECONDS, new LinkedBlockingQueue<>(), r -> {
            Thread t = new Thread(r, name + "-thread-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Unbounded pool whose idle threads expire; a thread stays busy only while a write is stuck
     */
    private ExecutorService createNamedCachedThreadPool(String name) {
        AtomicInteger counter = new AtomicInteger(0);
        return new ThreadPoolExecutor(0, Integer.MAX_VALUE, 60L, TimeUnit.SECONDS, new SynchronousQueue<>(), r -> {
            Thread t = new Thread(r, name + "-thread-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void start() {
        validateConfiguration();
        ensureExecutorsInitialized();
        log.info("Connection manager started, sender threads: {}, heartbeat interval: {}ms, max connections: {}",
            config.getSenderThreads(), config.getHeartbeat(), config.getMaxConnections());
    }

    private void ensureExecutorsInitialized() {
        if (senderExecutor == null || writeExecutor == null || heartbeatExecutor == null) {
            synchronized (this) {
                if (senderExecutor == null) {
                    senderExecutor = createNamedThreadPool(config.getSenderThreads(), "realtime-sender");
                }
                if (writeExecutor == null) {
                    writeExecutor = createNamedCachedThreadPool("realtime-writer");
                }
                if (heartbeatExecutor == null) {
                    int heartbeatThreads = Math.max(2, Math.min(10, config.getMaxConnections() / 50));
                    heartbeatExecutor = createNamedScheduledThreadPool(heartbeatThreads, "realtime-heartbeat");
                    log.info("Initializing heartbeat executor, thread count: {}", heartbeatThreads);
                }
            }
        }
    }

    @Override
    public ClientConnection open(String userId, Collection<String> roles, EventSink sink) {
        if (userId == null || userId.isEmpty()) {
            throw new IllegalArgumentException("User ID must not be empty");
        }
        if (shuttingDown.get()) {
            throw new RealtimeDeliveryException("Server is shutting down");
        }
        ensureExecutorsInitialized();

        ClientConnection connection;
        synchronized (capacityLock) {
            if (connections.size() >= config.getMaxConnections()) {
                log.warn("Maximum connection limit reached: {}", config.getMaxConnections());
                throw new ConnectionLimitExceededException(
                    "Maximum connection limit reached: " + config.getMaxConnections());
            }
            long userConnections = connections.values().stream().filter(c -> userId.equals(c.getUserId())).count();
            if (userConnections >= config.getMaxConnectionsPerUser()) {
                log.warn("Maximum connections per user reached, user: {}, limit: {}", userId,
                    config.getMaxConnectionsPerUser());
                throw new ConnectionLimitExceededException(
                    "Maximum connections per user reached: " + config.getMaxConnectionsPerUser());
            }

            connection = ClientConnection.builder().connectionId(UUID.randomUUID().toString()).userId(userId)
                .roles(roles).transport(TransportType.PUSH).sink(sink).sendExecutor(senderExecutor)
                .writeExecutor(writeExecutor).writeTimeout(config.getWriteTimeout())
                .sendQueueCapacity(config.getSendQueueCapacity()).failureListener(this).statistics(statistics)
                .build();
            connections.put(connection.getConnectionId(), connection);
        }

        String connectionId = connection.getConnectionId();
        if (!connection.transition(ConnectionState.CONNECTING, ConnectionState.OPEN)) {
            // Peer went away before the connection was opened
            connections.remove(connectionId, connection);
            log.info("Connection {} terminated before opening", connectionId);
            return connection;
        }

        connectionTimes.put(connectionId, connection.getOpenedAt());
        totalOpened.incrementAndGet();
        peakConnections.accumulateAndGet(connections.size(), Math::max);
        broadcaster.registerConnection(connection);
        connection.enqueue(OutboundMessage.connected(connection, config.getHeartbeat()));
        startHeartbeat(connection);

        log.info("Push connection opened: {}, user: {}, current connections: {}", connectionId, userId,
            connections.size());
        return connection;
    }

    private void startHeartbeat(ClientConnection connection) {
        ScheduledFuture<?> task = heartbeatExecutor.scheduleAtFixedRate(() -> {
            try {
                heartbeat(connection);
            } catch (Exception e) {
                log.error("Unable to send heartbeat to connection: {}", connection.getConnectionId(), e);
                closeWithError(connection.getConnectionId(), e);
            }
        }, config.getHeartbeat(), config.getHeartbeat(), TimeUnit.MILLISECONDS);
        connection.setHeartbeatTask(task);
    }

    /**
     * One heartbeat period of a connection: drop it if its writes are stuck or it has been idle, otherwise queue a
     * ping. Bounded writes normally fail a stuck connection first; the stall check covers direct write executors.
     *
     * @param connection Connection
     */
    void heartbeat(ClientConnection connection) {
        if (!connection.isOpen()) {
            return;
        }
        String connectionId = connection.getConnectionId();
        long now = System.currentTimeMillis();

        if (connection.isWriteStalled(now, config.getWriteTimeout())) {
            log.warn("Write to connection {} exceeded {}ms, closing", connectionId, config.getWriteTimeout());
            closeWithError(connectionId, new TimeoutException("Write timed out"));
            return;
        }

        long idleTimeout = (long)config.getHeartbeat() * config.getMaxIdleHeartbeats();
        if (connection.isIdle(now, idleTimeout)) {
            idleTimeouts.incrementAndGet();
            log.warn("Connection {} had no successful write for {}ms, closing", connectionId, idleTimeout);
            closeWithError(connectionId, new TimeoutException("Connection idle"));
            return;
        }

        if (!connection.enqueue(OutboundMessage.heartbeat()) && connection.isOpen()) {
            log.warn("Send queue of connection {} is full at heartbeat, dropping slow consumer", connectionId);
            statistics.recordSlowConsumer();
            closeWithError(connectionId, new TimeoutException("Send queue full"));
        }
    }

    @Override
    public boolean close(String connectionId) {
        ClientConnection connection = connections.remove(connectionId);
        if (connection == null) {
            return false;
        }
        connectionTimes.remove(connectionId);
        broadcaster.unregisterConnection(connectionId);
        totalClosed.incrementAndGet();
        if (!connection.beginClose()) {
            connection.fail(null);
        }
        log.info("Push connection closed: {}, current connections: {}", connectionId, connections.size());
        return true;
    }

    @Override
    public boolean closeWithError(String connectionId, Throwable cause) {
        ClientConnection connection = connections.get(connectionId);
        if (connection == null) {
            return false;
        }
        return connection.fail(cause);
    }

    @Override
    public void onFailure(ClientConnection connection, Throwable cause) {
        String connectionId = connection.getConnectionId();
        if (!connections.remove(connectionId, connection)) {
            return;
        }
        connectionTimes.remove(connectionId);
        broadcaster.unregisterConnection(connectionId);
        totalClosed.incrementAndGet();
        if (cause != null) {
            totalErrors.incrementAndGet();
            log.warn("Push connection {} closed after error, user: {}, current connections: {}", connectionId,
                connection.getUserId(), connections.size(), cause);
        } else {
            log.info("Push connection {} completed by client, current connections: {}", connectionId,
                connections.size());
        }
    }

    @Override
    public void closeAll() {
        int count = 0;
        for (String connectionId : connections.keySet()) {
            if (close(connectionId)) {
                count++;
            }
        }
        log.info("Closed {} push connections", count);
    }

    @Override
    public Optional<ClientConnection> find(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    @Override
    public int getConnectionCount() {
        return connections.size();
    }

    @Override
    public ConnectionMetrics getMetrics() {
        long uniqueUsers = connections.values().stream().map(ClientConnection::getUserId).distinct().count();
        return ConnectionMetrics.builder().activeConnections(connections.size())
            .peakConnections(peakConnections.get()).maxConnections(config.getMaxConnections())
            .uniqueUsers((int)uniqueUsers).totalOpened(totalOpened.get()).totalClosed(totalClosed.get())
            .totalErrors(totalErrors.get()).eventsSent(statistics.getEventsSent())
            .heartbeatsSent(statistics.getHeartbeatsSent()).slowConsumersDropped(statistics.getSlowConsumersDropped())
            .idleTimeouts(idleTimeouts.get()).build();
    }

    @Override
    public Map<String, Long> getConnectionTimes() {
        return new HashMap<>(connectionTimes);
    }

    @Override
    public void stop() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Start shutting down connection manager, current connection count: {}", connections.size());

        if (config.isGracefulShutdown()) {
            for (ClientConnection connection : connections.values()) {
                connection.enqueue(OutboundMessage.system(Collections.singletonMap("type", "server_shutdown")));
            }
            log.info("Server shutdown notification sent");
        }

        try {
            closeAll();
        } catch (Exception e) {
            log.error("Error occurred while closing push connections", e);
        }

        ScheduledExecutorService heartbeats = heartbeatExecutor;
        if (heartbeats != null) {
            heartbeats.shutdownNow();
        }

        Executor sender = senderExecutor;
        if (ownsSenderExecutor && sender instanceof ExecutorService) {
            shutdownSender((ExecutorService)sender);
        }

        Executor writer = writeExecutor;
        if (ownsWriteExecutor && writer instanceof ExecutorService) {
            List<Runnable> abandoned = ((ExecutorService)writer).shutdownNow();
            log.info("Writer executor stopped, abandoned task count: {}", abandoned.size());
        }
        log.info("Connection manager shutdown completed, total opened: {}, total closed: {}, errors: {}",
            totalOpened.get(), totalClosed.get(), totalErrors.get());
    }

    private void shutdownSender(ExecutorService sender) {
        if (!config.isGracefulShutdown()) {
            List<Runnable> pending = sender.shutdownNow();
            log.info("Fast shutdown completed, sender executor remaining task count: {}", pending.size());
            return;
        }
        sender.shutdown();
        try {
            if (!sender.awaitTermination(config.getGracefulShutdownTimeout(), TimeUnit.MILLISECONDS)) {
                List<Runnable> pending = sender.shutdownNow();
                log.warn("Sender executor shutdown timeout, remaining task count: {}", pending.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sender.shutdownNow();
            log.warn("Interrupted while waiting for sender executor to terminate");
        }
    }
}
