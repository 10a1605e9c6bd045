package me.ud.ltc.tak.distributed.realtime.starter.client;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import me.ud.ltc.tak.distributed.realtime.starter.model.Event;
import me.ud.ltc.tak.distributed.realtime.starter.model.TransportType;

import lombok.extern.slf4j.Slf4j;

/**
 * Client side connection strategy: prefers push, reconnects with exponential backoff and falls back to polling
 * after repeated push failures.
 * <p>
 * Every state change runs on one scheduler thread. Each transport started gets a new generation number and
 * callbacks carrying an older generation are dropped, so a torn down transport can never change the state or
 * deliver events. Exactly one transport is active at a time.
 * <p>
 * Polls block on HTTP, so they run on a separate poll executor and only their result is handed back to the
 * scheduler thread; {@link #disconnect()} and mode switches never wait for a poll in flight.
 *
 * @author takltc
 */
@Slf4j
public class BackendSelector implements AutoCloseable {

    private final ClientIdentity identity;
    private final PushTransport pushTransport;
    private final PollingTransport pollingTransport;
    private final BackendSelectorOptions options;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final ExecutorService pollExecutor;
    private final boolean ownsPollExecutor;

    private final Map<String, List<Consumer<Event>>> handlers = new ConcurrentHashMap<>();
    private final List<Consumer<Event>> anyHandlers = new CopyOnWriteArrayList<>();
    private final List<Consumer<SelectorState>> statusListeners = new CopyOnWriteArrayList<>();

    // Confined to the scheduler thread
    private ConnectionMode mode = ConnectionMode.AUTO;
    private TransportType transport;
    private ConnectionStatus status = ConnectionStatus.DISCONNECTED;
    private int pushFailures;
    private int pollingFailures;
    private long cursor;
    private String lastError;
    private long generation;
    private PushSubscription subscription;
    private ScheduledFuture<?> pendingTask;
    private ScheduledFuture<?> promoteTask;

    private volatile SelectorState state;

    public BackendSelector(ClientIdentity identity, PushTransport pushTransport, PollingTransport pollingTransport,
        BackendSelectorOptions options) {
        this(identity, pushTransport, pollingTransport, options, null);
    }

    public BackendSelector(ClientIdentity identity, PushTransport pushTransport, PollingTransport pollingTransport,
        BackendSelectorOptions options, ScheduledExecutorService scheduler) {
        this(identity, pushTransport, pollingTransport, options, scheduler, null);
    }

    /**
     * @param scheduler State machine thread, created when null
     * @param pollExecutor Executor running the blocking polls, created when null
     */
    public BackendSelector(ClientIdentity identity, PushTransport pushTransport, PollingTransport pollingTransport,
        BackendSelectorOptions options, ScheduledExecutorService scheduler, ExecutorService pollExecutor) {
        this.identity = identity;
        this.pushTransport = pushTransport;
        this.pollingTransport = pollingTransport;
        this.options = options != null ? options : BackendSelectorOptions.defaults();
        this.ownsScheduler = scheduler == null;
        this.scheduler = scheduler != null ? scheduler : createScheduler(identity.getUserId());
        this.ownsPollExecutor = pollExecutor == null;
        this.pollExecutor = pollExecutor != null ? pollExecutor : createPollExecutor(identity.getUserId());
        this.state = snapshot();
    }

    private static ScheduledExecutorService createScheduler(String userId) {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "realtime-selector-" + userId);
            t.setDaemon(true);
            return t;
        });
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    /**
     * Threads expire when idle; a poll abandoned by a mode switch may still hold one until its HTTP call returns
     */
    private static ExecutorService createPollExecutor(String userId) {
        AtomicInteger counter = new AtomicInteger(0);
        return new ThreadPoolExecutor(0, Integer.MAX_VALUE, 60L, TimeUnit.SECONDS, new SynchronousQueue<>(), r -> {
            Thread t = new Thread(r, "realtime-poller-" + userId + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // ====== Public API ======

    /**
     * Register a handler for one event type
     */
    public BackendSelector on(String type, Consumer<Event> handler) {
        handlers.computeIfAbsent(type, key -> new CopyOnWriteArrayList<>()).add(handler);
        return this;
    }

    /**
     * Register a handler for every event
     */
    public BackendSelector onAny(Consumer<Event> handler) {
        anyHandlers.add(handler);
        return this;
    }

    public BackendSelector onStatusChange(Consumer<SelectorState> listener) {
        statusListeners.add(listener);
        return this;
    }

    public SelectorState getState() {
        return state;
    }

    public void connect() {
        submit(this::evaluate);
    }

    /**
     * Cancel pending timers and close the active transport
     */
    public void disconnect() {
        submit(() -> {
            teardown();
            transport = null;
            status = ConnectionStatus.DISCONNECTED;
            publishState();
            log.info("Realtime client {} disconnected", identity.getUserId());
        });
    }

    public void forcePush() {
        switchMode(ConnectionMode.PUSH);
    }

    public void forcePolling() {
        switchMode(ConnectionMode.POLLING);
    }

    public void autoMode() {
        switchMode(ConnectionMode.AUTO);
    }

    @Override
    public void close() {
        disconnect();
        if (ownsScheduler) {
            scheduler.shutdown();
        }
        if (ownsPollExecutor) {
            pollExecutor.shutdownNow();
        }
    }

    // ====== Transitions, scheduler thread only ======

    private void switchMode(ConnectionMode newMode) {
        submit(() -> {
            log.info("Realtime client {} switching to {} mode", identity.getUserId(), newMode);
            mode = newMode;
            pushFailures = 0;
            pollingFailures = 0;
            evaluate();
        });
    }

    private void evaluate() {
        if (mode == ConnectionMode.POLLING) {
            startPolling();
        } else {
            startPush();
        }
    }

    private void startPush() {
        teardown();
        long current = ++generation;
        transport = TransportType.PUSH;
        status = ConnectionStatus.CONNECTING;
        publishState();

        try {
            subscription = pushTransport.connect(identity, new PushListener() {
                @Override
                public void onOpen() {
                    submitFor(current, BackendSelector.this::handlePushOpen);
                }

                @Override
                public void onEvent(Event event) {
                    submitFor(current, () -> dispatch(event));
                }

                @Override
                public void onError(Throwable cause) {
                    submitFor(current, () -> handlePushFailure(cause));
                }
            });
        } catch (Exception e) {
            handlePushFailure(e);
        }
    }

    private void handlePushOpen() {
        pushFailures = 0;
        lastError = null;
        status = ConnectionStatus.CONNECTED;
        publishState();
        log.info("Realtime client {} connected via push", identity.getUserId());
    }

    private void handlePushFailure(Throwable cause) {
        closeSubscription();
        generation++;
        pushFailures++;
        lastError = describe(cause);
        log.warn("Push connection of realtime client {} failed, attempt: {}/{}", identity.getUserId(), pushFailures,
            options.getMaxPushFailures(), cause);

        if (mode == ConnectionMode.AUTO && pushFailures >= options.getMaxPushFailures()) {
            log.info("Realtime client {} falling back to polling after {} push failures", identity.getUserId(),
                pushFailures);
            startPolling();
            return;
        }

        long delay = options.reconnectDelay(pushFailures);
        status = ConnectionStatus.CONNECTING;
        publishState();
        long current = generation;
        pendingTask = schedule(current, this::startPush, delay);
    }

    private void startPolling() {
        teardown();
        long current = ++generation;
        transport = TransportType.POLLING;
        status = ConnectionStatus.CONNECTING;
        publishState();
        pendingTask = schedule(current, () -> pollOnce(current), 0);

        if (mode == ConnectionMode.AUTO && options.isAutoPromote()) {
            promoteTask = schedule(current, this::promote, options.getPromoteInterval());
        }
    }

    private void pollOnce(long current) {
        long since = cursor;
        try {
            pollExecutor.execute(() -> fetch(current, since));
        } catch (RejectedExecutionException e) {
            log.warn("Realtime client {} is closed, not polling", identity.getUserId());
        }
    }

    /**
     * Poll executor only: run the request and hand the outcome back to the scheduler thread
     */
    private void fetch(long current, long since) {
        try {
            List<Event> events = pollingTransport.poll(identity, since);
            submitFor(current, () -> handlePollResult(current, events));
        } catch (Exception e) {
            submitFor(current, () -> handlePollFailure(current, e));
        }
    }

    private void handlePollResult(long current, List<Event> events) {
        pollingFailures = 0;
        lastError = null;
        if (status != ConnectionStatus.CONNECTED) {
            status = ConnectionStatus.CONNECTED;
            publishState();
        }
        if (events != null) {
            events.forEach(this::dispatch);
        }
        pendingTask = schedule(current, () -> pollOnce(current), options.getPollingInterval());
    }

    private void handlePollFailure(long current, Exception cause) {
        pollingFailures++;
        lastError = describe(cause);
        log.warn("Polling of realtime client {} failed, consecutive failures: {}", identity.getUserId(),
            pollingFailures, cause);
        if (pollingFailures >= options.getMaxPollingFailures()) {
            status = ConnectionStatus.ERROR;
        }
        publishState();
        pendingTask = schedule(current, () -> pollOnce(current), options.getPollingInterval());
    }

    /**
     * Try push once while polling; a single failure returns to polling
     */
    private void promote() {
        log.info("Realtime client {} retrying push", identity.getUserId());
        pushFailures = Math.max(0, options.getMaxPushFailures() - 1);
        startPush();
    }

    private void dispatch(Event event) {
        if (event.getTimestamp() > cursor) {
            cursor = event.getTimestamp();
        }
        List<Consumer<Event>> typeHandlers = handlers.get(event.getType());
        if (typeHandlers != null) {
            typeHandlers.forEach(handler -> invoke(handler, event));
        }
        anyHandlers.forEach(handler -> invoke(handler, event));
        state = snapshot();
    }

    private void invoke(Consumer<Event> handler, Event event) {
        try {
            handler.accept(event);
        } catch (Exception e) {
            log.error("Handler for event type {} failed", event.getType(), e);
        }
    }

    private void teardown() {
        generation++;
        cancel(pendingTask);
        pendingTask = null;
        cancel(promoteTask);
        promoteTask = null;
        closeSubscription();
    }

    private void closeSubscription() {
        if (subscription != null) {
            try {
                subscription.close();
            } catch (Exception e) {
                log.warn("Error closing push subscription", e);
            }
            subscription = null;
        }
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static void cancel(ScheduledFuture<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }

    private void publishState() {
        SelectorState snapshot = snapshot();
        state = snapshot;
        for (Consumer<SelectorState> listener : statusListeners) {
            try {
                listener.accept(snapshot);
            } catch (Exception e) {
                log.error("Status listener failed", e);
            }
        }
    }

    private SelectorState snapshot() {
        return SelectorState.builder().status(status).mode(mode).transport(transport).pushFailures(pushFailures)
            .pollingFailures(pollingFailures).cursor(cursor).lastError(lastError).build();
    }

    // ====== Scheduling ======

    private void submit(Runnable task) {
        try {
            scheduler.execute(() -> runSafely(task));
        } catch (RejectedExecutionException e) {
            log.warn("Realtime client {} is closed, ignoring request", identity.getUserId());
        }
    }

    private void submitFor(long expectedGeneration, Runnable task) {
        submit(() -> {
            if (expectedGeneration == generation) {
                task.run();
            }
        });
    }

    private ScheduledFuture<?> schedule(long expectedGeneration, Runnable task, long delay) {
        try {
            return scheduler.schedule(() -> runSafely(() -> {
                if (expectedGeneration == generation) {
                    task.run();
                }
            }), delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Realtime client {} is closed, not scheduling", identity.getUserId());
            return null;
        }
    }

    private void runSafely(Runnable task) {
        try {
            task.run();
        } catch (Exception e) {
            log.error("Realtime client {} state transition failed", identity.getUserId(), e);
        }
    }
}
