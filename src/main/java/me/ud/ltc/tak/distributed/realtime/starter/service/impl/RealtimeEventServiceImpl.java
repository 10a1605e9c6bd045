package me.ud.ltc.tak.distributed.realtime.starter.service.impl;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;

import me.ud.ltc.tak.distributed.realtime.starter.exception.EventStoreException;
import me.ud.ltc.tak.distributed.realtime.starter.exception.NoDeliveryPathException;
import me.ud.ltc.tak.distributed.realtime.starter.exception.RateLimitExceededException;
import me.ud.ltc.tak.distributed.realtime.starter.model.DashboardUpdatePayload;
import me.ud.ltc.tak.distributed.realtime.starter.model.Event;
import me.ud.ltc.tak.distributed.realtime.starter.model.EventPayload;
import me.ud.ltc.tak.distributed.realtime.starter.model.EventTargets;
import me.ud.ltc.tak.distributed.realtime.starter.model.NotificationPayload;
import me.ud.ltc.tak.distributed.realtime.starter.model.Priority;
import me.ud.ltc.tak.distributed.realtime.starter.service.CrossProcessRelay;
import me.ud.ltc.tak.distributed.realtime.starter.service.EventStore;
import me.ud.ltc.tak.distributed.realtime.starter.service.LocalBroadcaster;
import me.ud.ltc.tak.distributed.realtime.starter.service.RateLimiter;
import me.ud.ltc.tak.distributed.realtime.starter.service.RealtimeEventService;

import lombok.extern.slf4j.Slf4j;

/**
 * Emission pipeline: rate limiter, history, local fan-out, then the relay. Events received from other instances
 * are only delivered locally; the publishing instance has already stored them.
 * <p>
 * Concurrent emissions append in parallel, but their local fan-out is released by the {@link EmissionSequencer}
 * in timestamp order, so every local connection sees the events of this process in the same order.
 *
 * @author takltc
 */
@Slf4j
public class RealtimeEventServiceImpl implements RealtimeEventService {

    private final RateLimiter rateLimiter;
    private final EventStore eventStore;
    private final LocalBroadcaster broadcaster;
    private final CrossProcessRelay relay;
    private final ObjectMapper objectMapper;
    private final EmissionSequencer sequencer;
    private final Clock clock;

    private final AtomicBoolean subscribed = new AtomicBoolean(false);

    public RealtimeEventServiceImpl(RateLimiter rateLimiter, EventStore eventStore, LocalBroadcaster broadcaster,
        CrossProcessRelay relay, ObjectMapper objectMapper) {
        this(rateLimiter, eventStore, broadcaster, relay, objectMapper, Clock.systemUTC());
    }

    public RealtimeEventServiceImpl(RateLimiter rateLimiter, EventStore eventStore, LocalBroadcaster broadcaster,
        CrossProcessRelay relay, ObjectMapper objectMapper, Clock clock) {
        this(rateLimiter, eventStore, broadcaster, relay, objectMapper, new EmissionSequencer(clock), clock);
    }

    /**
     * @param sequencer Sequencer shared with the polling gateway
     */
    public RealtimeEventServiceImpl(RateLimiter rateLimiter, EventStore eventStore, LocalBroadcaster broadcaster,
        CrossProcessRelay relay, ObjectMapper objectMapper, EmissionSequencer sequencer, Clock clock) {
        this.rateLimiter = rateLimiter;
        this.eventStore = eventStore;
        this.broadcaster = broadcaster;
        this.relay = relay;
        this.objectMapper = objectMapper;
        this.sequencer = sequencer;
        this.clock = clock;
    }

    @Override
    public void start() {
        if (subscribed.compareAndSet(false, true)) {
            relay.subscribe(this::onRemoteEvent);
            log.info("Realtime event service started, relay local-only: {}", relay.isLocalOnly());
        }
    }

    @Override
    public void stop() {
        log.info("Realtime event service stopped");
    }

    @Override
    public String emit(String type, Object data, EventTargets targets, Priority priority) {
        if (type == null || type.trim().isEmpty()) {
            throw new IllegalArgumentException("Event type must not be empty");
        }
        EventTargets effectiveTargets = targets != null ? targets : EventTargets.broadcast();
        Priority effectivePriority = priority != null ? priority : Priority.NORMAL;

        if (!rateLimiter.tryAdmit(type, effectiveTargets.getUserIds(), effectivePriority)) {
            log.info("Event of type {} rejected by rate limiter, targets: {}", type, effectiveTargets);
            throw new RateLimitExceededException(type);
        }

        JsonNode json = toJson(data);
        long timestamp = sequencer.next();
        Event event = Event.builder().id(UUID.randomUUID().toString()).type(type).data(json).timestamp(timestamp)
            .targets(effectiveTargets).build();

        CompletableFuture<Integer> delivery = new CompletableFuture<>();
        boolean stored = false;
        boolean appendFinished = false;
        try {
            eventStore.append(event);
            stored = true;
            appendFinished = true;
        } catch (EventStoreException e) {
            appendFinished = true;
            log.warn("Event {} could not be stored, polling clients will miss it", event.getId(), e);
        } finally {
            // Unexpected failures still release the slot so later emissions are not held back
            sequencer.complete(timestamp, appendFinished ? () -> delivery.complete(deliverLocal(event)) : null);
        }
        int delivered = delivery.join();

        boolean relayed = relay.publish(event);

        if (!stored && !relayed && delivered == 0) {
            log.error("No delivery path for event {} of type {}", event.getId(), type);
            throw new NoDeliveryPathException(event.getId());
        }
        log.debug("Emitted event {} of type {}, stored: {}, local deliveries: {}, relayed: {}", event.getId(), type,
            stored, delivered, relayed);
        return event.getId();
    }

    @Override
    public String emit(EventPayload payload, EventTargets targets, Priority priority) {
        return emit(payload.getEventType().getValue(), payload, targets, priority);
    }

    @Override
    public String sendEventToUser(String userId, String type, Object data) {
        return emit(type, data, EventTargets.users(userId), Priority.NORMAL);
    }

    @Override
    public String broadcastEvent(String type, Object data) {
        return emit(type, data, EventTargets.broadcast(), Priority.NORMAL);
    }

    @Override
    public String emitNotification(String title, String message, String level, String... userIds) {
        NotificationPayload.NotificationPayloadBuilder builder = NotificationPayload.builder()
            .id(UUID.randomUUID().toString()).title(title).message(message).timestamp(clock.millis());
        if (level != null) {
            builder.level(level);
        }
        EventTargets targets =
            userIds == null || userIds.length == 0 ? EventTargets.broadcast() : EventTargets.users(userIds);
        return emit(builder.build(), targets, Priority.NORMAL);
    }

    @Override
    public String emitDashboardUpdate(String updateType, Map<String, Object> data) {
        DashboardUpdatePayload payload = DashboardUpdatePayload.builder().id(UUID.randomUUID().toString())
            .updateType(updateType).data(data).timestamp(clock.millis()).build();
        return emit(payload, EventTargets.broadcast(), Priority.NORMAL);
    }

    private int deliverLocal(Event event) {
        try {
            return broadcaster.deliverLocal(event);
        } catch (Exception e) {
            log.error("Local delivery of event {} failed", event.getId(), e);
            return 0;
        }
    }

    private void onRemoteEvent(Event event) {
        int delivered = broadcaster.deliverLocal(event);
        log.debug("Relayed event {} delivered to {} local connections", event.getId(), delivered);
    }

    private JsonNode toJson(Object data) {
        if (data == null) {
            return NullNode.getInstance();
        }
        return objectMapper.valueToTree(data);
    }
}
