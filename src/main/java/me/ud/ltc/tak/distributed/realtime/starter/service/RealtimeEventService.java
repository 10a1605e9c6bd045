package me.ud.ltc.tak.distributed.realtime.starter.service;

import java.util.Map;

import me.ud.ltc.tak.distributed.realtime.starter.model.EventPayload;
import me.ud.ltc.tak.distributed.realtime.starter.model.EventTargets;
import me.ud.ltc.tak.distributed.realtime.starter.model.Priority;

/**
 * Entry point for producing events
 *
 * @author takltc
 */
public interface RealtimeEventService {

    /**
     * Emit an event: rate limit, store, deliver to local connections, then relay to the other processes
     *
     * @param type Event type
     * @param data Payload, converted to JSON
     * @param targets Recipients, null for broadcast
     * @param priority Priority, null for NORMAL
     * @return Event ID
     * @throws me.ud.ltc.tak.distributed.realtime.starter.exception.RateLimitExceededException If rejected by the
     *     rate limiter
     * @throws me.ud.ltc.tak.distributed.realtime.starter.exception.NoDeliveryPathException If the event could
     *     neither be stored, relayed nor delivered locally
     */
    String emit(String type, Object data, EventTargets targets, Priority priority);

    /**
     * Emit a typed payload, its type deciding the event type
     */
    String emit(EventPayload payload, EventTargets targets, Priority priority);

    String sendEventToUser(String userId, String type, Object data);

    String broadcastEvent(String type, Object data);

    /**
     * Emit a notification to the given users, or to everyone when none are given
     */
    String emitNotification(String title, String message, String level, String... userIds);

    /**
     * Emit a dashboard update to everyone
     */
    String emitDashboardUpdate(String updateType, Map<String, Object> data);

    void start();

    void stop();
}
