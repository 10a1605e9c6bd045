package me.ud.ltc.tak.distributed.realtime.starter.connection;

import java.util.LinkedHashMap;
import java.util.Map;

import me.ud.ltc.tak.distributed.realtime.starter.model.Event;

import lombok.Value;

/**
 * A frame written to a push connection
 *
 * @author takltc
 */
@Value
public class OutboundMessage {

    public static final String HEARTBEAT = "heartbeat";
    public static final String CONNECTED = "connected";
    public static final String SYSTEM = "system";

    String eventName;

    String id;

    Object data;

    /**
     * Event frame: named after the event type and carrying the whole event
     */
    public static OutboundMessage of(Event event) {
        return new OutboundMessage(event.getType(), event.getId(), event);
    }

    public static OutboundMessage heartbeat() {
        return new OutboundMessage(HEARTBEAT, String.valueOf(System.currentTimeMillis()), "ping");
    }

    public static OutboundMessage connected(ClientConnection connection, long heartbeatInterval) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("connectionId", connection.getConnectionId());
        data.put("userId", connection.getUserId());
        data.put("connectedAt", connection.getOpenedAt());
        data.put("heartbeatInterval", heartbeatInterval);
        return new OutboundMessage(CONNECTED, connection.getConnectionId(), data);
    }

    public static OutboundMessage system(Object data) {
        return new OutboundMessage(SYSTEM, String.valueOf(System.currentTimeMillis()), data);
    }

    public boolean isHeartbeat() {
        return HEARTBEAT.equals(eventName);
    }
}
