package me.ud.ltc.tak.distributed.realtime.starter.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * In-app notification
 *
 * @author takltc
 */
@Value
@Builder
@Jacksonized
public class NotificationPayload implements EventPayload {

    String id;

    String title;

    String message;

    /**
     * Severity shown by the client: info, success, warning, error
     */
    @Builder.Default
    String level = "info";

    String icon;

    long timestamp;

    @Override
    public RealtimeEventType getEventType() {
        return RealtimeEventType.NOTIFICATION;
    }
}
