package me.ud.ltc.tak.distributed.realtime.starter.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Typed payload of a known event type. The type discriminator is derived from the payload.
 *
 * @author takltc
 */
public interface EventPayload {

    @JsonIgnore
    RealtimeEventType getEventType();
}
