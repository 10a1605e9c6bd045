package me.ud.ltc.tak.distributed.realtime.starter.model;

import java.util.Collection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Unit of delivery. Once stored an event is never modified.
 *
 * @author takltc
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Event {

    /**
     * Globally unique identifier generated at emission time
     */
    String id;

    /**
     * Type discriminator, e.g. notification, dashboardUpdate
     */
    String type;

    /**
     * Opaque payload, forwarded verbatim
     */
    @Builder.Default
    JsonNode data = NullNode.getInstance();

    /**
     * Creation time (epoch milliseconds), used as the polling cursor
     */
    long timestamp;

    /**
     * Recipients; broadcast when empty
     */
    @Builder.Default
    EventTargets targets = EventTargets.broadcast();

    public EventTargets getTargets() {
        return targets != null ? targets : EventTargets.broadcast();
    }

    public boolean isVisibleTo(String userId, Collection<String> roles) {
        return getTargets().matches(userId, roles);
    }
}
