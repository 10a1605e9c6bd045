package me.ud.ltc.tak.distributed.realtime.starter.service.impl;

import java.util.List;

import me.ud.ltc.tak.distributed.realtime.starter.exception.EventStoreException;
import me.ud.ltc.tak.distributed.realtime.starter.model.Event;
import me.ud.ltc.tak.distributed.realtime.starter.service.EventStore;

import lombok.extern.slf4j.Slf4j;

/**
 * Shared history with a local copy: every event is also kept in memory, and reads fall back to the local copy
 * while the shared store is unreachable. Appends only fail when both stores fail.
 *
 * @author takltc
 */
@Slf4j
public class FallbackEventStore implements EventStore {

    private final EventStore primary;
    private final EventStore local;

    public FallbackEventStore(EventStore primary, EventStore local) {
        this.primary = primary;
        this.local = local;
    }

    @Override
    public String append(Event event) {
        local.append(event);
        try {
            return primary.append(event);
        } catch (EventStoreException e) {
            log.warn("Shared event history unavailable, event {} kept locally only", event.getId(), e);
            return event.getId();
        }
    }

    @Override
    public List<Event> list(Long since) {
        try {
            return primary.list(since);
        } catch (EventStoreException e) {
            log.warn("Shared event history unavailable, serving local history", e);
            return local.list(since);
        }
    }

    @Override
    public void clear() {
        local.clear();
        primary.clear();
    }
}
