package me.ud.ltc.tak.distributed.realtime.starter.service;

import java.util.List;

import me.ud.ltc.tak.distributed.realtime.starter.model.Event;

/**
 * Bounded history of recent events, newest first
 *
 * @author takltc
 */
public interface EventStore {

    /**
     * Append an event, evicting the oldest beyond the configured cap
     *
     * @param event Event
     * @return Event ID
     */
    String append(Event event);

    /**
     * List stored events, newest first
     *
     * @param since Only events with a timestamp strictly greater than this; null for all
     * @return Events
     */
    List<Event> list(Long since);

    void clear();
}
