package me.ud.ltc.tak.distributed.realtime.starter.service;

import java.util.Collection;
import java.util.List;
import java.util.Set;

import me.ud.ltc.tak.distributed.realtime.starter.model.Event;
import me.ud.ltc.tak.distributed.realtime.starter.model.PollingBatch;
import me.ud.ltc.tak.distributed.realtime.starter.model.PollingQuery;

/**
 * Serves stored events to clients that cannot hold a push connection
 *
 * @author takltc
 */
public interface PollingGateway {

    /**
     * Events visible to the caller newer than the cursor, oldest first
     *
     * @param userId User ID
     * @param roles Roles
     * @param since Cursor, null for the whole history
     * @return Events
     */
    List<Event> poll(String userId, Collection<String> roles, Long since);

    /**
     * As {@link #poll(String, Collection, Long)}, restricted to the given event types when not empty
     */
    List<Event> poll(String userId, Collection<String> roles, Long since, Set<String> types);

    /**
     * Run a poll with a limit and an age filter. With a limit the oldest matching events are returned, so the
     * cursor of the batch never skips an event.
     *
     * @param query Query
     * @return Events and the cursor for the next poll
     */
    PollingBatch poll(PollingQuery query);
}
