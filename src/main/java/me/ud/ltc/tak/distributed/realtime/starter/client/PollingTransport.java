package me.ud.ltc.tak.distributed.realtime.starter.client;

import java.util.List;

import me.ud.ltc.tak.distributed.realtime.starter.model.Event;

/**
 * Client side of the polling endpoint
 *
 * @author takltc
 */
public interface PollingTransport {

    /**
     * Fetch the events newer than the cursor, oldest first
     *
     * @param identity Client identity
     * @param since Cursor
     * @return Events
     */
    List<Event> poll(ClientIdentity identity, long since);
}
