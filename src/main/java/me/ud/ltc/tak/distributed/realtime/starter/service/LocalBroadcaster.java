package me.ud.ltc.tak.distributed.realtime.starter.service;

import java.util.Collection;

import me.ud.ltc.tak.distributed.realtime.starter.connection.ClientConnection;
import me.ud.ltc.tak.distributed.realtime.starter.model.Event;

/**
 * Fans events out to the open connections of this process
 *
 * @author takltc
 */
public interface LocalBroadcaster {

    void registerConnection(ClientConnection connection);

    void unregisterConnection(String connectionId);

    /**
     * Queue the event on every matching open connection; never blocks on a connection
     *
     * @param event Event
     * @return Number of connections the event was queued on
     */
    int deliverLocal(Event event);

    Collection<ClientConnection> getConnections();
}
