package me.ud.ltc.tak.distributed.realtime.starter.service.impl;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import me.ud.ltc.tak.distributed.realtime.starter.connection.ClientConnection;
import me.ud.ltc.tak.distributed.realtime.starter.connection.DeliveryStatistics;
import me.ud.ltc.tak.distributed.realtime.starter.connection.OutboundMessage;
import me.ud.ltc.tak.distributed.realtime.starter.model.Event;
import me.ud.ltc.tak.distributed.realtime.starter.service.LocalBroadcaster;

import lombok.extern.slf4j.Slf4j;

/**
 * Local fan-out. Delivery only queues on each connection; a connection whose queue is full is dropped as a slow
 * consumer so that one peer can never hold up the others.
 *
 * @author takltc
 */
@Slf4j
public class DefaultLocalBroadcaster implements LocalBroadcaster {

    private final Map<String, ClientConnection> connections = new ConcurrentHashMap<>();
    private final DeliveryStatistics statistics;

    public DefaultLocalBroadcaster(DeliveryStatistics statistics) {
        this.statistics = statistics;
    }

    public DefaultLocalBroadcaster() {
        this(new DeliveryStatistics());
    }

    @Override
    public void registerConnection(ClientConnection connection) {
        connections.put(connection.getConnectionId(), connection);
    }

    @Override
    public void unregisterConnection(String connectionId) {
        connections.remove(connectionId);
    }

    @Override
    public int deliverLocal(Event event) {
        OutboundMessage message = OutboundMessage.of(event);
        int delivered = 0;
        for (ClientConnection connection : connections.values()) {
            if (!connection.isOpen() || !connection.matches(event)) {
                continue;
            }
            try {
                if (connection.enqueue(message)) {
                    delivered++;
                } else if (connection.isOpen()) {
                    log.warn("Send queue of connection {} is full, dropping slow consumer, user: {}",
                        connection.getConnectionId(), connection.getUserId());
                    statistics.recordSlowConsumer();
                    connection.fail(new SlowConsumerException(connection.getConnectionId()));
                }
            } catch (Exception e) {
                log.error("Error delivering event {} to connection {}", event.getId(), connection.getConnectionId(),
                    e);
                connection.fail(e);
            }
        }
        log.debug("Event {} of type {} delivered to {} local connections", event.getId(), event.getType(),
            delivered);
        return delivered;
    }

    @Override
    public Collection<ClientConnection> getConnections() {
        return Collections.unmodifiableCollection(connections.values());
    }

    public DeliveryStatistics getStatistics() {
        return statistics;
    }

    /**
     * Cause recorded on a connection dropped for not keeping up
     */
    static class SlowConsumerException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        SlowConsumerException(String connectionId) {
            super("Send queue full for connection: " + connectionId);
        }
    }
}
