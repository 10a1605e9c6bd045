package me.ud.ltc.tak.distributed.realtime.starter.service;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

import me.ud.ltc.tak.distributed.realtime.starter.connection.ClientConnection;
import me.ud.ltc.tak.distributed.realtime.starter.connection.EventSink;
import me.ud.ltc.tak.distributed.realtime.starter.model.ConnectionMetrics;

/**
 * Owns the lifecycle of this process's push connections
 *
 * @author takltc
 */
public interface ConnectionManager {

    /**
     * Open a connection: register it for delivery, send the connected event and start its heartbeat
     *
     * @param userId User ID
     * @param roles Roles
     * @param sink Write side of the connection
     * @return Open connection
     * @throws me.ud.ltc.tak.distributed.realtime.starter.exception.ConnectionLimitExceededException If this
     *     instance or the user has reached the connection limit
     */
    ClientConnection open(String userId, Collection<String> roles, EventSink sink);

    /**
     * Close gracefully after the queued messages are written. Idempotent.
     *
     * @param connectionId Connection ID
     * @return true if this call closed the connection
     */
    boolean close(String connectionId);

    /**
     * Close immediately after an error. Idempotent.
     *
     * @param connectionId Connection ID
     * @param cause Cause
     * @return true if this call closed the connection
     */
    boolean closeWithError(String connectionId, Throwable cause);

    void closeAll();

    Optional<ClientConnection> find(String connectionId);

    int getConnectionCount();

    ConnectionMetrics getMetrics();

    /**
     * Open time of every connection
     *
     * @return Connection ID to epoch milliseconds
     */
    Map<String, Long> getConnectionTimes();

    void start();

    void stop();
}
