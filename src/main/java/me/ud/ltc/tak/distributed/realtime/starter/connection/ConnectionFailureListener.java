package me.ud.ltc.tak.distributed.realtime.starter.connection;

/**
 * Notified when a connection closes without going through a graceful close: a failed write, a slow consumer
 * or the peer going away. The cause is null when the peer completed normally.
 *
 * @author takltc
 */
@FunctionalInterface
public interface ConnectionFailureListener {

    void onFailure(ClientConnection connection, Throwable cause);
}
