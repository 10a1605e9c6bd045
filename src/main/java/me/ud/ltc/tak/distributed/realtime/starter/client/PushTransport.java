package me.ud.ltc.tak.distributed.realtime.starter.client;

/**
 * Client side of the push endpoint
 *
 * @author takltc
 */
public interface PushTransport {

    /**
     * Open a push stream. Connection errors may be thrown or reported through the listener.
     *
     * @param identity Client identity
     * @param listener Listener
     * @return Subscription closing the stream
     */
    PushSubscription connect(ClientIdentity identity, PushListener listener);
}
