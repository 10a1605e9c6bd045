package me.ud.ltc.tak.distributed.realtime.starter.client;

/**
 * Handle of an open push stream
 *
 * @author takltc
 */
@FunctionalInterface
public interface PushSubscription extends AutoCloseable {

    @Override
    void close();
}
