package me.ud.ltc.tak.distributed.realtime.starter.model;

/**
 * Transport used to deliver events to a client
 *
 * @author takltc
 */
public enum TransportType {

    /**
     * Server initiated stream (server-sent events)
     */
    PUSH,

    /**
     * Client initiated periodic reads
     */
    POLLING
}
