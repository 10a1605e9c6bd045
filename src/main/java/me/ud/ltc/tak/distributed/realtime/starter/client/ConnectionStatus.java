package me.ud.ltc.tak.distributed.realtime.starter.client;

/**
 * @author takltc
 */
public enum ConnectionStatus {

    CONNECTED,

    CONNECTING,

    DISCONNECTED,

    /**
     * The active transport keeps failing; the selector is still retrying
     */
    ERROR
}
