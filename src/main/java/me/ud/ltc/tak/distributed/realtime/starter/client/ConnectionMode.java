package me.ud.ltc.tak.distributed.realtime.starter.client;

/**
 * Transport policy of a {@link BackendSelector}
 *
 * @author takltc
 */
public enum ConnectionMode {

    /**
     * Prefer push, fall back to polling after repeated push failures
     */
    AUTO,

    PUSH,

    POLLING
}
