package me.ud.ltc.tak.distributed.realtime.starter.client;

import me.ud.ltc.tak.distributed.realtime.starter.model.TransportType;

import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of a {@link BackendSelector}
 *
 * @author takltc
 */
@Value
@Builder
public class SelectorState {

    ConnectionStatus status;

    ConnectionMode mode;

    /**
     * Active transport, null when disconnected
     */
    TransportType transport;

    int pushFailures;

    int pollingFailures;

    /**
     * Timestamp of the newest event received
     */
    long cursor;

    String lastError;
}
