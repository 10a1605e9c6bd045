package me.ud.ltc.tak.distributed.realtime.starter.model;

import lombok.Builder;
import lombok.Value;

/**
 * Point in time snapshot of the connections owned by this process
 *
 * @author takltc
 */
@Value
@Builder
public class ConnectionMetrics {

    int activeConnections;

    int peakConnections;

    int maxConnections;

    int uniqueUsers;

    long totalOpened;

    long totalClosed;

    long totalErrors;

    long eventsSent;

    long heartbeatsSent;

    long slowConsumersDropped;

    long idleTimeouts;
}
