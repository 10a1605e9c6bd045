package me.ud.ltc.tak.distributed.realtime.starter.web;

import java.util.Set;

import me.ud.ltc.tak.distributed.realtime.starter.balancer.LoadBalancerStats;
import me.ud.ltc.tak.distributed.realtime.starter.model.ConnectionMetrics;

import lombok.Builder;
import lombok.Value;

/**
 * Operational view of this instance
 *
 * @author takltc
 */
@Value
@Builder
public class StatsResponse {

    String instanceId;

    ConnectionMetrics connections;

    /**
     * Null in single node mode
     */
    LoadBalancerStats loadBalancer;

    boolean relayLocalOnly;

    Set<String> activeInstances;

    long timestamp;
}
