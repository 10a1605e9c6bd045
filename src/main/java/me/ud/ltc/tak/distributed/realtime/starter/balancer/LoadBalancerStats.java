package me.ud.ltc.tak.distributed.realtime.starter.balancer;

import java.util.Map;

import lombok.Value;

/**
 * Load balancer statistics
 *
 * @author takltc
 */
@Value
public class LoadBalancerStats {

    int totalInstances;

    int healthyInstances;

    int unhealthyInstances;

    Map<String, InstanceHealth> instances;
}
