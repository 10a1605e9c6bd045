package me.ud.ltc.tak.distributed.realtime.starter.balancer;

import lombok.Value;

/**
 * Snapshot of an instance's health record
 *
 * @author takltc
 */
@Value
public class InstanceHealth {

    boolean healthy;

    int consecutiveErrors;

    long errorCount;

    long lastCheck;
}
