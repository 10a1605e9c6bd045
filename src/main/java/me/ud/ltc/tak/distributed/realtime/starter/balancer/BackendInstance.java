package me.ud.ltc.tak.distributed.realtime.starter.balancer;

import org.springframework.data.redis.core.RedisOperations;

import lombok.Getter;

/**
 * One backing store instance together with its health record.
 * <p>
 * Health is mutated by the health checker and by the load balancer on operation errors, and is only ever
 * promoted back to healthy by a successful probe.
 *
 * @author takltc
 */
public class BackendInstance {

    @Getter
    private final String id;

    @Getter
    private final int weight;

    @Getter
    private final RedisOperations<String, String> redis;

    private volatile boolean active;

    private boolean healthy = true;
    private int consecutiveErrors;
    private long errorCount;
    private long lastCheck;

    public BackendInstance(String id, int weight, boolean active, RedisOperations<String, String> redis) {
        if (weight <= 0) {
            throw new IllegalArgumentException("Instance weight must be greater than 0: " + id);
        }
        this.id = id;
        this.weight = weight;
        this.active = active;
        this.redis = redis;
        this.lastCheck = System.currentTimeMillis();
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public synchronized boolean isHealthy() {
        return healthy;
    }

    public boolean isAvailable() {
        return active && isHealthy();
    }

    /**
     * Record a failed operation or probe
     *
     * @param errorThreshold Consecutive errors that demote the instance
     * @param now Current time
     * @return true if this call demoted the instance
     */
    public synchronized boolean recordFailure(int errorThreshold, long now) {
        consecutiveErrors++;
        errorCount++;
        lastCheck = now;
        if (healthy && consecutiveErrors >= errorThreshold) {
            healthy = false;
            return true;
        }
        return false;
    }

    /**
     * Record a successful probe, which resets the error streak and promotes the instance
     *
     * @param now Current time
     * @return true if this call promoted the instance
     */
    public synchronized boolean recordProbeSuccess(long now) {
        boolean promoted = !healthy;
        healthy = true;
        consecutiveErrors = 0;
        lastCheck = now;
        return promoted;
    }

    public synchronized void resetHealth() {
        healthy = true;
        consecutiveErrors = 0;
    }

    public synchronized InstanceHealth snapshot() {
        return new InstanceHealth(healthy, consecutiveErrors, errorCount, lastCheck);
    }
}
