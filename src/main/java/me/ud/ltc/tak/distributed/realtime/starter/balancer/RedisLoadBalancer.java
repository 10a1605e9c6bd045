package me.ud.ltc.tak.distributed.realtime.starter.balancer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import me.ud.ltc.tak.distributed.realtime.starter.exception.RealtimeDeliveryException;

import lombok.extern.slf4j.Slf4j;

/**
 * Weighted round robin over the active and healthy backing store instances.
 * <p>
 * {@link #execute(RedisOperation)} never throws: when no instance is eligible, or the chosen instance fails, the
 * failure is reported through the returned {@link OperationResult}.
 *
 * @author takltc
 */
@Slf4j
public class RedisLoadBalancer {

    private final List<BackendInstance> instances;
    private final int errorThreshold;
    private final AtomicInteger roundRobinIndex = new AtomicInteger(0);

    /**
     * Resources created for the instances, released on {@link #stop()}
     */
    private final List<AutoCloseable> managedResources = new CopyOnWriteArrayList<>();

    public RedisLoadBalancer(List<BackendInstance> instances, int errorThreshold) {
        if (instances == null || instances.isEmpty()) {
            throw new IllegalStateException("At least one Redis instance must be configured");
        }
        if (errorThreshold <= 0) {
            throw new IllegalStateException("Error threshold must be greater than 0");
        }
        this.instances = Collections.unmodifiableList(new ArrayList<>(instances));
        this.errorThreshold = errorThreshold;
    }

    public void start() {
        log.info("Redis load balancer started, instances: {}, error threshold: {}", instances.size(), errorThreshold);
    }

    public void stop() {
        for (AutoCloseable resource : managedResources) {
            try {
                resource.close();
            } catch (Exception e) {
                log.warn("Error releasing Redis instance resource", e);
            }
        }
        managedResources.clear();
        log.info("Redis load balancer stopped");
    }

    /**
     * Register a resource to be released when the balancer stops
     *
     * @param resource Resource
     */
    public void manage(AutoCloseable resource) {
        managedResources.add(resource);
    }

    /**
     * Execute an operation on the next eligible instance
     *
     * @param operation Operation
     * @param <T> Result type
     * @return Operation result
     */
    public <T> OperationResult<T> execute(RedisOperation<T> operation) {
        BackendInstance instance = selectInstance();
        if (instance == null) {
            log.debug("No healthy Redis instance available");
            return OperationResult.failure(new RealtimeDeliveryException("No healthy Redis instance available"),
                null);
        }

        try {
            T data = operation.execute(instance.getRedis());
            return OperationResult.success(data, instance.getId());
        } catch (Exception e) {
            boolean demoted = instance.recordFailure(errorThreshold, System.currentTimeMillis());
            if (demoted) {
                log.warn("Redis instance {} marked unhealthy after {} consecutive errors", instance.getId(),
                    errorThreshold, e);
            } else {
                log.debug("Redis operation failed on instance {}", instance.getId(), e);
            }
            return OperationResult.failure(e, instance.getId());
        }
    }

    /**
     * Pick the next instance by weight among the available ones
     *
     * @return Instance, or null if none is available
     */
    BackendInstance selectInstance() {
        List<BackendInstance> weighted = new ArrayList<>();
        for (BackendInstance instance : instances) {
            if (instance.isAvailable()) {
                for (int i = 0; i < instance.getWeight(); i++) {
                    weighted.add(instance);
                }
            }
        }
        if (weighted.isEmpty()) {
            return null;
        }
        int index = Math.floorMod(roundRobinIndex.getAndIncrement(), weighted.size());
        return weighted.get(index);
    }

    public List<BackendInstance> getInstances() {
        return instances;
    }

    /**
     * First configured instance, used for traffic that must stay on one connection such as pub/sub
     *
     * @return Primary instance
     */
    public BackendInstance getPrimary() {
        return instances.get(0);
    }

    public LoadBalancerStats getStats() {
        Map<String, InstanceHealth> health = new LinkedHashMap<>();
        int healthy = 0;
        for (BackendInstance instance : instances) {
            InstanceHealth snapshot = instance.snapshot();
            health.put(instance.getId(), snapshot);
            if (snapshot.isHealthy()) {
                healthy++;
            }
        }
        return new LoadBalancerStats(instances.size(), healthy, instances.size() - healthy, health);
    }

    /**
     * Mark every instance healthy and clear the error streaks
     */
    public void resetHealth() {
        instances.forEach(BackendInstance::resetHealth);
        log.info("Health of all Redis instances reset");
    }
}
