package me.ud.ltc.tak.distributed.realtime.starter.balancer;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;

import lombok.extern.slf4j.Slf4j;

/**
 * Periodically probes every active instance. A successful probe is the only way an instance returns to the
 * healthy set.
 *
 * @author takltc
 */
@Slf4j
public class RedisHealthChecker {

    /**
     * PING the instance and expect PONG
     */
    public static final InstanceProbe PING_PROBE = instance -> {
        String reply = instance.getRedis().execute((RedisCallback<String>)RedisConnection::ping);
        if (!"PONG".equalsIgnoreCase(reply)) {
            throw new IllegalStateException("Unexpected PING reply: " + reply);
        }
    };

    private final List<BackendInstance> instances;
    private final InstanceProbe probe;
    private final int interval;
    private final int probeTimeout;
    private final int errorThreshold;

    private volatile ScheduledExecutorService scheduler;
    private volatile ExecutorService probeExecutor;

    public RedisHealthChecker(List<BackendInstance> instances, InstanceProbe probe, int interval, int probeTimeout,
        int errorThreshold) {
        if (interval <= 0) {
            throw new IllegalStateException("Health check interval must be greater than 0");
        }
        if (probeTimeout <= 0) {
            throw new IllegalStateException("Probe timeout must be greater than 0");
        }
        this.instances = instances;
        this.probe = probe != null ? probe : PING_PROBE;
        this.interval = interval;
        this.probeTimeout = probeTimeout;
        this.errorThreshold = errorThreshold;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        probeExecutor = createNamedProbePool(Math.max(1, instances.size()));
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "realtime-health-check");
            t.setDaemon(true);
            return t;
        });
        executor.setRemoveOnCancelPolicy(true);
        executor.scheduleAtFixedRate(this::checkAll, interval, interval, TimeUnit.MILLISECONDS);
        scheduler = executor;
        log.info("Redis health check started, interval: {}ms, probe timeout: {}ms", interval, probeTimeout);
    }

    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
        if (probeExecutor != null) {
            probeExecutor.shutdownNow();
            probeExecutor = null;
        }
        log.info("Redis health check stopped");
    }

    /**
     * Probe every active instance once
     */
    public void checkAll() {
        for (BackendInstance instance : instances) {
            if (!instance.isActive()) {
                continue;
            }
            try {
                check(instance);
            } catch (Exception e) {
                log.error("Health check of Redis instance {} failed unexpectedly", instance.getId(), e);
            }
        }
    }

    /**
     * Probe one instance, bounded by the probe timeout
     *
     * @param instance Instance
     * @return Whether the probe succeeded
     */
    public boolean check(BackendInstance instance) {
        long now = System.currentTimeMillis();
        try {
            runProbe(instance);
            if (instance.recordProbeSuccess(now)) {
                log.info("Redis instance {} is healthy again", instance.getId());
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Health check of Redis instance {} interrupted", instance.getId());
            return false;
        } catch (Exception e) {
            if (instance.recordFailure(errorThreshold, now)) {
                log.warn("Redis instance {} marked unhealthy by health check", instance.getId(), e);
            } else {
                log.debug("Health probe of Redis instance {} failed", instance.getId(), e);
            }
            return false;
        }
    }

    private void runProbe(BackendInstance instance) throws Exception {
        ExecutorService executor = probeExecutor;
        if (executor == null) {
            probe.probe(instance);
            return;
        }
        Future<?> future = executor.submit(() -> {
            probe.probe(instance);
            return null;
        });
        try {
            future.get(probeTimeout, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception)cause;
            }
            throw e;
        }
    }

    private ExecutorService createNamedProbePool(int size) {
        AtomicInteger counter = new AtomicInteger(0);
        return new ThreadPoolExecutor(size, size, 60, TimeUnit.SECONDS, new LinkedBlockingQueue<>(), r -> {
            Thread t = new Thread(r, "realtime-health-probe-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
