package me.ud.ltc.tak.distributed.realtime.starter.service.impl;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import me.ud.ltc.tak.distributed.realtime.starter.config.RealtimeProperties;
import me.ud.ltc.tak.distributed.realtime.starter.model.Priority;
import me.ud.ltc.tak.distributed.realtime.starter.service.RateLimiter;

/**
 * Fixed window rate limiter for single node deployments, with the same all-or-nothing semantics as
 * {@link RedisRateLimiter}
 *
 * @author takltc
 */
public class InMemoryRateLimiter implements RateLimiter {

    private final RealtimeProperties.RateLimit config;
    private final Clock clock;

    /**
     * Counter key to count, for the current window only
     */
    private final Map<String, Integer> counters = new HashMap<>();
    private long currentWindow = -1;

    public InMemoryRateLimiter(RealtimeProperties properties) {
        this(properties, Clock.systemUTC());
    }

    public InMemoryRateLimiter(RealtimeProperties properties, Clock clock) {
        this.config = properties.getRateLimit();
        this.clock = clock;
        if (config.getWindowSeconds() <= 0) {
            throw new IllegalStateException("Rate limit window must be greater than 0");
        }
    }

    @Override
    public synchronized boolean tryAdmit(String eventType, Collection<String> userIds, Priority priority) {
        if (!config.isEnabled() || priority == Priority.HIGH) {
            return true;
        }

        rollWindow();

        List<String> userKeys = new ArrayList<>();
        if (userIds != null) {
            for (String userId : new LinkedHashSet<>(userIds)) {
                userKeys.add("user:" + userId);
            }
        }
        String typeKey = "type:" + eventType;

        for (String key : userKeys) {
            if (counters.getOrDefault(key, 0) >= config.getMaxPerUser()) {
                return false;
            }
        }
        if (counters.getOrDefault(typeKey, 0) >= config.getMaxPerType()) {
            return false;
        }

        for (String key : userKeys) {
            counters.merge(key, 1, Integer::sum);
        }
        counters.merge(typeKey, 1, Integer::sum);
        return true;
    }

    @Override
    public synchronized boolean tryAcquire(String scope, String key, int max) {
        if (!config.isEnabled() || max <= 0) {
            return true;
        }
        rollWindow();

        String counterKey = scope + ":" + key;
        if (counters.getOrDefault(counterKey, 0) >= max) {
            return false;
        }
        counters.merge(counterKey, 1, Integer::sum);
        return true;
    }

    private void rollWindow() {
        long windowStart = RedisRateLimiter.windowStart(clock.millis(), config.getWindowSeconds());
        if (windowStart != currentWindow) {
            counters.clear();
            currentWindow = windowStart;
        }
    }
}
