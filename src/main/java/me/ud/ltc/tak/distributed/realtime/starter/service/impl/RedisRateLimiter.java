package me.ud.ltc.tak.distributed.realtime.starter.service.impl;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

import org.springframework.data.redis.connection.ReturnType;

import me.ud.ltc.tak.distributed.realtime.starter.balancer.OperationResult;
import me.ud.ltc.tak.distributed.realtime.starter.balancer.RedisLoadBalancer;
import me.ud.ltc.tak.distributed.realtime.starter.config.RealtimeProperties;
import me.ud.ltc.tak.distributed.realtime.starter.model.Priority;
import me.ud.ltc.tak.distributed.realtime.starter.script.LuaScript;
import me.ud.ltc.tak.distributed.realtime.starter.script.LuaScriptService;
import me.ud.ltc.tak.distributed.realtime.starter.service.RateLimiter;

import lombok.extern.slf4j.Slf4j;

/**
 * Fixed window rate limiter with counters in Redis. All counters of one decision are checked and incremented by a
 * single script; the keys share a hash tag so the script also runs on a cluster. If Redis cannot be reached the
 * emission is admitted.
 *
 * @author takltc
 */
@Slf4j
public class RedisRateLimiter implements RateLimiter {

    private final RealtimeProperties.RateLimit config;
    private final RedisLoadBalancer loadBalancer;
    private final LuaScriptService luaScriptService;
    private final String keyPrefix;
    private final Clock clock;

    public RedisRateLimiter(RealtimeProperties properties, RedisLoadBalancer loadBalancer,
        LuaScriptService luaScriptService) {
        this(properties, loadBalancer, luaScriptService, Clock.systemUTC());
    }

    public RedisRateLimiter(RealtimeProperties properties, RedisLoadBalancer loadBalancer,
        LuaScriptService luaScriptService, Clock clock) {
        this.config = properties.getRateLimit();
        this.loadBalancer = loadBalancer;
        this.luaScriptService = luaScriptService;
        this.keyPrefix = properties.getRedis().getPrefix() + "{ratelimit}:";
        this.clock = clock;
        if (config.getWindowSeconds() <= 0) {
            throw new IllegalStateException("Rate limit window must be greater than 0");
        }
    }

    @Override
    public boolean tryAdmit(String eventType, Collection<String> userIds, Priority priority) {
        if (!config.isEnabled() || priority == Priority.HIGH) {
            return true;
        }

        long windowStart = windowStart(clock.millis(), config.getWindowSeconds());
        List<String> keys = new ArrayList<>();
        if (userIds != null) {
            for (String userId : new LinkedHashSet<>(userIds)) {
                keys.add(keyPrefix + "user:" + userId + ":" + windowStart);
            }
        }
        keys.add(keyPrefix + "type:" + eventType + ":" + windowStart);
        List<String> args = Arrays.asList(String.valueOf(config.getMaxPerUser()),
            String.valueOf(config.getMaxPerType()), String.valueOf(config.getWindowSeconds()));

        OperationResult<Long> result = loadBalancer.execute(
            redis -> luaScriptService.executeScript(redis, LuaScript.RATE_LIMIT_ADMIT, keys, args, ReturnType.INTEGER));
        if (!result.isSuccess()) {
            log.warn("Rate limiter unavailable, admitting event of type {}", eventType, result.getError());
            return true;
        }

        boolean admitted = result.getData() != null && result.getData() == 1L;
        if (!admitted) {
            log.debug("Rate limit reached for event type {}, users: {}", eventType, userIds);
        }
        return admitted;
    }

    /**
     * Runs the admission script with a single counter, which is then checked against the last limit argument
     */
    @Override
    public boolean tryAcquire(String scope, String key, int max) {
        if (!config.isEnabled() || max <= 0) {
            return true;
        }

        long windowStart = windowStart(clock.millis(), config.getWindowSeconds());
        List<String> keys = Collections.singletonList(keyPrefix + scope + ":" + key + ":" + windowStart);
        List<String> args = Arrays.asList(String.valueOf(max), String.valueOf(max),
            String.valueOf(config.getWindowSeconds()));

        OperationResult<Long> result = loadBalancer.execute(
            redis -> luaScriptService.executeScript(redis, LuaScript.RATE_LIMIT_ADMIT, keys, args, ReturnType.INTEGER));
        if (!result.isSuccess()) {
            log.warn("Rate limiter unavailable, admitting {} request of {}", scope, key, result.getError());
            return true;
        }

        boolean admitted = result.getData() != null && result.getData() == 1L;
        if (!admitted) {
            log.debug("Rate limit reached for {} requests of {}", scope, key);
        }
        return admitted;
    }

    static long windowStart(long now, int windowSeconds) {
        long windowMillis = windowSeconds * 1000L;
        return now - Math.floorMod(now, windowMillis);
    }
}
