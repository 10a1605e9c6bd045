package me.ud.ltc.tak.distributed.realtime.starter.balancer;

import org.springframework.data.redis.core.RedisOperations;

/**
 * Operation executed against one backing store instance
 *
 * @param <T> Result type
 * @author takltc
 */
@FunctionalInterface
public interface RedisOperation<T> {

    T execute(RedisOperations<String, String> redis) throws Exception;
}
