package me.ud.ltc.tak.distributed.realtime.starter.balancer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import me.ud.ltc.tak.distributed.realtime.starter.config.RealtimeProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Builds backend instances from configuration, one Lettuce connection factory per instance
 *
 * @author takltc
 */
@Slf4j
public class RedisInstanceFactory {

    private final RealtimeProperties.LoadBalancer config;

    public RedisInstanceFactory(RealtimeProperties.LoadBalancer config) {
        this.config = config;
    }

    /**
     * Create the configured instances and hand their connection factories to the balancer for release
     *
     * @return Load balancer over the configured instances
     */
    public RedisLoadBalancer createLoadBalancer() {
        List<BackendInstance> instances = new ArrayList<>();
        List<LettuceConnectionFactory> factories = new ArrayList<>();
        List<RealtimeProperties.Instance> configured = config.getInstances();
        for (int i = 0; i < configured.size(); i++) {
            RealtimeProperties.Instance instanceConfig = configured.get(i);
            String id = instanceConfig.getId() != null ? instanceConfig.getId() : "redis-" + i;
            LettuceConnectionFactory factory = createConnectionFactory(instanceConfig);
            factories.add(factory);
            instances.add(new BackendInstance(id, instanceConfig.getWeight(), instanceConfig.isActive(),
                new StringRedisTemplate(factory)));
            log.info("Configured Redis instance {} at {}:{}, weight: {}", id, instanceConfig.getHost(),
                instanceConfig.getPort(), instanceConfig.getWeight());
        }

        RedisLoadBalancer balancer = new RedisLoadBalancer(instances, config.getErrorThreshold());
        factories.forEach(factory -> balancer.manage(factory::destroy));
        return balancer;
    }

    LettuceConnectionFactory createConnectionFactory(RealtimeProperties.Instance instanceConfig) {
        RedisStandaloneConfiguration standalone =
            new RedisStandaloneConfiguration(instanceConfig.getHost(), instanceConfig.getPort());
        standalone.setDatabase(instanceConfig.getDatabase());
        if (instanceConfig.getPassword() != null && !instanceConfig.getPassword().isEmpty()) {
            standalone.setPassword(RedisPassword.of(instanceConfig.getPassword()));
        }
        LettuceClientConfiguration clientConfig = LettuceClientConfiguration.builder()
            .commandTimeout(Duration.ofMillis(config.getOperationTimeout())).build();
        LettuceConnectionFactory factory = new LettuceConnectionFactory(standalone, clientConfig);
        factory.afterPropertiesSet();
        return factory;
    }
}
