package me.ud.ltc.tak.distributed.realtime.starter.config;

import java.time.Clock;
import java.util.Collections;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import com.fasterxml.jackson.databind.ObjectMapper;

import me.ud.ltc.tak.distributed.realtime.starter.balancer.BackendInstance;
import me.ud.ltc.tak.distributed.realtime.starter.balancer.RedisHealthChecker;
import me.ud.ltc.tak.distributed.realtime.starter.balancer.RedisInstanceFactory;
import me.ud.ltc.tak.distributed.realtime.starter.balancer.RedisLoadBalancer;
import me.ud.ltc.tak.distributed.realtime.starter.connection.DeliveryStatistics;
import me.ud.ltc.tak.distributed.realtime.starter.script.LuaScriptProperties;
import me.ud.ltc.tak.distributed.realtime.starter.script.LuaScriptService;
import me.ud.ltc.tak.distributed.realtime.starter.script.LuaScriptServiceImpl;
import me.ud.ltc.tak.distributed.realtime.starter.service.ConnectionManager;
import me.ud.ltc.tak.distributed.realtime.starter.service.CrossProcessRelay;
import me.ud.ltc.tak.distributed.realtime.starter.service.EventStore;
import me.ud.ltc.tak.distributed.realtime.starter.service.LocalBroadcaster;
import me.ud.ltc.tak.distributed.realtime.starter.service.PollingGateway;
import me.ud.ltc.tak.distributed.realtime.starter.service.RateLimiter;
import me.ud.ltc.tak.distributed.realtime.starter.service.RealtimeEventService;
import me.ud.ltc.tak.distributed.realtime.starter.service.RoleResolver;
import me.ud.ltc.tak.distributed.realtime.starter.service.impl.ClaimedRoleResolver;
import me.ud.ltc.tak.distributed.realtime.starter.service.impl.DefaultConnectionManager;
import me.ud.ltc.tak.distributed.realtime.starter.service.impl.DefaultLocalBroadcaster;
import me.ud.ltc.tak.distributed.realtime.starter.service.impl.DefaultPollingGateway;
import me.ud.ltc.tak.distributed.realtime.starter.service.impl.EmissionSequencer;
import me.ud.ltc.tak.distributed.realtime.starter.service.impl.FallbackEventStore;
import me.ud.ltc.tak.distributed.realtime.starter.service.impl.InMemoryEventStore;
import me.ud.ltc.tak.distributed.realtime.starter.service.impl.InMemoryRateLimiter;
import me.ud.ltc.tak.distributed.realtime.starter.service.impl.LocalOnlyRelay;
import me.ud.ltc.tak.distributed.realtime.starter.service.impl.RealtimeEventServiceImpl;
import me.ud.ltc.tak.distributed.realtime.starter.service.impl.RedisCrossProcessRelay;
import me.ud.ltc.tak.distributed.realtime.starter.service.impl.RedisEventStore;
import me.ud.ltc.tak.distributed.realtime.starter.service.impl.RedisRateLimiter;
import me.ud.ltc.tak.distributed.realtime.starter.web.RealtimeEventController;
import me.ud.ltc.tak.distributed.realtime.starter.web.RealtimeExceptionHandler;
import me.ud.ltc.tak.distributed.realtime.starter.web.RealtimePollingController;
import me.ud.ltc.tak.distributed.realtime.starter.web.RealtimeStreamController;

import lombok.extern.slf4j.Slf4j;

/**
 * Realtime event delivery auto-configuration. With Redis enabled (the default) history, rate limits and the relay
 * are shared through Redis; otherwise everything stays in this process.
 *
 * @author takltc
 */
@Slf4j
@Configuration
@AutoConfigureAfter({RedisAutoConfiguration.class, JacksonAutoConfiguration.class})
@EnableConfigurationProperties({RealtimeProperties.class, LuaScriptProperties.class})
@ConditionalOnProperty(prefix = "takltc.realtime", name = "enabled", havingValue = "true", matchIfMissing = true)
@Import(InstanceIdConfiguration.class)
public class RealtimeAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public DeliveryStatistics realtimeDeliveryStatistics() {
        return new DeliveryStatistics();
    }

    @Bean
    @ConditionalOnMissingBean
    public LocalBroadcaster localBroadcaster(DeliveryStatistics deliveryStatistics) {
        return new DefaultLocalBroadcaster(deliveryStatistics);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnMissingBean
    public ConnectionManager connectionManager(RealtimeProperties realtimeProperties,
        LocalBroadcaster localBroadcaster, DeliveryStatistics deliveryStatistics) {
        return new DefaultConnectionManager(realtimeProperties, localBroadcaster, deliveryStatistics);
    }

    @Bean
    @ConditionalOnMissingBean
    public RoleResolver roleResolver() {
        return new ClaimedRoleResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    public EmissionSequencer emissionSequencer() {
        return new EmissionSequencer();
    }

    @Bean
    @ConditionalOnMissingBean
    public PollingGateway pollingGateway(EventStore eventStore, EmissionSequencer emissionSequencer) {
        return new DefaultPollingGateway(eventStore, emissionSequencer);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnMissingBean
    public RealtimeEventService realtimeEventService(RateLimiter rateLimiter, EventStore eventStore,
        LocalBroadcaster localBroadcaster, CrossProcessRelay crossProcessRelay,
        ObjectProvider<ObjectMapper> objectMapper, EmissionSequencer emissionSequencer) {
        log.info("Creating realtime event service");
        return new RealtimeEventServiceImpl(rateLimiter, eventStore, localBroadcaster, crossProcessRelay,
            objectMapper.getIfAvailable(ObjectMapper::new), emissionSequencer, Clock.systemUTC());
    }

    /**
     * History, rate limits and relay shared through Redis
     */
    @Configuration
    @ConditionalOnClass(RedisConnectionFactory.class)
    @ConditionalOnProperty(prefix = "takltc.realtime.redis", name = "enabled", havingValue = "true",
        matchIfMissing = true)
    static class RedisBackedConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public LuaScriptService luaScriptService(LuaScriptProperties luaScriptProperties) {
            return new LuaScriptServiceImpl(luaScriptProperties);
        }

        @Bean(initMethod = "start", destroyMethod = "stop")
        @ConditionalOnMissingBean
        public RedisLoadBalancer realtimeRedisLoadBalancer(RealtimeProperties realtimeProperties,
            StringRedisTemplate stringRedisTemplate) {
            RealtimeProperties.LoadBalancer config = realtimeProperties.getLoadBalancer();
            if (config.getInstances().isEmpty()) {
                log.info("No Redis instances configured for load balancing, using the application connection");
                BackendInstance instance = new BackendInstance("redis-0", 1, true, stringRedisTemplate);
                return new RedisLoadBalancer(Collections.singletonList(instance), config.getErrorThreshold());
            }
            return new RedisInstanceFactory(config).createLoadBalancer();
        }

        @Bean(initMethod = "start", destroyMethod = "stop")
        @ConditionalOnMissingBean
        public RedisHealthChecker realtimeRedisHealthChecker(RealtimeProperties realtimeProperties,
            RedisLoadBalancer realtimeRedisLoadBalancer) {
            RealtimeProperties.LoadBalancer config = realtimeProperties.getLoadBalancer();
            return new RedisHealthChecker(realtimeRedisLoadBalancer.getInstances(), RedisHealthChecker.PING_PROBE,
                config.getHealthCheckInterval(), config.getProbeTimeout(), config.getErrorThreshold());
        }

        @Bean
        @ConditionalOnMissingBean
        public RedisMessageListenerContainer redisMessageListenerContainer(RedisConnectionFactory connectionFactory) {
            RedisMessageListenerContainer container = new RedisMessageListenerContainer();
            container.setConnectionFactory(connectionFactory);
            return container;
        }

        @Bean
        @ConditionalOnMissingBean
        public EventStore eventStore(RealtimeProperties realtimeProperties,
            RedisLoadBalancer realtimeRedisLoadBalancer, LuaScriptService luaScriptService,
            ObjectProvider<ObjectMapper> objectMapper) {
            EventStore redisStore = new RedisEventStore(realtimeProperties, realtimeRedisLoadBalancer,
                luaScriptService, objectMapper.getIfAvailable(ObjectMapper::new));
            if (!realtimeProperties.getEventStore().isLocalFallbackEnabled()) {
                return redisStore;
            }
            RealtimeProperties.EventStore config = realtimeProperties.getEventStore();
            return new FallbackEventStore(redisStore,
                new InMemoryEventStore(config.getMaxEvents(), config.getMaxAge(), Clock.systemUTC()));
        }

        @Bean
        @ConditionalOnMissingBean
        public RateLimiter rateLimiter(RealtimeProperties realtimeProperties,
            RedisLoadBalancer realtimeRedisLoadBalancer, LuaScriptService luaScriptService) {
            return new RedisRateLimiter(realtimeProperties, realtimeRedisLoadBalancer, luaScriptService);
        }

        @Bean(initMethod = "start", destroyMethod = "stop")
        @ConditionalOnMissingBean
        public CrossProcessRelay crossProcessRelay(RealtimeProperties realtimeProperties,
            StringRedisTemplate stringRedisTemplate, RedisMessageListenerContainer redisMessageListenerContainer,
            ObjectProvider<ObjectMapper> objectMapper, @Qualifier("realtimeInstanceId") String realtimeInstanceId) {
            if (!realtimeProperties.getRelay().isEnabled()) {
                log.info("Cross-process relay disabled, events are delivered on this instance only");
                return new LocalOnlyRelay(realtimeInstanceId);
            }
            return new RedisCrossProcessRelay(realtimeProperties, stringRedisTemplate, redisMessageListenerContainer,
                objectMapper.getIfAvailable(ObjectMapper::new), realtimeInstanceId);
        }
    }

    /**
     * Single node mode without Redis
     */
    @Configuration
    @ConditionalOnProperty(prefix = "takltc.realtime.redis", name = "enabled", havingValue = "false")
    static class InMemoryConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public EventStore eventStore(RealtimeProperties realtimeProperties) {
            log.info("Redis disabled, realtime delivery runs in memory on a single node");
            RealtimeProperties.EventStore config = realtimeProperties.getEventStore();
            return new InMemoryEventStore(config.getMaxEvents(), config.getMaxAge(), Clock.systemUTC());
        }

        @Bean
        @ConditionalOnMissingBean
        public RateLimiter rateLimiter(RealtimeProperties realtimeProperties) {
            return new InMemoryRateLimiter(realtimeProperties);
        }

        @Bean(initMethod = "start", destroyMethod = "stop")
        @ConditionalOnMissingBean
        public CrossProcessRelay crossProcessRelay(@Qualifier("realtimeInstanceId") String realtimeInstanceId) {
            return new LocalOnlyRelay(realtimeInstanceId);
        }
    }

    /**
     * HTTP endpoints
     */
    @Configuration
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnProperty(prefix = "takltc.realtime.web", name = "enabled", havingValue = "true",
        matchIfMissing = true)
    static class WebConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public RealtimeStreamController realtimeStreamController(ConnectionManager connectionManager,
            RoleResolver roleResolver, CrossProcessRelay crossProcessRelay,
            ObjectProvider<RedisLoadBalancer> realtimeRedisLoadBalancer, RateLimiter rateLimiter,
            RealtimeProperties realtimeProperties, @Qualifier("realtimeInstanceId") String realtimeInstanceId) {
            return new RealtimeStreamController(connectionManager, roleResolver, crossProcessRelay,
                realtimeRedisLoadBalancer.getIfAvailable(), rateLimiter, realtimeProperties, realtimeInstanceId);
        }

        @Bean
        @ConditionalOnMissingBean
        public RealtimePollingController realtimePollingController(PollingGateway pollingGateway,
            RoleResolver roleResolver, RateLimiter rateLimiter, RealtimeProperties realtimeProperties) {
            return new RealtimePollingController(pollingGateway, roleResolver, rateLimiter, realtimeProperties);
        }

        @Bean
        @ConditionalOnMissingBean
        public RealtimeEventController realtimeEventController(RealtimeEventService realtimeEventService) {
            return new RealtimeEventController(realtimeEventService);
        }

        @Bean
        @ConditionalOnMissingBean
        public RealtimeExceptionHandler realtimeExceptionHandler() {
            return new RealtimeExceptionHandler();
        }
    }
}
