package me.ud.ltc.tak.distributed.realtime.starter.web;

import java.util.List;
import java.util.Set;

import javax.servlet.http.HttpServletRequest;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import me.ud.ltc.tak.distributed.realtime.starter.balancer.RedisLoadBalancer;
import me.ud.ltc.tak.distributed.realtime.starter.config.RealtimeProperties;
import me.ud.ltc.tak.distributed.realtime.starter.connection.ClientConnection;
import me.ud.ltc.tak.distributed.realtime.starter.connection.SseEmitterEventSink;
import me.ud.ltc.tak.distributed.realtime.starter.exception.RequestRateLimitExceededException;
import me.ud.ltc.tak.distributed.realtime.starter.service.ConnectionManager;
import me.ud.ltc.tak.distributed.realtime.starter.service.CrossProcessRelay;
import me.ud.ltc.tak.distributed.realtime.starter.service.RateLimiter;
import me.ud.ltc.tak.distributed.realtime.starter.service.RoleResolver;

import lombok.extern.slf4j.Slf4j;

/**
 * SSE push endpoint and instance statistics
 *
 * @author takltc
 */
@Slf4j
@RestController
@RequestMapping("/api/realtime")
public class RealtimeStreamController {

    static final String CONNECT_USER_SCOPE = "connect-user";
    static final String CONNECT_IP_SCOPE = "connect-ip";

    private final ConnectionManager connectionManager;
    private final RoleResolver roleResolver;
    private final CrossProcessRelay relay;
    private final RedisLoadBalancer loadBalancer;
    private final RateLimiter rateLimiter;
    private final RealtimeProperties properties;
    private final String instanceId;

    /**
     * @param loadBalancer Load balancer, null in single node mode
     */
    public RealtimeStreamController(ConnectionManager connectionManager, RoleResolver roleResolver,
        CrossProcessRelay relay, RedisLoadBalancer loadBalancer, RateLimiter rateLimiter, RealtimeProperties properties,
        String instanceId) {
        this.connectionManager = connectionManager;
        this.roleResolver = roleResolver;
        this.relay = relay;
        this.loadBalancer = loadBalancer;
        this.rateLimiter = rateLimiter;
        this.properties = properties;
        this.instanceId = instanceId;
    }

    @GetMapping("/stream")
    public SseEmitter stream(@RequestParam String userId, @RequestParam(required = false) List<String> roles,
        HttpServletRequest request) {
        RealtimeProperties.RateLimit limits = properties.getRateLimit();
        if (!rateLimiter.tryAcquire(CONNECT_USER_SCOPE, userId, limits.getConnectionsPerUser())) {
            throw new RequestRateLimitExceededException(CONNECT_USER_SCOPE, userId);
        }
        String address = request.getRemoteAddr();
        if (address != null && !rateLimiter.tryAcquire(CONNECT_IP_SCOPE, address, limits.getConnectionsPerIp())) {
            throw new RequestRateLimitExceededException(CONNECT_IP_SCOPE, address);
        }

        Set<String> resolvedRoles = roleResolver.resolveRoles(userId, roles);
        SseEmitter emitter = new SseEmitter(properties.getConnection().getTimeout());
        ClientConnection connection =
            connectionManager.open(userId, resolvedRoles, new SseEmitterEventSink(emitter));
        log.debug("SSE stream {} opened for user {} with roles {}", connection.getConnectionId(), userId,
            resolvedRoles);
        return emitter;
    }

    @GetMapping("/stats")
    public StatsResponse stats() {
        return StatsResponse.builder().instanceId(instanceId).connections(connectionManager.getMetrics())
            .loadBalancer(loadBalancer != null ? loadBalancer.getStats() : null).relayLocalOnly(relay.isLocalOnly())
            .activeInstances(relay.getActiveInstances()).timestamp(System.currentTimeMillis()).build();
    }
}
