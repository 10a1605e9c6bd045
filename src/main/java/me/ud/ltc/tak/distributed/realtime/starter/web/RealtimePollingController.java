package me.ud.ltc.tak.distributed.realtime.starter.web;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import me.ud.ltc.tak.distributed.realtime.starter.config.RealtimeProperties;
import me.ud.ltc.tak.distributed.realtime.starter.exception.RequestRateLimitExceededException;
import me.ud.ltc.tak.distributed.realtime.starter.model.PollingBatch;
import me.ud.ltc.tak.distributed.realtime.starter.model.PollingQuery;
import me.ud.ltc.tak.distributed.realtime.starter.service.PollingGateway;
import me.ud.ltc.tak.distributed.realtime.starter.service.RateLimiter;
import me.ud.ltc.tak.distributed.realtime.starter.service.RoleResolver;

/**
 * Polling endpoint for clients without a push connection
 *
 * @author takltc
 */
@RestController
@RequestMapping("/api/realtime")
public class RealtimePollingController {

    static final String POLLING_SCOPE = "polling";

    private final PollingGateway pollingGateway;
    private final RoleResolver roleResolver;
    private final RateLimiter rateLimiter;
    private final RealtimeProperties properties;

    public RealtimePollingController(PollingGateway pollingGateway, RoleResolver roleResolver,
        RateLimiter rateLimiter, RealtimeProperties properties) {
        this.pollingGateway = pollingGateway;
        this.roleResolver = roleResolver;
        this.rateLimiter = rateLimiter;
        this.properties = properties;
    }

    /**
     * Events after the cursor, oldest first. {@code limit} is clamped to 1..max-limit; events older than the
     * polling max-age are skipped unless {@code includeExpired} is set.
     */
    @GetMapping("/polling")
    public PollingResponse poll(@RequestParam String userId, @RequestParam(required = false) List<String> roles,
        @RequestParam(required = false) Long since, @RequestParam(required = false) List<String> types,
        @RequestParam(required = false) Integer limit, @RequestParam(defaultValue = "false") boolean includeExpired) {
        if (!rateLimiter.tryAcquire(POLLING_SCOPE, userId, properties.getRateLimit().getPollingRequests())) {
            throw new RequestRateLimitExceededException(POLLING_SCOPE, userId);
        }

        RealtimeProperties.Polling config = properties.getPolling();
        int effectiveLimit = Math.min(config.getMaxLimit(),
            Math.max(1, limit != null ? limit : config.getDefaultLimit()));
        Set<String> typeFilter = types == null ? null : new LinkedHashSet<>(types);
        PollingBatch batch = pollingGateway.poll(PollingQuery.builder().userId(userId)
            .roles(roleResolver.resolveRoles(userId, roles)).since(since).types(typeFilter).limit(effectiveLimit)
            .maxAge(includeExpired ? 0L : config.getMaxAge()).build());

        long now = System.currentTimeMillis();
        return PollingResponse.builder().userId(userId).timestamp(now).since(since).cursor(batch.getCursor())
            .events(batch.getEvents()).hasMore(batch.isHasMore()).limit(effectiveLimit)
            .nextPollRecommended(batch.isHasMore() ? now : now + config.getRecommendedInterval()).build();
    }
}
