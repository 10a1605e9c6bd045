package me.ud.ltc.tak.distributed.realtime.starter.service;

import java.util.Collection;

import me.ud.ltc.tak.distributed.realtime.starter.model.Priority;

/**
 * Fixed window admission control per user and per event type, plus request counters for the HTTP endpoints
 *
 * @author takltc
 */
public interface RateLimiter {

    /**
     * Decide whether an emission may proceed. HIGH priority is always admitted; otherwise the emission is
     * admitted only if every target user and the event type are below their limits, in which case all of the
     * counters are incremented.
     *
     * @param eventType Event type
     * @param userIds Target users, may be empty
     * @param priority Priority
     * @return Whether the emission is admitted
     */
    boolean tryAdmit(String eventType, Collection<String> userIds, Priority priority);

    /**
     * Count one request against a single counter, such as the polls of one user or the connection attempts from
     * one address. Admitted when rate limiting is disabled or the limit is not positive.
     *
     * @param scope What is counted, e.g. {@code polling}
     * @param key Who is counted, e.g. a user ID
     * @param max Requests allowed per window
     * @return Whether the request is admitted
     */
    boolean tryAcquire(String scope, String key, int max);
}
