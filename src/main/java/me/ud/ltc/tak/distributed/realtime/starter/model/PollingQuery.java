package me.ud.ltc.tak.distributed.realtime.starter.model;

import java.util.Collection;
import java.util.Set;

import lombok.Builder;
import lombok.Value;

/**
 * One poll of the event history
 *
 * @author takltc
 */
@Value
@Builder
public class PollingQuery {

    String userId;

    Collection<String> roles;

    /**
     * Cursor, null for the whole history
     */
    Long since;

    /**
     * Event types to keep, null or empty for all
     */
    Set<String> types;

    /**
     * Maximum number of events returned, 0 for no limit
     */
    int limit;

    /**
     * Events older than this many milliseconds are skipped, 0 keeps them
     */
    long maxAge;
}
