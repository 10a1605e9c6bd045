package me.ud.ltc.tak.distributed.realtime.starter.model;

import java.util.List;

import lombok.Value;

/**
 * Events returned by a poll, oldest first
 *
 * @author takltc
 */
@Value
public class PollingBatch {

    List<Event> events;

    /**
     * Whether the limit cut off further events after the last one returned
     */
    boolean hasMore;

    /**
     * Cursor for the next poll: timestamp of the last event returned, or the request cursor (0 when absent)
     */
    long cursor;
}
