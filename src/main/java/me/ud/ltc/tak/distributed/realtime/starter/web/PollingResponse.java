package me.ud.ltc.tak.distributed.realtime.starter.web;

import java.util.ArrayList;
import java.util.List;

import me.ud.ltc.tak.distributed.realtime.starter.model.Event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Polling endpoint response
 *
 * @author takltc
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PollingResponse {

    private String userId;

    /**
     * Server time of the poll
     */
    private long timestamp;

    private Long since;

    /**
     * Cursor for the next poll: timestamp of the last event returned, or the request cursor when none
     */
    private long cursor;

    @Builder.Default
    private List<Event> events = new ArrayList<>();

    /**
     * Whether more events are waiting after the cursor; poll again right away
     */
    private boolean hasMore;

    /**
     * Limit applied to this poll
     */
    private int limit;

    /**
     * Server time at which the next poll is recommended
     */
    private long nextPollRecommended;
}
