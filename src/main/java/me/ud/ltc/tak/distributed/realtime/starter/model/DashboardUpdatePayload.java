package me.ud.ltc.tak.distributed.realtime.starter.model;

import java.util.Map;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Dashboard data refresh
 *
 * @author takltc
 */
@Value
@Builder
@Jacksonized
public class DashboardUpdatePayload implements EventPayload {

    String id;

    /**
     * Kind of dashboard update, e.g. metrics, chart
     */
    String updateType;

    Map<String, Object> data;

    String title;

    String message;

    long timestamp;

    @Override
    public RealtimeEventType getEventType() {
        return RealtimeEventType.DASHBOARD_UPDATE;
    }
}
