package me.ud.ltc.tak.distributed.realtime.starter.model;

import lombok.Getter;

/**
 * Known event types emitted by the application
 *
 * @author takltc
 */
@Getter
public enum RealtimeEventType {

    NOTIFICATION("notification"),

    DASHBOARD_UPDATE("dashboardUpdate"),

    REPORT_UPDATE("report-update");

    private final String value;

    RealtimeEventType(String value) {
        this.value = value;
    }
}
