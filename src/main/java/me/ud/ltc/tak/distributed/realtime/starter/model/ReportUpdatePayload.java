package me.ud.ltc.tak.distributed.realtime.starter.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Status change of a financial report
 *
 * @author takltc
 */
@Value
@Builder
@Jacksonized
public class ReportUpdatePayload implements EventPayload {

    String reportId;

    String branchId;

    String status;

    String previousStatus;

    String updatedBy;

    long timestamp;

    @Override
    public RealtimeEventType getEventType() {
        return RealtimeEventType.REPORT_UPDATE;
    }
}
