package me.ud.ltc.tak.distributed.realtime.starter.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire format of an event published on the cross-process channel, tagged with the publishing instance
 *
 * @author takltc
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RelayEnvelope {

    /**
     * Instance ID of the publisher
     */
    private String source;

    private Event event;
}
