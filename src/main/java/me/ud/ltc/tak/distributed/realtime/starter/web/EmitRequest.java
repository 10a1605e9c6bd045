package me.ud.ltc.tak.distributed.realtime.starter.web;

import com.fasterxml.jackson.databind.JsonNode;

import me.ud.ltc.tak.distributed.realtime.starter.model.EventTargets;

import lombok.Data;

/**
 * Event emission request
 *
 * @author takltc
 */
@Data
public class EmitRequest {

    private String type;

    private JsonNode data;

    private EventTargets targets;

    /**
     * high, normal or low; normal when absent
     */
    private String priority;
}
